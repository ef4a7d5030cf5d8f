// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.pfive.logtail.model.RemoteHost;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/// The sources file: which local files and directories to offer, and which remote hosts to reach
/// and what to tail on them. Field names match the YAML keys. Unknown keys are ignored so that a
/// file written for a newer version still loads.
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourcesConfig {

    /// Local whitelist. When empty, each configured file and scan directory whitelists itself.
    public List<String> allowedPaths = new ArrayList<>();
    public List<LogFile> logFiles = new ArrayList<>();
    public List<LogDirectory> logDirectories = new ArrayList<>();
    public List<RemoteServer> remoteServers = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LogFile {
        public String name;
        public String path;
        public String encoding;
        public boolean alwaysOn = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LogDirectory {
        public String name;
        public String scanDir;
        public String pattern = "*.log";
        public boolean recursive = false;
        public String encoding;
        public boolean alwaysOn = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RemoteServer {
        public String name;
        public String host;
        public int port = RemoteHost.DEFAULT_PORT;
        public String user;
        public String authMethod = "key";  // key | password
        public String keyPath;
        public String password;
        public String hostKeyPolicy = "verify";  // verify | auto-accept
        public String knownHosts;
        public List<String> allowedPaths = new ArrayList<>();
        public long maxFileSize = RemoteHost.DEFAULT_MAX_FILE_SIZE;
        public List<RemoteLog> logs = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RemoteLog {
        public String name;
        public String path;
        public String type = "file";  // file | directory
        public String pattern = "*.log";
        public boolean recursive = false;
        public String encoding;
        public boolean alwaysOn = false;
    }

    public static SourcesConfig load (Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        }
    }

    public static SourcesConfig parse (InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        JsonNode tree = mapper.readTree(in);
        SourcesConfig config = (tree == null || tree.isMissingNode() || tree.isNull())
            ? new SourcesConfig()  // Empty document.
            : mapper.treeToValue(tree, SourcesConfig.class);
        config.validate();
        return config;
    }

    /// Structural checks only. Whether the paths may be tailed is for the AccessGuard to decide.
    void validate () {
        if (allowedPaths == null) allowedPaths = new ArrayList<>();
        if (logFiles == null) logFiles = new ArrayList<>();
        if (logDirectories == null) logDirectories = new ArrayList<>();
        if (remoteServers == null) remoteServers = new ArrayList<>();
        for (LogFile file : logFiles) {
            checkArgument(file.path != null && !file.path.isBlank(), "Log file '%s' has no path.", file.name);
        }
        for (LogDirectory directory : logDirectories) {
            checkArgument(directory.scanDir != null && !directory.scanDir.isBlank(),
                "Log directory '%s' has no scanDir.", directory.name);
        }
        // Sessions are pooled per account, so one account can only have one set of credentials.
        Set<String> accounts = new HashSet<>();
        for (RemoteServer server : remoteServers) {
            checkArgument(server.host != null && !server.host.isBlank(), "Remote server '%s' has no host.", server.name);
            checkArgument(server.user != null && !server.user.isBlank(), "Remote server '%s' has no user.", server.host);
            checkArgument(server.allowedPaths != null && !server.allowedPaths.isEmpty(),
                "Remote server '%s' must list its allowedPaths.", server.host);
            checkArgument(isOneOf(server.authMethod, "key", "password"),
                "Remote server '%s' has authMethod '%s', expected key or password.", server.host, server.authMethod);
            checkArgument(isOneOf(server.hostKeyPolicy, "verify", "strict", "auto-accept", "auto_accept"),
                "Remote server '%s' has hostKeyPolicy '%s', expected verify or auto-accept.",
                server.host, server.hostKeyPolicy);
            String account = server.user + "@" + server.host + ":" + server.port;
            checkArgument(accounts.add(account),
                "Remote server %s is listed more than once; put all of its logs under one entry.", account);
            if (server.logs == null) server.logs = new ArrayList<>();
            for (RemoteLog log : server.logs) {
                checkArgument(log.path != null && !log.path.isBlank(), "Log '%s' on %s has no path.", log.name, server.host);
                checkArgument("file".equals(log.type) || "directory".equals(log.type),
                    "Log '%s' on %s has type '%s', expected file or directory.", log.name, server.host, log.type);
            }
        }
    }

    /// Blank values are allowed and take the default.
    private static boolean isOneOf (String value, String... allowed) {
        if (value == null || value.isBlank()) return true;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.asList(allowed).contains(normalized);
    }
}
