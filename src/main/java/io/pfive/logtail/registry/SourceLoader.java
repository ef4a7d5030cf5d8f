// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.registry;

import io.pfive.logtail.config.SourcesConfig;
import io.pfive.logtail.guard.AccessGuard;
import io.pfive.logtail.guard.Violation;
import io.pfive.logtail.model.Credential;
import io.pfive.logtail.model.HostKeyPolicy;
import io.pfive.logtail.model.RemoteHost;
import io.pfive.logtail.model.Source;
import io.pfive.logtail.model.SourceKind;
import io.pfive.logtail.scan.DirectorySpec;
import io.pfive.logtail.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Turns the sources file into validated Sources and DirectorySpecs. Every path goes through the
/// AccessGuard here, before anything is opened. Refused entries are kept as RejectedSources and
/// logged once with their reason.
public abstract class SourceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public record Loaded (List<Source> sources, List<DirectorySpec> directories, List<RejectedSource> rejected) { }

    public static Loaded load (SourcesConfig config) {
        List<Source> sources = new ArrayList<>();
        List<DirectorySpec> directories = new ArrayList<>();
        List<RejectedSource> rejected = new ArrayList<>();
        List<String> localAllowed = localAllowedPaths(config);

        for (SourcesConfig.LogFile file : config.logFiles) {
            String name = nameOr(file.name, file.path);
            Ret<Path> validated = AccessGuard.validateLocalPath(Path.of(file.path), localAllowed);
            if (validated instanceof AccessGuard.Rejection<Path> rejection) {
                rejected.add(reject(name, SourceKind.LOCAL_FILE, null, file.path, rejection));
            } else {
                sources.add(Source.local(name, validated.get(), charset(file.encoding), file.alwaysOn, null));
            }
        }
        for (SourcesConfig.LogDirectory directory : config.logDirectories) {
            String name = nameOr(directory.name, directory.scanDir);
            Ret<Path> validated = AccessGuard.validateLocalPath(Path.of(directory.scanDir), localAllowed);
            if (validated instanceof AccessGuard.Rejection<Path> rejection) {
                rejected.add(reject(name, SourceKind.LOCAL_FILE, null, directory.scanDir, rejection));
            } else {
                directories.add(DirectorySpec.of(name, validated.get().toString(), directory.pattern,
                    directory.recursive, charset(directory.encoding), null, localAllowed, directory.alwaysOn));
            }
        }
        for (SourcesConfig.RemoteServer server : config.remoteServers) {
            RemoteHost host = remoteHost(server);
            for (SourcesConfig.RemoteLog log : server.logs) {
                String name = nameOr(log.name, host.name + ":" + log.path);
                Ret<String> validated = AccessGuard.validatePath(log.path, host.allowedPaths);
                if (validated instanceof AccessGuard.Rejection<String> rejection) {
                    rejected.add(reject(name, SourceKind.REMOTE_FILE, host, log.path, rejection));
                } else if ("directory".equals(log.type)) {
                    directories.add(DirectorySpec.of(name, validated.get(), log.pattern, log.recursive,
                        charset(log.encoding), host, host.allowedPaths, log.alwaysOn));
                } else {
                    sources.add(Source.remote(name, host, validated.get(), charset(log.encoding), log.alwaysOn, null));
                }
            }
        }
        LOG.info("Loaded {} sources and {} directories, refused {}.", sources.size(), directories.size(), rejected.size());
        return new Loaded(sources, directories, rejected);
    }

    /// The explicit whitelist if there is one, otherwise each configured path whitelists itself.
    static List<String> localAllowedPaths (SourcesConfig config) {
        if (!config.allowedPaths.isEmpty()) return List.copyOf(config.allowedPaths);
        List<String> allowed = new ArrayList<>();
        for (SourcesConfig.LogFile file : config.logFiles) {
            allowed.add(Path.of(file.path).toAbsolutePath().toString());
        }
        for (SourcesConfig.LogDirectory directory : config.logDirectories) {
            allowed.add(Path.of(directory.scanDir).toAbsolutePath().toString());
        }
        return allowed;
    }

    static RemoteHost remoteHost (SourcesConfig.RemoteServer server) {
        Credential.Method method = Credential.Method.fromString(server.authMethod);
        Credential credential = (method == Credential.Method.PASSWORD)
            ? Credential.password(server.password)
            : Credential.key(server.keyPath);
        return new RemoteHost(server.name, server.host, server.port, server.user, credential,
            HostKeyPolicy.fromString(server.hostKeyPolicy), server.knownHosts, server.allowedPaths, server.maxFileSize);
    }

    private static RejectedSource reject (String name, SourceKind kind, RemoteHost host, String path,
                                          AccessGuard.Rejection<?> rejection) {
        Violation violation = rejection.violation;
        LOG.warn("Refusing source '{}' {}{}: {}", name, host == null ? "" : host.key() + ":", path, rejection.message);
        String id = Source.deriveId(name, kind, host, path);
        return new RejectedSource(id, name, host == null ? null : host.key(), path, violation, rejection.message);
    }

    private static String nameOr (String name, String fallback) {
        return (name == null || name.isBlank()) ? fallback : name;
    }

    private static Charset charset (String encoding) {
        return (encoding == null || encoding.isBlank()) ? StandardCharsets.UTF_8 : Charset.forName(encoding);
    }

}
