// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.config;

import io.pfive.logtail.remote.RemoteSessionPool;
import io.pfive.logtail.tail.TailSettings;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/// Engine tunables read from a properties file. Every key has a default, so a missing file or key
/// is fine, but a value that can't be parsed stops startup with a message naming the key.
/// Instances are immutable and passed to whatever needs them, which lets tests build their own.
public class Configuration {

    private static final Map<String, String> DEFAULTS = Map.ofEntries(
        Map.entry("http-port", "8000"),
        Map.entry("sources-file", "conf/sources.yaml"),
        Map.entry("pool-max-connections", "10"),
        Map.entry("pool-idle-timeout-ms", "300000"),
        Map.entry("pool-max-age-ms", "1800000"),
        Map.entry("pool-acquire-timeout-ms", "10000"),
        Map.entry("pool-sweep-interval-ms", "30000"),
        Map.entry("ssh-connect-timeout-ms", "10000"),
        Map.entry("reconnect-base-ms", "500"),
        Map.entry("reconnect-cap-ms", "30000"),
        Map.entry("reconnect-jitter", "0.2"),
        Map.entry("reconnect-max-attempts", "5"),
        Map.entry("subscriber-queue-capacity", "5000"),
        Map.entry("max-line-length", "16384"),
        Map.entry("backlog-bytes", "10240"),
        Map.entry("recent-lines", "200"),
        Map.entry("rescan-interval-ms", "10000"),
        Map.entry("local-poll-interval-ms", "2000"),
        Map.entry("heartbeat-interval-ms", "5000"),
        Map.entry("strip-ansi", "true")
    );

    private final Properties properties = new Properties();

    public final int httpPort;
    public final Path sourcesFile;
    public final int poolMaxConnections;
    public final Duration poolIdleTimeout;
    public final Duration poolMaxAge;
    public final Duration poolAcquireTimeout;
    public final Duration poolSweepInterval;
    public final int sshConnectTimeoutMs;
    public final Duration reconnectBase;
    public final Duration reconnectCap;
    public final double reconnectJitter;
    public final int reconnectMaxAttempts;
    public final int subscriberQueueCapacity;
    public final int maxLineLength;
    public final long backlogBytes;
    public final int recentLines;
    public final Duration rescanInterval;
    public final Duration localPollInterval;
    public final Duration heartbeatInterval;
    public final boolean stripAnsi;

    public Configuration (Properties overrides) {
        properties.putAll(DEFAULTS);
        properties.putAll(overrides);
        httpPort = intVal("http-port");
        sourcesFile = Path.of(stringVal("sources-file"));
        poolMaxConnections = intVal("pool-max-connections");
        poolIdleTimeout = millisVal("pool-idle-timeout-ms");
        poolMaxAge = millisVal("pool-max-age-ms");
        poolAcquireTimeout = millisVal("pool-acquire-timeout-ms");
        poolSweepInterval = millisVal("pool-sweep-interval-ms");
        sshConnectTimeoutMs = intVal("ssh-connect-timeout-ms");
        reconnectBase = millisVal("reconnect-base-ms");
        reconnectCap = millisVal("reconnect-cap-ms");
        reconnectJitter = doubleVal("reconnect-jitter");
        reconnectMaxAttempts = intVal("reconnect-max-attempts");
        subscriberQueueCapacity = intVal("subscriber-queue-capacity");
        maxLineLength = intVal("max-line-length");
        backlogBytes = longVal("backlog-bytes");
        recentLines = intVal("recent-lines");
        rescanInterval = millisVal("rescan-interval-ms");
        localPollInterval = millisVal("local-poll-interval-ms");
        heartbeatInterval = millisVal("heartbeat-interval-ms");
        stripAnsi = boolVal("strip-ansi");
    }

    /// All defaults.
    public Configuration () {
        this(new Properties());
    }

    /// Load from a properties file, falling back to defaults if the file does not exist.
    public static Configuration load (Path file) throws IOException {
        Properties properties = new Properties();
        if (Files.exists(file)) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        }
        return new Configuration(properties);
    }

    /// Keys present in the file that we don't recognize, most likely misspellings.
    public Set<String> unknownKeys () {
        Set<String> unknown = new TreeSet<>(properties.stringPropertyNames());
        unknown.removeAll(DEFAULTS.keySet());
        return unknown;
    }

    public RemoteSessionPool.Settings poolSettings () {
        return new RemoteSessionPool.Settings(poolMaxConnections, poolIdleTimeout, poolMaxAge, poolAcquireTimeout);
    }

    public TailSettings tailSettings () {
        return new TailSettings(maxLineLength, backlogBytes, stripAnsi, localPollInterval,
            reconnectBase, reconnectCap, reconnectJitter, reconnectMaxAttempts);
    }

    private String stringVal (String key) {
        String val = properties.getProperty(key);
        if (val == null) throw new IllegalStateException("Missing configuration key: " + key);
        return val.trim();
    }

    private int intVal (String key) {
        String val = stringVal(key);
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new IllegalArgumentException(message, e);
        }
    }

    private long longVal (String key) {
        String val = stringVal(key);
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new IllegalArgumentException(message, e);
        }
    }

    private double doubleVal (String key) {
        String val = stringVal(key);
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as a number.", val, key);
            throw new IllegalArgumentException(message, e);
        }
    }

    private Duration millisVal (String key) {
        long millis = longVal(key);
        if (millis < 0) {
            throw new IllegalArgumentException(String.format("Configuration key '%s' must not be negative.", key));
        }
        return Duration.ofMillis(millis);
    }

    private boolean boolVal (String key) {
        String val = stringVal(key);
        if (val.equalsIgnoreCase("true")) return true;
        if (val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false")) return false;
        if (val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new IllegalArgumentException(message);
    }

}
