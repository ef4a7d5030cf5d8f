// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationTest {

    private static Configuration with (String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return new Configuration(properties);
    }

    @Test
    void defaultsApplyWithoutAnyFile (@TempDir Path dir) throws Exception {
        Configuration config = Configuration.load(dir.resolve("missing.properties"));
        assertEquals(8000, config.httpPort);
        assertEquals(10, config.poolMaxConnections);
        assertEquals(Duration.ofMinutes(5), config.poolIdleTimeout);
        assertEquals(Duration.ofMinutes(30), config.poolMaxAge);
        assertEquals(5000, config.subscriberQueueCapacity);
        assertEquals(0.2, config.reconnectJitter);
        assertTrue(config.stripAnsi);
        assertTrue(config.unknownKeys().isEmpty());
    }

    @Test
    void fileValuesOverrideDefaults (@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("conf.properties"),
            "pool-max-connections=3\nreconnect-base-ms = 250\nstrip-ansi=no\nbacklog-bytes=0\n");
        Configuration config = Configuration.load(file);
        assertEquals(3, config.poolMaxConnections);
        assertEquals(Duration.ofMillis(250), config.reconnectBase);
        assertFalse(config.stripAnsi);
        assertEquals(0, config.backlogBytes);
        assertEquals(3, config.poolSettings().maxConnections());
        assertEquals(250, config.tailSettings().reconnectBase().toMillis());
    }

    @Test
    void unknownKeysAreReported () {
        assertEquals(Set.of("pool-max-conections"), with("pool-max-conections", "4").unknownKeys());
    }

    @Test
    void badValuesNameTheirKey () {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> with("http-port", "eighty"));
        assertTrue(e.getMessage().contains("http-port"));
        assertThrows(IllegalArgumentException.class, () -> with("strip-ansi", "maybe"));
        assertThrows(IllegalArgumentException.class, () -> with("pool-idle-timeout-ms", "-1"));
    }
}
