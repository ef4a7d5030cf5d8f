// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.http.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.logtail.LogTailEngine;
import io.pfive.logtail.Main;
import io.pfive.logtail.config.Configuration;
import io.pfive.logtail.config.SourcesConfig;
import io.pfive.logtail.registry.RejectedSource;
import io.pfive.logtail.remote.FakeSshConnector;
import io.pfive.logtail.util.JettyUtil;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Properties;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

/// Serves the real handlers from an ephemeral port and talks to them over HTTP.
class EventSourceHandlerTest {

    @TempDir
    Path tempDir;

    private Path logFile;
    private LogTailEngine engine;
    private Server server;
    private final HttpClient client = HttpClient.newHttpClient();
    private String baseUrl;

    @BeforeEach
    void startServer () throws Exception {
        Path dir = tempDir.toRealPath();
        logFile = Files.writeString(dir.resolve("app.log"), "hello\n");

        Properties properties = new Properties();
        properties.setProperty("heartbeat-interval-ms", "100");
        properties.setProperty("local-poll-interval-ms", "20");
        Configuration config = new Configuration(properties);

        SourcesConfig sources = new SourcesConfig();
        sources.allowedPaths.add(dir.toString());
        SourcesConfig.LogFile app = new SourcesConfig.LogFile();
        app.name = "app";
        app.path = logFile.toString();
        sources.logFiles.add(app);
        SourcesConfig.LogFile shadow = new SourcesConfig.LogFile();
        shadow.name = "shadow";
        shadow.path = "/etc/shadow";
        sources.logFiles.add(shadow);

        engine = new LogTailEngine(config, new FakeSshConnector(), Clock.systemUTC());
        engine.start(sources);

        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        connector.setPort(0);
        server.addConnector(connector);
        server.setHandler(Main.createHandler(engine, config));
        server.start();
        baseUrl = "http://localhost:" + connector.getLocalPort();
    }

    @AfterEach
    void stopServer () throws Exception {
        server.stop();
        engine.close();
    }

    private String appId () {
        return engine.registry.sources().get(0).source().id;
    }

    private HttpResponse<String> get (String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).build(),
            HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<Stream<String>> stream (String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).build(),
            HttpResponse.BodyHandlers.ofLines());
    }

    /// Skip ahead to the next event of the given type and return its parsed data.
    private static JsonNode nextEvent (Iterator<String> lines, String eventType) throws IOException {
        while (lines.hasNext()) {
            if (lines.next().equals("event: " + eventType)) {
                String data = lines.next();
                assertTrue(data.startsWith("data: "), data);
                return JettyUtil.objectMapper.readTree(data.substring("data: ".length()));
            }
        }
        throw new AssertionError("Stream ended before a " + eventType + " event.");
    }

    @Test
    void eventsWithoutSourceIsABadRequest () throws Exception {
        HttpResponse<String> response = get("/events");
        assertEquals(400, response.statusCode());
        assertTrue(response.body().contains("source"));
    }

    @Test
    void unknownSourceIsNotFound () throws Exception {
        assertEquals(404, get("/events?source=no-such-source").statusCode());
    }

    @Test
    void sourceListShowsRegisteredAndRefusedSources () throws Exception {
        HttpResponse<String> response = get("/sources");
        assertEquals(200, response.statusCode());
        JsonNode body = JettyUtil.objectMapper.readTree(response.body());
        assertEquals(appId(), body.get("sources").get(0).get("id").asText());
        assertEquals("local-file", body.get("sources").get(0).get("kind").asText());
        assertEquals("path-denylisted", body.get("rejected").get(0).get("reason").asText());
    }

    @Test
    void streamDeliversBacklogThenNewLines () throws Exception {
        HttpResponse<Stream<String>> response = stream("/events?source=" + appId());
        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));
        try (Stream<String> body = response.body()) {
            assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
                Iterator<String> lines = body.iterator();
                JsonNode connect = nextEvent(lines, "connect");
                assertEquals(32, connect.get("subscriberId").asText().length());

                JsonNode first = nextEvent(lines, "line");
                assertEquals("hello", first.get("content").asText());
                assertEquals(appId(), first.get("sourceId").asText());

                Files.writeString(logFile, "world\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
                JsonNode second = nextEvent(lines, "line");
                assertEquals("world", second.get("content").asText());
                assertEquals(first.get("seq").asLong() + 1, second.get("seq").asLong());
            });
        }
    }

    @Test
    void idleStreamGetsHeartbeats () throws Exception {
        HttpResponse<Stream<String>> response = stream("/events?source=" + appId());
        try (Stream<String> body = response.body()) {
            assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
                Iterator<String> lines = body.iterator();
                while (!lines.next().equals(": ping")) {
                    // Skip the connect event and backlog.
                }
            });
        }
    }

    @Test
    void refusedSourceIsReportedOnTheStream () throws Exception {
        RejectedSource shadow = engine.registry.rejected().get(0);
        HttpResponse<Stream<String>> response = stream("/events?source=" + shadow.id());
        assertEquals(200, response.statusCode());
        try (Stream<String> body = response.body()) {
            assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
                JsonNode error = nextEvent(body.iterator(), "error");
                assertEquals("SecurityViolation", error.get("errorKind").asText());
                assertEquals(shadow.id(), error.get("sourceId").asText());
            });
        }
    }
}
