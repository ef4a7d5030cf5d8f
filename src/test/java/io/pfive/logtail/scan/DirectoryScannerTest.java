// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.scan;

import io.pfive.logtail.hub.StreamHub;
import io.pfive.logtail.model.Credential;
import io.pfive.logtail.model.HostKeyPolicy;
import io.pfive.logtail.model.RemoteHost;
import io.pfive.logtail.model.Source;
import io.pfive.logtail.registry.SourceRegistry;
import io.pfive.logtail.remote.FakeSshConnector;
import io.pfive.logtail.remote.RemoteSessionPool;
import io.pfive.logtail.tail.StubTailerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryScannerTest {

    @TempDir
    Path tempDir;
    private Path dir;

    private final StreamHub hub = new StreamHub(100, 0, Clock.systemUTC());
    private final StubTailerFactory tailers = new StubTailerFactory();
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final SourceRegistry registry = new SourceRegistry(hub, tailers, executor);

    @BeforeEach
    void realDirectory () throws IOException {
        dir = tempDir.toRealPath();
    }

    @AfterEach
    void shutdown () {
        registry.close();
        executor.shutdownNow();
    }

    private DirectorySpec localSpec (String pattern, boolean recursive) {
        return DirectorySpec.of("logs", dir.toString(), pattern, recursive, StandardCharsets.UTF_8, null,
            List.of(dir.toString()), true);
    }

    private Set<String> registeredPaths () {
        return registry.sources().stream().map(s -> s.source().path).collect(Collectors.toSet());
    }

    @Test
    void newFilesAreAddedWithoutRestartingExistingTailers () throws Exception {
        Files.writeString(dir.resolve("a.log"), "a\n");
        Files.writeString(dir.resolve("notes.txt"), "not a log\n");
        DirectoryScanner scanner = new DirectoryScanner(registry, new LocalFileLister(), null);
        DirectorySpec spec = localSpec("*.log", false);
        scanner.addDirectory(spec);

        scanner.scanOnce();
        assertEquals(Set.of(dir.resolve("a.log").toString()), registeredPaths());
        String aId = registry.sources().get(0).source().id;

        Files.writeString(dir.resolve("b.log"), "b\n");
        scanner.scanOnce();
        assertEquals(Set.of(dir.resolve("a.log").toString(), dir.resolve("b.log").toString()), registeredPaths());
        assertEquals(1, tailers.createdFor(aId));

        scanner.scanOnce();
        assertEquals(2, registry.sources().size());
        assertEquals(2, tailers.created().size());
    }

    @Test
    void discoveredSourcesAreNamedAfterTheirDirectory () throws Exception {
        Files.writeString(dir.resolve("a.log"), "a\n");
        DirectoryScanner scanner = new DirectoryScanner(registry, new LocalFileLister(), null);
        DirectorySpec spec = localSpec("*.log", false);
        assertTrue(scanner.scan(spec));
        Source source = registry.sources().get(0).source();
        assertEquals("logs/a.log", source.name);
        assertEquals(spec.id(), source.origin);
    }

    @Test
    void removedFilesAreRetired () throws Exception {
        Files.writeString(dir.resolve("a.log"), "a\n");
        Files.writeString(dir.resolve("b.log"), "b\n");
        DirectoryScanner scanner = new DirectoryScanner(registry, new LocalFileLister(), null);
        DirectorySpec spec = localSpec("*.log", false);
        scanner.scan(spec);
        assertEquals(2, registry.sources().size());

        Files.delete(dir.resolve("a.log"));
        scanner.scan(spec);
        assertEquals(Set.of(dir.resolve("b.log").toString()), registeredPaths());
    }

    @Test
    void recursiveScanDescendsIntoSubdirectories () throws Exception {
        Files.createDirectories(dir.resolve("nested/deeper"));
        Files.writeString(dir.resolve("top.log"), "x\n");
        Files.writeString(dir.resolve("nested/deeper/inner.log"), "x\n");
        DirectoryScanner scanner = new DirectoryScanner(registry, new LocalFileLister(), null);

        scanner.scan(localSpec("*.log", false));
        assertEquals(Set.of(dir.resolve("top.log").toString()), registeredPaths());

        scanner.scan(localSpec("*.log", true));
        assertTrue(registeredPaths().contains(dir.resolve("nested/deeper/inner.log").toString()));
    }

    @Test
    void symlinkLeadingOutsideTheWhitelistIsSkipped () throws Exception {
        Path outside = Files.createTempFile("outside", ".log");
        try {
            Files.createSymbolicLink(dir.resolve("escape.log"), outside);
            Files.writeString(dir.resolve("inside.log"), "x\n");
            DirectoryScanner scanner = new DirectoryScanner(registry, new LocalFileLister(), null);
            scanner.scan(localSpec("*.log", false));
            assertEquals(Set.of(dir.resolve("inside.log").toString()), registeredPaths());
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void failedListingKeepsCurrentSources () throws Exception {
        Files.writeString(dir.resolve("a.log"), "a\n");
        AtomicBoolean failing = new AtomicBoolean(false);
        LocalFileLister real = new LocalFileLister();
        FileLister flaky = directory -> {
            if (failing.get()) throw new IOException("NFS server not responding");
            return real.list(directory);
        };
        DirectoryScanner scanner = new DirectoryScanner(registry, flaky, null);
        DirectorySpec spec = localSpec("*.log", false);
        assertTrue(scanner.scan(spec));

        failing.set(true);
        assertFalse(scanner.scan(spec));
        assertEquals(1, registry.sources().size());
    }

    @Test
    void remoteDirectoryIsListedWithFind () {
        FakeSshConnector connector = new FakeSshConnector();
        connector.file("/var/log/app/a.log").append("a\n");
        connector.file("/var/log/app/b.txt").append("b\n");
        connector.file("/var/log/app/archive/old.log").append("c\n");
        RemoteHost host = new RemoteHost("web-1", "web-1.example.com", 22, "reader", Credential.password("pw"),
            HostKeyPolicy.AUTO_ACCEPT, null, List.of("/var/log"), RemoteHost.DEFAULT_MAX_FILE_SIZE);
        try (RemoteSessionPool pool = new RemoteSessionPool(connector, new RemoteSessionPool.Settings(2,
            Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofSeconds(1)), Clock.systemUTC())) {
            DirectoryScanner scanner = new DirectoryScanner(registry, new LocalFileLister(), new RemoteFileLister(pool));
            DirectorySpec spec = DirectorySpec.of("app", "/var/log/app", "*.log", false, StandardCharsets.UTF_8,
                host, host.allowedPaths, false);

            assertTrue(scanner.scan(spec));
            assertEquals(Set.of("/var/log/app/a.log"), registeredPaths());
            assertTrue(registry.sources().get(0).source().isRemote());
            assertEquals(List.of("find", "/var/log/app", "-maxdepth", "1", "-type", "f", "-name", "*.log"),
                connector.connections().get(0).commands().get(0));
            assertEquals(1, pool.idleCount(host));

            connector.refuseConnections = true;
            connector.dropConnections();
            assertFalse(scanner.scan(spec));
            assertEquals(1, registry.sources().size());
        }
    }
}
