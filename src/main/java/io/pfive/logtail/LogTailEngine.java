// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.pfive.logtail.config.Configuration;
import io.pfive.logtail.config.SourcesConfig;
import io.pfive.logtail.hub.StreamHub;
import io.pfive.logtail.model.Source;
import io.pfive.logtail.registry.RejectedSource;
import io.pfive.logtail.registry.SourceLoader;
import io.pfive.logtail.registry.SourceRegistry;
import io.pfive.logtail.remote.JschConnector;
import io.pfive.logtail.remote.RemoteSessionPool;
import io.pfive.logtail.remote.SshConnector;
import io.pfive.logtail.scan.DirectoryScanner;
import io.pfive.logtail.scan.DirectorySpec;
import io.pfive.logtail.scan.LocalFileLister;
import io.pfive.logtail.scan.RemoteFileLister;
import io.pfive.logtail.tail.DefaultTailerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/// All process-wide state of the tailing engine, created once at startup and passed to whatever
/// needs it. Owns the session pool, hub, registry and scanner along with the threads they run on,
/// and tears them down in the opposite order to construction.
public class LogTailEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public final Configuration config;
    public final RemoteSessionPool pool;
    public final StreamHub hub;
    public final SourceRegistry registry;
    public final DirectoryScanner scanner;

    /// One thread per running tailer and one per connected subscriber, so both pools are unbounded;
    /// their sizes are limited by the number of sources and viewers.
    private final ExecutorService tailerExecutor;
    public final ExecutorService deliveryExecutor;
    private final ScheduledExecutorService scheduler;

    public LogTailEngine (Configuration config, SshConnector connector, Clock clock) {
        this.config = config;
        this.tailerExecutor = Executors.newCachedThreadPool(daemonThreads("tailer-%d"));
        this.deliveryExecutor = Executors.newCachedThreadPool(daemonThreads("delivery-%d"));
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("maintenance-%d"));
        this.pool = new RemoteSessionPool(connector, config.poolSettings(), clock);
        this.hub = new StreamHub(config.subscriberQueueCapacity, config.recentLines, clock);
        this.registry = new SourceRegistry(hub, new DefaultTailerFactory(config.tailSettings(), pool, clock), tailerExecutor);
        this.scanner = new DirectoryScanner(registry, new LocalFileLister(), new RemoteFileLister(pool));
    }

    /// Engine using the JSch transport and the system clock.
    public static LogTailEngine create (Configuration config) {
        return new LogTailEngine(config, new JschConnector(config.sshConnectTimeoutMs), Clock.systemUTC());
    }

    /// Register the configured sources and directories and begin periodic maintenance. Always-on
    /// sources start tailing immediately, all others on their first subscriber.
    public void start (SourcesConfig sources) {
        SourceLoader.Loaded loaded = SourceLoader.load(sources);
        for (RejectedSource rejected : loaded.rejected()) {
            registry.registerRejected(rejected);
        }
        for (Source source : loaded.sources()) {
            registry.register(source);
        }
        for (DirectorySpec directory : loaded.directories()) {
            scanner.addDirectory(directory);
        }
        pool.startSweeper(scheduler, config.poolSweepInterval);
        scanner.start(scheduler, config.rescanInterval);
        LOG.info("Engine started with {} sources and {} directories.", loaded.sources().size(), loaded.directories().size());
    }

    @Override
    public void close () {
        LOG.info("Shutting down engine.");
        scheduler.shutdownNow();
        registry.close();
        hub.close();
        pool.close();
        tailerExecutor.shutdownNow();
        deliveryExecutor.shutdownNow();
        try {
            if (!tailerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Some tailers did not stop within 5 seconds.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads (String nameFormat) {
        return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
    }

}
