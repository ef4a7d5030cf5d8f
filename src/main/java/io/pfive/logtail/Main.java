// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail;

import io.pfive.logtail.config.Configuration;
import io.pfive.logtail.config.SourcesConfig;
import io.pfive.logtail.http.handler.EventSourceHandler;
import io.pfive.logtail.http.handler.ExceptionHandler;
import io.pfive.logtail.http.handler.SourceListHandler;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.handler.ContextHandler;
import org.eclipse.jetty.server.handler.ContextHandlerCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.FileSystems;
import java.nio.file.Path;

/// This main method loads configuration, starts the tailing engine and a Jetty HTTP server that
/// exposes it. Static files and the viewer UI are served elsewhere. Note that each open event
/// stream holds one of the browser's limited per-host HTTP/1.1 connections.
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final String CONFIG_FILE = "conf/conf.properties";

    public static void main (String[] args) throws Exception {
        // Debugging configuration and deployment can be easier when we know the current directory.
        Path currentDir = FileSystems.getDefault().getPath("").toAbsolutePath();
        LOG.info("Current working directory is: {}", currentDir.toString());

        Path configFile = Path.of(args.length > 0 ? args[0] : CONFIG_FILE);
        Configuration config = Configuration.load(configFile);
        for (String key : config.unknownKeys()) {
            LOG.warn("Ignoring unknown configuration key '{}' in {}.", key, configFile);
        }
        SourcesConfig sources = SourcesConfig.load(config.sourcesFile);

        LogTailEngine engine = LogTailEngine.create(config);
        engine.start(sources);

        Server server = new Server(config.httpPort);
        server.setHandler(createHandler(engine, config));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.stop();
            } catch (Exception e) {
                LOG.warn("Error stopping HTTP server.", e);
            }
            engine.close();
        }, "shutdown"));

        server.start();
        LOG.info("Listening for HTTP on port {}.", config.httpPort);
        server.join();
    }

    /// All the HTTP endpoints, wrapped in an exception handler to turn exceptions into error
    /// responses. Separate from main so tests can serve the same handlers.
    public static Handler createHandler (LogTailEngine engine, Configuration config) {
        // Passing handlers in the constructor of the ContextHandlerCollection rather than adding
        // them later creates a non-dynamic (unmodifiable) collection.
        ContextHandlerCollection contexts = new ContextHandlerCollection(
            context(new EventSourceHandler(engine.registry, engine.hub, engine.deliveryExecutor,
                config.heartbeatInterval), "/events"),
            context(new SourceListHandler(engine.registry), "/sources")
        );
        return new ExceptionHandler(contexts);
    }

    /// Endpoints are addressed without a trailing slash, which a context would otherwise redirect.
    private static ContextHandler context (Handler handler, String path) {
        ContextHandler context = new ContextHandler(handler, path);
        context.setAllowNullPathInContext(true);
        return context;
    }

}
