// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.scan;

import io.pfive.logtail.guard.AccessGuard;
import io.pfive.logtail.model.Source;
import io.pfive.logtail.registry.SourceRegistry;
import io.pfive.logtail.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/// Keeps the registry's file-level sources in step with the contents of each directory source.
///
/// A scan lists the directory, validates each match against the AccessGuard and registers the new
/// ones, then retires the sources it registered earlier that no longer match. Registering an
/// existing source ID is a no-op and IDs are stable, so scanning an unchanged directory changes
/// nothing and leaves running tailers alone. If a listing fails the directory's current sources
/// are kept: a network blip must not look like every file was deleted.
public class DirectoryScanner {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final SourceRegistry registry;
    private final FileLister localLister;
    private final FileLister remoteLister;
    private final List<DirectorySpec> directories = new CopyOnWriteArrayList<>();
    /// Paths already reported as refused, so each is only logged once.
    private final Set<String> refusedPaths = ConcurrentHashMap.newKeySet();

    public DirectoryScanner (SourceRegistry registry, FileLister localLister, FileLister remoteLister) {
        this.registry = registry;
        this.localLister = localLister;
        this.remoteLister = remoteLister;
    }

    public void addDirectory (DirectorySpec directory) {
        directories.add(directory);
    }

    public List<DirectorySpec> directories () {
        return List.copyOf(directories);
    }

    public void scanOnce () {
        for (DirectorySpec directory : directories) {
            scan(directory);
        }
    }

    /// Reconcile one directory with the registry.
    /// @return false if it could not be listed.
    public boolean scan (DirectorySpec directory) {
        List<String> paths;
        try {
            paths = (directory.isRemote() ? remoteLister : localLister).list(directory);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not list {} ({}), keeping its current sources: {}", directory.name(), directory.root(), e.toString());
            return false;
        }
        Map<String, Source> found = new LinkedHashMap<>();
        for (String path : paths) {
            Source source = toSource(directory, path);
            if (source != null) found.put(source.id, source);
        }
        int added = 0;
        for (Source source : found.values()) {
            if (registry.register(source)) added += 1;
        }
        Set<String> gone = new HashSet<>(registry.idsByOrigin(directory.id()));
        gone.removeAll(found.keySet());
        for (String sourceId : gone) {
            registry.retire(sourceId);
        }
        if (added > 0 || !gone.isEmpty()) {
            LOG.info("Scan of {} added {} and removed {} sources.", directory.name(), added, gone.size());
        }
        return true;
    }

    private Source toSource (DirectorySpec directory, String path) {
        String name = directory.name() + "/" + relativeName(directory.root(), path);
        if (directory.isRemote()) {
            Ret<String> validated = AccessGuard.validatePath(path, directory.allowedPaths());
            if (validated.isErr()) {
                refused(path, validated.errorMessage());
                return null;
            }
            return Source.remote(name, directory.host(), validated.get(), directory.encoding(), directory.alwaysOn(), directory.id());
        }
        Ret<Path> validated = AccessGuard.validateLocalPath(Path.of(path), directory.allowedPaths());
        if (validated.isErr()) {
            refused(path, validated.errorMessage());
            return null;
        }
        return Source.local(name, validated.get(), directory.encoding(), directory.alwaysOn(), directory.id());
    }

    private void refused (String path, String reason) {
        if (refusedPaths.add(path)) {
            LOG.warn("Refusing discovered file {}: {}", path, reason);
        }
    }

    private static String relativeName (String root, String path) {
        String prefix = root.endsWith("/") ? root : root + "/";
        return path.startsWith(prefix) ? path.substring(prefix.length()) : path;
    }

    public ScheduledFuture<?> start (ScheduledExecutorService scheduler, Duration interval) {
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                scanOnce();
            } catch (RuntimeException e) {
                LOG.error("Directory scan failed.", e);
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

}
