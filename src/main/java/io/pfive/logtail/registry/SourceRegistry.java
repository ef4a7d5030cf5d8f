// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.registry;

import io.pfive.logtail.guard.SecurityViolationException;
import io.pfive.logtail.hub.StreamHub;
import io.pfive.logtail.hub.Subscription;
import io.pfive.logtail.model.ErrorEvent;
import io.pfive.logtail.model.ErrorKind;
import io.pfive.logtail.model.Source;
import io.pfive.logtail.tail.SourceTailer;
import io.pfive.logtail.tail.TailerFactory;
import io.pfive.logtail.tail.TailerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/// The process-wide table of sources, with the tailer and subscribers of each. All lifecycle
/// decisions about tailers are made here: a source has a running tailer exactly when it has at
/// least one subscriber or is configured always-on. Tailers start on the first subscription and
/// stop when the last subscriber leaves.
///
/// Every public method is synchronized on the registry, which is called concurrently from the
/// directory scanner, HTTP request threads and delivery loops noticing a dropped connection.
/// Nothing under this lock waits on I/O: stopping a tailer only signals it.
public class SourceRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final StreamHub hub;
    private final TailerFactory tailerFactory;
    private final ExecutorService tailerExecutor;

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, RejectedSource> rejected = new LinkedHashMap<>();
    private boolean closed = false;

    private static class Entry {
        final Source source;
        final Set<String> subscriberIds = new HashSet<>();
        /// Survives tailer restarts so seq keeps increasing for the lifetime of the entry.
        final AtomicLong seq = new AtomicLong();
        SourceTailer tailer;

        Entry (Source source) {
            this.source = source;
        }

        boolean tailing () {
            return tailer != null && tailer.isActive();
        }
    }

    /// Status of one source for listing.
    public record SourceStatus (Source source, boolean tailing, TailerState state, int subscribers) { }

    public SourceRegistry (StreamHub hub, TailerFactory tailerFactory, ExecutorService tailerExecutor) {
        this.hub = hub;
        this.tailerFactory = tailerFactory;
        this.tailerExecutor = tailerExecutor;
    }

    /// Add a source. Registering a source ID that is already present does nothing.
    /// @return true if the source was added.
    public synchronized boolean register (Source source) {
        if (closed || entries.containsKey(source.id)) return false;
        Entry entry = new Entry(source);
        entries.put(source.id, entry);
        rejected.remove(source.id);
        LOG.info("Registered source {} ({}{}).", source.id, source.host == null ? "" : source.host.key() + ":", source.path);
        if (source.alwaysOn) startTailer(entry);
        return true;
    }

    public synchronized void registerRejected (RejectedSource source) {
        if (!entries.containsKey(source.id())) {
            rejected.put(source.id(), source);
        }
    }

    /// Remove a source, stopping its tailer. Its subscribers are told the source went away and are
    /// unsubscribed, but remain connected for their other sources.
    public synchronized boolean retire (String sourceId) {
        Entry entry = entries.remove(sourceId);
        if (entry == null) return false;
        stopTailer(entry);
        hub.reportError(new ErrorEvent(sourceId, ErrorKind.SOURCE_UNAVAILABLE, "Source was removed."));
        hub.removeSource(sourceId);
        LOG.info("Retired source {} ({}).", sourceId, entry.source.path);
        return true;
    }

    /// Subscribe to a source, starting its tailer if it isn't already running.
    /// @throws UnknownSourceException if there is no such source.
    /// @throws SecurityViolationException if the source was refused by the AccessGuard.
    public synchronized Subscription subscribe (String sourceId, String subscriberId) {
        Entry entry = entries.get(sourceId);
        if (entry == null) {
            RejectedSource refused = rejected.get(sourceId);
            if (refused != null) throw new SecurityViolationException(refused.violation(), refused.reason());
            throw new UnknownSourceException(sourceId);
        }
        // Subscribe before starting the tailer so its first lines can't be missed.
        boolean start = !entry.tailing();
        if (start) hub.clearRecent(sourceId);
        Subscription subscription = hub.subscribe(sourceId, subscriberId);
        entry.subscriberIds.add(subscriberId);
        if (start) startTailer(entry);
        return subscription;
    }

    public synchronized void unsubscribe (Subscription subscription) {
        hub.unsubscribe(subscription);
        Entry entry = entries.get(subscription.sourceId());
        if (entry == null) return;
        entry.subscriberIds.remove(subscription.subscriberId());
        stopIfUnwanted(entry);
    }

    /// Remove a subscriber from every source, for example when its connection is gone.
    public synchronized void removeSubscriber (String subscriberId) {
        Set<String> sourceIds = hub.removeSubscriber(subscriberId);
        for (String sourceId : sourceIds) {
            Entry entry = entries.get(sourceId);
            if (entry == null) continue;
            entry.subscriberIds.remove(subscriberId);
            stopIfUnwanted(entry);
        }
    }

    private void stopIfUnwanted (Entry entry) {
        if (entry.subscriberIds.isEmpty() && !entry.source.alwaysOn && entry.tailer != null) {
            LOG.info("Last subscriber left {}, stopping its tailer.", entry.source.id);
            stopTailer(entry);
        }
    }

    private void startTailer (Entry entry) {
        if (closed) return;
        if (entry.tailer != null) entry.tailer.stop();
        hub.clearRecent(entry.source.id);
        SourceTailer tailer = tailerFactory.create(entry.source, hub, entry.seq);
        entry.tailer = tailer;
        try {
            tailerExecutor.execute(tailer);
        } catch (RejectedExecutionException e) {
            entry.tailer = null;
            LOG.error("Could not start a tailer for {}.", entry.source.id, e);
            hub.reportError(new ErrorEvent(entry.source.id, ErrorKind.SOURCE_UNAVAILABLE, "Engine is shutting down."));
        }
    }

    private void stopTailer (Entry entry) {
        if (entry.tailer != null) {
            entry.tailer.stop();
            entry.tailer = null;
        }
    }

    public synchronized Optional<Source> source (String sourceId) {
        Entry entry = entries.get(sourceId);
        return entry == null ? Optional.empty() : Optional.of(entry.source);
    }

    public synchronized boolean contains (String sourceId) {
        return entries.containsKey(sourceId) || rejected.containsKey(sourceId);
    }

    public synchronized boolean isTailing (String sourceId) {
        Entry entry = entries.get(sourceId);
        return entry != null && entry.tailing();
    }

    /// IDs of the sources discovered in the given directory source.
    public synchronized Set<String> idsByOrigin (String origin) {
        Set<String> ids = new HashSet<>();
        for (Entry entry : entries.values()) {
            if (origin.equals(entry.source.origin)) ids.add(entry.source.id);
        }
        return ids;
    }

    public synchronized List<SourceStatus> sources () {
        List<SourceStatus> statuses = new ArrayList<>();
        for (Entry entry : entries.values()) {
            TailerState state = entry.tailer == null ? TailerState.STOPPED : entry.tailer.state();
            statuses.add(new SourceStatus(entry.source, entry.tailing(), state, entry.subscriberIds.size()));
        }
        return statuses;
    }

    public synchronized List<RejectedSource> rejected () {
        return List.copyOf(rejected.values());
    }

    /// Stop every tailer. The executor they run on belongs to the caller.
    @Override
    public synchronized void close () {
        closed = true;
        for (Entry entry : entries.values()) {
            stopTailer(entry);
        }
        LOG.info("Stopped all tailers for {} sources.", entries.size());
    }

}
