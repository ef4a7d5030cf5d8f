// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.hub;

import com.google.common.collect.EvictingQueue;
import io.pfive.logtail.model.ErrorEvent;
import io.pfive.logtail.model.LineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static io.pfive.logtail.util.RandomId.createRandomStringId;

/// Fans events out from tailers (one per source) to subscribers (any number per source).
///
/// Every source has a channel holding its current subscribers and a ring buffer of its most recent
/// lines. Publishing to a channel and subscribing to it are serialized on the channel's monitor,
/// so a new subscriber receives the replayed lines followed by every later line exactly once,
/// with nothing lost or duplicated at the seam. Publishing only ever appends to bounded
/// subscriber queues (see Subscriber.offer), so it never waits on a slow viewer, and channels for
/// different sources never contend with each other.
public class StreamHub implements EventSink {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final int queueCapacity;
    private final int recentLines;
    private final Clock clock;
    private final Map<String, SourceChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    private static class SourceChannel {
        final Set<Subscriber> subscribers = new LinkedHashSet<>();
        final EvictingQueue<LineEvent> recent;

        SourceChannel (int recentLines) {
            recent = EvictingQueue.create(recentLines);
        }
    }

    public StreamHub (int queueCapacity, int recentLines, Clock clock) {
        checkArgument(queueCapacity > 0, "Subscriber queue capacity must be positive.");
        checkArgument(recentLines >= 0, "Recent line count must not be negative.");
        this.queueCapacity = queueCapacity;
        this.recentLines = recentLines;
        this.clock = clock;
    }

    private SourceChannel channel (String sourceId) {
        return channels.computeIfAbsent(sourceId, id -> new SourceChannel(recentLines));
    }

    public Subscriber createSubscriber () {
        Subscriber subscriber = new Subscriber(createRandomStringId(), queueCapacity, clock);
        subscribers.put(subscriber.id, subscriber);
        LOG.debug("Created subscriber {}.", subscriber.id);
        return subscriber;
    }

    public Subscriber subscriber (String subscriberId) {
        return subscribers.get(subscriberId);
    }

    /// Register a subscriber for a source, first replaying the source's recent lines to it.
    /// Subscribing twice to the same source has no further effect.
    public Subscription subscribe (String sourceId, String subscriberId) {
        Subscriber subscriber = subscribers.get(subscriberId);
        checkArgument(subscriber != null, "Unknown subscriber %s.", subscriberId);
        SourceChannel channel = channel(sourceId);
        synchronized (channel) {
            if (channel.subscribers.add(subscriber)) {
                for (LineEvent event : channel.recent) {
                    subscriber.offer(event);
                }
                subscriber.sourceIds.add(sourceId);
            }
        }
        return new Subscription(sourceId, subscriberId);
    }

    public void unsubscribe (Subscription subscription) {
        Subscriber subscriber = subscribers.get(subscription.subscriberId());
        SourceChannel channel = channels.get(subscription.sourceId());
        if (subscriber == null || channel == null) return;
        synchronized (channel) {
            channel.subscribers.remove(subscriber);
        }
        subscriber.sourceIds.remove(subscription.sourceId());
    }

    /// Unregister a subscriber from every source and close its queue.
    /// @return the IDs of the sources it was subscribed to.
    public Set<String> removeSubscriber (String subscriberId) {
        Subscriber subscriber = subscribers.remove(subscriberId);
        if (subscriber == null) return Set.of();
        Set<String> sourceIds = subscriber.sourceIds();
        for (String sourceId : sourceIds) {
            SourceChannel channel = channels.get(sourceId);
            if (channel == null) continue;
            synchronized (channel) {
                channel.subscribers.remove(subscriber);
            }
        }
        subscriber.sourceIds.clear();
        subscriber.close();
        LOG.debug("Removed subscriber {} from {} sources, {} lines were dropped for it.",
            subscriberId, sourceIds.size(), subscriber.droppedCount());
        return sourceIds;
    }

    @Override
    public void publish (LineEvent event) {
        SourceChannel channel = channel(event.sourceId());
        synchronized (channel) {
            channel.recent.add(event);
            for (Subscriber subscriber : channel.subscribers) {
                subscriber.offer(event);
            }
        }
    }

    @Override
    public void reportError (ErrorEvent event) {
        LOG.warn("Reporting {} for source {}: {}", event.errorKind().wireName(), event.sourceId(), event.message());
        SourceChannel channel = channel(event.sourceId());
        synchronized (channel) {
            for (Subscriber subscriber : channel.subscribers) {
                subscriber.offer(event);
            }
        }
    }

    /// Forget the recent lines of a source, so a tailer starting afresh doesn't have its backlog
    /// preceded by stale lines from an earlier run.
    public void clearRecent (String sourceId) {
        SourceChannel channel = channels.get(sourceId);
        if (channel == null) return;
        synchronized (channel) {
            channel.recent.clear();
        }
    }

    public List<LineEvent> recent (String sourceId) {
        SourceChannel channel = channels.get(sourceId);
        if (channel == null) return List.of();
        synchronized (channel) {
            return new ArrayList<>(channel.recent);
        }
    }

    /// Drop a retired source's channel along with its subscriptions.
    public void removeSource (String sourceId) {
        SourceChannel channel = channels.remove(sourceId);
        if (channel == null) return;
        synchronized (channel) {
            for (Subscriber subscriber : channel.subscribers) {
                subscriber.sourceIds.remove(sourceId);
            }
            channel.subscribers.clear();
        }
    }

    public Set<String> subscriberIds (String sourceId) {
        SourceChannel channel = channels.get(sourceId);
        if (channel == null) return Set.of();
        synchronized (channel) {
            return channel.subscribers.stream().map(s -> s.id).collect(Collectors.toUnmodifiableSet());
        }
    }

    public int subscriberCount () {
        return subscribers.size();
    }

    /// Close every subscriber so that all delivery loops end.
    public void close () {
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            removeSubscriber(subscriber.id);
        }
    }

}
