// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.hub;

import io.pfive.logtail.model.LineEvent;
import io.pfive.logtail.model.StreamEvent;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;

/// One viewer's outbound queue. Producers (the Hub, on tailer threads) call offer, which never
/// blocks beyond a short critical section. The viewer's delivery loop calls poll.
///
/// When the queue is full the oldest buffered line is dropped to make room, droppedCount goes up,
/// and a gap marker is owed for that line's source. Owed gap markers are handed out by poll ahead
/// of everything still queued, which is exactly where the discontinuity is: every queued event is
/// newer than the one that was dropped. Recording the gap instead of queueing it means a full
/// queue stays full of real lines, and a burst of drops costs one marker per source.
/// Error events are never dropped while a line remains that could be dropped instead.
public class Subscriber {

    public final String id;
    private final int capacity;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<StreamEvent> queue = new ArrayDeque<>();
    /// Source ID to the seq of the most recent line dropped from that source. Guarded by lock.
    private final Map<String, Long> owedGaps = new LinkedHashMap<>();
    private long droppedCount = 0;
    private boolean closed = false;

    /// Sources this subscriber is registered for, maintained by the Hub.
    final Set<String> sourceIds = ConcurrentHashMap.newKeySet();

    public Subscriber (String id, int capacity, Clock clock) {
        checkArgument(capacity > 0, "Subscriber queue capacity must be positive.");
        this.id = id;
        this.capacity = capacity;
        this.clock = clock;
    }

    /// Enqueue an event, dropping the oldest line if the queue is full.
    /// @return false if the subscriber has been closed and the event was ignored.
    public boolean offer (StreamEvent event) {
        lock.lock();
        try {
            if (closed) return false;
            if (queue.size() >= capacity) {
                dropOldest();
            }
            queue.addLast(event);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void dropOldest () {
        StreamEvent dropped = null;
        for (Iterator<StreamEvent> iterator = queue.iterator(); iterator.hasNext(); ) {
            StreamEvent event = iterator.next();
            if (event instanceof LineEvent) {
                iterator.remove();
                dropped = event;
                break;
            }
        }
        if (dropped == null) {
            dropped = queue.pollFirst();
        }
        droppedCount += 1;
        if (dropped instanceof LineEvent line) {
            owedGaps.merge(line.sourceId(), line.seq(), Math::max);
        }
    }

    /// Wait up to the given time for the next event.
    /// @return the next event, or null on timeout or once the subscriber is closed.
    public StreamEvent poll (long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!closed && queue.isEmpty() && owedGaps.isEmpty()) {
                if (nanos <= 0) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            if (closed) return null;
            if (!owedGaps.isEmpty()) {
                Iterator<Map.Entry<String, Long>> iterator = owedGaps.entrySet().iterator();
                Map.Entry<String, Long> owed = iterator.next();
                iterator.remove();
                return LineEvent.gapMarker(owed.getKey(), owed.getValue(), clock.instant());
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public long droppedCount () {
        lock.lock();
        try {
            return droppedCount;
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount () {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /// Discard everything queued and wake the delivery loop so it can exit.
    public void close () {
        lock.lock();
        try {
            closed = true;
            queue.clear();
            owedGaps.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed () {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public Set<String> sourceIds () {
        return Set.copyOf(sourceIds);
    }

    @Override
    public String toString () {
        return "Subscriber[" + id + "]";
    }
}
