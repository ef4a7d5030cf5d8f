// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import io.pfive.logtail.model.RemoteHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/// Keeps a bounded set of authenticated connections per remote host and leases them out one
/// caller at a time.
///
/// Each host has its own lock, so a slow connection attempt to one host never holds up callers
/// for another. The lock guards only bookkeeping: connecting, probing and closing all happen
/// outside it. A connection being opened is counted against the cap from the moment the attempt
/// starts, so for every host at every instant idle + leased + opening <= maxConnections.
///
/// Idle sessions are reused most-recently-used first, leaving the least used ones to age out
/// under the sweep.
public class RemoteSessionPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public record Settings (int maxConnections, Duration idleTimeout, Duration maxAge, Duration acquireTimeout) {
        public Settings {
            checkArgument(maxConnections > 0, "maxConnections must be positive.");
            checkArgument(!idleTimeout.isNegative() && !maxAge.isNegative() && !acquireTimeout.isNegative(),
                "Pool durations must not be negative.");
        }
    }

    private final SshConnector connector;
    private final Settings settings;
    private final Clock clock;
    private final Map<RemoteHost, HostPool> pools = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    public RemoteSessionPool (SshConnector connector, Settings settings, Clock clock) {
        this.connector = connector;
        this.settings = settings;
        this.clock = clock;
    }

    /// Sessions for one host. All fields are guarded by lock.
    private static class HostPool {
        final RemoteHost host;
        final ReentrantLock lock = new ReentrantLock();
        final Condition returned = lock.newCondition();
        final Deque<RemoteSession> idle = new ArrayDeque<>();
        final Set<RemoteSession> leased = new HashSet<>();
        int opening = 0;

        HostPool (RemoteHost host) {
            this.host = host;
        }

        int total () {
            return idle.size() + leased.size() + opening;
        }
    }

    /// Lease a session to the given host, blocking up to the acquire timeout if all are in use.
    /// @throws PoolExhaustedException if no session became available in time.
    /// @throws AuthFailedException or UnreachableException if a new connection was needed and failed.
    public RemoteSession acquire (RemoteHost host) {
        checkState(!closed, "Session pool is closed.");
        HostPool pool = pools.computeIfAbsent(host, HostPool::new);
        final long deadline = System.nanoTime() + settings.acquireTimeout.toNanos();
        while (true) {
            RemoteSession candidate = reserve(pool, deadline);
            if (candidate == null) {
                return open(pool);
            }
            if (candidate.connection.probe()) {
                return candidate;
            }
            LOG.debug("Idle session {} failed its liveness probe, closing it.", candidate.id);
            discard(candidate);
        }
    }

    /// Under the host lock, either take an idle session (returned already marked leased) or claim a
    /// slot for opening a new one (returns null), waiting for a release if neither is possible.
    private RemoteSession reserve (HostPool pool, long deadline) {
        pool.lock.lock();
        try {
            while (true) {
                checkState(!closed, "Session pool is closed.");
                RemoteSession session = pool.idle.pollFirst();
                if (session != null) {
                    session.markLeased(clock.instant());
                    pool.leased.add(session);
                    return session;
                }
                if (pool.total() < settings.maxConnections) {
                    pool.opening += 1;
                    return null;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new PoolExhaustedException(pool.host, "All %d sessions in use, none released within %s."
                        .formatted(settings.maxConnections, settings.acquireTimeout));
                }
                try {
                    pool.returned.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PoolExhaustedException(pool.host, "Interrupted while waiting for a session.");
                }
            }
        } finally {
            pool.lock.unlock();
        }
    }

    private RemoteSession open (HostPool pool) {
        RemoteConnection connection;
        try {
            connection = connector.connect(pool.host);
        } catch (RuntimeException e) {
            pool.lock.lock();
            try {
                pool.opening -= 1;
                pool.returned.signal();
            } finally {
                pool.lock.unlock();
            }
            throw e;
        }
        RemoteSession session = new RemoteSession(pool.host, connection, clock.instant());
        pool.lock.lock();
        try {
            pool.opening -= 1;
            if (!closed) {
                pool.leased.add(session);
                LOG.info("Opened session {} to {} ({} of {}).", session.id, pool.host.key(), pool.total(), settings.maxConnections);
                return session;
            }
        } finally {
            pool.lock.unlock();
        }
        session.markClosing();
        session.closeConnection();
        throw new IllegalStateException("Session pool was closed while connecting to " + pool.host.key());
    }

    /// Hand a leased session back for reuse. It is closed instead if it was marked broken, has
    /// exceeded its maximum age, is no longer connected, or the pool has been closed.
    public void release (RemoteSession session) {
        HostPool pool = pools.get(session.host);
        checkState(pool != null, "Session %s does not belong to this pool.", session.id);
        Instant now = clock.instant();
        boolean keep;
        pool.lock.lock();
        try {
            if (!pool.leased.remove(session)) {
                LOG.debug("Ignoring release of session {}, which is not leased.", session.id);
                return;
            }
            keep = !closed && !session.isBroken() && session.connection.isOpen()
                && session.age(now).compareTo(settings.maxAge) < 0;
            if (keep) {
                session.markIdle(now);
                pool.idle.addFirst(session);
            } else {
                session.markClosing();
            }
            pool.returned.signal();
        } finally {
            pool.lock.unlock();
        }
        if (!keep) {
            LOG.info("Closing session {} to {} on release (broken={}).", session.id, session.host.key(), session.isBroken());
            session.closeConnection();
        }
    }

    /// Close a session whose connection is known or suspected to be broken, freeing its slot.
    public void discard (RemoteSession session) {
        HostPool pool = pools.get(session.host);
        checkState(pool != null, "Session %s does not belong to this pool.", session.id);
        pool.lock.lock();
        try {
            boolean removed = pool.leased.remove(session) || pool.idle.remove(session);
            if (!removed) return;
            session.markClosing();
            pool.returned.signal();
        } finally {
            pool.lock.unlock();
        }
        LOG.info("Discarding session {} to {}.", session.id, session.host.key());
        session.closeConnection();
    }

    /// Close idle sessions past the idle timeout or maximum age, or whose connection has dropped.
    /// Leased sessions are never taken from their holder, but if their connection has dropped they
    /// are flagged so that release closes them.
    /// @return the number of sessions closed.
    public int sweep () {
        Instant now = clock.instant();
        List<RemoteSession> evicted = new ArrayList<>();
        for (HostPool pool : pools.values()) {
            pool.lock.lock();
            try {
                Iterator<RemoteSession> iterator = pool.idle.iterator();
                while (iterator.hasNext()) {
                    RemoteSession session = iterator.next();
                    boolean expired = session.idleTime(now).compareTo(settings.idleTimeout) > 0
                        || session.age(now).compareTo(settings.maxAge) >= 0;
                    if (expired || !session.connection.isOpen()) {
                        iterator.remove();
                        session.markClosing();
                        evicted.add(session);
                    }
                }
                for (RemoteSession session : pool.leased) {
                    if (!session.connection.isOpen()) session.markBroken();
                }
                if (!evicted.isEmpty()) pool.returned.signalAll();
            } finally {
                pool.lock.unlock();
            }
        }
        for (RemoteSession session : evicted) {
            LOG.info("Sweep closing idle session {} to {}.", session.id, session.host.key());
            session.closeConnection();
        }
        LOG.debug("Pool sweep closed {} sessions.", evicted.size());
        return evicted.size();
    }

    public ScheduledFuture<?> startSweeper (ScheduledExecutorService scheduler, Duration interval) {
        long millis = interval.toMillis();
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                sweep();
            } catch (RuntimeException e) {
                LOG.error("Session pool sweep failed.", e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    public int idleCount (RemoteHost host) {
        return count(host, false);
    }

    public int leasedCount (RemoteHost host) {
        return count(host, true);
    }

    private int count (RemoteHost host, boolean leased) {
        HostPool pool = pools.get(host);
        if (pool == null) return 0;
        pool.lock.lock();
        try {
            return leased ? pool.leased.size() : pool.idle.size();
        } finally {
            pool.lock.unlock();
        }
    }

    /// Idle plus leased plus currently opening.
    public int totalCount (RemoteHost host) {
        HostPool pool = pools.get(host);
        if (pool == null) return 0;
        pool.lock.lock();
        try {
            return pool.total();
        } finally {
            pool.lock.unlock();
        }
    }

    public Settings settings () {
        return settings;
    }

    /// Close every session, including leased ones, and wake any waiting callers so they fail.
    @Override
    public void close () {
        closed = true;
        List<RemoteSession> toClose = new ArrayList<>();
        for (HostPool pool : pools.values()) {
            pool.lock.lock();
            try {
                toClose.addAll(pool.idle);
                toClose.addAll(pool.leased);
                pool.idle.clear();
                pool.leased.clear();
                pool.returned.signalAll();
            } finally {
                pool.lock.unlock();
            }
        }
        for (RemoteSession session : toClose) {
            session.markClosing();
            session.closeConnection();
        }
        LOG.info("Session pool closed, {} sessions shut down.", toClose.size());
    }

}
