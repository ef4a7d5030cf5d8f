// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import io.pfive.logtail.model.RemoteHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static io.pfive.logtail.util.RandomId.createRandomStringId;

/// A pooled connection to one RemoteHost. State transitions are made only by the RemoteSessionPool
/// while holding the lock for the session's host. While Leased, the session belongs to exactly one
/// caller, which may run commands on it and must eventually hand it back with release or discard.
public class RemoteSession {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public enum State { IDLE, LEASED, CLOSING, CLOSED }

    public final String id;
    public final RemoteHost host;
    public final Instant createdAt;
    final RemoteConnection connection;

    private volatile State state;
    private volatile Instant lastUsedAt;
    private volatile boolean broken;

    RemoteSession (RemoteHost host, RemoteConnection connection, Instant now) {
        this.id = createRandomStringId().substring(0, 12);
        this.host = host;
        this.connection = connection;
        this.createdAt = now;
        this.lastUsedAt = now;
        this.state = State.LEASED;
    }

    /// Start a command over this session. Any failure to do so marks the session broken, so the
    /// pool will close it instead of handing it out again.
    public RemoteProcess exec (List<String> argv) {
        checkState(state == State.LEASED, "Session %s is not leased.", id);
        try {
            return connection.exec(argv);
        } catch (RuntimeException e) {
            broken = true;
            throw e;
        }
    }

    /// Flag the session so it is closed when its current lease ends rather than returned to idle.
    public void markBroken () {
        broken = true;
    }

    public boolean isBroken () {
        return broken;
    }

    public State state () {
        return state;
    }

    public Instant lastUsedAt () {
        return lastUsedAt;
    }

    Duration age (Instant now) {
        return Duration.between(createdAt, now);
    }

    Duration idleTime (Instant now) {
        return Duration.between(lastUsedAt, now);
    }

    void markLeased (Instant now) {
        state = State.LEASED;
        lastUsedAt = now;
    }

    void markIdle (Instant now) {
        state = State.IDLE;
        lastUsedAt = now;
    }

    void markClosing () {
        state = State.CLOSING;
    }

    /// Close the underlying connection. Must be called without holding the pool lock since this can
    /// involve network I/O.
    void closeConnection () {
        try {
            connection.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing session {} to {}: {}", id, host.key(), e.toString());
        } finally {
            state = State.CLOSED;
        }
    }

    @Override
    public String toString () {
        return "RemoteSession[%s %s %s]".formatted(id, host.key(), state);
    }
}
