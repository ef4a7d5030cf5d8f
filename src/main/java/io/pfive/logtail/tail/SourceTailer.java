// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import io.pfive.logtail.hub.EventSink;
import io.pfive.logtail.model.ErrorEvent;
import io.pfive.logtail.model.ErrorKind;
import io.pfive.logtail.model.LineEvent;
import io.pfive.logtail.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/// Follows one Source for new content on a thread of its own, until stopped or until the source
/// becomes permanently unavailable. Subclasses implement follow() and call emit for each line.
///
/// Stopping sets a flag and interrupts the thread running follow(), which must leave promptly
/// whether it is blocked on a filesystem watch, a remote read or a backoff sleep. The interrupt
/// is only delivered while run() is active, so a stop that arrives late can't interrupt whatever
/// task the pool thread picked up next.
public abstract class SourceTailer implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    protected final Source source;
    protected final EventSink sink;
    protected final TailSettings settings;
    protected final Clock clock;
    protected final LineSplitter splitter;
    /// Shared with previous and later tailers of the same source, so seq never goes backward.
    private final AtomicLong seq;

    private final Object runnerLock = new Object();
    private Thread runner;
    private volatile boolean stopRequested = false;
    private volatile TailerState state = TailerState.STARTING;

    protected SourceTailer (Source source, EventSink sink, TailSettings settings, AtomicLong seq, Clock clock) {
        this.source = source;
        this.sink = sink;
        this.settings = settings;
        this.seq = seq;
        this.clock = clock;
        this.splitter = new LineSplitter(source.encoding, settings.maxLineLength(), settings.stripAnsi());
    }

    @Override
    public final void run () {
        synchronized (runnerLock) {
            if (stopRequested) {
                state = TailerState.STOPPED;
                return;
            }
            runner = Thread.currentThread();
        }
        LOG.info("Started tailing {} ({}).", source.id, source.path);
        try {
            follow();
        } catch (InterruptedException e) {
            if (!stopRequested) {
                LOG.warn("Tailer for {} was interrupted without being stopped.", source.id);
            }
        } catch (RuntimeException e) {
            LOG.error("Tailer for {} failed unexpectedly.", source.id, e);
            reportError(ErrorKind.SOURCE_UNAVAILABLE, "Tailing failed: " + e.getMessage());
        } finally {
            state = TailerState.STOPPED;
            synchronized (runnerLock) {
                runner = null;
                // Clear any interrupt aimed at this tailer before the thread goes back to its pool.
                Thread.interrupted();
            }
            LOG.info("Stopped tailing {}.", source.id);
        }
    }

    /// Read the source until stopRequested() becomes true or the source is given up on.
    protected abstract void follow () throws InterruptedException;

    /// Release anything follow() may be blocked on that an interrupt alone won't wake.
    protected void onStop () { }

    /// Ask the tailer to finish. Does not wait for it to do so.
    public final void stop () {
        synchronized (runnerLock) {
            stopRequested = true;
            if (runner != null) runner.interrupt();
        }
        onStop();
    }

    public final boolean stopRequested () {
        return stopRequested;
    }

    public TailerState state () {
        return state;
    }

    /// Neither stopped nor asked to stop. A tailer that gave up on its source is no longer active.
    public boolean isActive () {
        return !stopRequested && state != TailerState.STOPPED;
    }

    public Source source () {
        return source;
    }

    protected void setState (TailerState state) {
        if (this.state != TailerState.STOPPED) this.state = state;
    }

    protected void emit (LineSplitter.Line line) {
        if (stopRequested) return;
        sink.publish(LineEvent.line(source.id, seq.incrementAndGet(), clock.instant(), line.content(), line.truncated()));
    }

    protected void emitRotation () {
        LOG.info("Rotation detected on {} ({}).", source.id, source.path);
        setState(TailerState.ROTATED);
        splitter.reset();
        if (!stopRequested) {
            sink.publish(LineEvent.rotationMarker(source.id, seq.incrementAndGet(), clock.instant()));
        }
    }

    protected void reportError (ErrorKind kind, String message) {
        sink.reportError(new ErrorEvent(source.id, kind, message));
    }

}
