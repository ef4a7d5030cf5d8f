// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import io.pfive.logtail.guard.AccessGuard;
import io.pfive.logtail.guard.SecurityViolationException;
import io.pfive.logtail.hub.EventSink;
import io.pfive.logtail.model.ErrorKind;
import io.pfive.logtail.model.RemoteHost;
import io.pfive.logtail.model.Source;
import io.pfive.logtail.remote.RemoteAccessException;
import io.pfive.logtail.remote.RemoteCommands;
import io.pfive.logtail.remote.RemoteProcess;
import io.pfive.logtail.remote.RemoteSession;
import io.pfive.logtail.remote.RemoteSessionPool;
import io.pfive.logtail.remote.UnreachableException;
import io.pfive.logtail.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/// Follows a file on a remote host by leasing a session from the pool and running tail on it.
///
/// The tailer counts every byte it has received, so after a dropped connection it resumes with
/// `tail -c +<offset>` exactly where the previous stream stopped, and a partial line left in the
/// splitter is completed by the new stream. Before each (re)start the current size of the file is
/// checked; if it is now smaller than our offset the file was rotated while we were away. A
/// rotation while connected is reported by tail itself, and the offset restarts with the new file.
///
/// On a clean stop the session goes back to the pool for the next tailer. After any failure it is
/// discarded, since we can't tell whether the connection or just the command broke.
public class RemoteFileTailer extends SourceTailer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final int READ_BUFFER_BYTES = 16 * 1024;

    private final RemoteSessionPool pool;
    private final RemoteHost host;
    private final Backoff backoff;
    private volatile RemoteProcess process;

    /// Offset in the remote file of the next byte we expect. Negative until the first start.
    private long offset = -1;

    public RemoteFileTailer (Source source, EventSink sink, TailSettings settings, AtomicLong seq,
                             Clock clock, RemoteSessionPool pool) {
        super(source, sink, settings, seq, clock);
        this.pool = pool;
        this.host = source.host;
        this.backoff = settings.backoff();
    }

    @Override
    protected void follow () throws InterruptedException {
        int failures = 0;
        while (!stopRequested()) {
            RemoteSession session = null;
            RemoteAccessException failure = null;
            try {
                session = pool.acquire(host);
                positionFor(session);
                List<String> argv = RemoteCommands.approve(
                    List.of("tail", "-c", "+" + (offset + 1), "-F", source.path));
                setState(TailerState.STREAMING);
                try (RemoteProcess running = session.exec(argv)) {
                    process = running;
                    // Reconnected. Only consecutive attempts that fail to get this far use up the budget.
                    failures = 0;
                    if (stopRequested()) break;
                    pump(running);
                    if (stopRequested()) break;
                    String stderr = running.stderr().trim();
                    throw new UnreachableException(host, "tail of %s ended unexpectedly%s"
                        .formatted(source.path, stderr.isEmpty() ? "." : ": " + stderr));
                }
            } catch (SecurityViolationException e) {
                LOG.warn("Refusing to tail {}: {}", source.id, e.getMessage());
                reportError(ErrorKind.SECURITY_VIOLATION, e.getMessage());
                return;
            } catch (RemoteAccessException e) {
                failure = e;
            } catch (IOException e) {
                failure = new UnreachableException(host, "Stream of %s broke: %s".formatted(source.path, e.getMessage()), e);
            } finally {
                process = null;
                if (session != null) {
                    if (stopRequested()) {
                        pool.release(session);
                    } else {
                        session.markBroken();
                        pool.discard(session);
                    }
                }
            }
            if (stopRequested()) break;
            failures += 1;
            if (failures > settings.maxReconnectAttempts()) {
                LOG.warn("Giving up on {} after {} failed attempts: {}", source.id, failures, failure.getMessage());
                ErrorKind kind = (failure.failure() == RemoteAccessException.Failure.POOL_EXHAUSTED)
                    ? ErrorKind.POOL_EXHAUSTED : ErrorKind.SOURCE_UNAVAILABLE;
                reportError(kind, failure.getMessage());
                return;
            }
            setState(TailerState.RECONNECTING);
            long delay = backoff.delayMillis(failures);
            LOG.warn("Lost {} ({}), reconnect attempt {} of {} in {} ms.", source.id, failure.getMessage(),
                failures, settings.maxReconnectAttempts(), delay);
            Thread.sleep(delay);
        }
    }

    /// Decide where the next follow command starts, using a size probe over the leased session.
    private void positionFor (RemoteSession session) throws IOException {
        long size = probeSize(session);
        if (offset < 0) {
            offset = initialOffset(size);
        } else if (size >= 0 && size < offset) {
            emitRotation();
            offset = 0;
        }
        source.recordPosition(size, null);
    }

    private long initialOffset (long size) {
        if (size <= 0) return 0;
        Ret<Long> sizeCheck = AccessGuard.checkFileSize(size, host.maxFileSize);
        if (sizeCheck.isErr()) {
            LOG.warn("Skipping backlog of {}: {}", source.id, sizeCheck.errorMessage());
            return size;
        }
        long backlogStart = Math.max(0, size - settings.backlogBytes());
        if (backlogStart == 0) return 0;
        splitter.skipToNextLine();
        return backlogStart - 1;
    }

    private long probeSize (RemoteSession session) throws IOException {
        List<String> argv = RemoteCommands.approve(List.of("ls", "-ln", source.path));
        try (RemoteProcess probe = session.exec(argv)) {
            StringBuilder output = new StringBuilder();
            InputStream in = probe.stdout();
            byte[] buffer = new byte[1024];
            int n;
            while ((n = in.read(buffer)) > 0 && output.length() < 4096) {
                output.append(new String(buffer, 0, n, source.encoding));
            }
            return RemoteCommands.parseLsSize(output.toString());
        }
    }

    /// Feed the follow command's output to the splitter until it ends. When tail reports that the
    /// file was truncated or replaced, the bytes after that point belong to the new file, so the
    /// offset starts counting again from zero there.
    private void pump (RemoteProcess running) throws IOException {
        InputStream in = running.stdout();
        byte[] buffer = new byte[READ_BUFFER_BYTES];
        long received = 0;
        long restart = -1;
        int n;
        while ((n = in.read(buffer)) > 0) {
            // Notices are queued before the bytes they precede, so they are visible by now.
            if (restart < 0) restart = running.pollRestart();
            int start = 0;
            while (restart >= 0 && restart < received + n) {
                int before = (int) Math.max(0, restart - received - start);
                splitter.feed(buffer, start, before, this::emit);
                offset += before;
                start += before;
                restartFile();
                restart = running.pollRestart();
            }
            splitter.feed(buffer, start, n - start, this::emit);
            offset += n - start;
            received += n;
        }
        // Started over after the last bytes we got: nothing of the new file has been read yet.
        if (restart < 0) restart = running.pollRestart();
        if (restart >= 0) restartFile();
    }

    /// The followed file started over while tail was running.
    private void restartFile () {
        // A file that didn't exist until now isn't a rotation.
        if (offset > 0) emitRotation();
        offset = 0;
        setState(TailerState.STREAMING);
    }

    @Override
    protected void onStop () {
        RemoteProcess running = process;
        if (running != null) running.close();
    }

}
