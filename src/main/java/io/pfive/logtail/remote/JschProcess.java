// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import com.jcraft.jsch.ChannelExec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

public class JschProcess implements RemoteProcess {

    private final ChannelExec channel;
    private final Output output;

    JschProcess (ChannelExec channel, Output output) {
        this.channel = channel;
        this.output = output;
    }

    @Override
    public InputStream stdout () {
        return output.stdout;
    }

    @Override
    public String stderr () {
        return output.stderr.text();
    }

    @Override
    public long pollRestart () {
        Long restart = output.restarts.poll();
        return restart == null ? -1 : restart;
    }

    /// Disconnecting the channel closes its output streams, which wakes any thread blocked reading stdout.
    @Override
    public void close () {
        channel.disconnect();
    }

    /// Both output streams of a command. JSch writes them from its session thread in the order the
    /// data arrived, so when tail reports on stderr that it started over, the count of stdout bytes
    /// written so far marks exactly where the new file begins.
    static class Output {
        private static final int PIPE_BYTES = 64 * 1024;

        final PipedInputStream stdout;
        final CountingPipe stdoutSink;
        final BoundedStderr stderr = new BoundedStderr(this);
        final Queue<Long> restarts = new ConcurrentLinkedQueue<>();

        Output () throws IOException {
            this.stdoutSink = new CountingPipe();
            this.stdout = new PipedInputStream(stdoutSink, PIPE_BYTES);
        }

        void restartedAt (long stdoutBytes) {
            restarts.add(stdoutBytes);
        }
    }

    static class CountingPipe extends PipedOutputStream {
        private volatile long written = 0;

        @Override
        public void write (int b) throws IOException {
            super.write(b);
            written += 1;
        }

        @Override
        public void write (byte[] b, int off, int len) throws IOException {
            super.write(b, off, len);
            written += len;
        }

        long written () {
            return written;
        }
    }

    /// Keeps the first few kilobytes written to the remote error stream and watches each line for
    /// tail announcing that it switched to a new file. tail -F keeps reporting truncation and
    /// reappearance for as long as it runs, so the kept text must not grow without bound.
    static class BoundedStderr extends OutputStream {
        private static final int LIMIT = 4096;
        private static final int LINE_LIMIT = 1024;

        private final Output output;
        private final ByteArrayOutputStream kept = new ByteArrayOutputStream();
        private final ByteArrayOutputStream line = new ByteArrayOutputStream();

        BoundedStderr (Output output) {
            this.output = output;
        }

        @Override
        public synchronized void write (int b) {
            if (kept.size() < LIMIT) kept.write(b);
            if (b == '\n') {
                String text = line.toString(StandardCharsets.UTF_8);
                line.reset();
                if (startsOver(text)) output.restartedAt(output.stdoutSink.written());
            } else if (line.size() < LINE_LIMIT) {
                line.write(b);
            }
        }

        @Override
        public synchronized void write (byte[] b, int off, int len) {
            for (int i = off; i < off + len; i++) write(b[i]);
        }

        synchronized String text () {
            return kept.toString(StandardCharsets.UTF_8);
        }

        /// GNU and BusyBox tail wording for a followed file that was cut back or swapped out.
        static boolean startsOver (String line) {
            return line.contains("file truncated")
                || line.contains("has been replaced")
                || line.contains("has appeared");
        }
    }
}
