// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import java.nio.charset.Charset;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/// Turns a stream of bytes arriving in arbitrary chunks into lines. A trailing partial line is held
/// until the rest of it arrives. Splitting happens on bytes rather than decoded characters, since
/// a chunk boundary can fall inside a multi-byte character but never inside a newline byte for
/// any encoding we support.
///
/// Memory held per splitter is bounded by the maximum line length. When a line reaches that many
/// bytes it is emitted immediately, flagged as truncated, and the rest of it is dropped up to the
/// next newline.
public class LineSplitter {

    /// Escape sequences (colours, cursor movement) plus bare colour codes whose ESC was already lost.
    private static final Pattern ANSI = Pattern.compile("\u001B\\[[0-?]*[ -/]*[@-~]|\\[[0-9;]+m");

    public record Line (String content, boolean truncated) { }

    private final Charset charset;
    private final boolean stripAnsi;
    private final byte[] buffer;
    private int length = 0;
    private boolean discardingRemainder = false;
    private boolean skippingPartial = false;

    public LineSplitter (Charset charset, int maxLineLength, boolean stripAnsi) {
        this.charset = charset;
        this.stripAnsi = stripAnsi;
        this.buffer = new byte[maxLineLength];
    }

    public void feed (byte[] bytes, int offset, int count, Consumer<Line> out) {
        for (int i = offset; i < offset + count; i++) {
            byte b = bytes[i];
            if (b == '\n') {
                if (skippingPartial) {
                    skippingPartial = false;
                } else if (discardingRemainder) {
                    discardingRemainder = false;
                } else {
                    emit(false, out);
                }
                length = 0;
                continue;
            }
            if (skippingPartial || discardingRemainder) continue;
            if (length == buffer.length) {
                emit(true, out);
                length = 0;
                discardingRemainder = true;
                continue;
            }
            buffer[length++] = b;
        }
    }

    /// Drop everything up to and including the next newline. Used when reading starts somewhere in
    /// the middle of a file, where the first line is probably incomplete.
    public void skipToNextLine () {
        skippingPartial = true;
        discardingRemainder = false;
        length = 0;
    }

    /// Forget any partial line, for example because the file it came from was replaced.
    public void reset () {
        length = 0;
        skippingPartial = false;
        discardingRemainder = false;
    }

    /// Bytes of the current incomplete line.
    public int pending () {
        return length;
    }

    private void emit (boolean truncated, Consumer<Line> out) {
        int end = length;
        if (!truncated && end > 0 && buffer[end - 1] == '\r') end -= 1;
        String content = new String(buffer, 0, end, charset);
        if (stripAnsi) {
            content = ANSI.matcher(content).replaceAll("");
        }
        if (content.isBlank()) return;
        out.accept(new Line(content, truncated));
    }

}
