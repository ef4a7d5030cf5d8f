// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import io.pfive.logtail.Await;
import io.pfive.logtail.hub.CollectingSink;
import io.pfive.logtail.model.LineEvent;
import io.pfive.logtail.model.Source;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalFileTailerTest {

    @TempDir
    Path dir;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final CollectingSink sink = new CollectingSink();

    @AfterEach
    void shutdown () {
        executor.shutdownNow();
    }

    static TailSettings settings (long backlogBytes, int maxLineLength) {
        return new TailSettings(maxLineLength, backlogBytes, true, Duration.ofMillis(20),
            Duration.ofMillis(1), Duration.ofMillis(5), 0, 3);
    }

    private LocalFileTailer start (Path file, TailSettings settings) {
        Source source = Source.local("app", file, StandardCharsets.UTF_8, false, null);
        LocalFileTailer tailer = new LocalFileTailer(source, sink, settings, new AtomicLong(), Clock.systemUTC());
        executor.execute(tailer);
        Await.until("tailer streaming", () -> tailer.state() == TailerState.STREAMING);
        return tailer;
    }

    private static void append (Path file, String text) throws IOException {
        Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Test
    void followsAppendedLinesFromTheEnd () throws Exception {
        Path file = Files.writeString(dir.resolve("app.log"), "old 1\nold 2\n");
        LocalFileTailer tailer = start(file, settings(0, 1024));
        append(file, "new 1\nnew ");
        Await.until("first new line", () -> sink.contents().equals(List.of("new 1")));
        append(file, "2\n");
        Await.until("completed partial line", () -> sink.contents().equals(List.of("new 1", "new 2")));
        tailer.stop();
        Await.until("tailer stopped", () -> tailer.state() == TailerState.STOPPED);
        assertFalse(tailer.isActive());
    }

    @Test
    void backlogIsEmittedOnStart () throws Exception {
        Path file = Files.writeString(dir.resolve("app.log"), "one\ntwo\nthree\n");
        start(file, settings(1024, 1024));
        Await.until("backlog", () -> sink.contents().equals(List.of("one", "two", "three")));
    }

    @Test
    void backlogStartingMidLineSkipsThatLine () throws Exception {
        Path file = Files.writeString(dir.resolve("app.log"), "aaaaaaaa\nbbbb\ncccc\n");
        start(file, settings(12, 1024));
        Await.until("backlog", () -> sink.contents().equals(List.of("bbbb", "cccc")));
    }

    @Test
    void backlogStartingOnLineBoundaryKeepsThatLine () throws Exception {
        Path file = Files.writeString(dir.resolve("app.log"), "aaaaaaaa\nbbbb\ncccc\n");
        start(file, settings(10, 1024));
        Await.until("backlog", () -> sink.contents().equals(List.of("bbbb", "cccc")));
    }

    @Test
    void seqIsMonotonic () throws Exception {
        Path file = Files.writeString(dir.resolve("app.log"), "");
        start(file, settings(0, 1024));
        for (int i = 0; i < 20; i++) {
            append(file, "line " + i + "\n");
        }
        Await.until("all lines", () -> sink.contents().size() == 20);
        List<LineEvent> lines = sink.lines();
        for (int i = 0; i < lines.size(); i++) {
            assertEquals(i + 1, lines.get(i).seq());
        }
    }

    @Test
    void truncatedAndRewrittenFileEmitsRotationThenOnlyNewContent () throws Exception {
        Path file = Files.writeString(dir.resolve("app.log"), "before 1\nbefore 2\n");
        start(file, settings(1024, 1024));
        append(file, "before 3\n");
        Await.until("pre-rotation lines", () -> sink.contents().size() == 3);

        Files.writeString(file, "after 1\n", StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
        Await.until("rotation marker", () -> sink.rotationCount() >= 1);
        Await.until("post-rotation line", () -> sink.contents().contains("after 1"));
        append(file, "after 2\n");
        Await.until("second post-rotation line", () -> sink.contents().contains("after 2"));

        assertEquals(List.of("before 1", "before 2", "before 3", "after 1", "after 2"), sink.contents());
        List<LineEvent> lines = sink.lines();
        int marker = 0;
        while (!lines.get(marker).rotated()) marker++;
        assertEquals(3, marker);
    }

    @Test
    void rewriteLongerThanOldContentIsStillDetected () throws Exception {
        Path file = Files.writeString(dir.resolve("app.log"), "short\n");
        start(file, settings(1024, 1024));
        Await.until("initial line", () -> sink.contents().equals(List.of("short")));

        // Replace the file's content with something longer in one step, so the size never drops
        // below our position between two checks.
        Path replacement = Files.writeString(dir.resolve("app.log.new"), "replaced entirely\nsecond\n");
        Files.move(replacement, file, java.nio.file.StandardCopyOption.REPLACE_EXISTING,
            java.nio.file.StandardCopyOption.ATOMIC_MOVE);
        Await.until("rotation marker", () -> sink.rotationCount() == 1);
        Await.until("new content", () -> sink.contents().equals(List.of("short", "replaced entirely", "second")));
    }

    @Test
    void fileAppearingLaterIsReadFromTheStart () throws Exception {
        Path file = dir.resolve("later.log");
        start(file, settings(1024, 1024));
        Thread.sleep(50);
        Files.writeString(file, "hello\nworld\n");
        Await.until("lines of new file", () -> sink.contents().equals(List.of("hello", "world")));
    }

    @Test
    void overlongLinesAreTruncated () throws Exception {
        Path file = Files.writeString(dir.resolve("app.log"), "");
        start(file, settings(0, 16));
        append(file, "x".repeat(100) + "\nshort\n");
        Await.until("both lines", () -> sink.contents().size() == 2);
        List<LineEvent> lines = sink.lines();
        assertTrue(lines.get(0).truncated());
        assertEquals(16, lines.get(0).content().length());
        assertEquals("short", lines.get(1).content());
        assertFalse(lines.get(1).truncated());
    }

    @Test
    void stopBeforeRunNeverStarts () {
        Source source = Source.local("app", dir.resolve("x.log"), StandardCharsets.UTF_8, false, null);
        LocalFileTailer tailer = new LocalFileTailer(source, sink, settings(0, 64), new AtomicLong(), Clock.systemUTC());
        tailer.stop();
        tailer.run();
        assertEquals(TailerState.STOPPED, tailer.state());
        assertTrue(sink.lines().isEmpty());
    }
}
