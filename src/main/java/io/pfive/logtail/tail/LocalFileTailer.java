// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import io.pfive.logtail.hub.EventSink;
import io.pfive.logtail.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/// Follows a file on the local filesystem. Between reads the thread waits on a WatchService
/// registered on the file's directory, but never longer than the poll interval, since some
/// filesystems (network mounts in particular) don't deliver notifications at all.
///
/// Each pass re-examines the file by path and decides whether it was rotated since the last pass:
/// the file key (device and inode where the platform has them) changed, the size dropped below
/// our read position, or the first bytes of the file no longer match what we saw there. The last
/// check catches a file truncated and rewritten past our position between two passes. On rotation
/// reading restarts at offset zero, so nothing written before the rotation is emitted twice.
public class LocalFileTailer extends SourceTailer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final int HEAD_FINGERPRINT_BYTES = 64;
    private static final int READ_BUFFER_BYTES = 64 * 1024;

    private final Path path;
    private final ByteBuffer readBuffer = ByteBuffer.allocate(READ_BUFFER_BYTES);

    private long position = 0;
    private Object fileKey = null;
    private byte[] head = new byte[0];
    private boolean missing = false;

    public LocalFileTailer (Source source, EventSink sink, TailSettings settings, AtomicLong seq, Clock clock) {
        super(source, sink, settings, seq, clock);
        this.path = source.localPath();
    }

    @Override
    protected void follow () throws InterruptedException {
        setState(TailerState.STARTING);
        startPosition();
        setState(TailerState.STREAMING);
        WatchService watcher = openWatcher();
        try {
            while (!stopRequested()) {
                try {
                    readAppended();
                } catch (IOException e) {
                    if (stopRequested()) break;
                    LOG.warn("Reading {} failed, will retry: {}", path, e.toString());
                }
                awaitChange(watcher);
            }
        } finally {
            closeWatcher(watcher);
        }
    }

    /// Position at the configured backlog distance from the end. When that lands mid-file we start
    /// one byte earlier and skip up to the next newline, so a backlog starting exactly on a line
    /// boundary loses nothing.
    private void startPosition () {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            long size = attributes.size();
            fileKey = attributes.fileKey();
            long backlogStart = Math.max(0, size - settings.backlogBytes());
            if (backlogStart > 0) {
                position = backlogStart - 1;
                splitter.skipToNextLine();
            } else {
                position = 0;
            }
            head = readHead(Math.min(HEAD_FINGERPRINT_BYTES, size));
            source.recordPosition(size, fileKey);
        } catch (NoSuchFileException e) {
            LOG.warn("{} does not exist yet, waiting for it to appear.", path);
            missing = true;
        } catch (IOException e) {
            LOG.warn("Could not examine {} at startup, will keep trying: {}", path, e.toString());
            missing = true;
        }
    }

    private void readAppended () throws IOException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            if (!missing) LOG.info("{} has disappeared, waiting for it to come back.", path);
            missing = true;
            return;
        }
        long size = attributes.size();
        Object currentKey = attributes.fileKey();
        if (missing) {
            // Anything that shows up after the file vanished is new content.
            boolean replaced = fileKey != null && !Objects.equals(fileKey, currentKey);
            missing = false;
            if (replaced || size < position) {
                rotate(currentKey);
            }
            fileKey = currentKey;
        } else if (isRotated(currentKey, size)) {
            rotate(currentKey);
        }
        if (size <= position) {
            source.recordPosition(size, currentKey);
            return;
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            channel.position(position);
            int n;
            readBuffer.clear();
            while (!stopRequested() && (n = channel.read(readBuffer)) > 0) {
                splitter.feed(readBuffer.array(), 0, n, this::emit);
                position += n;
                readBuffer.clear();
            }
        }
        if (head.length < HEAD_FINGERPRINT_BYTES) {
            head = readHead(Math.min(HEAD_FINGERPRINT_BYTES, position));
        }
        source.recordPosition(position, currentKey);
    }

    private boolean isRotated (Object currentKey, long size) throws IOException {
        if (fileKey != null && currentKey != null && !fileKey.equals(currentKey)) return true;
        if (size < position) return true;
        if (head.length > 0 && size >= head.length) {
            return !Arrays.equals(head, readHead(head.length));
        }
        return false;
    }

    private void rotate (Object currentKey) {
        emitRotation();
        position = 0;
        fileKey = currentKey;
        head = new byte[0];
        setState(TailerState.STREAMING);
    }

    private byte[] readHead (long length) throws IOException {
        byte[] bytes = new byte[(int) length];
        if (length == 0) return bytes;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining() && channel.read(buffer) > 0) {
                // Keep reading until full or end of file.
            }
            if (buffer.hasRemaining()) {
                return Arrays.copyOf(bytes, buffer.position());
            }
        }
        return bytes;
    }

    private WatchService openWatcher () {
        Path directory = path.toAbsolutePath().getParent();
        try {
            WatchService watcher = path.getFileSystem().newWatchService();
            directory.register(watcher, StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_DELETE);
            return watcher;
        } catch (IOException | UnsupportedOperationException e) {
            LOG.info("No change notifications for {}, polling every {}: {}", directory, settings.pollInterval(), e.toString());
            return null;
        }
    }

    private void awaitChange (WatchService watcher) throws InterruptedException {
        long millis = settings.pollInterval().toMillis();
        if (watcher == null) {
            Thread.sleep(millis);
            return;
        }
        try {
            WatchKey key = watcher.poll(millis, TimeUnit.MILLISECONDS);
            if (key != null) {
                // Any event in the directory triggers a re-check, which is cheap.
                key.pollEvents();
                key.reset();
            }
        } catch (ClosedWatchServiceException e) {
            LOG.debug("Watch service for {} closed, falling back to polling.", path);
            Thread.sleep(millis);
        }
    }

    private void closeWatcher (WatchService watcher) {
        if (watcher == null) return;
        try {
            watcher.close();
        } catch (IOException e) {
            LOG.debug("Closing watch service for {} failed: {}", path, e.toString());
        }
    }

}
