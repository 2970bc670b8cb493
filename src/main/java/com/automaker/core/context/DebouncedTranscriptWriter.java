package com.automaker.core.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Append-only transcript writer that coalesces bursts of fragments into one file write per
 * debounce window.
 * <p>
 * Fragments accumulate in memory and a flush is scheduled {@code debounceMs} after the first
 * unflushed fragment. {@link #close()} cancels the timer, waits for any flush already writing
 * and then flushes the rest, so nothing pushed before close is lost and fragments land in order.
 * One writer per running feature; not shared across features.
 */
public class DebouncedTranscriptWriter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebouncedTranscriptWriter.class);

    private final Path file;
    private final ScheduledExecutorService timer;
    private final long debounceMs;

    private static final int TAIL_BYTES = 8;

    private final Object lock = new Object();
    /** Held from taking the pending text until it is on disk. */
    private final Object writeLock = new Object();
    private StringBuilder pending = new StringBuilder();
    private ScheduledFuture<?> scheduledFlush;
    /** Last characters of the transcript as written or pending, for paragraph handling. */
    private String tail;
    private boolean closed;

    DebouncedTranscriptWriter(Path file, ScheduledExecutorService timer, long debounceMs) {
        this.file = file;
        this.timer = timer;
        this.debounceMs = debounceMs;
        this.tail = readTail(file);
    }

    /**
     * Queue a fragment for writing. The fragment is written within roughly one debounce window.
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Transcript writer for " + file + " is closed");
            }
            pending.append(text);
            tail = tailOf(tail + text);
            if (scheduledFlush == null || scheduledFlush.isDone()) {
                scheduledFlush = timer.schedule(this::flushQuietly, debounceMs, TimeUnit.MILLISECONDS);
            }
        }
    }

    /**
     * Appends a paragraph of prose, inserting a blank line first when the transcript does not
     * already end with one.
     */
    public void appendParagraph(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        synchronized (lock) {
            if (!tail.isEmpty() && !tail.endsWith("\n\n")) {
                append(tail.endsWith("\n") ? "\n" : "\n\n");
            }
            append(text);
        }
    }

    /** True when nothing has been written to this transcript yet. */
    public boolean isEmpty() {
        synchronized (lock) {
            return tail.isEmpty();
        }
    }

    /**
     * Write all pending fragments now.
     *
     * @throws ContextStoreException if the file cannot be written; pending text is kept
     */
    public void flush() {
        synchronized (writeLock) {
            String toWrite;
            synchronized (lock) {
                if (pending.length() == 0) {
                    return;
                }
                toWrite = pending.toString();
                pending = new StringBuilder();
            }
            try {
                Files.createDirectories(file.getParent());
                Files.writeString(file, toWrite, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                log.debug("Flushed {} chars to {}", toWrite.length(), file);
            } catch (IOException e) {
                synchronized (lock) {
                    pending.insert(0, toWrite);
                }
                throw new ContextStoreException("Failed to write transcript " + file, e);
            }
        }
    }

    /** Cancel the pending timer and flush synchronously, after any in-flight flush. Idempotent. */
    @Override
    public void close() {
        synchronized (lock) {
            if (scheduledFlush != null) {
                scheduledFlush.cancel(false);
                scheduledFlush = null;
            }
            closed = true;
        }
        flush();
    }

    public Path getFile() {
        return file;
    }

    private void flushQuietly() {
        try {
            flush();
        } catch (ContextStoreException e) {
            log.warn("Debounced transcript flush failed, will retry on next flush: {}", e.getMessage());
        }
    }

    private static String readTail(Path file) {
        if (!Files.exists(file)) {
            return "";
        }
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(size, TAIL_BYTES));
            channel.position(size - buffer.capacity());
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            buffer.flip();
            return tailOf(StandardCharsets.UTF_8.decode(buffer).toString());
        } catch (IOException e) {
            throw new ContextStoreException("Failed to read transcript " + file, e);
        }
    }

    private static String tailOf(String text) {
        return text.length() <= 2 ? text : text.substring(text.length() - 2);
    }
}
