/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.inputstream.source;

import static java.util.Objects.requireNonNull;

import io.tileverse.inputstream.AsyncInputStream;
import io.tileverse.inputstream.ProtocolViolationException;
import io.tileverse.inputstream.StreamMonitor;
import io.tileverse.inputstream.StreamOpenException;
import io.tileverse.inputstream.StreamTransferException;
import io.tileverse.inputstream.event.EventLoop;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * An {@link AsyncInputStream} fed by an {@link AsyncSource}.
 * <p>
 * The stream keeps exactly one read request outstanding while the buffer has
 * space, requesting chunks of at most {@code chunkSize} bytes at the position
 * following the last received byte. When the buffer is full the source is left
 * idle until consumers have drained it.
 * <p>
 * A failure reported while the stream is paused is not passed on immediately:
 * the source is reconnected on resume, and the failure is only escalated if the
 * reconnect fails as well.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * SourceInputStream input = new SourceInputStream(ioThread, source).open();
 * input.waitReady();
 * ByteBuffer buffer = ByteBuffer.allocate(8192);
 * while (input.read(buffer.clear()) >= 0) {
 *     ...
 * }
 * }</pre>
 */
@Slf4j
public class SourceInputStream extends AsyncInputStream implements SourceListener {

    /** Default ring buffer size. */
    public static final int DEFAULT_BUFFER_CAPACITY = 512 * 1024;

    /** Default free space at which a paused source is resumed. */
    public static final int DEFAULT_RESUME_AT = 384 * 1024;

    /** Default maximum size of a single read request. */
    public static final int DEFAULT_CHUNK_SIZE = 32 * 1024;

    private final AsyncSource source;
    private final int chunkSize;

    /** The size declared by the source, negative if unknown. */
    private long sourceSize = -1;

    /** The source position of the next read request. */
    private long nextOffset;

    /** Length of the outstanding read request, {@code 0} when idle. */
    private int requested;

    /** A failure was masked while paused, reconnect before reading again. */
    private boolean reconnectOnResume;

    /** A reconnect is in progress, waiting for {@link #onOpen}. */
    private boolean reconnecting;

    private IOException maskedError;

    /** Reading has stopped for good. */
    private boolean failed;

    /**
     * Creates a stream with the default buffer and chunk sizes.
     *
     * @param eventLoop the I/O thread driving the source
     * @param source the backend
     */
    public SourceInputStream(EventLoop eventLoop, AsyncSource source) {
        this(eventLoop, source, DEFAULT_BUFFER_CAPACITY, DEFAULT_RESUME_AT, DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param eventLoop the I/O thread driving the source
     * @param source the backend
     * @param bufferCapacity the ring buffer size in bytes
     * @param resumeAt resume a paused source once more than this many bytes are free
     * @param chunkSize the maximum size of a single read request
     */
    public SourceInputStream(
            EventLoop eventLoop, AsyncSource source, int bufferCapacity, int resumeAt, int chunkSize) {
        super(eventLoop, requireNonNull(source, "source cannot be null").getSourceIdentifier(), bufferCapacity, resumeAt);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.source = source;
        this.chunkSize = chunkSize;
    }

    /**
     * Starts opening the source on the I/O thread and waits for that call to
     * return, not for the source to become ready. Use {@link #waitReady()} for
     * that.
     *
     * @return this stream
     * @throws StreamOpenException if the source could not start opening
     * @throws InterruptedIOException if interrupted while waiting
     */
    public SourceInputStream open() throws IOException {
        if (getEventLoop().isInEventLoop()) {
            openSource();
            return this;
        }

        CompletableFuture<Void> started = new CompletableFuture<>();
        getEventLoop().execute(() -> {
            try {
                openSource();
                started.complete(null);
            } catch (IOException | RuntimeException e) {
                started.completeExceptionally(e);
            }
        });

        try {
            started.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            InterruptedIOException iioe = new InterruptedIOException("Interrupted opening " + getSourceIdentifier());
            iioe.initCause(e);
            throw iioe;
        } catch (ExecutionException e) {
            close();
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioe) {
                throw ioe;
            }
            throw new StreamOpenException("Failed to open " + getSourceIdentifier(), cause);
        }
        return this;
    }

    private void openSource() throws StreamOpenException {
        log.debug("Opening {}", getSourceIdentifier());
        try {
            source.open(this);
        } catch (IOException | RuntimeException e) {
            throw new StreamOpenException("Failed to open " + getSourceIdentifier(), e);
        }
    }

    /**
     * Issues the next read request, unless one is outstanding or the buffer is
     * full.
     */
    private void doRead() {
        if (requested > 0 || reconnecting || failed || isDisposed() || !isOpen()) {
            return;
        }
        if (sourceSize >= 0 && nextOffset >= sourceSize) {
            log.debug("Reached the end of {} at {}", getSourceIdentifier(), nextOffset);
            setClosed();
            return;
        }

        final int space = getBufferSpace();
        if (space == 0) {
            pause();
            return;
        }

        long length = Math.min(chunkSize, space);
        if (sourceSize >= 0) {
            length = Math.min(length, sourceSize - nextOffset);
        }
        final int nbytes = (int) length;
        final long readOffset = nextOffset;
        requested = nbytes;
        log.trace("Requesting {} bytes at {} from {}", nbytes, readOffset, getSourceIdentifier());
        try {
            monitor.releaseWhileIO(() -> source.read(readOffset, nbytes));
        } catch (IOException | RuntimeException e) {
            requested = 0;
            postponeError(new StreamTransferException(
                    "Failed to request %d bytes at %d from %s".formatted(nbytes, readOffset, getSourceIdentifier()),
                    e));
        }
    }

    @Override
    public void onOpen(long size, boolean seekable) {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            if (isDisposed()) {
                return;
            }
            if (reconnecting) {
                log.debug("Reconnected {}, continuing at {}", getSourceIdentifier(), nextOffset);
                reconnecting = false;
                maskedError = null;
                doRead();
                return;
            }

            log.debug("Opened {}: size={}, seekable={}", getSourceIdentifier(), size, seekable);
            sourceSize = size < 0 ? -1 : size;
            setSize(sourceSize);
            setSeekable(seekable);
            nextOffset = 0;
            setReady();
            doRead();
        }
    }

    @Override
    public void onData(ByteBuffer data) {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            if (isDisposed() || failed) {
                return;
            }
            final int nbytes = data.remaining();
            if (requested == 0) {
                protocolViolation("Received %d unrequested bytes".formatted(nbytes));
                return;
            }
            if (nbytes > requested) {
                protocolViolation("Received %d bytes, requested %d".formatted(nbytes, requested));
                return;
            }
            requested = 0;

            if (nbytes == 0) {
                if (sourceSize >= 0 && nextOffset < sourceSize) {
                    protocolViolation("Premature end of data at %d, declared size %d".formatted(nextOffset, sourceSize));
                } else {
                    log.debug("End of data of {} at {}", getSourceIdentifier(), nextOffset);
                    setClosed();
                }
                return;
            }
            if (sourceSize >= 0 && nextOffset + nbytes > sourceSize) {
                protocolViolation("Received %d bytes at %d, past the declared size %d"
                        .formatted(nbytes, nextOffset, sourceSize));
                return;
            }

            log.trace("Received {} bytes at {} from {}", nbytes, nextOffset, getSourceIdentifier());
            appendToBuffer(data);
            nextOffset += nbytes;
            doRead();
        }
    }

    private void protocolViolation(String message) {
        log.error("Protocol violation on {}: {}", getSourceIdentifier(), message);
        failed = true;
        requested = 0;
        monitor.releaseWhile(source::cancelRead);
        setClosed();
        postponeError(new ProtocolViolationException(message + " from " + getSourceIdentifier()));
    }

    @Override
    public void onError(Throwable error) {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            if (isDisposed() || failed) {
                return;
            }
            requested = 0;

            if (reconnecting) {
                reconnecting = false;
                fail(new StreamTransferException("Reconnect to %s failed".formatted(getSourceIdentifier()), error));
                return;
            }

            if (isPaused()) {
                log.warn("Error on paused {}, reconnecting on resume: {}", getSourceIdentifier(), error.toString());
                maskedError = error instanceof IOException ioe ? ioe : new StreamTransferException(error.toString(), error);
                reconnectOnResume = true;
                return;
            }

            if (!isReady()) {
                fail(new StreamOpenException("Failed to open " + getSourceIdentifier(), error));
            } else {
                fail(new StreamTransferException(
                        "Failed to read %s at %d".formatted(getSourceIdentifier(), nextOffset), error));
            }
        }
    }

    private void fail(IOException error) {
        if (maskedError != null) {
            error.addSuppressed(maskedError);
            maskedError = null;
        }
        failed = true;
        setClosed();
        postponeError(error);
    }

    @Override
    protected void doResume() throws IOException {
        if (!reconnectOnResume) {
            doRead();
            return;
        }

        reconnectOnResume = false;
        reconnecting = true;
        log.debug("Reconnecting {} at {}", getSourceIdentifier(), nextOffset);
        try {
            monitor.releaseWhileIO(() -> {
                source.close();
                source.open(this);
            });
        } catch (IOException | RuntimeException e) {
            reconnecting = false;
            StreamTransferException error =
                    new StreamTransferException("Reconnect to %s failed".formatted(getSourceIdentifier()), e);
            if (maskedError != null) {
                error.addSuppressed(maskedError);
                maskedError = null;
            }
            failed = true;
            setClosed();
            throw error;
        }
    }

    @Override
    protected void doSeek(long newOffset) throws IOException {
        if (requested > 0) {
            requested = 0;
            monitor.releaseWhile(source::cancelRead);
        }
        nextOffset = newOffset;
        seekDone();
        if (failed) {
            setClosed();
            return;
        }
        doRead();
    }

    @Override
    protected void doClose() {
        requested = 0;
        log.debug("Closing source {}", getSourceIdentifier());
        monitor.releaseWhile(() -> {
            source.cancelRead();
            source.close();
        });
    }

    /**
     * @return the source feeding this stream
     */
    public AsyncSource getSource() {
        return source;
    }
}
