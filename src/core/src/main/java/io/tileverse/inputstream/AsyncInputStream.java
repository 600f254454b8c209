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
package io.tileverse.inputstream;

import static java.util.Objects.requireNonNull;

import io.tileverse.inputstream.event.DeferredTask;
import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.io.CircularByteBuffer;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class moving asynchronous (non-blocking) backends to an I/O thread.
 * <p>
 * Data is read on the {@link EventLoop} into a fixed-capacity ring buffer, and
 * that buffer is consumed by other threads through the blocking
 * {@link MediaInput} API.
 * <p>
 * <strong>Backpressure:</strong> subclasses call {@link #pause()} when
 * {@link #getBufferSpace()} drops to zero and stop issuing reads. Once a
 * consumer has drained the buffer so that more than {@code resumeAt} bytes are
 * free, {@link #doResume()} is scheduled on the I/O thread.
 * <p>
 * <strong>Seeking:</strong> {@link #seek(long)} hands the new offset to the
 * I/O thread, which discards the buffer and calls {@link #doSeek(long)}. The
 * subclass restarts its backend at that offset and calls {@link #seekDone()},
 * which releases the waiting consumer.
 * <p>
 * <strong>Errors:</strong> failures observed on the I/O thread are handed to
 * {@link #postponeError(Throwable)} and thrown from the next blocking consumer
 * call. A postponed error takes precedence over buffered data and is cleared
 * once thrown.
 * <p>
 * <strong>Thread Safety:</strong> all state is guarded by a single
 * {@link StreamMonitor}. Protected methods documented as "I/O thread" must be
 * called on the event loop with the monitor held.
 */
@Slf4j
public abstract class AsyncInputStream implements MediaInput {

    /** The lock and wakeup signal shared with subclasses. */
    protected final StreamMonitor monitor = new StreamMonitor();

    private final String sourceIdentifier;
    private final EventLoop eventLoop;
    private final DeferredTask deferredResume;
    private final DeferredTask deferredSeek;

    private final CircularByteBuffer buffer;
    private final int resumeAt;

    private SeekState seekState = SeekState.NONE;

    /** The latest seek target requested by a consumer. */
    private long seekOffset;

    /** The seek target handed to {@link #doSeek(long)}. */
    private long inFlightSeekOffset;

    /** {@code true} until the backend has no more data. */
    private boolean open = true;

    /**
     * Is the backend currently paused? That happens when the buffer is full.
     * It will be unpaused when enough buffer space is free again.
     */
    private boolean paused;

    private boolean ready;
    private boolean seekable;
    private boolean disposed;
    private long size = -1;
    private long offset;

    private IOException postponedError;

    /** The tag ready to be requested via {@link #readTag()}. */
    private Tag tag;

    private InputStreamHandler handler;

    /**
     * Creates a stream with its ring buffer.
     *
     * @param eventLoop the I/O thread feeding this stream
     * @param sourceIdentifier the identifier of the source, usually its URI
     * @param bufferCapacity the ring buffer size in bytes; one byte less is usable
     * @param resumeAt resume a paused backend once more than this many bytes are free
     * @throws IllegalArgumentException if {@code bufferCapacity < 2} or
     *         {@code resumeAt} is not within {@code [0, bufferCapacity)}
     */
    protected AsyncInputStream(EventLoop eventLoop, String sourceIdentifier, int bufferCapacity, int resumeAt) {
        this.eventLoop = requireNonNull(eventLoop, "eventLoop cannot be null");
        this.sourceIdentifier = requireNonNull(sourceIdentifier, "sourceIdentifier cannot be null");
        if (bufferCapacity < 2) {
            throw new IllegalArgumentException("bufferCapacity must be at least 2: " + bufferCapacity);
        }
        if (resumeAt < 0 || resumeAt >= bufferCapacity) {
            throw new IllegalArgumentException(
                    "resumeAt must be >= 0 and < bufferCapacity (%d): %d".formatted(bufferCapacity, resumeAt));
        }
        this.resumeAt = resumeAt;
        this.buffer = new CircularByteBuffer(new byte[bufferCapacity]);
        this.deferredResume = new DeferredTask(eventLoop, "resume " + sourceIdentifier, this::runDeferredResume);
        this.deferredSeek = new DeferredTask(eventLoop, "seek " + sourceIdentifier, this::runDeferredSeek);
    }

    /**
     * @return the I/O thread feeding this stream
     */
    public EventLoop getEventLoop() {
        return eventLoop;
    }

    @Override
    public String getSourceIdentifier() {
        return sourceIdentifier;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        requireNonNull(dst, "destination buffer cannot be null");
        checkNotInEventLoop();

        try (StreamMonitor.Guard guard = monitor.lock()) {
            if (!dst.hasRemaining()) {
                ensureNotDisposed();
                return 0;
            }

            // buffered bytes are not handed out while a seek is in flight,
            // they will be discarded by it
            monitor.waitWhile(() -> !disposed
                    && postponedError == null
                    && (seekState != SeekState.NONE || (buffer.isEmpty() && !isEndOfStream())));

            ensureNotDisposed();
            rethrowPostponedError();

            if (buffer.isEmpty()) {
                return -1;
            }

            final int nbytes = buffer.get(dst);
            offset += nbytes;

            if (paused && buffer.space() > resumeAt) {
                log.debug("Scheduling resume of {}: {} bytes free", sourceIdentifier, buffer.space());
                scheduleResume();
            }
            return nbytes;
        }
    }

    @Override
    public void seek(long newOffset) throws IOException {
        if (newOffset < 0) {
            throw new IllegalArgumentException("offset cannot be negative: " + newOffset);
        }
        checkNotInEventLoop();

        try (StreamMonitor.Guard guard = monitor.lock()) {
            monitor.waitWhile(() -> !ready && !disposed && postponedError == null);
            ensureNotDisposed();
            rethrowPostponedError();

            if (!seekable) {
                throw new IOException("Source is not seekable: " + sourceIdentifier);
            }

            if (seekState == SeekState.NONE) {
                if (newOffset == offset) {
                    return;
                }
                if (fastForward(newOffset)) {
                    return;
                }
            } else {
                log.debug("Seek to {} supersedes pending seek to {} on {}", newOffset, seekOffset, sourceIdentifier);
            }

            final long previousOffset = seekOffset;
            final SeekState previousState = seekState;
            seekOffset = newOffset;
            seekState = SeekState.SCHEDULED;
            try {
                deferredSeek.schedule();
            } catch (RejectedExecutionException e) {
                seekOffset = previousOffset;
                seekState = previousState;
                throw new StreamTransferException(
                        "Event loop rejected the seek of %s to %d".formatted(sourceIdentifier, newOffset), e);
            }

            monitor.waitWhile(() -> seekState != SeekState.NONE && !disposed);

            ensureNotDisposed();
            rethrowPostponedError();
        }
    }

    /**
     * Skips over buffered bytes when the target lies within the buffer.
     */
    private boolean fastForward(long newOffset) {
        if (newOffset < offset || newOffset - offset > buffer.size()) {
            return false;
        }
        long remaining = newOffset - offset;
        while (remaining > 0) {
            int n = (int) Math.min(remaining, buffer.readableLength());
            buffer.consume(n);
            remaining -= n;
        }
        log.trace("Fast-forwarded {} from {} to {}", sourceIdentifier, offset, newOffset);
        offset = newOffset;
        if (paused && buffer.space() > resumeAt) {
            scheduleResume();
        }
        return true;
    }

    /**
     * Consumer thread, monitor held. The bytes already handed out stay valid
     * when the loop has shut down, the source just stays paused.
     */
    private void scheduleResume() {
        try {
            deferredResume.schedule();
        } catch (RejectedExecutionException e) {
            log.warn("Event loop rejected the resume of {}, the source stays paused", sourceIdentifier);
        }
    }

    @Override
    public Optional<Tag> readTag() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            Tag result = tag;
            tag = null;
            return Optional.ofNullable(result);
        }
    }

    @Override
    public boolean isEOF() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            return isEndOfStream();
        }
    }

    private boolean isEndOfStream() {
        return (size >= 0 && offset >= size) || (!open && buffer.isEmpty());
    }

    @Override
    public boolean isAvailable() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            return ready;
        }
    }

    @Override
    public void waitReady() throws IOException {
        checkNotInEventLoop();
        try (StreamMonitor.Guard guard = monitor.lock()) {
            monitor.waitWhile(() -> !ready && !disposed && postponedError == null);
            ensureNotDisposed();
            rethrowPostponedError();
        }
    }

    @Override
    public void check() throws IOException {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            rethrowPostponedError();
        }
    }

    @Override
    public int available() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            return seekState == SeekState.NONE ? buffer.size() : 0;
        }
    }

    @Override
    public OptionalLong size() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            return size < 0 ? OptionalLong.empty() : OptionalLong.of(size);
        }
    }

    @Override
    public long offset() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            return seekState == SeekState.NONE ? offset : seekOffset;
        }
    }

    @Override
    public boolean isSeekable() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            return seekable;
        }
    }

    @Override
    public void setHandler(InputStreamHandler handler) {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            this.handler = handler;
        }
    }

    @Override
    public void close() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            if (disposed) {
                return;
            }
            disposed = true;
            deferredResume.cancel();
            deferredSeek.cancel();
            monitor.signalAll();
        }

        log.debug("Closing {}", sourceIdentifier);
        try {
            eventLoop.execute(this::runDeferredClose);
        } catch (RejectedExecutionException e) {
            // the loop is gone, nothing can race with the teardown anymore
            log.warn("Event loop rejected the teardown of {}, closing on {}", sourceIdentifier, Thread.currentThread());
            runDeferredClose();
        }
    }

    /**
     * I/O thread. Pass a tag to the consumer, replacing an unconsumed one.
     *
     * @param tag the new tag
     */
    protected void setTag(Tag tag) {
        this.tag = requireNonNull(tag, "tag cannot be null");
    }

    /**
     * I/O thread. Discards the unconsumed tag, if any.
     */
    protected void clearTag() {
        this.tag = null;
    }

    /**
     * I/O thread. Declares the total size of the source.
     *
     * @param size the size in bytes, negative if unknown
     */
    protected void setSize(long size) {
        this.size = size < 0 ? -1 : size;
    }

    /**
     * I/O thread.
     *
     * @param seekable whether the backend supports {@link #doSeek(long)}
     */
    protected void setSeekable(boolean seekable) {
        this.seekable = seekable;
    }

    /**
     * I/O thread. Declares that size and seekability are known and wakes up
     * consumers waiting for it.
     */
    protected void setReady() {
        if (ready) {
            return;
        }
        ready = true;
        if (handler != null) {
            handler.onInputStreamReady(this);
        }
        monitor.signalAll();
    }

    /**
     * @return {@code true} once {@link #setReady()} was called
     */
    protected boolean isReady() {
        return ready;
    }

    /**
     * I/O thread. Declares that the backend has no more data. Consumers
     * continue to be served from the buffer until it runs empty.
     */
    protected void setClosed() {
        open = false;
        invokeOnAvailable();
    }

    /**
     * @return {@code false} once {@link #setClosed()} was called
     */
    protected boolean isOpen() {
        return open;
    }

    /**
     * @return {@code true} once a consumer closed this stream
     */
    protected boolean isDisposed() {
        return disposed;
    }

    /**
     * @return {@code true} if no bytes are buffered
     */
    protected boolean isBufferEmpty() {
        return buffer.isEmpty();
    }

    /**
     * @return {@code true} if no more bytes can be appended
     */
    protected boolean isBufferFull() {
        return buffer.isFull();
    }

    /**
     * Determines how many bytes can be added to the buffer.
     *
     * @return the free buffer space in bytes
     */
    protected int getBufferSpace() {
        return buffer.space();
    }

    /**
     * I/O thread. Returns the next contiguous writable region of the buffer,
     * for backends that read in place. Call {@link #commitWriteBuffer(int)}
     * afterwards.
     *
     * @return a view of the write window
     */
    protected ByteBuffer prepareWriteBuffer() {
        return buffer.writeWindow();
    }

    /**
     * I/O thread. Commits bytes written to the window returned by
     * {@link #prepareWriteBuffer()} and wakes up consumers.
     *
     * @param nbytes the number of bytes written
     */
    protected void commitWriteBuffer(int nbytes) {
        buffer.append(nbytes);
        afterAppend();
    }

    /**
     * I/O thread. Appends data to the buffer and wakes up consumers. The data
     * must fit, see {@link #getBufferSpace()}.
     *
     * @param src the data, its position is advanced to its limit
     * @throws IllegalArgumentException if the data does not fit
     */
    protected void appendToBuffer(ByteBuffer src) {
        if (src.remaining() > buffer.space()) {
            throw new IllegalArgumentException(
                    "Chunk of %,d bytes exceeds buffer space of %,d".formatted(src.remaining(), buffer.space()));
        }
        buffer.put(src);
        afterAppend();
    }

    private void afterAppend() {
        if (!ready) {
            setReady();
        } else {
            invokeOnAvailable();
        }
    }

    /**
     * I/O thread. Stops the backend until consumers have drained the buffer.
     */
    protected void pause() {
        if (!paused) {
            log.debug("Pausing {}: buffer full", sourceIdentifier);
        }
        paused = true;
    }

    /**
     * @return {@code true} while the backend is paused
     */
    protected boolean isPaused() {
        return paused;
    }

    private void resume() throws IOException {
        if (paused) {
            paused = false;
            log.debug("Resuming {}", sourceIdentifier);
            doResume();
        }
    }

    /**
     * I/O thread. Resumes the backend after it was paused due to a full
     * buffer.
     *
     * @throws IOException to be postponed to the consumer
     */
    protected abstract void doResume() throws IOException;

    /**
     * I/O thread. The actual seek implementation. When the backend was
     * restarted at {@code newOffset}, call {@link #seekDone()}.
     *
     * @param newOffset the new offset
     * @throws IOException to be postponed to the consumer
     */
    protected abstract void doSeek(long newOffset) throws IOException;

    /**
     * I/O thread. Releases backend resources. Called once, after a consumer
     * closed this stream.
     */
    protected abstract void doClose();

    /**
     * @return {@code true} between the start of {@link #doSeek(long)} and {@link #seekDone()}
     */
    protected boolean isSeekPending() {
        return seekState == SeekState.PENDING;
    }

    /**
     * I/O thread. Call this after seeking has finished. Discards buffered data
     * and releases the waiting consumer, unless a newer seek was requested in
     * the meantime.
     */
    protected void seekDone() {
        if (seekState != SeekState.PENDING) {
            log.debug("Seek to {} on {} was superseded", inFlightSeekOffset, sourceIdentifier);
            return;
        }
        open = true;
        completeSeek();
    }

    private void completeSeek() {
        buffer.clear();
        offset = inFlightSeekOffset;
        seekState = SeekState.NONE;
        invokeOnAvailable();
    }

    /**
     * I/O thread. Keeps a failure for the next blocking consumer call and
     * wakes up the consumer: through the seek completion if a seek is pending,
     * through the ready transition if the stream is not ready yet, or through
     * the general wakeup otherwise.
     *
     * @param error the failure
     */
    protected void postponeError(Throwable error) {
        IOException e = toIOException(error);
        if (postponedError != null && postponedError != e) {
            log.debug("Dropping {} on {}, an earlier error is still pending", e, sourceIdentifier);
            postponedError.addSuppressed(e);
        } else {
            postponedError = e;
        }

        if (isSeekPending()) {
            // a failed seek does not reopen a stream the subclass has closed
            completeSeek();
        } else if (seekState == SeekState.SCHEDULED) {
            seekState = SeekState.NONE;
            invokeOnAvailable();
        } else if (!ready) {
            setReady();
        } else {
            invokeOnAvailable();
        }
    }

    private static IOException toIOException(Throwable error) {
        requireNonNull(error, "error cannot be null");
        if (error instanceof IOException ioe) {
            return ioe;
        }
        return new StreamTransferException(String.valueOf(error.getMessage()), error);
    }

    private void invokeOnAvailable() {
        if (handler != null) {
            handler.onInputStreamAvailable(this);
        }
        monitor.signalAll();
    }

    private void runDeferredResume() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            if (disposed) {
                return;
            }
            try {
                resume();
            } catch (IOException | RuntimeException e) {
                postponeError(e);
            }
        }
    }

    private void runDeferredSeek() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            if (seekState != SeekState.SCHEDULED || disposed) {
                return;
            }
            try {
                resume();

                seekState = SeekState.PENDING;
                inFlightSeekOffset = seekOffset;
                buffer.clear();
                paused = false;
                log.debug("Seeking {} to {}", sourceIdentifier, inFlightSeekOffset);
                doSeek(inFlightSeekOffset);
            } catch (IOException | RuntimeException e) {
                seekState = SeekState.NONE;
                postponeError(e);
            }
        }
    }

    private void runDeferredClose() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            doClose();
        } catch (RuntimeException e) {
            log.warn("Error closing {}", sourceIdentifier, e);
        }
    }

    private void rethrowPostponedError() throws IOException {
        if (postponedError != null) {
            IOException e = postponedError;
            postponedError = null;
            throw e;
        }
    }

    private void ensureNotDisposed() throws ClosedChannelException {
        if (disposed) {
            throw new ClosedChannelException();
        }
    }

    private void checkNotInEventLoop() {
        if (eventLoop.isInEventLoop()) {
            throw new IllegalStateException("Blocking call on the I/O thread of " + sourceIdentifier);
        }
    }

    /** For tests. */
    SeekState seekState() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            return seekState;
        }
    }

    @Override
    public String toString() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            return "%s[source=%s, offset=%d, size=%d, buffered=%d, open=%s, paused=%s, seek=%s]"
                    .formatted(
                            getClass().getSimpleName(),
                            sourceIdentifier,
                            offset,
                            size,
                            buffer.size(),
                            open,
                            paused,
                            seekState);
        }
    }
}
