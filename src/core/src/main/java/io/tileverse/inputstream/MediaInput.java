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

import io.tileverse.inputstream.adapters.MediaInputSeekableByteChannel;
import io.tileverse.inputstream.adapters.MediaInputStreamAdapter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A pull-based byte stream fed asynchronously by a file or network backend.
 * <p>
 * Consumers read synchronously: {@link #read(ByteBuffer)} and
 * {@link #seek(long)} block the calling thread until data, an error, the end
 * of the stream, or the seek completion is available, while the backend keeps
 * running on its own I/O thread.
 * <p>
 * Failures of the backend are not reported when they happen, they are thrown
 * from the next blocking call that observes them.
 * <p>
 * Implementations MUST be thread-safe. Blocking methods MUST NOT be called
 * from the I/O thread that feeds the stream.
 */
public interface MediaInput extends Closeable {

    /**
     * Reads buffered bytes into {@code dst}, blocking until at least one byte,
     * an error, or the end of the stream is available.
     *
     * @param dst the destination buffer, its position is advanced by the bytes read
     * @return the number of bytes read, {@code 0} if {@code dst} has no remaining
     *         room, or {@code -1} at the end of the stream
     * @throws IOException a postponed backend failure, or if the stream was closed
     */
    int read(ByteBuffer dst) throws IOException;

    /**
     * Reads buffered bytes into an array.
     *
     * @param dst the destination array
     * @param offset the first index to write to
     * @param length the maximum number of bytes to read
     * @return the number of bytes read, or {@code -1} at the end of the stream
     * @throws IOException a postponed backend failure, or if the stream was closed
     * @see #read(ByteBuffer)
     */
    default int read(byte[] dst, int offset, int length) throws IOException {
        return read(ByteBuffer.wrap(dst, offset, length));
    }

    /**
     * Moves the read position, blocking until the backend has been restarted
     * at the new position. No byte preceding the new position is returned by
     * a later {@link #read(ByteBuffer)}.
     *
     * @param offset the new absolute position
     * @throws IOException if the stream is not seekable, the seek fails, or the
     *         stream was closed
     * @throws IllegalArgumentException if offset is negative
     */
    void seek(long offset) throws IOException;

    /**
     * Returns and clears the latest metadata snapshot. Does not block.
     *
     * @return the pending tag, or empty
     */
    Optional<Tag> readTag();

    /**
     * @return {@code true} once the stream was drained and the backend has no more data
     */
    boolean isEOF();

    /**
     * @return {@code true} once the backend reported size and seekability
     */
    boolean isAvailable();

    /**
     * Blocks until the stream is {@link #isAvailable() available}.
     *
     * @throws IOException if opening the backend failed, or the stream was closed
     */
    void waitReady() throws IOException;

    /**
     * Throws a postponed failure, if any, without reading.
     *
     * @throws IOException the postponed failure
     */
    void check() throws IOException;

    /**
     * @return the number of bytes that can be read without blocking
     */
    int available();

    /**
     * @return the total size of the source, or empty if unknown or not ready yet
     */
    OptionalLong size();

    /**
     * @return the absolute position of the next byte to be read
     */
    long offset();

    /**
     * @return {@code true} if {@link #seek(long)} is supported
     */
    boolean isSeekable();

    /**
     * @return the identifier of the source, usually its URI
     */
    String getSourceIdentifier();

    /**
     * Installs a handler notified about readiness and availability changes.
     *
     * @param handler the handler, or {@code null} to remove it
     */
    void setHandler(InputStreamHandler handler);

    /**
     * Skips {@code n} bytes, seeking when possible and reading them otherwise.
     *
     * @param n the number of bytes to skip
     * @return the number of bytes actually skipped, less than {@code n} at the end of the stream
     * @throws IOException if seeking or reading fails
     */
    default long skip(long n) throws IOException {
        if (n <= 0) {
            return 0;
        }
        final long start = offset();
        if (isSeekable()) {
            OptionalLong size = size();
            long target = size.isPresent() ? Math.min(start + n, size.getAsLong()) : start + n;
            seek(target);
            return target - start;
        }
        ByteBuffer discard = ByteBuffer.allocate((int) Math.min(n, 8192));
        long skipped = 0;
        while (skipped < n) {
            discard.clear().limit((int) Math.min(discard.capacity(), n - skipped));
            int read = read(discard);
            if (read < 0) {
                break;
            }
            skipped += read;
        }
        return skipped;
    }

    /**
     * Seeks back to the start of the stream.
     *
     * @throws IOException if the stream is not seekable or the seek fails
     */
    default void rewind() throws IOException {
        seek(0);
    }

    /**
     * Closes this stream. Blocked consumers are woken up and fail; backend
     * teardown happens asynchronously on the I/O thread. Idempotent.
     */
    @Override
    void close();

    /**
     * Returns a {@link SeekableByteChannel} view of this stream. The channel
     * shares the read position of the stream and does not close it.
     *
     * @return a channel view
     */
    default SeekableByteChannel asByteChannel() {
        return MediaInputSeekableByteChannel.of(this);
    }

    /**
     * Returns an {@link InputStream} view of this stream. Closing the returned
     * stream closes this one.
     *
     * @return an input stream view
     */
    default InputStream asInputStream() {
        return MediaInputStreamAdapter.of(this);
    }
}
