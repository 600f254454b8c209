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
package io.tileverse.inputstream.adapters;

import io.tileverse.inputstream.MediaInput;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ReadableByteChannel;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link ReadableByteChannel} view of a {@link MediaInput}.
 * <p>
 * The channel has no position of its own: it reads from, and reports, the
 * read position of the stream. It does not take ownership of the stream,
 * closing the channel leaves the stream open.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try (ReadableByteChannel channel = MediaInputReadableByteChannel.of(input)) {
 *     ByteBuffer buffer = ByteBuffer.allocate(1024);
 *     int bytesRead = channel.read(buffer);
 * }
 * }</pre>
 */
public class MediaInputReadableByteChannel implements ReadableByteChannel {

    /** The wrapped stream. */
    protected final MediaInput input;

    /** Atomic flag indicating whether this channel is open. */
    protected final AtomicBoolean open = new AtomicBoolean(true);

    protected MediaInputReadableByteChannel(MediaInput input) {
        this.input = Objects.requireNonNull(input, "input cannot be null");
    }

    /**
     * @param input the stream to wrap
     * @return a new channel view
     */
    public static MediaInputReadableByteChannel of(MediaInput input) {
        return new MediaInputReadableByteChannel(input);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Blocks until at least one byte is buffered, the end of the stream is
     * reached, or a postponed failure of the stream is thrown.
     */
    @Override
    public int read(ByteBuffer dst) throws IOException {
        ensureOpen();
        Objects.requireNonNull(dst, "destination buffer cannot be null");
        return input.read(dst);
    }

    /**
     * @return the read position of the stream
     * @throws ClosedChannelException if this channel is closed
     */
    public long position() throws IOException {
        ensureOpen();
        return input.offset();
    }

    /**
     * @return the size of the stream in bytes, or {@code -1} if unknown
     * @throws ClosedChannelException if this channel is closed
     */
    public long size() throws IOException {
        ensureOpen();
        return input.size().orElse(-1L);
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    /**
     * Closes this channel, but not the underlying stream.
     */
    @Override
    public void close() {
        open.set(false);
    }

    /**
     * @return the wrapped stream
     * @throws ClosedChannelException if this channel is closed
     */
    public MediaInput getMediaInput() throws ClosedChannelException {
        ensureOpen();
        return input;
    }

    protected void ensureOpen() throws ClosedChannelException {
        if (!open.get()) {
            throw new ClosedChannelException();
        }
    }

    @Override
    public String toString() {
        if (!open.get()) {
            return getClass().getSimpleName() + "[closed]";
        }
        return "%s[source=%s, position=%d, size=%d]"
                .formatted(
                        getClass().getSimpleName(),
                        input.getSourceIdentifier(),
                        input.offset(),
                        input.size().orElse(-1L));
    }
}
