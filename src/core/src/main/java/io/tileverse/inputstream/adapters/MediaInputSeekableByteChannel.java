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
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;

/**
 * A read-only {@link SeekableByteChannel} view of a {@link MediaInput}.
 * Setting the {@link #position(long) position} seeks the stream.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try (SeekableByteChannel channel = input.asByteChannel()) {
 *     channel.position(1000);
 *     int bytesRead = channel.read(buffer);
 * }
 * }</pre>
 */
public final class MediaInputSeekableByteChannel extends MediaInputReadableByteChannel
        implements SeekableByteChannel {

    private MediaInputSeekableByteChannel(MediaInput input) {
        super(input);
    }

    /**
     * @param input the stream to wrap
     * @return a new channel view
     */
    public static MediaInputSeekableByteChannel of(MediaInput input) {
        return new MediaInputSeekableByteChannel(input);
    }

    /**
     * @throws NonWritableChannelException always, as this channel is read-only
     */
    @Override
    public int write(ByteBuffer src) throws IOException {
        throw new NonWritableChannelException();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Blocks until the stream was restarted at {@code newPosition}.
     *
     * @throws IllegalArgumentException if newPosition is negative
     * @throws IOException if the stream is not seekable or the seek fails
     */
    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        ensureOpen();
        if (newPosition < 0) {
            throw new IllegalArgumentException("position cannot be negative: " + newPosition);
        }
        input.seek(newPosition);
        return this;
    }

    /**
     * @throws NonWritableChannelException always, as this channel is read-only
     */
    @Override
    public SeekableByteChannel truncate(long size) throws IOException {
        throw new NonWritableChannelException();
    }
}
