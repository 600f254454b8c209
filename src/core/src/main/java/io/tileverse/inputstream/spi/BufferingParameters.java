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
package io.tileverse.inputstream.spi;

import static io.tileverse.inputstream.spi.InputStreamParameter.GROUP_BUFFERING;

import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.inputstream.source.AsyncSource;
import io.tileverse.inputstream.source.SourceInputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Stream buffer parameters shared by all providers, and the creation of the
 * {@link SourceInputStream} wrapping a provider's {@link AsyncSource}.
 */
final class BufferingParameters {

    static final InputStreamParameter<Integer> BUFFER_CAPACITY = InputStreamParameter.builder()
            .key("io.tileverse.inputstream.buffer-capacity")
            .title("Read-ahead buffer size in bytes")
            .description(
                    """
                    Size of the ring buffer the I/O thread fills ahead of the consumer. \
                    One byte of it is never used.
                    """)
            .type(Integer.class)
            .group(GROUP_BUFFERING)
            .defaultValue(SourceInputStream.DEFAULT_BUFFER_CAPACITY)
            .options(64 * 1024, 256 * 1024, 512 * 1024, 1024 * 1024, 4 * 1024 * 1024)
            .build();

    static final InputStreamParameter<Integer> RESUME_AT = InputStreamParameter.builder()
            .key("io.tileverse.inputstream.resume-at")
            .title("Free buffer space at which reading resumes")
            .description(
                    """
                    When the buffer is full the backend is paused. It is resumed once consumers \
                    have drained the buffer so that more than this many bytes are free. \
                    Must be less than the buffer capacity, defaults to three quarters of it.
                    """)
            .type(Integer.class)
            .group(GROUP_BUFFERING)
            .build();

    static final InputStreamParameter<Integer> CHUNK_SIZE = InputStreamParameter.builder()
            .key("io.tileverse.inputstream.chunk-size")
            .title("Maximum size of a single backend read in bytes")
            .type(Integer.class)
            .group(GROUP_BUFFERING)
            .defaultValue(SourceInputStream.DEFAULT_CHUNK_SIZE)
            .options(8 * 1024, 16 * 1024, 32 * 1024, 64 * 1024, 128 * 1024)
            .build();

    private static final List<InputStreamParameter<?>> PARAMS = List.of(BUFFER_CAPACITY, RESUME_AT, CHUNK_SIZE);

    private BufferingParameters() {}

    static List<InputStreamParameter<?>> withBufferingParameters(List<InputStreamParameter<?>> params) {
        List<InputStreamParameter<?>> all = new ArrayList<>(PARAMS);
        all.addAll(params);
        return all;
    }

    /**
     * Resolved buffer settings.
     */
    record Settings(int bufferCapacity, int resumeAt, int chunkSize) {}

    /**
     * Reads and validates the buffer settings of {@code config}, falling back
     * to the defaults for missing values.
     *
     * @throws IllegalArgumentException if a value is invalid
     */
    static Settings settings(InputStreamConfig config) {
        int capacity = config.getParameter(BUFFER_CAPACITY).orElse(SourceInputStream.DEFAULT_BUFFER_CAPACITY);
        if (capacity < 2) {
            throw new IllegalArgumentException("%s must be at least 2: %d".formatted(BUFFER_CAPACITY.key(), capacity));
        }
        int resumeAt = config.getParameter(RESUME_AT).orElse((int) (capacity * 3L / 4));
        if (resumeAt < 0 || resumeAt >= capacity) {
            throw new IllegalArgumentException("%s must be >= 0 and < %s (%d): %d"
                    .formatted(RESUME_AT.key(), BUFFER_CAPACITY.key(), capacity, resumeAt));
        }
        int chunkSize = config.getParameter(CHUNK_SIZE).orElse(SourceInputStream.DEFAULT_CHUNK_SIZE);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("%s must be positive: %d".formatted(CHUNK_SIZE.key(), chunkSize));
        }
        return new Settings(capacity, resumeAt, chunkSize);
    }

    static SourceInputStream newStream(EventLoop eventLoop, AsyncSource source, Settings settings) {
        return new SourceInputStream(
                eventLoop, source, settings.bufferCapacity(), settings.resumeAt(), settings.chunkSize());
    }
}
