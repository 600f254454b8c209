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

import static java.util.Objects.requireNonNull;

import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.inputstream.source.AsyncSource;
import io.tileverse.inputstream.source.SourceInputStream;
import java.io.IOException;
import java.util.List;

/**
 * Base class for {@link AsyncSourceProvider} implementations. Adds the stream
 * buffer parameters to the provider's own, and wraps the {@link AsyncSource}
 * created by the subclass in a {@link SourceInputStream} configured with them.
 */
public abstract class AbstractAsyncSourceProvider implements AsyncSourceProvider {

    /**
     * Size of the read-ahead ring buffer in bytes.
     */
    public static final InputStreamParameter<Integer> BUFFER_CAPACITY = BufferingParameters.BUFFER_CAPACITY;

    /**
     * Free buffer space in bytes above which a paused backend is resumed.
     * Defaults to three quarters of the {@link #BUFFER_CAPACITY buffer capacity}.
     */
    public static final InputStreamParameter<Integer> RESUME_AT = BufferingParameters.RESUME_AT;

    /**
     * Maximum size of a single backend read in bytes.
     */
    public static final InputStreamParameter<Integer> CHUNK_SIZE = BufferingParameters.CHUNK_SIZE;

    private final List<InputStreamParameter<?>> params;

    protected AbstractAsyncSourceProvider() {
        this.params = List.copyOf(BufferingParameters.withBufferingParameters(buildParameters()));
    }

    @Override
    public final List<InputStreamParameter<?>> getParameters() {
        return params;
    }

    /**
     * Validates the buffer settings, creates the backend, and wraps it.
     *
     * @throws IllegalArgumentException If a buffer setting is invalid, before any backend is created.
     */
    @Override
    public final SourceInputStream create(InputStreamConfig config, EventLoop eventLoop) throws IOException {
        requireNonNull(config, "config");
        requireNonNull(eventLoop, "eventLoop");
        BufferingParameters.Settings settings = BufferingParameters.settings(config);
        AsyncSource source = createSource(config, eventLoop);
        return BufferingParameters.newStream(eventLoop, source, settings);
    }

    /**
     * Builds the list of parameters specific to the concrete provider.
     *
     * @return The provider-specific parameters.
     */
    protected List<InputStreamParameter<?>> buildParameters() {
        return List.of();
    }

    /**
     * Creates the backend for the given configuration.
     *
     * @param config The configuration containing the URI and other parameters.
     * @param eventLoop The I/O thread the backend delivers its callbacks on.
     * @return The backend, not opened yet.
     * @throws IOException If the backend cannot be created.
     */
    protected abstract AsyncSource createSource(InputStreamConfig config, EventLoop eventLoop) throws IOException;
}
