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
package io.tileverse.inputstream.file;

import static java.util.Objects.requireNonNull;

import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.inputstream.source.AsyncSource;
import io.tileverse.inputstream.source.SourceListener;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousFileChannel;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.CompletionHandler;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * An {@link AsyncSource} reading a local file through an
 * {@link AsynchronousFileChannel}.
 * <p>
 * Completions arrive on the channel's own thread pool and are re-posted to the
 * {@link EventLoop}. Every {@link #cancelRead()} and {@link #close()} starts a
 * new generation; completions of an older generation are dropped on the event
 * loop, so none is delivered once {@code cancelRead()} has returned.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FileAsyncSource source = FileAsyncSource.of(Path.of("music/track.flac"), ioThread);
 * SourceInputStream input = new SourceInputStream(ioThread, source).open();
 * }</pre>
 */
@Slf4j
public class FileAsyncSource implements AsyncSource {

    private final Path path;
    private final EventLoop eventLoop;
    private final AtomicLong generation = new AtomicLong();

    private volatile AsynchronousFileChannel channel;
    private volatile SourceListener listener;

    /**
     * @param path the file to read
     * @param eventLoop the loop to deliver callbacks on
     */
    public FileAsyncSource(Path path, EventLoop eventLoop) {
        this.path = requireNonNull(path, "Path cannot be null");
        this.eventLoop = requireNonNull(eventLoop, "eventLoop cannot be null");
    }

    @Override
    public String getSourceIdentifier() {
        return path.toAbsolutePath().toString();
    }

    /**
     * Opens the channel synchronously, the file size is reported on the event
     * loop. Files are always seekable.
     *
     * @throws IOException if the file cannot be opened, e.g. it does not exist
     */
    @Override
    public void open(SourceListener listener) throws IOException {
        this.listener = requireNonNull(listener, "listener cannot be null");
        AsynchronousFileChannel ch = AsynchronousFileChannel.open(path, StandardOpenOption.READ);
        final long size;
        try {
            size = ch.size();
        } catch (IOException e) {
            ch.close();
            throw e;
        }
        this.channel = ch;
        log.debug("Opened {}, {} bytes", path, size);
        deliver(generation.get(), () -> listener.onOpen(size, true));
    }

    @Override
    public void read(long offset, int length) throws IOException {
        final AsynchronousFileChannel ch = channel;
        if (ch == null || !ch.isOpen()) {
            throw new ClosedChannelException();
        }
        final ByteBuffer target = ByteBuffer.allocate(length);
        ch.read(target, offset, generation.get(), new CompletionHandler<Integer, Long>() {
            @Override
            public void completed(Integer nbytes, Long requestGeneration) {
                deliver(requestGeneration, () -> {
                    if (nbytes < 0) {
                        listener.onData(ByteBuffer.allocate(0));
                    } else {
                        listener.onData(target.flip());
                    }
                });
            }

            @Override
            public void failed(Throwable exc, Long requestGeneration) {
                deliver(requestGeneration, () -> listener.onError(exc));
            }
        });
    }

    private void deliver(long requestGeneration, Runnable callback) {
        try {
            eventLoop.execute(() -> {
                if (generation.get() == requestGeneration) {
                    callback.run();
                } else {
                    log.trace("Dropping cancelled completion for {}", path);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Event loop rejected completion for {}: {}", path, e.getMessage());
        }
    }

    @Override
    public void cancelRead() {
        generation.incrementAndGet();
    }

    @Override
    public void close() {
        generation.incrementAndGet();
        AsynchronousFileChannel ch = channel;
        channel = null;
        if (ch != null) {
            try {
                ch.close();
            } catch (IOException e) {
                log.warn("Error closing {}", path, e);
            }
        }
    }

    /**
     * @return the file read by this source
     */
    public Path getPath() {
        return path;
    }

    /**
     * @param path the file path
     * @param eventLoop the loop to deliver callbacks on
     * @return a new source
     */
    public static FileAsyncSource of(Path path, EventLoop eventLoop) {
        return builder().path(path).eventLoop(eventLoop).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FileAsyncSource.
     */
    public static class Builder {
        private Path path;
        private EventLoop eventLoop;

        private Builder() {}

        public Builder path(Path path) {
            this.path = requireNonNull(path, "Path cannot be null");
            return this;
        }

        /**
         * Sets the file path from a URI. A URI without scheme is taken as a
         * {@code file:} URI.
         *
         * @param uri the file URI
         * @return this builder
         * @throws IllegalArgumentException if the URI does not denote a local file
         */
        public Builder uri(URI uri) {
            requireNonNull(uri, "URI cannot be null");
            if (null == uri.getScheme()) {
                uri = URI.create("file:" + uri);
            }
            try {
                this.path = Paths.get(uri);
            } catch (IllegalArgumentException | FileSystemNotFoundException ex) {
                throw new IllegalArgumentException(
                        "Unable to create source for URI %s: %s".formatted(uri, ex.getMessage()), ex);
            }
            return this;
        }

        public Builder eventLoop(EventLoop eventLoop) {
            this.eventLoop = requireNonNull(eventLoop, "eventLoop cannot be null");
            return this;
        }

        public FileAsyncSource build() {
            if (path == null) {
                throw new IllegalStateException("Path must be set");
            }
            if (eventLoop == null) {
                throw new IllegalStateException("EventLoop must be set");
            }
            return new FileAsyncSource(path, eventLoop);
        }
    }
}
