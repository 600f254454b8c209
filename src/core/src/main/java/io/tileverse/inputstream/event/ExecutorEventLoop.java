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
package io.tileverse.inputstream.event;

import static java.util.Objects.requireNonNull;

import java.io.Closeable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link EventLoop} backed by a single dedicated daemon thread.
 * <p>
 * Exceptions thrown by tasks are logged and do not terminate the loop.
 * {@link #close()} stops accepting tasks, lets already queued ones finish for
 * a short grace period, and then interrupts the thread.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try (ExecutorEventLoop ioThread = new ExecutorEventLoop("io")) {
 *     MediaInput input = InputStreamFactory.openReady(uri, ioThread);
 *     ...
 * }
 * }</pre>
 */
public class ExecutorEventLoop implements EventLoop, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorEventLoop.class);

    /** How long {@link #close()} waits for queued tasks. */
    public static final long SHUTDOWN_GRACE_MILLIS = 2_000;

    private final String name;
    private final ExecutorService executor;

    private volatile Thread thread;

    /**
     * Creates and starts a new loop.
     *
     * @param name the name of the loop thread
     */
    public ExecutorEventLoop(String name) {
        this.name = requireNonNull(name, "name cannot be null");
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, name);
            t.setDaemon(true);
            this.thread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        requireNonNull(task, "task cannot be null");
        executor.execute(() -> runSafely(task));
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.error("Uncaught exception in event loop {}", name, e);
        }
    }

    @Override
    public boolean isInEventLoop() {
        return Thread.currentThread() == thread;
    }

    /**
     * @return {@code true} once {@link #close()} was called
     */
    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdown();
        if (isInEventLoop()) {
            return;
        }
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                logger.warn("Event loop {} did not drain in {}ms, interrupting it", name, SHUTDOWN_GRACE_MILLIS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public String toString() {
        return "ExecutorEventLoop[" + name + "]";
    }
}
