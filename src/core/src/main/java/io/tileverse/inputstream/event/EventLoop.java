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

import java.util.concurrent.Executor;

/**
 * The single-threaded cooperative loop that owns all backend state (the "I/O
 * thread").
 * <p>
 * Tasks submitted through {@link #execute(Runnable)} run strictly serialized,
 * in submission order, and never concurrently with each other. Every
 * {@link io.tileverse.inputstream.source.SourceListener SourceListener}
 * callback and every {@link DeferredTask} runs on this loop.
 * <p>
 * Implementations MUST make {@link #execute(Runnable)} callable from any thread.
 */
public interface EventLoop extends Executor {

    /**
     * Submits a task to run on the loop at the next opportunity.
     *
     * @param task the task to run
     * @throws java.util.concurrent.RejectedExecutionException if the loop was shut down
     */
    @Override
    void execute(Runnable task);

    /**
     * Tells whether the calling thread is the loop's thread.
     *
     * @return {@code true} when called from within a task running on this loop
     */
    boolean isInEventLoop();
}
