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

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * A callback that runs once, later, on an {@link EventLoop}.
 * <p>
 * {@link #schedule()} may be called from any thread. Redundant schedule
 * requests issued while a run is already pending are coalesced into that
 * single run. A request issued while the task is running (or after it ran)
 * schedules a new run.
 * <p>
 * {@link #cancel()} drops a pending run; it does not interrupt a run that has
 * already started.
 */
@Slf4j
public final class DeferredTask {

    private final EventLoop eventLoop;
    private final String name;
    private final Runnable callback;

    private final AtomicBoolean pending = new AtomicBoolean();

    /**
     * @param eventLoop the loop to run the callback on
     * @param name a short name used in log messages
     * @param callback the code to run
     */
    public DeferredTask(EventLoop eventLoop, String name, Runnable callback) {
        this.eventLoop = requireNonNull(eventLoop, "eventLoop cannot be null");
        this.name = requireNonNull(name, "name cannot be null");
        this.callback = requireNonNull(callback, "callback cannot be null");
    }

    /**
     * @return the loop this task runs on
     */
    public EventLoop getEventLoop() {
        return eventLoop;
    }

    /**
     * Requests a run of the callback on the loop.
     *
     * @return {@code true} if this call submitted a new run, {@code false} if it
     *         was coalesced into a pending one
     * @throws RejectedExecutionException if the loop no longer accepts tasks;
     *         the task is then not pending
     */
    public boolean schedule() {
        if (!pending.compareAndSet(false, true)) {
            log.trace("{} already pending", name);
            return false;
        }
        try {
            eventLoop.execute(this::run);
        } catch (RejectedExecutionException e) {
            pending.set(false);
            throw e;
        }
        return true;
    }

    /**
     * Drops the pending run, if any.
     */
    public void cancel() {
        pending.set(false);
    }

    /**
     * @return {@code true} if a run was scheduled and has not started yet
     */
    public boolean isPending() {
        return pending.get();
    }

    private void run() {
        // a cancelled run still sits in the loop's queue, skip it
        if (!pending.compareAndSet(true, false)) {
            return;
        }
        callback.run();
    }

    @Override
    public String toString() {
        return "DeferredTask[" + name + (pending.get() ? ", pending]" : "]");
    }
}
