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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * The lock and wakeup signal shared by the consumer threads and the I/O thread
 * of an {@link AsyncInputStream}.
 * <p>
 * There is one condition for every kind of wakeup (data, error, seek
 * completion, end of stream, close). Waiters re-check their own predicate,
 * so {@link #signalAll()} after every state change is enough to never lose a
 * wakeup.
 *
 * <pre>{@code
 * try (StreamMonitor.Guard guard = monitor.lock()) {
 *     monitor.waitWhile(() -> buffer.isEmpty() && open);
 *     ...
 * }
 * }</pre>
 */
public final class StreamMonitor {

    /**
     * A backend call made while the monitor is temporarily released.
     */
    @FunctionalInterface
    public interface IORunnable {
        /**
         * @throws IOException if the backend call fails
         */
        void run() throws IOException;
    }

    /**
     * Releases the monitor when closed.
     */
    public interface Guard extends AutoCloseable {
        @Override
        void close();
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Guard guard = lock::unlock;

    /**
     * Acquires the monitor.
     *
     * @return a guard releasing it, meant for try-with-resources
     */
    public Guard lock() {
        lock.lock();
        return guard;
    }

    /**
     * @return {@code true} if the calling thread owns the monitor
     */
    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * Blocks while {@code condition} holds. The monitor is released while
     * waiting and re-acquired before the condition is evaluated again.
     *
     * @param condition evaluated with the monitor held
     * @throws InterruptedIOException if the thread is interrupted while waiting;
     *         the interrupt flag is restored
     */
    public void waitWhile(BooleanSupplier condition) throws InterruptedIOException {
        checkHeld();
        while (condition.getAsBoolean()) {
            try {
                changed.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                InterruptedIOException iioe = new InterruptedIOException("Interrupted while waiting for the stream");
                iioe.initCause(e);
                throw iioe;
            }
        }
    }

    /**
     * Wakes up every waiting thread so it re-evaluates its condition.
     */
    public void signalAll() {
        checkHeld();
        changed.signalAll();
    }

    /**
     * Temporarily releases the monitor for the duration of a backend call.
     * <p>
     * Backends have their own internal locking and may call back into the
     * stream (e.g. when cancelling a request), so holding the stream's monitor
     * across such a call could deadlock. State observed before the call may
     * have changed when this method returns.
     *
     * @param action the backend call
     * @throws IOException if the backend call fails
     * @throws IllegalStateException if the monitor is not held exactly once
     */
    public void releaseWhileIO(IORunnable action) throws IOException {
        checkReleasable();
        lock.unlock();
        try {
            action.run();
        } finally {
            lock.lock();
        }
    }

    /**
     * Same as {@link #releaseWhileIO(IORunnable)} for backend calls that do not
     * throw checked exceptions.
     *
     * @param action the backend call
     */
    public void releaseWhile(Runnable action) {
        checkReleasable();
        lock.unlock();
        try {
            action.run();
        } finally {
            lock.lock();
        }
    }

    private void checkHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Monitor not held by " + Thread.currentThread().getName());
        }
    }

    private void checkReleasable() {
        checkHeld();
        if (lock.getHoldCount() != 1) {
            throw new IllegalStateException("Cannot release a monitor held " + lock.getHoldCount() + " times");
        }
    }
}
