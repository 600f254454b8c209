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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class StreamMonitorTest {

    private final StreamMonitor monitor = new StreamMonitor();

    @Test
    void waiterIsWokenBySignal() throws Exception {
        AtomicBoolean flag = new AtomicBoolean(true);
        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                monitor.waitWhile(flag::get);
            } catch (InterruptedIOException e) {
                throw new IllegalStateException(e);
            }
        });
        await().during(100, TimeUnit.MILLISECONDS).until(() -> !waiter.isDone());

        try (StreamMonitor.Guard guard = monitor.lock()) {
            flag.set(false);
            monitor.signalAll();
        }
        waiter.get(5, TimeUnit.SECONDS);
    }

    @Test
    void waitReturnsImmediatelyWhenConditionIsFalse() throws IOException {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            monitor.waitWhile(() -> false);
            assertThat(monitor.isHeldByCurrentThread()).isTrue();
        }
        assertThat(monitor.isHeldByCurrentThread()).isFalse();
    }

    @Test
    void interruptedWaitThrowsAndKeepsInterruptFlag() throws Exception {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicBoolean interrupted = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                monitor.waitWhile(() -> true);
            } catch (InterruptedIOException e) {
                failure.set(e);
                interrupted.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        await().until(() -> waiter.getState() == Thread.State.WAITING);

        waiter.interrupt();
        waiter.join(5_000);

        assertThat(failure.get()).isInstanceOf(InterruptedIOException.class);
        assertThat(interrupted).isTrue();
    }

    @Test
    void operationsRequireTheMonitor() {
        assertThatThrownBy(monitor::signalAll).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> monitor.waitWhile(() -> true)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> monitor.releaseWhile(() -> {})).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void releaseWhileLetsOtherThreadsIn() throws Exception {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            monitor.releaseWhileIO(() -> {
                assertThat(monitor.isHeldByCurrentThread()).isFalse();
                CompletableFuture<Boolean> other = CompletableFuture.supplyAsync(() -> {
                    try (StreamMonitor.Guard g = monitor.lock()) {
                        return true;
                    }
                });
                assertThat(other.join()).isTrue();
            });
            assertThat(monitor.isHeldByCurrentThread()).isTrue();
        }
    }

    @Test
    void releaseWhileReacquiresOnFailure() {
        try (StreamMonitor.Guard guard = monitor.lock()) {
            assertThatThrownBy(() -> monitor.releaseWhileIO(() -> {
                        throw new IOException("backend failed");
                    }))
                    .hasMessage("backend failed");
            assertThat(monitor.isHeldByCurrentThread()).isTrue();
        }
    }

    @Test
    void releaseRequiresASingleHold() {
        try (StreamMonitor.Guard outer = monitor.lock();
                StreamMonitor.Guard inner = monitor.lock()) {
            assertThatThrownBy(() -> monitor.releaseWhile(() -> {}))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("2 times");
        }
        assertThat(monitor.isHeldByCurrentThread()).isFalse();
    }
}
