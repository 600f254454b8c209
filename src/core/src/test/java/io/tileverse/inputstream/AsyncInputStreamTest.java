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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import io.tileverse.inputstream.event.ManualEventLoop;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.List;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AsyncInputStreamTest {

    private ManualEventLoop loop;
    private TestStream stream;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        stream = new TestStream(loop, 64, 32);
    }

    /**
     * Exposes the I/O thread protocol to the test, which plays the I/O thread.
     */
    static class TestStream extends AsyncInputStream {

        final List<Long> seeks = new ArrayList<>();
        IOException seekFailure;
        boolean completeSeeks = true;
        int resumes;
        int closes;

        TestStream(ManualEventLoop loop, int capacity, int resumeAt) {
            super(loop, "test://stream", capacity, resumeAt);
        }

        void ready(long size, boolean seekable) {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                setSize(size);
                setSeekable(seekable);
                setReady();
            }
        }

        void append(byte[] data) {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                appendToBuffer(ByteBuffer.wrap(data));
            }
        }

        int space() {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                return getBufferSpace();
            }
        }

        void end() {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                setClosed();
            }
        }

        void error(Throwable e) {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                postponeError(e);
            }
        }

        void tag(Tag tag) {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                setTag(tag);
            }
        }

        void dropTag() {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                clearTag();
            }
        }

        void pauseNow() {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                pause();
            }
        }

        void fail(IOException e) {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                setClosed();
                postponeError(e);
            }
        }

        void finishSeek() {
            try (StreamMonitor.Guard guard = monitor.lock()) {
                seekDone();
            }
        }

        @Override
        protected void doResume() {
            resumes++;
        }

        @Override
        protected void doSeek(long newOffset) throws IOException {
            seeks.add(newOffset);
            if (seekFailure != null) {
                throw seekFailure;
            }
            if (completeSeeks) {
                seekDone();
            }
        }

        @Override
        protected void doClose() {
            closes++;
        }
    }

    private static byte[] bytes(int from, int count) {
        byte[] b = new byte[count];
        for (int i = 0; i < count; i++) {
            b[i] = (byte) (from + i);
        }
        return b;
    }

    private CompletableFuture<Void> seekAsync(long offset) {
        return CompletableFuture.runAsync(() -> {
            try {
                stream.seek(offset);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @Test
    void constructorValidatesBufferSettings() {
        assertThrows(IllegalArgumentException.class, () -> new TestStream(loop, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new TestStream(loop, 64, 64));
        assertThrows(IllegalArgumentException.class, () -> new TestStream(loop, 64, -1));
        assertThat(new TestStream(loop, 2, 1).space()).isEqualTo(1);
    }

    @Test
    void readReturnsBufferedBytesAndAdvancesOffset() throws IOException {
        stream.ready(100, true);
        stream.append(bytes(0, 10));

        assertThat(stream.available()).isEqualTo(10);
        ByteBuffer dst = ByteBuffer.allocate(4);
        assertThat(stream.read(dst)).isEqualTo(4);
        assertThat(dst.array()).containsExactly(bytes(0, 4));
        assertThat(stream.offset()).isEqualTo(4);
        assertThat(stream.available()).isEqualTo(6);
    }

    @Test
    void readIntoFullBufferReturnsZero() throws IOException {
        stream.ready(100, true);
        assertThat(stream.read(ByteBuffer.allocate(0))).isZero();
    }

    @Test
    void endOfStreamAfterDrain() throws IOException {
        stream.ready(-1, false);
        stream.append(bytes(0, 10));
        stream.end();

        assertThat(stream.isEOF()).isFalse();
        byte[] dst = new byte[20];
        assertThat(stream.read(dst, 0, 20)).isEqualTo(10);
        assertThat(stream.isEOF()).isTrue();
        assertThat(stream.read(dst, 0, 20)).isEqualTo(-1);
    }

    @Test
    void endOfStreamWhenKnownSizeReached() throws IOException {
        stream.ready(10, true);
        stream.append(bytes(0, 10));
        stream.read(ByteBuffer.allocate(10));

        assertThat(stream.isEOF()).isTrue();
        assertThat(stream.read(ByteBuffer.allocate(10))).isEqualTo(-1);
    }

    @Test
    void blockedReadIsWokenByData() throws Exception {
        stream.ready(-1, false);
        CompletableFuture<Integer> read = CompletableFuture.supplyAsync(() -> {
            try {
                return stream.read(ByteBuffer.allocate(16));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        await().during(100, TimeUnit.MILLISECONDS).until(() -> !read.isDone());

        stream.append(bytes(0, 5));
        assertThat(read.get(5, TimeUnit.SECONDS)).isEqualTo(5);
    }

    private CompletableFuture<Integer> readAsync(int length) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return stream.read(ByteBuffer.allocate(length));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @Test
    void blockedReadIsWokenByPostponedError() throws Exception {
        stream.ready(-1, false);
        CompletableFuture<Integer> read = readAsync(16);
        await().during(100, TimeUnit.MILLISECONDS).until(() -> !read.isDone());

        stream.error(new StreamTransferException("connection reset"));

        assertThatThrownBy(() -> read.get(5, TimeUnit.SECONDS))
                .hasRootCauseInstanceOf(StreamTransferException.class)
                .hasRootCauseMessage("connection reset");
    }

    @Test
    void blockedReadIsWokenBySourceEnd() throws Exception {
        stream.ready(-1, false);
        CompletableFuture<Integer> read = readAsync(16);
        await().during(100, TimeUnit.MILLISECONDS).until(() -> !read.isDone());

        stream.end();

        assertThat(read.get(5, TimeUnit.SECONDS)).isEqualTo(-1);
        assertThat(stream.isEOF()).isTrue();
    }

    @Test
    void postponedErrorTakesPrecedenceOverBufferedData() throws IOException {
        stream.ready(-1, false);
        stream.append(bytes(0, 10));
        stream.error(new StreamTransferException("connection reset"));

        assertThatThrownBy(() -> stream.read(ByteBuffer.allocate(10)))
                .isInstanceOf(StreamTransferException.class)
                .hasMessage("connection reset");
        // cleared once thrown
        assertThat(stream.read(ByteBuffer.allocate(10))).isEqualTo(10);
    }

    @Test
    void checkThrowsAndClearsPostponedError() throws IOException {
        stream.ready(-1, false);
        stream.error(new IOException("boom"));

        assertThatThrownBy(stream::check).hasMessage("boom");
        stream.check();
    }

    @Test
    void runtimeFailuresAreWrapped() {
        stream.ready(-1, false);
        stream.error(new IllegalStateException("bug"));

        assertThatThrownBy(stream::check)
                .isInstanceOf(StreamTransferException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void secondErrorIsSuppressedByFirst() {
        stream.ready(-1, false);
        IOException first = new IOException("first");
        IOException second = new IOException("second");
        stream.error(first);
        stream.error(second);

        assertThatThrownBy(stream::check).isSameAs(first);
        assertThat(first.getSuppressed()).containsExactly(second);
    }

    @Test
    void errorBeforeReadyWakesWaitReady() {
        stream.error(new StreamOpenException("refused", new IOException("refused")));

        assertThatThrownBy(stream::waitReady).isInstanceOf(StreamOpenException.class);
    }

    @Test
    void blockingCallsAreRejectedOnTheIOThread() {
        stream.ready(-1, true);
        assertThatThrownBy(() -> loop.runInLoop(() -> stream.read(ByteBuffer.allocate(1))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> loop.runInLoop(() -> stream.seek(1)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> loop.runInLoop(stream::waitReady)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void appendBeyondSpaceIsRejected() {
        stream.ready(-1, false);
        assertThatThrownBy(() -> stream.append(new byte[64])).isInstanceOf(IllegalArgumentException.class);
        stream.append(new byte[63]);
        assertThat(stream.space()).isZero();
    }

    @Test
    void zeroCopyWriteWindow() throws IOException {
        stream.ready(-1, false);
        try (StreamMonitor.Guard guard = stream.monitor.lock()) {
            ByteBuffer window = stream.prepareWriteBuffer();
            assertThat(window.remaining()).isEqualTo(63);
            window.put(bytes(7, 3));
            stream.commitWriteBuffer(3);
        }
        byte[] dst = new byte[3];
        assertThat(stream.read(dst, 0, 3)).isEqualTo(3);
        assertThat(dst).containsExactly(bytes(7, 3));
    }

    @Test
    void readScheduledResumeOnlyAboveWatermark() throws IOException {
        stream.ready(-1, false);
        stream.append(new byte[63]);
        stream.pauseNow();

        // 31 bytes drained: space 31, resumeAt 32
        stream.read(ByteBuffer.allocate(31));
        assertThat(loop.pendingCount()).isZero();

        stream.read(ByteBuffer.allocate(1));
        assertThat(loop.pendingCount()).isZero();

        stream.read(ByteBuffer.allocate(1));
        assertThat(loop.pendingCount()).isEqualTo(1);
        loop.runPending();
        assertThat(stream.resumes).isEqualTo(1);
    }

    @Test
    void resumeRequestsAreCoalesced() throws IOException {
        stream.ready(-1, false);
        stream.append(new byte[63]);
        stream.pauseNow();
        stream.read(ByteBuffer.allocate(40));
        stream.read(ByteBuffer.allocate(5));
        stream.read(ByteBuffer.allocate(5));

        assertThat(loop.runPending()).isEqualTo(1);
        assertThat(stream.resumes).isEqualTo(1);
    }

    @Test
    void tagIsASingleSlotHandoff() {
        Tag first = Tag.builder().add(TagType.TITLE, "first").build();
        Tag second = Tag.builder()
                .add(TagType.TITLE, "second")
                .add(TagType.ARTIST, "someone")
                .build();

        assertThat(stream.readTag()).isEmpty();
        stream.tag(first);
        stream.tag(second);
        assertThat(stream.readTag()).contains(second);
        assertThat(stream.readTag()).isEmpty();

        stream.tag(first);
        stream.dropTag();
        assertThat(stream.readTag()).isEmpty();
    }

    @Test
    void seekRejectsNegativeOffsetsAndUnseekableStreams() {
        stream.ready(100, false);
        assertThrows(IllegalArgumentException.class, () -> stream.seek(-1));
        assertThatThrownBy(() -> stream.seek(10)).isInstanceOf(IOException.class).hasMessageContaining("not seekable");
    }

    @Test
    void seekToCurrentOffsetIsANoOp() throws IOException {
        stream.ready(100, true);
        stream.seek(0);
        assertThat(loop.pendingCount()).isZero();
        assertThat(stream.seeks).isEmpty();
    }

    @Test
    void seekWithinBufferFastForwards() throws IOException {
        stream.ready(100, true);
        stream.append(bytes(0, 20));

        stream.seek(15);

        assertThat(loop.pendingCount()).isZero();
        assertThat(stream.offset()).isEqualTo(15);
        byte[] dst = new byte[5];
        assertThat(stream.read(dst, 0, 5)).isEqualTo(5);
        assertThat(dst).containsExactly(bytes(15, 5));
    }

    @Test
    void seekOutsideBufferDiscardsBufferedData() throws Exception {
        stream.ready(100, true);
        stream.append(bytes(0, 20));

        CompletableFuture<Void> seek = seekAsync(50);
        await().until(() -> stream.seekState() == SeekState.SCHEDULED);
        assertThat(stream.offset()).isEqualTo(50);
        assertThat(stream.available()).isZero();

        loop.runPending();
        seek.get(5, TimeUnit.SECONDS);

        assertThat(stream.seeks).containsExactly(50L);
        assertThat(stream.seekState()).isEqualTo(SeekState.NONE);
        assertThat(stream.offset()).isEqualTo(50);
        assertThat(stream.available()).isZero();

        stream.append(bytes(50, 5));
        byte[] dst = new byte[5];
        stream.read(dst, 0, 5);
        assertThat(dst).containsExactly(bytes(50, 5));
    }

    @Test
    void readWaitsWhileSeekIsPending() throws Exception {
        stream.ready(100, true);
        stream.completeSeeks = false;

        CompletableFuture<Void> seek = seekAsync(50);
        await().until(() -> stream.seekState() == SeekState.SCHEDULED);
        loop.runPending();
        assertThat(stream.seekState()).isEqualTo(SeekState.PENDING);

        CompletableFuture<Integer> read = CompletableFuture.supplyAsync(() -> {
            try {
                return stream.read(ByteBuffer.allocate(10));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        await().during(100, TimeUnit.MILLISECONDS).until(() -> !read.isDone() && !seek.isDone());

        stream.finishSeek();
        seek.get(5, TimeUnit.SECONDS);
        stream.append(bytes(50, 3));
        assertThat(read.get(5, TimeUnit.SECONDS)).isEqualTo(3);
    }

    @Test
    void concurrentSeeksLastWriterWins() throws Exception {
        stream.ready(100, true);

        CompletableFuture<Void> first = seekAsync(30);
        await().until(() -> stream.offset() == 30);
        CompletableFuture<Void> second = seekAsync(70);
        await().until(() -> stream.offset() == 70);

        assertThat(loop.runPending()).isEqualTo(1);
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        assertThat(stream.seeks).containsExactly(70L);
        assertThat(stream.offset()).isEqualTo(70);
    }

    @Test
    void seekArrivingWhilePendingRestartsAtNewestTarget() throws Exception {
        stream.ready(100, true);
        stream.completeSeeks = false;

        CompletableFuture<Void> first = seekAsync(30);
        await().until(() -> stream.seekState() == SeekState.SCHEDULED);
        loop.runPending();
        assertThat(stream.seekState()).isEqualTo(SeekState.PENDING);

        CompletableFuture<Void> second = seekAsync(80);
        await().until(() -> stream.seekState() == SeekState.SCHEDULED);

        // the superseded completion does not release anybody
        stream.finishSeek();
        assertThat(first).isNotDone();

        stream.completeSeeks = true;
        loop.runPending();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        assertThat(stream.seeks).containsExactly(30L, 80L);
        assertThat(stream.offset()).isEqualTo(80);
    }

    @Test
    void seekFailureIsThrownToTheSeeker() throws Exception {
        stream.ready(100, true);
        stream.seekFailure = new IOException("cannot seek");

        CompletableFuture<Void> seek = seekAsync(50);
        await().until(() -> stream.seekState() == SeekState.SCHEDULED);
        loop.runPending();

        assertThatThrownBy(() -> seek.get(5, TimeUnit.SECONDS))
                .hasRootCauseInstanceOf(IOException.class)
                .hasRootCauseMessage("cannot seek");
        assertThat(stream.seekState()).isEqualTo(SeekState.NONE);
    }

    @Test
    void failureDuringPendingSeekKeepsStreamClosed() throws Exception {
        stream.ready(100, true);
        stream.append(bytes(0, 20));
        stream.completeSeeks = false;

        CompletableFuture<Void> seek = seekAsync(50);
        await().until(() -> stream.seekState() == SeekState.SCHEDULED);
        loop.runPending();
        assertThat(stream.seekState()).isEqualTo(SeekState.PENDING);

        stream.fail(new StreamTransferException("gone"));

        assertThatThrownBy(() -> seek.get(5, TimeUnit.SECONDS)).hasRootCauseMessage("gone");
        assertThat(stream.seekState()).isEqualTo(SeekState.NONE);
        assertThat(stream.offset()).isEqualTo(50);
        int n = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> stream.read(ByteBuffer.allocate(10)));
        assertThat(n).isEqualTo(-1);
        assertThat(stream.isEOF()).isTrue();
    }

    @Test
    void seekRejectedByStoppedLoopLeavesStreamReadable() throws IOException {
        stream.ready(100, true);
        stream.append(bytes(0, 63));
        stream.pauseNow();
        loop.shutdown();

        assertThatThrownBy(() -> stream.seek(90))
                .isInstanceOf(StreamTransferException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(stream.seekState()).isEqualTo(SeekState.NONE);
        assertThat(stream.offset()).isZero();
        assertThat(stream.available()).isEqualTo(63);

        byte[] dst = new byte[63];
        int n = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> stream.read(dst, 0, 40));
        assertThat(n).isEqualTo(40);
        assertThat(stream.offset()).isEqualTo(40);
        assertThat(stream.read(dst, 40, 23)).isEqualTo(23);
        assertThat(dst).containsExactly(bytes(0, 63));
        assertThat(stream.resumes).isZero();
    }

    @Test
    void rejectedResumeDoesNotLoseReadBytes() throws IOException {
        stream.ready(-1, false);
        stream.append(bytes(0, 63));
        stream.pauseNow();
        loop.shutdown();

        byte[] dst = new byte[40];
        assertThat(stream.read(dst, 0, 40)).isEqualTo(40);
        assertThat(dst).containsExactly(bytes(0, 40));
        assertThat(stream.offset()).isEqualTo(40);
        assertThat(stream.available()).isEqualTo(23);

        // teardown runs on the caller once the loop is gone
        stream.close();
        assertThat(stream.closes).isEqualTo(1);
    }

    @Test
    void closeWakesBlockedReaders() throws Exception {
        stream.ready(-1, false);
        CompletableFuture<Integer> read = CompletableFuture.supplyAsync(() -> {
            try {
                return stream.read(ByteBuffer.allocate(16));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        await().during(100, TimeUnit.MILLISECONDS).until(() -> !read.isDone());

        stream.close();

        assertThatThrownBy(() -> read.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(UncheckedIOException.class)
                .hasRootCauseInstanceOf(ClosedChannelException.class);
        assertThat(stream.closes).isZero();
        loop.runPending();
        assertThat(stream.closes).isEqualTo(1);
    }

    @Test
    void closeWakesBlockedSeekers() throws Exception {
        stream.ready(100, true);
        stream.completeSeeks = false;
        CompletableFuture<Void> seek = seekAsync(50);
        await().until(() -> stream.seekState() == SeekState.SCHEDULED);

        stream.close();

        assertThatThrownBy(() -> seek.get(5, TimeUnit.SECONDS)).hasRootCauseInstanceOf(ClosedChannelException.class);
        // the cancelled seek never reaches the backend
        loop.runPending();
        assertThat(stream.seeks).isEmpty();
        assertThat(stream.closes).isEqualTo(1);
    }

    @Test
    void closeIsIdempotent() {
        stream.close();
        stream.close();
        loop.runPending();
        assertThat(stream.closes).isEqualTo(1);
        assertThatThrownBy(() -> stream.read(ByteBuffer.allocate(1))).isInstanceOf(ClosedChannelException.class);
    }

    @Test
    void handlerIsNotified() {
        List<String> events = new ArrayList<>();
        stream.setHandler(new InputStreamHandler() {
            @Override
            public void onInputStreamReady(MediaInput input) {
                events.add("ready");
            }

            @Override
            public void onInputStreamAvailable(MediaInput input) {
                events.add("available");
            }
        });

        stream.ready(10, true);
        stream.append(bytes(0, 2));
        stream.end();

        assertThat(events).containsExactly("ready", "available", "available");
    }
}
