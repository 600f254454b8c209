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
package io.tileverse.inputstream.source;

import static java.util.Objects.requireNonNull;

import io.tileverse.inputstream.event.EventLoop;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A scriptable {@link AsyncSource} serving a byte array. Callbacks are always
 * posted to the event loop. In {@link #autoRespond(boolean) auto-respond} mode
 * every open and read request is answered right away; otherwise the test
 * answers them with {@link #completeOpen}, {@link #respond()} and friends.
 */
public class FakeAsyncSource implements AsyncSource {

    public record ReadRequest(long offset, int length) {}

    private final EventLoop eventLoop;
    private final byte[] data;

    private boolean seekable = true;
    private boolean declareSize = true;
    private boolean autoRespond;
    private IOException failOpen;

    private SourceListener listener;
    private ReadRequest outstanding;

    private final List<ReadRequest> requests = new CopyOnWriteArrayList<>();
    private int openCount;
    private int closeCount;
    private int cancelCount;

    public FakeAsyncSource(EventLoop eventLoop, byte[] data) {
        this.eventLoop = requireNonNull(eventLoop);
        this.data = requireNonNull(data);
    }

    public synchronized FakeAsyncSource autoRespond(boolean autoRespond) {
        this.autoRespond = autoRespond;
        return this;
    }

    public synchronized FakeAsyncSource seekable(boolean seekable) {
        this.seekable = seekable;
        return this;
    }

    /** Report an unknown size, the end of the data is an empty chunk. */
    public synchronized FakeAsyncSource unknownSize() {
        this.declareSize = false;
        return this;
    }

    /** Make the next calls to {@link #open} fail synchronously. */
    public synchronized FakeAsyncSource failOpen(IOException error) {
        this.failOpen = error;
        return this;
    }

    @Override
    public String getSourceIdentifier() {
        return "fake://" + data.length;
    }

    @Override
    public synchronized void open(SourceListener listener) throws IOException {
        openCount++;
        if (failOpen != null) {
            throw failOpen;
        }
        this.listener = requireNonNull(listener);
        if (autoRespond) {
            completeOpen();
        }
    }

    @Override
    public synchronized void read(long offset, int length) {
        if (outstanding != null) {
            throw new IllegalStateException("read " + offset + " while " + outstanding + " is outstanding");
        }
        ReadRequest request = new ReadRequest(offset, length);
        outstanding = request;
        requests.add(request);
        if (autoRespond) {
            respond();
        }
    }

    @Override
    public synchronized void cancelRead() {
        cancelCount++;
        outstanding = null;
    }

    @Override
    public synchronized void close() {
        closeCount++;
        outstanding = null;
    }

    public synchronized void completeOpen() {
        final long size = declareSize ? data.length : -1;
        final boolean canSeek = seekable;
        final SourceListener target = listener;
        eventLoop.execute(() -> target.onOpen(size, canSeek));
    }

    /**
     * Answers the outstanding request with the requested slice of the data,
     * unless it is cancelled before the answer is delivered.
     */
    public synchronized void respond() {
        final ReadRequest request = requireNonNull(outstanding, "no outstanding request");
        final SourceListener target = listener;
        eventLoop.execute(() -> {
            ByteBuffer chunk;
            synchronized (this) {
                if (outstanding != request) {
                    return;
                }
                outstanding = null;
                int start = (int) Math.min(request.offset(), data.length);
                int end = (int) Math.min(request.offset() + request.length(), data.length);
                chunk = ByteBuffer.wrap(data, start, end - start).slice();
            }
            target.onData(chunk);
        });
    }

    /** Delivers arbitrary bytes, whether requested or not. */
    public synchronized void respondWith(byte[] bytes) {
        outstanding = null;
        final SourceListener target = listener;
        eventLoop.execute(() -> target.onData(ByteBuffer.wrap(bytes)));
    }

    /** Fails the outstanding open or read request. */
    public synchronized void fail(Throwable error) {
        outstanding = null;
        final SourceListener target = listener;
        eventLoop.execute(() -> target.onError(error));
    }

    public synchronized ReadRequest outstanding() {
        return outstanding;
    }

    public List<ReadRequest> requests() {
        return requests;
    }

    public synchronized int openCount() {
        return openCount;
    }

    public synchronized int closeCount() {
        return closeCount;
    }

    public synchronized int cancelCount() {
        return cancelCount;
    }

    public static byte[] testData(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) (i % 251);
        }
        return data;
    }
}
