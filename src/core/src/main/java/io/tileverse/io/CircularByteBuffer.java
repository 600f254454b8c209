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
package io.tileverse.io;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A circular byte buffer over a caller-owned array.
 * <p>
 * This class does not manage memory. It never allocates or frees storage, it
 * only manages the contents of the array given to the constructor.
 * <p>
 * Everything between {@code head} and {@code tail} is valid data (it may wrap
 * around the physical end of the array). If both are equal the buffer is
 * empty. As a consequence the buffer is full when {@code capacity - 1} bytes
 * are stored; the last cell can never be used, and
 * {@code size() + space() == capacity() - 1} always holds.
 * <p>
 * The write and read "windows" are the contiguous regions that can be filled
 * or drained without wrapping. They may be shorter than {@link #space()} or
 * {@link #size()} when the region crosses the physical end of the array.
 * <p>
 * <strong>Thread Safety:</strong> This class is not thread-safe. Callers are
 * expected to guard it with their own lock.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * CircularByteBuffer buffer = new CircularByteBuffer(new byte[4096]);
 *
 * // producer side, fill the next contiguous window in place
 * int n = channel.read(buffer.writeWindow());
 * buffer.append(n);
 *
 * // consumer side
 * ByteBuffer window = buffer.readWindow();
 * int consumed = parse(window);
 * buffer.consume(consumed);
 * }</pre>
 */
public final class CircularByteBuffer {

    /** The next index to be read. */
    private int head;

    /** The next index to be written to. */
    private int tail;

    private final int capacity;

    private final byte[] data;

    /**
     * Creates a circular buffer managing the whole given array.
     *
     * @param data the backing storage, owned by the caller
     * @throws NullPointerException if data is null
     * @throws IllegalArgumentException if the array is shorter than 2 bytes
     */
    public CircularByteBuffer(byte[] data) {
        this.data = Objects.requireNonNull(data, "data cannot be null");
        if (data.length < 2) {
            throw new IllegalArgumentException("capacity must be at least 2: " + data.length);
        }
        this.capacity = data.length;
    }

    private int next(int i) {
        return i + 1 == capacity ? 0 : i + 1;
    }

    /**
     * Discards all buffered data.
     */
    public void clear() {
        head = tail = 0;
    }

    /**
     * @return the length of the backing array, one more than the usable capacity
     */
    public int capacity() {
        return capacity;
    }

    /**
     * @return {@code true} if no bytes are buffered
     */
    public boolean isEmpty() {
        return head == tail;
    }

    /**
     * @return {@code true} if no more bytes can be appended
     */
    public boolean isFull() {
        return next(tail) == head;
    }

    /**
     * Returns the number of bytes stored in this buffer.
     *
     * @return the buffered byte count
     */
    public int size() {
        return head <= tail ? tail - head : capacity - head + tail;
    }

    /**
     * Returns the number of bytes that can be added to this buffer.
     *
     * @return the free space in bytes
     */
    public int space() {
        // space = capacity - size - 1
        return (head <= tail ? capacity - tail + head : head - tail) - 1;
    }

    /**
     * @return the array index the next write window starts at
     */
    public int writeIndex() {
        checkIndices();
        return tail;
    }

    /**
     * Returns the length of the next contiguous writable window, starting at
     * {@link #writeIndex()}.
     *
     * @return the number of bytes that can be written without wrapping
     */
    public int writableLength() {
        checkIndices();
        // the "head == 0" term keeps the last cell unused, since a full
        // buffer with tail == capacity cannot be represented by head/tail
        final int end = tail < head ? head - 1 : capacity - (head == 0 ? 1 : 0);
        return end - tail;
    }

    /**
     * Prepares writing. Returns a view of the next writable window with its
     * position at zero and its limit at {@link #writableLength()}. When done,
     * call {@link #append(int)} with the number of bytes written.
     *
     * @return a heap buffer view sharing the backing array
     */
    public ByteBuffer writeWindow() {
        return ByteBuffer.wrap(data, writeIndex(), writableLength()).slice();
    }

    /**
     * Expands the tail of the buffer after data has been written to the
     * window returned by {@link #writeWindow()}.
     *
     * @param n the number of bytes written
     * @throws IllegalArgumentException if {@code n} exceeds the write window
     */
    public void append(int n) {
        checkIndices();
        if (n < 0 || n >= capacity || tail + n > capacity || (head > tail && tail + n >= head)) {
            throw new IllegalArgumentException(
                    "Cannot append %,d bytes: head=%d, tail=%d, capacity=%d".formatted(n, head, tail, capacity));
        }

        tail += n;

        if (tail == capacity) {
            if (head == 0) {
                throw new IllegalStateException("Tail wrapped onto head");
            }
            tail = 0;
        }
    }

    /**
     * @return the array index the next read window starts at
     */
    public int readIndex() {
        checkIndices();
        return head;
    }

    /**
     * Returns the length of the next contiguous readable window, starting at
     * {@link #readIndex()}.
     *
     * @return the number of bytes that can be read without wrapping
     */
    public int readableLength() {
        checkIndices();
        return (tail < head ? capacity : tail) - head;
    }

    /**
     * Returns a view of the next readable window. The buffer is writable to
     * allow modifications while parsing. When done, call {@link #consume(int)}.
     *
     * @return a heap buffer view sharing the backing array
     */
    public ByteBuffer readWindow() {
        return ByteBuffer.wrap(data, readIndex(), readableLength()).slice();
    }

    /**
     * Marks a chunk as consumed.
     *
     * @param n the number of bytes consumed from the read window
     * @throws IllegalArgumentException if {@code n} exceeds the read window
     */
    public void consume(int n) {
        checkIndices();
        if (n < 0 || n >= capacity || head + n > capacity || (tail >= head && head + n > tail)) {
            throw new IllegalArgumentException(
                    "Cannot consume %,d bytes: head=%d, tail=%d, capacity=%d".formatted(n, head, tail, capacity));
        }

        head += n;
        if (head == capacity) {
            head = 0;
        }
    }

    /**
     * Copies as many bytes from {@code src} as fit into this buffer, advancing
     * the position of {@code src}.
     *
     * @param src the bytes to append
     * @return the number of bytes appended
     */
    public int put(ByteBuffer src) {
        int total = 0;
        while (src.hasRemaining()) {
            final int n = Math.min(writableLength(), src.remaining());
            if (n == 0) {
                break;
            }
            src.get(data, tail, n);
            append(n);
            total += n;
        }
        return total;
    }

    /**
     * Moves as many buffered bytes as fit into {@code dst}, advancing its
     * position.
     *
     * @param dst the destination buffer
     * @return the number of bytes moved
     */
    public int get(ByteBuffer dst) {
        int total = 0;
        while (dst.hasRemaining()) {
            final int n = Math.min(readableLength(), dst.remaining());
            if (n == 0) {
                break;
            }
            dst.put(data, head, n);
            consume(n);
            total += n;
        }
        return total;
    }

    /**
     * Moves up to {@code length} buffered bytes into the given array.
     *
     * @param dst the destination array
     * @param offset the first index to write to
     * @param length the maximum number of bytes to move
     * @return the number of bytes moved
     */
    public int get(byte[] dst, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, dst.length);
        int total = 0;
        while (total < length) {
            final int n = Math.min(readableLength(), length - total);
            if (n == 0) {
                break;
            }
            System.arraycopy(data, head, dst, offset + total, n);
            consume(n);
            total += n;
        }
        return total;
    }

    private void checkIndices() {
        if (head >= capacity || tail >= capacity) {
            throw new IllegalStateException(
                    "Corrupt circular buffer: head=%d, tail=%d, capacity=%d".formatted(head, tail, capacity));
        }
    }

    @Override
    public String toString() {
        return "CircularByteBuffer[capacity=%d, head=%d, tail=%d, size=%d]".formatted(capacity, head, tail, size());
    }
}
