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

import java.nio.ByteBuffer;

/**
 * Receives the results of an {@link AsyncSource}.
 * <p>
 * All methods are called on the I/O thread, never from within
 * {@link AsyncSource#open(SourceListener)} or {@link AsyncSource#read(long, int)}.
 */
public interface SourceListener {

    /**
     * The source was opened.
     *
     * @param size the total size in bytes, negative if unknown
     * @param seekable whether reads may start at arbitrary offsets
     */
    void onOpen(long size, boolean seekable);

    /**
     * Data for the outstanding read request.
     *
     * @param data at most the requested number of bytes; an empty buffer
     *        signals the end of the data
     */
    void onData(ByteBuffer data);

    /**
     * The outstanding open or read request failed.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}
