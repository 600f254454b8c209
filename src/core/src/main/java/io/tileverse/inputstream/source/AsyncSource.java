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

import java.io.IOException;

/**
 * A non-blocking backend delivering bytes through a {@link SourceListener}.
 * <p>
 * At most one read request is outstanding at any time. Results are delivered
 * on the I/O thread of the stream that drives the source, and never
 * re-entrantly from within {@link #open(SourceListener)} or
 * {@link #read(long, int)}.
 * <p>
 * A source may be re-opened after {@link #close()}, which is how a stream
 * reconnects after a failure.
 */
public interface AsyncSource {

    /**
     * @return the identifier of the backend resource, usually its URI
     */
    String getSourceIdentifier();

    /**
     * Starts opening the source. Completion is reported through
     * {@link SourceListener#onOpen(long, boolean)} or
     * {@link SourceListener#onError(Throwable)}.
     *
     * @param listener receives all further callbacks
     * @throws IOException if the source cannot even start opening
     */
    void open(SourceListener listener) throws IOException;

    /**
     * Requests up to {@code length} bytes starting at {@code offset}. Completion
     * is reported through {@link SourceListener#onData} or
     * {@link SourceListener#onError(Throwable)}.
     *
     * @param offset the absolute position of the first byte
     * @param length the maximum number of bytes, positive
     * @throws IOException if the request cannot be issued
     */
    void read(long offset, int length) throws IOException;

    /**
     * Cancels the outstanding read, if any. No callback for it is delivered
     * after this method returns.
     */
    void cancelRead();

    /**
     * Releases the backend resources. Pending requests are cancelled.
     */
    void close();
}
