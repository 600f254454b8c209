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

/**
 * Receives notifications about state changes of a {@link MediaInput}.
 * <p>
 * Methods are called on the I/O thread while the stream's lock is held. They
 * must return quickly and must not call any blocking method of the stream.
 */
public interface InputStreamHandler {

    /**
     * The stream became ready: its size and seekability are known, or opening
     * it failed.
     *
     * @param input the stream
     */
    void onInputStreamReady(MediaInput input);

    /**
     * New data, an error, or the end of the stream is available for reading.
     *
     * @param input the stream
     */
    void onInputStreamAvailable(MediaInput input);
}
