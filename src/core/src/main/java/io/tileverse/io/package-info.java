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

/**
 * Low level byte buffering utilities.
 * <p>
 * {@link io.tileverse.io.CircularByteBuffer} is a fixed-capacity ring buffer over a
 * caller-owned array. It exposes its free and filled regions as contiguous windows,
 * so a producer can write into the buffer and a consumer can copy out of it without
 * intermediate copies:
 *
 * <pre>{@code
 * CircularByteBuffer buffer = new CircularByteBuffer(new byte[8192]);
 * ByteBuffer window = buffer.writeWindow();
 * int n = channel.read(window);
 * buffer.append(n);
 * }</pre>
 *
 * Instances are not thread-safe; callers serialize access themselves.
 *
 * @since 1.0
 */
package io.tileverse.io;
