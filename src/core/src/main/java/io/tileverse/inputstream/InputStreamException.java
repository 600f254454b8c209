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

/**
 * Base class of the failures reported by a {@link MediaInput}.
 * <p>
 * Failures observed on the I/O thread are never thrown there. They are kept
 * in a single slot and thrown from the next blocking consumer call instead.
 */
public class InputStreamException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message the detail message
     */
    public InputStreamException(String message) {
        super(message);
    }

    /**
     * @param message the detail message
     * @param cause the underlying failure
     */
    public InputStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
