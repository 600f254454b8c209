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
 * Progress of a seek request.
 * <pre>
 * NONE --seek()--&gt; SCHEDULED --deferred task--&gt; PENDING --seekDone()--&gt; NONE
 * </pre>
 * A seek arriving while PENDING moves the state back to SCHEDULED.
 */
enum SeekState {
    /** No seek in progress. */
    NONE,
    /** A consumer requested a seek, the I/O thread has not picked it up yet. */
    SCHEDULED,
    /** The backend was told to restart at the new offset. */
    PENDING
}
