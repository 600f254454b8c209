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
package io.tileverse.inputstream.adapters;

import io.tileverse.inputstream.MediaInput;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * A {@link java.io.InputStream} view of a {@link MediaInput}, for APIs that
 * only accept the classic stream type. Closing the adapter closes the
 * underlying stream.
 */
public final class MediaInputStreamAdapter extends InputStream {

    private final MediaInput input;
    private final byte[] single = new byte[1];

    private MediaInputStreamAdapter(MediaInput input) {
        this.input = Objects.requireNonNull(input, "input cannot be null");
    }

    /**
     * @param input the stream to wrap
     * @return a new input stream view
     */
    public static MediaInputStreamAdapter of(MediaInput input) {
        return new MediaInputStreamAdapter(input);
    }

    @Override
    public int read() throws IOException {
        int n = input.read(single, 0, 1);
        return n < 0 ? -1 : single[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        return input.read(b, off, len);
    }

    @Override
    public long skip(long n) throws IOException {
        return input.skip(n);
    }

    @Override
    public int available() {
        return input.available();
    }

    @Override
    public void close() {
        input.close();
    }
}
