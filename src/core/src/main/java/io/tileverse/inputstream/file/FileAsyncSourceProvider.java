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
package io.tileverse.inputstream.file;

import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.inputstream.source.AsyncSource;
import io.tileverse.inputstream.spi.AbstractAsyncSourceProvider;
import io.tileverse.inputstream.spi.AsyncSourceProvider;
import io.tileverse.inputstream.spi.InputStreamConfig;

/**
 * An {@link AsyncSourceProvider} for {@link FileAsyncSource}s reading from the
 * local file system.
 */
public class FileAsyncSourceProvider extends AbstractAsyncSourceProvider {

    /**
     * Key used as system property or environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_INPUTSTREAM_FILE=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_INPUTSTREAM_FILE";

    /**
     * This provider's {@link #getId() unique identifier}
     */
    public static final String ID = "file";

    public FileAsyncSourceProvider() {
        super();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public boolean isAvailable() {
        return AsyncSourceProvider.isEnabled(ENABLED_KEY);
    }

    @Override
    public String getDescription() {
        return "Streams files from the local file system.";
    }

    @Override
    public boolean canProcess(InputStreamConfig config) {
        return InputStreamConfig.matches(config, getId(), "file", null);
    }

    @Override
    protected AsyncSource createSource(InputStreamConfig config, EventLoop eventLoop) {
        return FileAsyncSource.builder().uri(config.uri()).eventLoop(eventLoop).build();
    }
}
