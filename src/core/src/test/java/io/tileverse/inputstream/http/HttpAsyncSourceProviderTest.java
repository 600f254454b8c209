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
package io.tileverse.inputstream.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.inputstream.event.ManualEventLoop;
import io.tileverse.inputstream.source.SourceInputStream;
import io.tileverse.inputstream.spi.InputStreamConfig;
import java.io.IOException;
import java.net.URI;
import org.junit.jupiter.api.Test;

class HttpAsyncSourceProviderTest {

    private final HttpAsyncSourceProvider provider = new HttpAsyncSourceProvider();
    private final ManualEventLoop loop = new ManualEventLoop();

    @Test
    void testCanProcess() {
        assertThat(provider.canProcess(new InputStreamConfig().uri("http://example.com/a.mp3")))
                .isTrue();
        assertThat(provider.canProcess(new InputStreamConfig().uri("HTTPS://example.com/a.mp3")))
                .isTrue();
        assertThat(provider.canProcess(new InputStreamConfig().uri("file:///tmp/a.mp3")))
                .isFalse();
        assertThat(provider.canProcess(
                        new InputStreamConfig().uri("http://example.com/a.mp3").providerId("file")))
                .isFalse();
    }

    @Test
    void testParameters() {
        assertThat(provider.getParameters())
                .contains(
                        HttpAsyncSourceProvider.CONNECTION_TIMEOUT_MILLIS,
                        HttpAsyncSourceProvider.TRUST_ALL_CERTIFICATES,
                        HttpAsyncSourceProvider.BEARER_TOKEN,
                        HttpAsyncSourceProvider.USERNAME,
                        HttpAsyncSourceProvider.PASSWORD);
        assertThat(provider.getDefaultConfig().getParameter(HttpAsyncSourceProvider.CONNECTION_TIMEOUT_MILLIS))
                .contains(5000);
    }

    @Test
    void testCreate() throws IOException {
        URI uri = URI.create("https://example.com/radio.ogg");
        SourceInputStream stream = provider.create(uri, loop);

        assertThat(stream.getSource()).isInstanceOf(HttpAsyncSource.class);
        assertThat(stream.getSourceIdentifier()).isEqualTo(uri.toString());
        assertThat(loop.pendingCount()).isZero();
    }

    @Test
    void testInvalidConfig() {
        InputStreamConfig noPassword = provider.getDefaultConfig()
                .uri("http://example.com/a.mp3")
                .setParameter(HttpAsyncSourceProvider.USERNAME, "user");
        IllegalArgumentException e =
                assertThrows(IllegalArgumentException.class, () -> provider.create(noPassword, loop));
        assertThat(e).hasMessageContaining(HttpAsyncSourceProvider.PASSWORD.key());

        InputStreamConfig badTimeout = provider.getDefaultConfig()
                .uri("http://example.com/a.mp3")
                .setParameter(HttpAsyncSourceProvider.CONNECTION_TIMEOUT_MILLIS, 0);
        assertThrows(IllegalArgumentException.class, () -> provider.create(badTimeout, loop));
    }

    @Test
    void testAuthenticationFromConfig() throws IOException {
        InputStreamConfig config = provider.getDefaultConfig()
                .uri("http://example.com/a.mp3")
                .setParameter(HttpAsyncSourceProvider.BEARER_TOKEN, "token")
                .setParameter(HttpAsyncSourceProvider.USERNAME, "user");

        SourceInputStream stream = provider.create(config, loop);
        assertThat(stream.getSource()).isInstanceOf(HttpAsyncSource.class);
    }
}
