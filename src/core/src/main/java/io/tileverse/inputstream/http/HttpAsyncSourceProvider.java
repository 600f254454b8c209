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

import static io.tileverse.inputstream.spi.InputStreamParameter.GROUP_HTTP;
import static io.tileverse.inputstream.spi.InputStreamParameter.SUBGROUP_AUTHENTICATION;

import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.inputstream.source.AsyncSource;
import io.tileverse.inputstream.spi.AbstractAsyncSourceProvider;
import io.tileverse.inputstream.spi.AsyncSourceProvider;
import io.tileverse.inputstream.spi.InputStreamConfig;
import io.tileverse.inputstream.spi.InputStreamParameter;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * An {@link AsyncSourceProvider} for {@link HttpAsyncSource}s reading from a
 * generic HTTP/HTTPS server that supports range requests.
 */
public class HttpAsyncSourceProvider extends AbstractAsyncSourceProvider {

    /**
     * Key used as system property or environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_INPUTSTREAM_HTTP=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_INPUTSTREAM_HTTP";

    /**
     * This provider's {@link #getId() unique identifier}
     */
    public static final String ID = "http";

    public static final InputStreamParameter<Integer> CONNECTION_TIMEOUT_MILLIS = InputStreamParameter.builder()
            .key("io.tileverse.inputstream.http.connection-timeout-millis")
            .title("HTTP connection timeout in milliseconds")
            .type(Integer.class)
            .group(GROUP_HTTP)
            .defaultValue((int) HttpAsyncSource.Builder.DEFAULT_CONNECTION_TIMEOUT.toMillis())
            .options(1_000, 5_000, 10_000, 30_000)
            .build();

    public static final InputStreamParameter<Boolean> TRUST_ALL_CERTIFICATES = InputStreamParameter.builder()
            .key("io.tileverse.inputstream.http.trust-all-certificates")
            .title("Trust all SSL certificates")
            .description("Accept self-signed or otherwise untrusted server certificates. Use for testing only.")
            .type(Boolean.class)
            .group(GROUP_HTTP)
            .defaultValue(false)
            .build();

    public static final InputStreamParameter<String> BEARER_TOKEN = InputStreamParameter.builder()
            .key("io.tileverse.inputstream.http.bearer-token")
            .title("Bearer token")
            .description("Sent as 'Authorization: Bearer <token>'. Takes precedence over username and password.")
            .type(String.class)
            .group(GROUP_HTTP)
            .subgroup(SUBGROUP_AUTHENTICATION)
            .build();

    public static final InputStreamParameter<String> USERNAME = InputStreamParameter.builder()
            .key("io.tileverse.inputstream.http.username")
            .title("HTTP Basic authentication user name")
            .type(String.class)
            .group(GROUP_HTTP)
            .subgroup(SUBGROUP_AUTHENTICATION)
            .build();

    public static final InputStreamParameter<String> PASSWORD = InputStreamParameter.builder()
            .key("io.tileverse.inputstream.http.password")
            .title("HTTP Basic authentication password")
            .type(String.class)
            .group(GROUP_HTTP)
            .subgroup(SUBGROUP_AUTHENTICATION)
            .build();

    public HttpAsyncSourceProvider() {
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
        return "Streams resources from an HTTP/HTTPS server supporting range requests.";
    }

    @Override
    protected List<InputStreamParameter<?>> buildParameters() {
        return List.of(CONNECTION_TIMEOUT_MILLIS, TRUST_ALL_CERTIFICATES, BEARER_TOKEN, USERNAME, PASSWORD);
    }

    @Override
    public boolean canProcess(InputStreamConfig config) {
        return InputStreamConfig.matches(config, getId(), "http", "https");
    }

    @Override
    protected AsyncSource createSource(InputStreamConfig config, EventLoop eventLoop) {
        HttpAsyncSource.Builder builder =
                HttpAsyncSource.builder(config.uri()).eventLoop(eventLoop);

        config.getParameter(CONNECTION_TIMEOUT_MILLIS).ifPresent(millis -> {
            if (millis <= 0) {
                throw new IllegalArgumentException(
                        "%s must be positive: %d".formatted(CONNECTION_TIMEOUT_MILLIS.key(), millis));
            }
            builder.connectionTimeout(Duration.ofMillis(millis));
        });
        if (config.getParameter(TRUST_ALL_CERTIFICATES).orElse(false)) {
            builder.trustAllCertificates();
        }

        Optional<String> token = config.getParameter(BEARER_TOKEN).filter(t -> !t.isBlank());
        Optional<String> username = config.getParameter(USERNAME).filter(u -> !u.isBlank());
        if (token.isPresent()) {
            builder.bearerToken(token.orElseThrow());
        } else if (username.isPresent()) {
            String password = config.getParameter(PASSWORD)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "%s requires %s".formatted(USERNAME.key(), PASSWORD.key())));
            builder.basicAuth(username.orElseThrow(), password);
        }
        return builder.build();
    }
}
