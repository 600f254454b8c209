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

import static java.util.Objects.requireNonNull;

import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.inputstream.source.AsyncSource;
import io.tileverse.inputstream.source.SourceListener;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * An {@link AsyncSource} reading from an HTTP(S) server using range requests.
 * <p>
 * {@link #open(SourceListener) Opening} sends a {@code HEAD} request to learn
 * the size of the resource, and fails unless the server announces
 * {@code Accept-Ranges: bytes}. Every read is a {@code GET} with a
 * {@code Range} header, answered with {@code 206 Partial Content}. A
 * {@code 416 Range Not Satisfiable} answer is reported as the end of the data.
 * <p>
 * Requests are sent with {@link HttpClient#sendAsync}, their completions are
 * re-posted to the {@link EventLoop}. Completions of cancelled requests are
 * dropped on the event loop.
 */
@Slf4j
public class HttpAsyncSource implements AsyncSource {

    private final URI uri;
    private final HttpClient httpClient;
    private final HttpAuthentication authentication;
    private final EventLoop eventLoop;

    private final AtomicLong generation = new AtomicLong();
    private volatile CompletableFuture<?> inFlight;
    private volatile SourceListener listener;

    HttpAsyncSource(
            @NonNull URI uri,
            @NonNull HttpClient httpClient,
            @NonNull HttpAuthentication authentication,
            @NonNull EventLoop eventLoop) {
        this.uri = uri;
        this.httpClient = httpClient;
        this.authentication = authentication;
        this.eventLoop = eventLoop;
    }

    @Override
    public String getSourceIdentifier() {
        return uri.toString();
    }

    @Override
    public void open(SourceListener listener) throws IOException {
        this.listener = requireNonNull(listener, "listener cannot be null");
        HttpRequest.Builder requestBuilder =
                HttpRequest.newBuilder().uri(uri).method("HEAD", HttpRequest.BodyPublishers.noBody());
        HttpRequest request = authentication.authenticate(httpClient, requestBuilder).build();

        final long requestGeneration = generation.get();
        CompletableFuture<HttpResponse<Void>> response =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        inFlight = response;
        response.whenComplete((head, error) -> deliver(requestGeneration, () -> onHeadResponse(head, error)));
    }

    private void onHeadResponse(HttpResponse<Void> response, Throwable error) {
        inFlight = null;
        if (error != null) {
            listener.onError(unwrap(error));
            return;
        }
        try {
            checkStatusCode(response, 200);
        } catch (IOException e) {
            listener.onError(e);
            return;
        }

        List<String> acceptRanges = response.headers().allValues("Accept-Ranges");
        if (acceptRanges.stream().map(String::toLowerCase).noneMatch("bytes"::equals)) {
            listener.onError(new IOException("Server does not support range requests for " + uri + ", Accept-Ranges: "
                    + acceptRanges));
            return;
        }

        long size = response.headers().firstValueAsLong("Content-Length").orElse(-1);
        if (size < 0) {
            log.warn("Content-Length unknown for {}", uri);
        }
        listener.onOpen(size, true);
    }

    @Override
    public void read(long offset, int length) throws IOException {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .GET()
                .uri(uri)
                .header("Range", "bytes=" + offset + "-" + (offset + length - 1));
        HttpRequest request = authentication.authenticate(httpClient, requestBuilder).build();

        final long start = System.nanoTime();
        final long requestGeneration = generation.get();
        CompletableFuture<HttpResponse<byte[]>> response =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        inFlight = response;
        response.whenComplete((range, error) -> deliver(requestGeneration, () -> {
            if (log.isTraceEnabled()) {
                long millis = Duration.ofNanos(System.nanoTime() - start).toMillis();
                log.trace("range:[{} +{}], time: {}ms", offset, length, millis);
            }
            onRangeResponse(range, error);
        }));
    }

    private void onRangeResponse(HttpResponse<byte[]> response, Throwable error) {
        inFlight = null;
        if (error != null) {
            listener.onError(unwrap(error));
            return;
        }
        if (response.statusCode() == 416) {
            listener.onData(ByteBuffer.allocate(0));
            return;
        }
        try {
            checkStatusCode(response, 206);
        } catch (IOException e) {
            listener.onError(e);
            return;
        }
        listener.onData(ByteBuffer.wrap(response.body()));
    }

    private void checkStatusCode(HttpResponse<?> response, int expected) throws IOException {
        int statusCode = response.statusCode();
        if (statusCode == 401 || statusCode == 403) {
            throw new IOException("Authentication failed for URI: " + uri + ", status code: " + statusCode);
        } else if (statusCode != expected) {
            throw new IOException("Unexpected response from URI: " + uri + ", status code: " + statusCode);
        }
    }

    private Throwable unwrap(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HttpConnectTimeoutException timeout) {
            String duration = httpClient
                    .connectTimeout()
                    .map(d -> d.toMillis() + " milliseconds")
                    .orElse("default timeout");
            IOException ex = new IOException("Connection timeout after " + duration + " to " + uri);
            ex.addSuppressed(timeout);
            return ex;
        }
        return cause;
    }

    private void deliver(long requestGeneration, Runnable callback) {
        try {
            eventLoop.execute(() -> {
                if (generation.get() == requestGeneration) {
                    callback.run();
                } else {
                    log.trace("Dropping cancelled response for {}", uri);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Event loop rejected response for {}: {}", uri, e.getMessage());
        }
    }

    @Override
    public void cancelRead() {
        generation.incrementAndGet();
        CompletableFuture<?> request = inFlight;
        inFlight = null;
        if (request != null) {
            request.cancel(true);
        }
    }

    @Override
    public void close() {
        cancelRead();
    }

    /**
     * @return the URI read by this source
     */
    public URI getUri() {
        return uri;
    }

    /**
     * @param uri the HTTP or HTTPS URI to read from
     * @param eventLoop the loop to deliver callbacks on
     * @return a new source with default settings
     */
    public static HttpAsyncSource of(URI uri, EventLoop eventLoop) {
        return builder(uri).eventLoop(eventLoop).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param uri the URI to pre configure the builder for
     * @return builder ready for uri
     */
    public static Builder builder(URI uri) {
        return new Builder().uri(uri);
    }

    /**
     * Builder for HttpAsyncSource.
     */
    public static class Builder {

        /**
         * The default connection timeout for the HTTP client.
         */
        public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(5);

        private URI uri;
        private EventLoop eventLoop;
        private boolean trustAllCertificates = false;
        private HttpAuthentication authentication = HttpAuthentication.NONE;
        private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        private HttpClient suppliedHttpClient;

        Builder() {}

        /**
         * @param uri the HTTP URI
         * @return this builder
         * @throws IllegalArgumentException if the scheme is not http or https
         */
        public Builder uri(URI uri) {
            requireNonNull(uri, "URI cannot be null");
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                throw new IllegalArgumentException("URI must have http or https scheme: " + uri);
            }
            this.uri = uri;
            return this;
        }

        public Builder eventLoop(EventLoop eventLoop) {
            this.eventLoop = requireNonNull(eventLoop, "eventLoop cannot be null");
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        /**
         * Enables trusting all SSL certificates.
         *
         * @return this builder
         */
        public Builder trustAllCertificates() {
            this.trustAllCertificates = true;
            return this;
        }

        public Builder authentication(HttpAuthentication authentication) {
            this.authentication = requireNonNull(authentication, "Authentication cannot be null");
            return this;
        }

        public Builder basicAuth(String username, String password) {
            return authentication(new BasicAuthentication(username, password));
        }

        public Builder bearerToken(String token) {
            return authentication(new BearerTokenAuthentication(token));
        }

        /**
         * Alternative to provide a pre-configured {@link HttpClient}.
         * @param client The {@link HttpClient} to use.
         * @return this
         */
        public Builder httpClient(HttpClient client) {
            this.suppliedHttpClient = client;
            return this;
        }

        public HttpAsyncSource build() {
            if (uri == null) {
                throw new IllegalStateException("URI must be set");
            }
            if (eventLoop == null) {
                throw new IllegalStateException("EventLoop must be set");
            }
            HttpClient httpClient = this.suppliedHttpClient;
            if (httpClient == null) {
                httpClient = buildClient();
            }
            return new HttpAsyncSource(uri, httpClient, authentication, eventLoop);
        }

        private HttpClient buildClient() {
            HttpClient.Builder httpClientBuilder = HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .sslContext(createSSLContext());
            if (connectionTimeout == null) {
                log.warn("No connection timeout set for {}", uri);
            } else {
                httpClientBuilder.connectTimeout(connectionTimeout);
            }
            return httpClientBuilder.build();
        }

        private SSLContext createSSLContext() {
            if (trustAllCertificates) {
                try {
                    return createTrustAllCertificatesContext();
                } catch (NoSuchAlgorithmException | KeyManagementException e) {
                    log.warn("Failed to create trust-all SSL context, falling back to default", e);
                }
            }
            try {
                return SSLContext.getDefault();
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(e);
            }
        }

        private SSLContext createTrustAllCertificatesContext() throws NoSuchAlgorithmException, KeyManagementException {
            TrustManager[] trustAllCerts = new TrustManager[] {
                new X509TrustManager() {
                    @Override
                    public X509Certificate[] getAcceptedIssuers() {
                        return new X509Certificate[0];
                    }

                    @Override
                    public void checkClientTrusted(X509Certificate[] certs, String authType) {
                        // Accept all
                    }

                    @Override
                    public void checkServerTrusted(X509Certificate[] certs, String authType) {
                        // Accept all
                    }
                }
            };
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, trustAllCerts, new SecureRandom());
            return sslContext;
        }
    }
}
