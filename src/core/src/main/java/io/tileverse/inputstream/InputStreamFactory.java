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

import static java.util.Objects.requireNonNull;

import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.inputstream.source.SourceInputStream;
import io.tileverse.inputstream.spi.AsyncSourceProvider;
import io.tileverse.inputstream.spi.InputStreamConfig;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link MediaInput} streams for URIs. The backend is selected among the
 * {@link AsyncSourceProvider}s registered through the Java Service Provider
 * Interface.
 */
public final class InputStreamFactory {

    private static final Logger logger = LoggerFactory.getLogger(InputStreamFactory.class);

    private InputStreamFactory() {
        // Private constructor to prevent instantiation of this utility class.
    }

    /**
     * Opens a stream for the given URI with the default configuration.
     *
     * @param uri The URI of the resource to read.
     * @param eventLoop The I/O thread driving the backend.
     * @return A stream that may not be {@link MediaInput#isAvailable() available} yet.
     * @throws IOException If the backend could not start opening.
     * @throws IllegalStateException If no suitable provider is found.
     */
    public static MediaInput open(URI uri, EventLoop eventLoop) throws IOException {
        return open(new InputStreamConfig().uri(requireNonNull(uri, "uri")), eventLoop);
    }

    /**
     * Opens a stream for the given URI and configuration properties.
     *
     * @param uri The URI of the resource to read.
     * @param config Additional configuration properties.
     * @param eventLoop The I/O thread driving the backend.
     * @return A stream that may not be {@link MediaInput#isAvailable() available} yet.
     * @throws IOException If the backend could not start opening.
     * @throws IllegalStateException If no suitable provider is found.
     */
    public static MediaInput open(URI uri, Properties config, EventLoop eventLoop) throws IOException {
        Properties properties = new Properties();
        properties.putAll(requireNonNull(config));
        properties.put(InputStreamConfig.URI_KEY, requireNonNull(uri));
        return open(InputStreamConfig.fromProperties(properties), eventLoop);
    }

    /**
     * Opens a stream using the best available provider for the given configuration.
     *
     * @param config The configuration, including the URI and optional provider ID.
     * @param eventLoop The I/O thread driving the backend.
     * @return A stream that may not be {@link MediaInput#isAvailable() available} yet.
     * @throws IOException If the backend could not start opening.
     * @throws IllegalArgumentException If a configuration value is invalid.
     * @throws IllegalStateException If no suitable provider is found.
     */
    public static MediaInput open(InputStreamConfig config, EventLoop eventLoop) throws IOException {
        requireNonNull(eventLoop, "eventLoop");
        AsyncSourceProvider provider = findBestProvider(requireNonNull(config, "config"));
        logger.debug("Opening {} with provider {}", config.uri(), provider.getId());
        SourceInputStream stream = provider.create(config, eventLoop);
        return stream.open();
    }

    /**
     * Opens a stream and waits until it is {@link MediaInput#isAvailable() available}.
     *
     * @param uri The URI of the resource to read.
     * @param eventLoop The I/O thread driving the backend.
     * @return A ready stream.
     * @throws IOException If opening the backend failed.
     */
    public static MediaInput openReady(URI uri, EventLoop eventLoop) throws IOException {
        return openReady(new InputStreamConfig().uri(requireNonNull(uri, "uri")), eventLoop);
    }

    /**
     * Opens a stream and waits until it is {@link MediaInput#isAvailable() available}.
     * The stream is closed if it fails to become ready.
     *
     * @param config The configuration, including the URI and optional provider ID.
     * @param eventLoop The I/O thread driving the backend.
     * @return A ready stream.
     * @throws IOException If opening the backend failed.
     */
    public static MediaInput openReady(InputStreamConfig config, EventLoop eventLoop) throws IOException {
        MediaInput input = open(config, eventLoop);
        try {
            input.waitReady();
        } catch (IOException | RuntimeException e) {
            input.close();
            throw e;
        }
        return input;
    }

    /**
     * Finds the provider for the given configuration:
     * <ol>
     *   <li>If a provider ID is set in the config, only that provider is considered.</li>
     *   <li>Otherwise the available providers that {@link AsyncSourceProvider#canProcess can process}
     *       the URI are candidates, and the one with the lowest {@link AsyncSourceProvider#getOrder() order}
     *       wins.</li>
     * </ol>
     *
     * @param config The configuration.
     * @return The selected provider.
     * @throws IllegalStateException If no suitable provider is found, or several have the same order.
     */
    public static AsyncSourceProvider findBestProvider(InputStreamConfig config) {
        final URI uri = requireNonNull(config.uri(), "config uri is null");

        if (config.providerId().isPresent()) {
            return AsyncSourceProvider.getProvider(config.providerId().orElseThrow(), true);
        }

        List<AsyncSourceProvider> candidates = AsyncSourceProvider.getAvailableProviders().stream()
                .filter(p -> p.canProcess(config))
                .toList();

        return switch (candidates.size()) {
            case 0 -> throw new IllegalStateException("No suitable provider found for URI: " + uri);
            case 1 -> candidates.get(0);
            default -> resolveByPriority(candidates);
        };
    }

    private static AsyncSourceProvider resolveByPriority(List<AsyncSourceProvider> candidates) {
        final int highestPriority = candidates.stream()
                .mapToInt(AsyncSourceProvider::getOrder)
                .min()
                .orElseThrow(() -> new IllegalStateException("No candidates to resolve by priority."));
        List<AsyncSourceProvider> bestCandidates = candidates.stream()
                .filter(p -> p.getOrder() == highestPriority)
                .toList();

        if (bestCandidates.size() > 1) {
            String conflictingIds =
                    bestCandidates.stream().map(AsyncSourceProvider::getId).collect(Collectors.joining(", "));
            throw new IllegalStateException("URI ambiguity detected. Multiple providers matched with the same priority ("
                    + highestPriority + "): [" + conflictingIds + "]. "
                    + "Please specify a provider ID in the InputStreamConfig to resolve this ambiguity.");
        }
        return bestCandidates.get(0);
    }
}
