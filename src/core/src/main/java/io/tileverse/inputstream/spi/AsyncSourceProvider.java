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
package io.tileverse.inputstream.spi;

import io.tileverse.inputstream.event.EventLoop;
import io.tileverse.inputstream.source.AsyncSource;
import io.tileverse.inputstream.source.SourceInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Stream;

/**
 * Service Provider Interface (SPI) for creating {@link AsyncSource} backends
 * and the streams reading them. Implementations are discovered at runtime using
 * {@link ServiceLoader}.
 */
public interface AsyncSourceProvider {

    /**
     * @return The unique ID of this provider.
     */
    String getId();

    /**
     * @return A human-readable description of this provider.
     */
    String getDescription();

    /**
     * Checks if this provider is enabled in the current environment.
     *
     * @return {@code true} if available, {@code false} otherwise.
     */
    boolean isAvailable();

    /**
     * @return The configuration parameters supported by this provider.
     */
    List<InputStreamParameter<?>> getParameters();

    /**
     * @return The configuration of this provider populated with default values.
     */
    default InputStreamConfig getDefaultConfig() {
        return InputStreamConfig.withDefaults(getParameters());
    }

    /**
     * Fast, static check whether this provider can handle the config, based on
     * the URI scheme only, without I/O.
     *
     * @param config The configuration to check.
     * @return {@code true} if this provider can handle the config.
     */
    boolean canProcess(InputStreamConfig config);

    /**
     * Gets the order value of this provider. Lower values have higher priority.
     *
     * @return The order value, {@code 0} by default.
     */
    default int getOrder() {
        return 0;
    }

    /**
     * Creates a stream for the given URI using the default configuration.
     *
     * @param uri The URI of the resource to read.
     * @param eventLoop The I/O thread driving the backend.
     * @return A new stream, not {@link SourceInputStream#open() opened} yet.
     * @throws IOException If the backend cannot be created.
     */
    default SourceInputStream create(URI uri, EventLoop eventLoop) throws IOException {
        return create(getDefaultConfig().uri(uri), eventLoop);
    }

    /**
     * Creates a stream with the specified configuration.
     *
     * @param config The configuration.
     * @param eventLoop The I/O thread driving the backend.
     * @return A new stream, not {@link SourceInputStream#open() opened} yet.
     * @throws IOException If the backend cannot be created.
     * @throws IllegalArgumentException If a configuration value is invalid.
     */
    SourceInputStream create(InputStreamConfig config, EventLoop eventLoop) throws IOException;

    /**
     * Checks if a provider is enabled via a system property or environment variable.
     * The property is checked first, then the environment variable. If neither
     * is set, it defaults to {@code true}.
     *
     * @param key The key for the system property/environment variable.
     * @return {@code true} if enabled, {@code false} otherwise.
     */
    static boolean isEnabled(String key) {
        String enabled = System.getProperty(key);
        if (enabled == null) {
            enabled = System.getenv(key);
        }
        return enabled == null ? true : Boolean.parseBoolean(enabled);
    }

    /**
     * @return A stream of all registered providers.
     */
    static Stream<AsyncSourceProvider> findProviders() {
        ServiceLoader<AsyncSourceProvider> loader = ServiceLoader.load(AsyncSourceProvider.class);
        return loader.stream().map(Provider::get);
    }

    /**
     * @return All registered providers.
     */
    static List<AsyncSourceProvider> getProviders() {
        return findProviders().toList();
    }

    /**
     * @return All registered providers that are {@link #isAvailable() available}.
     */
    static List<AsyncSourceProvider> getAvailableProviders() {
        return findProviders().filter(AsyncSourceProvider::isAvailable).toList();
    }

    /**
     * @param providerId The ID of the provider to find.
     * @return The provider, or empty if not registered.
     */
    static Optional<AsyncSourceProvider> findProvider(String providerId) {
        return findProviders()
                .filter(p -> p.getId().equalsIgnoreCase(providerId))
                .findFirst();
    }

    /**
     * Retrieves a provider by its ID.
     *
     * @param providerId The ID of the provider to retrieve.
     * @param available If {@code true}, fail if the provider is not available.
     * @return The requested provider.
     * @throws IllegalStateException if the provider is not found, or if
     *         {@code available} is true and the provider is not available.
     */
    static AsyncSourceProvider getProvider(String providerId, boolean available) {
        AsyncSourceProvider provider = findProvider(providerId)
                .orElseThrow(() ->
                        new IllegalStateException("The specified AsyncSourceProvider is not found: " + providerId));

        if (available && !provider.isAvailable()) {
            throw new IllegalStateException("The specified AsyncSourceProvider is not available: " + providerId);
        }
        return provider;
    }
}
