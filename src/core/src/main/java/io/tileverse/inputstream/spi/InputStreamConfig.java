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

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for opening a {@link io.tileverse.inputstream.MediaInput}: the
 * URI of the resource, an optional explicit provider id, and a map of
 * parameters interpreted by the {@link AsyncSourceProvider}s.
 */
public class InputStreamConfig {

    /**
     * The key used in {@link Properties} to specify the URI of the resource.
     */
    public static final String URI_KEY = "io.tileverse.inputstream.uri";

    /**
     * The key used in {@link Properties} to specify the ID of an {@link AsyncSourceProvider}.
     */
    public static final String PROVIDER_ID_KEY = "io.tileverse.inputstream.provider";

    /**
     * A parameter that forces a given {@link #providerId(String) provider id}
     * through {@link #setParameter(String, Object)}, and is parsed into
     * {@link #providerId()} by {@link #fromProperties(Properties)}.
     */
    public static final InputStreamParameter<String> FORCE_PROVIDER_ID = InputStreamParameter.builder()
            .key(PROVIDER_ID_KEY)
            .title("Select the backend implementation")
            .type(String.class)
            .group("advanced")
            .build();

    private URI uri;

    private String providerId;

    private final Map<String, Object> parameterValues = new HashMap<>();

    public InputStreamConfig() {
        // Default constructor
    }

    /**
     * @return The URI of the resource, {@code null} if not set yet.
     */
    public URI uri() {
        return uri;
    }

    /**
     * Sets the URI of the resource to be read.
     *
     * @param uri The URI to set.
     * @return This instance for method chaining.
     * @throws IllegalArgumentException If the given string violates RFC&nbsp;2396
     */
    public InputStreamConfig uri(String uri) {
        return uri(URI.create(uri));
    }

    /**
     * Sets the URI of the resource to be read.
     *
     * @param uri The URI to set.
     * @return This instance for method chaining.
     */
    public InputStreamConfig uri(URI uri) {
        this.uri = requireNonNull(uri, "uri can't be null");
        return this;
    }

    /**
     * @return An {@link Optional} containing the provider ID, or empty if not set.
     */
    public Optional<String> providerId() {
        return Optional.ofNullable(providerId);
    }

    /**
     * Forces the use of a given provider.
     *
     * @param providerId The provider ID, or {@code null} to select it by URI.
     * @return This instance for method chaining.
     */
    public InputStreamConfig providerId(String providerId) {
        this.providerId = providerId;
        return this;
    }

    /**
     * Sets a parameter value by its key. Values are not validated here, but
     * when the stream is created.
     *
     * @param key The key of the parameter.
     * @param value The value of the parameter.
     * @return This instance for method chaining.
     */
    public InputStreamConfig setParameter(String key, Object value) {
        if (FORCE_PROVIDER_ID.key().equals(key)) {
            this.providerId = value == null ? null : String.valueOf(value);
        }
        this.parameterValues.put(requireNonNull(key, "key"), value);
        return this;
    }

    /**
     * @param <T> the type of the parameter value
     * @param param The parameter descriptor.
     * @param value The value of the parameter.
     * @return This instance for method chaining.
     */
    public <T> InputStreamConfig setParameter(InputStreamParameter<T> param, T value) {
        return setParameter(param.key(), value);
    }

    /**
     * @param <T> The type of the parameter value.
     * @param param The {@link InputStreamParameter} definition.
     * @return An {@link Optional} containing the parameter value, or empty if not set.
     * @throws IllegalArgumentException if the value cannot be converted to the parameter type.
     */
    public <T> Optional<T> getParameter(InputStreamParameter<T> param) {
        return getParameter(param.key(), param.type());
    }

    /**
     * @param key The key of the parameter.
     * @return An {@link Optional} containing the parameter value, or empty if not set.
     */
    public Optional<Object> getParameter(String key) {
        return getParameter(key, Object.class);
    }

    /**
     * Retrieves the value of a parameter by its key and converts it to the specified type.
     *
     * @param <T> The target type for the parameter value.
     * @param key The key of the parameter.
     * @param type The target type.
     * @return An {@link Optional} containing the converted parameter value, or empty if not set.
     * @throws IllegalArgumentException if the value cannot be converted to the specified type.
     */
    public <T> Optional<T> getParameter(String key, Class<T> type) {
        Object value = parameterValues.get(requireNonNull(key, "key"));
        requireNonNull(type, "type");
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(convert(key, value, type));
    }

    static <T> T convert(String key, Object value, Class<T> type) {
        if (type.isInstance(value)) return type.cast(value);

        final String text = String.valueOf(value).trim();
        Object converted;
        try {
            if (type.equals(String.class)) {
                converted = text;
            } else if (type.equals(Boolean.class)) {
                converted = Boolean.valueOf(text);
            } else if (type.equals(Integer.class)) {
                converted = Integer.parseInt(text);
            } else if (type.equals(Long.class)) {
                converted = Long.parseLong(text);
            } else if (type.equals(URI.class)) {
                converted = URI.create(text);
            } else {
                throw new IllegalArgumentException("Unsupported conversion %s to %s"
                        .formatted(value.getClass().getCanonicalName(), type.getCanonicalName()));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid value for %s, expected %s: '%s'".formatted(key, type.getSimpleName(), text), e);
        }
        return type.cast(converted);
    }

    /**
     * @return A {@link Properties} object holding the URI, the provider id, and all parameters.
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        if (uri != null) {
            properties.setProperty(URI_KEY, uri.toString());
        }
        if (providerId != null) {
            properties.setProperty(PROVIDER_ID_KEY, providerId);
        }
        parameterValues.forEach((name, v) -> {
            if (v != null) {
                properties.setProperty(name, String.valueOf(v));
            }
        });
        return properties;
    }

    /**
     * Creates a configuration from a {@link Properties} object, which must
     * contain the {@link #URI_KEY}.
     *
     * @param properties The properties to convert.
     * @return A new instance.
     * @throws NullPointerException if properties or the URI_KEY is {@code null}.
     */
    public static InputStreamConfig fromProperties(Properties properties) {
        requireNonNull(properties);
        Object urip = requireNonNull(properties.get(URI_KEY), "Properties must include " + URI_KEY);

        URI uri = urip instanceof URI u ? u : URI.create(urip.toString());
        InputStreamConfig config = new InputStreamConfig().uri(uri);
        config.providerId(properties.getProperty(PROVIDER_ID_KEY));

        Properties copy = new Properties();
        copy.putAll(properties);
        copy.remove(URI_KEY);
        copy.remove(PROVIDER_ID_KEY);
        copy.forEach((k, v) -> config.setParameter(String.valueOf(k), v));
        return config;
    }

    /**
     * @param parameters The parameters from which to get default values.
     * @return A new instance with the default parameter values.
     */
    public static InputStreamConfig withDefaults(List<InputStreamParameter<?>> parameters) {
        InputStreamConfig config = new InputStreamConfig();
        parameters.stream()
                .filter(p -> p.defaultValue().isPresent())
                .forEach(p -> config.setParameter(p.key(), p.defaultValue().orElseThrow()));
        return config;
    }

    /**
     * Checks if a configuration matches a provider id and its accepted URI schemes.
     *
     * @param config The configuration to check.
     * @param providerId The ID of the provider to match against.
     * @param acceptedUriSchemes The URI schemes the provider accepts; a {@code null}
     *        element matches URIs without a scheme.
     * @return {@code true} if no other provider is forced and the URI scheme is accepted.
     */
    public static boolean matches(InputStreamConfig config, String providerId, String... acceptedUriSchemes) {
        requireNonNull(config, "config parameter is null");
        requireNonNull(providerId, "providerId parameter is null");
        requireNonNull(config.uri(), "config uri is null");
        if (config.providerId().isPresent()
                && !config.providerId().orElseThrow().equals(providerId)) {
            return false;
        }
        // may be null
        final String scheme = config.uri().getScheme();
        return Arrays.stream(acceptedUriSchemes)
                .anyMatch(accepted -> accepted == null ? scheme == null : accepted.equalsIgnoreCase(scheme));
    }

    @Override
    public String toString() {
        return "InputStreamConfig[uri=%s, providerId=%s, parameters=%s]".formatted(uri, providerId, parameterValues);
    }
}
