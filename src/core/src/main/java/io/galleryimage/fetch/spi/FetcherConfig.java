/*
 * Copyright 2026 The gallery-image Authors.
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
package io.galleryimage.fetch.spi;

import static java.util.Objects.requireNonNull;

import io.galleryimage.fetch.http.HttpResourceFetcher;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for the fetchers created by {@link io.galleryimage.fetch.ResourceFetchers}.
 * <p>
 * Values are stored by key so a configuration round-trips through {@link Properties}; typed accessors
 * convert on read. Unknown keys are kept as is for provider-specific settings.
 */
public class FetcherConfig {

    /** Forces a provider by {@link ResourceFetcherProvider#getId() id} instead of choosing by scheme. */
    public static final String PROVIDER_ID_KEY = "io.galleryimage.fetch.provider";

    /** Connect timeout in milliseconds. */
    public static final String CONNECT_TIMEOUT_KEY = "io.galleryimage.fetch.connect-timeout";

    /** Per-request timeout in milliseconds. */
    public static final String REQUEST_TIMEOUT_KEY = "io.galleryimage.fetch.request-timeout";

    /** Whether fetched resources are kept in an in-memory cache keyed by location. */
    public static final String MEMORY_CACHE_KEY = "io.galleryimage.fetch.memory-cache";

    /** Upper bound of the in-memory cache, in bytes. */
    public static final String MEMORY_CACHE_MAX_BYTES_KEY = "io.galleryimage.fetch.memory-cache.max-bytes";

    /** Bearer token sent with every HTTP request. */
    public static final String HTTP_BEARER_TOKEN_KEY = "io.galleryimage.fetch.http.bearer-token";

    /** HTTP Basic user name; requires {@link #HTTP_PASSWORD_KEY}. */
    public static final String HTTP_USERNAME_KEY = "io.galleryimage.fetch.http.username";

    /** HTTP Basic password. */
    public static final String HTTP_PASSWORD_KEY = "io.galleryimage.fetch.http.password";

    /** Default cache bound: 256MB. */
    public static final long DEFAULT_MEMORY_CACHE_MAX_BYTES = 256L * 1024 * 1024;

    private final Map<String, String> values = new LinkedHashMap<>();

    public FetcherConfig() {
        // defaults apply to unset keys
    }

    public static FetcherConfig defaults() {
        return new FetcherConfig();
    }

    public Optional<String> providerId() {
        return get(PROVIDER_ID_KEY);
    }

    public FetcherConfig providerId(String providerId) {
        return set(PROVIDER_ID_KEY, providerId);
    }

    public Duration connectTimeout() {
        return getMillis(CONNECT_TIMEOUT_KEY).orElse(HttpResourceFetcher.DEFAULT_TIMEOUT);
    }

    public FetcherConfig connectTimeout(Duration timeout) {
        return set(CONNECT_TIMEOUT_KEY, String.valueOf(requireNonNull(timeout).toMillis()));
    }

    public Duration requestTimeout() {
        return getMillis(REQUEST_TIMEOUT_KEY).orElse(HttpResourceFetcher.DEFAULT_TIMEOUT);
    }

    public FetcherConfig requestTimeout(Duration timeout) {
        return set(REQUEST_TIMEOUT_KEY, String.valueOf(requireNonNull(timeout).toMillis()));
    }

    public boolean memoryCache() {
        return get(MEMORY_CACHE_KEY).map(Boolean::parseBoolean).orElse(false);
    }

    public FetcherConfig memoryCache(boolean enabled) {
        return set(MEMORY_CACHE_KEY, String.valueOf(enabled));
    }

    public long memoryCacheMaxBytes() {
        return get(MEMORY_CACHE_MAX_BYTES_KEY).map(Long::parseLong).orElse(DEFAULT_MEMORY_CACHE_MAX_BYTES);
    }

    public FetcherConfig memoryCacheMaxBytes(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxBytes);
        }
        return set(MEMORY_CACHE_MAX_BYTES_KEY, String.valueOf(maxBytes));
    }

    public Optional<String> bearerToken() {
        return get(HTTP_BEARER_TOKEN_KEY);
    }

    public FetcherConfig bearerToken(String token) {
        return set(HTTP_BEARER_TOKEN_KEY, token);
    }

    public Optional<String> username() {
        return get(HTTP_USERNAME_KEY);
    }

    public Optional<String> password() {
        return get(HTTP_PASSWORD_KEY);
    }

    public FetcherConfig basicAuth(String username, String password) {
        set(HTTP_USERNAME_KEY, username);
        return set(HTTP_PASSWORD_KEY, password);
    }

    /**
     * Sets a raw value; {@code null} removes the key.
     */
    public FetcherConfig set(String key, String value) {
        requireNonNull(key, "key");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        return this;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(requireNonNull(key, "key")));
    }

    private Optional<Duration> getMillis(String key) {
        return get(key).map(Long::parseLong).map(Duration::ofMillis);
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        values.forEach(properties::setProperty);
        return properties;
    }

    public static FetcherConfig fromProperties(Properties properties) {
        requireNonNull(properties);
        FetcherConfig config = new FetcherConfig();
        properties.stringPropertyNames().forEach(name -> config.set(name, properties.getProperty(name)));
        return config;
    }

    @Override
    public String toString() {
        Map<String, String> masked = new LinkedHashMap<>(values);
        masked.computeIfPresent(HTTP_BEARER_TOKEN_KEY, (k, v) -> "***");
        masked.computeIfPresent(HTTP_PASSWORD_KEY, (k, v) -> "***");
        return "FetcherConfig" + masked;
    }
}
