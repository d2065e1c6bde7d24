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

import io.galleryimage.fetch.ResourceFetcher;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Stream;

/**
 * Service provider creating {@link ResourceFetcher}s for a family of URI schemes.
 * <p>
 * Implementations are discovered with {@link ServiceLoader} through
 * {@code META-INF/services/io.galleryimage.fetch.spi.ResourceFetcherProvider}.
 */
public interface ResourceFetcherProvider {

    /**
     * Unique identifier, e.g. {@code file} or {@code http}; matches {@link FetcherConfig#providerId()}.
     */
    String getId();

    String getDescription();

    /**
     * Whether the provider can be used, typically honoring an enablement system property or environment
     * variable (see {@link #isEnabled(String)}).
     */
    boolean isAvailable();

    /**
     * @return {@code true} if fetchers of this provider can fetch {@code uri}
     */
    boolean canFetch(URI uri);

    /**
     * Priority when several providers accept the same URI; lower wins.
     */
    default int getOrder() {
        return 0;
    }

    /**
     * Creates a fetcher configured from {@code config}. Fetchers are thread-safe and may be shared.
     */
    ResourceFetcher create(FetcherConfig config);

    /**
     * Reads an enablement flag from system properties first, then the environment; enabled unless set
     * to {@code false}.
     */
    static boolean isEnabled(String key) {
        String enabled = System.getProperty(key);
        if (enabled == null) {
            enabled = System.getenv(key);
        }
        return enabled == null || Boolean.parseBoolean(enabled);
    }

    static Stream<ResourceFetcherProvider> findProviders() {
        ServiceLoader<ResourceFetcherProvider> loader = ServiceLoader.load(ResourceFetcherProvider.class);
        return loader.stream().map(Provider::get);
    }

    static List<ResourceFetcherProvider> getAvailableProviders() {
        return findProviders().filter(ResourceFetcherProvider::isAvailable).toList();
    }

    static Optional<ResourceFetcherProvider> findProvider(String providerId) {
        return findProviders()
                .filter(p -> p.getId().equalsIgnoreCase(providerId))
                .findFirst();
    }
}
