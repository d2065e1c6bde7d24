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
package io.galleryimage.fetch;

import static java.util.Objects.requireNonNull;

import io.galleryimage.fetch.spi.FetcherConfig;
import io.galleryimage.fetch.spi.ResourceFetcherProvider;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link ResourceFetcher}s from the {@link ResourceFetcherProvider}s found on the classpath.
 * <p>
 * Provider selection for a URI:
 * <ol>
 *   <li>If {@link FetcherConfig#providerId()} is set, only that provider is used.</li>
 *   <li>Otherwise the available providers that {@link ResourceFetcherProvider#canFetch(URI) can fetch} the
 *       URI are candidates; a single candidate wins, several are resolved by lowest
 *       {@link ResourceFetcherProvider#getOrder() order}.</li>
 *   <li>No candidate, or a tie on the best order, is an {@link IllegalStateException}.</li>
 * </ol>
 */
public final class ResourceFetchers {
    private static final Logger logger = LoggerFactory.getLogger(ResourceFetchers.class);

    private ResourceFetchers() {
        // utility class
    }

    /**
     * @return a fetcher for both local paths and URLs, using the default configuration
     */
    public static ResourceFetcher create() {
        return create(FetcherConfig.defaults());
    }

    /**
     * Creates a fetcher accepting any location some available provider handles. The concrete fetcher is
     * chosen per location and reused for every location resolving to the same provider.
     * <p>
     * With {@link FetcherConfig#memoryCache()} enabled the result is wrapped in a
     * {@link CachingResourceFetcher} bounded by {@link FetcherConfig#memoryCacheMaxBytes()}.
     */
    public static ResourceFetcher create(FetcherConfig config) {
        requireNonNull(config);
        ResourceFetcher fetcher =
                new DispatchingResourceFetcher(config, ResourceFetcherProvider::getAvailableProviders);
        if (config.memoryCache()) {
            fetcher = CachingResourceFetcher.builder(fetcher)
                    .maximumWeight(config.memoryCacheMaxBytes())
                    .build();
        }
        return fetcher;
    }

    /**
     * Finds the provider to use for {@code uri}.
     *
     * @throws IllegalStateException if no provider applies or the best ones tie
     */
    public static ResourceFetcherProvider findBestProvider(URI uri, FetcherConfig config) {
        return findBestProvider(uri, config, ResourceFetcherProvider.getAvailableProviders());
    }

    static ResourceFetcherProvider findBestProvider(
            URI uri, FetcherConfig config, List<ResourceFetcherProvider> available) {
        requireNonNull(uri);
        if (config.providerId().isPresent()) {
            String providerId = config.providerId().orElseThrow();
            return ResourceFetcherProvider.findProvider(providerId)
                    .filter(ResourceFetcherProvider::isAvailable)
                    .orElseThrow(() -> new IllegalStateException(
                            "Provider %s not found or not available".formatted(providerId)));
        }
        List<ResourceFetcherProvider> candidates =
                available.stream().filter(p -> p.canFetch(uri)).toList();
        return switch (candidates.size()) {
            case 0 -> throw new IllegalStateException("No suitable provider found for URI: " + uri);
            case 1 -> candidates.get(0);
            default -> resolveByPriority(uri, candidates);
        };
    }

    private static ResourceFetcherProvider resolveByPriority(URI uri, List<ResourceFetcherProvider> candidates) {
        final int highestPriority = candidates.stream()
                .mapToInt(ResourceFetcherProvider::getOrder)
                .min()
                .orElseThrow();
        List<ResourceFetcherProvider> best = candidates.stream()
                .filter(p -> p.getOrder() == highestPriority)
                .toList();
        if (best.size() > 1) {
            String ids = best.stream().map(ResourceFetcherProvider::getId).collect(Collectors.joining(", "));
            throw new IllegalStateException(
                    "Ambiguous providers for %s with the same priority: %s".formatted(uri, ids));
        }
        logger.debug("Resolved {} to provider {} by priority", uri, best.get(0).getId());
        return best.get(0);
    }

    /**
     * Routes each fetch to the fetcher of the provider chosen for the location's URI.
     */
    static class DispatchingResourceFetcher implements ResourceFetcher {

        private final FetcherConfig config;
        private final Supplier<List<ResourceFetcherProvider>> providers;
        private final Map<String, ResourceFetcher> fetchers = new ConcurrentHashMap<>();

        DispatchingResourceFetcher(FetcherConfig config, Supplier<List<ResourceFetcherProvider>> providers) {
            this.config = config;
            this.providers = providers;
        }

        @Override
        public byte[] fetch(String location) throws IOException {
            URI uri = Locations.toUri(location);
            ResourceFetcherProvider provider = findBestProvider(uri, config, providers.get());
            ResourceFetcher fetcher = fetchers.computeIfAbsent(provider.getId(), id -> provider.create(config));
            return fetcher.fetch(location);
        }

        @Override
        public String getId() {
            return "dispatching";
        }
    }
}
