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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.galleryimage.fetch.spi.FetcherConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A decorator for {@link ResourceFetcher} keeping fetched resources in memory using Caffeine.
 * <p>
 * Entries are keyed by the resolved URI of the location, so {@code art/a.jpg} and its absolute path share
 * an entry. The cache is bounded by total byte size; each entry weighs its content length.
 * <p>
 * Returned arrays are copies, callers may modify them freely.
 */
public class CachingResourceFetcher extends AbstractResourceFetcher implements ResourceFetcher {

    private final ResourceFetcher delegate;
    private final Cache<String, byte[]> cache;

    CachingResourceFetcher(ResourceFetcher delegate, Cache<String, byte[]> cache) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate ResourceFetcher cannot be null");
        this.cache = Objects.requireNonNull(cache, "Cache cannot be null");
    }

    @Override
    protected byte[] fetchInternal(URI uri) throws IOException {
        try {
            return cache.get(uri.toString(), this::load).clone();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private byte[] load(String key) {
        try {
            return delegate.fetch(key);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String getId() {
        return "memory-cached:" + delegate.getId();
    }

    public ResourceFetcher getDelegate() {
        return delegate;
    }

    /**
     * Clears the cache, forcing subsequent fetches to go to the underlying source.
     */
    public void clearCache() {
        cache.invalidateAll();
    }

    long getEstimatedCacheSizeBytes() {
        return cache.asMap().values().stream().mapToLong(b -> b.length).sum();
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    public static Builder builder(ResourceFetcher delegate) {
        return new Builder(delegate);
    }

    /**
     * Builder for {@link CachingResourceFetcher}.
     */
    public static class Builder {
        private final ResourceFetcher delegate;
        private long maximumWeight = FetcherConfig.DEFAULT_MEMORY_CACHE_MAX_BYTES;
        private Long expireAfterAccessDuration;
        private TimeUnit expireAfterAccessUnit;

        private Builder(ResourceFetcher delegate) {
            this.delegate = Objects.requireNonNull(delegate, "Delegate ResourceFetcher cannot be null");
        }

        /**
         * @param maximumWeight the maximum total size of the cached resources, in bytes
         */
        public Builder maximumWeight(long maximumWeight) {
            if (maximumWeight <= 0) {
                throw new IllegalArgumentException("Maximum weight must be positive: " + maximumWeight);
            }
            this.maximumWeight = maximumWeight;
            return this;
        }

        public Builder expireAfterAccess(long duration, TimeUnit unit) {
            if (duration <= 0) {
                throw new IllegalArgumentException("Duration must be positive: " + duration);
            }
            this.expireAfterAccessDuration = duration;
            this.expireAfterAccessUnit = Objects.requireNonNull(unit, "TimeUnit cannot be null");
            return this;
        }

        public CachingResourceFetcher build() {
            Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder().recordStats();
            cacheBuilder.maximumWeight(maximumWeight).weigher((String key, byte[] value) -> value.length);
            if (expireAfterAccessDuration != null) {
                cacheBuilder.expireAfterAccess(expireAfterAccessDuration, expireAfterAccessUnit);
            }
            return new CachingResourceFetcher(delegate, cacheBuilder.build());
        }
    }
}
