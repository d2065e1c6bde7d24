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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.galleryimage.fetch.file.FileResourceFetcherProvider;
import io.galleryimage.fetch.http.HttpResourceFetcher;
import io.galleryimage.fetch.http.HttpResourceFetcherProvider;
import io.galleryimage.fetch.spi.FetcherConfig;
import io.galleryimage.fetch.spi.ResourceFetcherProvider;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResourceFetchersTest {

    @TempDir
    Path tempDir;

    @Test
    void testProvidersAreDiscovered() {
        assertThat(ResourceFetcherProvider.getAvailableProviders())
                .extracting(ResourceFetcherProvider::getId)
                .contains(FileResourceFetcherProvider.ID, HttpResourceFetcherProvider.ID);
    }

    @Test
    void testFindBestProviderByScheme() {
        FetcherConfig config = FetcherConfig.defaults();
        assertEquals(FileResourceFetcherProvider.ID,
                ResourceFetchers.findBestProvider(tempDir.toUri(), config).getId());
        assertEquals(HttpResourceFetcherProvider.ID,
                ResourceFetchers.findBestProvider(URI.create("https://example.com/a.jpg"), config).getId());
    }

    @Test
    void testNoProviderForScheme() {
        URI uri = URI.create("ftp://example.com/a.jpg");
        assertThrows(IllegalStateException.class,
                () -> ResourceFetchers.findBestProvider(uri, FetcherConfig.defaults()));
    }

    @Test
    void testUnknownForcedProvider() {
        FetcherConfig config = new FetcherConfig().providerId("nope");
        assertThrows(IllegalStateException.class,
                () -> ResourceFetchers.findBestProvider(tempDir.toUri(), config));
    }

    @Test
    void testPriorityResolvesAmbiguity() {
        ResourceFetcherProvider preferred = new TestProvider("preferred", -1);
        ResourceFetcherProvider other = new TestProvider("other", 0);
        URI uri = URI.create("test://a");
        assertSame(preferred,
                ResourceFetchers.findBestProvider(uri, FetcherConfig.defaults(), List.of(other, preferred)));
    }

    @Test
    void testSamePriorityIsAmbiguous() {
        List<ResourceFetcherProvider> providers = List.of(new TestProvider("a", 0), new TestProvider("b", 0));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ResourceFetchers.findBestProvider(URI.create("test://a"), FetcherConfig.defaults(), providers));
        assertThat(e.getMessage()).contains("a, b");
    }

    @Test
    void testCreateFetchesLocalFiles() throws IOException {
        Path file = tempDir.resolve("art.bin");
        Files.write(file, new byte[] {4, 2});
        ResourceFetcher fetcher = ResourceFetchers.create();
        assertArrayEquals(new byte[] {4, 2}, fetcher.fetch(file.toString()));
        assertArrayEquals(new byte[] {4, 2}, fetcher.fetch(file.toUri().toString()));
    }

    @Test
    void testCreateWithMemoryCache() {
        ResourceFetcher fetcher = ResourceFetchers.create(new FetcherConfig().memoryCache(true));
        assertInstanceOf(CachingResourceFetcher.class, fetcher);
    }

    @Test
    void testHttpProviderAppliesConfig() {
        FetcherConfig config = new FetcherConfig().requestTimeout(Duration.ofMillis(750)).bearerToken("t");
        ResourceFetcher fetcher = new HttpResourceFetcherProvider().create(config);
        assertEquals(Duration.ofMillis(750), ((HttpResourceFetcher) fetcher).getRequestTimeout());
    }

    @Test
    void testHttpProviderRequiresPassword() {
        FetcherConfig config = new FetcherConfig().set(FetcherConfig.HTTP_USERNAME_KEY, "user");
        assertThrows(IllegalArgumentException.class, () -> new HttpResourceFetcherProvider().create(config));
    }

    private static class TestProvider implements ResourceFetcherProvider {
        private final String id;
        private final int order;

        TestProvider(String id, int order) {
            this.id = id;
            this.order = order;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getDescription() {
            return "test provider " + id;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public boolean canFetch(URI uri) {
            return "test".equals(uri.getScheme());
        }

        @Override
        public int getOrder() {
            return order;
        }

        @Override
        public ResourceFetcher create(FetcherConfig config) {
            throw new UnsupportedOperationException();
        }
    }
}
