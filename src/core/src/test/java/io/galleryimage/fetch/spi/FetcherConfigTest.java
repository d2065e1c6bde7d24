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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.galleryimage.fetch.http.HttpResourceFetcher;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class FetcherConfigTest {

    @Test
    void testDefaults() {
        FetcherConfig config = FetcherConfig.defaults();
        assertEquals(Optional.empty(), config.providerId());
        assertEquals(HttpResourceFetcher.DEFAULT_TIMEOUT, config.connectTimeout());
        assertEquals(HttpResourceFetcher.DEFAULT_TIMEOUT, config.requestTimeout());
        assertFalse(config.memoryCache());
        assertEquals(FetcherConfig.DEFAULT_MEMORY_CACHE_MAX_BYTES, config.memoryCacheMaxBytes());
    }

    @Test
    void testPropertiesRoundTrip() {
        FetcherConfig config = new FetcherConfig()
                .providerId("http")
                .requestTimeout(Duration.ofMillis(1500))
                .memoryCache(true)
                .memoryCacheMaxBytes(1024)
                .bearerToken("token");

        Properties properties = config.toProperties();
        assertEquals("1500", properties.getProperty(FetcherConfig.REQUEST_TIMEOUT_KEY));

        FetcherConfig copy = FetcherConfig.fromProperties(properties);
        assertEquals(Optional.of("http"), copy.providerId());
        assertEquals(Duration.ofMillis(1500), copy.requestTimeout());
        assertThat(copy.memoryCache()).isTrue();
        assertEquals(1024, copy.memoryCacheMaxBytes());
        assertEquals(Optional.of("token"), copy.bearerToken());
    }

    @Test
    void testSetNullRemoves() {
        FetcherConfig config = new FetcherConfig().providerId("file");
        config.providerId(null);
        assertEquals(Optional.empty(), config.providerId());
    }

    @Test
    void testInvalidCacheSize() {
        assertThrows(IllegalArgumentException.class, () -> new FetcherConfig().memoryCacheMaxBytes(0));
    }

    @Test
    void testToStringMasksSecrets() {
        FetcherConfig config = new FetcherConfig().basicAuth("user", "hunter2").bearerToken("abc");
        assertThat(config.toString()).contains("user").doesNotContain("hunter2").doesNotContain("abc");
    }
}
