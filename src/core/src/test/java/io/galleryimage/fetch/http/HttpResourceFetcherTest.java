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
package io.galleryimage.fetch.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.galleryimage.ResourceUnavailableException;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

/**
 * Tests for {@link HttpResourceFetcher} using WireMock.
 */
class HttpResourceFetcherTest {

    private static final String IMAGE_PATH = "/art/sunset.jpg";
    private static final byte[] IMAGE = createTestData(20_000);

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private String imageUrl;

    private static byte[] createTestData(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) (i % 251);
        }
        return data;
    }

    @BeforeEach
    void setUp() {
        imageUrl = wm.baseUrl() + IMAGE_PATH;
        wm.stubFor(get(urlEqualTo(IMAGE_PATH)).willReturn(aResponse().withStatus(200).withBody(IMAGE)));
    }

    @Test
    void testFetch() throws IOException {
        HttpResourceFetcher fetcher = HttpResourceFetcher.create();
        assertArrayEquals(IMAGE, fetcher.fetch(imageUrl));
        wm.verify(getRequestedFor(urlEqualTo(IMAGE_PATH)).withHeader("Authorization", absent()));
    }

    @Test
    void testNotFound() {
        wm.stubFor(get(urlEqualTo("/missing.jpg")).willReturn(aResponse().withStatus(404)));
        HttpResourceFetcher fetcher = HttpResourceFetcher.create();
        String url = wm.baseUrl() + "/missing.jpg";

        ResourceUnavailableException e = assertThrows(ResourceUnavailableException.class, () -> fetcher.fetch(url));
        assertEquals(url, e.getLocation());
        assertThat(e.getMessage()).contains("404");
    }

    @Test
    void testUnauthorized() {
        wm.stubFor(get(urlEqualTo("/private.jpg")).willReturn(aResponse().withStatus(401)));
        HttpResourceFetcher fetcher = HttpResourceFetcher.create();

        ResourceUnavailableException e = assertThrows(
                ResourceUnavailableException.class, () -> fetcher.fetch(wm.baseUrl() + "/private.jpg"));
        assertThat(e.getMessage()).contains("Authentication failed");
    }

    @Test
    void testBearerToken() throws IOException {
        wm.stubFor(get(urlEqualTo("/private.jpg"))
                .withHeader("Authorization", equalTo("Bearer secret-token"))
                .willReturn(aResponse().withStatus(200).withBody(IMAGE)));

        HttpResourceFetcher fetcher =
                HttpResourceFetcher.builder().bearerToken("secret-token").build();
        assertArrayEquals(IMAGE, fetcher.fetch(wm.baseUrl() + "/private.jpg"));
    }

    @Test
    void testBasicAuth() throws IOException {
        String credentials = Base64.getEncoder().encodeToString("user:pass".getBytes(StandardCharsets.UTF_8));
        wm.stubFor(get(urlEqualTo("/private.jpg"))
                .withHeader("Authorization", equalTo("Basic " + credentials))
                .willReturn(aResponse().withStatus(200).withBody(IMAGE)));

        HttpResourceFetcher fetcher =
                HttpResourceFetcher.builder().basicAuth("user", "pass").build();
        assertArrayEquals(IMAGE, fetcher.fetch(wm.baseUrl() + "/private.jpg"));
    }

    @Test
    void testRequestTimeout() {
        wm.stubFor(get(urlEqualTo("/slow.jpg"))
                .willReturn(aResponse().withStatus(200).withBody(IMAGE).withFixedDelay(2_000)));
        HttpResourceFetcher fetcher = HttpResourceFetcher.builder()
                .requestTimeout(Duration.ofMillis(200))
                .build();

        ResourceUnavailableException e = assertThrows(
                ResourceUnavailableException.class, () -> fetcher.fetch(wm.baseUrl() + "/slow.jpg"));
        assertThat(e).hasCauseInstanceOf(HttpTimeoutException.class);
        assertThat(e.getMessage()).contains("200 milliseconds");
    }

    @Test
    void testInvalidTimeouts() {
        HttpResourceFetcher.Builder builder = HttpResourceFetcher.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.requestTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.connectTimeout(Duration.ofSeconds(-1)));
    }
}
