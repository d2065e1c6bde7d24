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

import io.galleryimage.fetch.ResourceFetcher;
import io.galleryimage.fetch.spi.FetcherConfig;
import io.galleryimage.fetch.spi.ResourceFetcherProvider;
import java.net.URI;
import java.util.Optional;

/**
 * Provides {@link HttpResourceFetcher}s for {@code http} and {@code https} URIs.
 * <p>
 * Timeouts and credentials come from the {@link FetcherConfig}; a bearer token takes precedence over
 * basic credentials when both are set.
 */
public class HttpResourceFetcherProvider implements ResourceFetcherProvider {

    /**
     * Set to {@code false} as a system property or environment variable to disable this provider.
     */
    public static final String ENABLED_KEY = "GALLERY_IMAGE_FETCH_HTTP";

    public static final String ID = "http";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Downloads images from HTTP/HTTPS servers.";
    }

    @Override
    public boolean isAvailable() {
        return ResourceFetcherProvider.isEnabled(ENABLED_KEY);
    }

    @Override
    public boolean canFetch(URI uri) {
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    @Override
    public ResourceFetcher create(FetcherConfig config) {
        HttpResourceFetcher.Builder builder = HttpResourceFetcher.builder()
                .connectTimeout(config.connectTimeout())
                .requestTimeout(config.requestTimeout());

        Optional<String> token = config.bearerToken();
        if (token.isPresent()) {
            builder.bearerToken(token.orElseThrow());
        } else if (config.username().isPresent()) {
            String password = config.password()
                    .orElseThrow(() -> new IllegalArgumentException(
                            FetcherConfig.HTTP_PASSWORD_KEY + " is required with " + FetcherConfig.HTTP_USERNAME_KEY));
            builder.basicAuth(config.username().orElseThrow(), password);
        }
        return builder.build();
    }
}
