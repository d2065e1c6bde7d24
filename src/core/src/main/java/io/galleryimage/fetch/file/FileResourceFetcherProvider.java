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
package io.galleryimage.fetch.file;

import io.galleryimage.fetch.ResourceFetcher;
import io.galleryimage.fetch.spi.FetcherConfig;
import io.galleryimage.fetch.spi.ResourceFetcherProvider;
import java.net.URI;

/**
 * Provides {@link FileResourceFetcher}s for {@code file:} URIs.
 */
public class FileResourceFetcherProvider implements ResourceFetcherProvider {

    /**
     * Set to {@code false} as a system property or environment variable to disable this provider.
     */
    public static final String ENABLED_KEY = "GALLERY_IMAGE_FETCH_FILE";

    public static final String ID = "file";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Reads images from the local file system.";
    }

    @Override
    public boolean isAvailable() {
        return ResourceFetcherProvider.isEnabled(ENABLED_KEY);
    }

    @Override
    public boolean canFetch(URI uri) {
        return "file".equalsIgnoreCase(uri.getScheme());
    }

    @Override
    public ResourceFetcher create(FetcherConfig config) {
        return new FileResourceFetcher();
    }
}
