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
package io.galleryimage;

import static java.util.Objects.requireNonNull;

import io.galleryimage.codec.ImageCodec;
import io.galleryimage.codec.ImageIOCodec;
import io.galleryimage.fetch.ResourceFetcher;
import io.galleryimage.fetch.ResourceFetchers;
import io.galleryimage.fetch.spi.FetcherConfig;
import io.galleryimage.store.FileSystemResourceStore;
import io.galleryimage.store.ResourceStore;

/**
 * The collaborators art items and layouts work with: where bytes come from, how pixels are processed and
 * where output goes.
 */
public record ImagingContext(ResourceFetcher fetcher, ImageCodec codec, ResourceStore store) {

    public ImagingContext {
        requireNonNull(fetcher, "fetcher");
        requireNonNull(codec, "codec");
        requireNonNull(store, "store");
    }

    /**
     * @return file and HTTP fetching, the {@code javax.imageio} codec and file system output
     */
    public static ImagingContext defaults() {
        return defaults(FetcherConfig.defaults());
    }

    public static ImagingContext defaults(FetcherConfig fetcherConfig) {
        return new ImagingContext(
                ResourceFetchers.create(fetcherConfig), new ImageIOCodec(), new FileSystemResourceStore());
    }

    public ImagingContext withFetcher(ResourceFetcher fetcher) {
        return new ImagingContext(fetcher, codec, store);
    }

    public ImagingContext withCodec(ImageCodec codec) {
        return new ImagingContext(fetcher, codec, store);
    }

    public ImagingContext withStore(ResourceStore store) {
        return new ImagingContext(fetcher, codec, store);
    }
}
