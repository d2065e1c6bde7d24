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

import io.galleryimage.ResourceUnavailableException;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for {@link ResourceFetcher} implementations.
 * <p>
 * {@link #fetch(String)} validates and resolves the location, times the call and normalizes failures to
 * {@link ResourceUnavailableException}; subclasses only implement {@link #fetchInternal(URI)}.
 */
@Slf4j
public abstract class AbstractResourceFetcher implements ResourceFetcher {

    protected AbstractResourceFetcher() {
        // for subclasses
    }

    @Override
    public final byte[] fetch(String location) throws IOException {
        final URI uri = Locations.toUri(location);

        final long start = System.nanoTime();
        byte[] content;
        try {
            content = fetchInternal(uri);
        } catch (ResourceUnavailableException e) {
            throw e;
        } catch (IOException e) {
            throw new ResourceUnavailableException(
                    location, "Unable to fetch %s: %s".formatted(location, e.getMessage()), e);
        }
        if (content == null) {
            throw new ResourceUnavailableException(location, "No content returned for " + location);
        }
        if (log.isDebugEnabled()) {
            long millis = Duration.ofNanos(System.nanoTime() - start).toMillis();
            log.debug("{}: fetched {} ({} bytes) in {}ms", getId(), location, content.length, millis);
        }
        return content;
    }

    /**
     * Fetches the full content of {@code uri}.
     *
     * @param uri an absolute URI, {@code file:} for local paths
     * @return the content
     * @throws IOException if the content cannot be read; anything but a {@link ResourceUnavailableException}
     *         is wrapped into one by the caller
     */
    protected abstract byte[] fetchInternal(URI uri) throws IOException;
}
