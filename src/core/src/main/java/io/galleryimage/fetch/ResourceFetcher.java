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

/**
 * Fetches the complete byte content behind a location.
 * <p>
 * A location is either an http(s) URL or a local file path (absolute, relative, or a {@code file:} URI).
 * Implementations MUST be thread-safe: the grid compositor fetches every cell of a layout concurrently
 * through the same fetcher.
 *
 * @see ResourceFetchers
 */
public interface ResourceFetcher {

    /**
     * Fetches all bytes behind {@code location}.
     *
     * @param location a URL or file path
     * @return the resource content, never {@code null}
     * @throws ResourceUnavailableException if the location cannot be reached, does not exist, answers with
     *         an error, or times out
     * @throws io.galleryimage.InvalidInputException if {@code location} is empty or malformed
     * @throws IOException for other I/O errors
     */
    byte[] fetch(String location) throws IOException;

    /**
     * Identifier of this fetcher, for logging and debugging. Decorators include the decorated
     * fetcher's identifier (e.g. {@literal memory-cached:http}).
     */
    String getId();
}
