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
package io.galleryimage.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists generated output.
 */
public interface ResourceStore {

    /**
     * Writes {@code content} as {@code name} inside {@code outputDir}, creating the directory if needed and
     * replacing an existing file.
     *
     * @return the path the content was saved to
     */
    String save(Path outputDir, String name, byte[] content) throws IOException;

    /**
     * Provides an empty directory {@code name} inside {@code outputDir}, deleting whatever was there.
     *
     * @return the directory
     */
    Path replaceDirectory(Path outputDir, String name) throws IOException;
}
