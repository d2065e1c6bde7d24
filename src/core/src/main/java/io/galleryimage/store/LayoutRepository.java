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

import io.galleryimage.layout.LayoutRecord;
import java.io.IOException;
import java.util.Optional;

/**
 * Lookup of previously saved layouts.
 */
public interface LayoutRepository {

    /**
     * @return the layout saved under {@code id}, empty if there is none
     * @throws IOException if the backing store cannot be read
     */
    Optional<LayoutRecord> findLayoutById(String id) throws IOException;
}
