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
package io.galleryimage.layout;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.galleryimage.art.ArtRecord;
import java.util.List;

/**
 * Flat, serializable form of a {@link GridLayout}.
 *
 * @param image the composite image, {@code null} until generated
 * @param array art records by row
 * @param thumbnailWidth width of the thumbnail every cell is composited with
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LayoutRecord(
        @JsonAlias("_id") String id,
        String name,
        ArtRecord image,
        List<List<ArtRecord>> array,
        Integer numRows,
        Integer numCols,
        @JsonAlias({"thumbnailSize", "noteImageSize"}) Integer thumbnailWidth) {

    public LayoutRecord {
        array = array == null ? List.of() : array.stream().map(List::copyOf).toList();
    }
}
