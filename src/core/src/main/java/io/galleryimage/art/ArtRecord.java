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
package io.galleryimage.art;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.galleryimage.codec.ImageDimensions;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flat, serializable form of an {@link ArtItem}.
 *
 * @param id identifier assigned by the caller or a backing store, may be {@code null}
 * @param source location of the full resolution image
 * @param thumbnails thumbnail locations by width
 * @param metadata descriptive metadata
 * @param dimensions size of the full resolution image, {@code null} if not probed yet
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtRecord(
        @JsonAlias("_id") String id,
        String source,
        Map<Integer, String> thumbnails,
        ArtMetadata metadata,
        ImageDimensions dimensions) {

    public ArtRecord {
        thumbnails = thumbnails == null ? Map.of() : new TreeMap<>(thumbnails);
        metadata = metadata == null ? new ArtMetadata() : metadata;
    }

    public static ArtRecord of(String source, ArtMetadata metadata) {
        return new ArtRecord(null, source, null, metadata, null);
    }
}
