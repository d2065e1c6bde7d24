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
package io.galleryimage.iiif;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/**
 * A IIIF Canvas holding one painted image.
 *
 * @param context the JSON-LD context, set only when the canvas is a top-level document
 * @param thumbnail largest first, {@code null} when excluded
 * @param metadata {@code null} when excluded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"@context", "id", "type", "label", "width", "height", "thumbnail", "metadata", "items"})
public record Canvas(
        @JsonProperty("@context") String context,
        String id,
        String type,
        Map<String, List<String>> label,
        int width,
        int height,
        List<ContentResource> thumbnail,
        List<MetadataEntry> metadata,
        List<AnnotationPage> items)
        implements PresentationResource {

    public static final String TYPE = "Canvas";

    /**
     * @return this canvas without a JSON-LD context, for embedding into a manifest
     */
    public Canvas embedded() {
        return new Canvas(null, id, type, label, width, height, thumbnail, metadata, items);
    }
}
