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

/**
 * A renderable image: location, media type and size.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentResource(String id, String type, String format, Integer width, Integer height) {

    public static final String IMAGE = "Image";

    public static ContentResource image(String id, String format, int width, int height) {
        return new ContentResource(id, IMAGE, format, width, height);
    }
}
