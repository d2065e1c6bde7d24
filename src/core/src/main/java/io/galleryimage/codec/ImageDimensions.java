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
package io.galleryimage.codec;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Pixel size of an image, with the EXIF orientation when the format carries one.
 *
 * @param width the width in pixels
 * @param height the height in pixels
 * @param orientation EXIF orientation (1 to 8), {@code null} when unknown
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImageDimensions(int width, int height, Integer orientation) {

    public ImageDimensions {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: %dx%d".formatted(width, height));
        }
    }

    public static ImageDimensions of(int width, int height) {
        return new ImageDimensions(width, height, null);
    }
}
