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

import io.galleryimage.InvalidInputException;
import java.util.Locale;

/**
 * Encodings {@link ImageResource#generateImage} can produce.
 */
public enum OutputType {
    /** A single pyramidal tiled TIFF file. */
    TIFF,
    /** A directory of IIIF level-0 tiles. */
    IIIF,
    /** A directory of Deep Zoom tiles. */
    DZI;

    /**
     * Accepts {@code tif}, {@code tiff}, {@code iiif} and {@code dzi}, case-insensitively.
     */
    public static OutputType fromName(String name) {
        if (name == null) {
            throw new InvalidInputException("Output type is required");
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "tif", "tiff" -> TIFF;
            case "iiif" -> IIIF;
            case "dzi" -> DZI;
            default -> throw new InvalidInputException("Unknown output type: " + name);
        };
    }
}
