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

import static java.util.Objects.requireNonNull;

import java.awt.Color;

/**
 * Size and background colour of a blank canvas that {@link ImageCodec#composite} paints blocks onto.
 */
public record CanvasSpec(int width, int height, Color background) {

    /** Gallery wall colour, {@code #303030}. */
    public static final Color DEFAULT_BACKGROUND = new Color(0x30, 0x30, 0x30);

    public CanvasSpec {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas size must be positive: %dx%d".formatted(width, height));
        }
        requireNonNull(background, "background");
    }

    public static CanvasSpec of(int width, int height) {
        return new CanvasSpec(width, height, DEFAULT_BACKGROUND);
    }
}
