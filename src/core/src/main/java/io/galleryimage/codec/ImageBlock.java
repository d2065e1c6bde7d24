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

/**
 * An encoded image to paint at a pixel offset of a composite canvas.
 *
 * @param input the encoded image
 * @param top offset from the top edge of the canvas
 * @param left offset from the left edge of the canvas
 */
public record ImageBlock(byte[] input, int top, int left) {

    public ImageBlock {
        requireNonNull(input, "input");
        if (top < 0 || left < 0) {
            throw new IllegalArgumentException("Offsets must not be negative: top=%d, left=%d".formatted(top, left));
        }
    }

    @Override
    public String toString() {
        return "ImageBlock[top=%d, left=%d, bytes=%d]".formatted(top, left, input.length);
    }
}
