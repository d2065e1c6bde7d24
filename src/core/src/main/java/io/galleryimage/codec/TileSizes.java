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

/**
 * Tile edge computation for pyramidal output.
 */
public final class TileSizes {

    /** Largest tile edge produced by {@link #minimumTileSize(int)}. */
    public static final int MAX_TILE_SIZE = 256;

    private TileSizes() {
        // utility class
    }

    /**
     * Tile edge for an image side of {@code widthOrHeight} pixels: the side rounded down to a multiple of 16,
     * then halved while it stays a multiple of 16 and exceeds {@value #MAX_TILE_SIZE}. For example
     * {@code 1000 -> 992 -> 496 -> 248}. A result still above {@value #MAX_TILE_SIZE} is clamped to it, as
     * in {@code 2016 -> 1008 -> 504 -> 256}.
     * <p>
     * Sides shorter than 16 pixels use the side itself, a tile never exceeds the image.
     *
     * @throws IllegalArgumentException if {@code widthOrHeight} is not positive
     */
    public static int minimumTileSize(int widthOrHeight) {
        if (widthOrHeight <= 0) {
            throw new IllegalArgumentException("Image side must be positive: " + widthOrHeight);
        }
        int tileSize = widthOrHeight - (widthOrHeight % 16);
        if (tileSize == 0) {
            return widthOrHeight;
        }
        while (tileSize % 16 == 0 && tileSize > MAX_TILE_SIZE) {
            tileSize /= 2;
        }
        return Math.min(tileSize, MAX_TILE_SIZE);
    }
}
