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
package io.galleryimage.compose;

import static java.util.Objects.requireNonNull;

import io.galleryimage.SerializationException;
import io.galleryimage.art.ArtItem;
import io.galleryimage.art.ArtRecord;
import io.galleryimage.art.ImageResource;
import io.galleryimage.codec.ImageDimensions;
import java.util.List;
import java.util.Map;

/**
 * Result of composing a grid layout.
 *
 * @param canvas the assembled image as an art item titled after the layout, held in memory
 * @param output the encoded output produced from {@code canvas}
 * @param width canvas width in pixels
 * @param height canvas height in pixels
 * @param cellWidth width of every cell
 * @param cellHeight height of every cell, taken from the first thumbnail produced
 * @param placements painted cells in row-major order
 * @param skippedCells cells left blank
 */
public record GridComposite(
        ArtItem canvas,
        ImageResource output,
        int width,
        int height,
        int cellWidth,
        int cellHeight,
        List<CellPlacement> placements,
        List<CellFailure> skippedCells) {

    public GridComposite {
        requireNonNull(canvas, "canvas");
        requireNonNull(output, "output");
        placements = List.copyOf(placements);
        skippedCells = List.copyOf(skippedCells);
    }

    public boolean isComplete() {
        return skippedCells.isEmpty();
    }

    /**
     * Flat form of the output image.
     *
     * @throws SerializationException if the output is held only in memory
     */
    public ArtRecord toRecord() {
        if (output.isInMemoryOnly()) {
            throw new SerializationException(
                    "Composite %s is only stored in memory, save it first".formatted(output.getId()));
        }
        return new ArtRecord(null, output.getId(), Map.of(), canvas.getMetadata().copy(),
                ImageDimensions.of(width, height));
    }
}
