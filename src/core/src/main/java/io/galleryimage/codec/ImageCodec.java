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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Pixel operations on encoded images.
 * <p>
 * Implementations must be thread-safe: the compositor calls them from several workers at once. All methods
 * block until done.
 */
public interface ImageCodec {

    /**
     * Scales an image to {@code width} pixels, keeping its aspect ratio, and encodes the result as JPEG.
     *
     * @throws IOException if {@code image} cannot be decoded or the result cannot be encoded
     */
    byte[] resize(byte[] image, int width) throws IOException;

    /**
     * Reads the size of an image from its header.
     *
     * @throws IOException if the format is not recognized
     */
    ImageDimensions probeDimensions(byte[] image) throws IOException;

    /**
     * Detects the format of an image.
     *
     * @return a lower-case file extension such as {@code jpeg}, {@code png} or {@code tif}
     * @throws IOException if the format is not recognized
     */
    String probeFormat(byte[] image) throws IOException;

    /**
     * Encodes an image as a tiled TIFF holding the full resolution followed by successively halved levels.
     */
    byte[] encodeTiledPyramid(byte[] image, int tileWidth, int tileHeight) throws IOException;

    /**
     * Writes a tile tree for {@code image} into an existing, empty {@code directory}.
     *
     * @param image the encoded image
     * @param layout the tile layout
     * @param directory target directory
     * @param name base name of the descriptor files where the layout uses one ({@code <name>.dzi})
     * @param baseId public id the tiles are served under, required by {@link TileLayout#IIIF}
     */
    void encodeTileDirectory(byte[] image, TileLayout layout, Path directory, String name, String baseId)
            throws IOException;

    /**
     * Paints each block at its offset onto a blank canvas and encodes the result losslessly.
     * Blocks are painted in list order.
     */
    byte[] composite(CanvasSpec canvas, List<ImageBlock> blocks) throws IOException;
}
