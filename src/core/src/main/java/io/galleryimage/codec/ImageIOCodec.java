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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.galleryimage.iiif.IiifJson;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ImageCodec} built on {@code javax.imageio} and Java2D.
 * <p>
 * Decodes whatever formats the installed {@link ImageReader}s support (JPEG, PNG, GIF, BMP, TIFF on the
 * JDK). Thumbnails and tiles are JPEG, composites PNG, pyramids Deflate-compressed TIFF. Everything is
 * decoded fully into memory, so this codec suits composites up to a few hundred megapixels.
 */
@Slf4j
public class ImageIOCodec implements ImageCodec {

    /** Edge of IIIF and Deep Zoom tiles. */
    public static final int DIRECTORY_TILE_SIZE = 256;

    static final String IIIF_IMAGE_CONTEXT = "http://iiif.io/api/image/3/context.json";

    static final String DEEP_ZOOM_NAMESPACE = "http://schemas.microsoft.com/deepzoom/2008";

    private final float jpegQuality;

    public ImageIOCodec() {
        this(0.9f);
    }

    /**
     * @param jpegQuality JPEG compression quality between 0 and 1
     */
    public ImageIOCodec(float jpegQuality) {
        if (jpegQuality <= 0f || jpegQuality > 1f) {
            throw new IllegalArgumentException("JPEG quality must be in (0, 1]: " + jpegQuality);
        }
        this.jpegQuality = jpegQuality;
    }

    @Override
    public byte[] resize(byte[] image, int width) throws IOException {
        if (width <= 0) {
            throw new IllegalArgumentException("Width must be positive: " + width);
        }
        BufferedImage src = read(image);
        int height = Math.max(1, (int) Math.round((double) src.getHeight() * width / src.getWidth()));
        BufferedImage scaled = scale(src, width, height);
        return toJpeg(scaled);
    }

    @Override
    public ImageDimensions probeDimensions(byte[] image) throws IOException {
        return withReader(image, reader -> ImageDimensions.of(reader.getWidth(0), reader.getHeight(0)));
    }

    @Override
    public String probeFormat(byte[] image) throws IOException {
        return withReader(image, reader -> reader.getFormatName().toLowerCase(Locale.ROOT));
    }

    private interface ReaderFunction<T> {
        T apply(ImageReader reader) throws IOException;
    }

    private static <T> T withReader(byte[] image, ReaderFunction<T> function) throws IOException {
        requireNonNull(image, "image");
        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(image))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new IOException("No compatible ImageReader for image");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                return function.apply(reader);
            } finally {
                reader.dispose();
            }
        }
    }

    @Override
    public byte[] encodeTiledPyramid(byte[] image, int tileWidth, int tileHeight) throws IOException {
        if (tileWidth <= 0 || tileHeight <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: %dx%d".formatted(tileWidth, tileHeight));
        }
        BufferedImage level = toRgb(read(image));
        ImageWriter writer = writerFor("tiff");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setTilingMode(ImageWriteParam.MODE_EXPLICIT);
            param.setTiling(tileWidth, tileHeight, 0, 0);
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionType("Deflate");

            writer.prepareWriteSequence(null);
            int levels = 0;
            while (true) {
                writer.writeToSequence(new IIOImage(level, null, null), param);
                levels++;
                if (level.getWidth() <= tileWidth && level.getHeight() <= tileHeight) {
                    break;
                }
                int w = Math.max(1, level.getWidth() / 2);
                int h = Math.max(1, level.getHeight() / 2);
                level = scale(level, w, h);
            }
            writer.endWriteSequence();
            log.debug("Encoded {} pyramid levels with {}x{} tiles", levels, tileWidth, tileHeight);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    @Override
    public void encodeTileDirectory(byte[] image, TileLayout layout, Path directory, String name, String baseId)
            throws IOException {
        requireNonNull(layout, "layout");
        requireNonNull(directory, "directory");
        BufferedImage src = toRgb(read(image));
        switch (layout) {
            case IIIF -> writeIiifTiles(src, directory, requireNonNull(baseId, "baseId is required for IIIF tiles"));
            case DZI -> writeDeepZoomTiles(src, directory, requireNonNull(name, "name is required for Deep Zoom"));
        }
    }

    @Override
    public byte[] composite(CanvasSpec canvas, List<ImageBlock> blocks) throws IOException {
        BufferedImage base = new BufferedImage(canvas.width(), canvas.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = base.createGraphics();
        try {
            g.setColor(canvas.background());
            g.fillRect(0, 0, canvas.width(), canvas.height());
            for (ImageBlock block : blocks) {
                g.drawImage(read(block.input()), block.left(), block.top(), null);
            }
        } finally {
            g.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(base, "png", out)) {
            throw new IOException("No ImageIO writer for format: png");
        }
        return out.toByteArray();
    }

    /**
     * Level-0 static tiles: {@code {x},{y},{w},{h}/{sw},{sh}/0/default.jpg} for every scale factor, plus
     * {@code info.json}.
     */
    private void writeIiifTiles(BufferedImage src, Path directory, String baseId) throws IOException {
        final int width = src.getWidth();
        final int height = src.getHeight();
        final int tile = DIRECTORY_TILE_SIZE;

        ArrayNode scaleFactors = IiifJson.mapper().createArrayNode();
        ArrayNode sizes = IiifJson.mapper().createArrayNode();
        int count = 0;
        for (int scale = 1; ; scale *= 2) {
            scaleFactors.add(scale);
            int region = tile * scale;
            for (int y = 0; y < height; y += region) {
                for (int x = 0; x < width; x += region) {
                    int rw = Math.min(region, width - x);
                    int rh = Math.min(region, height - y);
                    int sw = ceilDiv(rw, scale);
                    int sh = ceilDiv(rh, scale);
                    BufferedImage tileImage = scale(src.getSubimage(x, y, rw, rh), sw, sh);
                    Path file = directory.resolve("%d,%d,%d,%d".formatted(x, y, rw, rh))
                            .resolve("%d,%d".formatted(sw, sh))
                            .resolve("0")
                            .resolve("default.jpg");
                    writeJpeg(tileImage, file);
                    count++;
                }
            }
            sizes.addObject().put("width", ceilDiv(width, scale)).put("height", ceilDiv(height, scale));
            if (region >= width && region >= height) {
                break;
            }
        }

        ObjectNode tiles = IiifJson.mapper().createObjectNode();
        tiles.put("width", tile);
        tiles.put("height", tile);
        tiles.set("scaleFactors", scaleFactors);

        ObjectNode info = IiifJson.mapper().createObjectNode();
        info.put("@context", IIIF_IMAGE_CONTEXT);
        info.put("id", baseId);
        info.put("type", "ImageService3");
        info.put("protocol", "http://iiif.io/api/image");
        info.put("profile", "level0");
        info.put("width", width);
        info.put("height", height);
        info.set("sizes", sizes);
        info.putArray("tiles").add(tiles);
        IiifJson.mapper().writerWithDefaultPrettyPrinter().writeValue(directory.resolve("info.json").toFile(), info);
        log.debug("Wrote {} IIIF tiles for {} into {}", count, baseId, directory);
    }

    /**
     * Deep Zoom pyramid without overlap: level {@code L} is the image scaled by {@code 2^(L - maxLevel)},
     * tiles at {@code <name>_files/<L>/<col>_<row>.jpeg}.
     */
    private void writeDeepZoomTiles(BufferedImage src, Path directory, String name) throws IOException {
        final int width = src.getWidth();
        final int height = src.getHeight();
        final int tile = DIRECTORY_TILE_SIZE;
        final int maxLevel = 32 - Integer.numberOfLeadingZeros(Math.max(width, height) - 1);

        Path files = directory.resolve(name + "_files");
        for (int level = maxLevel; level >= 0; level--) {
            int divisor = 1 << (maxLevel - level);
            int lw = ceilDiv(width, divisor);
            int lh = ceilDiv(height, divisor);
            BufferedImage levelImage = level == maxLevel ? src : scale(src, lw, lh);
            for (int row = 0; row * tile < lh; row++) {
                for (int col = 0; col * tile < lw; col++) {
                    int x = col * tile;
                    int y = row * tile;
                    BufferedImage tileImage =
                            levelImage.getSubimage(x, y, Math.min(tile, lw - x), Math.min(tile, lh - y));
                    writeJpeg(tileImage, files.resolve(String.valueOf(level)).resolve(col + "_" + row + ".jpeg"));
                }
            }
        }

        String descriptor = """
                <?xml version="1.0" encoding="UTF-8"?>
                <Image xmlns="%s" Format="jpeg" Overlap="0" TileSize="%d">
                  <Size Width="%d" Height="%d"/>
                </Image>
                """.formatted(DEEP_ZOOM_NAMESPACE, tile, width, height);
        Files.writeString(directory.resolve(name + ".dzi"), descriptor, StandardCharsets.UTF_8);
        log.debug("Wrote {} Deep Zoom levels for {} into {}", maxLevel + 1, name, directory);
    }

    private static BufferedImage read(byte[] image) throws IOException {
        requireNonNull(image, "image");
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image));
        if (decoded == null) {
            throw new IOException("No compatible ImageReader for image");
        }
        return decoded;
    }

    private static BufferedImage scale(BufferedImage src, int width, int height) {
        if (src.getWidth() == width && src.getHeight() == height) {
            return src;
        }
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = dst.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2.drawImage(src, 0, 0, width, height, null);
        } finally {
            g2.dispose();
        }
        return dst;
    }

    /**
     * JPEG and the JDK TIFF writer reject alpha channels; flattens onto white.
     */
    private static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private byte[] toJpeg(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeJpeg(image, out);
        return out.toByteArray();
    }

    private void writeJpeg(BufferedImage image, Path file) throws IOException {
        Files.createDirectories(file.getParent());
        try (OutputStream out = Files.newOutputStream(file)) {
            writeJpeg(image, out);
        }
    }

    private void writeJpeg(BufferedImage image, OutputStream out) throws IOException {
        ImageWriter writer = writerFor("jpg");
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality);
            writer.write(null, new IIOImage(toRgb(image), null, null), param);
        } finally {
            writer.dispose();
        }
    }

    private static ImageWriter writerFor(String formatName) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
        if (!writers.hasNext()) {
            throw new IOException("No ImageIO writer for format: " + formatName);
        }
        return writers.next();
    }

    private static int ceilDiv(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }
}
