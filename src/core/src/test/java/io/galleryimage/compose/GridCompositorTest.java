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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import io.galleryimage.ImagingContext;
import io.galleryimage.ResourceUnavailableException;
import io.galleryimage.SerializationException;
import io.galleryimage.StateConflictException;
import io.galleryimage.TestImages;
import io.galleryimage.art.ArtItem;
import io.galleryimage.art.ArtMetadata;
import io.galleryimage.art.ArtRecord;
import io.galleryimage.art.ImageOptions;
import io.galleryimage.art.ImageResource;
import io.galleryimage.art.OutputType;
import io.galleryimage.codec.CanvasSpec;
import io.galleryimage.fetch.ResourceFetcher;
import io.galleryimage.iiif.IiifJson;
import io.galleryimage.layout.GridLayout;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link GridCompositor}.
 */
class GridCompositorTest {

    private static final ImageOptions TIFF_IN_MEMORY = ImageOptions.builder().outputType(OutputType.TIFF).build();

    @TempDir
    Path tempDir;

    private ImagingContext context;
    private GridCompositor compositor;

    @BeforeEach
    void setUp() {
        context = ImagingContext.defaults();
        compositor = new GridCompositor(4);
    }

    @AfterEach
    void tearDown() {
        compositor.close();
    }

    private ArtItem art(String name, Color color) throws IOException {
        Path file = TestImages.writeJpeg(tempDir, name + ".jpg", 100, 50, color);
        return ArtItem.fromRecord(new ArtRecord(name, file.toString(), null, ArtMetadata.titled(name), null), context);
    }

    private ArtItem missing(String name) {
        String location = tempDir.resolve(name + ".jpg").toString();
        return ArtItem.fromRecord(new ArtRecord(name, location, null, ArtMetadata.titled(name), null), context);
    }

    private GridLayout layout(List<List<ArtItem>> array) {
        return GridLayout.builder(context).name("wall").thumbnailWidth(40).array(array).build();
    }

    private static Color pixel(BufferedImage image, int x, int y) {
        return new Color(image.getRGB(x, y));
    }

    private static void assertMostly(Color expected, Color actual) {
        assertThat(Math.abs(expected.getRed() - actual.getRed())).as("red of %s", actual).isLessThan(40);
        assertThat(Math.abs(expected.getGreen() - actual.getGreen())).as("green of %s", actual).isLessThan(40);
        assertThat(Math.abs(expected.getBlue() - actual.getBlue())).as("blue of %s", actual).isLessThan(40);
    }

    @Test
    void testTwoByTwoOffsets() throws IOException {
        GridLayout layout = layout(List.of(
                List.of(art("red", Color.RED), art("green", Color.GREEN)),
                List.of(art("blue", Color.BLUE), art("white", Color.WHITE))));

        GridComposite composite = compositor.assemble(layout, TIFF_IN_MEMORY);

        assertEquals(80, composite.width());
        assertEquals(40, composite.height());
        assertEquals(40, composite.cellWidth());
        assertEquals(20, composite.cellHeight());
        assertTrue(composite.isComplete());
        assertThat(composite.placements()).containsExactly(
                new CellPlacement(0, 0, 0, 0, "red"),
                new CellPlacement(0, 1, 0, 40, "green"),
                new CellPlacement(1, 0, 20, 0, "blue"),
                new CellPlacement(1, 1, 20, 40, "white"));

        BufferedImage image = TestImages.read(composite.canvas().getSource().loadResource());
        assertEquals(80, image.getWidth());
        assertEquals(40, image.getHeight());
        assertMostly(Color.RED, pixel(image, 20, 10));
        assertMostly(Color.GREEN, pixel(image, 60, 10));
        assertMostly(Color.BLUE, pixel(image, 20, 30));
        assertMostly(Color.WHITE, pixel(image, 60, 30));
    }

    @Test
    void testCanvasIsTitledAfterLayout() throws IOException {
        GridLayout layout = layout(List.of(List.of(art("red", Color.RED))));

        GridComposite composite = compositor.assemble(layout, TIFF_IN_MEMORY);

        assertEquals("wall", composite.canvas().getSourceName());
        assertTrue(composite.canvas().getMetadata().title().isPresent());
        assertEquals("wall.tif" + ImageResource.BUFFER_SUFFIX, composite.output().getId());
        assertThrows(SerializationException.class, composite::toRecord);
    }

    @Test
    void testFailedCellIsSkipped() throws IOException {
        GridLayout layout = layout(List.of(
                List.of(art("red", Color.RED), missing("gone")),
                List.of(art("blue", Color.BLUE))));

        GridComposite composite = compositor.assemble(layout, TIFF_IN_MEMORY);

        assertFalse(composite.isComplete());
        assertEquals(1, composite.skippedCells().size());
        CellFailure failure = composite.skippedCells().get(0);
        assertEquals(0, failure.row());
        assertEquals(1, failure.column());
        assertEquals("gone", failure.sourceName());
        assertInstanceOf(ResourceUnavailableException.class, failure.cause());
        assertThat(composite.placements()).extracting(CellPlacement::sourceName).containsExactly("red", "blue");

        BufferedImage image = TestImages.read(composite.canvas().getSource().loadResource());
        assertEquals(CanvasSpec.DEFAULT_BACKGROUND.getRGB(), image.getRGB(60, 10));
        assertEquals(CanvasSpec.DEFAULT_BACKGROUND.getRGB(), image.getRGB(60, 30));
        assertMostly(Color.BLUE, pixel(image, 20, 30));
    }

    @Test
    void testCorruptExistingThumbnailIsSkipped() throws IOException {
        Path corrupt = Files.writeString(tempDir.resolve("green-40px.jpeg"), "not an image");
        Path source = TestImages.writeJpeg(tempDir, "green.jpg", 100, 50, Color.GREEN);
        ArtItem green = ArtItem.fromRecord(new ArtRecord("green", source.toString(), Map.of(40, corrupt.toString()),
                ArtMetadata.titled("green"), null), context);
        GridLayout layout = layout(List.of(List.of(art("red", Color.RED), green)));

        GridComposite composite = compositor.assemble(layout, TIFF_IN_MEMORY);

        assertEquals(80, composite.width());
        assertEquals(1, composite.skippedCells().size());
        CellFailure failure = composite.skippedCells().get(0);
        assertEquals(0, failure.row());
        assertEquals(1, failure.column());
        assertInstanceOf(IOException.class, failure.cause());
        assertThat(composite.placements()).extracting(CellPlacement::sourceName).containsExactly("red");

        BufferedImage image = TestImages.read(composite.canvas().getSource().loadResource());
        assertEquals(CanvasSpec.DEFAULT_BACKGROUND.getRGB(), image.getRGB(60, 10));
    }

    @Test
    void testUncheckedFailureOfFirstCellIsSkippedAndNotRetried() throws IOException {
        AtomicInteger brokenFetches = new AtomicInteger();
        ResourceFetcher delegate = context.fetcher();
        context = context.withFetcher(new ResourceFetcher() {
            @Override
            public byte[] fetch(String location) throws IOException {
                if (location.endsWith("broken.jpg")) {
                    brokenFetches.incrementAndGet();
                    throw new IllegalStateException("decoder crashed");
                }
                return delegate.fetch(location);
            }

            @Override
            public String getId() {
                return "failing";
            }
        });
        GridLayout layout = layout(List.of(List.of(missing("broken"), art("red", Color.RED))));

        GridComposite composite = compositor.assemble(layout, TIFF_IN_MEMORY);

        assertEquals(20, composite.cellHeight());
        assertEquals(1, composite.skippedCells().size());
        CellFailure failure = composite.skippedCells().get(0);
        assertEquals(0, failure.column());
        assertInstanceOf(IllegalStateException.class, failure.cause());
        assertEquals(1, brokenFetches.get());
    }

    @Test
    void testCellSizeFromFirstAvailableThumbnail() throws IOException {
        GridLayout layout = layout(List.of(List.of(missing("gone"), art("red", Color.RED))));

        GridComposite composite = compositor.assemble(layout, TIFF_IN_MEMORY);

        assertEquals(20, composite.cellHeight());
        assertEquals(80, composite.width());
        assertEquals(1, composite.skippedCells().size());
    }

    @Test
    void testNoAvailableCell() {
        GridLayout layout = layout(List.of(List.of(missing("a"), missing("b"))));
        assertThrows(ResourceUnavailableException.class, () -> compositor.assemble(layout, TIFF_IN_MEMORY));
    }

    @Test
    void testUsesSuppliedExecutor() throws IOException {
        AtomicInteger tasks = new AtomicInteger();
        Executor counting = command -> {
            tasks.incrementAndGet();
            command.run();
        };
        GridLayout layout = layout(List.of(List.of(art("red", Color.RED), art("blue", Color.BLUE))));

        compositor.assemble(layout, TIFF_IN_MEMORY.toBuilder().executor(counting).build());

        assertEquals(2, tasks.get());
    }

    @Test
    void testGenerateLayoutImageSavesLayout() throws IOException {
        Path outputDir = tempDir.resolve("out");
        GridLayout layout = layout(List.of(
                List.of(art("red", Color.RED), art("green", Color.GREEN)),
                List.of(art("blue", Color.BLUE))));
        ImageOptions options = ImageOptions.builder()
                .outputType(OutputType.TIFF)
                .saveFile(true)
                .outputDir(outputDir)
                .build();

        GridComposite composite = layout.generateImage(compositor, options);

        Path tiff = outputDir.resolve("wall.tif").toAbsolutePath();
        assertEquals(tiff.toString(), composite.output().getId());
        assertTrue(Files.exists(tiff));
        assertEquals(tiff.toString(), composite.toRecord().source());

        JsonNode saved = IiifJson.mapper().readTree(outputDir.resolve("wall-layout.json").toFile());
        assertEquals("wall", saved.get("name").asText());
        assertEquals(tiff.toString(), saved.get("image").get("source").asText());
        assertEquals(80, saved.get("image").get("dimensions").get("width").asInt());
        assertEquals(2, saved.get("numRows").asInt());
        assertEquals(0, saved.get("array").get(0).get(0).path("thumbnails").size());

        assertThrows(StateConflictException.class, () -> layout.generateImage(compositor, options));
    }

    @Test
    void testDeepZoomOutput() throws IOException {
        Path outputDir = tempDir.resolve("out");
        GridLayout layout = layout(List.of(List.of(art("red", Color.RED), art("blue", Color.BLUE))));
        ImageOptions options = ImageOptions.builder()
                .outputType(OutputType.DZI)
                .saveFile(true)
                .outputDir(outputDir)
                .build();

        GridComposite composite = compositor.assemble(layout, options);

        assertEquals(outputDir.resolve("wall").toAbsolutePath().toString(), composite.output().getId());
        assertTrue(Files.exists(outputDir.resolve("wall/wall.dzi")));
    }
}
