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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.galleryimage.ImagingContext;
import io.galleryimage.InvalidInputException;
import io.galleryimage.SerializationException;
import io.galleryimage.StateConflictException;
import io.galleryimage.TestImages;
import io.galleryimage.codec.ImageDimensions;
import io.galleryimage.fetch.ResourceFetcher;
import io.galleryimage.fetch.file.FileResourceFetcher;
import io.galleryimage.iiif.IiifJson;
import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ArtItem}.
 */
class ArtItemTest {

    @TempDir
    Path tempDir;

    private ImagingContext context;
    private Path sourceFile;

    @BeforeEach
    void setUp() throws IOException {
        context = ImagingContext.defaults();
        sourceFile = TestImages.writeJpeg(tempDir, "sunset.jpg", 400, 300, Color.ORANGE);
    }

    private ArtItem sunset() {
        ArtMetadata metadata = new ArtMetadata().put(ArtMetadata.TITLE, "Sunset").put(ArtMetadata.CREATOR, "Ana");
        return ArtItem.fromRecord(new ArtRecord("art-1", sourceFile.toString(), null, metadata, null), context);
    }

    @Test
    void testFromRecord() {
        ArtItem art = sunset();
        assertEquals(Optional.of("art-1"), art.getId());
        assertEquals("sunset", art.getSourceName());
        assertEquals(sourceFile.toAbsolutePath().toString(), art.getSource().getId());
        assertEquals(Optional.of("Ana"), art.getMetadata().creator());
        assertThat(art.getThumbnails()).isEmpty();
    }

    @Test
    void testFromRecordRequiresSource() {
        ArtRecord record = ArtRecord.of(null, ArtMetadata.titled("Nothing"));
        assertThrows(InvalidInputException.class, () -> ArtItem.fromRecord(record, context));
    }

    @Test
    void testFromRecordRejectsBadThumbnailWidth() {
        ArtRecord record = new ArtRecord(null, sourceFile.toString(), Map.of(0, "/x.jpeg"), null, null);
        assertThrows(InvalidInputException.class, () -> ArtItem.fromRecord(record, context));
    }

    @Test
    void testCreateThumbnail() throws IOException {
        ArtItem art = sunset();
        Path outputDir = tempDir.resolve("thumbs");

        ImageResource thumbnail = art.createThumbnail(200, ThumbnailOptions.savedTo(outputDir));

        assertTrue(art.thumbnailExists(200));
        assertEquals(Optional.of(thumbnail), art.getThumbnail(200));
        assertTrue(Files.exists(outputDir.resolve("sunset-200px.jpeg")));
        assertEquals(ImageDimensions.of(200, 150), thumbnail.getDimensions());
    }

    @Test
    void testDuplicateThumbnail() throws IOException {
        ArtItem art = sunset();
        art.createThumbnail(100, ThumbnailOptions.inMemory());
        assertThrows(StateConflictException.class, () -> art.createThumbnail(100, ThumbnailOptions.inMemory()));
        assertThrows(InvalidInputException.class, () -> art.createThumbnail(-1, ThumbnailOptions.inMemory()));
    }

    @Test
    void testLoadOrCreateThumbnailReusesExisting() throws IOException {
        Path thumbFile = TestImages.writeJpeg(tempDir, "sunset-100px.jpeg", 100, 75, Color.RED);
        RecordingFetcher fetcher = new RecordingFetcher();
        ArtItem art = ArtItem.fromRecord(
                new ArtRecord(null, sourceFile.toString(), Map.of(100, thumbFile.toString()), null, null),
                context.withFetcher(fetcher));

        byte[] bytes = art.loadOrCreateThumbnail(100);

        assertArrayEquals(Files.readAllBytes(thumbFile), bytes);
        assertThat(fetcher.fetched).containsExactly(thumbFile.toAbsolutePath().toString());
    }

    @Test
    void testLoadOrCreateThumbnailCreatesInMemory() throws IOException {
        ArtItem art = sunset();
        byte[] bytes = art.loadOrCreateThumbnail(80);

        assertEquals(ImageDimensions.of(80, 60), context.codec().probeDimensions(bytes));
        assertTrue(art.getThumbnail(80).orElseThrow().isInMemoryOnly());
    }

    @Test
    void testDimensions() throws IOException {
        ArtItem art = sunset();
        assertThat(art.getKnownDimensions()).isEmpty();
        assertEquals(ImageDimensions.of(400, 300), art.getDimensions());
        assertThat(art.getKnownDimensions()).contains(ImageDimensions.of(400, 300));
    }

    @Test
    void testRecordRoundTrip() throws IOException {
        ArtItem art = sunset();
        art.createThumbnail(120, ThumbnailOptions.savedTo(tempDir.resolve("thumbs")));
        art.getDimensions();

        ArtRecord record = art.toRecord();
        String json = IiifJson.toJson(record);
        ArtRecord parsed = IiifJson.mapper().readValue(json, ArtRecord.class);
        ArtItem copy = ArtItem.fromRecord(parsed, context);

        assertEquals(record, parsed);
        assertEquals(art.getId(), copy.getId());
        assertEquals(art.getSource().getId(), copy.getSource().getId());
        assertEquals(art.getMetadata(), copy.getMetadata());
        assertEquals(art.getThumbnail(120).orElseThrow().getId(), copy.getThumbnail(120).orElseThrow().getId());
        assertThat(copy.getKnownDimensions()).contains(ImageDimensions.of(400, 300));
    }

    @Test
    void testToRecordRejectsInMemoryThumbnail() throws IOException {
        ArtItem art = sunset();
        art.createThumbnail(64, ThumbnailOptions.inMemory());

        assertThrows(SerializationException.class, art::toRecord);
        assertThat(art.toSavedRecord().thumbnails()).isEmpty();
    }

    @Test
    void testFromBuffer() throws IOException {
        byte[] png = TestImages.png(30, 20, Color.BLUE);
        ArtItem art = ArtItem.fromBuffer(png, ArtMetadata.titled("Blue"), context);

        assertEquals("Blue", art.getSourceName());
        assertEquals("Blue.png" + ImageResource.BUFFER_SUFFIX, art.getSource().getId());
        assertTrue(art.getSource().isInMemoryOnly());
        assertFalse(art.getId().isPresent());
        assertThrows(SerializationException.class, art::toRecord);
    }

    @Test
    void testFromBufferRequiresTitle() {
        byte[] png = TestImages.png(30, 20, Color.BLUE);
        assertThrows(InvalidInputException.class, () -> ArtItem.fromBuffer(png, new ArtMetadata(), context));
        assertThrows(InvalidInputException.class, () -> ArtItem.fromBuffer(png, null, context));
    }

    @Test
    void testFromBufferRejectsUnknownFormat() {
        byte[] garbage = "nope".getBytes();
        assertThrows(IOException.class, () -> ArtItem.fromBuffer(garbage, ArtMetadata.titled("X"), context));
    }

    @Test
    void testFromLegacyInput() {
        ArtInput input = ArtInput.parse("""
                {"_id": "old", "orig": "%s", "thumbnails": {"s-100px": "/t/sunset-100px.jpeg"}, "title": "Old"}
                """.formatted(sourceFile.toString().replace("\\", "\\\\")));
        ArtItem art = ArtItem.from(input, context);

        assertEquals(Optional.of("old"), art.getId());
        assertTrue(art.thumbnailExists(100));
        assertEquals(Optional.of("Old"), art.getMetadata().title());
    }

    @Test
    void testGenerateImageDelegatesToSource() throws IOException {
        ImageResource tiff = sunset().generateImage(ImageOptions.builder().outputType(OutputType.TIFF).build());
        assertEquals("sunset.tif" + ImageResource.BUFFER_SUFFIX, tiff.getId());
    }

    @Test
    void testMetadataPutRemovesBlank() {
        ArtMetadata metadata = ArtMetadata.titled("T").put(ArtMetadata.TITLE, " ");
        assertTrue(metadata.isEmpty());
    }

    /**
     * Reads local files and remembers every location asked for.
     */
    private static class RecordingFetcher implements ResourceFetcher {
        private final ResourceFetcher delegate = new FileResourceFetcher();
        private final List<String> fetched = new CopyOnWriteArrayList<>();

        @Override
        public byte[] fetch(String location) throws IOException {
            fetched.add(location);
            return delegate.fetch(location);
        }

        @Override
        public String getId() {
            return "recording";
        }
    }
}
