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

import static java.util.Objects.requireNonNull;

import io.galleryimage.ImagingContext;
import io.galleryimage.InvalidInputException;
import io.galleryimage.SerializationException;
import io.galleryimage.StateConflictException;
import io.galleryimage.codec.ImageDimensions;
import io.galleryimage.fetch.Locations;
import io.galleryimage.iiif.Canvas;
import io.galleryimage.iiif.IiifOptions;
import io.galleryimage.iiif.Manifest;
import io.galleryimage.iiif.MetadataProjector;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One piece of art: its full resolution image, thumbnails by width and descriptive metadata.
 * <p>
 * Thumbnail operations are synchronized per item, so a thumbnail width is created at most once even when
 * several workers ask for it.
 */
public class ArtItem {

    private final String id;
    private final ImageResource source;
    private final String sourceName;
    private final Map<Integer, ImageResource> thumbnails = new LinkedHashMap<>();
    private final ArtMetadata metadata;
    private final ImagingContext context;
    private ImageDimensions dimensions;

    private ArtItem(String id, ImageResource source, String sourceName, ArtMetadata metadata,
            ImageDimensions dimensions, ImagingContext context) {
        this.id = id;
        this.source = source;
        this.sourceName = sourceName;
        this.metadata = metadata;
        this.dimensions = dimensions;
        this.context = context;
    }

    /**
     * Creates an item from any of the supported input shapes.
     *
     * @throws InvalidInputException if the input lacks a source or carries malformed fields
     */
    public static ArtItem from(ArtInput input, ImagingContext context) {
        return fromRecord(requireNonNull(input, "input").toArtRecord(), context);
    }

    /**
     * @throws InvalidInputException if the record has no source or a non-positive thumbnail width
     */
    public static ArtItem fromRecord(ArtRecord record, ImagingContext context) {
        requireNonNull(record, "record");
        requireNonNull(context, "context");
        if (record.source() == null || record.source().isBlank()) {
            throw new InvalidInputException("Art requires a source image");
        }
        String sourceName = Locations.baseName(record.source());
        ImageResource source =
                ImageResource.atLocation(record.source(), sourceName, record.dimensions(), context);
        ArtItem art = new ArtItem(
                record.id(), source, sourceName, record.metadata().copy(), record.dimensions(), context);
        record.thumbnails().forEach((width, location) -> {
            if (width == null || width <= 0) {
                throw new InvalidInputException("Thumbnail width must be positive: " + width);
            }
            art.thumbnails.put(width, ImageResource.atLocation(location, sourceName, null, context));
        });
        return art;
    }

    /**
     * Creates an item from an image held in memory. The title names the item, and the image until it is
     * saved.
     *
     * @throws InvalidInputException if {@code metadata} has no title
     * @throws IOException if the image format cannot be recognized
     */
    public static ArtItem fromBuffer(byte[] buffer, ArtMetadata metadata, ImagingContext context)
            throws IOException {
        return fromBuffer(null, buffer, metadata, context);
    }

    public static ArtItem fromBuffer(String id, byte[] buffer, ArtMetadata metadata, ImagingContext context)
            throws IOException {
        requireNonNull(buffer, "buffer");
        requireNonNull(context, "context");
        String title = metadata == null ? null : metadata.title().orElse(null);
        if (title == null) {
            throw new InvalidInputException("Art created from a buffer requires a title");
        }
        String extension = context.codec().probeFormat(buffer);
        ImageResource source = ImageResource.inMemory(title + "." + extension, buffer, title, context);
        return new ArtItem(id, source, title, metadata.copy(), null, context);
    }

    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public ImageResource getSource() {
        return source;
    }

    /**
     * Display name: the source's file name without extension, or the title for in-memory sources.
     */
    public String getSourceName() {
        return sourceName;
    }

    public ArtMetadata getMetadata() {
        return metadata;
    }

    public ImagingContext getContext() {
        return context;
    }

    public synchronized boolean thumbnailExists(int width) {
        return thumbnails.containsKey(width);
    }

    public synchronized Optional<ImageResource> getThumbnail(int width) {
        return Optional.ofNullable(thumbnails.get(width));
    }

    /**
     * @return an unmodifiable snapshot of the thumbnails by width
     */
    public synchronized Map<Integer, ImageResource> getThumbnails() {
        return Collections.unmodifiableMap(new TreeMap<>(thumbnails));
    }

    /**
     * @return the bytes of the thumbnail of {@code width}, creating it in memory if it does not exist
     */
    public synchronized byte[] loadOrCreateThumbnail(int width) throws IOException {
        ImageResource thumbnail = thumbnails.get(width);
        if (thumbnail == null) {
            thumbnail = createThumbnail(width, ThumbnailOptions.inMemory());
        }
        return thumbnail.loadResource();
    }

    /**
     * Creates and registers a thumbnail {@code width} pixels wide.
     *
     * @throws InvalidInputException if {@code width} is not positive
     * @throws StateConflictException if a thumbnail of that width exists
     */
    public synchronized ImageResource createThumbnail(int width, ThumbnailOptions options) throws IOException {
        if (width <= 0) {
            throw new InvalidInputException("Thumbnail width must be positive: " + width);
        }
        if (thumbnails.containsKey(width)) {
            throw new StateConflictException(
                    "Thumbnail of width %d already exists for %s".formatted(width, sourceName));
        }
        ImageResource thumbnail = source.generateThumbnail(width, options);
        thumbnails.put(width, thumbnail);
        return thumbnail;
    }

    /**
     * Size of the full resolution image, probed once.
     */
    public synchronized ImageDimensions getDimensions() throws IOException {
        if (dimensions == null) {
            dimensions = source.getDimensions();
        }
        return dimensions;
    }

    public synchronized Optional<ImageDimensions> getKnownDimensions() {
        return Optional.ofNullable(dimensions);
    }

    /**
     * Re-encodes the full resolution image.
     *
     * @see ImageResource#generateImage(ImageOptions)
     */
    public ImageResource generateImage(ImageOptions options) throws IOException {
        return source.generateImage(options);
    }

    /**
     * Flat form of this item.
     *
     * @throws SerializationException if the source or a thumbnail is held only in memory
     */
    public synchronized ArtRecord toRecord() {
        requireSaved(source);
        Map<Integer, String> locations = new TreeMap<>();
        thumbnails.forEach((width, thumbnail) -> {
            requireSaved(thumbnail);
            locations.put(width, thumbnail.getId());
        });
        return new ArtRecord(id, source.getId(), locations, metadata.copy(), dimensions);
    }

    /**
     * Flat form of this item leaving out thumbnails held only in memory.
     *
     * @throws SerializationException if the source is held only in memory
     */
    public synchronized ArtRecord toSavedRecord() {
        requireSaved(source);
        Map<Integer, String> locations = new TreeMap<>();
        thumbnails.forEach((width, thumbnail) -> {
            if (!thumbnail.isInMemoryOnly()) {
                locations.put(width, thumbnail.getId());
            }
        });
        return new ArtRecord(id, source.getId(), locations, metadata.copy(), dimensions);
    }

    private void requireSaved(ImageResource resource) {
        if (resource.isInMemoryOnly()) {
            throw new SerializationException(
                    "Cannot serialize %s: %s is only stored in memory, save it first".formatted(
                            sourceName, resource.getId()));
        }
    }

    /**
     * @see MetadataProjector#toCanvas(ArtItem, String, IiifOptions)
     */
    public Canvas toIiifCanvas(String canvasId, IiifOptions options) throws IOException {
        return MetadataProjector.toCanvas(this, canvasId, options);
    }

    /**
     * @see MetadataProjector#toManifest(ArtItem, String, IiifOptions)
     */
    public Manifest toIiifManifest(String manifestId, IiifOptions options) throws IOException {
        return MetadataProjector.toManifest(this, manifestId, options);
    }

    @Override
    public String toString() {
        return "ArtItem[" + (id == null ? "" : id + ", ") + sourceName + "]";
    }
}
