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
import io.galleryimage.JobLog;
import io.galleryimage.SerializationException;
import io.galleryimage.codec.ImageDimensions;
import io.galleryimage.codec.TileLayout;
import io.galleryimage.codec.TileSizes;
import io.galleryimage.fetch.Locations;
import io.galleryimage.iiif.ContentResource;
import io.galleryimage.iiif.IiifOptions;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Handle to one image: a location to fetch it from, an in-memory buffer, or both.
 * <p>
 * The content is fetched on first use and kept for the lifetime of the handle; it is never fetched twice.
 * A resource created from a buffer alone carries a synthetic id ending in {@value #BUFFER_SUFFIX} until it
 * is saved.
 * <p>
 * Derived resources (thumbnails, re-encoded variants) are named after the owner, the
 * {@link ArtItem#getSourceName() source name} of the art item this resource belongs to.
 */
public class ImageResource {

    /** Suffix of the synthetic id of a resource held only in memory. */
    public static final String BUFFER_SUFFIX = "-buffer";

    private final String ownerName;
    private final ImagingContext context;

    private String id;
    private byte[] buffer;
    private ImageDimensions dimensions;

    private ImageResource(String id, String ownerName, byte[] buffer, ImageDimensions dimensions,
            ImagingContext context) {
        this.id = requireNonNull(id, "id");
        this.ownerName = requireNonNull(ownerName, "ownerName");
        this.buffer = buffer;
        this.dimensions = dimensions;
        this.context = requireNonNull(context, "context");
    }

    /**
     * A resource fetched lazily from a file path or URL.
     *
     * @param dimensions known size, {@code null} to probe on demand
     * @throws InvalidInputException if {@code location} is empty or malformed
     */
    public static ImageResource atLocation(String location, String ownerName, ImageDimensions dimensions,
            ImagingContext context) {
        return new ImageResource(Locations.canonical(location), ownerName, null, dimensions, context);
    }

    /**
     * A resource held only in memory, identified as {@code <name>-buffer}.
     *
     * @param name file name the buffer is saved under later, extension included
     */
    public static ImageResource inMemory(String name, byte[] buffer, String ownerName, ImagingContext context) {
        requireNonNull(buffer, "buffer");
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("In-memory resources need a name");
        }
        return new ImageResource(name + BUFFER_SUFFIX, ownerName, buffer, null, context);
    }

    private ImageResource derived(String newId, byte[] content) {
        return new ImageResource(newId, ownerName, content, null, context);
    }

    public synchronized String getId() {
        return id;
    }

    public String getOwnerName() {
        return ownerName;
    }

    /**
     * @return the content, fetching it from the location on the first call
     * @throws IOException if the content cannot be fetched
     */
    public synchronized byte[] loadResource() throws IOException {
        if (buffer == null) {
            buffer = context.fetcher().fetch(id);
        }
        return buffer;
    }

    /**
     * @return whether the content has been loaded or was supplied at construction
     */
    public synchronized boolean isLoaded() {
        return buffer != null;
    }

    /**
     * @return whether the content exists only in memory, with no location to fetch it from
     */
    public synchronized boolean isInMemoryOnly() {
        return buffer != null && id.endsWith(BUFFER_SUFFIX);
    }

    /**
     * Size of the image, read from the content's header on first call.
     */
    public synchronized ImageDimensions getDimensions() throws IOException {
        if (dimensions == null) {
            dimensions = context.codec().probeDimensions(loadResource());
        }
        return dimensions;
    }

    /**
     * @return the size if it was supplied or already probed, without loading anything
     */
    public synchronized Optional<ImageDimensions> getKnownDimensions() {
        return Optional.ofNullable(dimensions);
    }

    /**
     * Creates a JPEG thumbnail {@code width} pixels wide, named {@code <owner>-<width>px.jpeg}.
     *
     * @return the thumbnail, with its content loaded; its id is the saved path, or a synthetic in-memory id
     *         when {@code options.saveFile()} is off
     * @throws InvalidInputException if {@code width} is not positive, or saving without an output directory
     */
    public ImageResource generateThumbnail(int width, ThumbnailOptions options) throws IOException {
        if (width <= 0) {
            throw new InvalidInputException("Thumbnail width must be positive: " + width);
        }
        ThumbnailOptions opts = options == null ? ThumbnailOptions.inMemory() : options;
        JobLog log = opts.jobLog(ImageResource.class);

        byte[] thumbnail = context.codec().resize(loadResource(), width);
        log.progress("Created {}px thumbnail for {}", width, ownerName);

        String name = "%s-%dpx.jpeg".formatted(ownerName, width);
        return output(name, thumbnail, opts.saveFile(), opts.outputDir(), log);
    }

    /**
     * Re-encodes this image.
     * <ul>
     *   <li>{@link OutputType#TIFF}: a pyramidal TIFF {@code <owner>.tif}, tile edges from
     *       {@link TileSizes#minimumTileSize(int)}; saved when {@code saveFile} is on, kept in memory otherwise.</li>
     *   <li>{@link OutputType#IIIF}: IIIF tiles in {@code <outputDir>/<owner>/}; the returned resource is
     *       identified by {@code iiifBaseId}.</li>
     *   <li>{@link OutputType#DZI}: Deep Zoom tiles in {@code <outputDir>/<owner>/}; the returned resource is
     *       identified by that directory.</li>
     * </ul>
     * Tile directories are replaced if they exist.
     *
     * @throws InvalidInputException if the output type is missing or the options required by it are
     */
    public ImageResource generateImage(ImageOptions options) throws IOException {
        if (options == null || options.outputType() == null) {
            throw new InvalidInputException("Output type is required for image generation");
        }
        JobLog log = options.jobLog(ImageResource.class);
        ImageResource result = switch (options.outputType()) {
            case TIFF -> tiffWithPyramid(options, log);
            case IIIF -> tileDirectory(TileLayout.IIIF, options, log);
            case DZI -> tileDirectory(TileLayout.DZI, options, log);
        };
        log.info("Generated {} output for {}: {}", options.outputType(), ownerName, result.getId());
        return result;
    }

    private ImageResource tiffWithPyramid(ImageOptions options, JobLog log) throws IOException {
        ImageDimensions dims = getDimensions();
        int tileWidth = TileSizes.minimumTileSize(dims.width());
        int tileHeight = TileSizes.minimumTileSize(dims.height());
        log.progress("Encoding {}x{} pyramid for {} with {}x{} tiles",
                dims.width(), dims.height(), ownerName, tileWidth, tileHeight);
        byte[] tiff = context.codec().encodeTiledPyramid(loadResource(), tileWidth, tileHeight);
        return output(ownerName + ".tif", tiff, options.saveFile(), options.outputDir(), log);
    }

    private ImageResource tileDirectory(TileLayout layout, ImageOptions options, JobLog log) throws IOException {
        if (!options.saveFile() || options.outputDir() == null) {
            throw new InvalidInputException(
                    "%s output is written to disk, set saveFile and outputDir".formatted(layout));
        }
        String baseId = null;
        if (layout == TileLayout.IIIF) {
            if (options.iiifBaseId() == null || options.iiifBaseId().isBlank()) {
                throw new InvalidInputException("iiifBaseId is required for IIIF output");
            }
            baseId = Locations.cleanTrailingSlash(options.iiifBaseId());
        }
        byte[] content = loadResource();
        Path directory = context.store().replaceDirectory(options.outputDir(), ownerName);
        context.codec().encodeTileDirectory(content, layout, directory, ownerName, baseId);
        log.progress("Wrote {} tiles for {} to {}", layout, ownerName, directory);

        String newId = layout == TileLayout.IIIF ? baseId : directory.toString();
        return new ImageResource(newId, ownerName, null, getKnownDimensions().orElse(null), context);
    }

    private ImageResource output(String name, byte[] content, boolean saveFile, Path outputDir, JobLog log)
            throws IOException {
        if (!saveFile) {
            return derived(name + BUFFER_SUFFIX, content);
        }
        if (outputDir == null) {
            throw new InvalidInputException("Must provide an output directory to save " + name);
        }
        String path = context.store().save(outputDir, name, content);
        log.progress("Saved {}", path);
        return derived(path, content);
    }

    /**
     * Describes this image as a IIIF content resource, probing its size if unknown.
     * <p>
     * An image held only in memory is saved first when {@code options} allow it, its id then becomes the saved
     * path.
     *
     * @throws SerializationException if the image is held only in memory and cannot be saved, or its id is
     *         not a location
     * @throws InvalidInputException if the id has no file extension to derive a media type from
     */
    public synchronized ContentResource toIiifContentResource(IiifOptions options) throws IOException {
        IiifOptions opts = options == null ? IiifOptions.defaults() : options;
        ImageDimensions dims = getDimensions();

        if (id.endsWith(BUFFER_SUFFIX)) {
            if (buffer == null) {
                throw new SerializationException(
                        "Resource %s has an invalid id and is not held in memory".formatted(id));
            }
            if (!opts.saveFile() || opts.outputDir() == null) {
                throw new SerializationException(("Resource %s is only stored in memory. "
                        + "Provide an output directory to save it to disk.").formatted(id));
            }
            String name = id.substring(0, id.length() - BUFFER_SUFFIX.length());
            id = context.store().save(opts.outputDir(), name, buffer);
            opts.jobLog(ImageResource.class).progress("Saved in-memory resource to {}", id);
        } else if (!Locations.isResolvable(id)) {
            throw new SerializationException("Resource %s has an invalid id".formatted(id));
        }
        return ContentResource.image(id, getMimeType(), dims.width(), dims.height());
    }

    /**
     * Media type from the id's extension, {@code jpg} and {@code tif} normalized to {@code jpeg} and
     * {@code tiff}.
     *
     * @throws InvalidInputException if the id has no extension
     */
    public synchronized String getMimeType() {
        String path = id.endsWith(BUFFER_SUFFIX) ? id.substring(0, id.length() - BUFFER_SUFFIX.length()) : id;
        if (Locations.isUrl(path)) {
            path = URI.create(path).getPath();
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        if (dot <= slash || dot == path.length() - 1) {
            throw new InvalidInputException("%s is not a valid path to an image resource".formatted(id));
        }
        String ext = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        ext = switch (ext) {
            case "jpg" -> "jpeg";
            case "tif" -> "tiff";
            default -> ext;
        };
        return "image/" + ext;
    }

    @Override
    public synchronized String toString() {
        return "ImageResource[" + id + (buffer == null ? "" : ", " + buffer.length + " bytes") + "]";
    }
}
