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
package io.galleryimage.layout;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import io.galleryimage.ImagingContext;
import io.galleryimage.InvalidInputException;
import io.galleryimage.JobLog;
import io.galleryimage.LogLevel;
import io.galleryimage.StateConflictException;
import io.galleryimage.art.ArtInput;
import io.galleryimage.art.ArtItem;
import io.galleryimage.art.ArtRecord;
import io.galleryimage.art.ImageOptions;
import io.galleryimage.codec.ImageDimensions;
import io.galleryimage.compose.GridComposite;
import io.galleryimage.compose.GridCompositor;
import io.galleryimage.iiif.Collection;
import io.galleryimage.iiif.IiifJson;
import io.galleryimage.iiif.IiifOptions;
import io.galleryimage.iiif.IiifType;
import io.galleryimage.iiif.Manifest;
import io.galleryimage.iiif.MetadataProjector;
import io.galleryimage.iiif.PresentationResource;
import io.galleryimage.store.LayoutRepository;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Art items arranged in rows and columns, all composited at the same thumbnail width.
 * <p>
 * Every row holds {@link #getNumCols()} items except possibly the last one, which may be shorter when the
 * layout was filled from a pool smaller than the grid. Absent trailing cells are not represented.
 */
public class GridLayout {

    /** Thumbnail width used when none is given. */
    public static final int DEFAULT_THUMBNAIL_WIDTH = 288;

    private final String id;
    private final String name;
    private final List<List<ArtItem>> rows;
    private final int numRows;
    private final int numCols;
    private final int thumbnailWidth;
    private final ImagingContext context;

    private ArtRecord imageRecord;
    private GridComposite composite;

    private GridLayout(Builder builder, List<List<ArtItem>> rows) {
        this.id = builder.id;
        this.name = builder.name;
        this.rows = rows;
        this.numRows = rows.size();
        this.numCols = rows.get(0).size();
        this.thumbnailWidth = builder.thumbnailWidth;
        this.context = builder.context;
        this.imageRecord = builder.imageRecord;
    }

    public static Builder builder(ImagingContext context) {
        return new Builder(context);
    }

    /**
     * Rebuilds a layout from its flat form, cells in their recorded positions.
     *
     * @throws InvalidInputException if the record is malformed or its counts disagree with its array
     */
    public static GridLayout fromRecord(LayoutRecord record, ImagingContext context) {
        requireNonNull(record, "record");
        List<List<ArtItem>> array = new ArrayList<>();
        for (List<ArtRecord> row : record.array()) {
            array.add(row.stream().map(art -> ArtItem.fromRecord(art, context)).toList());
        }
        GridLayout layout = builder(context)
                .id(record.id())
                .name(record.name())
                .thumbnailWidth(record.thumbnailWidth() == null ? DEFAULT_THUMBNAIL_WIDTH : record.thumbnailWidth())
                .array(array)
                .imageRecord(record.image())
                .build();
        if ((record.numRows() != null && record.numRows() != layout.numRows)
                || (record.numCols() != null && record.numCols() != layout.numCols)) {
            throw new InvalidInputException("Layout %s declares %sx%s cells but its array is %dx%d".formatted(
                    record.name(), record.numRows(), record.numCols(), layout.numRows, layout.numCols));
        }
        return layout;
    }

    /**
     * Loads a saved layout.
     *
     * @throws InvalidInputException if the repository has no layout {@code id}
     */
    public static GridLayout load(LayoutRepository repository, String id, ImagingContext context)
            throws IOException {
        LayoutRecord record = requireNonNull(repository, "repository")
                .findLayoutById(id)
                .orElseThrow(() -> new InvalidInputException("No layout found with id " + id));
        return fromRecord(record, context);
    }

    /**
     * Lays out the canvases of a IIIF Collection or Manifest at random with the default ratio.
     * <p>
     * The thumbnail width is the width of the first canvas that declares one, or else the probed width of
     * the first item's image. The layout is named after the resource's label.
     *
     * @throws InvalidInputException if the resource is neither a Collection nor a Manifest, or has no canvas
     */
    public static GridLayout fromIiif(JsonNode resource, ImagingContext context) throws IOException {
        return fromIiif(resource, context, new Random());
    }

    public static GridLayout fromIiif(JsonNode resource, ImagingContext context, Random random)
            throws IOException {
        requireNonNull(resource, "resource");
        List<ArtItem> pool = MetadataProjector.canvases(resource).stream()
                .map(canvas -> ArtItem.from(new ArtInput.Iiif(canvas), context))
                .toList();
        if (pool.isEmpty()) {
            throw new InvalidInputException("IIIF resource has no canvases");
        }

        Integer width = pool.stream()
                .map(ArtItem::getKnownDimensions)
                .flatMap(Optional::stream)
                .map(ImageDimensions::width)
                .findFirst()
                .orElse(null);
        if (width == null) {
            width = pool.get(0).getDimensions().width();
        }

        String label = MetadataProjector.firstValue(resource.get("label"));
        return builder(context)
                .id(textOrNull(resource.get("id")))
                .name(label)
                .thumbnailWidth(width)
                .pool(pool)
                .random(random)
                .build();
    }

    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public String getName() {
        return name;
    }

    /**
     * @return the rows of art items, unmodifiable
     */
    public List<List<ArtItem>> getRows() {
        return rows;
    }

    public int getNumRows() {
        return numRows;
    }

    public int getNumCols() {
        return numCols;
    }

    public int getThumbnailWidth() {
        return thumbnailWidth;
    }

    public ImagingContext getContext() {
        return context;
    }

    /**
     * @return every cell in row-major order
     */
    public Stream<GridCell> cells() {
        return IntStream.range(0, numRows).boxed().flatMap(row -> {
            List<ArtItem> items = rows.get(row);
            return IntStream.range(0, items.size()).mapToObj(col -> new GridCell(row, col, items.get(col)));
        });
    }

    public synchronized boolean hasImage() {
        return composite != null || imageRecord != null;
    }

    /**
     * @return the composite generated by {@link #generateImage}, if any
     */
    public synchronized Optional<GridComposite> getComposite() {
        return Optional.ofNullable(composite);
    }

    /**
     * Composes the layout into one image.
     * <p>
     * With {@code saveFile} on, the layout is also saved as {@code <name>-layout.json} next to the image;
     * thumbnails created only in memory during composition are left out of that file.
     *
     * @throws StateConflictException if the layout already has an image
     */
    public synchronized GridComposite generateImage(GridCompositor compositor, ImageOptions options)
            throws IOException {
        requireNonNull(compositor, "compositor");
        if (hasImage()) {
            throw new StateConflictException("Layout %s already has an image".formatted(name));
        }
        if (options == null || options.outputType() == null) {
            throw new InvalidInputException("Must specify an output type");
        }
        JobLog log = options.jobLog(GridLayout.class);
        log.info("Generating image for layout {}", name);

        composite = compositor.assemble(this, options);

        if (options.saveFile()) {
            LayoutRecord record = toRecord(ArtItem::toSavedRecord);
            String path = context.store()
                    .save(options.outputDir(), name + "-layout.json", IiifJson.toJsonBytes(record));
            log.info("Saved layout {} to {}", name, path);
        }
        return composite;
    }

    /**
     * Flat form of this layout.
     *
     * @throws io.galleryimage.SerializationException if an image of the layout is held only in memory
     */
    public LayoutRecord toRecord() {
        return toRecord(ArtItem::toRecord);
    }

    private synchronized LayoutRecord toRecord(Function<ArtItem, ArtRecord> cellRecord) {
        List<List<ArtRecord>> array = rows.stream().map(row -> row.stream().map(cellRecord).toList()).toList();
        ArtRecord image = composite != null ? composite.toRecord() : imageRecord;
        return new LayoutRecord(id, name, image, array, numRows, numCols, thumbnailWidth);
    }

    /**
     * Projects the layout to IIIF.
     *
     * @see MetadataProjector#toPresentation(GridLayout, IiifType, IiifOptions)
     */
    public PresentationResource arrayToIiif(IiifType type, IiifOptions options) throws IOException {
        return MetadataProjector.toPresentation(this, type, options);
    }

    public Manifest toIiifManifest(IiifOptions options) throws IOException {
        return (Manifest) arrayToIiif(IiifType.MANIFEST, options);
    }

    public Collection toIiifCollection(IiifOptions options) throws IOException {
        return (Collection) arrayToIiif(IiifType.COLLECTION, options);
    }

    @Override
    public String toString() {
        return "GridLayout[%s, %dx%d]".formatted(name, numRows, numCols);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || !node.isValueNode() ? null : node.asText();
    }

    /**
     * Builds a layout either from a ready arrangement ({@link #array}) or from a pool placed at random
     * ({@link #pool}), sized by explicit {@link #dimensions} or by {@link #ratio} (default 9:16).
     */
    public static class Builder {
        private final ImagingContext context;
        private String id;
        private String name;
        private int thumbnailWidth = DEFAULT_THUMBNAIL_WIDTH;
        private List<? extends List<ArtItem>> array;
        private List<ArtItem> pool;
        private Integer rows;
        private Integer cols;
        private Double ratio;
        private Random random;
        private LogLevel logLevel = LogLevel.STANDARD;
        private ArtRecord imageRecord;

        private Builder(ImagingContext context) {
            this.context = requireNonNull(context, "context");
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder thumbnailWidth(int thumbnailWidth) {
            this.thumbnailWidth = thumbnailWidth;
            return this;
        }

        public Builder array(List<? extends List<ArtItem>> array) {
            this.array = array;
            return this;
        }

        public Builder pool(List<ArtItem> pool) {
            this.pool = pool;
            return this;
        }

        /**
         * Places the pool in records of the current or legacy shape.
         */
        public Builder poolOf(List<ArtInput> inputs) {
            this.pool = inputs.stream().map(input -> ArtItem.from(input, context)).toList();
            return this;
        }

        public Builder dimensions(int numRows, int numCols) {
            this.rows = numRows;
            this.cols = numCols;
            return this;
        }

        public Builder ratio(double ratio) {
            this.ratio = ratio;
            return this;
        }

        /**
         * Source of randomness for pool placement, for reproducible layouts.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        Builder imageRecord(ArtRecord imageRecord) {
            this.imageRecord = imageRecord;
            return this;
        }

        /**
         * @throws InvalidInputException if the name is missing, the thumbnail width is not positive, both or
         *         neither of array and pool are given, dimensions or ratio accompany an array, both dimensions
         *         and ratio accompany a pool, the pool is empty or exceeds the explicit dimensions, or the
         *         array is jagged
         */
        public GridLayout build() {
            if (name == null || name.isBlank()) {
                throw new InvalidInputException("No layout name provided");
            }
            if (thumbnailWidth <= 0) {
                throw new InvalidInputException("Thumbnail width must be positive: " + thumbnailWidth);
            }
            if (array != null && pool != null) {
                throw new InvalidInputException("Provide either an array or a pool of art, not both");
            }
            if (array != null) {
                return new GridLayout(this, fromArray());
            }
            if (pool != null) {
                return new GridLayout(this, fromPool());
            }
            throw new InvalidInputException("No art provided: set an array or a pool");
        }

        private List<List<ArtItem>> fromArray() {
            if (rows != null || cols != null) {
                throw new InvalidInputException("Cannot set rows or columns when an array is provided");
            }
            if (ratio != null) {
                throw new InvalidInputException("Cannot set an aspect ratio when an array is provided");
            }
            if (array.isEmpty() || array.get(0) == null || array.get(0).isEmpty()) {
                throw new InvalidInputException("Layout array must have at least one non-empty row");
            }
            final int width = array.get(0).size();
            List<List<ArtItem>> copy = new ArrayList<>(array.size());
            for (int r = 0; r < array.size(); r++) {
                List<ArtItem> row = array.get(r);
                boolean last = r == array.size() - 1;
                int size = row == null ? 0 : row.size();
                if (size == 0 || size > width || (!last && size != width)) {
                    throw new InvalidInputException(
                            "Jagged layout array: row %d has %d items, expected %d".formatted(r, size, width));
                }
                copy.add(List.copyOf(row));
            }
            return List.copyOf(copy);
        }

        private List<List<ArtItem>> fromPool() {
            if ((rows != null || cols != null) && ratio != null) {
                throw new InvalidInputException("Cannot pass both rows/columns and a ratio");
            }
            if (pool.isEmpty()) {
                throw new InvalidInputException("No art provided for random placement");
            }
            JobLog log = JobLog.of(GridLayout.class, logLevel);
            log.info("Creating random pattern for {} items", pool.size());

            RandomPlacement.GridSize size = rows != null
                    ? new RandomPlacement.GridSize(rows, cols == null ? 0 : cols)
                    : RandomPlacement.sizeForRatio(pool.size(), ratio == null ? RandomPlacement.DEFAULT_RATIO : ratio);
            List<List<ArtItem>> placed =
                    RandomPlacement.place(pool, size, random == null ? new Random() : random);
            log.progress("Random pattern width: {}, height: {}", placed.get(0).size(), placed.size());
            return placed;
        }
    }
}
