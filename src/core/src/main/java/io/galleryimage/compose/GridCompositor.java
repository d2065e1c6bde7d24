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

import io.galleryimage.ImagingContext;
import io.galleryimage.JobLog;
import io.galleryimage.ResourceUnavailableException;
import io.galleryimage.art.ArtItem;
import io.galleryimage.art.ArtMetadata;
import io.galleryimage.art.ImageOptions;
import io.galleryimage.art.ImageResource;
import io.galleryimage.codec.CanvasSpec;
import io.galleryimage.codec.ImageBlock;
import io.galleryimage.codec.ImageDimensions;
import io.galleryimage.layout.GridCell;
import io.galleryimage.layout.GridLayout;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Composes a {@link GridLayout} into a single image.
 * <p>
 * Each cell is a thumbnail of {@link GridLayout#getThumbnailWidth()} pixels, loaded or created in memory. The
 * first thumbnail that can be produced fixes the cell size; cell {@code (r, c)} is painted at
 * {@code top = r * cellHeight, left = c * cellWidth} onto a canvas of {@code numCols * cellWidth} by
 * {@code numRows * cellHeight}. Thumbnails are produced in parallel. A cell whose thumbnail fails is left
 * blank and reported in {@link GridComposite#skippedCells()}.
 * <p>
 * The canvas becomes an in-memory {@link ArtItem} titled after the layout, which is then encoded as the
 * requested {@link ImageOptions#outputType() output type}.
 */
@Slf4j
public class GridCompositor implements AutoCloseable {

    private final ExecutorService executor;

    /**
     * Creates a compositor with one worker per available processor.
     */
    public GridCompositor() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public GridCompositor(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        this.executor = Executors.newFixedThreadPool(threads);
    }

    /**
     * Composes {@code layout}. {@link ImageOptions#executor()}, when set, runs the per-cell work instead of
     * this compositor's own pool.
     *
     * @throws ResourceUnavailableException if no cell of the layout can produce a thumbnail
     * @throws IOException if the composite cannot be encoded or saved
     */
    public GridComposite assemble(GridLayout layout, ImageOptions options) throws IOException {
        requireNonNull(layout, "layout");
        requireNonNull(options, "options");
        final JobLog jobLog = options.jobLog(GridCompositor.class);
        final int width = layout.getThumbnailWidth();
        final ImagingContext context = layout.getContext();
        final List<GridCell> cells = layout.cells().toList();

        // cells that already failed while sizing are not fetched again
        final Map<Integer, Throwable> sizingFailures = new HashMap<>();
        final ImageDimensions cellSize = representativeSize(layout, cells, width, sizingFailures, jobLog);
        final int cellWidth = cellSize.width();
        final int cellHeight = cellSize.height();
        jobLog.info("Composing {}x{} layout {} with {}x{} cells",
                layout.getNumRows(), layout.getNumCols(), layout.getName(), cellWidth, cellHeight);

        @SuppressWarnings("unchecked")
        CompletableFuture<byte[]>[] futures = new CompletableFuture[cells.size()];
        for (int i = 0; i < cells.size(); i++) {
            GridCell cell = cells.get(i);
            Throwable sizingFailure = sizingFailures.get(i);
            futures[i] = sizingFailure == null
                    ? CompletableFuture.supplyAsync(() -> thumbnail(cell, width, context, jobLog), executorFor(options))
                    : CompletableFuture.failedFuture(sizingFailure);
        }
        // failures are collected per cell below
        CompletableFuture.allOf(futures).exceptionally(ex -> null).join();

        List<ImageBlock> blocks = new ArrayList<>(cells.size());
        List<CellPlacement> placements = new ArrayList<>(cells.size());
        List<CellFailure> skipped = new ArrayList<>();
        for (int i = 0; i < cells.size(); i++) {
            GridCell cell = cells.get(i);
            String sourceName = cell.art().getSourceName();
            try {
                byte[] bytes = futures[i].join();
                int top = cell.row() * cellHeight;
                int left = cell.column() * cellWidth;
                blocks.add(new ImageBlock(bytes, top, left));
                placements.add(new CellPlacement(cell.row(), cell.column(), top, left, sourceName));
            } catch (CompletionException e) {
                Throwable cause = unwrap(e);
                log.warn("Skipping cell [{},{}] {} of layout {}: {}",
                        cell.row(), cell.column(), sourceName, layout.getName(), cause.getMessage());
                skipped.add(new CellFailure(cell.row(), cell.column(), sourceName, cause));
            }
        }

        CanvasSpec canvasSpec = CanvasSpec.of(cellWidth * layout.getNumCols(), cellHeight * layout.getNumRows());
        byte[] canvasBytes = context.codec().composite(canvasSpec, blocks);
        jobLog.progress("Painted {} of {} cells onto {}x{} canvas",
                blocks.size(), cells.size(), canvasSpec.width(), canvasSpec.height());

        ArtItem canvas = ArtItem.fromBuffer(canvasBytes, ArtMetadata.titled(layout.getName()), context);
        ImageResource output = canvas.generateImage(options);
        return new GridComposite(canvas, output, canvasSpec.width(), canvasSpec.height(), cellWidth, cellHeight,
                placements, skipped);
    }

    private ImageDimensions representativeSize(GridLayout layout, List<GridCell> cells, int width,
            Map<Integer, Throwable> failures, JobLog jobLog) throws IOException {
        Exception last = null;
        for (int i = 0; i < cells.size(); i++) {
            ArtItem art = cells.get(i).art();
            try {
                byte[] thumbnail = art.loadOrCreateThumbnail(width);
                return layout.getContext().codec().probeDimensions(thumbnail);
            } catch (IOException | RuntimeException e) {
                jobLog.progress("No thumbnail for {}, trying next cell: {}", art.getSourceName(), e.getMessage());
                failures.put(i, e);
                last = e;
            }
        }
        throw new ResourceUnavailableException(layout.getName(),
                "No cell of layout %s could produce a thumbnail".formatted(layout.getName()), last);
    }

    /**
     * Loads the cell's thumbnail and checks that it decodes, so a corrupt thumbnail fails its own cell
     * rather than the whole composite.
     */
    private static byte[] thumbnail(GridCell cell, int width, ImagingContext context, JobLog jobLog) {
        try {
            byte[] bytes = cell.art().loadOrCreateThumbnail(width);
            context.codec().probeDimensions(bytes);
            jobLog.progress("Loaded thumbnail for cell [{},{}] {}", cell.row(), cell.column(),
                    cell.art().getSourceName());
            return bytes;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Executor executorFor(ImageOptions options) {
        return options.executor() == null ? executor : options.executor();
    }

    private static Throwable unwrap(CompletionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        if (cause instanceof UncheckedIOException unchecked) {
            return unchecked.getCause();
        }
        return cause;
    }

    /**
     * Shuts down the worker pool, waiting briefly for running cells.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
