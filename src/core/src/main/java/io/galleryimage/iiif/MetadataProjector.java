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
package io.galleryimage.iiif;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import io.galleryimage.InvalidInputException;
import io.galleryimage.JobLog;
import io.galleryimage.art.ArtItem;
import io.galleryimage.art.ArtMetadata;
import io.galleryimage.art.ArtRecord;
import io.galleryimage.art.ImageResource;
import io.galleryimage.codec.ImageDimensions;
import io.galleryimage.layout.GridCell;
import io.galleryimage.layout.GridLayout;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps art items and grid layouts to IIIF Presentation 3 resources and back.
 * <p>
 * Canvases carry one annotation page with one painting annotation whose body is the full resolution image.
 * Thumbnails are listed largest first; metadata entries follow the item's field order with capitalized
 * labels. Grid layouts are projected in row-major order.
 */
public final class MetadataProjector {

    private static final String CANVAS_SUFFIX = "/canvas";

    private MetadataProjector() {
        // utility class
    }

    /**
     * Projects an item to a top-level canvas, saved as {@code <sourceName>-canvas.json} when
     * {@link IiifOptions#saveFile()} is on.
     */
    public static Canvas toCanvas(ArtItem art, String canvasId, IiifOptions options) throws IOException {
        IiifOptions opts = options == null ? IiifOptions.defaults() : options;
        Canvas canvas = canvas(art, canvasId, opts, PresentationResource.PRESENTATION_CONTEXT);
        save(art, art.getSourceName() + "-canvas.json", canvas, opts);
        return canvas;
    }

    /**
     * Projects an item to a manifest holding its canvas {@code <manifestId>/canvas}, saved as
     * {@code <sourceName>-manifest.json} when {@link IiifOptions#saveFile()} is on.
     */
    public static Manifest toManifest(ArtItem art, String manifestId, IiifOptions options) throws IOException {
        IiifOptions opts = options == null ? IiifOptions.defaults() : options;
        Manifest manifest = manifest(art, manifestId, opts, PresentationResource.PRESENTATION_CONTEXT);
        save(art, art.getSourceName() + "-manifest.json", manifest, opts);
        return manifest;
    }

    /**
     * Projects a layout to one manifest with a canvas per cell, or a collection with a manifest per cell.
     * The result is identified as {@code <layoutId>-contents} and saved as {@code <name>-manifest.json} or
     * {@code <name>-collection.json} when {@link IiifOptions#saveFile()} is on.
     */
    public static PresentationResource toPresentation(GridLayout layout, IiifType type, IiifOptions options)
            throws IOException {
        requireNonNull(layout, "layout");
        requireNonNull(type, "type");
        IiifOptions opts = options == null ? IiifOptions.defaults() : options;
        JobLog log = opts.jobLog(MetadataProjector.class);

        String id = layout.getId().orElse(layout.getName()) + "-contents";
        Map<String, List<String>> label = languageMap(layout.getName());
        List<ArtItem> cells = layout.cells().map(GridCell::art).toList();

        PresentationResource result;
        String fileName;
        if (type == IiifType.MANIFEST) {
            List<Canvas> canvases = new ArrayList<>(cells.size());
            for (ArtItem art : cells) {
                canvases.add(canvas(art, itemId(art) + CANVAS_SUFFIX, opts, null));
            }
            result = new Manifest(PresentationResource.PRESENTATION_CONTEXT, id, Manifest.TYPE, label, canvases);
            fileName = layout.getName() + "-manifest.json";
        } else {
            List<Manifest> manifests = new ArrayList<>(cells.size());
            for (ArtItem art : cells) {
                manifests.add(manifest(art, itemId(art), opts, null));
            }
            result = new Collection(
                    PresentationResource.PRESENTATION_CONTEXT, id, Collection.TYPE, label, manifests);
            fileName = layout.getName() + "-collection.json";
        }
        log.info("Projected layout {} to a {} of {} items", layout.getName(), result.type(), cells.size());
        if (opts.saveFile()) {
            String path =
                    layout.getContext().store().save(opts.outputDir(), fileName, IiifJson.toJsonBytes(result));
            log.progress("Saved {}", path);
        }
        return result;
    }

    /**
     * Metadata as IIIF {@code {label, value}} pairs in field order, labels capitalized.
     */
    public static List<MetadataEntry> toMetadataEntries(ArtMetadata metadata) {
        List<MetadataEntry> entries = new ArrayList<>();
        metadata.asMap().forEach((key, value) -> entries.add(MetadataEntry.of(capitalize(key), value)));
        return entries;
    }

    /**
     * Reads an art record from a canvas, or from the first canvas of a manifest.
     * <p>
     * The source is the body of the first painting annotation, thumbnails are keyed by their width and
     * metadata labels are lower-cased. A canvas id ending in {@code /canvas} yields the item id without that
     * suffix.
     *
     * @throws InvalidInputException if the resource is neither a canvas nor a manifest, or lacks a source
     */
    public static ArtRecord toArtRecord(JsonNode resource) {
        requireNonNull(resource, "resource");
        String type = resource.path("type").asText();
        JsonNode canvas;
        String itemId;
        if (Manifest.TYPE.equals(type)) {
            canvas = resource.path("items").path(0);
            if (!Canvas.TYPE.equals(canvas.path("type").asText())) {
                throw new InvalidInputException("Manifest %s has no canvas".formatted(resource.path("id").asText()));
            }
            itemId = textOrNull(resource.get("id"));
        } else if (Canvas.TYPE.equals(type)) {
            canvas = resource;
            itemId = textOrNull(resource.get("id"));
            if (itemId != null && itemId.endsWith(CANVAS_SUFFIX)) {
                itemId = itemId.substring(0, itemId.length() - CANVAS_SUFFIX.length());
            }
        } else {
            throw new InvalidInputException("Expected a IIIF Canvas or Manifest, got: " + type);
        }

        JsonNode body = canvas.path("items").path(0).path("items").path(0).path("body");
        if (body.isArray()) {
            body = body.path(0);
        }
        String source = textOrNull(body.get("id"));
        if (source == null) {
            throw new InvalidInputException(
                    "Canvas %s has no painting annotation".formatted(canvas.path("id").asText()));
        }

        Map<Integer, String> thumbnails = new LinkedHashMap<>();
        for (JsonNode thumbnail : canvas.path("thumbnail")) {
            int width = thumbnail.path("width").asInt(0);
            String location = textOrNull(thumbnail.get("id"));
            if (width <= 0 || location == null) {
                throw new InvalidInputException("Thumbnail of %s needs an id and a width".formatted(source));
            }
            thumbnails.put(width, location);
        }

        ArtMetadata metadata = new ArtMetadata();
        for (JsonNode entry : canvas.path("metadata")) {
            String label = firstValue(entry.get("label"));
            if (label != null) {
                metadata.put(label.toLowerCase(Locale.ROOT), firstValue(entry.get("value")));
            }
        }

        ImageDimensions dimensions = null;
        int width = canvas.path("width").asInt(0);
        int height = canvas.path("height").asInt(0);
        if (width > 0 && height > 0) {
            dimensions = ImageDimensions.of(width, height);
        }
        return new ArtRecord(itemId, source, thumbnails, metadata, dimensions);
    }

    /**
     * Canvases of a collection (through its manifests) or a manifest, in document order.
     *
     * @throws InvalidInputException for any other resource type
     */
    public static List<JsonNode> canvases(JsonNode resource) {
        String type = resource.path("type").asText();
        List<JsonNode> canvases = new ArrayList<>();
        if (Collection.TYPE.equals(type)) {
            for (JsonNode manifest : resource.path("items")) {
                manifest.path("items").forEach(canvases::add);
            }
        } else if (Manifest.TYPE.equals(type)) {
            resource.path("items").forEach(canvases::add);
        } else {
            throw new InvalidInputException("Invalid IIIF object, provide a Collection or Manifest: " + type);
        }
        return canvases;
    }

    /**
     * First string of a language map, {@code en} preferred; plain strings are returned as is.
     */
    public static String firstValue(JsonNode languageMap) {
        if (languageMap == null || languageMap.isNull() || languageMap.isMissingNode()) {
            return null;
        }
        if (languageMap.isTextual()) {
            return languageMap.asText();
        }
        JsonNode values = languageMap.get(MetadataEntry.LANGUAGE);
        if (values == null) {
            Iterator<JsonNode> languages = languageMap.elements();
            values = languages.hasNext() ? languages.next() : null;
        }
        if (values == null) {
            return null;
        }
        JsonNode first = values.isArray() ? values.path(0) : values;
        return first.isValueNode() ? first.asText() : null;
    }

    private static Canvas canvas(ArtItem art, String canvasId, IiifOptions opts, String context) throws IOException {
        requireNonNull(art, "art");
        if (canvasId == null || canvasId.isBlank()) {
            throw new InvalidInputException("Canvas id is required");
        }
        ImageDimensions dims = art.getDimensions();
        ContentResource body = art.getSource().toIiifContentResource(opts);

        List<ContentResource> thumbnail = null;
        if (!opts.excludes(IiifExclusion.THUMBNAILS)) {
            thumbnail = new ArrayList<>();
            List<Map.Entry<Integer, ImageResource>> bySize = new ArrayList<>(art.getThumbnails().entrySet());
            bySize.sort(Map.Entry.<Integer, ImageResource>comparingByKey(Comparator.reverseOrder()));
            for (Map.Entry<Integer, ImageResource> entry : bySize) {
                thumbnail.add(entry.getValue().toIiifContentResource(opts));
            }
        }
        List<MetadataEntry> metadata =
                opts.excludes(IiifExclusion.METADATA) ? null : toMetadataEntries(art.getMetadata());

        String pageId = canvasId + "/page";
        Annotation annotation = Annotation.painting(pageId + "/annotation", body, canvasId);
        return new Canvas(context, canvasId, Canvas.TYPE, label(art), dims.width(), dims.height(), thumbnail,
                metadata, List.of(AnnotationPage.of(pageId, List.of(annotation))));
    }

    private static Manifest manifest(ArtItem art, String manifestId, IiifOptions opts, String context)
            throws IOException {
        if (manifestId == null || manifestId.isBlank()) {
            throw new InvalidInputException("Manifest id is required");
        }
        Canvas canvas = canvas(art, manifestId + CANVAS_SUFFIX, opts, null);
        return new Manifest(context, manifestId, Manifest.TYPE, label(art), List.of(canvas));
    }

    private static void save(ArtItem art, String fileName, PresentationResource resource, IiifOptions opts)
            throws IOException {
        if (opts.saveFile()) {
            String path = art.getContext().store().save(opts.outputDir(), fileName, IiifJson.toJsonBytes(resource));
            opts.jobLog(MetadataProjector.class).progress("Saved {}", path);
        }
    }

    private static String itemId(ArtItem art) {
        return art.getId().orElse(art.getSourceName());
    }

    private static Map<String, List<String>> label(ArtItem art) {
        return languageMap(art.getMetadata().title().orElse(art.getSourceName()));
    }

    private static Map<String, List<String>> languageMap(String value) {
        return Map.of(MetadataEntry.LANGUAGE, List.of(value));
    }

    private static String capitalize(String key) {
        if (key.isEmpty()) {
            return key;
        }
        return key.substring(0, 1).toUpperCase(Locale.ROOT) + key.substring(1);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() || !node.isValueNode() ? null : node.asText();
    }
}
