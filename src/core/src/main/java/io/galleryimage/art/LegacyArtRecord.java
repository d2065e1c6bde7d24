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

import com.fasterxml.jackson.annotation.JsonProperty;
import io.galleryimage.InvalidInputException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Art records as written by earlier versions: the full resolution image under {@code orig}, thumbnails
 * keyed {@code s-<width>px}, and the metadata fields at top level.
 * <p>
 * {@code tiles}, a deprecated reference to a zoomable rendition, is read but not carried over.
 */
public record LegacyArtRecord(
        @JsonProperty("_id") String id,
        String orig,
        String tiles,
        Map<String, String> thumbnails,
        String creator,
        String title,
        String details,
        String date,
        String location) {

    private static final Pattern THUMBNAIL_KEY = Pattern.compile("s-(\\d+)px");

    /**
     * @throws InvalidInputException if a thumbnail key is not of the form {@code s-<width>px}
     */
    public ArtRecord toArtRecord() {
        Map<Integer, String> widths = new LinkedHashMap<>();
        if (thumbnails != null) {
            thumbnails.forEach((key, location) -> widths.put(thumbnailWidth(key), location));
        }
        ArtMetadata metadata = new ArtMetadata()
                .put(ArtMetadata.CREATOR, creator)
                .put(ArtMetadata.TITLE, title)
                .put(ArtMetadata.DETAILS, details)
                .put(ArtMetadata.DATE, date)
                .put(ArtMetadata.LOCATION, location);
        return new ArtRecord(id, orig, widths, metadata, null);
    }

    static int thumbnailWidth(String key) {
        Matcher matcher = key == null ? null : THUMBNAIL_KEY.matcher(key);
        if (matcher == null || !matcher.matches()) {
            throw new InvalidInputException("Invalid legacy thumbnail key: " + key);
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Invalid legacy thumbnail key: " + key, e);
        }
    }
}
