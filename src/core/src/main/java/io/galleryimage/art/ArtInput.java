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

import com.fasterxml.jackson.databind.JsonNode;
import io.galleryimage.InvalidInputException;
import io.galleryimage.iiif.IiifJson;
import io.galleryimage.iiif.MetadataProjector;

/**
 * The shapes an art item can be read from. {@link #toArtRecord()} normalizes each to an {@link ArtRecord}.
 */
public sealed interface ArtInput permits ArtInput.Current, ArtInput.Legacy, ArtInput.Iiif {

    ArtRecord toArtRecord();

    record Current(ArtRecord record) implements ArtInput {
        public Current {
            requireNonNull(record, "record");
        }

        @Override
        public ArtRecord toArtRecord() {
            return record;
        }
    }

    record Legacy(LegacyArtRecord record) implements ArtInput {
        public Legacy {
            requireNonNull(record, "record");
        }

        @Override
        public ArtRecord toArtRecord() {
            return record.toArtRecord();
        }
    }

    /**
     * A IIIF Canvas, or a Manifest whose first canvas describes the item.
     */
    record Iiif(JsonNode resource) implements ArtInput {
        public Iiif {
            requireNonNull(resource, "resource");
        }

        @Override
        public ArtRecord toArtRecord() {
            return MetadataProjector.toArtRecord(resource);
        }
    }

    /**
     * Detects the shape of a JSON object: {@code type} marks IIIF, {@code orig} the legacy record and
     * {@code source} the current one.
     *
     * @throws InvalidInputException if the shape is not recognized
     */
    static ArtInput parse(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new InvalidInputException("Art input must be a JSON object");
        }
        if (json.hasNonNull("type")) {
            return new Iiif(json);
        }
        if (json.hasNonNull("orig")) {
            return new Legacy(IiifJson.convert(json, LegacyArtRecord.class));
        }
        if (json.hasNonNull("source")) {
            return new Current(IiifJson.convert(json, ArtRecord.class));
        }
        throw new InvalidInputException("Unrecognized art input, expected a source, orig or IIIF type field");
    }

    static ArtInput parse(String json) {
        return parse(IiifJson.readTree(json));
    }
}
