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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Descriptive metadata of an art item: the well-known fields plus any others, in insertion order.
 * <p>
 * Serializes as a flat JSON object, e.g. {@code {"title": "Sunset", "creator": "A. Artist"}}.
 */
public final class ArtMetadata {

    public static final String CREATOR = "creator";
    public static final String TITLE = "title";
    public static final String DETAILS = "details";
    public static final String DATE = "date";
    public static final String LOCATION = "location";

    private final Map<String, String> fields = new LinkedHashMap<>();

    public ArtMetadata() {
        // empty
    }

    public static ArtMetadata of(Map<String, String> fields) {
        ArtMetadata metadata = new ArtMetadata();
        if (fields != null) {
            fields.forEach(metadata::put);
        }
        return metadata;
    }

    public static ArtMetadata titled(String title) {
        return new ArtMetadata().put(TITLE, title);
    }

    /**
     * Sets a field; a {@code null} or blank value removes it.
     */
    @JsonAnySetter
    public ArtMetadata put(String key, String value) {
        Objects.requireNonNull(key, "key");
        if (value == null || value.isBlank()) {
            fields.remove(key);
        } else {
            fields.put(key, value);
        }
        return this;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Optional<String> title() {
        return get(TITLE);
    }

    public Optional<String> creator() {
        return get(CREATOR);
    }

    public Optional<String> details() {
        return get(DETAILS);
    }

    public Optional<String> date() {
        return get(DATE);
    }

    public Optional<String> location() {
        return get(LOCATION);
    }

    @JsonAnyGetter
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public ArtMetadata copy() {
        return of(fields);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArtMetadata other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ArtMetadata" + fields;
    }
}
