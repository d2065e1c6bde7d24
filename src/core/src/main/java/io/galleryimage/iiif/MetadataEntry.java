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

import java.util.List;
import java.util.Map;

/**
 * One {@code {label, value}} pair of a resource's descriptive metadata, each a language map.
 */
public record MetadataEntry(Map<String, List<String>> label, Map<String, List<String>> value) {

    public static final String LANGUAGE = "en";

    public static MetadataEntry of(String label, String value) {
        return new MetadataEntry(Map.of(LANGUAGE, List.of(label)), Map.of(LANGUAGE, List.of(value)));
    }
}
