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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.galleryimage.InvalidInputException;
import io.galleryimage.SerializationException;

/**
 * Shared Jackson configuration for every JSON document the library reads or writes.
 * <p>
 * Unknown properties are ignored on read, {@code null} properties are omitted on write.
 */
public final class IiifJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private IiifJson() {
        // utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @throws InvalidInputException if {@code json} is not well-formed
     */
    public static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Binds a JSON tree to {@code type}.
     *
     * @throws InvalidInputException if the tree does not match the type
     */
    public static <T> T convert(JsonNode node, Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidInputException("Cannot read %s: %s".formatted(type.getSimpleName(), e.getMessage()), e);
        }
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot write " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }

    public static byte[] toJsonBytes(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot write " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }
}
