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
package io.galleryimage.store;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.galleryimage.SerializationException;
import io.galleryimage.iiif.IiifJson;
import io.galleryimage.layout.LayoutRecord;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LayoutRepository} over a JSON file holding an array of layout records.
 * <p>
 * The file is read on first lookup and kept in memory; {@link #reload()} discards the loaded records.
 * Records written by older versions ({@code _id}, {@code thumbnailSize}) are accepted.
 */
@Slf4j
public class JsonFileLayoutRepository implements LayoutRepository {

    private static final TypeReference<List<LayoutRecord>> RECORDS = new TypeReference<>() {};

    private final Path file;
    private List<LayoutRecord> records;

    public JsonFileLayoutRepository(Path file) {
        this.file = requireNonNull(file, "file");
    }

    @Override
    public Optional<LayoutRecord> findLayoutById(String id) throws IOException {
        if (id == null) {
            return Optional.empty();
        }
        return records().stream().filter(r -> Objects.equals(id, r.id())).findFirst();
    }

    public synchronized void reload() {
        records = null;
    }

    private synchronized List<LayoutRecord> records() throws IOException {
        if (records == null) {
            try (InputStream in = Files.newInputStream(file)) {
                List<LayoutRecord> loaded = IiifJson.mapper().readValue(in, RECORDS);
                records = loaded == null ? List.of() : List.copyOf(loaded);
            } catch (JacksonException e) {
                throw new SerializationException("Invalid layout file " + file + ": " + e.getOriginalMessage(), e);
            }
            log.debug("Loaded {} layouts from {}", records.size(), file);
        }
        return records;
    }
}
