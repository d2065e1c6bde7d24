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

import io.galleryimage.InvalidInputException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ResourceStore} writing to the local file system.
 */
@Slf4j
public class FileSystemResourceStore implements ResourceStore {

    @Override
    public String save(Path outputDir, String name, byte[] content) throws IOException {
        requireNonNull(content, "content");
        Path target = resolve(outputDir, name);
        Files.createDirectories(target.getParent());
        Files.write(target, content);
        log.debug("Saved {} ({} bytes)", target, content.length);
        return target.toString();
    }

    @Override
    public Path replaceDirectory(Path outputDir, String name) throws IOException {
        Path directory = resolve(outputDir, name);
        if (Files.exists(directory)) {
            deleteRecursively(directory);
            log.debug("Deleted existing directory {}", directory);
        }
        return Files.createDirectories(directory);
    }

    private static Path resolve(Path outputDir, String name) {
        if (outputDir == null) {
            throw new InvalidInputException("Output directory not specified");
        }
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\")) {
            throw new InvalidInputException("Invalid file name: " + name);
        }
        return outputDir.toAbsolutePath().normalize().resolve(name);
    }

    private static void deleteRecursively(Path directory) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.delete(path);
        }
    }
}
