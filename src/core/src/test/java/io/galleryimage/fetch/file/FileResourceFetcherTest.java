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
package io.galleryimage.fetch.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.galleryimage.ResourceUnavailableException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link FileResourceFetcher}.
 */
class FileResourceFetcherTest {

    @TempDir
    Path tempDir;

    private Path testFile;
    private byte[] testData;
    private FileResourceFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        testData = new byte[50_000];
        new Random(42).nextBytes(testData);
        testFile = tempDir.resolve("test.bin");
        Files.write(testFile, testData);
        fetcher = new FileResourceFetcher();
    }

    @Test
    void testFetchByPath() throws IOException {
        assertArrayEquals(testData, fetcher.fetch(testFile.toString()));
    }

    @Test
    void testFetchByFileUri() throws IOException {
        assertArrayEquals(testData, fetcher.fetch(testFile.toUri().toString()));
    }

    @Test
    void testFetchEmptyFile() throws IOException {
        Path empty = Files.createFile(tempDir.resolve("empty.bin"));
        assertThat(fetcher.fetch(empty.toString())).isEmpty();
    }

    @Test
    void testMissingFile() {
        String missing = tempDir.resolve("missing.jpg").toString();
        ResourceUnavailableException e =
                assertThrows(ResourceUnavailableException.class, () -> fetcher.fetch(missing));
        assertEquals(missing, e.getLocation());
    }

    @Test
    void testId() {
        assertEquals(FileResourceFetcherProvider.ID, fetcher.getId());
    }
}
