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
package io.galleryimage.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TileSizesTest {

    @ParameterizedTest
    @CsvSource({"1000, 248", "256, 256", "512, 256", "300, 144", "100, 96", "16, 16", "10, 10", "4096, 256",
        "784, 256", "2016, 256", "4000, 256", "264, 256"})
    void testMinimumTileSize(int side, int expected) {
        assertEquals(expected, TileSizes.minimumTileSize(side));
    }

    @Test
    void testNonPositiveSide() {
        assertThrows(IllegalArgumentException.class, () -> TileSizes.minimumTileSize(0));
        assertThrows(IllegalArgumentException.class, () -> TileSizes.minimumTileSize(-16));
    }
}
