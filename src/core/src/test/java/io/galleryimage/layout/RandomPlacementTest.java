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
package io.galleryimage.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.galleryimage.InvalidInputException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RandomPlacementTest {

    @ParameterizedTest
    @CsvSource({
        "10, 0.5625, 5, 2",
        "1, 0.5625, 1, 1",
        "3, 1.0, 2, 2",
        "12, 1.7777777777777777, 3, 4",
        "7, 0.5625, 4, 2"
    })
    void testSizeForRatio(int count, double ratio, int rows, int columns) {
        assertEquals(new RandomPlacement.GridSize(rows, columns), RandomPlacement.sizeForRatio(count, ratio));
    }

    @Test
    void testSizeForRatioValidation() {
        assertThrows(InvalidInputException.class, () -> RandomPlacement.sizeForRatio(0, 1));
        assertThrows(InvalidInputException.class, () -> RandomPlacement.sizeForRatio(5, 0));
        assertThrows(InvalidInputException.class, () -> RandomPlacement.sizeForRatio(5, Double.NaN));
    }

    @Test
    void testGridSizeMustBePositive() {
        assertThrows(InvalidInputException.class, () -> new RandomPlacement.GridSize(0, 3));
        assertThrows(InvalidInputException.class, () -> new RandomPlacement.GridSize(3, -1));
    }

    @Test
    void testEveryItemPlacedOnce() {
        Random random = new Random(7);
        double[] ratios = {RandomPlacement.DEFAULT_RATIO, 1.0, 16d / 9, 0.25, 3.0};
        for (double ratio : ratios) {
            for (int count = 1; count <= 120; count++) {
                List<Integer> pool = IntStream.range(0, count).boxed().toList();
                RandomPlacement.GridSize size = RandomPlacement.sizeForRatio(count, ratio);
                List<List<Integer>> rows = RandomPlacement.place(pool, size, random);

                List<Integer> placed = new ArrayList<>();
                rows.forEach(placed::addAll);
                assertThat(placed).as("count %d ratio %s", count, ratio).containsExactlyInAnyOrderElementsOf(pool);

                int numRows = rows.size();
                int numCols = rows.get(0).size();
                assertThat((long) numRows * numCols).isGreaterThanOrEqualTo(count);
                assertThat(numRows * numCols - count).isLessThan(numCols);
                for (int r = 0; r < numRows - 1; r++) {
                    assertThat(rows.get(r)).hasSize(numCols);
                }
                assertThat(rows.get(numRows - 1)).isNotEmpty();
            }
        }
    }

    @Test
    void testExplicitSizeLeavesTrailingCellsAbsent() {
        List<String> pool = List.of("a", "b", "c", "d", "e");
        List<List<String>> rows = RandomPlacement.place(pool, new RandomPlacement.GridSize(4, 2), new Random(1));

        assertEquals(3, rows.size());
        assertThat(rows.get(0)).hasSize(2);
        assertThat(rows.get(1)).hasSize(2);
        assertThat(rows.get(2)).hasSize(1);
    }

    @Test
    void testDeterministicWithSeed() {
        List<Integer> pool = IntStream.range(0, 20).boxed().toList();
        RandomPlacement.GridSize size = RandomPlacement.sizeForRatio(20, 1.0);
        assertEquals(RandomPlacement.place(pool, size, new Random(42)),
                RandomPlacement.place(pool, size, new Random(42)));
    }

    @Test
    void testPoolValidation() {
        RandomPlacement.GridSize size = new RandomPlacement.GridSize(2, 2);
        assertThrows(InvalidInputException.class, () -> RandomPlacement.place(List.of(), size, new Random()));
        assertThrows(InvalidInputException.class,
                () -> RandomPlacement.place(List.of(1, 2, 3, 4, 5), size, new Random()));
    }
}
