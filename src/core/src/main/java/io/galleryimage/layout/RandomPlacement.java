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

import static java.util.Objects.requireNonNull;

import io.galleryimage.InvalidInputException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Arranges a pool of items on a grid in random order.
 */
public final class RandomPlacement {

    /** Default width to height ratio of the grid, portrait 9:16. */
    public static final double DEFAULT_RATIO = 9d / 16;

    private RandomPlacement() {
        // utility class
    }

    /**
     * Rows and columns of a grid.
     */
    public record GridSize(int rows, int columns) {
        public GridSize {
            if (rows <= 0 || columns <= 0) {
                throw new InvalidInputException("Grid size must be positive: %dx%d".formatted(rows, columns));
            }
        }

        public long capacity() {
            return (long) rows * columns;
        }
    }

    /**
     * Smallest grid of roughly {@code ratio} (width / height) holding {@code count} items:
     * {@code height = ceil(sqrt(count / ratio))}, {@code width = ceil(height * ratio)}, then width shrunk by
     * up to two columns and height by one row while the grid still holds every item.
     */
    public static GridSize sizeForRatio(int count, double ratio) {
        if (count <= 0) {
            throw new InvalidInputException("Cannot size a grid for %d items".formatted(count));
        }
        if (!(ratio > 0) || Double.isInfinite(ratio)) {
            throw new InvalidInputException("Ratio must be positive: " + ratio);
        }
        int height = (int) Math.ceil(Math.sqrt(count / ratio));
        int width = (int) Math.ceil(height * ratio);

        if ((long) (width - 2) * height >= count) {
            width -= 2;
        }
        if ((long) (width - 1) * height >= count) {
            width -= 1;
        }
        if ((long) width * (height - 1) >= count) {
            height -= 1;
        }
        return new GridSize(height, width);
    }

    /**
     * Fills a grid row by row with every pool item exactly once, each cell drawing a pool index uniformly at
     * random among those not used yet. Filling stops when the pool is exhausted: the last row may be short and
     * no empty row is produced.
     *
     * @throws InvalidInputException if the pool is empty or larger than the grid
     */
    public static <T> List<List<T>> place(List<T> pool, GridSize size, Random random) {
        requireNonNull(pool, "pool");
        requireNonNull(size, "size");
        requireNonNull(random, "random");
        final int total = pool.size();
        if (total == 0) {
            throw new InvalidInputException("No art provided for random placement");
        }
        if (total > size.capacity()) {
            throw new InvalidInputException("%d items do not fit a %dx%d grid".formatted(
                    total, size.rows(), size.columns()));
        }

        List<List<T>> rows = new ArrayList<>();
        Set<Integer> used = new HashSet<>();
        for (int row = 0; row < size.rows() && used.size() < total; row++) {
            List<T> cells = new ArrayList<>(size.columns());
            for (int col = 0; col < size.columns() && used.size() < total; col++) {
                int index;
                do {
                    index = random.nextInt(total);
                } while (used.contains(index));
                used.add(index);
                cells.add(pool.get(index));
            }
            rows.add(List.copyOf(cells));
        }
        return List.copyOf(rows);
    }
}
