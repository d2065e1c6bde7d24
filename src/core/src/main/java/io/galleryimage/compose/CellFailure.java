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
package io.galleryimage.compose;

import static java.util.Objects.requireNonNull;

/**
 * A cell left blank on the composite because its thumbnail could not be produced.
 */
public record CellFailure(int row, int column, String sourceName, Throwable cause) {

    public CellFailure {
        requireNonNull(cause, "cause");
    }

    @Override
    public String toString() {
        return "CellFailure[%d,%d %s: %s]".formatted(row, column, sourceName, cause.getMessage());
    }
}
