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

/**
 * Where a cell's thumbnail was painted on the composite.
 *
 * @param row grid row
 * @param column grid column
 * @param top vertical offset in pixels
 * @param left horizontal offset in pixels
 * @param sourceName name of the art in the cell
 */
public record CellPlacement(int row, int column, int top, int left, String sourceName) {}
