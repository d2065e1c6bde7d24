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

/**
 * Directory layouts {@link ImageCodec#encodeTileDirectory} can produce.
 */
public enum TileLayout {
    /** IIIF Image API 3 level-0 static tiles with an {@code info.json}. */
    IIIF,
    /** Deep Zoom: a {@code .dzi} descriptor plus a {@code _files} tree. */
    DZI
}
