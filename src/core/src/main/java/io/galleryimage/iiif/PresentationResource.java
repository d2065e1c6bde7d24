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

/**
 * A top-level IIIF Presentation resource.
 */
public sealed interface PresentationResource permits Canvas, Manifest, Collection {

    /** IIIF Presentation 3 JSON-LD context. */
    String PRESENTATION_CONTEXT = "http://iiif.io/api/presentation/3/context.json";

    String id();

    String type();
}
