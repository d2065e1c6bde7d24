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
package io.galleryimage;

/**
 * Thrown when a non-idempotent operation is attempted a second time, e.g. creating a thumbnail width that
 * already exists or assembling an image for a layout that already has one.
 */
public class StateConflictException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message the detail message
     */
    public StateConflictException(String message) {
        super(message);
    }
}
