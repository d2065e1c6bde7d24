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
 * Thrown when an operation receives missing, malformed or conflicting input: a missing source, width or
 * name, incompatible construction options, or a malformed legacy record.
 * <p>
 * Input errors are fatal to the single operation that raised them and are never retried.
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message the detail message
     */
    public InvalidInputException(String message) {
        super(message);
    }

    /**
     * @param message the detail message
     * @param cause the underlying cause
     */
    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
