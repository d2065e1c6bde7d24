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

import java.io.IOException;

/**
 * Signals that the bytes behind a location could not be obtained: the file does not exist, the server
 * answered with an error status, or the request timed out.
 * <p>
 * Nothing retries automatically. Grid composition downgrades this failure to a skipped cell; every other
 * caller sees it as is.
 */
public class ResourceUnavailableException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String location;

    /**
     * @param location the location that could not be fetched
     * @param message the detail message
     */
    public ResourceUnavailableException(String location, String message) {
        super(message);
        this.location = location;
    }

    /**
     * @param location the location that could not be fetched
     * @param message the detail message
     * @param cause the underlying cause
     */
    public ResourceUnavailableException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * @return the location that could not be fetched
     */
    public String getLocation() {
        return location;
    }
}
