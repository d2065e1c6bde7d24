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
package io.galleryimage.fetch;

import io.galleryimage.InvalidInputException;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * Helpers to tell URLs from file paths and to derive canonical identifiers and display names from either.
 */
public final class Locations {

    private static final Pattern HTTP_PATTERN = Pattern.compile("^(http|https)://.*", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_SLASHES = Pattern.compile("([^/])/+$");

    private Locations() {
        // utility class
    }

    /**
     * @return {@code true} if {@code location} is an http or https URL
     */
    public static boolean isUrl(String location) {
        return location != null && HTTP_PATTERN.matcher(location).matches();
    }

    /**
     * Canonical form of a location: URLs are returned unchanged, file paths are made absolute and
     * {@code file:} URIs are turned into absolute paths.
     *
     * @throws InvalidInputException if {@code location} is empty or not a valid path
     */
    public static String canonical(String location) {
        if (location == null || location.isBlank()) {
            throw new InvalidInputException("Location cannot be empty");
        }
        if (isUrl(location)) {
            return location;
        }
        return toPath(location).toString();
    }

    /**
     * Converts a location to a URI: URLs as they are, file paths as absolute {@code file:} URIs.
     *
     * @throws InvalidInputException if {@code location} is empty or not a valid URL or path
     */
    public static URI toUri(String location) {
        if (location == null || location.isBlank()) {
            throw new InvalidInputException("Location cannot be empty");
        }
        if (isUrl(location)) {
            try {
                return URI.create(location);
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException("Invalid URL: " + location, e);
            }
        }
        return toPath(location).toUri();
    }

    /**
     * Whether {@code location} can be handed to a fetcher as is, i.e. it is a URL or a syntactically
     * valid file path.
     */
    public static boolean isResolvable(String location) {
        if (location == null || location.isBlank()) {
            return false;
        }
        if (isUrl(location)) {
            return true;
        }
        try {
            toPath(location);
            return true;
        } catch (InvalidInputException e) {
            return false;
        }
    }

    /**
     * File name without extension, taken from a URL's path or a file path.
     * {@code https://host/art/sunset.tif?x=1} and {@code /data/sunset.tif} both yield {@code sunset}.
     */
    public static String baseName(String location) {
        if (location == null || location.isBlank()) {
            throw new InvalidInputException("Location cannot be empty");
        }
        String path = location;
        if (isUrl(location)) {
            path = URI.create(location).getPath();
            if (path == null) {
                path = "";
            }
        }
        path = cleanTrailingSlash(path.replace('\\', '/'));
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        if (name.isEmpty()) {
            throw new InvalidInputException("Cannot derive a name from " + location);
        }
        return name;
    }

    /**
     * Removes trailing slashes, keeping a lone root slash.
     */
    public static String cleanTrailingSlash(String path) {
        return TRAILING_SLASHES.matcher(path).replaceAll("$1");
    }

    private static Path toPath(String location) {
        try {
            if (location.regionMatches(true, 0, "file:", 0, 5)) {
                return Paths.get(URI.create(location)).toAbsolutePath().normalize();
            }
            return Paths.get(location).toAbsolutePath().normalize();
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid path: " + location, e);
        }
    }
}
