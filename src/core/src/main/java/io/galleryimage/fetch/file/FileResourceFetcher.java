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
package io.galleryimage.fetch.file;

import io.galleryimage.InvalidInputException;
import io.galleryimage.ResourceUnavailableException;
import io.galleryimage.fetch.AbstractResourceFetcher;
import io.galleryimage.fetch.ResourceFetcher;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * {@link ResourceFetcher} reading whole files from the local file system.
 * <p>
 * Each call opens its own read-only {@link FileChannel}, so concurrent fetches share no state.
 */
public class FileResourceFetcher extends AbstractResourceFetcher implements ResourceFetcher {

    /** Files larger than this cannot be held in a single byte array. */
    static final long MAX_FILE_SIZE = Integer.MAX_VALUE - 8;

    @Override
    protected byte[] fetchInternal(URI uri) throws IOException {
        final Path path = toPath(uri);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            final long size = channel.size();
            if (size > MAX_FILE_SIZE) {
                throw new IOException("File too large to load in memory: %s (%,d bytes)".formatted(path, size));
            }
            ByteBuffer target = ByteBuffer.allocate((int) size);
            long position = 0;
            // positioned reads until the buffer is full or EOF
            while (target.hasRemaining()) {
                int read = channel.read(target, position);
                if (read == -1) {
                    break;
                }
                position += read;
            }
            if (target.hasRemaining()) {
                // truncated while reading
                byte[] actual = new byte[target.position()];
                target.flip().get(actual);
                return actual;
            }
            return target.array();
        } catch (NoSuchFileException e) {
            throw new ResourceUnavailableException(path.toString(), "File not found: " + path, e);
        }
    }

    @Override
    public String getId() {
        return FileResourceFetcherProvider.ID;
    }

    private static Path toPath(URI uri) {
        if (!"file".equalsIgnoreCase(uri.getScheme())) {
            throw new InvalidInputException("Not a file URI: " + uri);
        }
        try {
            return Paths.get(uri);
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            throw new InvalidInputException("Unable to resolve %s: %s".formatted(uri, e.getMessage()), e);
        }
    }
}
