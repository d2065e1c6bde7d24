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
package io.galleryimage.art;

import io.galleryimage.JobLog;
import io.galleryimage.LogLevel;
import java.nio.file.Path;
import lombok.Builder;

/**
 * Options for thumbnail creation.
 *
 * @param saveFile save the thumbnail to {@code outputDir}; otherwise it is kept in memory only
 * @param outputDir target directory, required with {@code saveFile}
 * @param logLevel job verbosity
 */
@Builder(toBuilder = true)
public record ThumbnailOptions(boolean saveFile, Path outputDir, LogLevel logLevel) {

    public ThumbnailOptions {
        logLevel = logLevel == null ? LogLevel.STANDARD : logLevel;
    }

    public static ThumbnailOptions inMemory() {
        return builder().build();
    }

    public static ThumbnailOptions savedTo(Path outputDir) {
        return builder().saveFile(true).outputDir(outputDir).build();
    }

    public JobLog jobLog(Class<?> owner) {
        return JobLog.of(owner, logLevel);
    }
}
