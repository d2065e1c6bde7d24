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
import java.util.concurrent.Executor;
import lombok.Builder;

/**
 * Options for {@link ImageResource#generateImage} and grid composition.
 *
 * @param outputType the encoding to produce, required
 * @param saveFile save output to {@code outputDir}; {@link OutputType#IIIF} and {@link OutputType#DZI}
 *        always write to disk and require it
 * @param outputDir target directory
 * @param iiifBaseId public URL the IIIF tiles will be served under, required for {@link OutputType#IIIF}
 * @param logLevel job verbosity
 * @param executor runs per-cell work when composing a grid, {@code null} for the compositor's own pool
 */
@Builder(toBuilder = true)
public record ImageOptions(
        OutputType outputType,
        boolean saveFile,
        Path outputDir,
        String iiifBaseId,
        LogLevel logLevel,
        Executor executor) {

    public ImageOptions {
        logLevel = logLevel == null ? LogLevel.STANDARD : logLevel;
    }

    public JobLog jobLog(Class<?> owner) {
        return JobLog.of(owner, logLevel);
    }
}
