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

import io.galleryimage.JobLog;
import io.galleryimage.LogLevel;
import java.nio.file.Path;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;

/**
 * Options for IIIF projection.
 *
 * @param saveFile write the resulting JSON, and any image still held only in memory, to {@code outputDir}
 * @param outputDir target directory, required with {@code saveFile}
 * @param exclusions parts left out of each canvas
 * @param logLevel job verbosity
 */
@Builder(toBuilder = true)
public record IiifOptions(boolean saveFile, Path outputDir, @Singular("exclude") Set<IiifExclusion> exclusions,
        LogLevel logLevel) {

    public IiifOptions {
        exclusions = exclusions == null ? Set.of() : Set.copyOf(exclusions);
        logLevel = logLevel == null ? LogLevel.STANDARD : logLevel;
    }

    /**
     * @return options that save nothing and exclude nothing
     */
    public static IiifOptions defaults() {
        return builder().build();
    }

    public boolean excludes(IiifExclusion exclusion) {
        return exclusions.contains(exclusion);
    }

    public JobLog jobLog(Class<?> owner) {
        return JobLog.of(owner, logLevel);
    }
}
