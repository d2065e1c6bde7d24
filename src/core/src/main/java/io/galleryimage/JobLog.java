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

import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

/**
 * Logging handle scoped to one job.
 * <p>
 * Each options record carries its own {@link LogLevel}; operations obtain a {@code JobLog} from it instead
 * of reconfiguring logging globally, so two jobs running side by side keep their own verbosity.
 */
public final class JobLog {

    private final Logger logger;
    private final LogLevel level;

    private JobLog(Logger logger, LogLevel level) {
        this.logger = requireNonNull(logger);
        this.level = requireNonNull(level);
    }

    /**
     * @param owner the class whose logger receives the job's messages
     * @param level the job verbosity, {@code null} meaning {@link LogLevel#STANDARD}
     * @return a handle logging through {@code owner}'s logger, or discarding everything for {@link LogLevel#NONE}
     */
    public static JobLog of(Class<?> owner, LogLevel level) {
        LogLevel effective = level == null ? LogLevel.STANDARD : level;
        Logger logger = effective == LogLevel.NONE ? NOPLogger.NOP_LOGGER : LoggerFactory.getLogger(owner);
        return new JobLog(logger, effective);
    }

    public LogLevel level() {
        return level;
    }

    /**
     * Logs a job milestone.
     */
    public void info(String format, Object... args) {
        logger.info(format, args);
    }

    /**
     * Logs per-item progress: INFO when verbose, DEBUG otherwise.
     */
    public void progress(String format, Object... args) {
        if (level == LogLevel.VERBOSE) {
            logger.info(format, args);
        } else {
            logger.debug(format, args);
        }
    }

    public void warn(String format, Object... args) {
        logger.warn(format, args);
    }
}
