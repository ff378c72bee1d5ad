/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/diagnostics/DiagnosticsBackend.java
 description: SLF4J sink for Diagnostics. Caches loggers per owner, attributes call sites through
              LocationAwareLogger, and holds the jresumable.diag switch.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.jresumable.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;
import tech.robd.jresumable.RuntimeProperties;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Routes {@link Diagnostics} calls to SLF4J.
 * <p>
 * The switch starts from {@link RuntimeProperties#diagnosticsEnabled()} and can be flipped with
 * {@link #enable()} / {@link #disable()}.
 * </p>
 */
public final class DiagnosticsBackend {

    enum Level {
        DEBUG(LocationAwareLogger.DEBUG_INT),
        INFO(LocationAwareLogger.INFO_INT),
        WARN(LocationAwareLogger.WARN_INT);

        final int slf4j;

        Level(int slf4j) {
            this.slf4j = slf4j;
        }
    }

    // 🧩 Section: state
    private static final String FQCN = DiagnosticsBackend.class.getName();
    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();
    private static volatile boolean enabled = RuntimeProperties.diagnosticsEnabled();
    // [/🧩 Section: state]

    private DiagnosticsBackend() {
    }

    // 🧩 Section: switch
    public static void enable() {
        enabled = true;
    }

    public static void disable() {
        enabled = false;
    }

    public static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: switch]

    // 🧩 Section: emitters
    static void trace(Class<?> owner, Level level, String msg, Object... args) {
        if (!enabled) return;
        Logger log = LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, level.slf4j, msg, args, null);
            return;
        }
        switch (level) {
            case DEBUG:
                log.debug(msg, args);
                break;
            case INFO:
                log.info(msg, args);
                break;
            default:
                log.warn(msg, args);
        }
    }

    static void failure(Class<?> owner, String msg, Throwable error) {
        Logger log = LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, LocationAwareLogger.ERROR_INT, msg, null, error);
        } else {
            log.error(msg, error);
        }
    }
    // [/🧩 Section: emitters]
}
