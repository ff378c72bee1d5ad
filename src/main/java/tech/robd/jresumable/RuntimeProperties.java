/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/RuntimeProperties.java
 description: System-property configuration: diagnostics switch, process-wide concurrency limit
              and substrate thread naming.
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

package tech.robd.jresumable;

import org.jspecify.annotations.NonNull;

import java.util.Optional;

/**
 * Names and readers for the system properties understood by jresumable.
 *
 * <ul>
 *   <li>{@value #DIAGNOSTICS} – {@code true} turns on internal SLF4J tracing (default {@code false}).</li>
 *   <li>{@value #MAX_CONCURRENCY} – when set, {@link CoroutineRuntime.Builder#fromSystemProperties()}
 *       installs a {@link tech.robd.jresumable.mods.MaxConcurrency} limiter with this capacity.</li>
 *   <li>{@value #THREAD_PREFIX} – name prefix for substrate threads (default {@value #DEFAULT_THREAD_PREFIX}).</li>
 * </ul>
 *
 * Properties are read on every call; nothing is cached here.
 */
public final class RuntimeProperties {

    // 🧩 Section: names
    public static final String DIAGNOSTICS = "jresumable.diag";
    public static final String MAX_CONCURRENCY = "jresumable.maxConcurrency";
    public static final String THREAD_PREFIX = "jresumable.threadPrefix";
    public static final String DEFAULT_THREAD_PREFIX = "jresumable-coro";
    // [/🧩 Section: names]

    private RuntimeProperties() {
        // no instances
    }

    // 🧩 Section: readers

    /**
     * @return whether {@code -Djresumable.diag=true} is set
     */
    public static boolean diagnosticsEnabled() {
        return "true".equalsIgnoreCase(System.getProperty(DIAGNOSTICS, "false").trim());
    }

    /**
     * Raw configured concurrency limit. Validation is left to
     * {@link tech.robd.jresumable.mods.MaxConcurrency#limit(String)}.
     *
     * @return the trimmed property value, or empty when unset or blank
     */
    public static @NonNull Optional<String> maxConcurrency() {
        String raw = System.getProperty(MAX_CONCURRENCY);
        if (raw == null || raw.isBlank()) return Optional.empty();
        return Optional.of(raw.trim());
    }

    /**
     * @return the configured substrate thread prefix, falling back to {@value #DEFAULT_THREAD_PREFIX}
     */
    public static @NonNull String threadPrefix() {
        String raw = System.getProperty(THREAD_PREFIX);
        return raw == null || raw.isBlank() ? DEFAULT_THREAD_PREFIX : raw.trim();
    }
    // [/🧩 Section: readers]
}
