/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/diagnostics/Diagnostics.java
 description: Tracing facade bound to an owner class. Trace levels are gated by jresumable.diag;
              failures are always logged.
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

/**
 * Small logging facade used by the coroutine machinery.
 * <p>
 * {@link #debug}, {@link #info} and {@link #warn} are internal tracing: they go to SLF4J only while
 * {@code -Djresumable.diag=true} is set (or {@link DiagnosticsBackend#enable()} was called).
 * {@link #failure(String, Throwable)} is for errors nobody else can observe, such as a callback
 * throwing on the event loop, and is logged at ERROR whatever the switch says.
 * </p>
 *
 * <pre>{@code
 * private static final Diagnostics DIAG = Diagnostics.of(MyType.class);
 * DIAG.debug("co#{} resumed", id);
 * }</pre>
 */
@FunctionalInterface
public interface Diagnostics {

    /**
     * @return the class whose SLF4J logger receives the output
     */
    Class<?> owner();

    // 🧩 Section: tracing
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.trace(owner(), DiagnosticsBackend.Level.DEBUG, msg, args);
    }

    default void info(String msg, Object... args) {
        DiagnosticsBackend.trace(owner(), DiagnosticsBackend.Level.INFO, msg, args);
    }

    default void warn(String msg, Object... args) {
        DiagnosticsBackend.trace(owner(), DiagnosticsBackend.Level.WARN, msg, args);
    }
    // [/🧩 Section: tracing]

    /**
     * Log an unobserved failure at ERROR, with stack trace. Never muted.
     *
     * @param msg   description of what was being done
     * @param error the failure
     */
    default void failure(String msg, Throwable error) {
        DiagnosticsBackend.failure(owner(), msg, error);
    }

    /**
     * Bind diagnostics to {@code owner}. The returned instance checks the switch on each call,
     * so tests may flip it after class initialisation.
     *
     * @param owner owning class
     * @return diagnostics bound to {@code owner}
     */
    static Diagnostics of(Class<?> owner) {
        return new ActiveD(owner);
    }

    /**
     * @return an instance whose tracing methods do nothing (failures still log)
     */
    static Diagnostics quiet() {
        return NoOpD.INSTANCE;
    }
}
