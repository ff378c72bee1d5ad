/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/Coroutine.java
 description: One in-flight invocation of a suspendable body: enter/leave, context bag, semaphore marker.
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
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.substrate.Transfer;

import java.util.Map;

/**
 * One invocation of a suspendable body bound to an execution substrate.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>obtained from {@link Pipeline#acquireCoro}, without the body having run;</li>
 *   <li>driven by repeated {@link #enter} calls from outside the body;</li>
 *   <li>suspended from inside the body with {@link #leave};</li>
 *   <li>handed back with {@link Pipeline#releaseCoro} exactly once, after its final exit.</li>
 * </ul>
 *
 * <p>Each {@code enter} runs the body synchronously up to its next suspension or exit and reports
 * the outcome to the {@link Protocol} the coroutine was acquired with.</p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public interface Coroutine {

    // 🧩 Section: control

    /**
     * Resume the body (or start it on the first call).
     *
     * @param error if non-null, raised inside the body at its suspension point
     * @param value returned to the body from its pending {@link #leave}
     */
    void enter(@Nullable Throwable error, @Nullable Object value);

    /**
     * Suspend the running body. Only legal on the body's own execution context.
     *
     * @param suspension what the driver is told: a yielded value, or that the body parked
     * @return the value passed to the {@link #enter} that resumes the body
     * @throws Exception the error passed to that {@code enter}, if any
     */
    @Nullable
    Object leave(Transfer.@NonNull Suspension suspension) throws Exception;
    // [/🧩 Section: control]

    // 🧩 Section: state

    /**
     * Mutable per-coroutine bag. Protocols keep their per-invocation state here, so entries written
     * before the first {@code enter} must survive whatever the pipeline does on acquisition.
     */
    @NonNull
    Map<String, @Nullable Object> context();

    /**
     * @return whether this coroutine currently holds a concurrency-limiter slot
     */
    boolean isInSemaphore();

    void setInSemaphore(boolean inSemaphore);
    // [/🧩 Section: state]
}
