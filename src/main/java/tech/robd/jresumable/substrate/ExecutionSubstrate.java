/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/substrate/ExecutionSubstrate.java
 description: Create/resume/suspend/dispose capability for execution contexts that can pause mid-body.
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

package tech.robd.jresumable.substrate;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.CoroutineBody;

import java.util.List;

/**
 * The low-level suspend/resume capability coroutines are built on.
 *
 * <p>The driver side calls {@link #resume}, which blocks until the body suspends or exits and
 * returns the resulting {@link Transfer}. The body side calls {@link #suspend}, which hands a
 * {@link Transfer.Suspension} to the driver and blocks until the next resume. Exactly one side
 * runs at a time.</p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public interface ExecutionSubstrate {

    // 🧩 Section: driver-side

    /**
     * Prepare an execution context for {@code body}. Nothing runs until the first resume.
     */
    @NonNull
    SubstrateHandle create(@NonNull CoroutineBody body, @Nullable Object self, @NonNull List<@Nullable Object> args);

    /**
     * Transfer control into the body until it suspends, returns or throws.
     *
     * @param error if non-null, thrown from the body's pending {@link #suspend}; on the first resume
     *              it fails the body without running it
     * @param value returned from the body's pending {@link #suspend}; ignored on the first resume
     * @return what the body did
     * @throws IllegalStateException if the handle has finished, or a body tries to resume itself
     */
    @NonNull
    Transfer resume(@NonNull SubstrateHandle handle, @Nullable Throwable error, @Nullable Object value);

    /**
     * Release the context. A suspended body is unwound; a running body is unwound at its next
     * suspension; a finished one is left alone.
     */
    void dispose(@NonNull SubstrateHandle handle);
    // [/🧩 Section: driver-side]

    // 🧩 Section: body-side

    /**
     * Suspend the calling body.
     *
     * @return the value of the resume that continues the body
     * @throws Exception             the error of the resume that continues the body
     * @throws IllegalStateException when not called from inside a body of this substrate
     */
    @Nullable
    Object suspend(Transfer.@NonNull Suspension suspension) throws Exception;

    /**
     * @return the handle whose body is running on the calling thread, or {@code null}
     */
    @Nullable
    SubstrateHandle current();
    // [/🧩 Section: body-side]
}
