/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/internal/SubstrateCoroutine.java
 description: Coroutine bound directly to a substrate handle; dispatches each transfer to its protocol.
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

package tech.robd.jresumable.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.Coroutine;
import tech.robd.jresumable.Protocol;
import tech.robd.jresumable.diagnostics.Diagnostics;
import tech.robd.jresumable.substrate.ExecutionSubstrate;
import tech.robd.jresumable.substrate.SubstrateHandle;
import tech.robd.jresumable.substrate.Transfer;

import java.util.HashMap;
import java.util.Map;

/**
 * The coroutine produced by {@link SubstratePipeline}.
 *
 * <p>{@link #enter} resumes the substrate and turns the resulting {@link Transfer} into a
 * {@link Protocol} call. A {@link Transfer.Parked} transfer reports nothing: whoever the body
 * parked on will enter it again.</p>
 */
public final class SubstrateCoroutine implements Coroutine {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(SubstrateCoroutine.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int coId = System.identityHashCode(this);
    private final @NonNull ExecutionSubstrate substrate;
    private final @NonNull SubstrateHandle handle;
    private final @NonNull Protocol protocol;
    private final Map<String, @Nullable Object> context = new HashMap<>();
    private volatile boolean inSemaphore;
    // [/🧩 Section: state]

    SubstrateCoroutine(@NonNull ExecutionSubstrate substrate, @NonNull SubstrateHandle handle, @NonNull Protocol protocol) {
        this.substrate = substrate;
        this.handle = handle;
        this.protocol = protocol;
    }

    // 🧩 Section: control
    @Override
    public void enter(@Nullable Throwable error, @Nullable Object value) {
        DIAG.debug("co#{} enter error={}", coId, error == null ? "none" : error.getClass().getSimpleName());
        Transfer t = substrate.resume(handle, error, value);
        if (t instanceof Transfer.Yielded y) {
            protocol.onYield(this, y.value());
        } else if (t instanceof Transfer.Returned r) {
            DIAG.debug("co#{} returned", coId);
            protocol.onReturn(this, r.value());
        } else if (t instanceof Transfer.Threw th) {
            DIAG.debug("co#{} threw {}", coId, th.error().getClass().getSimpleName());
            protocol.onThrow(this, th.error());
        } else {
            DIAG.debug("co#{} parked", coId);
        }
    }

    @Override
    public @Nullable Object leave(Transfer.@NonNull Suspension suspension) throws Exception {
        if (substrate.current() != handle) {
            throw new IllegalStateException("leave() must be called from the coroutine's own body");
        }
        return substrate.suspend(suspension);
    }
    // [/🧩 Section: control]

    // 🧩 Section: state-access
    @Override
    public @NonNull Map<String, @Nullable Object> context() {
        return context;
    }

    @Override
    public boolean isInSemaphore() {
        return inSemaphore;
    }

    @Override
    public void setInSemaphore(boolean inSemaphore) {
        this.inSemaphore = inSemaphore;
    }

    public boolean isFinished() {
        return handle.isFinished();
    }
    // [/🧩 Section: state-access]

    void dispose() {
        DIAG.debug("co#{} dispose", coId);
        substrate.dispose(handle);
    }

    @Override
    public String toString() {
        return "Coroutine[" + (handle.isFinished() ? "FINISHED" : "LIVE") + (inSemaphore ? ", slot" : "") + "]";
    }
}
