/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/internal/SubstratePipeline.java
 description: Terminal pipeline: creates substrate-backed coroutines and disposes them on release.
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
import tech.robd.jresumable.CoroutineBody;
import tech.robd.jresumable.Pipeline;
import tech.robd.jresumable.Protocol;
import tech.robd.jresumable.substrate.ExecutionSubstrate;
import tech.robd.jresumable.substrate.SubstrateHandle;

import java.util.List;
import java.util.Objects;

/**
 * Innermost pipeline. Every mod chain ends here.
 */
public final class SubstratePipeline implements Pipeline {

    private final @NonNull ExecutionSubstrate substrate;

    public SubstratePipeline(@NonNull ExecutionSubstrate substrate) {
        this.substrate = Objects.requireNonNull(substrate, "substrate");
    }

    @Override
    public @NonNull Coroutine acquireCoro(@NonNull Protocol protocol, @NonNull CoroutineBody body,
                                          @Nullable Object self, @NonNull List<@Nullable Object> args) {
        if (protocol == null) throw new IllegalArgumentException("protocol cannot be null");
        SubstrateHandle handle = substrate.create(body, self, args);
        SubstrateCoroutine co = new SubstrateCoroutine(substrate, handle, protocol);
        handle.attach(co);
        return co;
    }

    @Override
    public void releaseCoro(@NonNull Protocol protocol, @NonNull Coroutine coroutine) {
        if (!(coroutine instanceof SubstrateCoroutine sc)) {
            throw new IllegalArgumentException("coroutine was not acquired from this pipeline: " + coroutine);
        }
        sc.dispose();
    }

    @Override
    public @Nullable Coroutine currentCoro() {
        SubstrateHandle h = substrate.current();
        if (h == null) return null;
        return h.attachment() instanceof Coroutine co ? co : null;
    }
}
