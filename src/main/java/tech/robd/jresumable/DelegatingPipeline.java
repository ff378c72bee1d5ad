/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/DelegatingPipeline.java
 description: Base class for mods: forwards acquire, release and currentCoro to the wrapped pipeline.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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

import java.util.List;
import java.util.Objects;

/**
 * Forwards everything to an inner pipeline. Subclasses override what they intercept and call
 * {@code super} to continue inward.
 */
public abstract class DelegatingPipeline implements Pipeline {

    private final @NonNull Pipeline inner;

    protected DelegatingPipeline(@NonNull Pipeline inner) {
        this.inner = Objects.requireNonNull(inner, "inner pipeline");
    }

    protected final @NonNull Pipeline inner() {
        return inner;
    }

    @Override
    public @NonNull Coroutine acquireCoro(@NonNull Protocol protocol, @NonNull CoroutineBody body,
                                          @Nullable Object self, @NonNull List<@Nullable Object> args) {
        return inner.acquireCoro(protocol, body, self, args);
    }

    @Override
    public void releaseCoro(@NonNull Protocol protocol, @NonNull Coroutine coroutine) {
        inner.releaseCoro(protocol, coroutine);
    }

    @Override
    public @Nullable Coroutine currentCoro() {
        return inner.currentCoro();
    }
}
