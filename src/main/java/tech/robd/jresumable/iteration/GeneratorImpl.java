/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/GeneratorImpl.java
 description: Generator bound to the coroutine running the body; suspends it through Coroutine.leave.
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

package tech.robd.jresumable.iteration;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.Coroutine;
import tech.robd.jresumable.Thunk;
import tech.robd.jresumable.substrate.Transfer;

import java.util.List;

final class GeneratorImpl<T extends @Nullable Object> implements Generator<T> {

    private final Coroutine coroutine;
    private final @Nullable Object callContext;
    private final List<@Nullable Object> args;

    GeneratorImpl(Coroutine coroutine, @Nullable Object callContext, List<@Nullable Object> args) {
        this.coroutine = coroutine;
        this.callContext = callContext;
        this.args = args;
    }

    @Override
    public void yield(@Nullable T value) throws Exception {
        coroutine.leave(new Transfer.Yielded(value));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <V extends @Nullable Object> V await(@NonNull Thunk<V> thunk) throws Exception {
        if (thunk == null) throw new IllegalArgumentException("thunk cannot be null");
        thunk.start(coroutine::enter);
        return (V) coroutine.leave(Transfer.Parked.INSTANCE);
    }

    @Override
    public @Nullable Object callContext() {
        return callContext;
    }

    @Override
    public @NonNull List<@Nullable Object> args() {
        return args;
    }
}
