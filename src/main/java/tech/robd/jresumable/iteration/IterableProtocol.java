/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/IterableProtocol.java
 description: Protocol for iterable coroutines: routes each transfer to the iterator stored in the coroutine's context.
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
import tech.robd.jresumable.Protocol;

/**
 * Stateless; the per-invocation state is the {@link AsyncIteratorImpl} registered under
 * {@link #ITERATOR_KEY} in the coroutine's context before its first enter.
 */
enum IterableProtocol implements Protocol {
    INSTANCE;

    static final String ITERATOR_KEY = "jresumable.iterator";

    @Override
    public void onYield(@NonNull Coroutine coroutine, @Nullable Object value) {
        iterator(coroutine).yielded(value);
    }

    @Override
    public void onReturn(@NonNull Coroutine coroutine, @Nullable Object result) {
        iterator(coroutine).returned(coroutine, result);
    }

    @Override
    public void onThrow(@NonNull Coroutine coroutine, @NonNull Throwable error) {
        iterator(coroutine).threw(coroutine, error);
    }

    private static AsyncIteratorImpl<?> iterator(Coroutine coroutine) {
        if (coroutine.context().get(ITERATOR_KEY) instanceof AsyncIteratorImpl<?> it) return it;
        throw new IllegalStateException("coroutine is not bound to an async iterator: " + coroutine);
    }
}
