/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/AsyncIterator.java
 description: Pull-based iterator over a suspendable body: next() and forEach() return thunks.
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

package tech.robd.jresumable.iteration;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.Thunk;

import java.util.function.Consumer;

/**
 * Consumer side of an {@link IterableFunction} invocation.
 *
 * <p>Both operations return an inert {@link Thunk}. Starting it resumes the body synchronously up
 * to its next yield, return or throw; the outcome is then delivered on the runtime's scheduler,
 * after {@code start} has returned.</p>
 *
 * <p>One driver at a time: starting a step while the previous one is still executing (queued for a
 * concurrency slot, running, or parked on an await) throws {@link IllegalStateException}.</p>
 *
 * @param <T> yielded and returned value type
 */
public interface AsyncIterator<T extends @Nullable Object> extends AutoCloseable {

    /**
     * One step. Delivers {@code (null, yielded(v))}, {@code (null, returned(r))}, the body's error
     * verbatim, or {@link IterationExhaustedException} once the iteration is over.
     */
    @NonNull
    Thunk<IterationResult<T>> next();

    /**
     * Every remaining step. {@code visitor} is called with each yielded value, in order, each call
     * after the step producing it has completed. Delivers the return value, or the first error (from
     * the body or the visitor).
     *
     * @throws IllegalArgumentException if {@code visitor} is null
     */
    @NonNull
    Thunk<T> forEach(@NonNull Consumer<? super T> visitor);

    @NonNull
    IterationStatus status();

    /**
     * Give up on the remaining steps. A suspended body is unwound (its {@code finally} blocks run)
     * and its execution thread and any concurrency slot are released; later steps deliver
     * {@link IterationExhaustedException}. Does nothing once the iteration is over.
     *
     * <p>An iterator dropped mid-iteration without being closed keeps its body parked on a
     * substrate thread until the runtime is closed, which for {@link tech.robd.jresumable.CoroutineRuntime#defaults()}
     * is never.</p>
     *
     * @throws IllegalStateException if a step is in flight
     */
    @Override
    void close();
}
