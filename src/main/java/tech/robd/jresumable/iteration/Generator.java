/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/Generator.java
 description: Body-side view of an iteration: yield, await, call context and arguments.
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

import java.util.List;

/**
 * Handed to an {@link IterableBody}. Only usable from inside that body.
 *
 * @param <T> yielded value type
 */
public interface Generator<T extends @Nullable Object> {

    // 🧩 Section: suspension

    /**
     * Emit {@code value} to the consumer and suspend until the next step is requested.
     *
     * @throws Exception an error injected by the driver on resume
     */
    void yield(@Nullable T value) throws Exception;

    /**
     * Start {@code thunk}, suspend until it completes, then return its value or throw its error.
     * The thunk must deliver its outcome asynchronously, as every {@link Thunk} does.
     *
     * @param thunk work to wait for, not yet started
     * @param <V>   result type
     * @return the thunk's value
     * @throws Exception the thunk's error, verbatim
     */
    <V extends @Nullable Object> V await(@NonNull Thunk<V> thunk) throws Exception;
    // [/🧩 Section: suspension]

    // 🧩 Section: invocation
    /**
     * @return the call context the iterator was created with ({@code null} when unbound)
     */
    @Nullable
    Object callContext();

    @NonNull
    List<@Nullable Object> args();
    // [/🧩 Section: invocation]
}
