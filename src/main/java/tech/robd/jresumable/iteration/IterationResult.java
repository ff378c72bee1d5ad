/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/IterationResult.java
 description: One step of an async iteration: done flag plus the yielded or returned value.
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

import org.jspecify.annotations.Nullable;

/**
 * Result of one {@link AsyncIterator#next()} step.
 *
 * @param done  {@code false} for a yielded value, {@code true} for the body's return value
 * @param value the value
 * @param <T>   value type
 */
public record IterationResult<T extends @Nullable Object>(boolean done, @Nullable T value) {

    public static <T extends @Nullable Object> IterationResult<T> yielded(@Nullable T value) {
        return new IterationResult<>(false, value);
    }

    public static <T extends @Nullable Object> IterationResult<T> returned(@Nullable T value) {
        return new IterationResult<>(true, value);
    }
}
