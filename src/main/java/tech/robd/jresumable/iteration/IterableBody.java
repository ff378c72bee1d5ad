/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/IterableBody.java
 description: User body of an iterable suspendable function.
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

/**
 * Body of an {@link IterableFunction}. Emits values through {@link Generator#yield(Object)} and ends
 * by returning (the final value) or throwing.
 *
 * <pre>{@code
 * IterableBody<Object> countdown = g -> {
 *     int n = (Integer) g.args().get(0);
 *     for (int i = n; i > 0; i--) g.yield(i);
 *     return "liftoff";
 * };
 * }</pre>
 *
 * @param <T> yielded and returned value type
 */
@FunctionalInterface
public interface IterableBody<T extends @Nullable Object> {

    @Nullable
    T run(@NonNull Generator<T> generator) throws Exception;
}
