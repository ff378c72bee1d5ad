/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/CoroutineBody.java
 description: Shape of a body run by the execution substrate: call context plus positional arguments in, result out.
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

/**
 * A suspendable body as seen by the {@link tech.robd.jresumable.substrate.ExecutionSubstrate}.
 * <p>
 * The substrate runs it on its own execution context; the body may suspend any number of times
 * through {@link Coroutine#leave} before it returns or throws.
 * </p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
@FunctionalInterface
public interface CoroutineBody {

    /**
     * @param self the call context bound at invocation, may be {@code null}
     * @param args positional arguments, unmodifiable, may contain {@code null}
     * @return the body's result
     * @throws Exception any failure; it reaches the protocol verbatim
     */
    @Nullable
    Object run(@Nullable Object self, @NonNull List<@Nullable Object> args) throws Exception;
}
