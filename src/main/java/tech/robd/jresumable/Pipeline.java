/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/Pipeline.java
 description: Acquire/release chain for coroutines, composed from mods over a substrate-backed terminal.
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

package tech.robd.jresumable;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Creates and disposes coroutines.
 * <p>
 * A pipeline is a terminal, substrate-backed implementation wrapped by zero or more {@link Mod}s.
 * It is immutable once composed (see {@link Pipelines#compose}).
 * </p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public interface Pipeline {

    /**
     * Obtain a coroutine for {@code body}. Returns synchronously and never runs the body; the caller
     * decides when to {@link Coroutine#enter} it.
     *
     * @param protocol receives the coroutine's outcomes
     * @param body     the body to run
     * @param self     call context for the body
     * @param args     arguments for the body
     * @return a coroutine handle, not yet started
     */
    @NonNull
    Coroutine acquireCoro(@NonNull Protocol protocol, @NonNull CoroutineBody body,
                          @Nullable Object self, @NonNull List<@Nullable Object> args);

    /**
     * Return a coroutine after its final exit. Called once per acquired coroutine.
     */
    void releaseCoro(@NonNull Protocol protocol, @NonNull Coroutine coroutine);

    /**
     * @return the coroutine whose body is running on the calling thread, or {@code null} when the
     * caller is not inside any coroutine body
     */
    @Nullable
    Coroutine currentCoro();
}
