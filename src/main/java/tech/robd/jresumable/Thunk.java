/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/Thunk.java
 description: Deferred single-shot task with explicit fire-and-forget and callback start overloads.
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

/**
 * A deferred, single-shot unit of work. Nothing happens until one of the {@code start} overloads
 * is called, and only one call is allowed.
 *
 * <p>Whatever work can run synchronously runs before {@code start} returns. The outcome is
 * always delivered afterwards, on the runtime's {@link Scheduler}, never from inside
 * {@code start}.</p>
 *
 * @param <T> result type
 */
public interface Thunk<T extends @Nullable Object> {

    /**
     * Run the work and discard its outcome.
     *
     * @throws IllegalStateException if already started
     */
    void start();

    /**
     * Run the work and deliver its outcome to {@code callback} later.
     *
     * @throws IllegalArgumentException if {@code callback} is null
     * @throws IllegalStateException    if already started
     */
    void start(@NonNull Callback<? super T> callback);
}
