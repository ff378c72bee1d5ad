/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/Protocol.java
 description: Callbacks through which a coroutine reports each resume outcome to the component driving it.
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
 * Receives the outcome of every {@link Coroutine#enter} step.
 * <p>
 * Called on the thread that called {@code enter}, after the body has suspended or exited.
 * A body that parked on an await reports nothing until it is resumed again.
 * </p>
 */
public interface Protocol {

    /**
     * The body yielded {@code value} and is suspended. Single-result protocols keep the default.
     */
    default void onYield(@NonNull Coroutine coroutine, @Nullable Object value) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support yield");
    }

    /**
     * The body returned. The coroutine will not run again and should be released.
     */
    void onReturn(@NonNull Coroutine coroutine, @Nullable Object result);

    /**
     * The body threw {@code error}. The coroutine will not run again and should be released.
     */
    void onThrow(@NonNull Coroutine coroutine, @NonNull Throwable error);
}
