/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/Callback.java
 description: Node-style completion handler: an error or a value, never both.
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

import org.jspecify.annotations.Nullable;

/**
 * Completion handler for a {@link Thunk}. Exactly one of {@code error} and {@code value} is
 * meaningful: when {@code error} is non-null, {@code value} is {@code null}.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface Callback<T extends @Nullable Object> {

    void complete(@Nullable Throwable error, @Nullable T value);
}
