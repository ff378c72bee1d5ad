/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/IterationExhaustedException.java
 description: Delivered when an iteration is stepped after it has returned or failed.
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

import java.util.NoSuchElementException;

/**
 * The iterator already returned or failed. Only ever delivered through a {@link tech.robd.jresumable.Callback},
 * never thrown from {@code start}.
 */
public final class IterationExhaustedException extends NoSuchElementException {

    public IterationExhaustedException(IterationStatus status) {
        super("iterator is exhausted (" + status + ")");
    }
}
