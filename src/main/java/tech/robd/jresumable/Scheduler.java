/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/Scheduler.java
 description: Seam for running work on a later turn; outcome delivery goes through it.
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

/**
 * Runs tasks on a later turn than the caller's. {@link tech.robd.jresumable.advanced.EventLoop} is
 * the stock implementation.
 */
@FunctionalInterface
public interface Scheduler {

    /**
     * Queue {@code task}. Must not run it before this method returns.
     */
    void defer(@NonNull Runnable task);
}
