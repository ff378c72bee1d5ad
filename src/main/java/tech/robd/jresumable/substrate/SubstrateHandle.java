/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/substrate/SubstrateHandle.java
 description: Opaque handle for one execution context created by an ExecutionSubstrate.
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

package tech.robd.jresumable.substrate;

import org.jspecify.annotations.Nullable;

/**
 * Handle to one execution context. Carries a single attachment so the owning coroutine can be
 * found again from inside the body.
 */
public interface SubstrateHandle {

    void attach(@Nullable Object owner);

    @Nullable
    Object attachment();

    /**
     * @return whether the body has exited, failed to start, or been disposed
     */
    boolean isFinished();
}
