/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/substrate/Transfer.java
 description: Messages a suspended or finished body hands back to its driver.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one {@link ExecutionSubstrate#resume} call, as seen by the driver.
 * <p>
 * {@link Suspension}s are produced by the body itself through {@link ExecutionSubstrate#suspend};
 * {@link Returned} and {@link Threw} are produced by the substrate when the body exits.
 * </p>
 */
public sealed interface Transfer {

    /**
     * Body-side suspensions.
     */
    sealed interface Suspension extends Transfer {
    }

    /**
     * The body emitted {@code value} and waits for the next resume.
     */
    record Yielded(@Nullable Object value) implements Suspension {
    }

    /**
     * The body is waiting on something else (an await) that will resume it. The driver has
     * nothing to report.
     */
    enum Parked implements Suspension {
        INSTANCE
    }

    record Returned(@Nullable Object value) implements Transfer {
    }

    record Threw(@NonNull Throwable error) implements Transfer {
    }
}
