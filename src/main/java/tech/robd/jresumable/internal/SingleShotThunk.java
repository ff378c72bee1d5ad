/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/internal/SingleShotThunk.java
 description: Thunk base class enforcing a single start and routing both start overloads to one hook.
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

package tech.robd.jresumable.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.Callback;
import tech.robd.jresumable.Thunk;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Implements the start-once rule of {@link Thunk}; subclasses supply {@link #run}.
 *
 * @param <T> result type
 */
public abstract class SingleShotThunk<T extends @Nullable Object> implements Thunk<T> {

    private final AtomicBoolean started = new AtomicBoolean();

    @Override
    public final void start() {
        begin(null);
    }

    @Override
    public final void start(@NonNull Callback<? super T> callback) {
        if (callback == null) throw new IllegalArgumentException("callback cannot be null; use start() to discard the outcome");
        begin(callback);
    }

    private void begin(@Nullable Callback<? super T> callback) {
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("thunk has already been started");
        run(callback);
    }

    /**
     * Do the work. {@code callback} is {@code null} for fire-and-forget starts.
     */
    protected abstract void run(@Nullable Callback<? super T> callback);
}
