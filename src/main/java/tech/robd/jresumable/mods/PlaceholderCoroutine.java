/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/mods/PlaceholderCoroutine.java
 description: Stand-in coroutine returned for top-level acquisitions; waits for a semaphore slot on first
              enter, then binds to the real coroutine.
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

package tech.robd.jresumable.mods;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.Coroutine;
import tech.robd.jresumable.substrate.Transfer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * What {@link MaxConcurrency} hands out for a top-level acquisition.
 *
 * <p>States: {@code Pending} (not entered yet) → {@code Queued} (waiting for a slot) →
 * {@code Bound} (real coroutine acquired). Every call dispatches on the current state; once bound,
 * the placeholder is a transparent forwarder.</p>
 */
final class PlaceholderCoroutine implements Coroutine {

    private sealed interface State permits Pending, Queued, Bound {
    }

    private record Pending(Map<String, @Nullable Object> context) implements State {
    }

    private record Queued(Map<String, @Nullable Object> context) implements State {
    }

    private record Bound(Coroutine real) implements State {
    }

    private final SlotSemaphore semaphore;
    private final Supplier<Coroutine> acquire;
    private volatile State state = new Pending(new HashMap<>());

    PlaceholderCoroutine(SlotSemaphore semaphore, Supplier<Coroutine> acquire) {
        this.semaphore = semaphore;
        this.acquire = acquire;
    }

    // 🧩 Section: control
    @Override
    public void enter(@Nullable Throwable error, @Nullable Object value) {
        State s = state;
        if (s instanceof Bound b) {
            b.real().enter(error, value);
            return;
        }
        if (s instanceof Queued) throw new IllegalStateException("coroutine is already waiting for a concurrency slot");
        Map<String, @Nullable Object> pending = ((Pending) s).context();
        state = new Queued(pending);
        semaphore.enter(() -> bind(pending, error, value));
    }

    private void bind(Map<String, @Nullable Object> pending, @Nullable Throwable error, @Nullable Object value) {
        Coroutine real;
        try {
            real = acquire.get();
        } catch (RuntimeException | Error e) {
            semaphore.leave();
            throw e;
        }
        real.context().putAll(pending);
        state = new Bound(real);
        real.setInSemaphore(true);
        real.enter(error, value);
    }

    @Override
    public @Nullable Object leave(Transfer.@NonNull Suspension suspension) throws Exception {
        if (state instanceof Bound b) return b.real().leave(suspension);
        throw new IllegalStateException("coroutine has not started");
    }
    // [/🧩 Section: control]

    // 🧩 Section: state-access
    @Override
    public @NonNull Map<String, @Nullable Object> context() {
        State s = state;
        if (s instanceof Bound b) return b.real().context();
        if (s instanceof Queued q) return q.context();
        return ((Pending) s).context();
    }

    @Override
    public boolean isInSemaphore() {
        return state instanceof Bound b && b.real().isInSemaphore();
    }

    @Override
    public void setInSemaphore(boolean inSemaphore) {
        if (state instanceof Bound b) {
            b.real().setInSemaphore(inSemaphore);
        } else if (inSemaphore) {
            throw new IllegalStateException("an unbound placeholder cannot hold a slot");
        }
    }

    /**
     * @return the real coroutine once a slot has been granted
     */
    Optional<Coroutine> bound() {
        return state instanceof Bound b ? Optional.of(b.real()) : Optional.empty();
    }
    // [/🧩 Section: state-access]

    @Override
    public String toString() {
        return "PlaceholderCoroutine[" + state.getClass().getSimpleName() + "]";
    }
}
