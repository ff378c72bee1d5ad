/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/mods/MaxConcurrency.java
 description: Mod limiting concurrently executing top-level coroutines through one process-wide semaphore;
              nested acquisitions bypass it to avoid deadlock.
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
import tech.robd.jresumable.ConfigurationException;
import tech.robd.jresumable.Coroutine;
import tech.robd.jresumable.CoroutineBody;
import tech.robd.jresumable.DelegatingPipeline;
import tech.robd.jresumable.Mod;
import tech.robd.jresumable.Pipeline;
import tech.robd.jresumable.Protocol;
import tech.robd.jresumable.ValidationException;
import tech.robd.jresumable.diagnostics.Diagnostics;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Limits how many top-level coroutines may be executing at once. Excess entries queue until a slot
 * frees up.
 *
 * <p>Only calls made from outside any coroutine body go through the semaphore. A body that starts
 * another coroutine and waits on it already holds a slot; if the inner call needed one too, a full
 * semaphore would leave both waiting forever.</p>
 *
 * <p>There is one limiter per process. {@link #limit(int)} refuses to build a second one while one is
 * installed, and applying a limiter mod a second time fails with {@link ConfigurationException}.
 * {@link #reset()} uninstalls it (tests).</p>
 *
 * <pre>{@code
 * CoroutineRuntime rt = CoroutineRuntime.builder()
 *         .use(MaxConcurrency.limit(4))
 *         .build();
 * }</pre>
 */
public final class MaxConcurrency implements Mod {

    private static final Diagnostics DIAG = Diagnostics.of(MaxConcurrency.class);

    // 🧩 Section: process-state
    private static final AtomicReference<SlotSemaphore> INSTALLED = new AtomicReference<>();
    // [/🧩 Section: process-state]

    private final SlotSemaphore semaphore;

    private MaxConcurrency(int capacity) {
        this.semaphore = new SlotSemaphore(capacity);
    }

    // 🧩 Section: factories

    /**
     * @param capacity maximum number of concurrently executing top-level coroutines, at least 1
     * @throws ValidationException    if {@code capacity < 1}
     * @throws ConfigurationException if a limiter is already installed in this process
     */
    public static MaxConcurrency limit(int capacity) {
        if (capacity < 1) {
            throw new ValidationException("maxConcurrency: please specify a positive numeric value, got " + capacity);
        }
        if (INSTALLED.get() != null) {
            throw new ConfigurationException("maxConcurrency: mod cannot be applied multiple times");
        }
        return new MaxConcurrency(capacity);
    }

    /**
     * Parse a configured capacity, e.g. the value of {@code -Djresumable.maxConcurrency}.
     *
     * @throws ValidationException if {@code capacity} is not a positive integer
     */
    public static MaxConcurrency limit(@Nullable String capacity) {
        int n;
        try {
            n = Integer.parseInt(capacity == null ? "" : capacity.trim());
        } catch (NumberFormatException nfe) {
            throw new ValidationException("maxConcurrency: please specify a positive numeric value, got '" + capacity + "'", nfe);
        }
        return limit(n);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: mod
    @Override
    public @NonNull Pipeline apply(@NonNull Pipeline inner) {
        if (!INSTALLED.compareAndSet(null, semaphore)) {
            throw new ConfigurationException("maxConcurrency: mod cannot be applied multiple times");
        }
        DIAG.debug("installed limiter capacity={}", semaphore.capacity());
        return new Limited(inner);
    }

    private final class Limited extends DelegatingPipeline {

        Limited(Pipeline inner) {
            super(inner);
        }

        @Override
        public @NonNull Coroutine acquireCoro(@NonNull Protocol protocol, @NonNull CoroutineBody body,
                                              @Nullable Object self, @NonNull List<@Nullable Object> args) {
            if (inner().currentCoro() != null) {
                // nested: the caller already holds a slot
                return super.acquireCoro(protocol, body, self, args);
            }
            return new PlaceholderCoroutine(semaphore, () -> inner().acquireCoro(protocol, body, self, args));
        }

        @Override
        public void releaseCoro(@NonNull Protocol protocol, @NonNull Coroutine coroutine) {
            Coroutine target = coroutine;
            if (coroutine instanceof PlaceholderCoroutine p) {
                Optional<Coroutine> real = p.bound();
                if (real.isEmpty()) {
                    DIAG.debug("release of unbound placeholder ignored");
                    return;
                }
                target = real.get();
            }
            try {
                if (target.isInSemaphore()) {
                    target.setInSemaphore(false);
                    semaphore.leave();
                }
            } finally {
                super.releaseCoro(protocol, target);
            }
        }
    }
    // [/🧩 Section: mod]

    // 🧩 Section: info
    public SlotSemaphore semaphore() {
        return semaphore;
    }

    /**
     * @return the semaphore of the limiter installed in this process, if any
     */
    public static Optional<SlotSemaphore> installed() {
        return Optional.ofNullable(INSTALLED.get());
    }

    /**
     * Uninstall the process-wide limiter and clear its semaphore, so another can be applied.
     */
    public static void reset() {
        SlotSemaphore s = INSTALLED.getAndSet(null);
        if (s != null) s.reset();
    }
    // [/🧩 Section: info]
}
