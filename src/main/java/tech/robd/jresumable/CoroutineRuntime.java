/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/CoroutineRuntime.java
 description: Bundles substrate, scheduler and the composed pipeline. Builder with mods and system-property
              configuration, plus a lazily created shared default.
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

package tech.robd.jresumable;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.advanced.EventLoop;
import tech.robd.jresumable.diagnostics.Diagnostics;
import tech.robd.jresumable.internal.SubstratePipeline;
import tech.robd.jresumable.mods.MaxConcurrency;
import tech.robd.jresumable.substrate.ExecutionSubstrate;
import tech.robd.jresumable.substrate.ThreadSubstrate;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a suspendable function needs to run: an {@link ExecutionSubstrate}, a {@link Scheduler}
 * for outcome delivery, and the {@link Pipeline} composed from the configured {@link Mod}s.
 *
 * <p>Typical usage:</p>
 * <pre>{@code
 * try (CoroutineRuntime rt = CoroutineRuntime.builder()
 *         .use(MaxConcurrency.limit(8))
 *         .build()) {
 *     IterableFunction<Integer> counter = IterableFunction.of(rt, g -> { ... });
 * }
 * }</pre>
 *
 * <p>Resources the builder created itself (the default {@link ThreadSubstrate} and
 * {@link EventLoop}) are closed by {@link #close()}; ones passed in are left to their owner.</p>
 */
public final class CoroutineRuntime implements AutoCloseable {

    private static final Diagnostics DIAG = Diagnostics.of(CoroutineRuntime.class);

    // 🧩 Section: state
    private final @NonNull ExecutionSubstrate substrate;
    private final @NonNull Scheduler scheduler;
    private final @NonNull Pipeline pipeline;
    private final List<AutoCloseable> owned;
    // [/🧩 Section: state]

    private CoroutineRuntime(ExecutionSubstrate substrate, Scheduler scheduler, Pipeline pipeline, List<AutoCloseable> owned) {
        this.substrate = substrate;
        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.owned = owned;
    }

    // 🧩 Section: factories
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shared runtime with a thread substrate, an event loop named {@code jresumable-loop} and no mods.
     * Created on first use and never closed.
     */
    public static CoroutineRuntime defaults() {
        return DefaultHolder.INSTANCE;
    }

    private static final class DefaultHolder {
        static final CoroutineRuntime INSTANCE = builder().build();
    }
    // [/🧩 Section: factories]

    // 🧩 Section: accessors
    public @NonNull Pipeline pipeline() {
        return pipeline;
    }

    public @NonNull Scheduler scheduler() {
        return scheduler;
    }

    public @NonNull ExecutionSubstrate substrate() {
        return substrate;
    }

    /**
     * @return the scheduler as an {@link EventLoop}
     * @throws IllegalStateException if a different scheduler was configured
     */
    public @NonNull EventLoop eventLoop() {
        if (scheduler instanceof EventLoop loop) return loop;
        throw new IllegalStateException("scheduler is not an EventLoop: " + scheduler);
    }
    // [/🧩 Section: accessors]

    @Override
    public void close() {
        for (AutoCloseable c : owned) {
            try {
                c.close();
            } catch (Exception e) {
                DIAG.failure("closing " + c + " failed", e);
            }
        }
    }

    /**
     * Builds a {@link CoroutineRuntime}. Mods are listed outermost first.
     */
    public static final class Builder {
        private @Nullable ExecutionSubstrate substrate;
        private @Nullable Scheduler scheduler;
        private final List<Mod> mods = new ArrayList<>();

        private Builder() {
        }

        public Builder substrate(@NonNull ExecutionSubstrate substrate) {
            if (substrate == null) throw new IllegalArgumentException("substrate cannot be null");
            this.substrate = substrate;
            return this;
        }

        public Builder scheduler(@NonNull Scheduler scheduler) {
            if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Add a mod inside the ones added so far.
         */
        public Builder use(@NonNull Mod mod) {
            if (mod == null) throw new IllegalArgumentException("mod cannot be null");
            mods.add(mod);
            return this;
        }

        /**
         * Apply {@value RuntimeProperties#MAX_CONCURRENCY} when it is set.
         *
         * @throws ValidationException    if the property is not a positive integer
         * @throws ConfigurationException if a limiter is already installed
         */
        public Builder fromSystemProperties() {
            RuntimeProperties.maxConcurrency().ifPresent(v -> use(MaxConcurrency.limit(v)));
            return this;
        }

        /**
         * Compose the pipeline. Mods are applied here, so mod misuse surfaces from this call.
         */
        public CoroutineRuntime build() {
            List<AutoCloseable> owned = new ArrayList<>();
            ExecutionSubstrate sub = substrate;
            if (sub == null) {
                ThreadSubstrate ts = new ThreadSubstrate();
                owned.add(ts);
                sub = ts;
            }
            Scheduler sched = scheduler;
            if (sched == null) {
                EventLoop loop = EventLoop.create("jresumable-loop");
                owned.add(loop);
                sched = loop;
            }
            Pipeline pipeline;
            try {
                pipeline = Pipelines.compose(new SubstratePipeline(sub), mods);
            } catch (RuntimeException e) {
                new CoroutineRuntime(sub, sched, new SubstratePipeline(sub), owned).close();
                throw e;
            }
            DIAG.debug("runtime built mods={} substrate={} scheduler={}", mods.size(), sub, sched);
            return new CoroutineRuntime(sub, sched, pipeline, owned);
        }
    }
}
