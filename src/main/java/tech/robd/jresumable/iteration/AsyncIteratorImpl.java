/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/AsyncIteratorImpl.java
 description: AsyncIterator driving one coroutine: step bookkeeping, outcome delivery on the scheduler,
              release after the final exit, and forEach traversal.
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

package tech.robd.jresumable.iteration;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.Callback;
import tech.robd.jresumable.Coroutine;
import tech.robd.jresumable.CoroutineBody;
import tech.robd.jresumable.Pipeline;
import tech.robd.jresumable.Scheduler;
import tech.robd.jresumable.Thunk;
import tech.robd.jresumable.diagnostics.Diagnostics;
import tech.robd.jresumable.internal.SingleShotThunk;

import java.util.List;
import java.util.function.Consumer;

/**
 * Default {@link AsyncIterator}.
 *
 * <p>A step is in flight from the moment its thunk starts until {@link IterableProtocol} reports
 * the coroutine's transfer. The outcome is then handed to the {@link Scheduler}, and the coroutine
 * is released first if that was its final exit.</p>
 */
final class AsyncIteratorImpl<T extends @Nullable Object> implements AsyncIterator<T> {

    private static final Diagnostics DIAG = Diagnostics.of(AsyncIteratorImpl.class);

    // 🧩 Section: state
    private final int iterId = System.identityHashCode(this);
    private final Pipeline pipeline;
    private final Scheduler scheduler;
    private final Coroutine coroutine;
    private volatile IterationStatus status = IterationStatus.NOT_STARTED;
    private volatile boolean stepInFlight;
    private volatile @Nullable Callback<? super IterationResult<T>> pending;
    // [/🧩 Section: state]

    private AsyncIteratorImpl(Pipeline pipeline, Scheduler scheduler, Coroutine coroutine) {
        this.pipeline = pipeline;
        this.scheduler = scheduler;
        this.coroutine = coroutine;
    }

    /**
     * Acquire a coroutine for {@code body} and bind a new iterator to it. Does not run the body.
     */
    static <T extends @Nullable Object> AsyncIteratorImpl<T> open(Pipeline pipeline, Scheduler scheduler, CoroutineBody body,
                                                                   @Nullable Object self, List<@Nullable Object> args) {
        Coroutine co = pipeline.acquireCoro(IterableProtocol.INSTANCE, body, self, args);
        AsyncIteratorImpl<T> it = new AsyncIteratorImpl<>(pipeline, scheduler, co);
        co.context().put(IterableProtocol.ITERATOR_KEY, it);
        return it;
    }

    // 🧩 Section: api
    @Override
    public @NonNull Thunk<IterationResult<T>> next() {
        return new SingleShotThunk<>() {
            @Override
            protected void run(@Nullable Callback<? super IterationResult<T>> callback) {
                step(callback);
            }
        };
    }

    @Override
    public @NonNull Thunk<T> forEach(@NonNull Consumer<? super T> visitor) {
        if (visitor == null) throw new IllegalArgumentException("forEach() expects a visitor");
        return new SingleShotThunk<>() {
            @Override
            protected void run(@Nullable Callback<? super T> callback) {
                new Traversal(visitor, callback).advance();
            }
        };
    }

    @Override
    public @NonNull IterationStatus status() {
        return status;
    }

    @Override
    public void close() {
        if (stepInFlight) throw new IllegalStateException("cannot close an iterator while a step is in flight");
        if (status.isTerminal()) return;
        DIAG.debug("iter#{} closed early from {}", iterId, status);
        status = IterationStatus.DONE;
        pipeline.releaseCoro(IterableProtocol.INSTANCE, coroutine);
    }
    // [/🧩 Section: api]

    // 🧩 Section: stepping
    private void step(@Nullable Callback<? super IterationResult<T>> callback) {
        if (stepInFlight) {
            throw new IllegalStateException("iterator is already being driven; wait for the previous step to complete");
        }
        IterationStatus s = status;
        if (s.isTerminal()) {
            deliver(callback, new IterationExhaustedException(s), null);
            return;
        }
        stepInFlight = true;
        pending = callback;
        DIAG.debug("iter#{} step from {}", iterId, s);
        try {
            coroutine.enter(null, null);
        } catch (RuntimeException | Error e) {
            if (!stepInFlight) throw e; // the step had already reported; this came from outside it
            DIAG.debug("iter#{} resume failed: {}", iterId, e.toString());
            status = IterationStatus.FAILED;
            try {
                pipeline.releaseCoro(IterableProtocol.INSTANCE, coroutine);
            } finally {
                complete(e, null);
            }
        }
    }

    void yielded(@Nullable Object value) {
        status = IterationStatus.SUSPENDED;
        complete(null, IterationResult.yielded(cast(value)));
    }

    void returned(Coroutine co, @Nullable Object result) {
        status = IterationStatus.DONE;
        try {
            pipeline.releaseCoro(IterableProtocol.INSTANCE, co);
        } finally {
            complete(null, IterationResult.returned(cast(result)));
        }
    }

    void threw(Coroutine co, Throwable error) {
        status = IterationStatus.FAILED;
        try {
            pipeline.releaseCoro(IterableProtocol.INSTANCE, co);
        } finally {
            complete(error, null);
        }
    }

    private void complete(@Nullable Throwable error, @Nullable IterationResult<T> result) {
        Callback<? super IterationResult<T>> callback = pending;
        pending = null;
        stepInFlight = false;
        deliver(callback, error, result);
    }

    private <R extends @Nullable Object> void deliver(@Nullable Callback<? super R> callback,
                                                      @Nullable Throwable error, @Nullable R value) {
        if (callback == null) {
            DIAG.debug("iter#{} outcome discarded (fire-and-forget)", iterId);
            return;
        }
        scheduler.defer(() -> callback.complete(error, value));
    }

    @SuppressWarnings("unchecked")
    private T cast(@Nullable Object value) {
        return (T) value;
    }
    // [/🧩 Section: stepping]

    // 🧩 Section: traversal

    /**
     * One forEach run. Each step is started from inside the delivery of the previous one, so the
     * visitor always sees a completed step.
     */
    private final class Traversal {
        private final Consumer<? super T> visitor;
        private final @Nullable Callback<? super T> done;

        Traversal(Consumer<? super T> visitor, @Nullable Callback<? super T> done) {
            this.visitor = visitor;
            this.done = done;
        }

        void advance() {
            step(this::onStep);
        }

        private void onStep(@Nullable Throwable error, @Nullable IterationResult<T> result) {
            if (error != null || result == null) {
                finish(error, null);
                return;
            }
            if (result.done()) {
                finish(null, result.value());
                return;
            }
            try {
                visitor.accept(result.value());
                advance();
            } catch (RuntimeException | Error e) {
                finish(e, null);
            }
        }

        private void finish(@Nullable Throwable error, @Nullable T value) {
            if (done != null) done.complete(error, value);
        }
    }
    // [/🧩 Section: traversal]
}
