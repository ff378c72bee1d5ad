/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/substrate/ThreadSubstrate.java
 description: Execution substrate that parks each coroutine body on a pooled platform thread and hands control
              back and forth with per-resume reply futures.
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

package tech.robd.jresumable.substrate;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.CoroutineBody;
import tech.robd.jresumable.RuntimeProperties;
import tech.robd.jresumable.diagnostics.Diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ExecutionSubstrate} backed by platform threads.
 *
 * <p>Each handle gets a thread from a cached pool on its first resume. The driver and the body
 * never run at the same time:
 * <ul>
 *   <li>{@link #resume} queues a resumption on the handle's inbox and blocks on that resumption's
 *       reply future;</li>
 *   <li>the body completes the reply when it suspends or exits, then blocks on the inbox.</li>
 * </ul>
 * Each resumption carries its own reply, so a resume issued from a second thread (for example an
 * await callback on the event loop) can never receive the transfer meant for the first.</p>
 *
 * <p>Threads are daemon threads named {@code <prefix>-N}. {@link #close()} interrupts every
 * parked body, which unwinds it like {@link #dispose}.</p>
 */
public final class ThreadSubstrate implements ExecutionSubstrate, AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ThreadSubstrate.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private static final AtomicInteger THREADS = new AtomicInteger();
    private final ExecutorService executor;
    private final ThreadLocal<ThreadHandle> current = new ThreadLocal<>();
    private final String threadPrefix;
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public ThreadSubstrate() {
        this(RuntimeProperties.threadPrefix());
    }

    public ThreadSubstrate(@NonNull String threadPrefix) {
        this.threadPrefix = Objects.requireNonNull(threadPrefix, "threadPrefix");
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, this.threadPrefix + "-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
    // [/🧩 Section: construction]

    // 🧩 Section: driver-side
    @Override
    public @NonNull SubstrateHandle create(@NonNull CoroutineBody body, @Nullable Object self,
                                           @NonNull List<@Nullable Object> args) {
        if (body == null) throw new IllegalArgumentException("body cannot be null");
        List<@Nullable Object> copy = Collections.unmodifiableList(new ArrayList<>(args));
        return new ThreadHandle(body, self, copy);
    }

    @Override
    public @NonNull Transfer resume(@NonNull SubstrateHandle handle, @Nullable Throwable error, @Nullable Object value) {
        ThreadHandle h = own(handle);
        if (current.get() == h) throw new IllegalStateException("a coroutine cannot resume itself");
        return h.resume(error, value);
    }

    @Override
    public void dispose(@NonNull SubstrateHandle handle) {
        own(handle).dispose();
    }
    // [/🧩 Section: driver-side]

    // 🧩 Section: body-side
    @Override
    public @Nullable Object suspend(Transfer.@NonNull Suspension suspension) throws Exception {
        if (suspension == null) throw new IllegalArgumentException("suspension cannot be null");
        ThreadHandle h = current.get();
        if (h == null) throw new IllegalStateException("suspend() called outside a coroutine body");
        return h.suspend(suspension);
    }

    @Override
    public @Nullable SubstrateHandle current() {
        return current.get();
    }
    // [/🧩 Section: body-side]

    // 🧩 Section: lifecycle
    @Override
    public void close() {
        DIAG.debug("substrate {} closing", threadPrefix);
        executor.shutdownNow();
    }

    @Override
    public String toString() {
        return "ThreadSubstrate(" + threadPrefix + (executor.isShutdown() ? ", CLOSED)" : ")");
    }
    // [/🧩 Section: lifecycle]

    private ThreadHandle own(SubstrateHandle handle) {
        if (handle instanceof ThreadHandle h && h.owner() == this) return h;
        throw new IllegalArgumentException("handle was not created by " + this);
    }

    private static Object rethrow(Throwable error) throws Exception {
        if (error instanceof Exception e) throw e;
        if (error instanceof Error err) throw err;
        throw new IllegalStateException("unexpected throwable", error);
    }

    /**
     * One resume request. A {@code null} reply marks the kill request sent by dispose.
     */
    private record Resumption(@Nullable Throwable error, @Nullable Object value,
                              @Nullable CompletableFuture<Transfer> reply) {
        static final Resumption KILL = new Resumption(null, null, null);

        boolean isKill() {
            return reply == null;
        }
    }

    /**
     * Unwinds a disposed body. Carries no stack trace.
     */
    private static final class Disposed extends Error {
        Disposed() {
            super("coroutine disposed", null, false, false);
        }
    }

    private final class ThreadHandle implements SubstrateHandle {

        private final int id = System.identityHashCode(this);
        private final CoroutineBody body;
        private final @Nullable Object self;
        private final List<@Nullable Object> args;
        private final BlockingQueue<Resumption> inbox = new LinkedBlockingQueue<>();
        private volatile @Nullable Object attachment;
        private boolean started;        // guarded by this
        private boolean finished;       // guarded by this
        private boolean disposed;       // guarded by this
        private @Nullable Resumption active;  // body thread only

        ThreadHandle(CoroutineBody body, @Nullable Object self, List<@Nullable Object> args) {
            this.body = body;
            this.self = self;
            this.args = args;
        }

        ThreadSubstrate owner() {
            return ThreadSubstrate.this;
        }

        @Override
        public void attach(@Nullable Object owner) {
            this.attachment = owner;
        }

        @Override
        public @Nullable Object attachment() {
            return attachment;
        }

        @Override
        public synchronized boolean isFinished() {
            return finished;
        }

        // 🧩 Point: driver/resume
        Transfer resume(@Nullable Throwable error, @Nullable Object value) {
            Resumption r = new Resumption(error, value, new CompletableFuture<>());
            boolean launch;
            synchronized (this) {
                if (finished || disposed) throw new IllegalStateException("coroutine has already finished");
                inbox.add(r);
                launch = !started;
                started = true;
            }
            if (launch) launch();
            return awaitReply(r.reply());
        }

        private void launch() {
            DIAG.debug("co#{} launch", id);
            try {
                executor.execute(this::runBody);
            } catch (RejectedExecutionException rex) {
                DIAG.warn("co#{} rejected by {}", id, ThreadSubstrate.this);
                finish(null, null, new CancellationException(ThreadSubstrate.this + " rejected coroutine (probably closed)"));
            }
        }

        private Transfer awaitReply(CompletableFuture<Transfer> reply) {
            try {
                return reply.get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for coroutine");
            } catch (ExecutionException ee) {
                throw new IllegalStateException("coroutine reply failed", ee.getCause());
            }
        }

        // 🧩 Point: driver/dispose
        void dispose() {
            synchronized (this) {
                if (finished || disposed) return;
                disposed = true;
                if (!started) {
                    finished = true;
                    DIAG.debug("co#{} disposed before start", id);
                    return;
                }
                inbox.add(Resumption.KILL);
            }
            DIAG.debug("co#{} dispose requested", id);
        }

        // 🧩 Point: body/run
        private void runBody() {
            current.set(this);
            Resumption first;
            try {
                first = inbox.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                current.remove();
                finish(null, null, new CancellationException("Interrupted"));
                return;
            }
            Transfer outcome = null;
            try {
                if (!first.isKill()) {
                    active = first;
                    Throwable error = first.error();
                    outcome = error != null
                            ? new Transfer.Threw(error)
                            : new Transfer.Returned(body.run(self, args));
                }
            } catch (Disposed d) {
                DIAG.debug("co#{} unwound", id);
            } catch (Throwable t) {
                outcome = new Transfer.Threw(t);
            } finally {
                current.remove();
            }
            Resumption last = active;
            active = null;
            finish(last, outcome, new IllegalStateException("coroutine finished before it could be resumed"));
        }

        /**
         * Mark finished, answer the last resumption with {@code outcome} and fail every resumption
         * still queued with {@code stranded}.
         */
        private void finish(@Nullable Resumption last, @Nullable Transfer outcome, Throwable stranded) {
            List<Resumption> pending = new ArrayList<>();
            synchronized (this) {
                finished = true;
                inbox.drainTo(pending);
            }
            DIAG.debug("co#{} finished outcome={}", id, outcome == null ? "none" : outcome.getClass().getSimpleName());
            if (last != null && outcome != null) Objects.requireNonNull(last.reply()).complete(outcome);
            for (Resumption r : pending) {
                if (!r.isKill()) Objects.requireNonNull(r.reply()).complete(new Transfer.Threw(stranded));
            }
        }

        // 🧩 Point: body/suspend
        @Nullable
        Object suspend(Transfer.Suspension suspension) throws Exception {
            Resumption r = active;
            if (r == null) throw new Disposed();
            active = null;
            Objects.requireNonNull(r.reply()).complete(suspension);

            Resumption next;
            try {
                next = inbox.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new Disposed();
            }
            if (next.isKill()) throw new Disposed();
            active = next;
            Throwable error = next.error();
            if (error != null) return rethrow(error);
            return next.value();
        }
    }
}
