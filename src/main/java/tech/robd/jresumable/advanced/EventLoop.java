/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/advanced/EventLoop.java
 description: Single-threaded scheduler: the later turn on which thunk outcomes and await resumptions run.
              Provides defer/schedule/submit, a blocking bridge, and graceful close.
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

package tech.robd.jresumable.advanced;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jresumable.Scheduler;
import tech.robd.jresumable.diagnostics.Diagnostics;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * An {@code EventLoop} runs tasks one at a time on a single daemon thread.
 *
 * <p>It is the cooperative scheduler coroutines are driven from:
 * <ul>
 *   <li>{@link #defer(Runnable)} queues a task for a later turn (the {@link Scheduler} contract);</li>
 *   <li>{@link #schedule(Runnable, Duration)} queues it after a delay;</li>
 *   <li>{@link #submit(Callable)} runs a driver block on the loop and exposes its result as a future;</li>
 *   <li>{@link #runBlocking(Callable)} bridges synchronous callers onto the loop.</li>
 * </ul>
 *
 * <p>A task that throws is logged as a failure; the loop keeps running.</p>
 */
public final class EventLoop implements Scheduler, AutoCloseable {

    private static final Diagnostics DIAG = Diagnostics.of(EventLoop.class);

    private final ScheduledExecutorService executor;
    private final String name;
    private volatile @Nullable Thread loopThread;

    private EventLoop(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    // 🧩 Section: factories

    /**
     * @param name thread name for the loop (non-null)
     * @return a new, running loop
     */
    public static EventLoop create(String name) {
        if (name == null) throw new IllegalArgumentException("name cannot be null");
        return new EventLoop(name);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: execution
    @Override
    public void defer(@NonNull Runnable task) {
        if (task == null) throw new IllegalArgumentException("task cannot be null");
        try {
            executor.execute(() -> runGuarded(task));
        } catch (RejectedExecutionException rex) {
            DIAG.warn("loop {} rejected task (closed)", name);
            throw rex;
        }
    }

    /**
     * Run {@code task} on the loop once {@code delay} has elapsed.
     */
    public void schedule(@NonNull Runnable task, @NonNull Duration delay) {
        if (task == null || delay == null) throw new IllegalArgumentException("task and delay cannot be null");
        executor.schedule(() -> runGuarded(task), Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    /**
     * Run {@code block} on the loop.
     *
     * @return a future completing with the block's result or failure
     */
    public <T extends @Nullable Object> CompletableFuture<T> submit(@NonNull Callable<T> block) {
        if (block == null) throw new IllegalArgumentException("Block cannot be null");
        CompletableFuture<T> cf = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    cf.complete(block.call());
                } catch (Throwable t) {
                    cf.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException rex) {
            cf.completeExceptionally(new CancellationException("EventLoop '" + name + "' rejected task (probably closed)"));
        }
        return cf;
    }

    /**
     * Run {@code block} on the loop and block the caller for its result.
     *
     * @throws IllegalStateException if called from the loop thread itself
     */
    public <T extends @Nullable Object> T runBlocking(@NonNull Callable<T> block) {
        if (inLoop()) throw new IllegalStateException("runBlocking() on the loop thread would deadlock");
        try {
            return submit(block).get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted");
        } catch (ExecutionException ee) {
            Throwable c = ee.getCause();
            if (c instanceof RuntimeException re) throw re;
            if (c instanceof Error err) throw err;
            throw new CompletionException(c);
        }
    }

    private void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            DIAG.failure("task on event loop '" + name + "' failed", t);
        }
    }
    // [/🧩 Section: execution]

    // 🧩 Section: info

    /**
     * @return whether the calling thread is this loop's thread
     */
    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "EventLoop(" + name + ")";
    }
    // [/🧩 Section: info]

    // 🧩 Section: lifecycle

    /**
     * Stop accepting tasks, let queued ones finish for up to 5 seconds, then force shutdown.
     */
    @Override
    public void close() {
        executor.shutdown();
        if (inLoop()) return; // cannot wait for ourselves
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
    // [/🧩 Section: lifecycle]
}
