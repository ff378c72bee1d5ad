/*
 [File Info]
 path: src/test/java/tech/robd/jresumable/mods/MaxConcurrencyTest.java
 description: MaxConcurrency: argument validation, single installation per process, capacity N admits
              exactly N top-level calls, nested calls bypass the limiter, slots freed on failure.
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jresumable.ConfigurationException;
import tech.robd.jresumable.CoroutineRuntime;
import tech.robd.jresumable.ValidationException;
import tech.robd.jresumable.advanced.EventLoop;
import tech.robd.jresumable.iteration.IterableFunction;
import tech.robd.jresumable.iteration.IterationResult;
import tech.robd.jresumable.iteration.IterationStatus;
import tech.robd.jresumable.iteration.AsyncIterator;
import tech.robd.jresumable.tools.TestThunks;
import tech.robd.jresumable.tools.TestThunks.Gate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static tech.robd.jresumable.tools.TestAwaitUtils.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class MaxConcurrencyTest {

    private CoroutineRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) runtime.close();
        MaxConcurrency.reset();
    }

    // 🧩 Section: configuration

    @Test
    void limit_rejectsNonPositiveOrNonNumericCapacity() {
        assertThrows(ValidationException.class, () -> MaxConcurrency.limit(0));
        assertThrows(ValidationException.class, () -> MaxConcurrency.limit(-4));
        assertThrows(ValidationException.class, () -> MaxConcurrency.limit("abc"));
        assertThrows(ValidationException.class, () -> MaxConcurrency.limit(""));
        assertThrows(ValidationException.class, () -> MaxConcurrency.limit((String) null));
        // validation errors are argument errors
        assertThrows(IllegalArgumentException.class, () -> MaxConcurrency.limit("-1"));
        assertEquals(3, MaxConcurrency.limit(" 3 ").semaphore().capacity());
    }

    @Test
        // One limiter per process: a second application of the same mod, or a new limiter while one is installed, fails.
    void apply_secondTime_failsWithConfigurationException() {
        MaxConcurrency mod = MaxConcurrency.limit(2);
        runtime = CoroutineRuntime.builder().use(mod).build();
        assertTrue(MaxConcurrency.installed().isPresent());

        ConfigurationException again = assertThrows(ConfigurationException.class,
                () -> CoroutineRuntime.builder().use(mod).build());
        assertTrue(again.getMessage().contains("multiple times"));
        assertThrows(ConfigurationException.class, () -> MaxConcurrency.limit(1));
    }

    @Test
    void reset_allowsANewLimiter() {
        runtime = CoroutineRuntime.builder().use(MaxConcurrency.limit(1)).build();
        runtime.close();
        MaxConcurrency.reset();
        assertTrue(MaxConcurrency.installed().isEmpty());

        runtime = CoroutineRuntime.builder().use(MaxConcurrency.limit(4)).build();
        assertEquals(4, MaxConcurrency.installed().orElseThrow().capacity());
    }

    // [/🧩 Section: configuration]

    // 🧩 Section: admission

    @Test
        // Capacity N: of N+1 calls started together, exactly N run their first segment; the last starts when a slot frees.
    void capacityTwo_admitsTwoAndQueuesTheThird() {
        MaxConcurrency mod = MaxConcurrency.limit(2);
        runtime = CoroutineRuntime.builder().use(mod).build();
        EventLoop loop = runtime.eventLoop();
        List<Integer> started = Collections.synchronizedList(new ArrayList<>());
        List<Gate<String>> gates = List.of(new Gate<>(), new Gate<>(), new Gate<>());

        IterableFunction<String> task = IterableFunction.of(runtime, g -> {
            int i = (Integer) g.args().get(0);
            started.add(i);
            return g.await(gates.get(i));
        });

        List<CompletableFuture<IterationResult<String>>> results = loop.runBlocking(() -> {
            List<CompletableFuture<IterationResult<String>>> out = new ArrayList<>();
            for (int i = 0; i < 3; i++) out.add(TestThunks.start(task.invoke(i).next()));
            return out;
        });

        assertEquals(List.of(0, 1), new ArrayList<>(started));
        assertEquals(0, mod.semaphore().available());
        assertEquals(1, mod.semaphore().queued());

        gates.get(0).open(loop, "zero");
        assertEquals(IterationResult.returned("zero"), await(results.get(0), 2000));
        awaitTrue(() -> started.contains(2), 2000, "third call should start once a slot is freed");
        assertEquals(0, mod.semaphore().queued());

        gates.get(1).open(loop, "one");
        gates.get(2).open(loop, "two");
        assertEquals("one", await(results.get(1), 2000).value());
        assertEquals("two", await(results.get(2), 2000).value());
        awaitTrue(() -> mod.semaphore().available() == 2, 2000, "all slots should be free again");
    }

    @Test
        // A body holding the only slot calls another limited function and waits on it: no deadlock.
    void nestedCall_atCapacityOne_doesNotDeadlock() {
        MaxConcurrency mod = MaxConcurrency.limit(1);
        runtime = CoroutineRuntime.builder().use(mod).build();

        IterableFunction<String> inner = IterableFunction.of(runtime, g -> "inner:" + g.args().get(0));
        IterableFunction<String> outer = IterableFunction.of(runtime, g -> {
            IterationResult<String> r = g.await(inner.invoke("x").next());
            return "outer(" + r.value() + ")";
        });

        CompletableFuture<IterationResult<String>> first = TestThunks.start(outer.invoke().next());
        assertEquals("outer(inner:x)", await(first, 3000).value());

        CompletableFuture<IterationResult<String>> second = TestThunks.start(outer.invoke().next());
        assertEquals("outer(inner:x)", await(second, 3000).value());
        awaitTrue(() -> mod.semaphore().available() == 1, 2000, "slot should be released");
    }

    @Test
        // An iterator queued for a slot keeps the state registered on it before the slot was granted.
    void queuedIterator_stillIteratesOnceBound() {
        MaxConcurrency mod = MaxConcurrency.limit(1);
        runtime = CoroutineRuntime.builder().use(mod).build();
        EventLoop loop = runtime.eventLoop();
        Gate<String> gate = new Gate<>();

        IterableFunction<String> holder = IterableFunction.of(runtime, g -> g.await(gate));
        IterableFunction<String> counter = IterableFunction.of(runtime, g -> {
            g.yield("a");
            g.yield("b");
            return "end";
        });

        CompletableFuture<IterationResult<String>> held = TestThunks.startOnLoop(loop, holder.invoke().next());
        awaitTrue(gate::isWaiting, 2000, "holder should be parked on its gate");

        AsyncIterator<String> queued = counter.invoke();
        CompletableFuture<IterationResult<String>> firstStep = TestThunks.startOnLoop(loop, queued.next());
        awaitTrue(() -> mod.semaphore().queued() == 1, 2000, "second call should wait for the slot");
        assertFalse(firstStep.isDone());
        assertEquals(IterationStatus.NOT_STARTED, queued.status());

        gate.open(loop, "released");
        assertEquals("released", await(held, 2000).value());
        assertEquals(IterationResult.yielded("a"), await(firstStep, 2000));
        assertEquals(IterationResult.yielded("b"), await(TestThunks.startOnLoop(loop, queued.next()), 2000));
        assertEquals(IterationResult.returned("end"), await(TestThunks.startOnLoop(loop, queued.next()), 2000));
        awaitTrue(() -> mod.semaphore().available() == 1, 2000, "slot should be released after the last step");
    }

    @Test
        // Failure releases the slot just like success.
    void failingBody_releasesSlot() {
        MaxConcurrency mod = MaxConcurrency.limit(1);
        runtime = CoroutineRuntime.builder().use(mod).build();
        IllegalStateException boom = new IllegalStateException("boom");

        IterableFunction<String> failing = IterableFunction.of(runtime, g -> {
            throw boom;
        });

        for (int i = 0; i < 3; i++) {
            Throwable err = awaitFailure(TestThunks.start(failing.invoke().next()), 2000);
            assertSame(boom, err);
        }
        awaitTrue(() -> mod.semaphore().available() == 1, 2000, "slot should not leak");
    }

    @Test
        // Closing a suspended iterator hands its slot to the next caller.
    void closingSuspendedIterator_releasesSlot() {
        MaxConcurrency mod = MaxConcurrency.limit(1);
        runtime = CoroutineRuntime.builder().use(mod).build();
        EventLoop loop = runtime.eventLoop();

        IterableFunction<String> endless = IterableFunction.of(runtime, g -> {
            while (true) g.yield("tick");
        });
        IterableFunction<String> quick = IterableFunction.of(runtime, g -> "quick");

        AsyncIterator<String> holder = endless.invoke();
        assertEquals(IterationResult.yielded("tick"), await(TestThunks.startOnLoop(loop, holder.next()), 2000));
        assertEquals(0, mod.semaphore().available());

        CompletableFuture<IterationResult<String>> waiting = TestThunks.startOnLoop(loop, quick.invoke().next());
        awaitTrue(() -> mod.semaphore().queued() == 1, 2000, "second call should wait for the slot");

        loop.runBlocking(() -> {
            holder.close();
            return null;
        });

        assertEquals(IterationResult.returned("quick"), await(waiting, 2000));
        awaitTrue(() -> mod.semaphore().available() == 1, 2000, "slot should be free again");
    }

    // [/🧩 Section: admission]
}
