/*
 [File Info]
 path: src/test/java/tech/robd/jresumable/CoroutineRuntimeTest.java
 description: CoroutineRuntime: defaults, builder validation, limiter from system properties, custom
              schedulers, ownership of closed resources.
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jresumable.advanced.EventLoop;
import tech.robd.jresumable.iteration.IterableFunction;
import tech.robd.jresumable.iteration.IterationResult;
import tech.robd.jresumable.mods.MaxConcurrency;
import tech.robd.jresumable.substrate.ThreadSubstrate;
import tech.robd.jresumable.tools.TestThunks;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static tech.robd.jresumable.tools.TestAwaitUtils.await;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class CoroutineRuntimeTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(RuntimeProperties.MAX_CONCURRENCY);
        System.clearProperty(RuntimeProperties.THREAD_PREFIX);
        MaxConcurrency.reset();
    }

    @Test
    void defaults_isSharedAndUsesAnEventLoop() {
        CoroutineRuntime rt = CoroutineRuntime.defaults();
        assertSame(rt, CoroutineRuntime.defaults());
        assertEquals("jresumable-loop", rt.eventLoop().getName());
        assertNull(rt.pipeline().currentCoro());
    }

    @Test
    void fromSystemProperties_installsConfiguredLimiter() {
        System.setProperty(RuntimeProperties.MAX_CONCURRENCY, " 3 ");
        try (CoroutineRuntime rt = CoroutineRuntime.builder().fromSystemProperties().build()) {
            assertEquals(3, MaxConcurrency.installed().orElseThrow().capacity());

            IterableFunction<Object> fn = IterableFunction.of(rt, g -> "limited");
            assertEquals(IterationResult.returned("limited"), await(TestThunks.start(fn.invoke().next()), 2000));
        }
    }

    @Test
    void fromSystemProperties_withoutProperty_installsNothing() {
        try (CoroutineRuntime rt = CoroutineRuntime.builder().fromSystemProperties().build()) {
            assertTrue(MaxConcurrency.installed().isEmpty());
            assertNotNull(rt.pipeline());
        }
    }

    @Test
    void fromSystemProperties_rejectsInvalidValue() {
        System.setProperty(RuntimeProperties.MAX_CONCURRENCY, "zero");
        assertThrows(ValidationException.class, () -> CoroutineRuntime.builder().fromSystemProperties());
    }

    @Test
    void threadPrefix_isReadFromSystemProperties() {
        assertEquals(RuntimeProperties.DEFAULT_THREAD_PREFIX, RuntimeProperties.threadPrefix());
        System.setProperty(RuntimeProperties.THREAD_PREFIX, "custom");
        assertEquals("custom", RuntimeProperties.threadPrefix());
        try (ThreadSubstrate substrate = new ThreadSubstrate()) {
            assertTrue(substrate.toString().contains("custom"));
        }
    }

    @Test
    void builder_rejectsNulls() {
        CoroutineRuntime.Builder b = CoroutineRuntime.builder();
        assertThrows(IllegalArgumentException.class, () -> b.use(null));
        assertThrows(IllegalArgumentException.class, () -> b.scheduler(null));
        assertThrows(IllegalArgumentException.class, () -> b.substrate(null));
    }

    @Test
        // Outcomes go to whatever scheduler was configured; eventLoop() only works for an EventLoop.
    void customScheduler_receivesDeliveries() {
        List<Runnable> queued = new java.util.ArrayList<>();
        try (CoroutineRuntime rt = CoroutineRuntime.builder().scheduler(queued::add).build()) {
            assertThrows(IllegalStateException.class, rt::eventLoop);

            IterableFunction<Object> fn = IterableFunction.of(rt, g -> 7);
            Object[] delivered = new Object[1];
            fn.invoke().next().start((err, r) -> delivered[0] = r.value());

            assertNull(delivered[0], "outcome must not be delivered inside start");
            assertEquals(1, queued.size());
            queued.get(0).run();
            assertEquals(7, delivered[0]);
        }
    }

    @Test
    void close_shutsDownOwnedResourcesOnly() {
        EventLoop shared = EventLoop.create("shared-loop");
        try {
            CoroutineRuntime external = CoroutineRuntime.builder().scheduler(shared).build();
            external.close();
            assertEquals("ok", shared.runBlocking(() -> "ok"), "a passed-in loop stays open");

            CoroutineRuntime owning = CoroutineRuntime.builder().build();
            EventLoop own = owning.eventLoop();
            owning.close();
            assertThrows(RejectedExecutionException.class, () -> own.defer(() -> { }));
        } finally {
            shared.close();
        }
    }
}
