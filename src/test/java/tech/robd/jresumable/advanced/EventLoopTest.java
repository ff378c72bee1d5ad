/*
 [File Info]
 path: src/test/java/tech/robd/jresumable/advanced/EventLoopTest.java
 description: EventLoop: ordered deferral on the loop thread, delayed scheduling, failing tasks keep the
              loop alive, runBlocking bridge and its deadlock guard, closing.
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static tech.robd.jresumable.tools.TestAwaitUtils.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class EventLoopTest {

    private final EventLoop loop = EventLoop.create("loop-test");

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void defer_runsTasksInOrderOnTheLoopThread() {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(3);
        for (int i = 0; i < 3; i++) {
            int n = i;
            loop.defer(() -> {
                seen.add(n + "@" + Thread.currentThread().getName() + "@" + loop.inLoop());
                done.countDown();
            });
        }
        awaitLatch(done, 2000, "deferred tasks should run");
        assertEquals(List.of("0@loop-test@true", "1@loop-test@true", "2@loop-test@true"), seen);
        assertFalse(loop.inLoop());
    }

    @Test
        // A task deferred from the loop runs after the current task returns.
    void defer_fromLoop_runsOnALaterTurn() {
        List<String> order = loop.runBlocking(() -> {
            List<String> out = Collections.synchronizedList(new ArrayList<>());
            loop.defer(() -> out.add("deferred"));
            out.add("current");
            return out;
        });
        awaitTrue(() -> order.size() == 2, 2000, "deferred task should run");
        assertEquals(List.of("current", "deferred"), order);
    }

    @Test
    void failingTask_doesNotStopTheLoop() {
        loop.defer(() -> {
            throw new IllegalStateException("task failure (expected in this test)");
        });
        assertEquals("still alive", loop.runBlocking(() -> "still alive"));
    }

    @Test
    void schedule_runsAfterTheDelay() {
        long start = System.nanoTime();
        CountDownLatch fired = new CountDownLatch(1);
        loop.schedule(fired::countDown, Duration.ofMillis(50));
        awaitLatch(fired, 2000, "scheduled task should fire");
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(45));
    }

    @Test
    void submit_exposesResultAndFailure() throws Exception {
        Integer answer = await(loop.submit(() -> 42), 2000);
        assertEquals(42, answer);

        CompletableFuture<Object> failed = loop.submit(() -> {
            throw new IllegalArgumentException("bad");
        });
        ExecutionException ee = assertThrows(ExecutionException.class, () -> failed.get(2, TimeUnit.SECONDS));
        assertTrue(ee.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void runBlocking_rethrowsAndRefusesToRunOnTheLoop() {
        IllegalStateException boom = assertThrows(IllegalStateException.class,
                () -> loop.runBlocking(() -> {
                    throw new IllegalStateException("boom");
                }));
        assertEquals("boom", boom.getMessage());

        Throwable nested = awaitFailure(loop.submit(() -> loop.runBlocking(() -> "never")), 2000);
        assertTrue(nested instanceof IllegalStateException, nested.toString());
    }

    @Test
    void close_rejectsFurtherWork() {
        EventLoop closed = EventLoop.create("closed-loop");
        closed.close();

        assertThrows(RejectedExecutionException.class, () -> closed.defer(() -> { }));
        Throwable t = awaitFailure(closed.submit(() -> "late"), 2000);
        assertTrue(t instanceof CancellationException, t.toString());
        assertEquals("closed-loop", closed.getName());
    }

    @Test
    void nullArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> EventLoop.create(null));
        assertThrows(IllegalArgumentException.class, () -> loop.defer(null));
        assertThrows(IllegalArgumentException.class, () -> loop.schedule(() -> { }, null));
        assertThrows(IllegalArgumentException.class, () -> loop.submit(null));
    }
}
