/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/mods/SlotSemaphore.java
 description: Counter-plus-FIFO-queue semaphore whose waiters are callbacks rather than blocked threads.
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
import tech.robd.jresumable.ValidationException;
import tech.robd.jresumable.diagnostics.Diagnostics;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Callback-style semaphore used by {@link MaxConcurrency}.
 *
 * <p>Nobody blocks: {@link #enter(Runnable)} either runs the callback at once or queues it, and
 * {@link #leave()} hands the freed slot straight to the oldest queued callback.
 * While the capacity is unchanged, a non-empty queue implies no slot is available.</p>
 *
 * <p>State changes happen under the semaphore's monitor; callbacks always run outside it, on the
 * thread that entered or left.</p>
 */
public final class SlotSemaphore {

    private static final Diagnostics DIAG = Diagnostics.of(SlotSemaphore.class);

    // 🧩 Section: state
    private final int semId = System.identityHashCode(this);
    private int capacity;
    private int available;
    private final Deque<Runnable> queue = new ArrayDeque<>();
    // [/🧩 Section: state]

    public SlotSemaphore(int capacity) {
        this.capacity = validated(capacity);
        this.available = capacity;
    }

    // 🧩 Section: slots

    /**
     * Take a slot and run {@code onSlot} now, or queue it (FIFO) until {@link #leave()} frees one.
     */
    public void enter(@NonNull Runnable onSlot) {
        if (onSlot == null) throw new IllegalArgumentException("onSlot cannot be null");
        boolean acquired;
        synchronized (this) {
            acquired = available > 0;
            if (acquired) {
                available--;
            } else {
                queue.addLast(onSlot);
            }
        }
        DIAG.debug("sem#{} enter -> {}", semId, acquired ? "acquired" : "queued");
        if (acquired) onSlot.run();
    }

    /**
     * Free a slot. If anyone is queued, the oldest waiter gets the slot directly and runs now.
     *
     * @throws IllegalStateException if more slots are freed than were taken
     */
    public void leave() {
        Runnable next;
        synchronized (this) {
            next = queue.pollFirst();
            if (next == null) {
                if (available >= capacity) throw new IllegalStateException("semaphore left more often than entered");
                available++;
            }
        }
        DIAG.debug("sem#{} leave -> {}", semId, next == null ? "slot freed" : "handed to waiter");
        if (next != null) next.run();
    }

    /**
     * Change the capacity, shifting {@code available} by the difference. Queued waiters are not woken;
     * they still only proceed through {@link #leave()}. Meant to be called once, at startup.
     */
    public synchronized void resize(int newCapacity) {
        validated(newCapacity);
        available += newCapacity - capacity;
        capacity = newCapacity;
        DIAG.debug("sem#{} resized capacity={} available={}", semId, capacity, available);
    }

    /**
     * Drop every waiter and make all slots available again. For test teardown.
     */
    public synchronized void reset() {
        queue.clear();
        available = capacity;
    }
    // [/🧩 Section: slots]

    // 🧩 Section: info
    public synchronized int capacity() {
        return capacity;
    }

    public synchronized int available() {
        return available;
    }

    public synchronized int queued() {
        return queue.size();
    }

    @Override
    public synchronized String toString() {
        return "SlotSemaphore[capacity=" + capacity + ", available=" + available + ", queued=" + queue.size() + "]";
    }
    // [/🧩 Section: info]

    private static int validated(int capacity) {
        if (capacity < 1) throw new ValidationException("capacity must be a positive number, got " + capacity);
        return capacity;
    }
}
