/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/iteration/IterableFunction.java
 description: Wraps an IterableBody as a callable producing AsyncIterators, with plain and explicit-context invocation.
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
import tech.robd.jresumable.CoroutineBody;
import tech.robd.jresumable.CoroutineRuntime;
import tech.robd.jresumable.Pipeline;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A suspendable function whose invocations are pulled through an {@link AsyncIterator}.
 *
 * <pre>{@code
 * IterableFunction<Object> upTo = IterableFunction.of(g -> {
 *     int n = (Integer) g.args().get(0);
 *     for (int i = 1; i <= n; i++) g.yield(111 * i);
 *     return "done";
 * });
 * upTo.invoke(3).forEach(System.out::println).start((err, last) -> ...);
 * }</pre>
 *
 * <p>The body sees a call context through {@link Generator#callContext()}: the receiver bound with
 * {@link #bindTo(Object)} for {@link #invoke}, or whatever {@link #call} is given.</p>
 *
 * @param <T> yielded and returned value type
 */
public final class IterableFunction<T extends @Nullable Object> {

    private final @NonNull CoroutineRuntime runtime;
    private final @NonNull IterableBody<T> body;
    private final @Nullable Object receiver;

    private IterableFunction(CoroutineRuntime runtime, IterableBody<T> body, @Nullable Object receiver) {
        this.runtime = runtime;
        this.body = body;
        this.receiver = receiver;
    }

    // 🧩 Section: factories
    public static <T extends @Nullable Object> IterableFunction<T> of(@NonNull IterableBody<T> body) {
        return of(CoroutineRuntime.defaults(), body);
    }

    public static <T extends @Nullable Object> IterableFunction<T> of(@NonNull CoroutineRuntime runtime,
                                                                      @NonNull IterableBody<T> body) {
        if (runtime == null) throw new IllegalArgumentException("runtime cannot be null");
        if (body == null) throw new IllegalArgumentException("body cannot be null");
        return new IterableFunction<>(runtime, body, null);
    }

    /**
     * @return a copy whose {@link #invoke} passes {@code receiver} as the call context
     */
    public IterableFunction<T> bindTo(@Nullable Object receiver) {
        return new IterableFunction<>(runtime, body, receiver);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: invocation

    /**
     * Start an invocation with the bound receiver as call context. The body does not run yet.
     */
    public @NonNull AsyncIterator<T> invoke(@Nullable Object... args) {
        return call(receiver, args);
    }

    /**
     * Start an invocation with an explicit call context. The body does not run yet.
     */
    public @NonNull AsyncIterator<T> call(@Nullable Object callContext, @Nullable Object... args) {
        List<@Nullable Object> argList = args == null ? Collections.emptyList() : Arrays.asList(args);
        Pipeline pipeline = runtime.pipeline();
        CoroutineBody coroutineBody = (self, a) -> {
            GeneratorImpl<T> generator = new GeneratorImpl<>(
                    Objects.requireNonNull(pipeline.currentCoro(), "body is not running inside a coroutine"), self, a);
            return body.run(generator);
        };
        return AsyncIteratorImpl.open(pipeline, runtime.scheduler(), coroutineBody, callContext, argList);
    }
    // [/🧩 Section: invocation]

    public @Nullable Object receiver() {
        return receiver;
    }
}
