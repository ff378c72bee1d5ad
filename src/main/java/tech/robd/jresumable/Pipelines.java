/*
 [File Info]
 path: src/main/java/tech/robd/jresumable/Pipelines.java
 description: Composes a mod chain over a terminal pipeline, outermost mod first.
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

import java.util.List;
import java.util.ListIterator;

/**
 * Pipeline composition.
 */
public final class Pipelines {

    private Pipelines() {
    }

    /**
     * Wrap {@code terminal} in {@code mods}. The first mod in the list is the outermost: its
     * {@code acquireCoro} runs first and delegates inward towards the terminal.
     *
     * @param terminal the substrate-backed pipeline
     * @param mods     mods, outermost first
     * @return the composed pipeline
     */
    public static @NonNull Pipeline compose(@NonNull Pipeline terminal, @NonNull List<? extends Mod> mods) {
        if (terminal == null) throw new IllegalArgumentException("terminal pipeline cannot be null");
        Pipeline p = terminal;
        ListIterator<? extends Mod> it = mods.listIterator(mods.size());
        while (it.hasPrevious()) {
            Mod mod = it.previous();
            if (mod == null) throw new IllegalArgumentException("mods cannot contain null");
            p = mod.apply(p);
            if (p == null) throw new IllegalStateException(mod.getClass().getName() + " returned a null pipeline");
        }
        return p;
    }
}
