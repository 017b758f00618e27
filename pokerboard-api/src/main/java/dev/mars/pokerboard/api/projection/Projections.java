/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.pokerboard.api.projection;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Folding helpers for {@link EventSourced} models.
 */
public final class Projections {

    private Projections() {
        // Utility class - no instantiation
    }

    /**
     * Builds a state from its default value and a sequence of events.
     *
     * @param initialState Supplier of the default (empty) state
     * @param events Events in log order
     * @return The folded state
     */
    public static <E, S extends EventSourced<E>> S source(Supplier<S> initialState, List<? extends E> events) {
        Objects.requireNonNull(events, "events cannot be null");
        S state = initialState.get();
        for (E event : events) {
            state.apply(event);
        }
        return state;
    }

    /**
     * Applies further events to an existing state and returns it.
     */
    public static <E, S extends EventSourced<E>> S applyAll(S state, List<? extends E> events) {
        for (E event : events) {
            state.apply(event);
        }
        return state;
    }
}
