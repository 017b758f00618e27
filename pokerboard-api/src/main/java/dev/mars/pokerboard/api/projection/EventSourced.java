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

/**
 * A state that is built by folding events.
 *
 * Implementations must be deterministic: the resulting state depends only on
 * the sequence of applied events. Events a model does not care about are no-ops.
 *
 * @param <E> The event type folded into this state
 */
public interface EventSourced<E> {

    /**
     * Applies one event in place.
     */
    void apply(E event);
}
