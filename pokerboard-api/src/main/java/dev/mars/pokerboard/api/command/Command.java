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

package dev.mars.pokerboard.api.command;

import java.util.List;

/**
 * A request against an aggregate.
 *
 * Applying a command is pure: it inspects the aggregate and returns the events it
 * produces without mutating anything. A command that fails validation returns a
 * negative event describing the rejection instead of throwing.
 *
 * @param <S> The aggregate type the command is validated against
 * @param <N> The type of the events the command produces
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
@FunctionalInterface
public interface Command<S, N> {

    /**
     * @param state The current aggregate
     * @return The produced events, possibly empty, in the order they should be appended
     */
    List<N> apply(S state);
}
