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

package dev.mars.pokerboard.engine.sidecar;

import java.util.List;
import java.util.Objects;

/**
 * What the sidecar answers for each submitted command.
 *
 * @param <N> The event type commands produce
 */
public sealed interface CommandOutcome<N> permits CommandOutcome.CommandResult, CommandOutcome.CommandError {

    record CommandResult<N>(List<N> events) implements CommandOutcome<N> {
        public CommandResult {
            events = List.copyOf(events);
        }
    }

    record CommandError<N>(String message) implements CommandOutcome<N> {
        public CommandError {
            Objects.requireNonNull(message, "message cannot be null");
        }
    }

    static <N> CommandOutcome<N> result(List<N> events) {
        return new CommandResult<>(events);
    }

    static <N> CommandOutcome<N> error(String message) {
        return new CommandError<>(message);
    }
}
