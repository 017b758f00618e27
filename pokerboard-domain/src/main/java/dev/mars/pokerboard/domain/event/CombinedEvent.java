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

package dev.mars.pokerboard.domain.event;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a board event or a vote-type event. This is what the command side reads:
 * configured vote types followed by the board's own history.
 */
public sealed interface CombinedEvent permits CombinedEvent.BoardChange, CombinedEvent.VoteTypeChange {

    record BoardChange(BoardModifiedEvent event) implements CombinedEvent {
        public BoardChange {
            Objects.requireNonNull(event, "event cannot be null");
        }
    }

    record VoteTypeChange(VoteTypeEvent event) implements CombinedEvent {
        public VoteTypeChange {
            Objects.requireNonNull(event, "event cannot be null");
        }
    }

    static CombinedEvent of(BoardModifiedEvent event) {
        return new BoardChange(event);
    }

    static CombinedEvent of(VoteTypeEvent event) {
        return new VoteTypeChange(event);
    }

    /**
     * @return The board event this wraps, empty for vote-type events
     */
    static Optional<BoardModifiedEvent> boardEvent(CombinedEvent event) {
        return event instanceof BoardChange change ? Optional.of(change.event()) : Optional.empty();
    }
}
