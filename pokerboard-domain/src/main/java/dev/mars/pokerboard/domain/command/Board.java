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

package dev.mars.pokerboard.domain.command;

import dev.mars.pokerboard.api.projection.EventSourced;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Command-side view of a board: who is on it. Votes are not needed to decide
 * commands and are not tracked here.
 */
public final class Board implements EventSourced<BoardModifiedEvent> {

    private final Map<String, String> participants = new LinkedHashMap<>();

    @Override
    public void apply(BoardModifiedEvent event) {
        if (event instanceof BoardModifiedEvent.ParticipantAdded added) {
            participants.put(added.participantId(), added.participantName());
        } else if (event instanceof BoardModifiedEvent.ParticipantRemoved removed) {
            participants.remove(removed.participantId());
        }
    }

    public boolean hasParticipant(String participantId) {
        return participants.containsKey(participantId);
    }

    public Optional<String> participantName(String participantId) {
        return Optional.ofNullable(participants.get(participantId));
    }

    public Map<String, String> getParticipants() {
        return Collections.unmodifiableMap(participants);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board)) return false;
        return participants.equals(((Board) o).participants);
    }

    @Override
    public int hashCode() {
        return Objects.hash(participants);
    }

    @Override
    public String toString() {
        return "Board{participants=" + participants + '}';
    }
}
