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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * A single state change on one board.
 *
 * The set of variants is closed. Positive variants change board state; negative
 * variants ({@link ParticipantNotAdded}, {@link ParticipantCouldNotBeRemoved},
 * {@link ParticipantCouldNotVote}) record a rejected command and are part of the
 * board's history like any other event.
 *
 * Serialized as an externally tagged object, e.g.
 * {@code {"ParticipantAdded":{"participant_id":"p1","participant_name":"Ann"}}}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = BoardModifiedEvent.ParticipantAdded.class, name = "ParticipantAdded"),
    @JsonSubTypes.Type(value = BoardModifiedEvent.ParticipantNotAdded.class, name = "ParticipantNotAdded"),
    @JsonSubTypes.Type(value = BoardModifiedEvent.ParticipantRemoved.class, name = "ParticipantRemoved"),
    @JsonSubTypes.Type(value = BoardModifiedEvent.ParticipantCouldNotBeRemoved.class, name = "ParticipantCouldNotBeRemoved"),
    @JsonSubTypes.Type(value = BoardModifiedEvent.ParticipantVoted.class, name = "ParticipantVoted"),
    @JsonSubTypes.Type(value = BoardModifiedEvent.ParticipantCouldNotVote.class, name = "ParticipantCouldNotVote"),
    @JsonSubTypes.Type(value = BoardModifiedEvent.VotesCleared.class, name = "VotesCleared")
})
public sealed interface BoardModifiedEvent permits
        BoardModifiedEvent.ParticipantAdded,
        BoardModifiedEvent.ParticipantNotAdded,
        BoardModifiedEvent.ParticipantRemoved,
        BoardModifiedEvent.ParticipantCouldNotBeRemoved,
        BoardModifiedEvent.ParticipantVoted,
        BoardModifiedEvent.ParticipantCouldNotVote,
        BoardModifiedEvent.VotesCleared {

    /**
     * @return true for variants that record a rejected command
     */
    default boolean negative() {
        return false;
    }

    record ParticipantAdded(
            @JsonProperty("participant_id") String participantId,
            @JsonProperty("participant_name") String participantName) implements BoardModifiedEvent {
        public ParticipantAdded {
            Objects.requireNonNull(participantId, "participantId cannot be null");
            Objects.requireNonNull(participantName, "participantName cannot be null");
        }
    }

    record ParticipantNotAdded(
            @JsonProperty("participant_id") String participantId,
            @JsonProperty("reason") ParticipantNotAddedReason reason) implements BoardModifiedEvent {
        @Override
        public boolean negative() {
            return true;
        }
    }

    record ParticipantRemoved(
            @JsonProperty("participant_id") String participantId) implements BoardModifiedEvent {
        public ParticipantRemoved {
            Objects.requireNonNull(participantId, "participantId cannot be null");
        }
    }

    record ParticipantCouldNotBeRemoved(
            @JsonProperty("participant_id") String participantId,
            @JsonProperty("reason") ParticipantNotRemovedReason reason) implements BoardModifiedEvent {
        @Override
        public boolean negative() {
            return true;
        }
    }

    record ParticipantVoted(
            @JsonProperty("participant_id") String participantId,
            @JsonProperty("vote") Vote vote) implements BoardModifiedEvent {
        public ParticipantVoted {
            Objects.requireNonNull(participantId, "participantId cannot be null");
            Objects.requireNonNull(vote, "vote cannot be null");
        }
    }

    record ParticipantCouldNotVote(
            @JsonProperty("participant_id") String participantId,
            @JsonProperty("reasons") List<ParticipantNotVotedReason> reasons) implements BoardModifiedEvent {
        public ParticipantCouldNotVote {
            reasons = List.copyOf(reasons);
        }

        @Override
        public boolean negative() {
            return true;
        }
    }

    record VotesCleared() implements BoardModifiedEvent {
    }
}
