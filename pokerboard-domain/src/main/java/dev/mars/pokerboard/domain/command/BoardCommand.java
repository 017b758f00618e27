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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import dev.mars.pokerboard.api.command.Command;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.event.ParticipantNotAddedReason;
import dev.mars.pokerboard.domain.event.ParticipantNotRemovedReason;
import dev.mars.pokerboard.domain.event.ParticipantNotVotedReason;
import dev.mars.pokerboard.domain.event.VoteValue;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Everything a client can ask a board to do.
 *
 * Commands are pure: applying one never changes the aggregate and never throws
 * for a business rule. A rejected command yields a negative event instead, which
 * is stored like any other.
 *
 * JSON form is externally tagged, e.g.
 * {@code {"AddParticipant":{"participant_name":"Ann"}}} or {@code {"ClearVotes":{}}}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = BoardCommand.AddParticipant.class, name = "AddParticipant"),
    @JsonSubTypes.Type(value = BoardCommand.RemoveParticipant.class, name = "RemoveParticipant"),
    @JsonSubTypes.Type(value = BoardCommand.Vote.class, name = "Vote"),
    @JsonSubTypes.Type(value = BoardCommand.ClearVotes.class, name = "ClearVotes"),
    @JsonSubTypes.Type(value = BoardCommand.Noop.class, name = "Noop")
})
public sealed interface BoardCommand extends Command<CombinedAggregate, BoardModifiedEvent> permits
        BoardCommand.AddParticipant,
        BoardCommand.RemoveParticipant,
        BoardCommand.Vote,
        BoardCommand.ClearVotes,
        BoardCommand.Noop {

    /**
     * Adds a participant. Without an id a random one is minted.
     */
    record AddParticipant(
            @JsonProperty("participant_name") String participantName,
            @JsonProperty("participant_id") String participantId) implements BoardCommand {

        public AddParticipant {
            Objects.requireNonNull(participantName, "participantName cannot be null");
        }

        @Override
        public List<BoardModifiedEvent> apply(CombinedAggregate state) {
            if (participantId != null && state.getBoard().hasParticipant(participantId)) {
                return List.of(new BoardModifiedEvent.ParticipantNotAdded(
                        participantId, ParticipantNotAddedReason.AlreadyExists));
            }
            String id = participantId != null ? participantId : UUID.randomUUID().toString();
            return List.of(new BoardModifiedEvent.ParticipantAdded(id, participantName));
        }
    }

    record RemoveParticipant(
            @JsonProperty("participant_id") String participantId) implements BoardCommand {

        public RemoveParticipant {
            Objects.requireNonNull(participantId, "participantId cannot be null");
        }

        @Override
        public List<BoardModifiedEvent> apply(CombinedAggregate state) {
            if (!state.getBoard().hasParticipant(participantId)) {
                return List.of(new BoardModifiedEvent.ParticipantCouldNotBeRemoved(
                        participantId, ParticipantNotRemovedReason.DoesNotExist));
            }
            return List.of(new BoardModifiedEvent.ParticipantRemoved(participantId));
        }
    }

    record Vote(
            @JsonProperty("participant_id") String participantId,
            @JsonProperty("vote") dev.mars.pokerboard.domain.event.Vote vote) implements BoardCommand {

        public Vote {
            Objects.requireNonNull(participantId, "participantId cannot be null");
            Objects.requireNonNull(vote, "vote cannot be null");
        }

        @Override
        public List<BoardModifiedEvent> apply(CombinedAggregate state) {
            List<ParticipantNotVotedReason> reasons = VoteRules.check(state, this);
            if (!reasons.isEmpty()) {
                return List.of(new BoardModifiedEvent.ParticipantCouldNotVote(participantId, reasons));
            }
            return List.of(new BoardModifiedEvent.ParticipantVoted(participantId, vote));
        }
    }

    record ClearVotes() implements BoardCommand {
        @Override
        public List<BoardModifiedEvent> apply(CombinedAggregate state) {
            return List.of(new BoardModifiedEvent.VotesCleared());
        }
    }

    record Noop() implements BoardCommand {
        @Override
        public List<BoardModifiedEvent> apply(CombinedAggregate state) {
            return List.of();
        }
    }

    static BoardCommand addParticipant(String participantName, String participantId) {
        return new AddParticipant(participantName, participantId);
    }

    static BoardCommand removeParticipant(String participantId) {
        return new RemoveParticipant(participantId);
    }

    static BoardCommand vote(VoteValue value, String voteTypeId, String participantId) {
        return new Vote(participantId, new dev.mars.pokerboard.domain.event.Vote(voteTypeId, value));
    }

    static BoardCommand clearVotes() {
        return new ClearVotes();
    }
}
