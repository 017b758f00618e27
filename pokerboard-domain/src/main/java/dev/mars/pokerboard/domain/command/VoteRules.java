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

import dev.mars.pokerboard.api.validation.Validator;
import dev.mars.pokerboard.domain.event.ParticipantNotVotedReason;
import dev.mars.pokerboard.domain.event.Vote;
import dev.mars.pokerboard.domain.event.VoteValidation;

import java.util.List;
import java.util.Optional;

/**
 * Checks a vote must pass before it is recorded.
 */
final class VoteRules {

    private VoteRules() {
        // Utility class - no instantiation
    }

    static List<ParticipantNotVotedReason> check(CombinedAggregate state, BoardCommand.Vote command) {
        return Validator.<CombinedAggregate, BoardCommand.Vote, ParticipantNotVotedReason>of()
                .should(VoteRules::beValidVote)
                .should(VoteRules::haveExistingParticipant)
                .validateAgainst(state, command);
    }

    static Optional<ParticipantNotVotedReason> beValidVote(CombinedAggregate state, BoardCommand.Vote command) {
        Vote vote = command.vote();
        Optional<VoteValidation> validation = state.getVoteTypes().validationFor(vote.voteTypeId());
        if (validation.isEmpty()) {
            return Optional.of(new ParticipantNotVotedReason.VoteTypeDoesNotExist(vote.voteTypeId()));
        }
        if (!validation.get().accepts(vote.value())) {
            return Optional.of(new ParticipantNotVotedReason.InvalidVote(validation.get(), vote.value()));
        }
        return Optional.empty();
    }

    static Optional<ParticipantNotVotedReason> haveExistingParticipant(CombinedAggregate state, BoardCommand.Vote command) {
        if (state.getBoard().hasParticipant(command.participantId())) {
            return Optional.empty();
        }
        return Optional.of(new ParticipantNotVotedReason.DoesNotExist());
    }
}
