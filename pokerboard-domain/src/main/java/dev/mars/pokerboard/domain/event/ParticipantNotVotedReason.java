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

/**
 * Why a vote was rejected. A rejected vote carries every reason that applied.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ParticipantNotVotedReason.DoesNotExist.class, name = "DoesNotExist"),
    @JsonSubTypes.Type(value = ParticipantNotVotedReason.VoteTypeDoesNotExist.class, name = "VoteTypeDoesNotExist"),
    @JsonSubTypes.Type(value = ParticipantNotVotedReason.InvalidVote.class, name = "InvalidVote")
})
public sealed interface ParticipantNotVotedReason permits
        ParticipantNotVotedReason.DoesNotExist,
        ParticipantNotVotedReason.VoteTypeDoesNotExist,
        ParticipantNotVotedReason.InvalidVote {

    /** The voting participant is not on the board. */
    record DoesNotExist() implements ParticipantNotVotedReason {
    }

    record VoteTypeDoesNotExist(
            @JsonProperty("vote_type_id") String voteTypeId) implements ParticipantNotVotedReason {
    }

    /** The value does not satisfy the vote type's validation. */
    record InvalidVote(
            @JsonProperty("expected") VoteValidation expected,
            @JsonProperty("received") VoteValue received) implements ParticipantNotVotedReason {
    }
}
