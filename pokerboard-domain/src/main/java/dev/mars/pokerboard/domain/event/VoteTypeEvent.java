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
 * Changes to the set of vote types a board accepts. These come from configuration
 * rather than from commands.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = VoteTypeEvent.VoteTypeAdded.class, name = "VoteTypeAdded")
})
public sealed interface VoteTypeEvent permits VoteTypeEvent.VoteTypeAdded {

    record VoteTypeAdded(
            @JsonProperty("vote_type_id") String voteTypeId,
            @JsonProperty("vote_validation") VoteValidation voteValidation) implements VoteTypeEvent {
    }

    static VoteTypeEvent anyNumber(String voteTypeId) {
        return new VoteTypeAdded(voteTypeId, VoteValidation.AnyNumber);
    }
}
