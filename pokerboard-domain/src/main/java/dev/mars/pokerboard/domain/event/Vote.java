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

import java.util.Objects;

/**
 * A value cast against a vote type.
 */
public record Vote(
        @JsonProperty("vote_type_id") String voteTypeId,
        @JsonProperty("value") VoteValue value) {

    public Vote {
        Objects.requireNonNull(voteTypeId, "voteTypeId cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static Vote number(String voteTypeId, int value) {
        return new Vote(voteTypeId, VoteValue.number(value));
    }
}
