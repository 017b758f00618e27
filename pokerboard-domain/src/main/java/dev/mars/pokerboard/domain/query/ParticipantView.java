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

package dev.mars.pokerboard.domain.query;

import java.util.Objects;

/**
 * A participant as the read model sees it. {@code vote} is null until a numeric
 * vote arrives in the current round.
 */
public record ParticipantView(String name, Integer vote) {

    public ParticipantView {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public ParticipantView withVote(Integer newVote) {
        return new ParticipantView(name, newVote);
    }
}
