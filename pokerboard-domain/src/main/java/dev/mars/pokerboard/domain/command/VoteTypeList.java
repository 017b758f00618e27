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
import dev.mars.pokerboard.domain.event.VoteTypeEvent;
import dev.mars.pokerboard.domain.event.VoteValidation;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Vote types known to a board and the validation each applies.
 */
public final class VoteTypeList implements EventSourced<VoteTypeEvent> {

    private final Map<String, VoteValidation> voteTypes = new HashMap<>();

    @Override
    public void apply(VoteTypeEvent event) {
        if (event instanceof VoteTypeEvent.VoteTypeAdded added) {
            voteTypes.put(added.voteTypeId(), added.voteValidation());
        }
    }

    public Optional<VoteValidation> validationFor(String voteTypeId) {
        return Optional.ofNullable(voteTypes.get(voteTypeId));
    }

    public int size() {
        return voteTypes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VoteTypeList)) return false;
        return voteTypes.equals(((VoteTypeList) o).voteTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(voteTypes);
    }

    @Override
    public String toString() {
        return "VoteTypeList{voteTypes=" + voteTypes + '}';
    }
}
