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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Summary of a finished round. Zero votes are left out; {@code average} is the
 * middle element of the sorted remaining votes.
 */
public record VoteStatistics(int average, int max, int min) {

    static Optional<VoteStatistics> of(Collection<ParticipantView> participants) {
        List<Integer> votes = new ArrayList<>();
        for (ParticipantView participant : participants) {
            Integer vote = participant.vote();
            if (vote != null && vote != 0) {
                votes.add(vote);
            }
        }
        if (votes.isEmpty()) {
            return Optional.empty();
        }
        Collections.sort(votes);
        return Optional.of(new VoteStatistics(
                votes.get(votes.size() / 2),
                votes.get(votes.size() - 1),
                votes.get(0)));
    }
}
