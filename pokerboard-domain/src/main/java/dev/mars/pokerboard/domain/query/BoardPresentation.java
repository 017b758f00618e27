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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The board as clients see it.
 *
 * <pre>
 * {"participants":[{"name":"Ann","vote":3}],"voting_complete":true,"average":3,"max":3,"min":3}
 * </pre>
 *
 * The statistics fields are omitted unless voting is complete and at least one
 * non-zero vote was cast.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BoardPresentation {

    private final List<ParticipantPresentation> participants;
    private final boolean votingComplete;
    private final VoteStatistics stats;

    public BoardPresentation(List<ParticipantPresentation> participants, boolean votingComplete, VoteStatistics stats) {
        this.participants = List.copyOf(participants);
        this.votingComplete = votingComplete;
        this.stats = stats;
    }

    @JsonCreator
    static BoardPresentation fromJson(
            @JsonProperty("participants") List<ParticipantPresentation> participants,
            @JsonProperty("voting_complete") boolean votingComplete,
            @JsonProperty("average") Integer average,
            @JsonProperty("max") Integer max,
            @JsonProperty("min") Integer min) {
        VoteStatistics stats = average != null && max != null && min != null
                ? new VoteStatistics(average, max, min)
                : null;
        return new BoardPresentation(participants == null ? List.of() : participants, votingComplete, stats);
    }

    @JsonProperty("participants")
    public List<ParticipantPresentation> getParticipants() {
        return participants;
    }

    @JsonProperty("voting_complete")
    public boolean isVotingComplete() {
        return votingComplete;
    }

    @JsonIgnore
    public Optional<VoteStatistics> getStats() {
        return Optional.ofNullable(stats);
    }

    @JsonProperty("average")
    public Integer getAverage() {
        return stats == null ? null : stats.average();
    }

    @JsonProperty("max")
    public Integer getMax() {
        return stats == null ? null : stats.max();
    }

    @JsonProperty("min")
    public Integer getMin() {
        return stats == null ? null : stats.min();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoardPresentation)) return false;
        BoardPresentation that = (BoardPresentation) o;
        return votingComplete == that.votingComplete
                && participants.equals(that.participants)
                && Objects.equals(stats, that.stats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(participants, votingComplete, stats);
    }

    @Override
    public String toString() {
        return "BoardPresentation{participants=" + participants +
                ", votingComplete=" + votingComplete +
                ", stats=" + stats + '}';
    }
}
