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

import dev.mars.pokerboard.api.projection.EventSourced;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.event.VoteValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read model of a board, folded from board events and rendered for clients.
 *
 * <p>Participants are kept in join order. Only numeric votes are recorded; a text
 * vote is accepted by the log but leaves this view unchanged.
 *
 * <p>{@code votingComplete} is set by the vote that brings {@code numberVoted} up to
 * the participant count and then holds for the rest of the round: a late join or a
 * removal does not clear it, only {@link BoardModifiedEvent.VotesCleared} does.
 * Removing a participant who had voted does not lower {@code numberVoted}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class BoardView implements EventSourced<BoardModifiedEvent> {

    private final Map<String, ParticipantView> participants = new LinkedHashMap<>();
    private int numberVoted;
    private boolean votingComplete;

    @Override
    public void apply(BoardModifiedEvent event) {
        if (event instanceof BoardModifiedEvent.ParticipantAdded added) {
            participants.put(added.participantId(), new ParticipantView(added.participantName(), null));
        } else if (event instanceof BoardModifiedEvent.ParticipantRemoved removed) {
            participants.remove(removed.participantId());
        } else if (event instanceof BoardModifiedEvent.ParticipantVoted voted) {
            applyVote(voted);
        } else if (event instanceof BoardModifiedEvent.VotesCleared) {
            participants.replaceAll((id, participant) -> participant.withVote(null));
            numberVoted = 0;
            votingComplete = false;
        }
        // Negative events leave the view unchanged
    }

    private void applyVote(BoardModifiedEvent.ParticipantVoted voted) {
        ParticipantView participant = participants.get(voted.participantId());
        if (participant == null || !(voted.vote().value() instanceof VoteValue.Numeric numeric)) {
            return;
        }
        if (participant.vote() == null) {
            numberVoted++;
        }
        participants.put(voted.participantId(), participant.withVote(numeric.value()));
        votingComplete = votingComplete || numberVoted == participants.size();
    }

    /**
     * @return Participants in join order, keyed by participant id
     */
    public Map<String, ParticipantView> getParticipants() {
        return Collections.unmodifiableMap(participants);
    }

    public int getNumberVoted() {
        return numberVoted;
    }

    public boolean isVotingComplete() {
        return votingComplete;
    }

    /**
     * Renders the view for clients.
     */
    public BoardPresentation present() {
        List<ParticipantPresentation> rendered = new ArrayList<>(participants.size());
        for (ParticipantView participant : participants.values()) {
            rendered.add(new ParticipantPresentation(participant.name(), participant.vote()));
        }
        if (!votingComplete) {
            return new BoardPresentation(rendered, false, null);
        }
        return new BoardPresentation(rendered, true, VoteStatistics.of(participants.values()).orElse(null));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoardView)) return false;
        BoardView that = (BoardView) o;
        return numberVoted == that.numberVoted
                && votingComplete == that.votingComplete
                && participants.equals(that.participants)
                && List.copyOf(participants.keySet()).equals(List.copyOf(that.participants.keySet()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(participants, numberVoted, votingComplete);
    }

    @Override
    public String toString() {
        return "BoardView{participants=" + participants +
                ", numberVoted=" + numberVoted +
                ", votingComplete=" + votingComplete + '}';
    }
}
