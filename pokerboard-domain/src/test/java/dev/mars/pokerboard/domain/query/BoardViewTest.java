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

import dev.mars.pokerboard.api.projection.Projections;
import dev.mars.pokerboard.domain.BoardScenario;
import dev.mars.pokerboard.domain.command.BoardCommand;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.event.Vote;
import dev.mars.pokerboard.domain.event.VoteValue;
import dev.mars.pokerboard.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the board read model and its presentation.
 */
@Tag(TestCategories.CORE)
@DisplayName("BoardView Tests")
class BoardViewTest {

    private BoardScenario scenario;

    @BeforeEach
    void setUp() {
        scenario = BoardScenario.withVoteTypes("1");
    }

    private void addAndVote() {
        scenario.execute(BoardCommand.addParticipant("Ann", "p1"));
        scenario.execute(BoardCommand.addParticipant("Bo", "p2"));
        scenario.execute(BoardCommand.vote(VoteValue.number(3), "1", "p1"));
        scenario.execute(BoardCommand.vote(VoteValue.number(5), "1", "p2"));
    }

    private static BoardModifiedEvent voted(String participantId, int value) {
        return new BoardModifiedEvent.ParticipantVoted(participantId, Vote.number("1", value));
    }

    @Nested
    @DisplayName("Voting rounds")
    class VotingRounds {

        @Test
        @DisplayName("Two participants voting completes the round with statistics")
        void testAddAndVoteHappyPath() {
            addAndVote();

            BoardPresentation presentation = scenario.presentation();
            assertTrue(presentation.isVotingComplete());
            assertEquals(List.of(new ParticipantPresentation("Ann", 3), new ParticipantPresentation("Bo", 5)),
                    presentation.getParticipants());
            assertEquals(new VoteStatistics(5, 5, 3), presentation.getStats().orElseThrow());
        }

        @Test
        @DisplayName("ClearVotes resets completion, votes and statistics")
        void testClearResetsCompletion() {
            addAndVote();
            scenario.execute(BoardCommand.clearVotes());

            BoardPresentation presentation = scenario.presentation();
            assertFalse(presentation.isVotingComplete());
            assertTrue(presentation.getParticipants().stream().allMatch(p -> p.vote() == null));
            assertTrue(presentation.getStats().isEmpty());
            assertEquals(0, scenario.view().getNumberVoted());
        }

        @Test
        @DisplayName("Round is incomplete until everyone has voted")
        void testIncompleteRound() {
            scenario.execute(BoardCommand.addParticipant("Ann", "p1"));
            scenario.execute(BoardCommand.addParticipant("Bo", "p2"));
            scenario.execute(BoardCommand.vote(VoteValue.number(3), "1", "p1"));

            BoardPresentation presentation = scenario.presentation();
            assertFalse(presentation.isVotingComplete());
            assertEquals(Integer.valueOf(3), presentation.getParticipants().get(0).vote());
            assertNull(presentation.getParticipants().get(1).vote());
            assertTrue(presentation.getStats().isEmpty());
        }

        @Test
        @DisplayName("A late join keeps the round complete")
        void testLateJoinKeepsComplete() {
            addAndVote();
            scenario.execute(BoardCommand.addParticipant("Cy", "p3"));

            assertTrue(scenario.view().isVotingComplete());
            assertEquals(3, scenario.presentation().getParticipants().size());
        }

        @Test
        @DisplayName("Removing a voter neither decrements the count nor clears completion")
        void testRemovalKeepsCount() {
            addAndVote();
            scenario.execute(BoardCommand.removeParticipant("p2"));

            BoardView view = scenario.view();
            assertEquals(2, view.getNumberVoted());
            assertTrue(view.isVotingComplete());
            assertEquals(List.of("p1"), List.copyOf(view.getParticipants().keySet()));
        }

        @Test
        @DisplayName("Changing a vote does not count twice")
        void testRevote() {
            scenario.execute(BoardCommand.addParticipant("Ann", "p1"));
            scenario.execute(BoardCommand.addParticipant("Bo", "p2"));
            scenario.execute(BoardCommand.vote(VoteValue.number(3), "1", "p1"));
            scenario.execute(BoardCommand.vote(VoteValue.number(8), "1", "p1"));

            BoardView view = scenario.view();
            assertEquals(1, view.getNumberVoted());
            assertFalse(view.isVotingComplete());
            assertEquals(Integer.valueOf(8), view.getParticipants().get("p1").vote());
        }

        @Test
        @DisplayName("Text votes are discarded by the read model")
        void testTextVoteIgnored() {
            BoardView view = Projections.source(BoardView::new, List.of(
                    new BoardModifiedEvent.ParticipantAdded("p1", "Ann"),
                    new BoardModifiedEvent.ParticipantVoted("p1", new Vote("1", VoteValue.text("?")))));

            assertEquals(0, view.getNumberVoted());
            assertNull(view.getParticipants().get("p1").vote());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("All-zero round is complete without statistics")
        void testZeroVotesHaveNoStats() {
            BoardView view = Projections.source(BoardView::new, List.of(
                    new BoardModifiedEvent.ParticipantAdded("p1", "Ann"),
                    voted("p1", 0)));

            BoardPresentation presentation = view.present();
            assertTrue(presentation.isVotingComplete());
            assertTrue(presentation.getStats().isEmpty());
        }

        @Test
        @DisplayName("Zero votes are left out of the statistics")
        void testZeroVotesExcluded() {
            BoardView view = Projections.source(BoardView::new, List.of(
                    new BoardModifiedEvent.ParticipantAdded("p1", "Ann"),
                    new BoardModifiedEvent.ParticipantAdded("p2", "Bo"),
                    new BoardModifiedEvent.ParticipantAdded("p3", "Cy"),
                    voted("p1", 0),
                    voted("p2", 8),
                    voted("p3", 2)));

            VoteStatistics stats = view.present().getStats().orElseThrow();
            assertEquals(new VoteStatistics(8, 8, 2), stats);
        }

        @Test
        @DisplayName("Statistics stay within the cast votes")
        void testStatsBounds() {
            int[] votes = {13, 1, 5, 8, 3};
            List<BoardModifiedEvent> events = new ArrayList<>();
            for (int i = 0; i < votes.length; i++) {
                events.add(new BoardModifiedEvent.ParticipantAdded("p" + i, "n" + i));
            }
            for (int i = 0; i < votes.length; i++) {
                events.add(voted("p" + i, votes[i]));
            }

            VoteStatistics stats = Projections.source(BoardView::new, events).present().getStats().orElseThrow();
            assertTrue(stats.min() <= stats.average() && stats.average() <= stats.max());
            assertEquals(1, stats.min());
            assertEquals(5, stats.average());
            assertEquals(13, stats.max());
        }
    }

    @Test
    @DisplayName("Folding a log in one pass equals folding a prefix and applying the rest")
    void testDeterminism() {
        addAndVote();
        scenario.execute(BoardCommand.addParticipant("Cy", "p3"));
        scenario.execute(BoardCommand.vote(VoteValue.number(1), "1", "ghost"));
        scenario.execute(BoardCommand.removeParticipant("p1"));
        scenario.execute(BoardCommand.clearVotes());
        List<BoardModifiedEvent> log = scenario.log();

        BoardView whole = Projections.source(BoardView::new, log);
        for (int split = 0; split <= log.size(); split++) {
            BoardView prefix = Projections.source(BoardView::new, log.subList(0, split));
            Projections.applyAll(prefix, log.subList(split, log.size()));
            assertEquals(whole, prefix, "split at " + split);
        }
    }
}
