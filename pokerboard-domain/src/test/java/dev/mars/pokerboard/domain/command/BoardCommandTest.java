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

import dev.mars.pokerboard.domain.BoardScenario;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.event.ParticipantNotAddedReason;
import dev.mars.pokerboard.domain.event.ParticipantNotRemovedReason;
import dev.mars.pokerboard.domain.event.ParticipantNotVotedReason;
import dev.mars.pokerboard.domain.event.VoteValidation;
import dev.mars.pokerboard.domain.event.VoteValue;
import dev.mars.pokerboard.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the decisions each board command makes against the aggregate.
 */
@Tag(TestCategories.CORE)
@DisplayName("BoardCommand Tests")
class BoardCommandTest {

    private BoardScenario scenario;

    @BeforeEach
    void setUp() {
        scenario = BoardScenario.withVoteTypes("1");
    }

    @Nested
    @DisplayName("AddParticipant")
    class AddParticipant {

        @Test
        @DisplayName("Adds a participant with the given id")
        void testAddWithId() {
            List<BoardModifiedEvent> events = scenario.execute(BoardCommand.addParticipant("Ann", "p1"));

            assertEquals(List.of(new BoardModifiedEvent.ParticipantAdded("p1", "Ann")), events);
            assertTrue(scenario.aggregate().getBoard().hasParticipant("p1"));
        }

        @Test
        @DisplayName("Mints an id when none is given")
        void testAddMintsId() {
            List<BoardModifiedEvent> events = scenario.execute(BoardCommand.addParticipant("Ann", null));

            assertEquals(1, events.size());
            BoardModifiedEvent.ParticipantAdded added = (BoardModifiedEvent.ParticipantAdded) events.get(0);
            assertFalse(added.participantId().isBlank());
            assertEquals("Ann", added.participantName());
        }

        @Test
        @DisplayName("Rejects a duplicate id")
        void testAddDuplicate() {
            scenario.execute(BoardCommand.addParticipant("Ann", "p1"));

            List<BoardModifiedEvent> events = scenario.execute(BoardCommand.addParticipant("Other", "p1"));

            assertEquals(List.of(new BoardModifiedEvent.ParticipantNotAdded("p1", ParticipantNotAddedReason.AlreadyExists)),
                    events);
            assertEquals("Ann", scenario.aggregate().getBoard().participantName("p1").orElseThrow());
        }
    }

    @Nested
    @DisplayName("RemoveParticipant")
    class RemoveParticipant {

        @Test
        @DisplayName("Removes a known participant")
        void testRemove() {
            scenario.execute(BoardCommand.addParticipant("Ann", "p1"));

            assertEquals(List.of(new BoardModifiedEvent.ParticipantRemoved("p1")),
                    scenario.execute(BoardCommand.removeParticipant("p1")));
            assertFalse(scenario.aggregate().getBoard().hasParticipant("p1"));
        }

        @Test
        @DisplayName("Rejects an unknown participant")
        void testRemoveUnknown() {
            assertEquals(List.of(new BoardModifiedEvent.ParticipantCouldNotBeRemoved("ghost",
                            ParticipantNotRemovedReason.DoesNotExist)),
                    scenario.execute(BoardCommand.removeParticipant("ghost")));
        }
    }

    @Nested
    @DisplayName("Vote")
    class Vote {

        @Test
        @DisplayName("Records a valid vote")
        void testValidVote() {
            scenario.execute(BoardCommand.addParticipant("Ann", "p1"));

            List<BoardModifiedEvent> events = scenario.execute(BoardCommand.vote(VoteValue.number(3), "1", "p1"));

            assertEquals(1, events.size());
            assertInstanceOf(BoardModifiedEvent.ParticipantVoted.class, events.get(0));
        }

        @Test
        @DisplayName("Unknown participant on an empty board leaves everything unchanged")
        void testUnknownParticipant() {
            CombinedAggregate before = scenario.aggregate();

            List<BoardModifiedEvent> events = scenario.execute(BoardCommand.vote(VoteValue.number(1), "1", "ghost"));

            assertEquals(List.of(new BoardModifiedEvent.ParticipantCouldNotVote("ghost",
                    List.of(new ParticipantNotVotedReason.DoesNotExist()))), events);
            assertEquals(before, scenario.aggregate());
            assertFalse(scenario.presentation().isVotingComplete());
            assertTrue(scenario.presentation().getParticipants().isEmpty());
            assertTrue(scenario.presentation().getStats().isEmpty());
        }

        @Test
        @DisplayName("Unknown vote type is rejected")
        void testUnknownVoteType() {
            scenario.execute(BoardCommand.addParticipant("Ann", "p1"));

            List<BoardModifiedEvent> events = scenario.execute(BoardCommand.vote(VoteValue.number(1), "bad", "p1"));

            assertEquals(List.of(new BoardModifiedEvent.ParticipantCouldNotVote("p1",
                    List.of(new ParticipantNotVotedReason.VoteTypeDoesNotExist("bad")))), events);
        }

        @Test
        @DisplayName("Text vote fails AnyNumber validation")
        void testTextVoteInvalid() {
            scenario.execute(BoardCommand.addParticipant("Ann", "p1"));

            List<BoardModifiedEvent> events = scenario.execute(BoardCommand.vote(VoteValue.text("?"), "1", "p1"));

            assertEquals(List.of(new BoardModifiedEvent.ParticipantCouldNotVote("p1",
                    List.of(new ParticipantNotVotedReason.InvalidVote(VoteValidation.AnyNumber, VoteValue.text("?"))))),
                    events);
        }

        @Test
        @DisplayName("Collects every failing reason in rule order")
        void testCollectsAllReasons() {
            List<BoardModifiedEvent> events = scenario.execute(BoardCommand.vote(VoteValue.number(1), "bad", "ghost"));

            BoardModifiedEvent.ParticipantCouldNotVote rejected = (BoardModifiedEvent.ParticipantCouldNotVote) events.get(0);
            assertEquals(List.of(
                    new ParticipantNotVotedReason.VoteTypeDoesNotExist("bad"),
                    new ParticipantNotVotedReason.DoesNotExist()), rejected.reasons());
        }
    }

    @Test
    @DisplayName("ClearVotes emits VotesCleared and Noop emits nothing")
    void testClearAndNoop() {
        assertEquals(List.of(new BoardModifiedEvent.VotesCleared()), scenario.execute(BoardCommand.clearVotes()));
        assertEquals(List.of(), scenario.execute(new BoardCommand.Noop()));
    }

    @Test
    @DisplayName("Applying a command does not change the aggregate it was given")
    void testCommandIsPure() {
        scenario.execute(BoardCommand.addParticipant("Ann", "p1"));
        CombinedAggregate aggregate = scenario.aggregate();
        CombinedAggregate copy = scenario.aggregate();

        BoardCommand.removeParticipant("p1").apply(aggregate);

        assertEquals(copy, aggregate);
    }

    @Test
    @DisplayName("Negative events leave the command-side aggregate unchanged")
    void testNegativeEventsAreNoOps() {
        scenario.execute(BoardCommand.addParticipant("Ann", "p1"));
        List<BoardModifiedEvent> negatives = List.of(
                new BoardModifiedEvent.ParticipantNotAdded("p1", ParticipantNotAddedReason.AlreadyExists),
                new BoardModifiedEvent.ParticipantCouldNotBeRemoved("p1", ParticipantNotRemovedReason.DoesNotExist),
                new BoardModifiedEvent.ParticipantCouldNotVote("p1", List.of(new ParticipantNotVotedReason.DoesNotExist())));

        for (BoardModifiedEvent negative : negatives) {
            assertTrue(negative.negative());
            CombinedAggregate aggregate = scenario.aggregate();
            Board board = aggregate.getBoard();
            Board before = scenario.aggregate().getBoard();

            board.apply(negative);

            assertEquals(before, board, "state changed by " + negative);
        }
    }
}
