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
import dev.mars.pokerboard.domain.event.CombinedEvent;

import java.util.Objects;

/**
 * The state board commands are decided against: configured vote types plus the
 * board's participants.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class CombinedAggregate implements EventSourced<CombinedEvent> {

    private final VoteTypeList voteTypes = new VoteTypeList();
    private final Board board = new Board();

    @Override
    public void apply(CombinedEvent event) {
        if (event instanceof CombinedEvent.BoardChange change) {
            board.apply(change.event());
        } else if (event instanceof CombinedEvent.VoteTypeChange change) {
            voteTypes.apply(change.event());
        }
    }

    public VoteTypeList getVoteTypes() {
        return voteTypes;
    }

    public Board getBoard() {
        return board;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CombinedAggregate)) return false;
        CombinedAggregate that = (CombinedAggregate) o;
        return voteTypes.equals(that.voteTypes) && board.equals(that.board);
    }

    @Override
    public int hashCode() {
        return Objects.hash(voteTypes, board);
    }

    @Override
    public String toString() {
        return "CombinedAggregate{voteTypes=" + voteTypes + ", board=" + board + '}';
    }
}
