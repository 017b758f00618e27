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

package dev.mars.pokerboard.domain;

import dev.mars.pokerboard.api.projection.Projections;
import dev.mars.pokerboard.domain.command.BoardCommand;
import dev.mars.pokerboard.domain.command.CombinedAggregate;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.event.CombinedEvent;
import dev.mars.pokerboard.domain.event.VoteTypeEvent;
import dev.mars.pokerboard.domain.query.BoardPresentation;
import dev.mars.pokerboard.domain.query.BoardView;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs board commands against an in-test log without a store or runner.
 */
public final class BoardScenario {

    private final List<VoteTypeEvent> voteTypes;
    private final List<BoardModifiedEvent> log = new ArrayList<>();

    private BoardScenario(List<VoteTypeEvent> voteTypes) {
        this.voteTypes = voteTypes;
    }

    public static BoardScenario withVoteTypes(String... voteTypeIds) {
        List<VoteTypeEvent> events = new ArrayList<>();
        for (String id : voteTypeIds) {
            events.add(VoteTypeEvent.anyNumber(id));
        }
        return new BoardScenario(events);
    }

    public List<BoardModifiedEvent> execute(BoardCommand command) {
        List<BoardModifiedEvent> produced = command.apply(aggregate());
        log.addAll(produced);
        return produced;
    }

    public CombinedAggregate aggregate() {
        List<CombinedEvent> combined = new ArrayList<>();
        voteTypes.forEach(event -> combined.add(CombinedEvent.of(event)));
        log.forEach(event -> combined.add(CombinedEvent.of(event)));
        return Projections.source(CombinedAggregate::new, combined);
    }

    public BoardView view() {
        return Projections.source(BoardView::new, log);
    }

    public BoardPresentation presentation() {
        return view().present();
    }

    public List<BoardModifiedEvent> log() {
        return List.copyOf(log);
    }
}
