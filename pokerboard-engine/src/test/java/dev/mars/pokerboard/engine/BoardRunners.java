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

package dev.mars.pokerboard.engine;

import dev.mars.pokerboard.api.retry.RetryStrategy;
import dev.mars.pokerboard.api.store.EventLogStore;
import dev.mars.pokerboard.domain.command.CombinedAggregate;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.event.CombinedEvent;
import dev.mars.pokerboard.domain.event.VoteTypeEvent;
import dev.mars.pokerboard.store.CombinedEventLogStore;
import dev.mars.pokerboard.store.DefaultEventLogStore;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds runners over a board store with vote type "1" configured.
 */
public final class BoardRunners {

    private BoardRunners() {
    }

    public static EventLogStore<CombinedEvent> combined(EventLogStore<BoardModifiedEvent> boards) {
        return new CombinedEventLogStore<CombinedEvent, VoteTypeEvent, BoardModifiedEvent>(
                new DefaultEventLogStore<>(List.of(VoteTypeEvent.anyNumber("1"))),
                boards,
                CombinedEvent::of,
                CombinedEvent::of,
                CombinedEvent::boardEvent);
    }

    public static TransactionalCommandRunner<CombinedEvent, CombinedAggregate, BoardModifiedEvent> runner(
            EventLogStore<BoardModifiedEvent> boards, RetryStrategy strategy, ScheduledExecutorService scheduler) {
        return new TransactionalCommandRunner<>(combined(boards), CombinedAggregate::new, CombinedEvent::of,
                strategy, scheduler);
    }
}
