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

package dev.mars.pokerboard.runtime;

import dev.mars.pokerboard.api.store.EventLogStore;
import dev.mars.pokerboard.domain.command.CombinedAggregate;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.event.CombinedEvent;
import dev.mars.pokerboard.domain.event.VoteTypeEvent;
import dev.mars.pokerboard.engine.TransactionalCommandRunner;
import dev.mars.pokerboard.engine.sidecar.CommandSidecar;
import dev.mars.pokerboard.fanout.BoardBroker;
import dev.mars.pokerboard.fanout.FanoutPoller;
import dev.mars.pokerboard.store.CombinedEventLogStore;
import dev.mars.pokerboard.store.DefaultEventLogStore;
import dev.mars.pokerboard.store.InMemoryEventLogStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point that wires the board engine.
 *
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *     .retryMode(EngineConfig.RetryMode.EXPONENTIAL)
 *     .sidecarPartitions(4)
 *     .build();
 * try (PokerBoardContext context = PokerBoardRuntime.bootstrap(config)) {
 *     context.getSidecar().submit("b1", BoardCommand.addParticipant("Ann", null));
 * }
 * }</pre>
 *
 * The returned context has its sidecar and poller started.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class PokerBoardRuntime {

    private static final Logger logger = LoggerFactory.getLogger(PokerBoardRuntime.class);

    private PokerBoardRuntime() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static PokerBoardContext bootstrap() {
        return bootstrap(EngineConfig.defaults());
    }

    public static PokerBoardContext bootstrap(EngineConfig config) {
        return bootstrap(config, new SimpleMeterRegistry());
    }

    public static PokerBoardContext bootstrap(EngineConfig config, MeterRegistry meterRegistry) {
        Objects.requireNonNull(config, "EngineConfig cannot be null");
        Objects.requireNonNull(meterRegistry, "MeterRegistry cannot be null");

        logger.info("Bootstrapping poker board engine with config: {}", config);

        InMemoryEventLogStore<BoardModifiedEvent> boardStore =
                new InMemoryEventLogStore<>(config.isRejectDivergentWrites());
        EventLogStore<CombinedEvent> commandStore = new CombinedEventLogStore<CombinedEvent, VoteTypeEvent, BoardModifiedEvent>(
                new DefaultEventLogStore<>(voteTypeEvents(config.getVoteTypes())),
                boardStore,
                CombinedEvent::of,
                CombinedEvent::of,
                CombinedEvent::boardEvent);

        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, namedDaemonThreads());

        TransactionalCommandRunner<CombinedEvent, CombinedAggregate, BoardModifiedEvent> runner =
                new TransactionalCommandRunner<>(commandStore, CombinedAggregate::new, CombinedEvent::of,
                        config.createRetryStrategy(), scheduler);
        CommandSidecar<CombinedAggregate, BoardModifiedEvent> sidecar =
                new CommandSidecar<>(runner, config.getSidecarPartitions(), meterRegistry).start();

        BoardBroker<BoardModifiedEvent> broker = new BoardBroker<>();
        FanoutPoller<BoardModifiedEvent> poller =
                new FanoutPoller<>(boardStore, broker, config.getPollInterval(), scheduler).start();

        PokerBoardContext context = new PokerBoardContext(config, boardStore, commandStore, runner, sidecar,
                broker, poller, scheduler, meterRegistry);
        logger.info("Poker board engine bootstrapped: {}", context);
        return context;
    }

    static List<VoteTypeEvent> voteTypeEvents(List<String> voteTypeIds) {
        return voteTypeIds.stream().map(VoteTypeEvent::anyNumber).toList();
    }

    private static ThreadFactory namedDaemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "pokerboard-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
