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
import dev.mars.pokerboard.engine.TransactionalCommandRunner;
import dev.mars.pokerboard.engine.sidecar.CommandSidecar;
import dev.mars.pokerboard.fanout.BoardBroker;
import dev.mars.pokerboard.fanout.FanoutPoller;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Container for the running board engine, handed to the transport layer.
 *
 * Closing the context stops the poller and the sidecar, then the scheduler and
 * the stores.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class PokerBoardContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PokerBoardContext.class);

    private final EngineConfig config;
    private final EventLogStore<BoardModifiedEvent> boardStore;
    private final EventLogStore<CombinedEvent> commandStore;
    private final TransactionalCommandRunner<CombinedEvent, CombinedAggregate, BoardModifiedEvent> runner;
    private final CommandSidecar<CombinedAggregate, BoardModifiedEvent> sidecar;
    private final BoardBroker<BoardModifiedEvent> broker;
    private final FanoutPoller<BoardModifiedEvent> poller;
    private final ScheduledExecutorService scheduler;
    private final MeterRegistry meterRegistry;

    PokerBoardContext(EngineConfig config,
                      EventLogStore<BoardModifiedEvent> boardStore,
                      EventLogStore<CombinedEvent> commandStore,
                      TransactionalCommandRunner<CombinedEvent, CombinedAggregate, BoardModifiedEvent> runner,
                      CommandSidecar<CombinedAggregate, BoardModifiedEvent> sidecar,
                      BoardBroker<BoardModifiedEvent> broker,
                      FanoutPoller<BoardModifiedEvent> poller,
                      ScheduledExecutorService scheduler,
                      MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "EngineConfig cannot be null");
        this.boardStore = Objects.requireNonNull(boardStore, "boardStore cannot be null");
        this.commandStore = Objects.requireNonNull(commandStore, "commandStore cannot be null");
        this.runner = Objects.requireNonNull(runner, "runner cannot be null");
        this.sidecar = Objects.requireNonNull(sidecar, "sidecar cannot be null");
        this.broker = Objects.requireNonNull(broker, "broker cannot be null");
        this.poller = Objects.requireNonNull(poller, "poller cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * @return The per-board log of board events, as read by queries and the poller
     */
    public EventLogStore<BoardModifiedEvent> getBoardStore() {
        return boardStore;
    }

    /**
     * @return Configured vote types followed by the board log, as read by commands
     */
    public EventLogStore<CombinedEvent> getCommandStore() {
        return commandStore;
    }

    public TransactionalCommandRunner<CombinedEvent, CombinedAggregate, BoardModifiedEvent> getRunner() {
        return runner;
    }

    public CommandSidecar<CombinedAggregate, BoardModifiedEvent> getSidecar() {
        return sidecar;
    }

    public BoardBroker<BoardModifiedEvent> getBroker() {
        return broker;
    }

    public FanoutPoller<BoardModifiedEvent> getPoller() {
        return poller;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    @Override
    public void close() {
        logger.info("Closing poker board context");
        poller.close();
        sidecar.close();
        scheduler.shutdownNow();
        commandStore.close();
        boardStore.close();
        logger.info("Poker board context closed");
    }

    @Override
    public String toString() {
        return "PokerBoardContext{" +
                "config=" + config +
                ", boardStore=" + boardStore.getClass().getSimpleName() +
                ", partitions=" + sidecar.getPartitions() +
                '}';
    }
}
