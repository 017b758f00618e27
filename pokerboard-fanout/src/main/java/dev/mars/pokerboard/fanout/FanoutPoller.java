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

package dev.mars.pokerboard.fanout;

import dev.mars.pokerboard.api.store.EventLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives the {@link BoardBroker}: on every tick, loads each board that has a row,
 * hands the events to the broker and broadcasts what is new.
 *
 * <p>Ticks never overlap. A board whose load fails is skipped for that tick and
 * picked up again on the next one.
 *
 * @param <E> The board event type
 */
public class FanoutPoller<E> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FanoutPoller.class);

    static final Duration LOAD_TIMEOUT = Duration.ofSeconds(5);

    private final EventLogStore<E> store;
    private final BoardBroker<E> broker;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> ticking;

    public FanoutPoller(EventLogStore<E> store, BoardBroker<E> broker, Duration interval,
                        ScheduledExecutorService scheduler) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.broker = Objects.requireNonNull(broker, "broker cannot be null");
        this.interval = Objects.requireNonNull(interval, "interval cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    public synchronized FanoutPoller<E> start() {
        if (ticking == null) {
            ticking = scheduler.scheduleWithFixedDelay(this::safeTick,
                    interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
            logger.info("Fan-out poller started with interval {}", interval);
        }
        return this;
    }

    /**
     * Runs a tick outside the schedule, e.g. right after a command changed a board.
     */
    public void signal() {
        try {
            scheduler.execute(this::safeTick);
        } catch (RejectedExecutionException e) {
            logger.debug("Ignoring signal, scheduler is shut down");
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            logger.error("Fan-out tick failed", e);
        }
    }

    /**
     * Loads every tracked board and broadcasts the changes.
     *
     * @return The number of updates broadcast
     */
    public int tick() {
        synchronized (this) {
            for (String boardId : broker.boardIds()) {
                loadBoard(boardId);
            }
            return broker.broadcastChanges();
        }
    }

    private void loadBoard(String boardId) {
        try {
            List<E> events = store.load(boardId).get(LOAD_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            broker.updateEvents(boardId, events);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while loading board {}", boardId);
        } catch (ExecutionException | TimeoutException e) {
            logger.error("Failed to load board {}, skipping this tick", boardId, e);
        }
    }

    @Override
    public synchronized void close() {
        if (ticking != null) {
            ticking.cancel(false);
            ticking = null;
            logger.info("Fan-out poller stopped");
        }
    }
}
