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

package dev.mars.pokerboard.store;

import dev.mars.pokerboard.api.error.ErrorKind;
import dev.mars.pokerboard.api.error.EventLogConflictException;
import dev.mars.pokerboard.api.error.EventLogException;
import dev.mars.pokerboard.api.error.InvalidPositionException;
import dev.mars.pokerboard.api.store.EventLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Process-wide in-memory event log.
 *
 * All logs live in one map guarded by a single monitor. The monitor is held for
 * one map operation at a time and never while a future is completed, so callbacks
 * chained on a returned future can call back into the store freely.
 *
 * Pending {@link #loadUpdate(String, int)} calls are parked per key and woken by the
 * next save that actually extends the log past their position.
 *
 * @param <E> The stored event type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class InMemoryEventLogStore<E> implements EventLogStore<E> {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventLogStore.class);

    private final Object lock = new Object();
    private final Map<String, KeyedLog<E>> logs = new HashMap<>();
    private final boolean rejectDivergentWrites;
    private boolean closed;

    public InMemoryEventLogStore() {
        this(false);
    }

    /**
     * @param rejectDivergentWrites when true, a save whose sequence does not extend the
     *                              stored one fails with {@link EventLogConflictException}
     */
    public InMemoryEventLogStore(boolean rejectDivergentWrites) {
        this.rejectDivergentWrites = rejectDivergentWrites;
    }

    @Override
    public CompletableFuture<List<E>> load(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(closedError());
            }
            KeyedLog<E> log = logs.get(key);
            return CompletableFuture.completedFuture(log == null ? List.of() : List.copyOf(log.events));
        }
    }

    @Override
    public CompletableFuture<List<E>> save(String key, List<E> events) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(events, "events cannot be null");

        List<E> snapshot = List.copyOf(events);
        List<PendingUpdate<E>> ready = new ArrayList<>();
        List<PendingUpdate<E>> invalid = new ArrayList<>();

        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(closedError());
            }
            KeyedLog<E> log = logs.computeIfAbsent(key, k -> new KeyedLog<>());
            if (rejectDivergentWrites && !extendsSequence(log.events, snapshot)) {
                logger.debug("Rejecting divergent write to '{}': stored {} events, proposed {}",
                    key, log.events.size(), snapshot.size());
                return CompletableFuture.failedFuture(
                    new EventLogConflictException(key, log.events.size(), snapshot.size()));
            }
            log.events = snapshot;

            Iterator<PendingUpdate<E>> waiters = log.waiters.iterator();
            while (waiters.hasNext()) {
                PendingUpdate<E> waiter = waiters.next();
                if (waiter.position < snapshot.size()) {
                    ready.add(waiter);
                    waiters.remove();
                } else if (waiter.position > snapshot.size()) {
                    invalid.add(waiter);
                    waiters.remove();
                }
            }
        }

        logger.trace("Saved {} events for '{}', waking {} waiters", snapshot.size(), key, ready.size());
        for (PendingUpdate<E> waiter : ready) {
            waiter.future.complete(snapshot.subList(waiter.position, snapshot.size()));
        }
        for (PendingUpdate<E> waiter : invalid) {
            waiter.future.completeExceptionally(new InvalidPositionException(key, waiter.position, snapshot.size()));
        }
        return CompletableFuture.completedFuture(snapshot);
    }

    @Override
    public CompletableFuture<List<E>> loadUpdate(String key, int since) {
        Objects.requireNonNull(key, "key cannot be null");
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(closedError());
            }
            KeyedLog<E> log = logs.computeIfAbsent(key, k -> new KeyedLog<>());
            int length = log.events.size();
            if (since < 0 || since > length) {
                return CompletableFuture.failedFuture(new InvalidPositionException(key, since, length));
            }
            if (since < length) {
                return CompletableFuture.completedFuture(log.events.subList(since, length));
            }
            PendingUpdate<E> waiter = new PendingUpdate<>(since);
            log.waiters.add(waiter);
            return waiter.future;
        }
    }

    /**
     * @return Number of loadUpdate calls currently parked on the key
     */
    public int pendingUpdates(String key) {
        synchronized (lock) {
            KeyedLog<E> log = logs.get(key);
            return log == null ? 0 : log.waiters.size();
        }
    }

    @Override
    public void close() {
        List<PendingUpdate<E>> abandoned = new ArrayList<>();
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            for (KeyedLog<E> log : logs.values()) {
                abandoned.addAll(log.waiters);
                log.waiters.clear();
            }
        }
        logger.info("In-memory event log closed, releasing {} pending update requests", abandoned.size());
        for (PendingUpdate<E> waiter : abandoned) {
            waiter.future.completeExceptionally(closedError());
        }
    }

    private static <E> boolean extendsSequence(List<E> stored, List<E> proposed) {
        return proposed.size() >= stored.size() && proposed.subList(0, stored.size()).equals(stored);
    }

    private static EventLogException closedError() {
        return new EventLogException(ErrorKind.FATAL, "Event log store is closed");
    }

    private static final class KeyedLog<E> {
        private List<E> events = List.of();
        private final List<PendingUpdate<E>> waiters = new ArrayList<>();
    }

    private static final class PendingUpdate<E> {
        private final int position;
        private final CompletableFuture<List<E>> future = new CompletableFuture<>();

        private PendingUpdate(int position) {
            this.position = position;
        }
    }
}
