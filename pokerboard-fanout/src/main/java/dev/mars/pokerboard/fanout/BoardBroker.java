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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-board fan-out bookkeeping: who is subscribed to each board, which events are
 * known and how far they have been broadcast.
 *
 * <p>Each board row moves through {@link BoardRowState}:
 * <ul>
 *   <li>{@code EMPTY + updateEvents(e)} becomes {@code LOADED} with the broadcast
 *       position at {@code |e|}. The first snapshot counts as already seen; new
 *       subscribers catch up through a replay.</li>
 *   <li>{@code EMPTY + replayOnto(r)} becomes {@code REPLAY} with {@code r} waiting.</li>
 *   <li>{@code REPLAY + updateEvents(e)} sends {@code e} to every waiter and becomes
 *       {@code LOADED} at {@code |e|}.</li>
 *   <li>{@code LOADED + updateEvents(e)} replaces the events and keeps the broadcast
 *       position, so the new tail goes out on the next {@link #broadcastChanges()}.</li>
 *   <li>{@code LOADED + replayOnto(r)} sends the known events to {@code r} at once.</li>
 * </ul>
 * A row is removed when its last subscriber disconnects.
 *
 * <p>One lock guards all rows and is held only for bookkeeping. Subscriber callbacks
 * run after the lock is released.
 *
 * @param <E> The board event type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class BoardBroker<E> {

    private static final Logger logger = LoggerFactory.getLogger(BoardBroker.class);

    private final Object lock = new Object();
    private final Map<String, BoardRow<E>> rows = new HashMap<>();
    private final Map<String, String> boardBySession = new HashMap<>();

    private static final class BoardRow<E> {
        final Map<String, BoardSubscriber<E>> subscribers = new LinkedHashMap<>();
        final List<BoardSubscriber<E>> replayWaiters = new ArrayList<>();
        BoardRowState state = BoardRowState.EMPTY;
        List<E> events = List.of();
        int broadcastPosition;
    }

    private record Delivery<E>(String sessionId, BoardSubscriber<E> subscriber, List<BoardUpdate<E>> updates) {
    }

    public void connect(String sessionId, String boardId, BoardSubscriber<E> subscriber) {
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        Objects.requireNonNull(boardId, "boardId cannot be null");
        Objects.requireNonNull(subscriber, "subscriber cannot be null");
        synchronized (lock) {
            String previous = boardBySession.put(sessionId, boardId);
            if (previous != null && !previous.equals(boardId)) {
                removeSubscriber(sessionId, previous);
            }
            rows.computeIfAbsent(boardId, id -> new BoardRow<>()).subscribers.put(sessionId, subscriber);
        }
        logger.debug("Session {} connected to board {}", sessionId, boardId);
    }

    public void disconnect(String sessionId) {
        String boardId;
        synchronized (lock) {
            boardId = boardBySession.remove(sessionId);
            if (boardId != null) {
                removeSubscriber(sessionId, boardId);
            }
        }
        if (boardId != null) {
            logger.debug("Session {} disconnected from board {}", sessionId, boardId);
        }
    }

    private void removeSubscriber(String sessionId, String boardId) {
        BoardRow<E> row = rows.get(boardId);
        if (row == null) {
            return;
        }
        row.subscribers.remove(sessionId);
        if (row.subscribers.isEmpty() && row.replayWaiters.isEmpty()) {
            rows.remove(boardId);
            logger.debug("Removed orphaned row for board {}", boardId);
        }
    }

    /**
     * Asks for the board's events to be sent to {@code subscriber}, now if they are
     * known and otherwise once the first load returns.
     */
    public void replayOnto(String boardId, BoardSubscriber<E> subscriber) {
        Objects.requireNonNull(boardId, "boardId cannot be null");
        Objects.requireNonNull(subscriber, "subscriber cannot be null");
        List<E> known;
        synchronized (lock) {
            BoardRow<E> row = rows.computeIfAbsent(boardId, id -> new BoardRow<>());
            if (row.state != BoardRowState.LOADED) {
                row.state = BoardRowState.REPLAY;
                row.replayWaiters.add(subscriber);
                return;
            }
            known = row.events;
        }
        deliverReplay(subscriber, new BoardReplay<>(boardId, known));
    }

    /**
     * Records the latest events loaded for a board. Unknown boards are ignored.
     */
    public void updateEvents(String boardId, List<E> events) {
        Objects.requireNonNull(events, "events cannot be null");
        List<E> snapshot = List.copyOf(events);
        List<BoardSubscriber<E>> waiters = List.of();
        synchronized (lock) {
            BoardRow<E> row = rows.get(boardId);
            if (row == null) {
                return;
            }
            switch (row.state) {
                case EMPTY:
                    row.broadcastPosition = snapshot.size();
                    break;
                case REPLAY:
                    waiters = List.copyOf(row.replayWaiters);
                    row.replayWaiters.clear();
                    row.broadcastPosition = snapshot.size();
                    if (row.subscribers.isEmpty()) {
                        rows.remove(boardId);
                    }
                    break;
                case LOADED:
                    row.broadcastPosition = Math.min(row.broadcastPosition, snapshot.size());
                    break;
                default:
                    throw new IllegalStateException("Unknown row state " + row.state);
            }
            row.state = BoardRowState.LOADED;
            row.events = snapshot;
        }
        if (!waiters.isEmpty()) {
            BoardReplay<E> replay = new BoardReplay<>(boardId, snapshot);
            logger.debug("Replaying {} event(s) of board {} to {} waiter(s)", snapshot.size(), boardId, waiters.size());
            waiters.forEach(waiter -> deliverReplay(waiter, replay));
        }
    }

    /**
     * Sends every event past the broadcast position to every open subscriber, in log
     * order, and advances the position.
     *
     * @return The number of updates sent
     */
    public int broadcastChanges() {
        List<Delivery<E>> deliveries = new ArrayList<>();
        synchronized (lock) {
            for (Map.Entry<String, BoardRow<E>> entry : rows.entrySet()) {
                BoardRow<E> row = entry.getValue();
                dropClosedSubscribers(row);
                if (row.state != BoardRowState.LOADED || row.broadcastPosition >= row.events.size()) {
                    continue;
                }
                List<BoardUpdate<E>> updates = new ArrayList<>();
                for (int position = row.broadcastPosition; position < row.events.size(); position++) {
                    updates.add(new BoardUpdate<>(entry.getKey(), position, row.events.get(position)));
                }
                row.broadcastPosition = row.events.size();
                row.subscribers.forEach((sessionId, subscriber) ->
                        deliveries.add(new Delivery<>(sessionId, subscriber, updates)));
            }
            rows.values().removeIf(row -> row.subscribers.isEmpty() && row.replayWaiters.isEmpty());
        }

        int sent = 0;
        for (Delivery<E> delivery : deliveries) {
            sent += deliver(delivery);
        }
        if (sent > 0) {
            logger.trace("Broadcast {} update(s) to {} subscriber(s)", sent, deliveries.size());
        }
        return sent;
    }

    private void dropClosedSubscribers(BoardRow<E> row) {
        Iterator<Map.Entry<String, BoardSubscriber<E>>> it = row.subscribers.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, BoardSubscriber<E>> subscriber = it.next();
            if (!subscriber.getValue().isOpen()) {
                it.remove();
                boardBySession.remove(subscriber.getKey());
                logger.debug("Dropped closed subscriber {}", subscriber.getKey());
            }
        }
    }

    private int deliver(Delivery<E> delivery) {
        int sent = 0;
        try {
            for (BoardUpdate<E> update : delivery.updates()) {
                delivery.subscriber().onUpdate(update);
                sent++;
            }
        } catch (RuntimeException e) {
            logger.debug("Dropping subscriber {}: delivery failed", delivery.sessionId(), e);
            disconnect(delivery.sessionId());
        }
        return sent;
    }

    private void deliverReplay(BoardSubscriber<E> subscriber, BoardReplay<E> replay) {
        try {
            subscriber.onReplay(replay);
        } catch (RuntimeException e) {
            logger.debug("Replay of board {} not delivered", replay.boardId(), e);
        }
    }

    /**
     * @return Boards the poller should load: every board with a row
     */
    public Set<String> boardIds() {
        synchronized (lock) {
            return Set.copyOf(rows.keySet());
        }
    }

    public Optional<BoardRowState> stateOf(String boardId) {
        synchronized (lock) {
            BoardRow<E> row = rows.get(boardId);
            return row == null ? Optional.empty() : Optional.of(row.state);
        }
    }

    public int subscriberCount(String boardId) {
        synchronized (lock) {
            BoardRow<E> row = rows.get(boardId);
            return row == null ? 0 : row.subscribers.size();
        }
    }
}
