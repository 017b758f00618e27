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

import dev.mars.pokerboard.api.projection.EventSourced;
import dev.mars.pokerboard.api.projection.Projections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * One session's read model and its replay-to-live handover.
 *
 * <p>Until the first replay the projection is initial: live updates are buffered.
 * A replay is authoritative for the positions it covers. The model is rebuilt from
 * the replayed events and buffered updates at later positions are applied in order.
 * Once live, an update is applied only at the next expected position; earlier
 * positions are duplicates and are ignored. A replay shorter than what is already
 * applied is stale and is ignored.
 *
 * <p>An update past the next expected position opens a gap. Later updates are
 * buffered and {@link #takeResyncRequest()} reports once that the owner should ask
 * the broker for a fresh replay, which closes the gap.
 *
 * <p>Not thread-safe. The owning session confines it to one thread.
 *
 * @param <E> The board event type
 * @param <Q> The read model type
 */
public final class SessionProjection<E, Q extends EventSourced<E>> {

    private static final Logger logger = LoggerFactory.getLogger(SessionProjection.class);

    private final Supplier<Q> initialState;
    private final List<BoardUpdate<E>> queued = new ArrayList<>();
    private Q state;
    private int nextPosition;
    private boolean resyncPending;
    private boolean resyncRequested;

    public SessionProjection(Supplier<Q> initialState) {
        this.initialState = Objects.requireNonNull(initialState, "initialState cannot be null");
    }

    /**
     * @return true if the read model changed
     */
    public boolean onUpdate(BoardUpdate<E> update) {
        if (state == null || resyncPending) {
            queued.add(update);
            return false;
        }
        return applyLive(update);
    }

    /**
     * Rebuilds the read model from a replay, also when already live, unless the
     * replay is older than the applied positions.
     *
     * @return true if the read model was rebuilt
     */
    public boolean onReplay(BoardReplay<E> replay) {
        int size = replay.events().size();
        if (state != null && size < nextPosition) {
            logger.debug("Ignoring stale replay of board {}: {} event(s), next position {}",
                    replay.boardId(), size, nextPosition);
            return false;
        }
        state = Projections.source(initialState, replay.events());
        nextPosition = size;
        resyncPending = false;

        List<BoardUpdate<E>> pending = new ArrayList<>(queued);
        queued.clear();
        pending.sort(Comparator.comparingInt(BoardUpdate::position));
        for (BoardUpdate<E> update : pending) {
            if (resyncPending) {
                queued.add(update);
            } else {
                applyLive(update);
            }
        }
        return true;
    }

    private boolean applyLive(BoardUpdate<E> update) {
        if (update.position() < nextPosition) {
            return false;
        }
        if (update.position() > nextPosition) {
            logger.warn("Gap at position {} of board {}: expected position {}, requesting replay",
                    update.position(), update.boardId(), nextPosition);
            resyncPending = true;
            resyncRequested = true;
            queued.add(update);
            return false;
        }
        state.apply(update.event());
        nextPosition++;
        return true;
    }

    /**
     * @return true once per gap, when a fresh replay should be requested
     */
    public boolean takeResyncRequest() {
        boolean requested = resyncRequested;
        resyncRequested = false;
        return requested;
    }

    public boolean isResyncPending() {
        return resyncPending;
    }

    public boolean isLive() {
        return state != null;
    }

    /**
     * @return The read model, empty until the first replay
     */
    public Optional<Q> getState() {
        return Optional.ofNullable(state);
    }

    public int getNextPosition() {
        return nextPosition;
    }

    public int getQueuedCount() {
        return queued.size();
    }
}
