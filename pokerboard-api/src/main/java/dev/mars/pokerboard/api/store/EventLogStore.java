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

package dev.mars.pokerboard.api.store;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Keyed, append-only event log.
 *
 * Each key maps to an ordered, dense sequence of events (positions 0..n-1).
 * Readers only ever observe prefix-extensions of what they saw before:
 * nothing is edited, reordered or deleted once stored.
 *
 * The store does not enforce that a write extends the sequence the writer
 * based it on. That check belongs to the command runner, or to an
 * implementation that opts into rejecting divergent writes.
 *
 * @param <E> The stored event type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface EventLogStore<E> extends AutoCloseable {

    /**
     * Loads the full sequence for a key.
     *
     * @param key The log key (a board id)
     * @return A CompletableFuture with the events, empty if the key is unknown
     */
    CompletableFuture<List<E>> load(String key);

    /**
     * Replaces the sequence for a key.
     *
     * @param key The log key
     * @param events The proposed sequence, a prefix-extension of the last observation
     * @return A CompletableFuture with the saved sequence
     */
    CompletableFuture<List<E>> save(String key, List<E> events);

    /**
     * Waits for events at positions {@code >= since}.
     *
     * If the log already holds more than {@code since} events the tail is returned
     * immediately. If it holds exactly {@code since} events the future completes with
     * the newly appended tail after the next save on that key.
     *
     * @param key The log key
     * @param since The first position the caller has not seen yet
     * @return A CompletableFuture with the tail, failed with
     *         {@link dev.mars.pokerboard.api.error.InvalidPositionException} if
     *         {@code since} is past the end of the log
     */
    CompletableFuture<List<E>> loadUpdate(String key, int since);

    @Override
    default void close() {
        // in-memory stores hold nothing that needs releasing
    }
}
