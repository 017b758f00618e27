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

import dev.mars.pokerboard.api.error.InvalidPositionException;
import dev.mars.pokerboard.api.store.EventLogStore;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only store that answers every key with the same configured events.
 *
 * Used for configuration-sourced events such as the vote types every board
 * starts with. Saves are accepted and ignored.
 *
 * @param <E> The stored event type
 */
public class DefaultEventLogStore<E> implements EventLogStore<E> {

    private final List<E> configuredEvents;

    public DefaultEventLogStore(List<E> configuredEvents) {
        this.configuredEvents = List.copyOf(configuredEvents);
    }

    @Override
    public CompletableFuture<List<E>> load(String key) {
        return CompletableFuture.completedFuture(configuredEvents);
    }

    @Override
    public CompletableFuture<List<E>> save(String key, List<E> events) {
        return CompletableFuture.completedFuture(events);
    }

    /**
     * Configured events never change, so a request at the end of the sequence never completes.
     */
    @Override
    public CompletableFuture<List<E>> loadUpdate(String key, int since) {
        if (since < 0 || since > configuredEvents.size()) {
            return CompletableFuture.failedFuture(new InvalidPositionException(key, since, configuredEvents.size()));
        }
        if (since < configuredEvents.size()) {
            return CompletableFuture.completedFuture(configuredEvents.subList(since, configuredEvents.size()));
        }
        return new CompletableFuture<>();
    }
}
