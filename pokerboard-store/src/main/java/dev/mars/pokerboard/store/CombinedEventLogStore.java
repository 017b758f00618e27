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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Presents two physical stores as one log of a combined event type.
 *
 * Configuration-sourced events always come first, so a replay sees them before
 * any runtime event that depends on them. Saves only reach the runtime store;
 * combined events that do not map back to the runtime type are dropped.
 *
 * @param <E> The combined event type
 * @param <A> The configuration event type
 * @param <B> The runtime event type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class CombinedEventLogStore<E, A, B> implements EventLogStore<E> {

    private static final Logger logger = LoggerFactory.getLogger(CombinedEventLogStore.class);

    private final EventLogStore<A> configurationStore;
    private final EventLogStore<B> runtimeStore;
    private final Function<A, E> fromConfiguration;
    private final Function<B, E> fromRuntime;
    private final Function<E, Optional<B>> toRuntime;

    public CombinedEventLogStore(EventLogStore<A> configurationStore,
                                 EventLogStore<B> runtimeStore,
                                 Function<A, E> fromConfiguration,
                                 Function<B, E> fromRuntime,
                                 Function<E, Optional<B>> toRuntime) {
        this.configurationStore = configurationStore;
        this.runtimeStore = runtimeStore;
        this.fromConfiguration = fromConfiguration;
        this.fromRuntime = fromRuntime;
        this.toRuntime = toRuntime;
    }

    @Override
    public CompletableFuture<List<E>> load(String key) {
        return configurationStore.load(key)
            .thenCombine(runtimeStore.load(key), this::combine);
    }

    @Override
    public CompletableFuture<List<E>> save(String key, List<E> events) {
        List<B> runtimeEvents = new ArrayList<>();
        for (E event : events) {
            toRuntime.apply(event).ifPresent(runtimeEvents::add);
        }
        logger.trace("Saving {} of {} combined events for '{}' to the runtime store",
            runtimeEvents.size(), events.size(), key);
        return configurationStore.load(key)
            .thenCompose(configured -> runtimeStore.save(key, runtimeEvents)
                .thenApply(saved -> combine(configured, saved)));
    }

    @Override
    public CompletableFuture<List<E>> loadUpdate(String key, int since) {
        return configurationStore.load(key).thenCompose(configured ->
            runtimeStore.load(key).thenCompose(runtime -> {
                int total = configured.size() + runtime.size();
                if (since < 0 || since > total) {
                    return CompletableFuture.failedFuture(new InvalidPositionException(key, since, total));
                }
                if (since < total) {
                    List<E> combined = combine(configured, runtime);
                    return CompletableFuture.completedFuture(combined.subList(since, total));
                }
                return runtimeStore.loadUpdate(key, since - configured.size())
                    .thenApply(tail -> tail.stream().map(fromRuntime).toList());
            }));
    }

    @Override
    public void close() {
        configurationStore.close();
        runtimeStore.close();
    }

    private List<E> combine(List<A> configured, List<B> runtime) {
        List<E> combined = new ArrayList<>(configured.size() + runtime.size());
        configured.forEach(event -> combined.add(fromConfiguration.apply(event)));
        runtime.forEach(event -> combined.add(fromRuntime.apply(event)));
        return List.copyOf(combined);
    }
}
