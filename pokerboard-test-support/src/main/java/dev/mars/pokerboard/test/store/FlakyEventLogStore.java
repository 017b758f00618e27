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

package dev.mars.pokerboard.test.store;

import dev.mars.pokerboard.api.error.ErrorKind;
import dev.mars.pokerboard.api.error.EventLogException;
import dev.mars.pokerboard.api.store.EventLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Store decorator that fails a configurable number of operations before
 * delegating, for exercising retry behaviour.
 *
 * @param <E> The stored event type
 */
public class FlakyEventLogStore<E> implements EventLogStore<E> {

    private static final Logger logger = LoggerFactory.getLogger(FlakyEventLogStore.class);

    private final EventLogStore<E> delegate;
    private final AtomicInteger remainingSaveFailures;
    private final AtomicInteger remainingLoadFailures;
    private final ErrorKind failureKind;
    private final AtomicInteger saveAttempts = new AtomicInteger();
    private final AtomicInteger loadAttempts = new AtomicInteger();

    public FlakyEventLogStore(EventLogStore<E> delegate, int saveFailures, int loadFailures, ErrorKind failureKind) {
        this.delegate = delegate;
        this.remainingSaveFailures = new AtomicInteger(saveFailures);
        this.remainingLoadFailures = new AtomicInteger(loadFailures);
        this.failureKind = failureKind;
    }

    /**
     * Fails the first {@code saveFailures} saves with a transient error.
     */
    public static <E> FlakyEventLogStore<E> failingSaves(EventLogStore<E> delegate, int saveFailures) {
        return new FlakyEventLogStore<>(delegate, saveFailures, 0, ErrorKind.TRANSIENT);
    }

    @Override
    public CompletableFuture<List<E>> load(String key) {
        loadAttempts.incrementAndGet();
        if (remainingLoadFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            logger.debug("Injecting {} load failure for key {}", failureKind, key);
            return CompletableFuture.failedFuture(new EventLogException(failureKind, "Injected load failure"));
        }
        return delegate.load(key);
    }

    @Override
    public CompletableFuture<List<E>> save(String key, List<E> events) {
        saveAttempts.incrementAndGet();
        if (remainingSaveFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            logger.debug("Injecting {} save failure for key {}", failureKind, key);
            return CompletableFuture.failedFuture(new EventLogException(failureKind, "Injected save failure"));
        }
        return delegate.save(key, events);
    }

    @Override
    public CompletableFuture<List<E>> loadUpdate(String key, int since) {
        return delegate.loadUpdate(key, since);
    }

    public int getSaveAttempts() {
        return saveAttempts.get();
    }

    public int getLoadAttempts() {
        return loadAttempts.get();
    }
}
