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

package dev.mars.pokerboard.engine;

import dev.mars.pokerboard.api.command.Command;
import dev.mars.pokerboard.api.error.ErrorKind;
import dev.mars.pokerboard.api.error.EventLogException;
import dev.mars.pokerboard.api.projection.EventSourced;
import dev.mars.pokerboard.api.projection.Projections;
import dev.mars.pokerboard.api.retry.NoRetry;
import dev.mars.pokerboard.api.retry.RetryInstruction;
import dev.mars.pokerboard.api.retry.RetryStrategy;
import dev.mars.pokerboard.api.store.EventLogStore;
import dev.mars.pokerboard.engine.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Executes a command against the event log of one key as a single
 * load, decide, save transaction.
 *
 * <p>Each attempt loads the full log, folds the aggregate, applies the command and
 * saves the log extended with the produced events. When an attempt fails the error
 * is classified:
 * <ul>
 *   <li>{@link ErrorKind#FATAL} fails the execution straight away.</li>
 *   <li>{@link ErrorKind#TRANSIENT} and {@link ErrorKind#CONFLICT} ask a
 *       {@link RetryPolicy} created for this execution. A retry reloads the log,
 *       so a retried attempt never appends events from an earlier one.</li>
 * </ul>
 * Failures that carry no kind are treated as transient. A command that throws is fatal.
 *
 * <p>Retry delays run on the supplied {@link ScheduledExecutorService}; the runner
 * does not own it.
 *
 * @param <E> The stored event type
 * @param <S> The aggregate type
 * @param <N> The event type commands produce
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class TransactionalCommandRunner<E, S extends EventSourced<E>, N> {

    private static final Logger logger = LoggerFactory.getLogger(TransactionalCommandRunner.class);

    private final EventLogStore<E> store;
    private final Supplier<S> initialState;
    private final Function<N, E> toStored;
    private final RetryStrategy retryStrategy;
    private final ScheduledExecutorService scheduler;

    public TransactionalCommandRunner(EventLogStore<E> store,
                                      Supplier<S> initialState,
                                      Function<N, E> toStored,
                                      RetryStrategy retryStrategy,
                                      ScheduledExecutorService scheduler) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.initialState = Objects.requireNonNull(initialState, "initialState cannot be null");
        this.toStored = Objects.requireNonNull(toStored, "toStored cannot be null");
        this.retryStrategy = retryStrategy != null ? retryStrategy : NoRetry.INSTANCE;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    /**
     * Runs the command on the log at {@code key}.
     *
     * @return The events the successful attempt produced, in order
     */
    public CompletableFuture<List<N>> execute(String key, Command<S, N> command) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(command, "command cannot be null");

        CompletableFuture<List<N>> result = new CompletableFuture<>();
        attempt(key, command, new RetryPolicy(retryStrategy), result);
        return result;
    }

    private void attempt(String key, Command<S, N> command, RetryPolicy policy, CompletableFuture<List<N>> result) {
        CompletableFuture<List<N>> attempt;
        try {
            attempt = store.load(key).thenCompose(events -> decideAndSave(key, command, events));
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        attempt.whenComplete((produced, throwable) -> {
            if (throwable == null) {
                logger.debug("Command {} on key {} produced {} event(s) after {} retries",
                        command.getClass().getSimpleName(), key, produced.size(), policy.getRetryCount());
                result.complete(produced);
                return;
            }
            handleFailure(key, command, policy, result, unwrap(throwable));
        });
    }

    private CompletableFuture<List<N>> decideAndSave(String key, Command<S, N> command, List<E> events) {
        S state = Projections.source(initialState, events);
        List<N> produced;
        try {
            produced = command.apply(state);
        } catch (RuntimeException e) {
            throw new CommandExecutionException(key, e);
        }
        if (produced.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<E> proposed = new ArrayList<>(events.size() + produced.size());
        proposed.addAll(events);
        for (N event : produced) {
            proposed.add(toStored.apply(event));
        }
        List<N> emitted = List.copyOf(produced);
        return store.save(key, proposed).thenApply(saved -> emitted);
    }

    private void handleFailure(String key, Command<S, N> command, RetryPolicy policy,
                               CompletableFuture<List<N>> result, Throwable error) {
        ErrorKind kind = classify(error);
        if (kind == ErrorKind.FATAL) {
            logger.warn("Command {} on key {} failed with a fatal error: {}",
                    command.getClass().getSimpleName(), key, error.getMessage());
            result.completeExceptionally(error);
            return;
        }

        RetryInstruction instruction = policy.next();
        if (instruction instanceof RetryInstruction.Retry retry) {
            logger.debug("Retrying command {} on key {} after {} ({} error, retry {}): {}",
                    command.getClass().getSimpleName(), key, retry.delay(), kind, policy.getRetryCount(),
                    error.getMessage());
            scheduleRetry(key, command, policy, result, retry);
        } else {
            logger.info("Giving up on command {} on key {} after {} retries. Final error: {}",
                    command.getClass().getSimpleName(), key, policy.getRetryCount() - 1, error.getMessage());
            result.completeExceptionally(error);
        }
    }

    private void scheduleRetry(String key, Command<S, N> command, RetryPolicy policy,
                               CompletableFuture<List<N>> result, RetryInstruction.Retry retry) {
        try {
            scheduler.schedule(() -> attempt(key, command, policy, result),
                    retry.delay().toNanos(), TimeUnit.NANOSECONDS);
        } catch (RuntimeException e) {
            logger.error("Unable to schedule retry for key {}", key, e);
            result.completeExceptionally(e);
        }
    }

    static ErrorKind classify(Throwable error) {
        if (error instanceof CommandExecutionException) {
            return ErrorKind.FATAL;
        }
        if (error instanceof EventLogException) {
            return ((EventLogException) error).getKind();
        }
        return ErrorKind.TRANSIENT;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
