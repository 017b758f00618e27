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

package dev.mars.pokerboard.engine.sidecar;

import dev.mars.pokerboard.api.command.Command;
import dev.mars.pokerboard.api.projection.EventSourced;
import dev.mars.pokerboard.engine.TransactionalCommandRunner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Serializes command execution so the runner never sees two concurrent writers on
 * the same key.
 *
 * <p>Commands are routed to one of {@code partitions} queues by the hash of their
 * key. Each queue has one worker thread that takes a command, waits for the
 * runner's outcome and answers the caller before taking the next. Commands on one
 * key are therefore executed strictly in submission order.
 *
 * <p>Every outcome is delivered as a {@link CommandOutcome}. Failures are logged and
 * answered with {@link #ERROR_MESSAGE}. A reply target that throws is logged and
 * otherwise ignored.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code pokerboard.commands.succeeded} and {@code pokerboard.commands.failed} counters</li>
 *   <li>{@code pokerboard.commands.duration} timer</li>
 *   <li>{@code pokerboard.commands.queued} gauge</li>
 * </ul>
 *
 * @param <S> The aggregate type
 * @param <N> The event type commands produce
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class CommandSidecar<S extends EventSourced<?>, N> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CommandSidecar.class);

    public static final String ERROR_MESSAGE = "There was an error processing your command.";
    public static final String STOPPED_MESSAGE = "sidecar stopped";

    private final TransactionalCommandRunner<?, S, N> runner;
    private final List<BlockingQueue<CommandEnvelope<S, N>>> queues;
    private final List<Thread> workers;
    private final CommandEnvelope<S, N> stopMarker = new CommandEnvelope<>(null, null, null);
    private final Object lifecycleLock = new Object();
    private volatile boolean running;

    private final Counter succeeded;
    private final Counter failed;
    private final Timer duration;

    public CommandSidecar(TransactionalCommandRunner<?, S, N> runner, int partitions, MeterRegistry meterRegistry) {
        this.runner = Objects.requireNonNull(runner, "runner cannot be null");
        Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");
        if (partitions < 1) {
            throw new IllegalArgumentException("partitions must be at least 1");
        }

        this.queues = new ArrayList<>(partitions);
        this.workers = new ArrayList<>(partitions);
        for (int i = 0; i < partitions; i++) {
            BlockingQueue<CommandEnvelope<S, N>> queue = new LinkedBlockingQueue<>();
            queues.add(queue);
            Thread worker = new Thread(() -> runWorker(queue), "pokerboard-sidecar-" + i);
            worker.setDaemon(true);
            workers.add(worker);
        }

        this.succeeded = Counter.builder("pokerboard.commands.succeeded")
                .description("Commands executed successfully")
                .register(meterRegistry);
        this.failed = Counter.builder("pokerboard.commands.failed")
                .description("Commands that ended in an error")
                .register(meterRegistry);
        this.duration = Timer.builder("pokerboard.commands.duration")
                .description("Time from dequeue to outcome")
                .register(meterRegistry);
        Gauge.builder("pokerboard.commands.queued", this, CommandSidecar::queuedCount)
                .description("Commands waiting for a worker")
                .register(meterRegistry);
    }

    /**
     * Starts the worker threads.
     */
    public CommandSidecar<S, N> start() {
        synchronized (lifecycleLock) {
            if (running) {
                return this;
            }
            if (workers.get(0).getState() != Thread.State.NEW) {
                throw new IllegalStateException("A closed sidecar cannot be restarted");
            }
            running = true;
            workers.forEach(Thread::start);
        }
        logger.info("Command sidecar started with {} partition(s)", workers.size());
        return this;
    }

    /**
     * Queues a command. The outcome is delivered to {@code replyTo} on a worker thread.
     */
    public void send(String key, Command<S, N> command, Consumer<CommandOutcome<N>> replyTo) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(command, "command cannot be null");
        Objects.requireNonNull(replyTo, "replyTo cannot be null");

        CommandEnvelope<S, N> envelope = new CommandEnvelope<>(key, command, replyTo);
        synchronized (lifecycleLock) {
            if (running) {
                queues.get(partitionFor(key)).add(envelope);
                return;
            }
        }
        logger.debug("Rejecting command {} on key {}: sidecar is not running",
                command.getClass().getSimpleName(), key);
        deliver(envelope, CommandOutcome.error(STOPPED_MESSAGE));
    }

    /**
     * Queues a command and returns its outcome as a future, for request/response callers.
     */
    public CompletableFuture<CommandOutcome<N>> submit(String key, Command<S, N> command) {
        CompletableFuture<CommandOutcome<N>> future = new CompletableFuture<>();
        send(key, command, future::complete);
        return future;
    }

    int partitionFor(String key) {
        return Math.floorMod(key.hashCode(), queues.size());
    }

    private void runWorker(BlockingQueue<CommandEnvelope<S, N>> queue) {
        logger.debug("Sidecar worker {} started", Thread.currentThread().getName());
        while (true) {
            CommandEnvelope<S, N> envelope;
            try {
                envelope = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (envelope == stopMarker) {
                break;
            }
            process(envelope);
        }
        logger.debug("Sidecar worker {} stopped", Thread.currentThread().getName());
    }

    private void process(CommandEnvelope<S, N> envelope) {
        String commandName = envelope.command().getClass().getSimpleName();
        Timer.Sample sample = Timer.start();
        CommandOutcome<N> outcome;
        try {
            List<N> events = runner.execute(envelope.key(), envelope.command()).join();
            succeeded.increment();
            outcome = CommandOutcome.result(events);
            logger.debug("Command {} on key {} produced {} event(s)", commandName, envelope.key(), events.size());
        } catch (RuntimeException e) {
            failed.increment();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Command {} on key {} failed", commandName, envelope.key(), cause);
            outcome = CommandOutcome.error(ERROR_MESSAGE);
        } finally {
            sample.stop(duration);
        }
        deliver(envelope, outcome);
    }

    private void deliver(CommandEnvelope<S, N> envelope, CommandOutcome<N> outcome) {
        try {
            envelope.replyTo().accept(outcome);
        } catch (RuntimeException e) {
            logger.debug("Dropping reply for key {}: recipient failed", envelope.key(), e);
        }
    }

    private double queuedCount() {
        return queues.stream().mapToInt(BlockingQueue::size).sum();
    }

    public int getPartitions() {
        return queues.size();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops the workers after their current command. Commands still queued are
     * answered with {@link #STOPPED_MESSAGE}.
     */
    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
        }
        logger.info("Stopping command sidecar");

        List<CommandEnvelope<S, N>> pending = new ArrayList<>();
        for (BlockingQueue<CommandEnvelope<S, N>> queue : queues) {
            queue.drainTo(pending);
            queue.add(stopMarker);
        }
        for (CommandEnvelope<S, N> envelope : pending) {
            deliver(envelope, CommandOutcome.error(STOPPED_MESSAGE));
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for sidecar worker {} to stop", worker.getName());
                break;
            }
        }
        logger.info("Command sidecar stopped, {} queued command(s) rejected", pending.size());
    }
}
