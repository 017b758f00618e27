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

package dev.mars.pokerboard.engine.retry;

import dev.mars.pokerboard.api.retry.RetryInstruction;
import dev.mars.pokerboard.api.retry.RetryStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries with a delay that starts at {@code initialDelay} and is multiplied on
 * each further retry, capped at {@code maxDelay}.
 *
 * <p>The next delay is derived from the previous {@link RetryInstruction.Retry}, so
 * the strategy itself holds no per-execution state and can be shared.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final int maxRetries;

    public ExponentialBackoffRetryStrategy(Duration initialDelay, double multiplier, Duration maxDelay, int maxRetries) {
        Objects.requireNonNull(initialDelay, "initialDelay cannot be null");
        Objects.requireNonNull(maxDelay, "maxDelay cannot be null");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be less than initialDelay");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.maxRetries = maxRetries;
    }

    @Override
    public RetryInstruction shouldRetry(RetryInstruction previousInstruction, int retryCount) {
        if (retryCount >= maxRetries) {
            return RetryInstruction.abort();
        }
        if (previousInstruction instanceof RetryInstruction.Retry previous) {
            return RetryInstruction.retry(calculateNextDelay(previous.delay()));
        }
        return RetryInstruction.retry(initialDelay);
    }

    private Duration calculateNextDelay(Duration currentDelay) {
        // nanosecond precision, so small delays still grow
        double nextDelayNanos = Math.ceil(currentDelay.toNanos() * multiplier);
        if (nextDelayNanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nextDelayNanos);
    }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryStrategy{initialDelay=" + initialDelay +
                ", multiplier=" + multiplier +
                ", maxDelay=" + maxDelay +
                ", maxRetries=" + maxRetries + '}';
    }
}
