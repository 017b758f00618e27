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
 * Retries up to {@code maxRetries} times, always waiting the same delay.
 */
public final class FixedDelayRetryStrategy implements RetryStrategy {

    private final Duration delay;
    private final int maxRetries;

    public FixedDelayRetryStrategy(Duration delay, int maxRetries) {
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.delay = delay;
        this.maxRetries = maxRetries;
    }

    @Override
    public RetryInstruction shouldRetry(RetryInstruction previousInstruction, int retryCount) {
        return retryCount < maxRetries ? RetryInstruction.retry(delay) : RetryInstruction.abort();
    }

    @Override
    public String toString() {
        return "FixedDelayRetryStrategy{delay=" + delay + ", maxRetries=" + maxRetries + '}';
    }
}
