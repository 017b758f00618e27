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

import java.util.Objects;

/**
 * Retry state for one command execution. Remembers the last instruction and how
 * many times the strategy has been consulted.
 */
public final class RetryPolicy {

    private final RetryStrategy strategy;
    private RetryInstruction previousInstruction;
    private int retryCount;

    public RetryPolicy(RetryStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
    }

    /**
     * Asks the strategy what to do after a failure and advances the count.
     */
    public synchronized RetryInstruction next() {
        RetryInstruction instruction = strategy.shouldRetry(previousInstruction, retryCount);
        previousInstruction = instruction;
        retryCount++;
        return instruction;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }
}
