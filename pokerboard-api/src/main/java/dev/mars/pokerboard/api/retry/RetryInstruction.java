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

package dev.mars.pokerboard.api.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What the runner should do after a failed attempt.
 */
public sealed interface RetryInstruction permits RetryInstruction.Retry, RetryInstruction.Abort {

    /**
     * Try again after the given delay.
     */
    record Retry(Duration delay) implements RetryInstruction {
        public Retry {
            Objects.requireNonNull(delay, "delay cannot be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }
    }

    /**
     * Give up and surface the last error.
     */
    record Abort() implements RetryInstruction {
    }

    static RetryInstruction retry(Duration delay) {
        return new Retry(delay);
    }

    static RetryInstruction abort() {
        return new Abort();
    }
}
