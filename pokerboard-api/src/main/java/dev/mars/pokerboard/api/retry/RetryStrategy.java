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

/**
 * Decides whether a failed command attempt is retried.
 *
 * A strategy is stateless and shared; the per-execution state (how many retries
 * happened, what was decided last time) is handed in on every call so back-off
 * schedules can be written without touching the runner.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
@FunctionalInterface
public interface RetryStrategy {

    /**
     * @param previousInstruction The instruction returned for the previous failure of this
     *                            execution, or null on the first failure
     * @param retryCount Number of times this strategy was already consulted for this execution
     * @return {@link RetryInstruction.Retry} or {@link RetryInstruction.Abort}
     */
    RetryInstruction shouldRetry(RetryInstruction previousInstruction, int retryCount);
}
