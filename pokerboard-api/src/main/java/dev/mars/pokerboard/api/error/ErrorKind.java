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

package dev.mars.pokerboard.api.error;

/**
 * Classification of infrastructure failures seen by the command runner.
 *
 * Domain rejections are never errors; they are recorded as negative events.
 */
public enum ErrorKind {

    /** Load/save failure or contention. Eligible for retry. */
    TRANSIENT,

    /** The stored log no longer matches the sequence a write was based on. Eligible for retry. */
    CONFLICT,

    /** Internal invariant violation. Never retried. */
    FATAL;

    public boolean isRetryable() {
        return this != FATAL;
    }
}
