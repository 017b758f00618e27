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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class RetryInstructionTest {

    @Test
    @DisplayName("Retry delay must be present and non-negative")
    void testRetryValidation() {
        assertEquals(Duration.ZERO, ((RetryInstruction.Retry) RetryInstruction.retry(Duration.ZERO)).delay());
        assertThrows(NullPointerException.class, () -> RetryInstruction.retry(null));
        assertThrows(IllegalArgumentException.class, () -> RetryInstruction.retry(Duration.ofMillis(-1)));
    }

    @Test
    @DisplayName("NoRetry always aborts")
    void testNoRetry() {
        assertInstanceOf(RetryInstruction.Abort.class, NoRetry.INSTANCE.shouldRetry(null, 0));
        assertInstanceOf(RetryInstruction.Abort.class,
                NoRetry.INSTANCE.shouldRetry(RetryInstruction.retry(Duration.ofSeconds(1)), 5));
    }
}
