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

package dev.mars.pokerboard.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Validator rule ordering and reason collection.
 */
@Tag("core")
class ValidatorTest {

    private static Optional<String> positive(Integer limit, Integer value) {
        return value > 0 ? Optional.empty() : Optional.of("not positive");
    }

    private static Optional<String> withinLimit(Integer limit, Integer value) {
        return value <= limit ? Optional.empty() : Optional.of("over limit");
    }

    private static Optional<String> even(Integer limit, Integer value) {
        return value % 2 == 0 ? Optional.empty() : Optional.of("odd");
    }

    @Test
    @DisplayName("Valid command yields no reasons")
    void testNoReasons() {
        List<String> reasons = Validator.<Integer, Integer, String>of()
                .should(ValidatorTest::positive)
                .should(ValidatorTest::withinLimit)
                .validateAgainst(10, 4);

        assertTrue(reasons.isEmpty());
    }

    @Test
    @DisplayName("Every failing rule is reported in the order rules were added")
    void testCollectsAllInOrder() {
        List<String> reasons = Validator.<Integer, Integer, String>of()
                .should(ValidatorTest::even)
                .should(ValidatorTest::positive)
                .should(ValidatorTest::withinLimit)
                .validateAgainst(-10, -3);

        assertEquals(List.of("odd", "not positive", "over limit"), reasons);
        assertThrows(UnsupportedOperationException.class, () -> reasons.add("x"));
    }

    @Test
    @DisplayName("A failing rule does not stop later rules from running")
    void testAllRulesRun() {
        List<String> seen = new ArrayList<>();
        Validator.<Integer, Integer, String>of()
                .should((s, c) -> {
                    seen.add("first");
                    return Optional.of("fail");
                })
                .should((s, c) -> {
                    seen.add("second");
                    return Optional.empty();
                })
                .validateAgainst(0, 0);

        assertEquals(List.of("first", "second"), seen);
    }
}
