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

package dev.mars.pokerboard.domain.event;

import java.util.Objects;

/**
 * The raw value of a vote: a card number in 0..255 or free text.
 *
 * JSON form is {@code {"Number":3}} or {@code {"String":"?"}}; see
 * {@link dev.mars.pokerboard.domain.json.PokerBoardJson}.
 */
public sealed interface VoteValue permits VoteValue.Numeric, VoteValue.Text {

    int MAX_NUMBER = 255;

    record Numeric(int value) implements VoteValue {
        public Numeric {
            if (value < 0 || value > MAX_NUMBER) {
                throw new IllegalArgumentException("vote number must be between 0 and " + MAX_NUMBER + ", was " + value);
            }
        }
    }

    record Text(String value) implements VoteValue {
        public Text {
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    static VoteValue number(int value) {
        return new Numeric(value);
    }

    static VoteValue text(String value) {
        return new Text(value);
    }
}
