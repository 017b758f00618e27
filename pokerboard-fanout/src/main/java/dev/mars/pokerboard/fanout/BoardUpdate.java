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

package dev.mars.pokerboard.fanout;

import java.util.Objects;

/**
 * One live event and its position in the board's log.
 */
public record BoardUpdate<E>(String boardId, int position, E event) {

    public BoardUpdate {
        Objects.requireNonNull(boardId, "boardId cannot be null");
        Objects.requireNonNull(event, "event cannot be null");
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative");
        }
    }
}
