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

import java.util.List;
import java.util.Objects;

/**
 * The board's full log as known to the broker, sent to a subscriber that asked to
 * catch up.
 */
public record BoardReplay<E>(String boardId, List<E> events) {

    public BoardReplay {
        Objects.requireNonNull(boardId, "boardId cannot be null");
        events = List.copyOf(events);
    }
}
