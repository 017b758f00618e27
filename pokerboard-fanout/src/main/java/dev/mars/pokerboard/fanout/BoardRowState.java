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

/**
 * Lifecycle of a board row in the {@link BoardBroker}.
 */
public enum BoardRowState {
    /** No events known and no replay requested. */
    EMPTY,
    /** A replay was requested before the first load returned. */
    REPLAY,
    /** Events are known; broadcasting resumes from the broadcast position. */
    LOADED
}
