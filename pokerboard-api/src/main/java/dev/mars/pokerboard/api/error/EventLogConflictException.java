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
 * Raised when a proposed sequence does not extend the currently stored one,
 * meaning another writer got in between load and save.
 */
public class EventLogConflictException extends EventLogException {

    private static final long serialVersionUID = 1L;

    public EventLogConflictException(String key, int storedLength, int proposedLength) {
        super(ErrorKind.CONFLICT, String.format(
            "Event log '%s' changed since it was loaded (stored %d events, proposed %d)",
            key, storedLength, proposedLength));
    }
}
