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
 * Raised when a reader asks for updates from a position past the end of a log.
 * A reader can only get there through a bug, so this is always fatal.
 */
public class InvalidPositionException extends EventLogException {

    private static final long serialVersionUID = 1L;

    private final int requestedPosition;
    private final int logLength;

    public InvalidPositionException(String key, int requestedPosition, int logLength) {
        super(ErrorKind.FATAL, String.format("Invalid event index %d for log '%s' with %d events",
            requestedPosition, key, logLength));
        this.requestedPosition = requestedPosition;
        this.logLength = logLength;
    }

    public int getRequestedPosition() {
        return requestedPosition;
    }

    public int getLogLength() {
        return logLength;
    }
}
