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
 * Failure raised by an event log store or by the command runner around it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class EventLogException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public EventLogException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EventLogException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Creates a transient failure wrapping the given cause.
     */
    public static EventLogException transientFailure(String message, Throwable cause) {
        return new EventLogException(ErrorKind.TRANSIENT, message, cause);
    }

    /**
     * Creates a fatal failure wrapping the given cause.
     */
    public static EventLogException fatal(String message, Throwable cause) {
        return new EventLogException(ErrorKind.FATAL, message, cause);
    }
}
