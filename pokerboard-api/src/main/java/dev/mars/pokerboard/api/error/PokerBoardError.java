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

import java.time.Instant;

/**
 * Immutable error record returned to HTTP and WebSocket clients.
 *
 * @param code      The standard error code (e.g., POKERR0050)
 * @param message   Human-readable error message
 * @param timestamp When the error occurred
 * @param details   Optional additional details (can be null)
 */
public record PokerBoardError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    public static PokerBoardError of(String code, String message) {
        return new PokerBoardError(code, message, Instant.now(), null);
    }

    public static PokerBoardError of(String code, String message, String details) {
        return new PokerBoardError(code, message, Instant.now(), details);
    }

    public static PokerBoardError boardNotFound(String boardId) {
        return of(PokerBoardErrorCodes.BOARD_NOT_FOUND, "Board not found: " + boardId);
    }

    public static PokerBoardError commandParseFailed(String details) {
        return of(PokerBoardErrorCodes.COMMAND_PARSE_FAILED, "Invalid command body", details);
    }

    public static PokerBoardError commandFailed(String message) {
        return of(PokerBoardErrorCodes.COMMAND_EXECUTION_FAILED, message);
    }

    public static PokerBoardError internalError(String message) {
        return of(PokerBoardErrorCodes.INTERNAL_ERROR, message);
    }
}
