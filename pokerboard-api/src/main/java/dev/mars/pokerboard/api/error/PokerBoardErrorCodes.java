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
 * Standard error codes for the poker board service.
 *
 * Error code ranges:
 * - POKERR0001-0049: General/System errors
 * - POKERR0050-0099: Board errors
 * - POKERR0100-0149: Command errors
 * - POKERR0150-0199: Session/WebSocket errors
 */
public final class PokerBoardErrorCodes {

    private PokerBoardErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "POKERR0001";
    public static final String INVALID_REQUEST = "POKERR0002";
    public static final String SERVICE_UNAVAILABLE = "POKERR0008";

    // ========================================================================
    // Board Errors (0050-0099)
    // ========================================================================
    public static final String BOARD_NOT_FOUND = "POKERR0050";
    public static final String EVENT_LOAD_FAILED = "POKERR0051";

    // ========================================================================
    // Command Errors (0100-0149)
    // ========================================================================
    public static final String COMMAND_PARSE_FAILED = "POKERR0100";
    public static final String COMMAND_EXECUTION_FAILED = "POKERR0101";

    // ========================================================================
    // Session Errors (0150-0199)
    // ========================================================================
    public static final String FRAME_PARSE_FAILED = "POKERR0150";
    public static final String UNKNOWN_FRAME = "POKERR0151";
}
