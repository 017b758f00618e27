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

package dev.mars.pokerboard.rest.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.mars.pokerboard.api.error.PokerBoardError;
import dev.mars.pokerboard.api.error.PokerBoardErrorCodes;
import dev.mars.pokerboard.api.projection.Projections;
import dev.mars.pokerboard.domain.command.BoardCommand;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.query.BoardView;
import dev.mars.pokerboard.engine.sidecar.CommandOutcome;
import dev.mars.pokerboard.rest.error.ErrorResponse;
import dev.mars.pokerboard.runtime.PokerBoardContext;
import io.vertx.core.Future;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Handler for the board HTTP endpoints.
 *
 * Commands go through the sidecar, so HTTP and WebSocket writers on one board are
 * serialized together. Queries read the board log directly.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class BoardHandler {

    private static final Logger logger = LoggerFactory.getLogger(BoardHandler.class);

    private final PokerBoardContext context;
    private final ObjectMapper objectMapper;
    private final ObjectWriter eventsWriter;

    public BoardHandler(PokerBoardContext context, ObjectMapper objectMapper) {
        this.context = context;
        this.objectMapper = objectMapper;
        this.eventsWriter = objectMapper.writerFor(new TypeReference<List<BoardModifiedEvent>>() {});
    }

    /**
     * Executes a command against a board.
     * POST /board/:boardId with a tagged command body.
     */
    public void executeCommand(RoutingContext ctx) {
        String boardId = ctx.pathParam("boardId");
        String body = ctx.body().asString();

        BoardCommand command;
        try {
            if (body == null || body.isBlank()) {
                ErrorResponse.badRequest(ctx, PokerBoardError.commandParseFailed("Request body is empty"));
                return;
            }
            command = objectMapper.readValue(body, BoardCommand.class);
        } catch (JsonProcessingException e) {
            logger.debug("Rejected command body for board {}: {}", boardId, e.getOriginalMessage());
            ErrorResponse.badRequest(ctx, PokerBoardError.commandParseFailed(e.getOriginalMessage()));
            return;
        }

        logger.debug("Executing {} on board {}", command.getClass().getSimpleName(), boardId);

        Future.fromCompletionStage(context.getSidecar().submit(boardId, command), ctx.vertx().getOrCreateContext())
            .onSuccess(outcome -> {
                if (outcome instanceof CommandOutcome.CommandResult<BoardModifiedEvent> result) {
                    if (!result.events().isEmpty()) {
                        context.getPoller().signal();
                    }
                    sendJson(ctx, 200, writeEvents(result.events()));
                } else if (outcome instanceof CommandOutcome.CommandError<BoardModifiedEvent> error) {
                    ErrorResponse.internalError(ctx, PokerBoardError.commandFailed(error.message()));
                }
            })
            .onFailure(cause -> {
                logger.error("Command {} on board {} did not complete", command.getClass().getSimpleName(), boardId, cause);
                ErrorResponse.internalError(ctx, PokerBoardError.internalError("Command did not complete"));
            });
    }

    /**
     * Returns the presentation folded from the board log.
     * GET /board/:boardId
     */
    public void getBoard(RoutingContext ctx) {
        String boardId = ctx.pathParam("boardId");

        loadEvents(ctx, boardId)
            .onSuccess(events -> {
                if (events.isEmpty()) {
                    ErrorResponse.notFound(ctx, PokerBoardError.boardNotFound(boardId));
                    return;
                }
                BoardView view = Projections.source(BoardView::new, events);
                try {
                    sendJson(ctx, 200, objectMapper.writeValueAsString(view.present()));
                } catch (JsonProcessingException e) {
                    logger.error("Failed to render board {}", boardId, e);
                    ErrorResponse.internalError(ctx, PokerBoardError.internalError("Failed to render board"));
                }
            });
    }

    /**
     * Returns the raw board events, empty for an unknown board.
     * GET /board/:boardId/events
     */
    public void getEvents(RoutingContext ctx) {
        String boardId = ctx.pathParam("boardId");

        loadEvents(ctx, boardId)
            .onSuccess(events -> sendJson(ctx, 200, writeEvents(events)));
    }

    private Future<List<BoardModifiedEvent>> loadEvents(RoutingContext ctx, String boardId) {
        return Future.fromCompletionStage(context.getBoardStore().load(boardId), ctx.vertx().getOrCreateContext())
            .onFailure(cause -> {
                logger.error("Failed to load board {}", boardId, cause);
                ErrorResponse.internalError(ctx, PokerBoardError.of(PokerBoardErrorCodes.EVENT_LOAD_FAILED,
                    "Failed to load board " + boardId));
            });
    }

    private String writeEvents(List<BoardModifiedEvent> events) {
        try {
            return eventsWriter.writeValueAsString(events);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Board events could not be serialized", e);
        }
    }

    private static void sendJson(RoutingContext ctx, int statusCode, String json) {
        ctx.response()
            .setStatusCode(statusCode)
            .putHeader("content-type", "application/json")
            .end(json);
    }
}
