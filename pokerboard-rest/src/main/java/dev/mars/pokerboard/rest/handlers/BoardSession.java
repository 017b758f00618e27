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
import dev.mars.pokerboard.domain.command.BoardCommand;
import dev.mars.pokerboard.domain.event.BoardModifiedEvent;
import dev.mars.pokerboard.domain.event.VoteValue;
import dev.mars.pokerboard.domain.query.BoardPresentation;
import dev.mars.pokerboard.domain.query.BoardView;
import dev.mars.pokerboard.engine.sidecar.CommandOutcome;
import dev.mars.pokerboard.fanout.BoardReplay;
import dev.mars.pokerboard.fanout.BoardSubscriber;
import dev.mars.pokerboard.fanout.BoardUpdate;
import dev.mars.pokerboard.fanout.SessionProjection;
import dev.mars.pokerboard.rest.config.ServerConfig;
import dev.mars.pokerboard.runtime.PokerBoardContext;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One participant's connection to a board.
 *
 * <p>The session is owned by the event-loop context that accepted the socket. Broker
 * deliveries and sidecar replies arrive on other threads and are handed to that
 * context before they touch any session state.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #open()} subscribes to the board, asks for a replay and adds the
 *       participant.</li>
 *   <li>Client frames become commands; their outcomes are echoed back. The board
 *       presentation is pushed whenever it differs from the last one sent.</li>
 *   <li>{@link #close(String)} cancels the timers, leaves the broker and removes
 *       the participant.</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class BoardSession implements BoardSubscriber<BoardModifiedEvent> {

    private static final Logger logger = LoggerFactory.getLogger(BoardSession.class);

    private final String sessionId;
    private final String boardId;
    private final String participantName;
    private final ServerWebSocket webSocket;
    private final Vertx vertx;
    private final Context context;
    private final PokerBoardContext engine;
    private final ObjectMapper objectMapper;
    private final ObjectWriter eventsWriter;
    private final ServerConfig.HeartbeatConfig heartbeat;
    private final Runnable onClosed;
    private final SessionProjection<BoardModifiedEvent, BoardView> projection =
            new SessionProjection<>(BoardView::new);

    private volatile boolean closed;
    private BoardPresentation lastSent;
    private long lastActivity;
    private long heartbeatTimer = -1;

    BoardSession(String sessionId, String boardId, String participantName, ServerWebSocket webSocket,
                 Vertx vertx, PokerBoardContext engine, ObjectMapper objectMapper,
                 ServerConfig.HeartbeatConfig heartbeat, Runnable onClosed) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId cannot be null");
        this.boardId = Objects.requireNonNull(boardId, "boardId cannot be null");
        this.participantName = Objects.requireNonNull(participantName, "participantName cannot be null");
        this.webSocket = Objects.requireNonNull(webSocket, "webSocket cannot be null");
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.context = vertx.getOrCreateContext();
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.eventsWriter = objectMapper.writerFor(new TypeReference<List<BoardModifiedEvent>>() {});
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat cannot be null");
        this.onClosed = Objects.requireNonNull(onClosed, "onClosed cannot be null");
    }

    /**
     * Wires the socket handlers and joins the board. Must run on the socket's context.
     */
    void open() {
        lastActivity = System.currentTimeMillis();

        webSocket.textMessageHandler(this::handleText);
        webSocket.binaryMessageHandler(buffer -> sendError("Binary messages are not supported"));
        webSocket.pongHandler(buffer -> touch());
        webSocket.exceptionHandler(cause -> logger.warn("WebSocket error in session {}: {}", sessionId, cause.getMessage()));
        webSocket.closeHandler(v -> close("client closed"));

        heartbeatTimer = vertx.setPeriodic(heartbeat.intervalMs(), id -> checkHeartbeat());

        engine.getBroker().connect(sessionId, boardId, this);
        engine.getBroker().replayOnto(boardId, this);
        submit(BoardCommand.addParticipant(participantName, sessionId));
        engine.getPoller().signal();

        logger.info("Session {} ({}) joined board {}", sessionId, participantName, boardId);
    }

    // Broker callbacks, on the poller's thread

    @Override
    public void onUpdate(BoardUpdate<BoardModifiedEvent> update) {
        context.runOnContext(v -> {
            if (closed) {
                return;
            }
            if (projection.onUpdate(update)) {
                pushPresentation();
            }
            requestResyncIfNeeded();
        });
    }

    @Override
    public void onReplay(BoardReplay<BoardModifiedEvent> replay) {
        context.runOnContext(v -> {
            if (!closed) {
                logger.debug("Session {} replaying {} event(s) of board {}", sessionId, replay.events().size(), boardId);
                if (projection.onReplay(replay)) {
                    pushPresentation();
                }
                requestResyncIfNeeded();
            }
        });
    }

    private void requestResyncIfNeeded() {
        if (projection.takeResyncRequest()) {
            logger.info("Session {} missed updates of board {}, requesting replay", sessionId, boardId);
            engine.getBroker().replayOnto(boardId, this);
        }
    }

    @Override
    public boolean isOpen() {
        return !closed;
    }

    private void handleText(String text) {
        touch();
        logger.trace("Session {} received frame {}", sessionId, text);

        ClientFrame frame;
        try {
            frame = ClientFrame.parse(text);
        } catch (ClientFrame.InvalidFrameException e) {
            logger.debug("Session {} sent an invalid frame: {}", sessionId, e.getMessage());
            sendError(e.getMessage());
            return;
        }

        if (frame instanceof ClientFrame.ParticipantVoted voted) {
            submit(BoardCommand.vote(VoteValue.number(voted.vote()),
                    engine.getConfig().getDefaultVoteType(), sessionId));
        } else if (frame instanceof ClientFrame.ClearVotes) {
            submit(BoardCommand.clearVotes());
        } else if (frame instanceof ClientFrame.Replay) {
            engine.getBroker().replayOnto(boardId, this);
        }
    }

    private void submit(BoardCommand command) {
        engine.getSidecar().send(boardId, command, outcome -> context.runOnContext(v -> handleOutcome(outcome)));
    }

    private void handleOutcome(CommandOutcome<BoardModifiedEvent> outcome) {
        if (outcome instanceof CommandOutcome.CommandResult<BoardModifiedEvent> result) {
            if (!result.events().isEmpty()) {
                engine.getPoller().signal();
            }
            try {
                send(new JsonObject().put("CommandResult", new JsonArray(eventsWriter.writeValueAsString(result.events()))));
            } catch (JsonProcessingException e) {
                logger.error("Failed to render command result for session {}", sessionId, e);
                sendError("Failed to render command result");
            }
        } else if (outcome instanceof CommandOutcome.CommandError<BoardModifiedEvent> error) {
            sendError(error.message());
        }
    }

    private void pushPresentation() {
        projection.getState().ifPresent(view -> {
            BoardPresentation presentation = view.present();
            if (presentation.equals(lastSent)) {
                return;
            }
            try {
                send(new JsonObject().put("QueryUpdated", new JsonObject(objectMapper.writeValueAsString(presentation))));
                lastSent = presentation;
            } catch (JsonProcessingException e) {
                logger.error("Failed to render board {} for session {}", boardId, sessionId, e);
            }
        });
    }

    private void sendError(String message) {
        send(new JsonObject().put("Error", message));
    }

    private void send(JsonObject frame) {
        if (closed) {
            return;
        }
        webSocket.writeTextMessage(frame.encode())
                .onFailure(cause -> logger.debug("Session {} dropped a frame: {}", sessionId, cause.getMessage()));
    }

    private void touch() {
        lastActivity = System.currentTimeMillis();
    }

    private void checkHeartbeat() {
        if (closed) {
            return;
        }
        long silentFor = System.currentTimeMillis() - lastActivity;
        if (silentFor > heartbeat.clientTimeoutMs()) {
            logger.info("Session {} silent for {} ms, closing", sessionId, silentFor);
            close("heartbeat timeout");
            return;
        }
        webSocket.writePing(Buffer.buffer())
                .onFailure(cause -> logger.debug("Ping to session {} failed: {}", sessionId, cause.getMessage()));
    }

    /**
     * Leaves the board. Safe to call more than once.
     */
    void close(String reason) {
        if (closed) {
            return;
        }
        closed = true;
        if (heartbeatTimer != -1) {
            vertx.cancelTimer(heartbeatTimer);
        }
        engine.getBroker().disconnect(sessionId);
        engine.getSidecar().send(boardId, BoardCommand.removeParticipant(sessionId), outcome -> {
            if (outcome instanceof CommandOutcome.CommandResult) {
                engine.getPoller().signal();
            }
        });
        if (!webSocket.isClosed()) {
            webSocket.close();
        }
        onClosed.run();
        logger.info("Session {} left board {} ({})", sessionId, boardId, reason);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getBoardId() {
        return boardId;
    }
}
