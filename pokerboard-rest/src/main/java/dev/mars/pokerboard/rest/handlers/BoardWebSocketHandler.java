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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pokerboard.rest.config.ServerConfig;
import dev.mars.pokerboard.runtime.PokerBoardContext;
import io.micrometer.core.instrument.Gauge;
import io.vertx.core.Vertx;
import io.vertx.core.http.ServerWebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for live boards.
 *
 * WebSocket URL: /ws/board/{boardId}?name={displayName}
 *
 * Each accepted socket becomes a {@link BoardSession} whose participant id is a
 * fresh UUID. Sessions are tracked for the {@code pokerboard.sessions.active} gauge
 * and closed together on shutdown.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class BoardWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(BoardWebSocketHandler.class);

    public static final String PATH_PREFIX = "/ws/board/";
    public static final String DEFAULT_NAME = "Anonymous";

    private final Vertx vertx;
    private final PokerBoardContext engine;
    private final ObjectMapper objectMapper;
    private final ServerConfig.HeartbeatConfig heartbeat;
    private final Map<String, BoardSession> activeSessions = new ConcurrentHashMap<>();

    public BoardWebSocketHandler(Vertx vertx, PokerBoardContext engine, ObjectMapper objectMapper,
                                 ServerConfig.HeartbeatConfig heartbeat) {
        this.vertx = vertx;
        this.engine = engine;
        this.objectMapper = objectMapper;
        this.heartbeat = heartbeat;

        Gauge.builder("pokerboard.sessions.active", activeSessions, Map::size)
            .description("Open board WebSocket sessions")
            .register(engine.getMeterRegistry());
    }

    public static boolean handles(String path) {
        return path != null && path.startsWith(PATH_PREFIX);
    }

    /**
     * Handles WebSocket connections for a board.
     */
    public void handleBoardStream(ServerWebSocket webSocket) {
        Optional<String> boardId = boardIdOf(webSocket.path());
        if (boardId.isEmpty()) {
            logger.debug("Closing WebSocket with malformed path {}", webSocket.path());
            webSocket.close((short) 1008, "Expected " + PATH_PREFIX + "{boardId}");
            return;
        }

        String sessionId = UUID.randomUUID().toString();
        String name = queryParam(webSocket.query(), "name").orElse(DEFAULT_NAME);

        BoardSession session = new BoardSession(sessionId, boardId.get(), name, webSocket, vertx, engine,
            objectMapper, heartbeat, () -> activeSessions.remove(sessionId));
        activeSessions.put(sessionId, session);
        session.open();
    }

    static Optional<String> boardIdOf(String path) {
        if (!handles(path)) {
            return Optional.empty();
        }
        String boardId = path.substring(PATH_PREFIX.length());
        if (boardId.isEmpty() || boardId.contains("/")) {
            return Optional.empty();
        }
        return Optional.of(URLDecoder.decode(boardId, StandardCharsets.UTF_8));
    }

    static Optional<String> queryParam(String query, String key) {
        if (query == null || query.isEmpty()) {
            return Optional.empty();
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            if (URLDecoder.decode(name, StandardCharsets.UTF_8).equals(key)) {
                String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                return value.isBlank() ? Optional.empty() : Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    /**
     * Closes every open session.
     */
    public void closeAll() {
        logger.info("Closing {} board session(s)", activeSessions.size());
        activeSessions.values().forEach(session -> session.close("server stopping"));
        activeSessions.clear();
    }
}
