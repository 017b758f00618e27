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

package dev.mars.pokerboard.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pokerboard.domain.json.PokerBoardJson;
import dev.mars.pokerboard.rest.config.ServerConfig;
import dev.mars.pokerboard.rest.handlers.BoardHandler;
import dev.mars.pokerboard.rest.handlers.BoardWebSocketHandler;
import dev.mars.pokerboard.rest.handlers.MetricsHandler;
import dev.mars.pokerboard.runtime.PokerBoardContext;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Vert.x verticle serving the poker board over HTTP and WebSocket.
 *
 * Routes:
 * <ul>
 *   <li>{@code POST /board/:boardId} executes a command</li>
 *   <li>{@code GET /board/:boardId} returns the board presentation</li>
 *   <li>{@code GET /board/:boardId/events} returns the raw event log</li>
 *   <li>{@code GET /health} and {@code GET /metrics}</li>
 *   <li>{@code /ws/board/:boardId?name=} opens a live session</li>
 * </ul>
 *
 * The engine is injected by the deploying application and is not closed by the
 * verticle.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PokerBoardServer extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(PokerBoardServer.class);

    private final ServerConfig config;
    private final PokerBoardContext engine;
    private final ObjectMapper objectMapper;

    private HttpServer server;
    private BoardWebSocketHandler webSocketHandler;

    /**
     * @param config Server configuration
     * @param engine The running board engine (required)
     */
    public PokerBoardServer(ServerConfig config, PokerBoardContext engine) {
        this.config = Objects.requireNonNull(config, "ServerConfig must be provided");
        this.engine = Objects.requireNonNull(engine, "PokerBoardContext must be provided");
        this.objectMapper = PokerBoardJson.createObjectMapper();
    }

    @Override
    public void start(Promise<Void> startPromise) {
        webSocketHandler = new BoardWebSocketHandler(vertx, engine, objectMapper, config.heartbeat());

        Future.succeededFuture(createRouter())
                .compose(router -> vertx.createHttpServer()
                        .requestHandler(router)
                        .webSocketHandler(webSocket -> {
                            if (BoardWebSocketHandler.handles(webSocket.path())) {
                                webSocketHandler.handleBoardStream(webSocket);
                            } else {
                                logger.debug("Closing WebSocket on unknown path {}", webSocket.path());
                                webSocket.close();
                            }
                        })
                        .listen(config.port()))
                .compose(httpServer -> {
                    server = httpServer;
                    logger.info("Poker board server started on port {}", httpServer.actualPort());
                    return Future.<Void>succeededFuture();
                })
                .onSuccess(v -> startPromise.complete())
                .onFailure(cause -> {
                    logger.error("Failed to start poker board server", cause);
                    startPromise.fail(cause);
                });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping poker board server - closing sessions first");
        if (webSocketHandler != null) {
            webSocketHandler.closeAll();
        }

        if (server != null) {
            server.close()
                .onSuccess(v -> {
                    logger.info("Poker board server stopped");
                    stopPromise.complete();
                })
                .onFailure(cause -> {
                    logger.error("Failed to stop poker board server", cause);
                    stopPromise.fail(cause);
                });
        } else {
            stopPromise.complete();
        }
    }

    /**
     * @return The bound port, useful when the configured port is 0
     */
    public int actualPort() {
        return server != null ? server.actualPort() : -1;
    }

    private Router createRouter() {
        Router router = Router.router(vertx);

        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());
        router.route().handler(createCorsHandler());

        BoardHandler boardHandler = new BoardHandler(engine, objectMapper);
        MetricsHandler metricsHandler = new MetricsHandler(engine.getMeterRegistry());

        router.post("/board/:boardId").handler(boardHandler::executeCommand);
        router.get("/board/:boardId").handler(boardHandler::getBoard);
        router.get("/board/:boardId/events").handler(boardHandler::getEvents);

        router.get("/health").handler(ctx -> {
            ctx.response()
                    .putHeader("content-type", "application/json")
                    .end("{\"status\":\"UP\",\"service\":\"pokerboard\"}");
        });
        router.get("/metrics").handler(metricsHandler::getMetrics);

        return router;
    }

    private CorsHandler createCorsHandler() {
        CorsHandler cors = CorsHandler.create();
        if (!config.allowsAnyOrigin()) {
            cors.addOrigins(config.allowedOrigins());
        }
        return cors
                .allowedMethod(HttpMethod.GET)
                .allowedMethod(HttpMethod.POST)
                .allowedMethod(HttpMethod.OPTIONS)
                .allowedHeader("Content-Type");
    }
}
