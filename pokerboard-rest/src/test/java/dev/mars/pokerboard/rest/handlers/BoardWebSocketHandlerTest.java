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

import dev.mars.pokerboard.domain.command.BoardCommand;
import dev.mars.pokerboard.rest.PokerBoardServer;
import dev.mars.pokerboard.rest.config.ServerConfig;
import dev.mars.pokerboard.runtime.EngineConfig;
import dev.mars.pokerboard.runtime.PokerBoardContext;
import dev.mars.pokerboard.runtime.PokerBoardRuntime;
import dev.mars.pokerboard.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetSocket;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for board sessions over a real WebSocket.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
@ExtendWith(VertxExtension.class)
class BoardWebSocketHandlerTest {

    private static final Logger logger = LoggerFactory.getLogger(BoardWebSocketHandlerTest.class);

    private Vertx vertx;
    private PokerBoardContext engine;
    private PokerBoardServer server;
    private WebSocketClient wsClient;
    private NetClient netClient;
    private int port;

    /**
     * Collects every text frame a client receives.
     */
    private static final class ClientSocket {
        final WebSocket webSocket;
        final List<JsonObject> frames = new CopyOnWriteArrayList<>();

        ClientSocket(WebSocket webSocket) {
            this.webSocket = webSocket;
            webSocket.textMessageHandler(text -> frames.add(new JsonObject(text)));
        }

        void send(String frame) {
            webSocket.writeTextMessage(frame);
        }

        List<JsonObject> framesOf(String type) {
            return frames.stream().filter(frame -> frame.containsKey(type)).toList();
        }

        Optional<JsonObject> lastBoard() {
            List<JsonObject> updates = framesOf("QueryUpdated");
            return updates.isEmpty()
                    ? Optional.empty()
                    : Optional.of(updates.get(updates.size() - 1).getJsonObject("QueryUpdated"));
        }
    }

    /**
     * Upgrades a plain TCP connection and then never writes again, so pings go
     * unanswered. Server frames are unmasked and only their opcodes are tracked.
     */
    private static final class SilentSocket {
        private Buffer pending = Buffer.buffer();
        private boolean upgraded;
        volatile boolean closeFrameReceived;
        volatile boolean connectionClosed;

        SilentSocket(NetSocket socket, int port, String uri) {
            socket.handler(this::onData);
            socket.closeHandler(v -> connectionClosed = true);
            socket.write("GET " + uri + " HTTP/1.1\r\n"
                    + "Host: localhost:" + port + "\r\n"
                    + "Upgrade: websocket\r\n"
                    + "Connection: Upgrade\r\n"
                    + "Sec-WebSocket-Key: dGhlIHNhbXBsZSBub25jZQ==\r\n"
                    + "Sec-WebSocket-Version: 13\r\n\r\n");
        }

        boolean isClosedByServer() {
            return closeFrameReceived || connectionClosed;
        }

        private void onData(Buffer data) {
            pending.appendBuffer(data);
            if (!upgraded) {
                int end = pending.toString(StandardCharsets.ISO_8859_1).indexOf("\r\n\r\n");
                if (end < 0) {
                    return;
                }
                upgraded = true;
                pending = pending.getBuffer(end + 4, pending.length());
            }
            while (pending.length() >= 2) {
                int opcode = pending.getByte(0) & 0x0F;
                int length = pending.getByte(1) & 0x7F;
                int header = 2;
                if (length == 126) {
                    if (pending.length() < 4) {
                        return;
                    }
                    length = pending.getUnsignedShort(2);
                    header = 4;
                } else if (length == 127) {
                    if (pending.length() < 10) {
                        return;
                    }
                    length = (int) pending.getLong(2);
                    header = 10;
                }
                if (pending.length() < header + length) {
                    return;
                }
                if (opcode == 0x8) {
                    closeFrameReceived = true;
                }
                pending = pending.getBuffer(header + length, pending.length());
            }
        }
    }

    @BeforeEach
    void setUp(Vertx vertx, VertxTestContext testContext) {
        this.vertx = vertx;
        engine = PokerBoardRuntime.bootstrap(EngineConfig.builder()
                .pollInterval(Duration.ofMillis(50))
                .build(), new SimpleMeterRegistry());
        ServerConfig config = new ServerConfig(0, new ServerConfig.HeartbeatConfig(100, 400), List.of("*"),
                engine.getConfig());
        server = new PokerBoardServer(config, engine);
        wsClient = vertx.createWebSocketClient();

        vertx.deployVerticle(server)
            .onSuccess(id -> {
                port = server.actualPort();
                logger.info("Poker board server deployed on port {}", port);
                testContext.completeNow();
            })
            .onFailure(testContext::failNow);
    }

    @AfterEach
    void tearDown() {
        if (wsClient != null) {
            wsClient.close();
        }
        if (netClient != null) {
            netClient.close();
        }
        engine.close();
    }

    private ClientSocket connect(String uri) throws Exception {
        WebSocketConnectOptions options = new WebSocketConnectOptions()
            .setHost("localhost")
            .setPort(port)
            .setURI(uri);
        // handlers are attached on the event loop before the first frame can arrive
        return wsClient.connect(options)
                .map(ClientSocket::new)
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static List<String> names(JsonObject board) {
        return board.getJsonArray("participants").stream()
                .map(JsonObject.class::cast)
                .map(participant -> participant.getString("name"))
                .toList();
    }

    @Test
    void connect_addsParticipantAndPushesBoard() throws Exception {
        // When
        ClientSocket ann = connect("/ws/board/b1?name=Ann");

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> names(board).equals(List.of("Ann")))
                .orElse(false));
        JsonArray result = ann.framesOf("CommandResult").get(0).getJsonArray("CommandResult");
        assertTrue(result.getJsonObject(0).containsKey("ParticipantAdded"));
    }

    @Test
    void connect_withoutName_joinsAsAnonymous() throws Exception {
        ClientSocket client = connect("/ws/board/b1");

        await().atMost(5, TimeUnit.SECONDS).until(() -> client.lastBoard()
                .map(board -> names(board).equals(List.of(BoardWebSocketHandler.DEFAULT_NAME)))
                .orElse(false));
    }

    @Test
    void votes_fromTwoSessions_completeTheRound() throws Exception {
        // Given
        ClientSocket ann = connect("/ws/board/b1?name=Ann");
        ClientSocket bob = connect("/ws/board/b1?name=Bob");
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> names(board).size() == 2)
                .orElse(false));

        // When
        ann.send("{\"ParticipantVoted\":{\"vote\":3}}");
        bob.send("{\"ParticipantVoted\":{\"vote\":5}}");

        // Then
        for (ClientSocket client : List.of(ann, bob)) {
            await().atMost(5, TimeUnit.SECONDS).until(() -> client.lastBoard()
                    .map(board -> board.getBoolean("voting_complete"))
                    .orElse(false));
            JsonObject board = client.lastBoard().orElseThrow();
            assertEquals(5, board.getInteger("average"));
            assertEquals(3, board.getInteger("min"));
            assertEquals(5, board.getInteger("max"));
        }
    }

    @Test
    void clearVotes_resetsTheRound() throws Exception {
        // Given
        ClientSocket ann = connect("/ws/board/b1?name=Ann");
        ann.send("{\"ParticipantVoted\":{\"vote\":8}}");
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> board.getBoolean("voting_complete"))
                .orElse(false));

        // When
        ann.send("{\"ClearVotes\":null}");

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> !board.getBoolean("voting_complete") && !board.containsKey("average"))
                .orElse(false));
    }

    @Test
    void invalidFrame_answersErrorAndKeepsSessionOpen() throws Exception {
        // Given
        ClientSocket ann = connect("/ws/board/b1?name=Ann");

        // When
        ann.send("{\"ParticipantVoted\":{\"vote\":300}}");
        ann.send("hello");

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.framesOf("Error").size() == 2);
        assertFalse(ann.webSocket.isClosed());

        ann.send("{\"ParticipantVoted\":{\"vote\":1}}");
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> board.getBoolean("voting_complete"))
                .orElse(false));
    }

    @Test
    void replayFrame_keepsTheSameBoard() throws Exception {
        // Given
        ClientSocket ann = connect("/ws/board/b1?name=Ann");
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard().isPresent());

        // When
        ann.send("{\"Replay\":null}");
        ann.send("{\"ParticipantVoted\":{\"vote\":2}}");

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> board.getBoolean("voting_complete"))
                .orElse(false));
        assertTrue(ann.framesOf("Error").isEmpty());
    }

    @Test
    void close_removesParticipantForOthers() throws Exception {
        // Given
        ClientSocket ann = connect("/ws/board/b1?name=Ann");
        ClientSocket bob = connect("/ws/board/b1?name=Bob");
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> names(board).size() == 2)
                .orElse(false));

        // When
        bob.webSocket.close();

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> names(board).equals(List.of("Ann")))
                .orElse(false));
        assertEquals(1, engine.getBroker().subscriberCount("b1"));
    }

    @Test
    @Tag(TestCategories.SLOW)
    void silentClient_notAnsweringPings_isClosedAndRemoved() throws Exception {
        // Given
        ClientSocket ann = connect("/ws/board/b1?name=Ann");
        netClient = vertx.createNetClient();
        SilentSocket ghost = netClient.connect(port, "localhost")
                .map(socket -> new SilentSocket(socket, port, "/ws/board/b1?name=Ghost"))
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> names(board).size() == 2 && names(board).contains("Ghost"))
                .orElse(false));

        // When - no pong ever comes back, so the 400 ms client timeout elapses
        await().atMost(5, TimeUnit.SECONDS).until(ghost::isClosedByServer);

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> names(board).equals(List.of("Ann")))
                .orElse(false));
        assertEquals(1, engine.getBroker().subscriberCount("b1"));
        assertFalse(ann.webSocket.isClosed());
    }

    @Test
    @Tag(TestCategories.SLOW)
    void quietClient_answeringPings_staysConnected() throws Exception {
        // Given
        ClientSocket ann = connect("/ws/board/b1?name=Ann");

        // Then - no text frames for well past the 400 ms client timeout
        await().during(1, TimeUnit.SECONDS).atMost(3, TimeUnit.SECONDS).until(() -> !ann.webSocket.isClosed());
        assertEquals(1, engine.getBroker().subscriberCount("b1"));
    }

    @Test
    void httpCommand_isBroadcastToSessions() throws Exception {
        // Given
        ClientSocket ann = connect("/ws/board/b1?name=Ann");
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard().isPresent());

        // When
        engine.getSidecar().submit("b1", BoardCommand.addParticipant("Cleo", "p-cleo")).get(5, TimeUnit.SECONDS);

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> ann.lastBoard()
                .map(board -> names(board).contains("Cleo"))
                .orElse(false));
    }
}
