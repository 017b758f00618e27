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

import dev.mars.pokerboard.rest.config.ServerConfig;
import dev.mars.pokerboard.runtime.PokerBoardContext;
import dev.mars.pokerboard.runtime.PokerBoardRuntime;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the poker board server.
 *
 * Configuration is loaded with ConfigRetriever from, in rising precedence,
 * {@code conf/pokerboard.json} (optional), environment variables and system
 * properties. It is parsed and validated once into {@link ServerConfig}, the engine
 * is bootstrapped from it and the verticle is deployed with both injected.
 *
 * <pre>
 * java -Dport=9090 -jar pokerboard-rest.jar
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class StartPokerBoardServer {

    private static final Logger logger = LoggerFactory.getLogger(StartPokerBoardServer.class);

    private StartPokerBoardServer() {
        // Utility class - not instantiable
    }

    public static void main(String[] args) {
        logger.info("Starting poker board server...");

        Vertx vertx = Vertx.vertx();

        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setOptional(true)
            .setConfig(new JsonObject()
                .put("path", "conf/pokerboard.json"));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
            .setType("env")
            .setConfig(new JsonObject().put("raw-data", true));

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
            .setType("sys")
            .setConfig(new JsonObject().put("cache", false));

        ConfigRetrieverOptions retrieverOptions = new ConfigRetrieverOptions()
            .addStore(fileStore)       // Lowest priority
            .addStore(envStore)
            .addStore(sysPropsStore);  // Highest priority

        ConfigRetriever retriever = ConfigRetriever.create(vertx, retrieverOptions);

        retriever.getConfig()
            .compose(json -> {
                ServerConfig config = ServerConfig.from(json);
                logger.info("Configuration loaded: port={}, heartbeat={}", config.port(), config.heartbeat());

                PokerBoardContext engine = PokerBoardRuntime.bootstrap(config.engine());
                Runtime.getRuntime().addShutdownHook(new Thread(engine::close, "pokerboard-shutdown"));

                return vertx.deployVerticle(new PokerBoardServer(config, engine));
            })
            .onSuccess(id -> logger.info("Poker board server deployed ({}); health check at /health", id))
            .onFailure(cause -> {
                logger.error("Failed to start poker board server", cause);
                vertx.close();
                System.exit(1);
            });
    }
}
