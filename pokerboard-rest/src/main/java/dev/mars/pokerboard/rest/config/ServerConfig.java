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

package dev.mars.pokerboard.rest.config;

import dev.mars.pokerboard.runtime.EngineConfig;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, validated configuration for the poker board server.
 * Parsed once at bootstrap, injected into the verticle.
 *
 * Values may arrive as JSON numbers (from the config file) or as strings (from
 * environment variables and system properties); both are accepted.
 *
 * @param port           HTTP port, 0 binds an ephemeral port
 * @param heartbeat      WebSocket liveness settings
 * @param allowedOrigins CORS origins, {@code "*"} allows any
 * @param engine         Settings for the board engine
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public record ServerConfig(
        int port,
        HeartbeatConfig heartbeat,
        List<String> allowedOrigins,
        EngineConfig engine) {

    /**
     * How often sessions are pinged and how long a silent client is tolerated.
     */
    public record HeartbeatConfig(long intervalMs, long clientTimeoutMs) {

        public HeartbeatConfig {
            if (intervalMs <= 0) {
                throw new IllegalArgumentException("heartbeat intervalMs must be positive");
            }
            if (clientTimeoutMs <= intervalMs) {
                throw new IllegalArgumentException("heartbeat clientTimeoutMs must be greater than intervalMs");
            }
        }

        public static HeartbeatConfig defaults() {
            return new HeartbeatConfig(
                    1000, // intervalMs
                    5000  // clientTimeoutMs
            );
        }
    }

    public ServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535");
        }
        Objects.requireNonNull(heartbeat, "heartbeat config must not be null");
        Objects.requireNonNull(allowedOrigins, "allowedOrigins must not be null");
        Objects.requireNonNull(engine, "engine config must not be null");
        if (allowedOrigins.isEmpty()) {
            throw new IllegalArgumentException("allowedOrigins must not be empty");
        }
        allowedOrigins = List.copyOf(allowedOrigins);
    }

    public static ServerConfig defaults() {
        return new ServerConfig(8080, HeartbeatConfig.defaults(), List.of("*"), EngineConfig.defaults());
    }

    public boolean allowsAnyOrigin() {
        return allowedOrigins.contains("*");
    }

    /**
     * Parse and validate configuration from JsonObject.
     * Called once at bootstrap after ConfigRetriever merges all sources.
     *
     * <pre>{@code
     * {
     *   "port": 8080,
     *   "allowedOrigins": ["*"],
     *   "heartbeat": {"intervalMs": 1000, "clientTimeoutMs": 5000},
     *   "engine": {
     *     "voteTypes": ["1"], "defaultVoteType": "1",
     *     "retry": {"mode": "exponential", "delayMs": 100, "multiplier": 2.0, "maxDelayMs": 5000, "maxRetries": 3},
     *     "rejectDivergentWrites": true, "sidecarPartitions": 1, "pollIntervalMs": 1000
     *   }
     * }
     * }</pre>
     *
     * @param json Merged configuration from ConfigRetriever
     * @return Validated, immutable configuration
     * @throws IllegalArgumentException if validation fails
     */
    public static ServerConfig from(JsonObject json) {
        int port = (int) longValue(json, "port", 8080);

        JsonObject heartbeatJson = objectValue(json, "heartbeat");
        HeartbeatConfig heartbeat = new HeartbeatConfig(
                longValue(heartbeatJson, "intervalMs", 1000),
                longValue(heartbeatJson, "clientTimeoutMs", 5000));

        List<String> allowedOrigins = stringList(json, "allowedOrigins", List.of("*"));

        return new ServerConfig(port, heartbeat, allowedOrigins, engineFrom(objectValue(json, "engine")));
    }

    static EngineConfig engineFrom(JsonObject json) {
        EngineConfig defaults = EngineConfig.defaults();
        List<String> voteTypes = stringList(json, "voteTypes", defaults.getVoteTypes());
        JsonObject retry = objectValue(json, "retry");

        return EngineConfig.builder()
                .voteTypes(voteTypes)
                .defaultVoteType(json.getString("defaultVoteType", voteTypes.get(0)))
                .retryMode(EngineConfig.RetryMode.parse(retry.getString("mode", defaults.getRetryMode().name())))
                .retryDelay(Duration.ofMillis(longValue(retry, "delayMs", defaults.getRetryDelay().toMillis())))
                .retryMultiplier(doubleValue(retry, "multiplier", defaults.getRetryMultiplier()))
                .retryMaxDelay(Duration.ofMillis(longValue(retry, "maxDelayMs", defaults.getRetryMaxDelay().toMillis())))
                .maxRetries((int) longValue(retry, "maxRetries", defaults.getMaxRetries()))
                .rejectDivergentWrites(booleanValue(json, "rejectDivergentWrites", defaults.isRejectDivergentWrites()))
                .sidecarPartitions((int) longValue(json, "sidecarPartitions", defaults.getSidecarPartitions()))
                .pollInterval(Duration.ofMillis(longValue(json, "pollIntervalMs", defaults.getPollInterval().toMillis())))
                .build();
    }

    private static JsonObject objectValue(JsonObject json, String key) {
        Object value = json.getValue(key);
        if (value == null) {
            return new JsonObject();
        }
        if (value instanceof JsonObject object) {
            return object;
        }
        if (value instanceof String text) {
            return new JsonObject(text);
        }
        throw new IllegalArgumentException(key + " must be an object");
    }

    private static long longValue(JsonObject json, String key, long defaultValue) {
        Object value = json.getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got '" + value + "'", e);
        }
    }

    private static double doubleValue(JsonObject json, String key, double defaultValue) {
        Object value = json.getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static boolean booleanValue(JsonObject json, String key, boolean defaultValue) {
        Object value = json.getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * A list is either a JSON array or a comma separated string.
     */
    private static List<String> stringList(JsonObject json, String key, List<String> defaultValue) {
        Object value = json.getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof JsonArray array) {
            return array.stream().map(Object::toString).toList();
        }
        return Arrays.stream(value.toString().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
