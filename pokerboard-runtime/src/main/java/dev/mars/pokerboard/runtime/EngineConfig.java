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

package dev.mars.pokerboard.runtime;

import dev.mars.pokerboard.api.retry.NoRetry;
import dev.mars.pokerboard.api.retry.RetryStrategy;
import dev.mars.pokerboard.engine.retry.ExponentialBackoffRetryStrategy;
import dev.mars.pokerboard.engine.retry.FixedDelayRetryStrategy;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Settings for the board engine: configured vote types, command retries, the
 * sidecar and the fan-out poller.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class EngineConfig {

    /**
     * How failed command attempts are retried.
     */
    public enum RetryMode {
        NONE,
        FIXED,
        EXPONENTIAL;

        public static RetryMode parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown retry mode '" + value + "', expected one of none, fixed, exponential", e);
            }
        }
    }

    private final List<String> voteTypes;
    private final String defaultVoteType;
    private final RetryMode retryMode;
    private final Duration retryDelay;
    private final double retryMultiplier;
    private final Duration retryMaxDelay;
    private final int maxRetries;
    private final boolean rejectDivergentWrites;
    private final int sidecarPartitions;
    private final Duration pollInterval;

    private EngineConfig(Builder builder) {
        this.voteTypes = List.copyOf(builder.voteTypes);
        this.defaultVoteType = builder.defaultVoteType;
        this.retryMode = builder.retryMode;
        this.retryDelay = builder.retryDelay;
        this.retryMultiplier = builder.retryMultiplier;
        this.retryMaxDelay = builder.retryMaxDelay;
        this.maxRetries = builder.maxRetries;
        this.rejectDivergentWrites = builder.rejectDivergentWrites;
        this.sidecarPartitions = builder.sidecarPartitions;
        this.pollInterval = builder.pollInterval;
    }

    public List<String> getVoteTypes() {
        return voteTypes;
    }

    /**
     * @return The vote type used for votes cast over the WebSocket
     */
    public String getDefaultVoteType() {
        return defaultVoteType;
    }

    public RetryMode getRetryMode() {
        return retryMode;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public double getRetryMultiplier() {
        return retryMultiplier;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isRejectDivergentWrites() {
        return rejectDivergentWrites;
    }

    public int getSidecarPartitions() {
        return sidecarPartitions;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * Creates the retry strategy these settings describe.
     */
    public RetryStrategy createRetryStrategy() {
        switch (retryMode) {
            case FIXED:
                return new FixedDelayRetryStrategy(retryDelay, maxRetries);
            case EXPONENTIAL:
                return new ExponentialBackoffRetryStrategy(retryDelay, retryMultiplier, retryMaxDelay, maxRetries);
            case NONE:
            default:
                return NoRetry.INSTANCE;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Builder for EngineConfig. {@link #build()} validates the combination.
     */
    public static final class Builder {
        private List<String> voteTypes = List.of("1");
        private String defaultVoteType = "1";
        private RetryMode retryMode = RetryMode.NONE;
        private Duration retryDelay = Duration.ofMillis(100);
        private double retryMultiplier = 2.0;
        private Duration retryMaxDelay = Duration.ofSeconds(5);
        private int maxRetries = 3;
        private boolean rejectDivergentWrites = true;
        private int sidecarPartitions = 1;
        private Duration pollInterval = Duration.ofSeconds(1);

        private Builder() {}

        public Builder voteTypes(List<String> voteTypes) {
            this.voteTypes = Objects.requireNonNull(voteTypes, "voteTypes cannot be null");
            return this;
        }

        public Builder defaultVoteType(String defaultVoteType) {
            this.defaultVoteType = defaultVoteType;
            return this;
        }

        public Builder retryMode(RetryMode retryMode) {
            this.retryMode = Objects.requireNonNull(retryMode, "retryMode cannot be null");
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder retryMultiplier(double retryMultiplier) {
            this.retryMultiplier = retryMultiplier;
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder rejectDivergentWrites(boolean rejectDivergentWrites) {
            this.rejectDivergentWrites = rejectDivergentWrites;
            return this;
        }

        public Builder sidecarPartitions(int sidecarPartitions) {
            this.sidecarPartitions = sidecarPartitions;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public EngineConfig build() {
            if (voteTypes.isEmpty()) {
                throw new IllegalArgumentException("At least one vote type must be configured");
            }
            if (voteTypes.stream().anyMatch(id -> id == null || id.isBlank())) {
                throw new IllegalArgumentException("Vote type ids cannot be blank");
            }
            if (defaultVoteType == null || !voteTypes.contains(defaultVoteType)) {
                throw new IllegalArgumentException("Default vote type '" + defaultVoteType
                        + "' must be one of the configured vote types " + voteTypes);
            }
            if (retryDelay == null || retryDelay.isNegative()) {
                throw new IllegalArgumentException("Retry delay must not be negative");
            }
            if (retryMaxDelay == null || retryMaxDelay.compareTo(retryDelay) < 0) {
                throw new IllegalArgumentException("Retry max delay must not be less than the retry delay");
            }
            if (retryMultiplier < 1.0) {
                throw new IllegalArgumentException("Retry multiplier must be at least 1.0");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must not be negative");
            }
            if (sidecarPartitions < 1) {
                throw new IllegalArgumentException("Sidecar partitions must be at least 1");
            }
            if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
                throw new IllegalArgumentException("Poll interval must be positive");
            }
            return new EngineConfig(this);
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "voteTypes=" + voteTypes +
                ", defaultVoteType='" + defaultVoteType + '\'' +
                ", retryMode=" + retryMode +
                ", retryDelay=" + retryDelay +
                ", retryMultiplier=" + retryMultiplier +
                ", retryMaxDelay=" + retryMaxDelay +
                ", maxRetries=" + maxRetries +
                ", rejectDivergentWrites=" + rejectDivergentWrites +
                ", sidecarPartitions=" + sidecarPartitions +
                ", pollInterval=" + pollInterval +
                '}';
    }
}
