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

import dev.mars.pokerboard.domain.event.VoteValue;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * A text frame sent by a board client. Frames are JSON objects with exactly one key:
 *
 * <pre>{@code
 * {"ParticipantVoted":{"vote":3}}
 * {"Replay":null}
 * {"ClearVotes":null}
 * }</pre>
 */
public sealed interface ClientFrame permits ClientFrame.ParticipantVoted, ClientFrame.Replay, ClientFrame.ClearVotes {

    record ParticipantVoted(int vote) implements ClientFrame {
        public ParticipantVoted {
            if (vote < 0 || vote > VoteValue.MAX_NUMBER) {
                throw new IllegalArgumentException("vote must be between 0 and " + VoteValue.MAX_NUMBER);
            }
        }
    }

    record Replay() implements ClientFrame {
    }

    record ClearVotes() implements ClientFrame {
    }

    /**
     * @throws InvalidFrameException if the text is not a known frame
     */
    static ClientFrame parse(String text) {
        JsonObject json;
        try {
            json = new JsonObject(text);
        } catch (DecodeException | ClassCastException e) {
            throw new InvalidFrameException("Frame is not a JSON object");
        }
        if (json.size() != 1) {
            throw new InvalidFrameException("Frame must have exactly one key, got " + json.fieldNames());
        }

        String type = json.fieldNames().iterator().next();
        switch (type) {
            case "ParticipantVoted":
                return new ParticipantVoted(voteOf(json.getValue(type)));
            case "Replay":
                return new Replay();
            case "ClearVotes":
                return new ClearVotes();
            default:
                throw new InvalidFrameException("Unknown frame type: " + type);
        }
    }

    private static int voteOf(Object body) {
        if (!(body instanceof JsonObject object) || !object.containsKey("vote")) {
            throw new InvalidFrameException("ParticipantVoted must carry a vote");
        }
        Object vote = object.getValue("vote");
        if (vote instanceof Integer || vote instanceof Long || vote instanceof Short || vote instanceof Byte) {
            long value = ((Number) vote).longValue();
            if (value < 0 || value > VoteValue.MAX_NUMBER) {
                throw new InvalidFrameException("vote must be between 0 and " + VoteValue.MAX_NUMBER);
            }
            return (int) value;
        }
        throw new InvalidFrameException("vote must be a whole number");
    }

    /**
     * A frame the session cannot act on. The session answers with an error frame
     * and stays open.
     */
    final class InvalidFrameException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public InvalidFrameException(String message) {
            super(message);
        }
    }
}
