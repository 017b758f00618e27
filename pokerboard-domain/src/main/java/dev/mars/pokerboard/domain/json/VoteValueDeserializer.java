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

package dev.mars.pokerboard.domain.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import dev.mars.pokerboard.domain.event.VoteValue;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads the single-key tagged form written by {@link VoteValueSerializer}.
 */
class VoteValueDeserializer extends StdDeserializer<VoteValue> {

    VoteValueDeserializer() {
        super(VoteValue.class);
    }

    @Override
    public VoteValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node == null || !node.isObject() || node.size() != 1) {
            return context.reportInputMismatch(VoteValue.class,
                    "vote value must be an object with a single Number or String field");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        Map.Entry<String, JsonNode> field = fields.next();
        JsonNode content = field.getValue();
        switch (field.getKey()) {
            case VoteValueSerializer.NUMBER:
                if (!content.isIntegralNumber() || !content.canConvertToInt()) {
                    return context.reportInputMismatch(VoteValue.class, "vote number must be an integer");
                }
                int number = content.intValue();
                if (number < 0 || number > VoteValue.MAX_NUMBER) {
                    return context.reportInputMismatch(VoteValue.class,
                            "vote number must be between 0 and %d, was %d", VoteValue.MAX_NUMBER, number);
                }
                return VoteValue.number(number);
            case VoteValueSerializer.STRING:
                if (!content.isTextual()) {
                    return context.reportInputMismatch(VoteValue.class, "vote text must be a string");
                }
                return VoteValue.text(content.textValue());
            default:
                return context.reportInputMismatch(VoteValue.class,
                        "unknown vote value kind '%s', expected Number or String", field.getKey());
        }
    }
}
