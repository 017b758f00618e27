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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import dev.mars.pokerboard.domain.event.VoteValue;

import java.io.IOException;

/**
 * Writes {@code {"Number":3}} or {@code {"String":"?"}}.
 */
class VoteValueSerializer extends StdSerializer<VoteValue> {

    static final String NUMBER = "Number";
    static final String STRING = "String";

    VoteValueSerializer() {
        super(VoteValue.class);
    }

    @Override
    public void serialize(VoteValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        if (value instanceof VoteValue.Numeric numeric) {
            gen.writeNumberField(NUMBER, numeric.value());
        } else if (value instanceof VoteValue.Text text) {
            gen.writeStringField(STRING, text.value());
        }
        gen.writeEndObject();
    }
}
