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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import dev.mars.pokerboard.domain.event.VoteValue;

/**
 * Jackson configuration for the board domain types.
 *
 * <p>Unit variants such as {@code VotesCleared} have no properties and serialize as
 * {@code {}}, so empty beans must be allowed. {@link VoteValue} uses its own
 * tagged form.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class PokerBoardJson {

    private PokerBoardJson() {
        // Utility class - no instantiation
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(domainModule());
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static SimpleModule domainModule() {
        SimpleModule module = new SimpleModule("pokerboard-domain");
        module.addSerializer(VoteValue.class, new VoteValueSerializer());
        module.addDeserializer(VoteValue.class, new VoteValueDeserializer());
        return module;
    }
}
