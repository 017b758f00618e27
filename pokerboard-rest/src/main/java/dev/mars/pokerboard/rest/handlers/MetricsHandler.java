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

import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.Comparator;
import java.util.Locale;

/**
 * Serves a JSON snapshot of every registered meter.
 * GET /metrics
 *
 * <pre>{@code
 * {"meters":[{"name":"pokerboard.commands.succeeded","type":"counter","tags":{},"measurements":{"count":3.0}}]}
 * }</pre>
 */
public class MetricsHandler {

    private final MeterRegistry meterRegistry;

    public MetricsHandler(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void getMetrics(RoutingContext ctx) {
        ctx.response()
            .putHeader("content-type", "application/json")
            .end(snapshot().encode());
    }

    JsonObject snapshot() {
        JsonArray meters = new JsonArray();
        meterRegistry.getMeters().stream()
            .sorted(Comparator.comparing(meter -> meter.getId().getName()))
            .forEach(meter -> meters.add(toJson(meter)));
        return new JsonObject().put("meters", meters);
    }

    private static JsonObject toJson(Meter meter) {
        JsonObject tags = new JsonObject();
        for (Tag tag : meter.getId().getTags()) {
            tags.put(tag.getKey(), tag.getValue());
        }
        JsonObject measurements = new JsonObject();
        for (Measurement measurement : meter.measure()) {
            double value = measurement.getValue();
            // NaN is not valid JSON
            measurements.put(measurement.getStatistic().getTagValueRepresentation(), Double.isNaN(value) ? null : value);
        }
        return new JsonObject()
            .put("name", meter.getId().getName())
            .put("type", meter.getId().getType().name().toLowerCase(Locale.ROOT))
            .put("tags", tags)
            .put("measurements", measurements);
    }
}
