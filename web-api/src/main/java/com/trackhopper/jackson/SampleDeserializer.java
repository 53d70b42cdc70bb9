/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.trackhopper.jackson;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.trackhopper.util.Sample;

import java.io.IOException;

class SampleDeserializer extends JsonDeserializer<Sample> {

    @Override
    public Sample deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException {
        JsonNode node = jp.readValueAsTree();
        if (!node.isObject())
            throw new JsonParseException(jp, "Sample must be an object but was " + node.getNodeType().name());

        for (String required : new String[]{"time", "lat", "lon", "altitude"}) {
            if (!node.hasNonNull(required))
                throw new JsonParseException(jp, "Sample is missing the required field '" + required + "'");
        }
        if (!node.get("time").canConvertToLong())
            throw new JsonParseException(jp, "Sample field 'time' must be an integer but was " + node.get("time"));

        return new Sample(node.get("time").asLong(),
                number(jp, node, "lat", Double.NaN),
                number(jp, node, "lon", Double.NaN),
                number(jp, node, "altitude", Double.NaN),
                number(jp, node, "barometric_altitude", Double.NaN),
                number(jp, node, "fused_altitude", Double.NaN),
                number(jp, node, "elevation_confidence", Double.NaN),
                number(jp, node, "elevation_accuracy", Double.NaN),
                number(jp, node, "horizontal_accuracy", 0),
                number(jp, node, "vertical_accuracy", 0),
                number(jp, node, "speed", 0),
                number(jp, node, "course", -1));
    }

    private static double number(JsonParser jp, JsonNode node, String name, double _default) throws JsonParseException {
        JsonNode value = node.get(name);
        if (value == null || value.isNull())
            return _default;
        if (!value.isNumber())
            throw new JsonParseException(jp, "Sample field '" + name + "' must be a number but was " + value);
        return value.asDouble();
    }
}
