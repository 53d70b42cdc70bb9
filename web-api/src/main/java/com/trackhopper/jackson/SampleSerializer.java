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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.trackhopper.util.Sample;

import java.io.IOException;

/**
 * Writes a sample as object, optional values that are absent (NaN) are left out.
 */
class SampleSerializer extends JsonSerializer<Sample> {
    @Override
    public void serialize(Sample sample, JsonGenerator gen, SerializerProvider serializerProvider) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("time", sample.getTime());
        gen.writeNumberField("lat", sample.getLat());
        gen.writeNumberField("lon", sample.getLon());
        gen.writeNumberField("altitude", sample.getAltitude());
        writeOptional(gen, "barometric_altitude", sample.getBarometricAltitude());
        writeOptional(gen, "fused_altitude", sample.getFusedAltitude());
        writeOptional(gen, "elevation_confidence", sample.getElevationConfidence());
        writeOptional(gen, "elevation_accuracy", sample.getElevationAccuracy());
        gen.writeNumberField("horizontal_accuracy", sample.getHorizontalAccuracy());
        gen.writeNumberField("vertical_accuracy", sample.getVerticalAccuracy());
        gen.writeNumberField("speed", sample.getSpeed());
        if (sample.hasCourse())
            gen.writeNumberField("course", sample.getCourse());
        gen.writeEndObject();
    }

    private static void writeOptional(JsonGenerator gen, String name, double value) throws IOException {
        if (!Double.isNaN(value))
            gen.writeNumberField(name, value);
    }
}
