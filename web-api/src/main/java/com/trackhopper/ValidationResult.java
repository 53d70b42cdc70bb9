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
package com.trackhopper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Compares the total elevation gain and the total distance of a compressed track with its
 * original. The acceptance limits are fixed: less than 5% elevation gain error and less than 2%
 * distance error.
 */
@JsonPropertyOrder({"elevation_gain_error", "elevation_gain_error_pct", "distance_error", "distance_error_pct", "valid"})
public class ValidationResult {
    public static final double MAX_ELEVATION_GAIN_ERROR_PCT = 5.0;
    public static final double MAX_DISTANCE_ERROR_PCT = 2.0;

    private final double elevationGainError;
    private final double elevationGainErrorPct;
    private final double distanceError;
    private final double distanceErrorPct;

    public ValidationResult(double elevationGainError, double elevationGainErrorPct,
                            double distanceError, double distanceErrorPct) {
        this.elevationGainError = elevationGainError;
        this.elevationGainErrorPct = elevationGainErrorPct;
        this.distanceError = distanceError;
        this.distanceErrorPct = distanceErrorPct;
    }

    /**
     * @return absolute difference of the elevation gain in meter
     */
    @JsonProperty("elevation_gain_error")
    public double getElevationGainError() {
        return elevationGainError;
    }

    @JsonProperty("elevation_gain_error_pct")
    public double getElevationGainErrorPct() {
        return elevationGainErrorPct;
    }

    /**
     * @return absolute difference of the total distance in meter
     */
    @JsonProperty("distance_error")
    public double getDistanceError() {
        return distanceError;
    }

    @JsonProperty("distance_error_pct")
    public double getDistanceErrorPct() {
        return distanceErrorPct;
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return elevationGainErrorPct < MAX_ELEVATION_GAIN_ERROR_PCT && distanceErrorPct < MAX_DISTANCE_ERROR_PCT;
    }

    @Override
    public String toString() {
        return "elevation gain error:" + elevationGainError + "m (" + elevationGainErrorPct + "%), "
                + "distance error:" + distanceError + "m (" + distanceErrorPct + "%), valid:" + isValid();
    }
}
