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
import com.trackhopper.util.Helper;

/**
 * This class represents the global configuration for the TrackHopper class, which is typically
 * read from the 'config.yml' file of the embedding application. The values are the defaults used
 * when a track is compressed without explicit parameters.
 */
public class TrackHopperConfig {
    private double epsilon = CompressionRequest.DEFAULT_EPSILON;
    private boolean preserveElevationChanges = true;
    private double elevationThreshold = CompressionRequest.DEFAULT_ELEVATION_THRESHOLD;
    private int parallelThreshold = 0;
    private int parallelism = Runtime.getRuntime().availableProcessors();

    public TrackHopperConfig() {
    }

    public TrackHopperConfig(TrackHopperConfig otherConfig) {
        epsilon = otherConfig.epsilon;
        preserveElevationChanges = otherConfig.preserveElevationChanges;
        elevationThreshold = otherConfig.elevationThreshold;
        parallelThreshold = otherConfig.parallelThreshold;
        parallelism = otherConfig.parallelism;
    }

    public double getEpsilon() {
        return epsilon;
    }

    @JsonProperty("compression.epsilon")
    public TrackHopperConfig setEpsilon(double epsilon) {
        if (!(epsilon > 0) || !Helper.isFinite(epsilon))
            throw new IllegalArgumentException("compression.epsilon must be positive but was " + epsilon);
        this.epsilon = epsilon;
        return this;
    }

    public boolean isPreserveElevationChanges() {
        return preserveElevationChanges;
    }

    @JsonProperty("compression.preserve_elevation_changes")
    public TrackHopperConfig setPreserveElevationChanges(boolean preserveElevationChanges) {
        this.preserveElevationChanges = preserveElevationChanges;
        return this;
    }

    public double getElevationThreshold() {
        return elevationThreshold;
    }

    @JsonProperty("compression.elevation_threshold")
    public TrackHopperConfig setElevationThreshold(double elevationThreshold) {
        if (!(elevationThreshold >= 0) || !Helper.isFinite(elevationThreshold))
            throw new IllegalArgumentException("compression.elevation_threshold must not be negative but was " + elevationThreshold);
        this.elevationThreshold = elevationThreshold;
        return this;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    /**
     * Sample ranges spanning more than this are simplified with multiple threads. Any positive
     * value is used as is, 0 means never.
     */
    @JsonProperty("compression.parallel_threshold")
    public TrackHopperConfig setParallelThreshold(int parallelThreshold) {
        if (parallelThreshold < 0)
            throw new IllegalArgumentException("compression.parallel_threshold must not be negative but was " + parallelThreshold);
        this.parallelThreshold = parallelThreshold;
        return this;
    }

    public int getParallelism() {
        return parallelism;
    }

    @JsonProperty("compression.parallelism")
    public TrackHopperConfig setParallelism(int parallelism) {
        if (parallelism < 1)
            throw new IllegalArgumentException("compression.parallelism must be at least 1 but was " + parallelism);
        this.parallelism = parallelism;
        return this;
    }

    @Override
    public String toString() {
        return "compression.epsilon: " + epsilon + "\n"
                + "compression.preserve_elevation_changes: " + preserveElevationChanges + "\n"
                + "compression.elevation_threshold: " + elevationThreshold + "\n"
                + "compression.parallel_threshold: " + parallelThreshold + "\n"
                + "compression.parallelism: " + parallelism;
    }
}
