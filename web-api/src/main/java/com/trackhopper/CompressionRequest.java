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

import com.trackhopper.util.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request object to compress one recorded track with TrackHopper.
 * <p>
 * The request keeps a read-only copy of the samples, so later changes to the list passed to the
 * constructor do not affect it.
 */
public class CompressionRequest {
    public static final double DEFAULT_EPSILON = 5.0;
    public static final double DEFAULT_ELEVATION_THRESHOLD = 2.0;

    private final List<Sample> samples;
    private double epsilon = DEFAULT_EPSILON;
    private boolean preserveElevationChanges = true;
    private double elevationThreshold = DEFAULT_ELEVATION_THRESHOLD;

    public CompressionRequest(List<Sample> samples) {
        if (samples == null)
            throw new IllegalArgumentException("samples cannot be null");

        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public List<Sample> getSamples() {
        return samples;
    }

    public double getEpsilon() {
        return epsilon;
    }

    /**
     * Maximum perpendicular distance in meter a discarded sample may have from the simplified track.
     */
    public CompressionRequest setEpsilon(double epsilon) {
        if (!(epsilon > 0) || Double.isInfinite(epsilon))
            throw new IllegalArgumentException("epsilon must be a positive number but was " + epsilon);

        this.epsilon = epsilon;
        return this;
    }

    public boolean isPreserveElevationChanges() {
        return preserveElevationChanges;
    }

    public CompressionRequest setPreserveElevationChanges(boolean preserveElevationChanges) {
        this.preserveElevationChanges = preserveElevationChanges;
        return this;
    }

    public double getElevationThreshold() {
        return elevationThreshold;
    }

    /**
     * Minimum elevation difference in meter to a neighbouring sample that forces a sample to be kept.
     */
    public CompressionRequest setElevationThreshold(double elevationThreshold) {
        if (!(elevationThreshold >= 0) || Double.isInfinite(elevationThreshold))
            throw new IllegalArgumentException("elevation threshold must not be negative but was " + elevationThreshold);

        this.elevationThreshold = elevationThreshold;
        return this;
    }

    @Override
    public String toString() {
        return "samples:" + samples.size() + ", epsilon:" + epsilon
                + ", preserve_elevation_changes:" + preserveElevationChanges
                + ", elevation_threshold:" + elevationThreshold;
    }
}
