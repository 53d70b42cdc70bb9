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
package com.trackhopper.compression;

import com.carrotsearch.hppc.IntArrayList;
import com.trackhopper.CompressionRequest;
import com.trackhopper.util.AngleCalc;
import com.trackhopper.util.Sample;

import java.util.EnumSet;
import java.util.List;

/**
 * Finds the samples of a track that must be kept regardless of the geometric simplification: the
 * endpoints, significant elevation changes and extrema, turns and speed changes. All rules only
 * look at the direct neighbours of a sample, so a single pass over the track is sufficient.
 * <p>
 * Instances are cheap, create one per compression. Calling detect is thread safe as long as the
 * detector is not reconfigured concurrently.
 */
public class KeyPointDetector {
    /**
     * minimum absolute turn angle in degree
     */
    public static final double TURN_ANGLE_THRESHOLD = 30;
    /**
     * minimum speed difference between consecutive samples in m/s
     */
    public static final double SPEED_CHANGE_THRESHOLD = 2.0;

    private final AngleCalc angleCalc;
    private boolean preserveElevationChanges = true;
    private double elevationThreshold = CompressionRequest.DEFAULT_ELEVATION_THRESHOLD;

    public KeyPointDetector() {
        this(AngleCalc.ANGLE_CALC);
    }

    public KeyPointDetector(AngleCalc angleCalc) {
        this.angleCalc = angleCalc;
    }

    public KeyPointDetector setPreserveElevationChanges(boolean preserveElevationChanges) {
        this.preserveElevationChanges = preserveElevationChanges;
        return this;
    }

    /**
     * minimum elevation difference in meter
     */
    public KeyPointDetector setElevationThreshold(double elevationThreshold) {
        if (elevationThreshold < 0)
            throw new IllegalArgumentException("elevation threshold must not be negative " + elevationThreshold);

        this.elevationThreshold = elevationThreshold;
        return this;
    }

    /**
     * @return the ascending indices of all key points of the specified samples
     */
    public IntArrayList detect(List<Sample> samples) {
        IntArrayList keyPoints = new IntArrayList();
        for (int i = 0; i < samples.size(); i++) {
            if (!classify(samples, i).isEmpty())
                keyPoints.add(i);
        }
        return keyPoints;
    }

    /**
     * @return all reasons why the sample at the specified index is a key point, empty if it is none
     */
    public EnumSet<KeyPointReason> classify(List<Sample> samples, int index) {
        int size = samples.size();
        if (index < 0 || index >= size)
            throw new IllegalArgumentException("index " + index + " is out of bounds [0, " + size + ")");

        EnumSet<KeyPointReason> reasons = EnumSet.noneOf(KeyPointReason.class);
        if (index == 0 || index == size - 1)
            reasons.add(KeyPointReason.ENDPOINT);

        Sample curr = samples.get(index);
        if (index > 0) {
            Sample prev = samples.get(index - 1);
            if (Math.abs(curr.getSpeed() - prev.getSpeed()) >= SPEED_CHANGE_THRESHOLD)
                reasons.add(KeyPointReason.SPEED_CHANGE);

            if (index < size - 1) {
                Sample next = samples.get(index + 1);
                if (preserveElevationChanges)
                    addElevationReasons(prev, curr, next, reasons);

                if (Math.abs(angleCalc.calcTurnAngle(prev, curr, next)) >= TURN_ANGLE_THRESHOLD)
                    reasons.add(KeyPointReason.TURN);
            }
        }
        return reasons;
    }

    private void addElevationReasons(Sample prev, Sample curr, Sample next, EnumSet<KeyPointReason> reasons) {
        double prevEle = prev.getBestAltitude();
        double currEle = curr.getBestAltitude();
        double nextEle = next.getBestAltitude();
        boolean significant = Math.abs(currEle - prevEle) >= elevationThreshold
                || Math.abs(nextEle - currEle) >= elevationThreshold;
        if (!significant)
            return;

        reasons.add(KeyPointReason.ELEVATION_CHANGE);
        boolean localMax = currEle > prevEle && currEle > nextEle;
        boolean localMin = currEle < prevEle && currEle < nextEle;
        if (localMax || localMin)
            reasons.add(KeyPointReason.ELEVATION_EXTREMUM);
    }
}
