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

import com.trackhopper.ValidationResult;
import com.trackhopper.util.DistanceCalcEarth;
import com.trackhopper.util.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks how much a compressed track deviates from its original. This is an acceptance check,
 * not a proof: the caller decides what to do if a result is not valid, e.g. compress again with
 * a smaller epsilon or keep the original track.
 */
public class CompressionValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompressionValidator.class);
    private final DistanceCalcEarth calc;

    public CompressionValidator() {
        this(DistanceCalcEarth.DIST_EARTH);
    }

    public CompressionValidator(DistanceCalcEarth calc) {
        this.calc = calc;
    }

    public ValidationResult validate(List<Sample> original, List<Sample> compressed) {
        double originalGain = calcElevationGain(original);
        double elevationGainError = Math.abs(originalGain - calcElevationGain(compressed));

        double originalDistance = calcDistance(original);
        double distanceError = Math.abs(originalDistance - calcDistance(compressed));

        ValidationResult result = new ValidationResult(elevationGainError, toPercentage(elevationGainError, originalGain),
                distanceError, toPercentage(distanceError, originalDistance));
        if (!result.isValid())
            LOGGER.warn("Compressed track of " + compressed.size() + " samples (original " + original.size() + ") "
                    + "exceeds the acceptance limits, " + result);
        return result;
    }

    /**
     * @return the sum of all positive best altitude differences of consecutive samples in meter
     */
    public double calcElevationGain(List<Sample> samples) {
        double gain = 0;
        for (int i = 1; i < samples.size(); i++) {
            double change = samples.get(i - 1).calcElevationChange(samples.get(i));
            if (change > 0)
                gain += change;
        }
        return gain;
    }

    /**
     * @return the sum of all negative best altitude differences of consecutive samples as positive
     * value in meter
     */
    public double calcElevationLoss(List<Sample> samples) {
        double loss = 0;
        for (int i = 1; i < samples.size(); i++) {
            double change = samples.get(i - 1).calcElevationChange(samples.get(i));
            if (change < 0)
                loss -= change;
        }
        return loss;
    }

    /**
     * @return the horizontal length of the track in meter
     */
    public double calcDistance(List<Sample> samples) {
        return calc.calcDistance(samples);
    }

    /**
     * Calculates for every original sample its distance to the chord between the kept samples
     * surrounding it. Kept samples have a deviation of 0.
     *
     * @param keptIndices strictly increasing indices into <code>samples</code>
     */
    public double[] calcDeviations(List<Sample> samples, int[] keptIndices) {
        double[] deviations = new double[samples.size()];
        for (int k = 1; k < keptIndices.length; k++) {
            int left = keptIndices[k - 1];
            int right = keptIndices[k];
            if (left >= right)
                throw new IllegalArgumentException("kept indices must be strictly increasing, " + left + " >= " + right);

            Sample leftSample = samples.get(left);
            Sample rightSample = samples.get(right);
            for (int i = left + 1; i < right; i++) {
                deviations[i] = calc.calcPerpendicularDist(samples.get(i), leftSample, rightSample);
            }
        }
        return deviations;
    }

    /**
     * @return the largest deviation of a discarded sample in meter, see {@link #calcDeviations}
     */
    public double calcMaxDeviation(List<Sample> samples, int[] keptIndices) {
        double max = 0;
        for (double deviation : calcDeviations(samples, keptIndices)) {
            max = Math.max(max, deviation);
        }
        return max;
    }

    private static double toPercentage(double error, double total) {
        return total > 0 ? error / total * 100 : 0;
    }
}
