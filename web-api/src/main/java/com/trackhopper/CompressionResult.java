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

import java.util.Arrays;

/**
 * The outcome of a compression: the ascending indices of the samples that were kept plus some
 * statistics.
 */
@JsonPropertyOrder({"original_count", "compressed_count", "compression_ratio", "key_point_count", "epsilon", "kept_indices"})
public class CompressionResult {
    private final int[] keptIndices;
    private final int originalCount;
    private final int keyPointCount;
    private final double epsilon;

    public CompressionResult(int[] keptIndices, int originalCount, int keyPointCount, double epsilon) {
        if (keptIndices.length > originalCount)
            throw new IllegalArgumentException("Cannot keep " + keptIndices.length + " of " + originalCount + " samples");

        this.keptIndices = keptIndices;
        this.originalCount = originalCount;
        this.keyPointCount = keyPointCount;
        this.epsilon = epsilon;
    }

    /**
     * @return a copy of the strictly increasing indices into the original samples
     */
    @JsonProperty("kept_indices")
    public int[] getKeptIndices() {
        return keptIndices.clone();
    }

    public int getKeptIndex(int index) {
        return keptIndices[index];
    }

    @JsonProperty("original_count")
    public int getOriginalCount() {
        return originalCount;
    }

    @JsonProperty("compressed_count")
    public int getCompressedCount() {
        return keptIndices.length;
    }

    /**
     * @return compressed count divided by original count, 1 for an empty track
     */
    @JsonProperty("compression_ratio")
    public double getCompressionRatio() {
        if (originalCount == 0)
            return 1;
        return (double) keptIndices.length / originalCount;
    }

    /**
     * @return the number of samples that had to be kept for elevation, turn or speed reasons
     * (including the endpoints)
     */
    @JsonProperty("key_point_count")
    public int getKeyPointCount() {
        return keyPointCount;
    }

    @JsonProperty("epsilon")
    public double getEpsilon() {
        return epsilon;
    }

    @Override
    public String toString() {
        return "original:" + originalCount + ", compressed:" + keptIndices.length + ", key points:" + keyPointCount
                + ", epsilon:" + epsilon + ", kept:" + Arrays.toString(keptIndices);
    }
}
