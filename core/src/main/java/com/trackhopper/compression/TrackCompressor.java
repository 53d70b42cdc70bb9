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
import com.trackhopper.CompressionResult;
import com.trackhopper.util.AngleCalc;
import com.trackhopper.util.DistanceCalcEarth;
import com.trackhopper.util.Helper;
import com.trackhopper.util.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

/**
 * Compresses a recorded track in two independent passes: the {@link KeyPointDetector} picks the
 * samples that matter for elevation, turns and speed, and {@link RamerDouglasPeucker} picks the
 * samples that matter for the shape. The union of both is the compressed track.
 * <p>
 * This class holds no state per track and can be shared between threads.
 */
public class TrackCompressor {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackCompressor.class);
    private final DistanceCalcEarth distCalc;
    private final AngleCalc angleCalc;
    private final ForkJoinPool pool;
    private final int parallelThreshold;

    /**
     * Creates a compressor which simplifies on the calling thread.
     */
    public TrackCompressor() {
        this(null, 0);
    }

    /**
     * @param pool              the pool used for the parallel simplification, or null
     * @param parallelThreshold sample ranges larger than this are simplified in parallel if a pool
     *                          is set. 0 disables the parallel simplification.
     */
    public TrackCompressor(ForkJoinPool pool, int parallelThreshold) {
        if (parallelThreshold < 0)
            throw new IllegalArgumentException("parallel threshold must not be negative " + parallelThreshold);

        this.distCalc = DistanceCalcEarth.DIST_EARTH;
        this.angleCalc = AngleCalc.ANGLE_CALC;
        this.pool = pool;
        this.parallelThreshold = parallelThreshold;
    }

    public CompressionResult compress(CompressionRequest request) {
        List<Sample> samples = request.getSamples();
        int size = samples.size();
        if (size <= 2) {
            LOGGER.debug("Too few samples to compress: " + size);
            int[] all = new int[size];
            for (int i = 0; i < size; i++) {
                all[i] = i;
            }
            return new CompressionResult(all, size, size, request.getEpsilon());
        }

        long start = System.nanoTime();
        IntArrayList keyPoints = createKeyPointDetector(request).detect(samples);
        IntArrayList simplified = createSimplifier(request).simplify(samples);
        int[] kept = union(size, keyPoints, simplified);
        CompressionResult result = new CompressionResult(kept, size, keyPoints.size(), request.getEpsilon());

        float millis = (System.nanoTime() - start) / 1e6f;
        LOGGER.info("Compressed track from " + size + " to " + kept.length + " samples"
                + " (" + Helper.round2(result.getCompressionRatio() * 100) + "%), key points: " + keyPoints.size()
                + ", epsilon: " + request.getEpsilon() + "m, took: " + Helper.round2(millis) + "ms");
        return result;
    }

    /**
     * Same as {@link #compress(CompressionRequest)} but returns the kept samples instead of their
     * indices.
     */
    public List<Sample> compressSamples(CompressionRequest request) {
        List<Sample> samples = request.getSamples();
        CompressionResult result = compress(request);
        List<Sample> compressed = new ArrayList<>(result.getCompressedCount());
        for (int i = 0; i < result.getCompressedCount(); i++) {
            compressed.add(samples.get(result.getKeptIndex(i)));
        }
        return compressed;
    }

    KeyPointDetector createKeyPointDetector(CompressionRequest request) {
        return new KeyPointDetector(angleCalc).
                setPreserveElevationChanges(request.isPreserveElevationChanges()).
                setElevationThreshold(request.getElevationThreshold());
    }

    RamerDouglasPeucker createSimplifier(CompressionRequest request) {
        RamerDouglasPeucker simplifier = new RamerDouglasPeucker(distCalc).setMaxDistance(request.getEpsilon());
        if (pool != null && parallelThreshold > 0)
            simplifier.setForkJoinPool(pool, parallelThreshold);
        return simplifier;
    }

    static int[] union(int size, IntArrayList first, IntArrayList second) {
        BitSet set = new BitSet(size);
        for (int i = 0; i < first.size(); i++) {
            set.set(first.get(i));
        }
        for (int i = 0; i < second.size(); i++) {
            set.set(second.get(i));
        }

        int[] result = new int[set.cardinality()];
        int index = 0;
        for (int i = set.nextSetBit(0); i >= 0; i = set.nextSetBit(i + 1)) {
            result[index++] = i;
        }
        return result;
    }
}
