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
import com.trackhopper.util.DistanceCalcEarth;
import com.trackhopper.util.Sample;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

import static com.trackhopper.compression.TrackFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class TrackCompressorTest {

    private final TrackCompressor compressor = new TrackCompressor();

    private CompressionResult compress(List<Sample> samples, double epsilon) {
        return compressor.compress(new CompressionRequest(samples).setEpsilon(epsilon));
    }

    @Test
    public void testSmallTracksAreNotCompressed() {
        for (int count = 0; count <= 2; count++) {
            CompressionResult result = compress(straightLine(count, 1), 5);
            assertEquals(count, result.getOriginalCount());
            assertEquals(count, result.getCompressedCount());
            assertEquals(1.0, result.getCompressionRatio());
            for (int i = 0; i < count; i++) {
                assertEquals(i, result.getKeptIndex(i));
            }
        }
    }

    @Test
    public void testStraightLine() {
        CompressionResult result = compress(straightLine(100, 1), 5);
        assertArrayEquals(new int[]{0, 99}, result.getKeptIndices());
        assertEquals(100, result.getOriginalCount());
        assertEquals(2, result.getCompressedCount());
        assertEquals(0.02, result.getCompressionRatio(), 1e-9);
        assertEquals(2, result.getKeyPointCount());
        assertEquals(5, result.getEpsilon());
    }

    @Test
    public void testOffsetSample() {
        CompressionResult result = compress(withOffset(straightLine(100, 1), 50, 10), 5);
        int[] kept = result.getKeptIndices();
        assertTrue(IntArrayList.from(kept).contains(50), Arrays.toString(kept));
        assertEquals(0, kept[0]);
        assertEquals(99, kept[kept.length - 1]);
        assertTrue(kept.length < 100);
    }

    @Test
    public void testElevationSpikeSurvivesAnyEpsilon() {
        List<Sample> samples = withAltitude(straightLine(100, 1), 40, 110);
        for (double epsilon : new double[]{1, 5, 50, 1000}) {
            int[] kept = compress(samples, epsilon).getKeptIndices();
            assertTrue(IntArrayList.from(kept).contains(40), "epsilon " + epsilon + ": " + Arrays.toString(kept));
        }

        CompressionResult result = compressor.compress(new CompressionRequest(samples).setEpsilon(1000).
                setPreserveElevationChanges(false));
        assertArrayEquals(new int[]{0, 99}, result.getKeptIndices());
    }

    @Test
    public void testElevationProfile() {
        double[] elevations = {10, 15, 25, 30, 20, 10};
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < elevations.length; i++) {
            samples.add(sample(i, START_LAT + i * 0.001, START_LON, elevations[i], 0));
        }

        List<Sample> compressed = compressor.compressSamples(new CompressionRequest(samples).setEpsilon(10).
                setElevationThreshold(3));
        assertTrue(compressed.size() > 2);
        assertEquals(30, compressed.stream().mapToDouble(Sample::getBestAltitude).max().getAsDouble());
        assertEquals(10, compressed.stream().mapToDouble(Sample::getBestAltitude).min().getAsDouble());

        compressed = compressor.compressSamples(new CompressionRequest(samples).setEpsilon(10).
                setPreserveElevationChanges(false));
        assertEquals(Arrays.asList(samples.get(0), samples.get(5)), compressed);
    }

    @Test
    public void testTurnSurvivesLargeEpsilon() {
        List<Sample> samples = Arrays.asList(
                sample(0, 0, 0, 10, 1),
                sample(1, 0.001, 0, 10, 1),
                sample(2, 0.001, 0.001, 10, 1));
        // Douglas-Peucker alone would drop the corner
        assertEquals(IntArrayList.from(0, 2), new RamerDouglasPeucker().setMaxDistance(1000).simplify(samples));

        CompressionResult result = compress(samples, 1000);
        assertArrayEquals(new int[]{0, 1, 2}, result.getKeptIndices());
        assertEquals(3, result.getKeyPointCount());
    }

    @Test
    public void testKeptIndicesAreStrictlyIncreasing() {
        List<Sample> samples = randomWalk(5000, 7);
        CompressionResult result = compress(samples, 3);
        int[] kept = result.getKeptIndices();
        assertEquals(0, kept[0]);
        assertEquals(samples.size() - 1, kept[kept.length - 1]);
        for (int i = 1; i < kept.length; i++) {
            assertTrue(kept[i - 1] < kept[i], "not increasing at " + i);
        }
        assertTrue(result.getCompressedCount() >= result.getKeyPointCount());
        assertTrue(result.getCompressionRatio() < 1);
    }

    @Test
    public void testRatioGrowsWithSmallerEpsilon() {
        List<Sample> samples = randomWalk(3000, 3);
        double previousRatio = 0;
        IntArrayList previous = new IntArrayList();
        for (double epsilon : new double[]{20, 10, 5, 2, 1, 0.5}) {
            CompressionResult result = compress(samples, epsilon);
            assertTrue(result.getCompressionRatio() >= previousRatio, "epsilon " + epsilon);
            IntArrayList kept = IntArrayList.from(result.getKeptIndices());
            for (int i = 0; i < previous.size(); i++) {
                assertTrue(kept.contains(previous.get(i)), "epsilon " + epsilon + " lost " + previous.get(i));
            }
            previousRatio = result.getCompressionRatio();
            previous = kept;
        }
    }

    private static IntArrayList toOriginalIndices(CompressionResult first, int[] keptOfCompressed) {
        IntArrayList result = new IntArrayList(keptOfCompressed.length);
        for (int index : keptOfCompressed) {
            result.add(first.getKeptIndex(index));
        }
        return result;
    }

    @Test
    public void testCompressingAgain() {
        List<Sample> samples = randomWalk(4000, 11);
        CompressionResult first = compress(samples, 4);
        List<Sample> compressed = new ArrayList<>();
        for (int index : first.getKeptIndices()) {
            compressed.add(samples.get(index));
        }
        IntArrayList firstKept = IntArrayList.from(first.getKeptIndices());

        // Douglas-Peucker on the compressed track finds the same samples as on the original
        IntArrayList simplified = new RamerDouglasPeucker().setMaxDistance(4).simplify(samples);
        IntArrayList simplifiedAgain = new RamerDouglasPeucker().setMaxDistance(4).simplify(compressed);
        assertEquals(simplified, toOriginalIndices(first, simplifiedAgain.toArray()));

        for (double epsilon : new double[]{4, 8}) {
            CompressionResult again = compress(compressed, epsilon);
            assertTrue(again.getCompressedCount() <= compressed.size());
            IntArrayList keptAgain = toOriginalIndices(first, again.getKeptIndices());
            assertEquals(0, keptAgain.get(0));
            assertEquals(samples.size() - 1, keptAgain.get(keptAgain.size() - 1));
            for (int i = 0; i < keptAgain.size(); i++) {
                assertTrue(firstKept.contains(keptAgain.get(i)), "epsilon " + epsilon + ", not kept before: " + keptAgain.get(i));
            }
            if (epsilon == 4) {
                for (int i = 0; i < simplified.size(); i++) {
                    assertTrue(keptAgain.contains(simplified.get(i)), "lost " + simplified.get(i));
                }
            }
        }
    }

    @Test
    public void testDeviationIsBoundedByEpsilon() {
        // no key points besides the endpoints, every removed sample is removed by Douglas-Peucker
        List<Sample> samples = arc(400, 300);
        assertEquals(IntArrayList.from(0, 399), new KeyPointDetector().detect(samples));

        for (double epsilon : new double[]{0.5, 2, 5}) {
            CompressionResult result = compress(samples, epsilon);
            assertTrue(result.getCompressedCount() < samples.size());
            double maxDeviation = new CompressionValidator().calcMaxDeviation(samples, result.getKeptIndices());
            assertTrue(maxDeviation <= epsilon, "epsilon " + epsilon + ", deviation " + maxDeviation);
        }
    }

    @Test
    public void testSamplesAreNotModified() {
        List<Sample> samples = randomWalk(500, 5);
        List<Sample> copy = new ArrayList<>(samples);
        compressor.compressSamples(new CompressionRequest(samples).setEpsilon(2));
        assertEquals(copy, samples);
    }

    @Test
    public void testParallelCompressorGivesSameResult() {
        ForkJoinPool pool = new ForkJoinPool(3);
        try {
            List<Sample> samples = randomWalk(10_000, 21);
            CompressionRequest request = new CompressionRequest(samples).setEpsilon(1.5);
            int[] expected = compressor.compress(request).getKeptIndices();
            for (int threshold : new int[]{100, 1}) {
                TrackCompressor parallel = new TrackCompressor(pool, threshold);
                assertArrayEquals(expected, parallel.compress(request).getKeptIndices(), "threshold " + threshold);
            }
        } finally {
            pool.shutdown();
        }
    }

    @Test
    public void testParallelCompressorOnLongZigzag() {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < 12_000; i++) {
            double lon = START_LON + (i % 2 == 0 ? 0 : metersToLon(20, START_LAT));
            samples.add(sample(i, START_LAT + metersToLat(i * 2), lon, 0, 1));
        }
        ForkJoinPool pool = new ForkJoinPool(2);
        try {
            CompressionResult result = new TrackCompressor(pool, 1000).compress(new CompressionRequest(samples).setEpsilon(1));
            assertEquals(samples.size(), result.getCompressedCount());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    public void testDistanceIsPreserved() {
        List<Sample> samples = arc(400, 300);
        List<Sample> compressed = compressor.compressSamples(new CompressionRequest(samples).setEpsilon(1));
        double original = DistanceCalcEarth.DIST_EARTH.calcDistance(samples);
        double simplified = DistanceCalcEarth.DIST_EARTH.calcDistance(compressed);
        // a quarter circle of 300m
        assertEquals(Math.PI / 2 * 300, original, 1);
        assertTrue(Math.abs(original - simplified) / original < 0.02);
    }

    @Test
    public void testUnion() {
        assertArrayEquals(new int[]{0, 2, 3, 5, 9}, TrackCompressor.union(10, IntArrayList.from(0, 3, 9), IntArrayList.from(0, 2, 5, 9)));
        assertArrayEquals(new int[0], TrackCompressor.union(0, new IntArrayList(), new IntArrayList()));
    }
}
