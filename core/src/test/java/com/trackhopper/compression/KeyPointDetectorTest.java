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
import com.trackhopper.util.Sample;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static com.trackhopper.compression.TrackFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class KeyPointDetectorTest {

    private final KeyPointDetector detector = new KeyPointDetector();

    @Test
    public void testEndpoints() {
        assertEquals(IntArrayList.from(0, 99), detector.detect(straightLine(100, 1)));
        assertEquals(IntArrayList.from(0), detector.detect(straightLine(1, 1)));
        assertEquals(new IntArrayList(), detector.detect(new ArrayList<>()));
        assertEquals(EnumSet.of(KeyPointReason.ENDPOINT), detector.classify(straightLine(1, 1), 0));
    }

    @Test
    public void testElevationSpike() {
        List<Sample> samples = withAltitude(straightLine(100, 1), 40, 110);
        // the neighbours differ by 10m from the spike as well
        assertEquals(IntArrayList.from(0, 39, 40, 41, 99), detector.detect(samples));
        assertEquals(EnumSet.of(KeyPointReason.ELEVATION_CHANGE, KeyPointReason.ELEVATION_EXTREMUM),
                detector.classify(samples, 40));
        assertEquals(EnumSet.of(KeyPointReason.ELEVATION_CHANGE), detector.classify(samples, 39));

        detector.setPreserveElevationChanges(false);
        assertEquals(IntArrayList.from(0, 99), detector.detect(samples));
    }

    @Test
    public void testElevationNoiseIsIgnored() {
        List<Sample> samples = straightLine(10, 5);
        samples = withAltitude(samples, 3, 101.5);
        samples = withAltitude(samples, 6, 98.5);
        assertEquals(IntArrayList.from(0, 9), detector.detect(samples));

        detector.setElevationThreshold(1.5);
        assertEquals(IntArrayList.from(0, 2, 3, 4, 5, 6, 7, 9), detector.detect(samples));
    }

    @Test
    public void testElevationUsesBestAltitude() {
        List<Sample> samples = new ArrayList<>(straightLine(5, 10));
        // raw altitude jumps, but the confident fused altitude is flat
        samples.set(2, withAltitude(samples, 2, 150).get(2).withFusedAltitude(100, 0.9));
        assertEquals(IntArrayList.from(0, 4), detector.detect(samples));

        // low confidence: the barometric altitude is used
        samples.set(2, samples.get(2).withFusedAltitude(100, 0.2).withBarometricAltitude(104));
        assertEquals(IntArrayList.from(0, 1, 2, 3, 4), detector.detect(samples));
    }

    @Test
    public void testTurn() {
        List<Sample> samples = Arrays.asList(
                sample(0, 0, 0, 10, 1),
                sample(1, 0.001, 0, 10, 1),
                sample(2, 0.001, 0.001, 10, 1));
        assertEquals(IntArrayList.from(0, 1, 2), detector.detect(samples));
        assertEquals(EnumSet.of(KeyPointReason.TURN), detector.classify(samples, 1));
    }

    @Test
    public void testSlightBendIsNoTurn() {
        // 20 degree to the east
        double lat = 0.001 + 0.001 * Math.cos(Math.toRadians(20));
        double lon = 0.001 * Math.sin(Math.toRadians(20));
        List<Sample> samples = Arrays.asList(
                sample(0, 0, 0, 10, 1),
                sample(1, 0.001, 0, 10, 1),
                sample(2, lat, lon, 10, 1));
        assertTrue(detector.classify(samples, 1).isEmpty());
    }

    @Test
    public void testSpeedChange() {
        double[] speeds = {1, 1, 1, 5, 5, 1, 1};
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < speeds.length; i++) {
            samples.add(sample(i, START_LAT + i * 0.001, START_LON, 10, speeds[i]));
        }
        assertEquals(IntArrayList.from(0, 3, 5, 6), detector.detect(samples));
        assertEquals(EnumSet.of(KeyPointReason.SPEED_CHANGE), detector.classify(samples, 3));
        assertEquals(EnumSet.of(KeyPointReason.ENDPOINT), detector.classify(samples, 6));

        // 1.9 m/s is below the threshold
        samples.set(3, samples.get(3).withSpeed(2.9));
        samples.set(4, samples.get(4).withSpeed(2.9));
        assertEquals(IntArrayList.from(0, 6), detector.detect(samples));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> detector.setElevationThreshold(-1));
        assertThrows(IllegalArgumentException.class, () -> detector.classify(straightLine(3, 1), 3));
    }
}
