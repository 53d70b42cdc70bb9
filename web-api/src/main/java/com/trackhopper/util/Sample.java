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
package com.trackhopper.util;

/**
 * One timestamped reading of a recorded track: position, several altitude estimates, accuracy,
 * speed and course. Instances are immutable, the with* methods return modified copies.
 * <p>
 * Optional values (barometric altitude, fused altitude, elevation confidence and elevation
 * accuracy) are NaN when absent. A negative or NaN course means 'unknown'.
 */
public class Sample {
    /**
     * Minimum confidence a fused altitude needs before it is preferred over the other estimates.
     */
    public static final double MIN_FUSED_CONFIDENCE = 0.5;

    private final long time;
    private final double lat;
    private final double lon;
    private final double altitude;
    private final double barometricAltitude;
    private final double fusedAltitude;
    private final double elevationConfidence;
    private final double elevationAccuracy;
    private final double horizontalAccuracy;
    private final double verticalAccuracy;
    private final double speed;
    private final double course;

    public Sample(long time, double lat, double lon, double altitude) {
        this(time, lat, lon, altitude, 0, 0, 0, -1);
    }

    public Sample(long time, double lat, double lon, double altitude,
                  double horizontalAccuracy, double verticalAccuracy, double speed, double course) {
        this(time, lat, lon, altitude, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                horizontalAccuracy, verticalAccuracy, speed, course);
    }

    public Sample(long time, double lat, double lon, double altitude,
                  double barometricAltitude, double fusedAltitude, double elevationConfidence, double elevationAccuracy,
                  double horizontalAccuracy, double verticalAccuracy, double speed, double course) {
        this.time = time;
        this.lat = lat;
        this.lon = lon;
        this.altitude = altitude;
        this.barometricAltitude = barometricAltitude;
        this.fusedAltitude = fusedAltitude;
        this.elevationConfidence = elevationConfidence;
        this.elevationAccuracy = elevationAccuracy;
        this.horizontalAccuracy = horizontalAccuracy;
        this.verticalAccuracy = verticalAccuracy;
        this.speed = speed;
        this.course = course;
    }

    public Sample withBarometricAltitude(double barometricAltitude) {
        return new Sample(time, lat, lon, altitude, barometricAltitude, fusedAltitude, elevationConfidence,
                elevationAccuracy, horizontalAccuracy, verticalAccuracy, speed, course);
    }

    public Sample withFusedAltitude(double fusedAltitude, double elevationConfidence) {
        return new Sample(time, lat, lon, altitude, barometricAltitude, fusedAltitude, elevationConfidence,
                elevationAccuracy, horizontalAccuracy, verticalAccuracy, speed, course);
    }

    public Sample withElevationAccuracy(double elevationAccuracy) {
        return new Sample(time, lat, lon, altitude, barometricAltitude, fusedAltitude, elevationConfidence,
                elevationAccuracy, horizontalAccuracy, verticalAccuracy, speed, course);
    }

    public Sample withSpeed(double speed) {
        return new Sample(time, lat, lon, altitude, barometricAltitude, fusedAltitude, elevationConfidence,
                elevationAccuracy, horizontalAccuracy, verticalAccuracy, speed, course);
    }

    /**
     * @return milliseconds since epoch
     */
    public long getTime() {
        return time;
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }

    /**
     * @return the altitude in meter as reported by the positioning device
     */
    public double getAltitude() {
        return altitude;
    }

    public double getBarometricAltitude() {
        return barometricAltitude;
    }

    public boolean hasBarometricAltitude() {
        return !Double.isNaN(barometricAltitude);
    }

    public double getFusedAltitude() {
        return fusedAltitude;
    }

    public boolean hasFusedAltitude() {
        return !Double.isNaN(fusedAltitude);
    }

    public double getElevationConfidence() {
        return elevationConfidence;
    }

    public double getElevationAccuracy() {
        return elevationAccuracy;
    }

    /**
     * Returns the single altitude value all elevation calculations use. The fused altitude wins if
     * it exists and its confidence is at least {@link #MIN_FUSED_CONFIDENCE}, then the barometric
     * altitude, and the raw device altitude otherwise.
     */
    public double getBestAltitude() {
        if (hasFusedAltitude() && elevationConfidence >= MIN_FUSED_CONFIDENCE)
            return fusedAltitude;
        if (hasBarometricAltitude())
            return barometricAltitude;
        return altitude;
    }

    /**
     * @return the best altitude of <code>other</code> minus the best altitude of this sample
     */
    public double calcElevationChange(Sample other) {
        return other.getBestAltitude() - getBestAltitude();
    }

    public double getHorizontalAccuracy() {
        return horizontalAccuracy;
    }

    public double getVerticalAccuracy() {
        return verticalAccuracy;
    }

    /**
     * @return speed in m/s
     */
    public double getSpeed() {
        return speed;
    }

    /**
     * @return the course in degree where 0 is north, or a negative value if unknown
     */
    public double getCourse() {
        return course;
    }

    public boolean hasCourse() {
        return course >= 0;
    }

    public boolean isAccurate() {
        return horizontalAccuracy > 0 && horizontalAccuracy <= 10;
    }

    public boolean hasAccurateElevation() {
        // NaN fails both comparisons
        return elevationAccuracy <= 1 && elevationConfidence >= 0.7;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;

        Sample other = (Sample) obj;
        return time == other.time
                && Double.compare(lat, other.lat) == 0
                && Double.compare(lon, other.lon) == 0
                && Double.compare(altitude, other.altitude) == 0
                && Double.compare(barometricAltitude, other.barometricAltitude) == 0
                && Double.compare(fusedAltitude, other.fusedAltitude) == 0
                && Double.compare(elevationConfidence, other.elevationConfidence) == 0
                && Double.compare(elevationAccuracy, other.elevationAccuracy) == 0
                && Double.compare(horizontalAccuracy, other.horizontalAccuracy) == 0
                && Double.compare(verticalAccuracy, other.verticalAccuracy) == 0
                && Double.compare(speed, other.speed) == 0
                && Double.compare(course, other.course) == 0;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 83 * hash + Long.hashCode(time);
        hash = 83 * hash + Double.hashCode(lat);
        hash = 83 * hash + Double.hashCode(lon);
        hash = 83 * hash + Double.hashCode(altitude);
        return hash;
    }

    @Override
    public String toString() {
        return lat + "," + lon + "," + getBestAltitude() + ", " + time;
    }
}
