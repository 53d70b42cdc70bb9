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

import java.util.List;

import static java.lang.Math.*;

/**
 * Calculates the distance of two points or of one point and a chord on earth via the haversine
 * formula.
 * <p>
 * All methods are side effect free and can be called from multiple threads.
 */
public class DistanceCalcEarth {
    /**
     * mean radius of the earth
     */
    public final static double R = 6371000; // m
    /**
     * Circumference of the earth
     */
    public final static double C = 2 * PI * R;
    public final static double METERS_PER_DEGREE = C / 360.0;
    public static final DistanceCalcEarth DIST_EARTH = new DistanceCalcEarth();

    /**
     * Calculates distance of (from, to) in meter.
     * <p>
     * http://en.wikipedia.org/wiki/Haversine_formula a = sin²(Δlat/2) +
     * cos(lat1).cos(lat2).sin²(Δlong/2) c = 2.atan2(√a, √(1−a)) d = R.c
     */
    public double calcDist(double fromLat, double fromLon, double toLat, double toLon) {
        double normedDist = calcNormalizedDist(fromLat, fromLon, toLat, toLon);
        // rounding can push the term of antipodal points slightly above 1
        return R * 2 * asin(sqrt(min(1, normedDist)));
    }

    public double calcDist(Sample from, Sample to) {
        return calcDist(from.getLat(), from.getLon(), to.getLat(), to.getLon());
    }

    /**
     * Returns the haversine term 'a' which increases monotonically with the distance. Useful to
     * compare distances without the trigonometric back transformation.
     */
    public double calcNormalizedDist(double fromLat, double fromLon, double toLat, double toLon) {
        double sinDeltaLat = sin(toRadians(toLat - fromLat) / 2);
        double sinDeltaLon = sin(toRadians(toLon - fromLon) / 2);
        return sinDeltaLat * sinDeltaLat
                + sinDeltaLon * sinDeltaLon * cos(toRadians(fromLat)) * cos(toRadians(toLat));
    }

    /**
     * Calculates the distance in meter from r to the chord a-b. The crossing point is found via a
     * projection in plain degree space (lat and lon used as cartesian coordinates) and clamped to
     * the chord, i.e. if r is outside the chord the distance to the nearer end is returned. Only the
     * final distance is calculated on the sphere. This is good enough for the short chords of a
     * single foot activity.
     */
    public double calcPerpendicularDist(double r_lat, double r_lon,
                                        double a_lat, double a_lon,
                                        double b_lat, double b_lon) {
        double delta_lat = b_lat - a_lat;
        double delta_lon = b_lon - a_lon;
        double norm = delta_lat * delta_lat + delta_lon * delta_lon;
        if (norm == 0)
            // special case: a and b are identical
            return calcDist(r_lat, r_lon, a_lat, a_lon);

        double factor = calcProjectionFactor(r_lat, r_lon, a_lat, a_lon, b_lat, b_lon);
        double c_lat = a_lat + factor * delta_lat;
        double c_lon = a_lon + factor * delta_lon;
        return calcDist(r_lat, r_lon, c_lat, c_lon);
    }

    public double calcPerpendicularDist(Sample r, Sample a, Sample b) {
        return calcPerpendicularDist(r.getLat(), r.getLon(), a.getLat(), a.getLon(), b.getLat(), b.getLon());
    }

    /**
     * @return the position t in [0, 1] of the projection of r onto the chord a-b in degree space,
     * where 0 is a and 1 is b. Returns 0 for a zero length chord.
     */
    public double calcProjectionFactor(double r_lat, double r_lon,
                                       double a_lat, double a_lon,
                                       double b_lat, double b_lon) {
        double delta_lat = b_lat - a_lat;
        double delta_lon = b_lon - a_lon;
        double norm = delta_lat * delta_lat + delta_lon * delta_lon;
        if (norm == 0)
            return 0;

        double factor = ((r_lat - a_lat) * delta_lat + (r_lon - a_lon) * delta_lon) / norm;
        if (factor < 0)
            return 0;
        if (factor > 1)
            return 1;
        return factor;
    }

    /**
     * @return the sum of the distances between consecutive samples in meter
     */
    public double calcDistance(List<Sample> samples) {
        double dist = 0;
        for (int i = 1; i < samples.size(); i++) {
            dist += calcDist(samples.get(i - 1), samples.get(i));
        }
        return dist;
    }

    @Override
    public String toString() {
        return "EXACT";
    }
}
