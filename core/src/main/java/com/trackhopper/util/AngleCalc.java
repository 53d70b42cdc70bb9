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

import static java.lang.Math.*;

/**
 * Calculates azimuths of track segments and the turn angle defined by three samples.
 */
public class AngleCalc {
    public static final AngleCalc ANGLE_CALC = new AngleCalc();

    /**
     * Calculate the initial azimuth (forward azimuth) in degree of the great circle from the first
     * to the second coordinate. 0 is north, 90 is east, 180 is south and 270 is west. Identical
     * coordinates result in 0.
     */
    public double calcAzimuth(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = toRadians(lat1);
        double lat2Rad = toRadians(lat2);
        double deltaLon = toRadians(lon2 - lon1);

        double y = sin(deltaLon) * cos(lat2Rad);
        double x = cos(lat1Rad) * sin(lat2Rad) - sin(lat1Rad) * cos(lat2Rad) * cos(deltaLon);
        double azimuth = toDegrees(atan2(y, x));
        return azimuth < 0 ? azimuth + 360 : azimuth;
    }

    public double calcAzimuth(Sample from, Sample to) {
        return calcAzimuth(from.getLat(), from.getLon(), to.getLat(), to.getLon());
    }

    /**
     * Calculates the change of direction at p2 when moving from p1 via p2 to p3.
     *
     * @return the signed turn angle in degree in (-180, 180], positive for right turns
     */
    public double calcTurnAngle(Sample p1, Sample p2, Sample p3) {
        return normalizeAngle(calcAzimuth(p2, p3) - calcAzimuth(p1, p2));
    }

    /**
     * Changes the representation of the specified angle (degree) to the interval (-180, 180]
     * without changing its direction.
     */
    public double normalizeAngle(double angle) {
        angle %= 360;
        if (angle > 180)
            return angle - 360;
        if (angle <= -180)
            return angle + 360;
        return angle;
    }
}
