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

/**
 * The reasons why a sample has to survive the compression, independent of its geometric
 * significance.
 */
public enum KeyPointReason {
    /**
     * first or last sample of the track
     */
    ENDPOINT,
    /**
     * the best altitude differs by at least the elevation threshold from a neighbour
     */
    ELEVATION_CHANGE,
    /**
     * a strict local maximum or minimum of the best altitude which is not just noise
     */
    ELEVATION_EXTREMUM,
    TURN,
    SPEED_CHANGE
}
