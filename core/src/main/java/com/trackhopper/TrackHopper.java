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

import com.trackhopper.compression.CompressionValidator;
import com.trackhopper.compression.TrackCompressor;
import com.trackhopper.util.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ForkJoinPool;

/**
 * Easy to use access point to compress and validate recorded tracks. Create an instance, call
 * init with a configuration and then compress tracks from any thread. Call close when the
 * instance is no longer needed to release the worker threads of the parallel simplification.
 * <p>
 * The core holds no per-track state, so no locking is necessary. Isolating concurrent access to
 * the tracks themselves is up to the application.
 */
public class TrackHopper implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TrackHopper.class);
    private TrackHopperConfig config;
    private TrackCompressor compressor;
    private final CompressionValidator validator = new CompressionValidator();
    private ForkJoinPool pool;

    public TrackHopper init(TrackHopperConfig trackHopperConfig) {
        if (compressor != null)
            throw new IllegalStateException("Cannot call init twice");

        config = new TrackHopperConfig(trackHopperConfig);
        if (config.getParallelThreshold() > 0) {
            pool = new ForkJoinPool(config.getParallelism());
            compressor = new TrackCompressor(pool, config.getParallelThreshold());
        } else {
            compressor = new TrackCompressor();
        }
        logger.info("initialized TrackHopper with " + config.toString().replace('\n', ','));
        return this;
    }

    public TrackHopperConfig getConfig() {
        ensureInitialized();
        return new TrackHopperConfig(config);
    }

    /**
     * Creates a request for the specified samples that uses the configured defaults.
     */
    public CompressionRequest createRequest(List<Sample> samples) {
        ensureInitialized();
        return new CompressionRequest(samples).
                setEpsilon(config.getEpsilon()).
                setPreserveElevationChanges(config.isPreserveElevationChanges()).
                setElevationThreshold(config.getElevationThreshold());
    }

    public CompressionResult compress(CompressionRequest request) {
        ensureInitialized();
        return compressor.compress(request);
    }

    public CompressionResult compress(List<Sample> samples, double epsilon, boolean preserveElevationChanges, double elevationThreshold) {
        return compress(new CompressionRequest(samples).
                setEpsilon(epsilon).
                setPreserveElevationChanges(preserveElevationChanges).
                setElevationThreshold(elevationThreshold));
    }

    /**
     * Compresses the samples with the configured defaults and returns the kept samples.
     */
    public List<Sample> compressSamples(List<Sample> samples) {
        return compressSamples(createRequest(samples));
    }

    public List<Sample> compressSamples(CompressionRequest request) {
        ensureInitialized();
        return compressor.compressSamples(request);
    }

    public ValidationResult validate(List<Sample> originalSamples, List<Sample> compressedSamples) {
        return validator.validate(originalSamples, compressedSamples);
    }

    public CompressionValidator getValidator() {
        return validator;
    }

    private void ensureInitialized() {
        if (compressor == null)
            throw new IllegalStateException("Call init before using TrackHopper");
    }

    @Override
    public void close() {
        if (pool != null)
            pool.shutdown();
    }
}
