/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.voxelstack.volume;

import static java.util.Objects.requireNonNull;

import io.voxelstack.dicom.DicomSignature;
import java.util.Properties;

/**
 * Settings for {@link DicomVolumeLoader}.
 * <p>
 * Can be populated fluently or from {@link Properties} using the {@code *_KEY} constants, for
 * instance from system properties:
 *
 * <pre>{@code
 * VolumeLoaderConfig config = VolumeLoaderConfig.fromProperties(System.getProperties());
 * }</pre>
 */
public class VolumeLoaderConfig {

    /** Per-cosine tolerance used to decide that two orientations are the same. */
    public static final String ORIENTATION_TOLERANCE_KEY = "io.voxelstack.orientation.tolerance";

    /** File name that is never loaded as a slice. */
    public static final String EXCLUDED_FILENAME_KEY = "io.voxelstack.excluded.filename";

    public static final double DEFAULT_ORIENTATION_TOLERANCE = 1e-4;

    private double orientationTolerance = DEFAULT_ORIENTATION_TOLERANCE;

    private String excludedFilename = DicomSignature.DICOMDIR;

    public VolumeLoaderConfig() {
        // defaults
    }

    public double orientationTolerance() {
        return orientationTolerance;
    }

    /**
     * @param tolerance a positive tolerance
     * @return this config
     * @throws IllegalArgumentException if tolerance is not positive
     */
    public VolumeLoaderConfig orientationTolerance(double tolerance) {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Orientation tolerance must be positive: " + tolerance);
        }
        this.orientationTolerance = tolerance;
        return this;
    }

    public String excludedFilename() {
        return excludedFilename;
    }

    public VolumeLoaderConfig excludedFilename(String name) {
        this.excludedFilename = requireNonNull(name, "name");
        return this;
    }

    /**
     * Creates a config from properties; missing keys keep their defaults.
     *
     * @param properties the source properties
     * @return a new config
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static VolumeLoaderConfig fromProperties(Properties properties) {
        requireNonNull(properties, "properties");
        VolumeLoaderConfig config = new VolumeLoaderConfig();
        String tolerance = properties.getProperty(ORIENTATION_TOLERANCE_KEY);
        if (tolerance != null) {
            try {
                config.orientationTolerance(Double.parseDouble(tolerance.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid value for %s: %s".formatted(ORIENTATION_TOLERANCE_KEY, tolerance), e);
            }
        }
        String excluded = properties.getProperty(EXCLUDED_FILENAME_KEY);
        if (excluded != null) {
            config.excludedFilename(excluded);
        }
        return config;
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        properties.setProperty(ORIENTATION_TOLERANCE_KEY, String.valueOf(orientationTolerance));
        properties.setProperty(EXCLUDED_FILENAME_KEY, excludedFilename);
        return properties;
    }

    @Override
    public String toString() {
        return "VolumeLoaderConfig[orientationTolerance=" + orientationTolerance + ", excludedFilename="
                + excludedFilename + "]";
    }
}
