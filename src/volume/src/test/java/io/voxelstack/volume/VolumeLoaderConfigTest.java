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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.voxelstack.dicom.DicomSignature;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class VolumeLoaderConfigTest {

    @Test
    void defaults() {
        VolumeLoaderConfig config = new VolumeLoaderConfig();
        assertThat(config.orientationTolerance()).isEqualTo(1e-4);
        assertThat(config.excludedFilename()).isEqualTo(DicomSignature.DICOMDIR);
    }

    @Test
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty(VolumeLoaderConfig.ORIENTATION_TOLERANCE_KEY, " 0.01 ");
        props.setProperty(VolumeLoaderConfig.EXCLUDED_FILENAME_KEY, "INDEX");

        VolumeLoaderConfig config = VolumeLoaderConfig.fromProperties(props);

        assertThat(config.orientationTolerance()).isEqualTo(0.01);
        assertThat(config.excludedFilename()).isEqualTo("INDEX");
    }

    @Test
    void missingPropertiesKeepDefaults() {
        VolumeLoaderConfig config = VolumeLoaderConfig.fromProperties(new Properties());
        assertThat(config.orientationTolerance()).isEqualTo(VolumeLoaderConfig.DEFAULT_ORIENTATION_TOLERANCE);
    }

    @Test
    void roundTripsThroughProperties() {
        VolumeLoaderConfig config = new VolumeLoaderConfig().orientationTolerance(0.5).excludedFilename("X");

        VolumeLoaderConfig copy = VolumeLoaderConfig.fromProperties(config.toProperties());

        assertThat(copy.orientationTolerance()).isEqualTo(0.5);
        assertThat(copy.excludedFilename()).isEqualTo("X");
    }

    @Test
    void rejectsInvalidTolerance() {
        Properties props = new Properties();
        props.setProperty(VolumeLoaderConfig.ORIENTATION_TOLERANCE_KEY, "tight");

        assertThatThrownBy(() -> VolumeLoaderConfig.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(VolumeLoaderConfig.ORIENTATION_TOLERANCE_KEY);
        assertThatThrownBy(() -> new VolumeLoaderConfig().orientationTolerance(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VolumeLoaderConfig().orientationTolerance(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
