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

import java.util.Optional;
import javax.vecmath.Point3d;
import org.junit.jupiter.api.Test;

class LoadedVolumeTest {

    private final Volume volume = Volume.empty();
    private final TagSnapshot metadata = TestSlices.axial(0).build();

    @Test
    void originIsCopiedInAndOut() {
        Point3d origin = new Point3d(1, 2, 3);
        LoadedVolume loaded = new LoadedVolume(volume, metadata, 2.0, Optional.of(origin), new double[] {0, 2});

        origin.x = 42;
        loaded.globalOriginMm().orElseThrow().y = 42;

        assertThat(loaded.globalOriginMm()).contains(new Point3d(1, 2, 3));
    }

    @Test
    void sortedPositionsAreCopied() {
        double[] positions = {0, 2, 4};
        LoadedVolume loaded = new LoadedVolume(volume, metadata, 2.0, Optional.empty(), positions);

        positions[0] = 9;
        loaded.sortedPositions()[1] = 9;

        assertThat(loaded.sortedPositions()).containsExactly(0, 2, 4);
    }

    @Test
    void equalityComparesArrayContents() {
        LoadedVolume a = new LoadedVolume(
                volume, metadata, Double.NaN, Optional.of(new Point3d(0, 0, 1)), new double[] {0, 1, 2});
        LoadedVolume b = new LoadedVolume(
                volume, metadata, Double.NaN, Optional.of(new Point3d(0, 0, 1)), new double[] {0, 1, 2});
        LoadedVolume c = new LoadedVolume(
                volume, metadata, Double.NaN, Optional.of(new Point3d(0, 0, 1)), new double[] {0, 1, 3});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
    }

    @Test
    void stackGeometryEqualityComparesArrayContents() {
        StackGeometry a = new StackGeometry(2.0, Optional.empty(), new double[] {0, 2});
        StackGeometry b = new StackGeometry(2.0, Optional.empty(), new double[] {0, 2});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new StackGeometry(2.0, Optional.empty(), new double[] {0, 3}));
    }
}
