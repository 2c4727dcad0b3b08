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

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import javax.vecmath.Point3d;

/**
 * Geometry derived by {@link SliceStack#sortAndGetParameters}.
 *
 * @param sliceThickness distance between consecutive slice centres in mm, or
 *     {@link SliceStack#UNKNOWN_THICKNESS} when it cannot be measured
 * @param globalOriginMm patient-space position of the first slice in sorted order
 * @param sortedPositions per-slice coordinate along the slice axis, in sorted order; the index
 *     sequence {@code 0..N-1} when positions are unavailable
 */
public record StackGeometry(double sliceThickness, Optional<Point3d> globalOriginMm, double[] sortedPositions) {

    public StackGeometry {
        requireNonNull(globalOriginMm, "globalOriginMm");
        globalOriginMm = globalOriginMm.map(Point3d::new);
        sortedPositions = requireNonNull(sortedPositions, "sortedPositions").clone();
    }

    /**
     * @return whether the slice thickness was measured from positions
     */
    public boolean hasKnownThickness() {
        return !Double.isNaN(sliceThickness);
    }

    @Override
    public double[] sortedPositions() {
        return sortedPositions.clone();
    }

    @Override
    public Optional<Point3d> globalOriginMm() {
        return globalOriginMm.map(Point3d::new);
    }

    /**
     * Compares {@code sortedPositions} by content; unknown thicknesses are equal.
     */
    @Override
    public boolean equals(Object o) {
        return o instanceof StackGeometry other
                && Double.compare(sliceThickness, other.sliceThickness) == 0
                && globalOriginMm.equals(other.globalOriginMm)
                && Arrays.equals(sortedPositions, other.sortedPositions);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(sliceThickness, globalOriginMm) + Arrays.hashCode(sortedPositions);
    }

    @Override
    public String toString() {
        return "StackGeometry[sliceThickness=%s, globalOriginMm=%s, sortedPositions=%s]"
                .formatted(sliceThickness, globalOriginMm.orElse(null), Arrays.toString(sortedPositions));
    }
}
