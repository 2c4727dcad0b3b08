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
 * The result of {@link DicomVolumeLoader#loadMainImageFromDicomFiles}.
 *
 * @param volume the voxel buffer; {@link Volume#isEmpty() empty} if the first slice could not be decoded
 * @param representativeMetadata metadata of the first slice in sorted order
 * @param sliceThickness spacing between slices in mm, or {@link SliceStack#UNKNOWN_THICKNESS}
 * @param globalOriginMm position of the first sorted slice, if known
 * @param sortedPositions per-slice coordinates along the slice axis, in volume order
 */
public record LoadedVolume(
        Volume volume,
        TagSnapshot representativeMetadata,
        double sliceThickness,
        Optional<Point3d> globalOriginMm,
        double[] sortedPositions) {

    public LoadedVolume {
        requireNonNull(volume, "volume");
        requireNonNull(representativeMetadata, "representativeMetadata");
        globalOriginMm = requireNonNull(globalOriginMm, "globalOriginMm").map(Point3d::new);
        sortedPositions = requireNonNull(sortedPositions, "sortedPositions").clone();
    }

    LoadedVolume(Volume volume, TagSnapshot representativeMetadata, StackGeometry geometry) {
        this(volume, representativeMetadata, geometry.sliceThickness(), geometry.globalOriginMm(),
                geometry.sortedPositions());
    }

    @Override
    public double[] sortedPositions() {
        return sortedPositions.clone();
    }

    @Override
    public Optional<Point3d> globalOriginMm() {
        return globalOriginMm.map(Point3d::new);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LoadedVolume other
                && volume.equals(other.volume)
                && representativeMetadata.equals(other.representativeMetadata)
                && Double.compare(sliceThickness, other.sliceThickness) == 0
                && globalOriginMm.equals(other.globalOriginMm)
                && Arrays.equals(sortedPositions, other.sortedPositions);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(volume, representativeMetadata, sliceThickness, globalOriginMm)
                + Arrays.hashCode(sortedPositions);
    }

    @Override
    public String toString() {
        return "LoadedVolume[volume=%s, sliceThickness=%s, globalOriginMm=%s, sortedPositions=%s]"
                .formatted(volume, sliceThickness, globalOriginMm.orElse(null), Arrays.toString(sortedPositions));
    }
}
