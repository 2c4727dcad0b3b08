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

/**
 * Exact part of the key deciding which slices form one coherent series.
 * <p>
 * Two slices can share a group only when they come from the same study and series, both have
 * or both lack an orientation, and they have the same in-plane dimensions and channel count, so
 * that they can be stacked into one voxel buffer. Orientations are then compared within a
 * tolerance by {@link SliceGrouper}.
 *
 * @param studyInstanceUid the study UID, empty if absent
 * @param seriesInstanceUid the series UID, empty if absent
 * @param hasOrientation whether ImageOrientationPatient is present
 * @param rows image rows
 * @param columns image columns
 * @param samplesPerPixel channels per pixel
 */
public record SeriesKey(
        String studyInstanceUid,
        String seriesInstanceUid,
        boolean hasOrientation,
        int rows,
        int columns,
        int samplesPerPixel) {

    public SeriesKey {
        requireNonNull(studyInstanceUid, "studyInstanceUid");
        requireNonNull(seriesInstanceUid, "seriesInstanceUid");
    }

    /**
     * Builds a key, mapping absent UIDs to the empty string.
     *
     * @param studyInstanceUid the study UID or {@code null}
     * @param seriesInstanceUid the series UID or {@code null}
     * @param orientation six direction cosines or {@code null}
     * @param rows image rows
     * @param columns image columns
     * @param samplesPerPixel channels per pixel
     * @return the key
     */
    public static SeriesKey of(
            String studyInstanceUid,
            String seriesInstanceUid,
            double[] orientation,
            int rows,
            int columns,
            int samplesPerPixel) {
        return new SeriesKey(
                studyInstanceUid == null ? "" : studyInstanceUid,
                seriesInstanceUid == null ? "" : seriesInstanceUid,
                orientation != null,
                rows,
                columns,
                samplesPerPixel);
    }
}
