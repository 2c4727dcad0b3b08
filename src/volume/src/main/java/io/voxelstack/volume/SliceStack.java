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

import io.voxelstack.volume.reporting.ReportingSink;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One coherent group of slices and the algorithm that puts them in spatial order.
 * <p>
 * Slices are kept in the order they were grouped (natural filename order) until
 * {@link #sortAndGetParameters(ReportingSink)} reorders them along the slice axis.
 * Not thread-safe.
 */
public class SliceStack implements Iterable<SliceEntry> {

    private static final Logger logger = LoggerFactory.getLogger(SliceStack.class);

    /** Thickness reported when slice spacing cannot be derived from positions. */
    public static final double UNKNOWN_THICKNESS = Double.NaN;

    static final String POSITION_UNAVAILABLE = "SliceStack:PositionUnavailable";
    static final String INCONSISTENT_ORIENTATION = "SliceStack:InconsistentOrientation";

    private final List<SliceEntry> entries;
    private final double orientationTolerance;

    /**
     * @param entries the slices, in their fallback order; must not be empty
     * @param orientationTolerance maximum per-cosine difference for orientations to count as equal
     */
    public SliceStack(List<SliceEntry> entries, double orientationTolerance) {
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("A slice stack needs at least one slice");
        }
        this.entries = new ArrayList<>(entries);
        this.orientationTolerance = orientationTolerance;
    }

    public int size() {
        return entries.size();
    }

    public SliceEntry get(int index) {
        return entries.get(index);
    }

    public TagSnapshot metadata(int index) {
        return entries.get(index).metadata();
    }

    public List<SliceEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public Iterator<SliceEntry> iterator() {
        return entries().iterator();
    }

    /**
     * Orders the slices along the slice axis and derives the stack geometry.
     * <p>
     * The slice axis is the cross product of the row and column direction cosines of the first
     * slice. When every slice has a position, slices are stably sorted by their projection on
     * that axis, the thickness is the median spacing between consecutive slices and the origin is
     * the first sorted slice's position. Otherwise the current order is kept, a
     * {@value #POSITION_UNAVAILABLE} warning is raised and the thickness is
     * {@link #UNKNOWN_THICKNESS}.
     *
     * @param reporting receives warnings
     * @return the derived geometry
     */
    public StackGeometry sortAndGetParameters(@NonNull ReportingSink reporting) {
        checkOrientationConsistency(reporting);

        final Optional<Vector3d> axis = metadata(0).orientation().flatMap(SliceStack::sliceAxis);
        final boolean allPositions = entries.stream().allMatch(e -> e.metadata().hasPosition());
        if (axis.isEmpty() || !allPositions) {
            return fallbackGeometry(reporting, axis.isEmpty());
        }

        final Vector3d normal = axis.get();
        List<ProjectedSlice> projected = new ArrayList<>(entries.size());
        for (SliceEntry entry : entries) {
            Point3d position = entry.metadata().position().orElseThrow();
            projected.add(new ProjectedSlice(entry, normal.dot(new Vector3d(position))));
        }
        // List.sort is stable, equal coordinates keep their filename order
        projected.sort(Comparator.comparingDouble(ProjectedSlice::coordinate));

        double[] sortedPositions = new double[projected.size()];
        for (int i = 0; i < projected.size(); i++) {
            entries.set(i, projected.get(i).entry());
            sortedPositions[i] = projected.get(i).coordinate();
        }

        double thickness = medianSpacing(sortedPositions);
        Optional<Point3d> origin = metadata(0).position();
        logger.debug("Sorted {} slices along {}: thickness {} mm, origin {}", size(), normal, thickness, origin);
        return new StackGeometry(thickness, origin, sortedPositions);
    }

    private StackGeometry fallbackGeometry(ReportingSink reporting, boolean missingOrientation) {
        String reason = missingOrientation
                ? "the image orientation is missing"
                : "some images have no image position";
        reporting.showWarning(
                POSITION_UNAVAILABLE,
                "Cannot order the images by their position because " + reason
                        + ". The images are ordered by file name and the slice thickness is unknown.");
        double[] indices = new double[size()];
        Arrays.setAll(indices, i -> i);
        return new StackGeometry(UNKNOWN_THICKNESS, metadata(0).position(), indices);
    }

    private void checkOrientationConsistency(ReportingSink reporting) {
        TagSnapshot reference = metadata(0);
        if (reference.orientation().isEmpty()) {
            return;
        }
        for (SliceEntry entry : entries) {
            if (!reference.sameOrientation(entry.metadata(), orientationTolerance)) {
                reporting.showWarning(
                        INCONSISTENT_ORIENTATION,
                        "Images in this series do not share one orientation, first mismatch in " + entry.path());
                return;
            }
        }
    }

    /**
     * The unit normal of the image plane, {@code row x column}.
     *
     * @param orientation six direction cosines
     * @return the normal, or empty if the row and column directions are degenerate
     */
    static Optional<Vector3d> sliceAxis(double[] orientation) {
        Vector3d row = new Vector3d(orientation[0], orientation[1], orientation[2]);
        Vector3d column = new Vector3d(orientation[3], orientation[4], orientation[5]);
        Vector3d normal = new Vector3d();
        normal.cross(row, column);
        if (normal.length() == 0) {
            return Optional.empty();
        }
        normal.normalize();
        return Optional.of(normal);
    }

    /**
     * Median of the differences between consecutive sorted coordinates.
     *
     * @param sorted coordinates in ascending order
     * @return the median spacing, {@link #UNKNOWN_THICKNESS} for fewer than two slices
     */
    static double medianSpacing(double[] sorted) {
        if (sorted.length < 2) {
            return UNKNOWN_THICKNESS;
        }
        double[] spacing = new double[sorted.length - 1];
        for (int i = 0; i < spacing.length; i++) {
            spacing[i] = sorted[i + 1] - sorted[i];
        }
        Arrays.sort(spacing);
        int middle = spacing.length / 2;
        if (spacing.length % 2 == 1) {
            return spacing[middle];
        }
        return (spacing[middle - 1] + spacing[middle]) / 2;
    }

    private record ProjectedSlice(SliceEntry entry, double coordinate) {}
}
