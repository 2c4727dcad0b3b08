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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sorts slices into coherent groups.
 * <p>
 * A slice joins the first group with an equal {@link SeriesKey} whose first slice has the same
 * orientation within the tolerance, or starts a new group. Grouping is a single forward pass:
 * groups never merge, and groups are kept in the order they were first seen. Not thread-safe.
 */
public class SliceGrouper {

    private final Map<SeriesKey, List<List<SliceEntry>>> candidates = new LinkedHashMap<>();
    private final List<List<SliceEntry>> groups = new ArrayList<>();
    private final double orientationTolerance;

    public SliceGrouper() {
        this(VolumeLoaderConfig.DEFAULT_ORIENTATION_TOLERANCE);
    }

    /**
     * @param orientationTolerance maximum per-cosine difference for two slices to share a group,
     *     also handed to the stacks this grouper creates
     * @throws IllegalArgumentException if the tolerance is not positive
     */
    public SliceGrouper(double orientationTolerance) {
        if (!(orientationTolerance > 0)) {
            throw new IllegalArgumentException("Orientation tolerance must be positive: " + orientationTolerance);
        }
        this.orientationTolerance = orientationTolerance;
    }

    /**
     * Adds a slice to the first group matching its series key and orientation, creating the group
     * if needed.
     *
     * @param path the slice file
     * @param metadata the slice's grouping metadata
     */
    public void addItem(Path path, TagSnapshot metadata) {
        SliceEntry entry = new SliceEntry(path, metadata);
        List<List<SliceEntry>> sameKey = candidates.computeIfAbsent(metadata.seriesKey(), key -> new ArrayList<>());
        for (List<SliceEntry> group : sameKey) {
            if (group.get(0).metadata().sameOrientation(metadata, orientationTolerance)) {
                group.add(entry);
                return;
            }
        }
        List<SliceEntry> group = new ArrayList<>();
        group.add(entry);
        sameKey.add(group);
        groups.add(group);
    }

    public int numberOfGroups() {
        return groups.size();
    }

    /**
     * @return read-only views of every group, in order of creation
     */
    public List<List<SliceEntry>> groups() {
        List<List<SliceEntry>> views = new ArrayList<>(groups.size());
        groups.forEach(g -> views.add(Collections.unmodifiableList(g)));
        return Collections.unmodifiableList(views);
    }

    /**
     * Builds a stack from the group with the most slices; on a tie the earliest group wins.
     * Groups are left untouched.
     *
     * @return a new stack
     * @throws IllegalStateException if no slice was added
     */
    public SliceStack largestStack() {
        List<SliceEntry> largest = null;
        for (List<SliceEntry> group : groups) {
            if (largest == null || group.size() > largest.size()) {
                largest = group;
            }
        }
        if (largest == null) {
            throw new IllegalStateException("No slices have been grouped");
        }
        return new SliceStack(largest, orientationTolerance);
    }
}
