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

import io.voxelstack.dicom.DicomTag;
import io.voxelstack.dicom.PixelType;
import io.voxelstack.dicom.TagSet;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import javax.vecmath.Point3d;

/**
 * The per-slice metadata used to group and order slices, extracted once per file.
 * <p>
 * Orientation and position are optional: a slice without ImagePositionPatient has an unknown
 * location along the slice axis. Snapshots with equal {@link #seriesKey()} are assumed to share
 * one patient coordinate frame.
 */
public final class TagSnapshot {

    /** The tags {@link #fromTags(TagSet)} reads; pass as the decoder's tag filter. */
    public static final Set<DicomTag> GROUPING_TAGS = Set.of(
            DicomTag.STUDY_INSTANCE_UID,
            DicomTag.SERIES_INSTANCE_UID,
            DicomTag.INSTANCE_NUMBER,
            DicomTag.IMAGE_POSITION_PATIENT,
            DicomTag.IMAGE_ORIENTATION_PATIENT,
            DicomTag.SLICE_LOCATION,
            DicomTag.SAMPLES_PER_PIXEL,
            DicomTag.ROWS,
            DicomTag.COLUMNS,
            DicomTag.BITS_ALLOCATED,
            DicomTag.PIXEL_REPRESENTATION);

    private final SeriesKey seriesKey;
    private final double[] orientation;
    private final Point3d position;
    private final int rows;
    private final int columns;
    private final int samplesPerPixel;
    private final PixelType pixelType;
    private final Integer instanceNumber;
    private final Double sliceLocation;

    private TagSnapshot(Builder builder) {
        this.orientation = builder.orientation;
        this.position = builder.position;
        this.rows = builder.rows;
        this.columns = builder.columns;
        this.samplesPerPixel = builder.samplesPerPixel;
        this.pixelType = builder.pixelType;
        this.instanceNumber = builder.instanceNumber;
        this.sliceLocation = builder.sliceLocation;
        this.seriesKey = SeriesKey.of(
                builder.studyInstanceUid,
                builder.seriesInstanceUid,
                orientation,
                rows,
                columns,
                samplesPerPixel);
    }

    /**
     * Extracts a snapshot from the tags of one file.
     *
     * @param tags tags read with at least {@link #GROUPING_TAGS}
     * @return the snapshot
     */
    public static TagSnapshot fromTags(TagSet tags) {
        Builder builder = builder()
                .studyInstanceUid(tags.getString(DicomTag.STUDY_INSTANCE_UID, null))
                .seriesInstanceUid(tags.getString(DicomTag.SERIES_INSTANCE_UID, null))
                .rows(tags.getInt(DicomTag.ROWS, 0))
                .columns(tags.getInt(DicomTag.COLUMNS, 0))
                .samplesPerPixel(tags.getInt(DicomTag.SAMPLES_PER_PIXEL, 1));

        tags.getDoubles(DicomTag.IMAGE_ORIENTATION_PATIENT)
                .filter(v -> v.length >= 6)
                .ifPresent(builder::orientation);
        tags.getDoubles(DicomTag.IMAGE_POSITION_PATIENT)
                .filter(v -> v.length >= 3)
                .ifPresent(v -> builder.position(v[0], v[1], v[2]));
        tags.getInt(DicomTag.INSTANCE_NUMBER).ifPresent(builder::instanceNumber);
        tags.getDoubles(DicomTag.SLICE_LOCATION)
                .filter(v -> v.length >= 1)
                .ifPresent(v -> builder.sliceLocation(v[0]));

        OptionalInt bitsAllocated = tags.getInt(DicomTag.BITS_ALLOCATED);
        if (bitsAllocated.isPresent()) {
            boolean signed = tags.getInt(DicomTag.PIXEL_REPRESENTATION, 0) == 1;
            PixelType.forBitsAllocated(bitsAllocated.getAsInt(), signed).ifPresent(builder::pixelType);
        }
        return builder.build();
    }

    public SeriesKey seriesKey() {
        return seriesKey;
    }

    /**
     * @return a copy of the six direction cosines (row direction, then column direction)
     */
    public Optional<double[]> orientation() {
        return orientation == null ? Optional.empty() : Optional.of(orientation.clone());
    }

    /**
     * @return a copy of ImagePositionPatient, in mm
     */
    public Optional<Point3d> position() {
        return position == null ? Optional.empty() : Optional.of(new Point3d(position));
    }

    /**
     * Compares orientations cosine by cosine. Two absent orientations match; an absent one never
     * matches a present one.
     *
     * @param other the snapshot to compare with
     * @param tolerance maximum absolute difference per direction cosine
     * @return whether every cosine differs by at most {@code tolerance}
     */
    public boolean sameOrientation(TagSnapshot other, double tolerance) {
        if (orientation == null || other.orientation == null) {
            return orientation == other.orientation;
        }
        for (int i = 0; i < orientation.length; i++) {
            if (Math.abs(orientation[i] - other.orientation[i]) > tolerance) {
                return false;
            }
        }
        return true;
    }

    public boolean hasPosition() {
        return position != null;
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int samplesPerPixel() {
        return samplesPerPixel;
    }

    /**
     * @return the sample type declared by BitsAllocated and PixelRepresentation
     */
    public Optional<PixelType> pixelType() {
        return Optional.ofNullable(pixelType);
    }

    public OptionalInt instanceNumber() {
        return instanceNumber == null ? OptionalInt.empty() : OptionalInt.of(instanceNumber);
    }

    public OptionalDouble sliceLocation() {
        return sliceLocation == null ? OptionalDouble.empty() : OptionalDouble.of(sliceLocation);
    }

    @Override
    public String toString() {
        return "TagSnapshot[series=%s, %dx%d, samplesPerPixel=%d, position=%s, orientation=%s]"
                .formatted(
                        seriesKey.seriesInstanceUid(),
                        rows,
                        columns,
                        samplesPerPixel,
                        position,
                        orientation == null ? null : Arrays.toString(orientation));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TagSnapshot.
     */
    public static class Builder {
        private String studyInstanceUid;
        private String seriesInstanceUid;
        private double[] orientation;
        private Point3d position;
        private int rows;
        private int columns;
        private int samplesPerPixel = 1;
        private PixelType pixelType;
        private Integer instanceNumber;
        private Double sliceLocation;

        private Builder() {}

        public Builder studyInstanceUid(String uid) {
            this.studyInstanceUid = uid;
            return this;
        }

        public Builder seriesInstanceUid(String uid) {
            this.seriesInstanceUid = uid;
            return this;
        }

        /**
         * @param cosines row direction cosines followed by column direction cosines
         * @return this builder
         */
        public Builder orientation(double... cosines) {
            if (cosines.length < 6) {
                throw new IllegalArgumentException("Orientation needs 6 direction cosines, got " + cosines.length);
            }
            this.orientation = Arrays.copyOf(cosines, 6);
            return this;
        }

        public Builder position(double x, double y, double z) {
            this.position = new Point3d(x, y, z);
            return this;
        }

        public Builder rows(int rows) {
            this.rows = rows;
            return this;
        }

        public Builder columns(int columns) {
            this.columns = columns;
            return this;
        }

        public Builder samplesPerPixel(int samplesPerPixel) {
            this.samplesPerPixel = samplesPerPixel;
            return this;
        }

        public Builder pixelType(PixelType pixelType) {
            this.pixelType = pixelType;
            return this;
        }

        public Builder instanceNumber(int instanceNumber) {
            this.instanceNumber = instanceNumber;
            return this;
        }

        public Builder sliceLocation(double sliceLocation) {
            this.sliceLocation = sliceLocation;
            return this;
        }

        public TagSnapshot build() {
            return new TagSnapshot(this);
        }
    }
}
