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

import io.voxelstack.dicom.PixelSlice;
import io.voxelstack.dicom.PixelType;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * A dense voxel buffer of shape {@code (rows, columns, slices)}, or
 * {@code (rows, columns, slices, samplesPerPixel)} for multi-channel images.
 * <p>
 * Samples are stored little-endian, slice by slice, each slice row-major with interleaved
 * channels. An {@link #empty() empty} volume has no shape and no data; callers must check
 * {@link #isEmpty()} before reading.
 */
public final class Volume {

    private static final Volume EMPTY = new Volume(0, 0, 0, 0, null, null);

    private final int rows;
    private final int columns;
    private final int slices;
    private final int samplesPerPixel;
    private final PixelType pixelType;
    private final ByteBuffer data;

    private Volume(int rows, int columns, int slices, int samplesPerPixel, PixelType pixelType, ByteBuffer data) {
        this.rows = rows;
        this.columns = columns;
        this.slices = slices;
        this.samplesPerPixel = samplesPerPixel;
        this.pixelType = pixelType;
        this.data = data;
    }

    /**
     * @return the volume returned when the first slice cannot be decoded
     */
    public static Volume empty() {
        return EMPTY;
    }

    /**
     * Allocates a zero-filled volume.
     *
     * @throws IllegalArgumentException if a dimension is not positive or the buffer would exceed 2 GiB
     */
    static Volume allocate(int rows, int columns, int slices, int samplesPerPixel, PixelType pixelType) {
        Objects.requireNonNull(pixelType, "pixelType");
        if (rows <= 0 || columns <= 0 || slices <= 0 || samplesPerPixel <= 0) {
            throw new IllegalArgumentException("Invalid volume shape %dx%dx%dx%d"
                    .formatted(rows, columns, slices, samplesPerPixel));
        }
        long bytes = (long) rows * columns * slices * samplesPerPixel * pixelType.bytesPerSample();
        if (bytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Volume of " + bytes + " bytes exceeds the maximum buffer size");
        }
        ByteBuffer data = ByteBuffer.allocate((int) bytes).order(ByteOrder.LITTLE_ENDIAN);
        return new Volume(rows, columns, slices, samplesPerPixel, pixelType, data);
    }

    public boolean isEmpty() {
        return data == null;
    }

    /**
     * @return {@code [rows, columns, slices]}, with a trailing {@code samplesPerPixel} when above
     *     1; an empty array for the empty volume
     */
    public int[] shape() {
        if (isEmpty()) {
            return new int[0];
        }
        return samplesPerPixel > 1
                ? new int[] {rows, columns, slices, samplesPerPixel}
                : new int[] {rows, columns, slices};
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int numSlices() {
        return slices;
    }

    public int samplesPerPixel() {
        return samplesPerPixel;
    }

    /**
     * @return the sample type, {@code null} for the empty volume
     */
    public PixelType pixelType() {
        return pixelType;
    }

    /**
     * @return a read-only little-endian view of all samples
     */
    public ByteBuffer buffer() {
        checkNotEmpty();
        return data.asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    public double getDouble(int row, int column, int slice) {
        return getDouble(row, column, slice, 0);
    }

    public double getDouble(int row, int column, int slice, int sample) {
        checkNotEmpty();
        if (row < 0 || row >= rows || column < 0 || column >= columns || slice < 0 || slice >= slices
                || sample < 0 || sample >= samplesPerPixel) {
            throw new IndexOutOfBoundsException("(%d,%d,%d,%d) outside %dx%dx%dx%d"
                    .formatted(row, column, slice, sample, rows, columns, slices, samplesPerPixel));
        }
        int index = slice * sliceLength() + ((row * columns + column) * samplesPerPixel + sample) * bytesPerSample();
        return pixelType.read(data, index);
    }

    /**
     * Copies one decoded slice into position {@code index} along the slice axis.
     *
     * @throws IllegalStateException if the slice does not match the volume's in-plane shape or sample size
     */
    void setSlice(int index, PixelSlice slice) {
        checkNotEmpty();
        Objects.checkIndex(index, slices);
        if (slice.rows() != rows || slice.columns() != columns || slice.samplesPerPixel() != samplesPerPixel) {
            throw new IllegalStateException("Slice %d is %dx%dx%d but the volume expects %dx%dx%d"
                    .formatted(index, slice.rows(), slice.columns(), slice.samplesPerPixel(),
                            rows, columns, samplesPerPixel));
        }
        if (slice.type().bytesPerSample() != bytesPerSample()) {
            throw new IllegalStateException("Slice %d has %s samples but the volume holds %s"
                    .formatted(index, slice.type(), pixelType));
        }
        ByteBuffer target = data.duplicate();
        target.position(index * sliceLength());
        target.put(slice.data());
    }

    private int bytesPerSample() {
        return pixelType.bytesPerSample();
    }

    private int sliceLength() {
        return rows * columns * samplesPerPixel * bytesPerSample();
    }

    private void checkNotEmpty() {
        if (isEmpty()) {
            throw new IllegalStateException("The volume is empty");
        }
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "Volume[empty]";
        }
        return "Volume[shape=%s, type=%s]".formatted(Arrays.toString(shape()), pixelType);
    }
}
