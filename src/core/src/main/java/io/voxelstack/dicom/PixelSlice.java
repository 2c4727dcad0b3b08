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
package io.voxelstack.dicom;

import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The decoded pixels of one slice: a {@code rows x columns} grid with {@code samplesPerPixel}
 * interleaved samples per pixel, stored little-endian.
 */
public final class PixelSlice {

    private final int rows;
    private final int columns;
    private final int samplesPerPixel;
    private final PixelType type;
    private final ByteBuffer data;

    /**
     * @param rows number of rows
     * @param columns number of columns
     * @param samplesPerPixel interleaved samples per pixel
     * @param type sample type
     * @param data samples in row-major, sample-interleaved order, from position to limit
     * @throws IllegalArgumentException if dimensions are not positive or data has the wrong size
     */
    public PixelSlice(int rows, int columns, int samplesPerPixel, PixelType type, ByteBuffer data) {
        if (rows <= 0 || columns <= 0 || samplesPerPixel <= 0) {
            throw new IllegalArgumentException(
                    "Invalid slice dimensions %dx%dx%d".formatted(rows, columns, samplesPerPixel));
        }
        this.rows = rows;
        this.columns = columns;
        this.samplesPerPixel = samplesPerPixel;
        this.type = requireNonNull(type, "type");
        long expected = (long) rows * columns * samplesPerPixel * type.bytesPerSample();
        if (requireNonNull(data, "data").remaining() != expected) {
            throw new IllegalArgumentException(
                    "Expected %d bytes of %s samples, got %d".formatted(expected, type, data.remaining()));
        }
        this.data = data.slice().asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Creates a single-sample slice from 16-bit values.
     *
     * @param rows number of rows
     * @param columns number of columns
     * @param samples {@code rows * columns} values in row-major order
     * @param signed whether to type the samples as {@link PixelType#INT16} or {@link PixelType#UINT16}
     * @return a new slice
     */
    public static PixelSlice ofShorts(int rows, int columns, short[] samples, boolean signed) {
        ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asShortBuffer().put(samples);
        return new PixelSlice(rows, columns, 1, signed ? PixelType.INT16 : PixelType.UINT16, buffer);
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

    public PixelType type() {
        return type;
    }

    /**
     * @return a read-only little-endian view of the samples, positioned at 0
     */
    public ByteBuffer data() {
        return data.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    }

    public double getDouble(int row, int column, int sample) {
        if (row < 0 || row >= rows || column < 0 || column >= columns || sample < 0 || sample >= samplesPerPixel) {
            throw new IndexOutOfBoundsException("(%d,%d,%d) outside %dx%dx%d"
                    .formatted(row, column, sample, rows, columns, samplesPerPixel));
        }
        int index = ((row * columns + column) * samplesPerPixel + sample) * type.bytesPerSample();
        return type.read(data, index);
    }

    @Override
    public String toString() {
        return "PixelSlice[%dx%d, samplesPerPixel=%d, type=%s]".formatted(rows, columns, samplesPerPixel, type);
    }
}
