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
package io.voxelstack.rangereader;

import static java.util.Objects.requireNonNull;

import io.voxelstack.io.ByteRange;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.OptionalLong;

/**
 * Random access to the bytes of one slice file.
 * <p>
 * A DICOM file is touched in a few separate places: the 4-byte signature after the preamble,
 * the header elements, and the pixel data block. Each is fetched with its own range read.
 * <p>
 * All read methods leave the returned or target buffer in write mode, positioned after the last
 * byte read; call {@code flip()} before consuming it.
 */
public interface RangeReader extends Closeable {

    /**
     * Reads up to {@code length} bytes at {@code offset} into a new heap buffer.
     *
     * @throws IOException if the source cannot be read
     * @throws IllegalArgumentException if offset or length is negative
     */
    default ByteBuffer readRange(long offset, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        readRange(offset, length, buffer);
        return buffer;
    }

    default ByteBuffer readRange(ByteRange range) throws IOException {
        return readRange(requireNonNull(range, "range").offset(), range.length());
    }

    /**
     * Reads up to {@code length} bytes at {@code offset} into {@code target}, starting at its
     * position.
     *
     * @return the number of bytes read, fewer than {@code length} only when the source ends first
     * @throws IOException if the source cannot be read
     * @throws IllegalArgumentException if offset or length is negative, or {@code target} has
     *     fewer than {@code length} bytes remaining
     * @throws java.nio.ReadOnlyBufferException if {@code target} is read-only
     */
    int readRange(long offset, int length, ByteBuffer target) throws IOException;

    /**
     * @return the source size in bytes, or empty if unknown
     * @throws IOException if the size cannot be queried
     */
    OptionalLong size() throws IOException;

    /**
     * @return a name for the source, used in log and error messages
     */
    String getSourceIdentifier();
}
