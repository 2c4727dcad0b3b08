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
package io.voxelstack.io;

/**
 * Location of a value inside a file, defined by offset and length.
 * <p>
 * Used to remember where a large element value (such as pixel data) lives so it can be
 * fetched later with a single range read instead of being buffered while the header is parsed.
 *
 * @param offset the starting position of the range, non-negative
 * @param length the number of bytes in the range, non-negative
 */
public record ByteRange(long offset, int length) {

    public ByteRange {
        if (offset < 0) {
            throw new IllegalArgumentException("offset can't be < 0: " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length can't be < 0: " + length);
        }
    }

    /**
     * @return the position just past the last byte, {@code offset + length}
     */
    public long end() {
        return offset + length;
    }

    /**
     * @param newLength the length of the returned range
     * @return a range with the same offset
     */
    public ByteRange withLength(int newLength) {
        return new ByteRange(offset, newLength);
    }

    /**
     * Trims this range so it does not extend past the end of a source.
     *
     * @param size the source size in bytes
     * @return this range, a shorter one, or a zero-length range at {@code offset} when it starts
     *     at or after {@code size}
     */
    public ByteRange clampTo(long size) {
        if (end() <= size) {
            return this;
        }
        return withLength((int) Math.max(0, size - offset));
    }

    public static ByteRange of(long offset, int length) {
        return new ByteRange(offset, length);
    }
}
