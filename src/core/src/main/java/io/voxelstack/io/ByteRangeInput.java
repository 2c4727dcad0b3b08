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

import io.voxelstack.rangereader.RangeReader;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Buffered, seekable reader of primitive values over a {@link RangeReader}, with a switchable
 * {@link ByteOrder}.
 * <p>
 * {@link java.io.DataInput} is fixed to big-endian, while DICOM files are little-endian except
 * for one retired transfer syntax, and the file meta group is always little-endian even when the
 * data set is not. This reader keeps a window of the file in memory and refills it with range
 * reads as the logical position moves forward.
 * <p>
 * <strong>Thread Safety:</strong> This class is not thread-safe.
 */
public final class ByteRangeInput {

    static final int DEFAULT_BUFFER_SIZE = 8192;

    private final RangeReader reader;
    private final ByteBuffer buffer;
    private final long size;

    /** Source offset of {@code buffer} index 0. */
    private long bufferOffset;

    private ByteRangeInput(RangeReader reader, int bufferSize) throws IOException {
        this.reader = Objects.requireNonNull(reader, "reader cannot be null");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.size = reader.size()
                .orElseThrow(() -> new IOException("Source size is unknown: " + reader.getSourceIdentifier()));
        this.buffer = ByteBuffer.allocate(bufferSize).order(ByteOrder.LITTLE_ENDIAN);
        this.buffer.limit(0);
    }

    /**
     * Creates a little-endian reader positioned at offset 0.
     *
     * @param reader the source
     * @return a new input
     * @throws IOException if the source size cannot be determined
     */
    public static ByteRangeInput of(RangeReader reader) throws IOException {
        return new ByteRangeInput(reader, DEFAULT_BUFFER_SIZE);
    }

    /**
     * Creates a little-endian reader with the given buffer size.
     *
     * @param reader the source
     * @param bufferSize the size of the read-ahead window
     * @return a new input
     * @throws IOException if the source size cannot be determined
     */
    public static ByteRangeInput of(RangeReader reader, int bufferSize) throws IOException {
        return new ByteRangeInput(reader, bufferSize);
    }

    /**
     * Sets the byte order used by subsequent multi-byte reads.
     *
     * @param order the byte order
     * @return this input
     */
    public ByteRangeInput order(ByteOrder order) {
        buffer.order(Objects.requireNonNull(order, "order"));
        return this;
    }

    public ByteOrder order() {
        return buffer.order();
    }

    public long position() {
        return bufferOffset + buffer.position();
    }

    public long size() {
        return size;
    }

    public boolean hasRemaining() {
        return position() < size;
    }

    /**
     * Moves the logical position, reusing the buffered window when the target falls inside it.
     *
     * @param newPosition the absolute position
     */
    public void seek(long newPosition) {
        if (newPosition < 0) {
            throw new IllegalArgumentException("position can't be < 0: " + newPosition);
        }
        if (newPosition >= bufferOffset && newPosition <= bufferOffset + buffer.limit()) {
            buffer.position((int) (newPosition - bufferOffset));
        } else {
            bufferOffset = newPosition;
            buffer.clear();
            buffer.limit(0);
        }
    }

    /**
     * Skips {@code n} bytes.
     *
     * @param n the number of bytes to skip
     * @throws EOFException if fewer than {@code n} bytes remain
     */
    public void skip(long n) throws EOFException {
        long target = position() + n;
        if (n < 0 || target > size) {
            throw new EOFException("Cannot skip " + n + " bytes at " + position() + " of " + size);
        }
        seek(target);
    }

    public int readUnsignedByte() throws IOException {
        ensureAvailable(1);
        return buffer.get() & 0xFF;
    }

    public int readUnsignedShort() throws IOException {
        ensureAvailable(2);
        return buffer.getShort() & 0xFFFF;
    }

    public long readUnsignedInt() throws IOException {
        ensureAvailable(4);
        return buffer.getInt() & 0xFFFFFFFFL;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @param length number of bytes
     * @return a new array
     * @throws EOFException if the source ends first, checked before anything is allocated
     * @throws IOException on read failure
     */
    public byte[] readBytes(int length) throws IOException {
        if (length < 0) {
            throw new IllegalArgumentException("length can't be < 0: " + length);
        }
        if (length > size - position()) {
            throw new EOFException("Cannot read " + length + " bytes at " + position() + " of "
                    + reader.getSourceIdentifier() + ", only " + (size - position()) + " remain");
        }
        byte[] bytes = new byte[length];
        if (length <= buffer.capacity()) {
            ensureAvailable(length);
            buffer.get(bytes);
            return bytes;
        }
        // larger than the window, read straight through
        long start = position();
        ByteBuffer direct = reader.readRange(start, length);
        if (direct.position() < length) {
            throw new EOFException("Unexpected end of " + reader.getSourceIdentifier() + " after reading "
                    + direct.position() + " of " + length + " bytes at " + start);
        }
        direct.flip().get(bytes);
        seek(start + length);
        return bytes;
    }

    private void ensureAvailable(int n) throws IOException {
        if (buffer.remaining() >= n) {
            return;
        }
        final long start = position();
        bufferOffset = start;
        buffer.clear();
        reader.readRange(start, buffer.capacity(), buffer);
        buffer.flip();
        if (buffer.remaining() < n) {
            throw new EOFException("Unexpected end of " + reader.getSourceIdentifier() + " at " + start + ", needed "
                    + n + " bytes but only " + buffer.remaining() + " remain");
        }
    }

    @Override
    public String toString() {
        return String.format(
                "ByteRangeInput[source=%s, position=%d, size=%d, order=%s]",
                reader.getSourceIdentifier(), position(), size, buffer.order());
    }
}
