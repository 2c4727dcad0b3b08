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

import io.voxelstack.io.ByteRange;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.util.Objects;
import java.util.OptionalLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for slice file readers.
 * <p>
 * Requests are checked here and clamped to the source size with {@link ByteRange#clampTo(long)},
 * so subclasses only see non-empty ranges that lie inside the source. A request that starts at
 * or past the end reads nothing; one that runs past the end is shortened.
 */
@Slf4j
public abstract class AbstractRangeReader implements RangeReader {

    protected AbstractRangeReader() {}

    @Override
    public final int readRange(long offset, int length, ByteBuffer target) throws IOException {
        final ByteRange requested = ByteRange.of(offset, length);
        Objects.requireNonNull(target, "target buffer");
        if (target.isReadOnly()) {
            throw new ReadOnlyBufferException();
        }
        if (target.remaining() < length) {
            throw new IllegalArgumentException("%s does not fit in a buffer with %d bytes remaining"
                    .formatted(requested, target.remaining()));
        }

        final ByteRange range = clamp(requested);
        if (range.length() == 0) {
            return 0;
        }
        return readRangeNoFlip(range.offset(), range.length(), target);
    }

    private ByteRange clamp(ByteRange requested) throws IOException {
        final OptionalLong size = size();
        if (size.isEmpty()) {
            return requested;
        }
        ByteRange clamped = requested.clampTo(size.getAsLong());
        if (clamped.length() < requested.length()) {
            log.trace("{} truncated to {} bytes by the end of {}", requested, clamped.length(), getSourceIdentifier());
        }
        return clamped;
    }

    /**
     * Copies {@code actualLength} bytes at {@code offset} into {@code target}, advancing its
     * position and leaving its limit alone. The range is non-empty and inside the source, and
     * the target has room for it.
     *
     * @param offset start of the range
     * @param actualLength length of the range, already clamped
     * @param target writable destination
     * @return the number of bytes written
     * @throws IOException if the source cannot be read
     */
    protected abstract int readRangeNoFlip(long offset, int actualLength, ByteBuffer target) throws IOException;
}
