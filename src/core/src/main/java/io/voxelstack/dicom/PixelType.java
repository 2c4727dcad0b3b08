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

import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Sample datatype of decoded pixel data.
 * <p>
 * {@link #CHAR} is what a decoder reports for pixel data it could only interpret as raw
 * characters. It has the layout of {@link #INT8}, and volume assembly stores it as such.
 */
public enum PixelType {
    INT8(1),
    UINT8(1),
    INT16(2),
    UINT16(2),
    INT32(4),
    UINT32(4),
    FLOAT32(4),
    FLOAT64(8),
    CHAR(1);

    private final int bytesPerSample;

    PixelType(int bytesPerSample) {
        this.bytesPerSample = bytesPerSample;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }

    /**
     * Maps BitsAllocated and PixelRepresentation to a sample type.
     *
     * @param bitsAllocated 8, 16 or 32
     * @param signed whether PixelRepresentation is 1 (two's complement)
     * @return the type, or empty for unsupported allocations such as 1-bit overlays
     */
    public static Optional<PixelType> forBitsAllocated(int bitsAllocated, boolean signed) {
        return switch (bitsAllocated) {
            case 8 -> Optional.of(signed ? INT8 : UINT8);
            case 16 -> Optional.of(signed ? INT16 : UINT16);
            case 32 -> Optional.of(signed ? INT32 : UINT32);
            default -> Optional.empty();
        };
    }

    /**
     * Reads one sample at an absolute byte index, honouring the buffer's byte order.
     *
     * @param buffer the sample buffer
     * @param byteIndex absolute byte index of the sample
     * @return the sample value
     */
    public double read(ByteBuffer buffer, int byteIndex) {
        return switch (this) {
            case INT8, CHAR -> buffer.get(byteIndex);
            case UINT8 -> buffer.get(byteIndex) & 0xFF;
            case INT16 -> buffer.getShort(byteIndex);
            case UINT16 -> buffer.getShort(byteIndex) & 0xFFFF;
            case INT32 -> buffer.getInt(byteIndex);
            case UINT32 -> buffer.getInt(byteIndex) & 0xFFFFFFFFL;
            case FLOAT32 -> buffer.getFloat(byteIndex);
            case FLOAT64 -> buffer.getDouble(byteIndex);
        };
    }
}
