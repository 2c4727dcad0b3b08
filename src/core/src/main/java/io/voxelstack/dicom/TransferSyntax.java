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

import java.nio.ByteOrder;

/**
 * How a data set is encoded: whether headers carry an explicit VR, the byte order, and whether
 * pixel data is encapsulated (compressed fragments).
 *
 * @param uid the transfer syntax UID
 * @param explicitVr whether element headers state their VR
 * @param byteOrder byte order of the data set
 * @param encapsulated whether pixel data is stored as compressed fragments
 */
public record TransferSyntax(String uid, boolean explicitVr, ByteOrder byteOrder, boolean encapsulated) {

    public static final TransferSyntax IMPLICIT_VR_LITTLE_ENDIAN =
            new TransferSyntax("1.2.840.10008.1.2", false, ByteOrder.LITTLE_ENDIAN, false);

    public static final TransferSyntax EXPLICIT_VR_LITTLE_ENDIAN =
            new TransferSyntax("1.2.840.10008.1.2.1", true, ByteOrder.LITTLE_ENDIAN, false);

    public static final TransferSyntax EXPLICIT_VR_BIG_ENDIAN =
            new TransferSyntax("1.2.840.10008.1.2.2", true, ByteOrder.BIG_ENDIAN, false);

    static final String DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1.99";

    public TransferSyntax {
        requireNonNull(uid, "uid");
        requireNonNull(byteOrder, "byteOrder");
    }

    /**
     * Resolves a transfer syntax UID.
     * <p>
     * Every UID other than the three native syntaxes and deflate is one of the compressed
     * syntaxes, whose data sets are explicit VR little endian with encapsulated pixel data.
     *
     * @param uid the UID from the file meta information, trailing padding allowed
     * @return the transfer syntax
     * @throws DicomParseException for the deflated syntax, whose data set cannot be read in place
     */
    public static TransferSyntax forUid(String uid) throws DicomParseException {
        String trimmed = requireNonNull(uid, "uid").trim();
        if (IMPLICIT_VR_LITTLE_ENDIAN.uid().equals(trimmed)) {
            return IMPLICIT_VR_LITTLE_ENDIAN;
        }
        if (EXPLICIT_VR_LITTLE_ENDIAN.uid().equals(trimmed)) {
            return EXPLICIT_VR_LITTLE_ENDIAN;
        }
        if (EXPLICIT_VR_BIG_ENDIAN.uid().equals(trimmed)) {
            return EXPLICIT_VR_BIG_ENDIAN;
        }
        if (DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN.equals(trimmed)) {
            throw new DicomParseException("Deflated transfer syntax is not supported: " + trimmed);
        }
        return new TransferSyntax(trimmed, true, ByteOrder.LITTLE_ENDIAN, true);
    }
}
