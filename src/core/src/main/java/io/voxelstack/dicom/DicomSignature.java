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

import io.voxelstack.rangereader.RangeReader;
import io.voxelstack.rangereader.file.FileRangeReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Cheap test for DICOM Part 10 files: the four bytes after the 128-byte preamble must read
 * {@code DICM}.
 * <p>
 * This can produce false positives. A file that passes and then fails to parse is reported by
 * the decoder.
 */
public final class DicomSignature {

    public static final int PREAMBLE_LENGTH = 128;

    /** Name of the directory index file, which carries the signature but holds no image. */
    public static final String DICOMDIR = "DICOMDIR";

    private static final byte[] MAGIC = "DICM".getBytes(StandardCharsets.US_ASCII);

    private DicomSignature() {
        // utility class
    }

    /**
     * @param path the file to test
     * @return {@code true} if the file carries the DICM signature
     * @throws IOException if the file cannot be opened
     */
    public static boolean isDicom(Path path) throws IOException {
        try (RangeReader reader = FileRangeReader.of(path)) {
            return isDicom(reader);
        }
    }

    /**
     * @param reader the source to test
     * @return {@code true} if bytes {@code [128, 132)} equal {@code DICM}; short sources are not DICOM
     * @throws IOException on read failure
     */
    public static boolean isDicom(RangeReader reader) throws IOException {
        ByteBuffer buffer = reader.readRange(PREAMBLE_LENGTH, MAGIC.length).flip();
        if (buffer.remaining() < MAGIC.length) {
            return false;
        }
        byte[] actual = new byte[MAGIC.length];
        buffer.get(actual);
        return Arrays.equals(MAGIC, actual);
    }

    /**
     * Tests if a file is a DICOM file and not an excluded index file such as {@link #DICOMDIR}.
     * The excluded name is checked first, so the file is not opened in that case.
     *
     * @param directory the containing directory
     * @param fileName the file name
     * @param excludedName the name that never counts as an image
     * @return {@code true} for a DICOM image candidate
     * @throws IOException if the file cannot be opened
     */
    public static boolean isDicomImageFile(Path directory, String fileName, String excludedName)
            throws IOException {
        if (excludedName.equals(fileName)) {
            return false;
        }
        return isDicom(directory.resolve(fileName));
    }
}
