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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes the tags and pixels of a single DICOM file.
 * <p>
 * The volume pipeline only depends on this interface; {@link DicomFileReader} is the default
 * implementation.
 */
public interface DicomDecoder {

    /**
     * Reads the header elements of a file, stopping before the pixel data.
     *
     * @param path the file
     * @param filter the tags to keep; an empty set keeps every element
     * @return the elements read
     * @throws DicomParseException if the file is not a readable DICOM file
     * @throws IOException if the file cannot be read
     */
    TagSet readTags(Path path, Set<DicomTag> filter) throws IOException;

    /**
     * Reads every header element of a file.
     *
     * @param path the file
     * @return the elements read
     * @throws IOException if the file cannot be read or parsed
     */
    default TagSet readTags(Path path) throws IOException {
        return readTags(path, Set.of());
    }

    /**
     * Decodes the first frame of a file's pixel data.
     *
     * @param path the file
     * @return the pixels, or empty if the file has no pixel data element
     * @throws DicomParseException if the pixel data is malformed or in an unsupported encoding
     * @throws IOException if the file cannot be read
     */
    Optional<PixelSlice> readPixels(Path path) throws IOException;

    /**
     * @return the decoder for uncompressed transfer syntaxes
     */
    static DicomDecoder getDefault() {
        return new DicomFileReader();
    }
}
