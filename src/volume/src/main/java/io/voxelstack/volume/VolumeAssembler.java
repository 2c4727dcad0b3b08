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

import static java.util.Objects.requireNonNull;

import io.voxelstack.dicom.DicomDecoder;
import io.voxelstack.dicom.DicomParseException;
import io.voxelstack.dicom.PixelSlice;
import io.voxelstack.dicom.PixelType;
import io.voxelstack.volume.reporting.ReportingSink;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Streams the pixel data of a sorted {@link SliceStack} into one {@link Volume}.
 * <p>
 * The first slice decides the sample type and is decoded before anything is allocated. If it
 * cannot be decoded the result is {@link Volume#empty()}. Any failure on a later slice
 * propagates, so a partially filled volume is never returned.
 */
@Slf4j
public class VolumeAssembler {

    static final String SETTING_DATATYPE_TO_INT8 = "VolumeAssembler:SettingDatatypeToInt8";
    static final String FIRST_SLICE_UNREADABLE = "VolumeAssembler:FirstSliceUnreadable";

    private final DicomDecoder decoder;

    public VolumeAssembler(DicomDecoder decoder) {
        this.decoder = requireNonNull(decoder, "decoder");
    }

    /**
     * Loads every slice of the stack, in stack order, into a new volume.
     *
     * @param stack the slices, already sorted
     * @param reporting receives progress and messages
     * @return the filled volume, or {@link Volume#empty()} if the first slice yields no pixels
     * @throws IOException if a slice after the first cannot be read or decoded
     * @throws IllegalStateException if a slice does not match the shape of the first
     */
    public Volume loadImagesFromStack(SliceStack stack, ReportingSink reporting) throws IOException {
        requireNonNull(stack, "stack");
        requireNonNull(reporting, "reporting");
        reporting.showProgress("Reading pixel data");
        reporting.updateProgress(0);

        final int numSlices = stack.size();
        final Optional<PixelSlice> firstSlice = readFirstSlice(stack.get(0).path(), reporting);
        if (firstSlice.isEmpty()) {
            return Volume.empty();
        }

        final TagSnapshot metadata = stack.metadata(0);
        PixelType pixelType = firstSlice.get().type();
        if (pixelType == PixelType.CHAR) {
            reporting.showMessage(SETTING_DATATYPE_TO_INT8, "Char datatype detected. Setting to int8");
            pixelType = PixelType.INT8;
        }
        final Volume volume = Volume.allocate(
                metadata.rows(), metadata.columns(), numSlices, metadata.samplesPerPixel(), pixelType);
        volume.setSlice(0, firstSlice.get());

        for (int index = 1; index < numSlices; index++) {
            final Path path = stack.get(index).path();
            PixelSlice next = decoder.readPixels(path)
                    .orElseThrow(() -> new DicomParseException("No pixel data in " + path));
            volume.setSlice(index, next);
            reporting.updateProgress((int) Math.round(100.0 * index / numSlices));
        }

        reporting.completeProgress();
        log.debug("Assembled {} from {} slices", volume, numSlices);
        return volume;
    }

    private Optional<PixelSlice> readFirstSlice(Path path, ReportingSink reporting) {
        try {
            Optional<PixelSlice> slice = decoder.readPixels(path);
            if (slice.isEmpty()) {
                log.warn("First slice {} has no pixel data, returning an empty volume", path);
            }
            return slice;
        } catch (IOException e) {
            log.warn("Cannot decode first slice {}, returning an empty volume", path, e);
            reporting.showWarning(FIRST_SLICE_UNREADABLE, "Could not read the pixel data of " + path + ": "
                    + e.getMessage());
            return Optional.empty();
        }
    }
}
