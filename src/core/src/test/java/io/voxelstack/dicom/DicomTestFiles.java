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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Writes small synthetic DICOM Part 10 files for tests.
 *
 * <pre>{@code
 * Path file = DicomTestFiles.image(4, 4).position(0, 0, 2).write(tempDir.resolve("IM1"));
 * }</pre>
 */
public final class DicomTestFiles {

    public static final String STUDY_UID = "1.2.826.0.1.3680043.2.1125.1";
    public static final String SERIES_UID = "1.2.826.0.1.3680043.2.1125.1.2";

    /** A JPEG baseline syntax, for encapsulated pixel data. */
    public static final String JPEG_BASELINE_UID = "1.2.840.10008.1.2.4.50";

    private static final DicomTag REFERENCED_IMAGE_SEQUENCE = DicomTag.of(0x0008, 0x1140);
    private static final DicomTag REFERENCED_SOP_INSTANCE_UID = DicomTag.of(0x0008, 0x1155);
    private static final long UNDEFINED = 0xFFFFFFFFL;

    private DicomTestFiles() {}

    /**
     * @return a builder with no data set elements
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A 16-bit unsigned monochrome axial image of zeros, with study and series UIDs.
     *
     * @param rows image rows
     * @param columns image columns
     * @return a builder
     */
    public static Builder image(int rows, int columns) {
        return builder()
                .studyInstanceUid(STUDY_UID)
                .seriesInstanceUid(SERIES_UID)
                .orientation(1, 0, 0, 0, 1, 0)
                .uint16(DicomTag.ROWS, rows)
                .uint16(DicomTag.COLUMNS, columns)
                .uint16(DicomTag.SAMPLES_PER_PIXEL, 1)
                .string(DicomTag.PHOTOMETRIC_INTERPRETATION, "CS", "MONOCHROME2")
                .pixels16(new short[rows * columns], false);
    }

    /**
     * Writes one axial 16-bit slice per z position, named {@code IM1}, {@code IM2}, ... Pixel
     * {@code p} of slice {@code i} holds {@code 100 * i + p}.
     *
     * @param directory target directory
     * @param rows image rows
     * @param columns image columns
     * @param zPositions slice positions along z, in file order
     * @return the file names, in file order
     * @throws IOException on write failure
     */
    public static List<String> writeAxialSeries(Path directory, int rows, int columns, double... zPositions)
            throws IOException {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < zPositions.length; i++) {
            String name = "IM" + (i + 1);
            image(rows, columns)
                    .instanceNumber(i + 1)
                    .position(0, 0, zPositions[i])
                    .pixels16(ramp(rows * columns, 100 * i), false)
                    .write(directory.resolve(name));
            names.add(name);
        }
        return names;
    }

    public static short[] ramp(int count, int start) {
        short[] samples = new short[count];
        for (int p = 0; p < count; p++) {
            samples[p] = (short) (start + p);
        }
        return samples;
    }

    /**
     * Writes a file long enough to hold a signature, with text where {@code DICM} should be.
     */
    public static Path writeNotDicom(Path file) throws IOException {
        return Files.writeString(file, "not a dicom file ".repeat(16), StandardCharsets.US_ASCII);
    }

    public static Path writeEmpty(Path file) throws IOException {
        return Files.write(file, new byte[0]);
    }

    private record Entry(String vr, Function<ByteOrder, byte[]> value, boolean undefinedLength) {}

    /**
     * Builder for a single DICOM file.
     */
    public static class Builder {
        private final Map<DicomTag, Entry> entries = new TreeMap<>();
        private TransferSyntax transferSyntax = TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN;
        private String transferSyntaxUid = TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN.uid();

        private Builder() {}

        public Builder transferSyntax(TransferSyntax syntax) {
            this.transferSyntax = syntax;
            this.transferSyntaxUid = syntax.uid();
            return this;
        }

        public Builder string(DicomTag tag, String vr, String value) {
            entries.put(tag, new Entry(vr, order -> text(value, "UI".equals(vr) ? '\0' : ' '), false));
            return this;
        }

        public Builder uint16(DicomTag tag, int value) {
            entries.put(tag, new Entry("US", order -> buffer(2, order).putShort((short) value).array(), false));
            return this;
        }

        public Builder decimals(DicomTag tag, double... values) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < values.length; i++) {
                if (i > 0) {
                    sb.append('\\');
                }
                sb.append(values[i]);
            }
            return string(tag, "DS", sb.toString());
        }

        public Builder studyInstanceUid(String uid) {
            return string(DicomTag.STUDY_INSTANCE_UID, "UI", uid);
        }

        public Builder seriesInstanceUid(String uid) {
            return string(DicomTag.SERIES_INSTANCE_UID, "UI", uid);
        }

        public Builder orientation(double... cosines) {
            return decimals(DicomTag.IMAGE_ORIENTATION_PATIENT, cosines);
        }

        public Builder position(double x, double y, double z) {
            return decimals(DicomTag.IMAGE_POSITION_PATIENT, x, y, z);
        }

        public Builder instanceNumber(int number) {
            return string(DicomTag.INSTANCE_NUMBER, "IS", Integer.toString(number));
        }

        public Builder sliceLocation(double location) {
            return decimals(DicomTag.SLICE_LOCATION, location);
        }

        /**
         * Sets 16-bit single channel pixel data and the matching pixel module attributes.
         */
        public Builder pixels16(short[] samples, boolean signed) {
            uint16(DicomTag.BITS_ALLOCATED, 16);
            uint16(DicomTag.BITS_STORED, 16);
            uint16(DicomTag.PIXEL_REPRESENTATION, signed ? 1 : 0);
            entries.put(DicomTag.PIXEL_DATA, new Entry("OW", order -> {
                ByteBuffer buffer = buffer(samples.length * 2, order);
                for (short s : samples) {
                    buffer.putShort(s);
                }
                return buffer.array();
            }, false));
            return this;
        }

        /**
         * Sets 8-bit unsigned pixel data with {@code samplesPerPixel} channels, stored as given.
         */
        public Builder pixels8(byte[] samples, int samplesPerPixel, boolean planar) {
            uint16(DicomTag.SAMPLES_PER_PIXEL, samplesPerPixel);
            uint16(DicomTag.BITS_ALLOCATED, 8);
            uint16(DicomTag.BITS_STORED, 8);
            uint16(DicomTag.PIXEL_REPRESENTATION, 0);
            if (samplesPerPixel > 1) {
                string(DicomTag.PHOTOMETRIC_INTERPRETATION, "CS", "RGB");
                uint16(DicomTag.PLANAR_CONFIGURATION, planar ? 1 : 0);
            }
            entries.put(DicomTag.PIXEL_DATA, new Entry("OB", order -> pad(samples, (byte) 0), false));
            return this;
        }

        /**
         * Adds an undefined length sequence holding one undefined length item.
         */
        public Builder withSequence() {
            entries.put(REFERENCED_IMAGE_SEQUENCE, new Entry("SQ", order -> {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                out.writeBytes(delimiter(DicomTag.ITEM, UNDEFINED, order));
                out.writeBytes(element(REFERENCED_SOP_INSTANCE_UID, "UI", text("1.2.3.4", '\0'), explicit(), order));
                out.writeBytes(delimiter(DicomTag.ITEM_DELIMITATION, 0, order));
                out.writeBytes(delimiter(DicomTag.SEQUENCE_DELIMITATION, 0, order));
                return out.toByteArray();
            }, true));
            return this;
        }

        /**
         * Adds the same sequence as {@link #withSequence()} but declared as an undefined length
         * {@code UN} element, whose content is implicit VR little endian whatever the file syntax.
         */
        public Builder withUnknownSequence() {
            entries.put(REFERENCED_IMAGE_SEQUENCE, new Entry("UN", order -> {
                ByteOrder le = ByteOrder.LITTLE_ENDIAN;
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                out.writeBytes(delimiter(DicomTag.ITEM, UNDEFINED, le));
                out.writeBytes(element(REFERENCED_SOP_INSTANCE_UID, "UI", text("1.2.3.4", '\0'), false, le));
                out.writeBytes(delimiter(DicomTag.ITEM_DELIMITATION, 0, le));
                out.writeBytes(delimiter(DicomTag.SEQUENCE_DELIMITATION, 0, le));
                return out.toByteArray();
            }, true));
            return this;
        }

        /**
         * Switches to a JPEG transfer syntax with fragment-encoded pixel data.
         */
        public Builder encapsulatedPixelData() {
            this.transferSyntax = TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN;
            this.transferSyntaxUid = JPEG_BASELINE_UID;
            entries.put(DicomTag.PIXEL_DATA, new Entry("OB", order -> {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                out.writeBytes(delimiter(DicomTag.ITEM, 0, order));
                out.writeBytes(delimiter(DicomTag.ITEM, 4, order));
                out.writeBytes(new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xD9});
                out.writeBytes(delimiter(DicomTag.SEQUENCE_DELIMITATION, 0, order));
                return out.toByteArray();
            }, true));
            return this;
        }

        public Builder without(DicomTag tag) {
            entries.remove(tag);
            return this;
        }

        /**
         * Writes the file.
         *
         * @param file target path
         * @return {@code file}
         * @throws IOException on write failure
         */
        public Path write(Path file) throws IOException {
            Files.write(file, toByteArray());
            return file;
        }

        public byte[] toByteArray() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.writeBytes(new byte[DicomSignature.PREAMBLE_LENGTH]);
            out.writeBytes("DICM".getBytes(StandardCharsets.US_ASCII));

            byte[] syntaxElement = element(
                    DicomTag.TRANSFER_SYNTAX_UID, "UI", text(transferSyntaxUid, '\0'), true, ByteOrder.LITTLE_ENDIAN);
            byte[] groupLength = buffer(4, ByteOrder.LITTLE_ENDIAN)
                    .putInt(syntaxElement.length)
                    .array();
            out.writeBytes(element(DicomTag.of(0x0002, 0x0000), "UL", groupLength, true, ByteOrder.LITTLE_ENDIAN));
            out.writeBytes(syntaxElement);

            ByteOrder order = transferSyntax.byteOrder();
            for (Map.Entry<DicomTag, Entry> e : entries.entrySet()) {
                Entry entry = e.getValue();
                byte[] value = entry.value().apply(order);
                if (entry.undefinedLength()) {
                    out.writeBytes(header(e.getKey(), entry.vr(), UNDEFINED, explicit(), order));
                    out.writeBytes(value);
                } else {
                    out.writeBytes(element(e.getKey(), entry.vr(), value, explicit(), order));
                }
            }
            return out.toByteArray();
        }

        private boolean explicit() {
            return transferSyntax.explicitVr();
        }
    }

    private static byte[] element(DicomTag tag, String vr, byte[] value, boolean explicit, ByteOrder order) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(header(tag, vr, value.length, explicit, order));
        out.writeBytes(value);
        return out.toByteArray();
    }

    private static byte[] header(DicomTag tag, String vr, long length, boolean explicit, ByteOrder order) {
        if (!explicit) {
            return buffer(8, order)
                    .putShort((short) tag.group())
                    .putShort((short) tag.element())
                    .putInt((int) length)
                    .array();
        }
        boolean longLength = ValueRepresentation.valueOf(vr).hasLongLength();
        ByteBuffer buffer = buffer(longLength ? 12 : 8, order)
                .putShort((short) tag.group())
                .putShort((short) tag.element())
                .put((byte) vr.charAt(0))
                .put((byte) vr.charAt(1));
        if (longLength) {
            buffer.putShort((short) 0).putInt((int) length);
        } else {
            buffer.putShort((short) length);
        }
        return buffer.array();
    }

    private static byte[] delimiter(DicomTag tag, long length, ByteOrder order) {
        return buffer(8, order)
                .putShort((short) tag.group())
                .putShort((short) tag.element())
                .putInt((int) length)
                .array();
    }

    private static byte[] text(String value, char padding) {
        return pad(value.getBytes(StandardCharsets.ISO_8859_1), (byte) padding);
    }

    private static byte[] pad(byte[] value, byte padding) {
        if (value.length % 2 == 0) {
            return value;
        }
        byte[] padded = new byte[value.length + 1];
        System.arraycopy(value, 0, padded, 0, value.length);
        padded[value.length] = padding;
        return padded;
    }

    private static ByteBuffer buffer(int size, ByteOrder order) {
        return ByteBuffer.allocate(size).order(order);
    }
}
