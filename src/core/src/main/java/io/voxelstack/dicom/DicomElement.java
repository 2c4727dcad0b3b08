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

import io.voxelstack.io.ByteRange;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One data element of a DICOM data set.
 * <p>
 * Small values are loaded while the header is parsed. Large values (pixel data) are deferred:
 * only their {@link #valueRange() location} is kept so the decoder can fetch them with a single
 * range read. Elements with undefined length carry no range.
 */
public final class DicomElement {

    private final DicomTag tag;
    private final ValueRepresentation vr;
    private final ByteOrder byteOrder;
    private final byte[] value;
    private final ByteRange valueRange;

    private DicomElement(DicomTag tag, ValueRepresentation vr, ByteOrder byteOrder, byte[] value, ByteRange range) {
        this.tag = requireNonNull(tag, "tag");
        this.vr = requireNonNull(vr, "vr");
        this.byteOrder = requireNonNull(byteOrder, "byteOrder");
        this.value = value;
        this.valueRange = range;
    }

    static DicomElement loaded(DicomTag tag, ValueRepresentation vr, ByteOrder order, long offset, byte[] value) {
        return new DicomElement(tag, vr, order, value, ByteRange.of(offset, value.length));
    }

    static DicomElement deferred(DicomTag tag, ValueRepresentation vr, ByteOrder order, ByteRange range) {
        return new DicomElement(tag, vr, order, null, requireNonNull(range, "range"));
    }

    static DicomElement undefinedLength(DicomTag tag, ValueRepresentation vr, ByteOrder order) {
        return new DicomElement(tag, vr, order, null, null);
    }

    public DicomTag tag() {
        return tag;
    }

    public ValueRepresentation vr() {
        return vr;
    }

    public ByteOrder byteOrder() {
        return byteOrder;
    }

    /**
     * @return whether the value bytes were read into memory
     */
    public boolean isLoaded() {
        return value != null;
    }

    /**
     * @return whether the element was encoded with undefined length (sequences, encapsulated pixel data)
     */
    public boolean isUndefinedLength() {
        return valueRange == null;
    }

    /**
     * @return where the value lives in the file, empty for undefined length elements
     */
    public Optional<ByteRange> valueRange() {
        return Optional.ofNullable(valueRange);
    }

    /**
     * Returns a copy of the loaded value bytes.
     *
     * @return the raw value, empty if the value was not loaded
     */
    public Optional<byte[]> bytes() {
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    /**
     * Returns the backslash separated values of a string element, with padding removed.
     *
     * @return the values, an empty array if not a loaded string element
     */
    public String[] getStrings() {
        if (value == null || !vr.isString()) {
            return new String[0];
        }
        String text = new String(value, StandardCharsets.ISO_8859_1);
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\0')) {
            end--;
        }
        if (end == 0) {
            return new String[0];
        }
        String[] parts = text.substring(0, end).split("\\\\", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return parts;
    }

    /**
     * @return the first string value
     */
    public Optional<String> getString() {
        String[] values = getStrings();
        return values.length == 0 ? Optional.empty() : Optional.of(values[0]);
    }

    /**
     * Interprets the value as numbers: decimal and integer strings are parsed, binary numeric
     * representations decoded in the element's byte order.
     *
     * @return the numeric values, empty if the element is not numeric or a string is malformed
     */
    public Optional<double[]> getDoubles() {
        if (value == null) {
            return Optional.empty();
        }
        return switch (vr.kind()) {
            case DECIMAL_STRING, INTEGER_STRING -> parseNumbers(getStrings());
            case FLOAT64, FLOAT32, INT16, UINT16, INT32, UINT32 -> Optional.of(decodeBinary());
            default -> Optional.empty();
        };
    }

    /**
     * @return the first numeric value as an int
     */
    public OptionalInt getInt() {
        return getDoubles()
                .filter(v -> v.length > 0)
                .map(v -> OptionalInt.of((int) v[0]))
                .orElse(OptionalInt.empty());
    }

    private static Optional<double[]> parseNumbers(String[] strings) {
        double[] values = new double[strings.length];
        try {
            for (int i = 0; i < strings.length; i++) {
                values[i] = Double.parseDouble(strings[i]);
            }
        } catch (NumberFormatException malformed) {
            return Optional.empty();
        }
        return Optional.of(values);
    }

    private double[] decodeBinary() {
        ByteBuffer buffer = ByteBuffer.wrap(value).order(byteOrder);
        return switch (vr.kind()) {
            case FLOAT64 -> {
                double[] v = new double[value.length / 8];
                for (int i = 0; i < v.length; i++) v[i] = buffer.getDouble();
                yield v;
            }
            case FLOAT32 -> {
                double[] v = new double[value.length / 4];
                for (int i = 0; i < v.length; i++) v[i] = buffer.getFloat();
                yield v;
            }
            case INT16 -> {
                double[] v = new double[value.length / 2];
                for (int i = 0; i < v.length; i++) v[i] = buffer.getShort();
                yield v;
            }
            case UINT16 -> {
                double[] v = new double[value.length / 2];
                for (int i = 0; i < v.length; i++) v[i] = buffer.getShort() & 0xFFFF;
                yield v;
            }
            case INT32 -> {
                double[] v = new double[value.length / 4];
                for (int i = 0; i < v.length; i++) v[i] = buffer.getInt();
                yield v;
            }
            case UINT32 -> {
                double[] v = new double[value.length / 4];
                for (int i = 0; i < v.length; i++) v[i] = buffer.getInt() & 0xFFFFFFFFL;
                yield v;
            }
            default -> new double[0];
        };
    }

    @Override
    public String toString() {
        String location = valueRange == null ? "undefined length" : valueRange.length() + " bytes";
        return "DicomElement[" + tag + " " + vr + ", " + location + "]";
    }
}
