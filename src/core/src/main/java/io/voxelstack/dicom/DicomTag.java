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

import java.util.HashMap;
import java.util.Map;

/**
 * A DICOM attribute tag, {@code (group,element)}.
 * <p>
 * Only the tags the volume pipeline reads are declared as constants, together with the value
 * representation implied for them when a file uses the implicit VR transfer syntax. This is not
 * a data dictionary: any other tag read implicitly is treated as {@link ValueRepresentation#UN}.
 *
 * @param group the group number, 0..0xFFFF
 * @param element the element number, 0..0xFFFF
 */
public record DicomTag(int group, int element) implements Comparable<DicomTag> {

    private static final Map<DicomTag, ValueRepresentation> IMPLIED_VR = new HashMap<>();

    public static final DicomTag TRANSFER_SYNTAX_UID = declare(0x0002, 0x0010, ValueRepresentation.UI);
    public static final DicomTag SOP_INSTANCE_UID = declare(0x0008, 0x0018, ValueRepresentation.UI);
    public static final DicomTag MODALITY = declare(0x0008, 0x0060, ValueRepresentation.CS);
    public static final DicomTag SLICE_THICKNESS = declare(0x0018, 0x0050, ValueRepresentation.DS);
    public static final DicomTag STUDY_INSTANCE_UID = declare(0x0020, 0x000D, ValueRepresentation.UI);
    public static final DicomTag SERIES_INSTANCE_UID = declare(0x0020, 0x000E, ValueRepresentation.UI);
    public static final DicomTag SERIES_NUMBER = declare(0x0020, 0x0011, ValueRepresentation.IS);
    public static final DicomTag INSTANCE_NUMBER = declare(0x0020, 0x0013, ValueRepresentation.IS);
    public static final DicomTag IMAGE_POSITION_PATIENT = declare(0x0020, 0x0032, ValueRepresentation.DS);
    public static final DicomTag IMAGE_ORIENTATION_PATIENT = declare(0x0020, 0x0037, ValueRepresentation.DS);
    public static final DicomTag SLICE_LOCATION = declare(0x0020, 0x1041, ValueRepresentation.DS);
    public static final DicomTag SAMPLES_PER_PIXEL = declare(0x0028, 0x0002, ValueRepresentation.US);
    public static final DicomTag PHOTOMETRIC_INTERPRETATION = declare(0x0028, 0x0004, ValueRepresentation.CS);
    public static final DicomTag PLANAR_CONFIGURATION = declare(0x0028, 0x0006, ValueRepresentation.US);
    public static final DicomTag NUMBER_OF_FRAMES = declare(0x0028, 0x0008, ValueRepresentation.IS);
    public static final DicomTag ROWS = declare(0x0028, 0x0010, ValueRepresentation.US);
    public static final DicomTag COLUMNS = declare(0x0028, 0x0011, ValueRepresentation.US);
    public static final DicomTag PIXEL_SPACING = declare(0x0028, 0x0030, ValueRepresentation.DS);
    public static final DicomTag BITS_ALLOCATED = declare(0x0028, 0x0100, ValueRepresentation.US);
    public static final DicomTag BITS_STORED = declare(0x0028, 0x0101, ValueRepresentation.US);
    public static final DicomTag PIXEL_REPRESENTATION = declare(0x0028, 0x0103, ValueRepresentation.US);
    public static final DicomTag PIXEL_DATA = declare(0x7FE0, 0x0010, ValueRepresentation.OW);

    public static final DicomTag ITEM = new DicomTag(0xFFFE, 0xE000);
    public static final DicomTag ITEM_DELIMITATION = new DicomTag(0xFFFE, 0xE00D);
    public static final DicomTag SEQUENCE_DELIMITATION = new DicomTag(0xFFFE, 0xE0DD);

    public DicomTag {
        if (group < 0 || group > 0xFFFF) {
            throw new IllegalArgumentException("group out of range: " + group);
        }
        if (element < 0 || element > 0xFFFF) {
            throw new IllegalArgumentException("element out of range: " + element);
        }
    }

    private static DicomTag declare(int group, int element, ValueRepresentation vr) {
        DicomTag tag = new DicomTag(group, element);
        IMPLIED_VR.put(tag, vr);
        return tag;
    }

    public static DicomTag of(int group, int element) {
        return new DicomTag(group, element);
    }

    /**
     * @return the 32-bit {@code ggggeeee} code
     */
    public int code() {
        return (group << 16) | element;
    }

    /**
     * The representation to assume when the file does not state one.
     *
     * @return the implied VR, {@code UL} for group lengths and {@code UN} for undeclared tags
     */
    public ValueRepresentation impliedVr() {
        if (element == 0) {
            return ValueRepresentation.UL;
        }
        return IMPLIED_VR.getOrDefault(this, ValueRepresentation.UN);
    }

    /**
     * @return whether this is an item or sequence delimitation tag
     */
    public boolean isDelimiter() {
        return equals(ITEM_DELIMITATION) || equals(SEQUENCE_DELIMITATION);
    }

    @Override
    public int compareTo(DicomTag o) {
        return Integer.compareUnsigned(code(), o.code());
    }

    @Override
    public String toString() {
        return String.format("(%04X,%04X)", group, element);
    }
}
