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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.voxelstack.io.ByteRange;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class DicomElementTest {

    @Test
    void splitsAndTrimsMultiValuedStrings() {
        DicomElement element = text(DicomTag.IMAGE_POSITION_PATIENT, ValueRepresentation.DS, " -1.5\\2\\3e1 ");

        assertThat(element.getStrings()).containsExactly("-1.5", "2", "3e1");
        assertThat(element.getString()).contains("-1.5");
        assertThat(element.getDoubles()).hasValueSatisfying(v -> assertThat(v).containsExactly(-1.5, 2, 30));
    }

    @Test
    void stripsNulPaddingOfUids() {
        DicomElement element = text(DicomTag.SERIES_INSTANCE_UID, ValueRepresentation.UI, "1.2.3\0");
        assertThat(element.getString()).contains("1.2.3");
    }

    @Test
    void emptyStringHasNoValue() {
        DicomElement element = text(DicomTag.MODALITY, ValueRepresentation.CS, "  ");
        assertThat(element.getStrings()).isEmpty();
        assertThat(element.getString()).isEmpty();
    }

    @Test
    void malformedNumberStringHasNoNumbers() {
        DicomElement element = text(DicomTag.SLICE_LOCATION, ValueRepresentation.DS, "abc");
        assertThat(element.getDoubles()).isEmpty();
        assertThat(element.getInt()).isEmpty();
    }

    @Test
    void integerString() {
        DicomElement element = text(DicomTag.INSTANCE_NUMBER, ValueRepresentation.IS, "42 ");
        assertThat(element.getInt()).hasValue(42);
    }

    @Test
    void decodesBinaryNumbersInElementByteOrder() {
        byte[] little = ByteBuffer.allocate(4)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putShort((short) 512)
                .putShort((short) 0xFFFF)
                .array();
        DicomElement us =
                DicomElement.loaded(DicomTag.ROWS, ValueRepresentation.US, ByteOrder.LITTLE_ENDIAN, 0, little);
        assertThat(us.getDoubles()).hasValueSatisfying(v -> assertThat(v).containsExactly(512, 65535));
        assertThat(us.getInt()).hasValue(512);

        byte[] big = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN).putDouble(2.5).array();
        DicomElement fd = DicomElement.loaded(
                DicomTag.of(0x0018, 0x9087), ValueRepresentation.FD, ByteOrder.BIG_ENDIAN, 0, big);
        assertThat(fd.getDoubles()).hasValueSatisfying(v -> assertThat(v).containsExactly(2.5));
    }

    @Test
    void deferredElementHasRangeButNoBytes() {
        DicomElement element = DicomElement.deferred(
                DicomTag.PIXEL_DATA, ValueRepresentation.OW, ByteOrder.LITTLE_ENDIAN, ByteRange.of(300, 32));

        assertThat(element.isLoaded()).isFalse();
        assertThat(element.isUndefinedLength()).isFalse();
        assertThat(element.bytes()).isEmpty();
        assertThat(element.valueRange()).contains(ByteRange.of(300, 32));
        assertThat(element.getDoubles()).isEmpty();
    }

    @Test
    void tagSetLookups() {
        TagSet tags = TagSet.of(
                List.of(
                        text(DicomTag.MODALITY, ValueRepresentation.CS, "CT"),
                        text(DicomTag.INSTANCE_NUMBER, ValueRepresentation.IS, "7")),
                TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN);

        assertThat(tags.size()).isEqualTo(2);
        assertThat(tags.getString(DicomTag.MODALITY, "OT")).isEqualTo("CT");
        assertThat(tags.getString(DicomTag.SERIES_INSTANCE_UID, "none")).isEqualTo("none");
        assertThat(tags.getInt(DicomTag.INSTANCE_NUMBER, -1)).isEqualTo(7);
        assertThat(tags.getInt(DicomTag.ROWS, -1)).isEqualTo(-1);
        assertThat(tags.elements()).extracting(DicomElement::tag)
                .containsExactly(DicomTag.MODALITY, DicomTag.INSTANCE_NUMBER);
    }

    @Test
    void tagOrderingAndImpliedVr() {
        assertThat(DicomTag.PIXEL_DATA.compareTo(DicomTag.ROWS)).isPositive();
        assertThat(DicomTag.ITEM.compareTo(DicomTag.PIXEL_DATA)).isPositive();
        assertThat(DicomTag.ROWS.impliedVr()).isEqualTo(ValueRepresentation.US);
        assertThat(DicomTag.of(0x0028, 0x0000).impliedVr()).isEqualTo(ValueRepresentation.UL);
        assertThat(DicomTag.of(0x0009, 0x1001).impliedVr()).isEqualTo(ValueRepresentation.UN);
        assertThat(DicomTag.SEQUENCE_DELIMITATION.isDelimiter()).isTrue();
        assertThat(DicomTag.ITEM.isDelimiter()).isFalse();
        assertThat(DicomTag.PIXEL_DATA.toString()).isEqualTo("(7FE0,0010)");
        assertThatThrownBy(() -> DicomTag.of(0x10000, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void valueRepresentationCodes() {
        assertThat(ValueRepresentation.fromCode('O', 'W')).contains(ValueRepresentation.OW);
        assertThat(ValueRepresentation.fromCode('Z', 'Z')).isEmpty();
        assertThat(ValueRepresentation.fromCode(0, 0)).isEmpty();
        assertThat(ValueRepresentation.SQ.hasLongLength()).isTrue();
        assertThat(ValueRepresentation.US.hasLongLength()).isFalse();
        assertThat(ValueRepresentation.DS.isString()).isTrue();
    }

    @Test
    void transferSyntaxResolution() throws DicomParseException {
        assertThat(TransferSyntax.forUid("1.2.840.10008.1.2")).isEqualTo(TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN);
        assertThat(TransferSyntax.forUid("1.2.840.10008.1.2.2 ")).isEqualTo(TransferSyntax.EXPLICIT_VR_BIG_ENDIAN);

        TransferSyntax jpeg = TransferSyntax.forUid(DicomTestFiles.JPEG_BASELINE_UID);
        assertThat(jpeg.encapsulated()).isTrue();
        assertThat(jpeg.explicitVr()).isTrue();
        assertThat(jpeg.byteOrder()).isEqualTo(ByteOrder.LITTLE_ENDIAN);

        assertThatThrownBy(() -> TransferSyntax.forUid("1.2.840.10008.1.2.1.99"))
                .isInstanceOf(DicomParseException.class)
                .hasMessageContaining("Deflated");
    }

    private static DicomElement text(DicomTag tag, ValueRepresentation vr, String value) {
        return DicomElement.loaded(
                tag, vr, ByteOrder.LITTLE_ENDIAN, 0, value.getBytes(StandardCharsets.ISO_8859_1));
    }
}
