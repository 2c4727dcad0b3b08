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

import io.voxelstack.io.ByteRange;
import io.voxelstack.io.ByteRangeInput;
import io.voxelstack.rangereader.RangeReader;
import io.voxelstack.rangereader.file.FileRangeReader;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streaming {@link DicomDecoder} for DICOM Part 10 files in the native (uncompressed) transfer
 * syntaxes.
 * <p>
 * The header is walked element by element through a {@link ByteRangeInput}. Sequences are
 * skipped, since none of the attributes the volume pipeline needs live inside one. The pixel
 * data value is not buffered while parsing: its {@link ByteRange} is recorded and fetched with a
 * single range read by {@link #readPixels(Path)}.
 * <p>
 * Files using a compressed transfer syntax still yield their tags, but
 * {@link #readPixels(Path)} rejects their encapsulated pixel data with a
 * {@link DicomParseException}.
 */
public class DicomFileReader implements DicomDecoder {

    private static final Logger logger = LoggerFactory.getLogger(DicomFileReader.class);

    static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;

    private static final int FILE_META_GROUP = 0x0002;
    private static final long DATA_START = DicomSignature.PREAMBLE_LENGTH + 4L;

    @Override
    public TagSet readTags(Path path, Set<DicomTag> filter) throws IOException {
        try (RangeReader reader = FileRangeReader.of(path)) {
            return parse(reader, filter == null ? Set.of() : filter);
        }
    }

    @Override
    public Optional<PixelSlice> readPixels(Path path) throws IOException {
        try (RangeReader reader = FileRangeReader.of(path)) {
            TagSet tags = parse(reader, Set.of());
            Optional<DicomElement> pixelData = tags.get(DicomTag.PIXEL_DATA);
            if (pixelData.isEmpty()) {
                logger.debug("{} has no pixel data", reader.getSourceIdentifier());
                return Optional.empty();
            }
            return Optional.of(decodePixels(reader, tags, pixelData.get()));
        }
    }

    TagSet parse(RangeReader reader, Set<DicomTag> filter) throws IOException {
        if (!DicomSignature.isDicom(reader)) {
            throw new DicomParseException("Missing DICM signature: " + reader.getSourceIdentifier());
        }
        final ByteRangeInput input = ByteRangeInput.of(reader).order(ByteOrder.LITTLE_ENDIAN);
        input.seek(DATA_START);

        final Map<DicomTag, DicomElement> elements = new TreeMap<>();
        final DicomTag lastWanted = filter.isEmpty() ? null : Collections.max(filter);
        try {
            TransferSyntax syntax = readFileMetaInformation(input, elements, filter);
            input.order(syntax.byteOrder());
            readDataSet(input, syntax, elements, filter, lastWanted);
            return new TagSet(elements, syntax);
        } catch (EOFException e) {
            throw new DicomParseException("Truncated DICOM header in " + reader.getSourceIdentifier(), e);
        }
    }

    /**
     * Reads the group 0002 elements, always explicit VR little endian, and resolves the transfer
     * syntax of the data set that follows.
     */
    private TransferSyntax readFileMetaInformation(
            ByteRangeInput input, Map<DicomTag, DicomElement> elements, Set<DicomTag> filter) throws IOException {

        String transferSyntaxUid = null;
        while (input.hasRemaining()) {
            long mark = input.position();
            int group = input.readUnsignedShort();
            input.seek(mark);
            if (group != FILE_META_GROUP) {
                break;
            }
            Header header = readHeader(input, TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN);
            DicomElement element = readValue(input, header, ByteOrder.LITTLE_ENDIAN);
            if (DicomTag.TRANSFER_SYNTAX_UID.equals(header.tag())) {
                transferSyntaxUid = element.getString().orElse(null);
            }
            if (wanted(filter, header.tag())) {
                elements.put(header.tag(), element);
            }
        }
        if (transferSyntaxUid == null) {
            logger.debug("No transfer syntax in file meta information, assuming implicit VR little endian");
            return TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN;
        }
        return TransferSyntax.forUid(transferSyntaxUid);
    }

    private void readDataSet(
            ByteRangeInput input,
            TransferSyntax syntax,
            Map<DicomTag, DicomElement> elements,
            Set<DicomTag> filter,
            DicomTag lastWanted)
            throws IOException {

        while (input.hasRemaining()) {
            Header header = readHeader(input, syntax);
            DicomTag tag = header.tag();
            if (lastWanted != null && tag.compareTo(lastWanted) > 0) {
                // data set elements are in ascending tag order
                return;
            }
            if (DicomTag.PIXEL_DATA.equals(tag)) {
                if (wanted(filter, tag)) {
                    elements.put(tag, deferPixelData(input, header, syntax));
                }
                return;
            }
            if (header.length() == UNDEFINED_LENGTH) {
                skipUntilDelimiter(input, contentSyntax(header, syntax));
            } else if (header.vr() == ValueRepresentation.SQ || !wanted(filter, tag)) {
                input.skip(header.length());
            } else {
                elements.put(tag, readValue(input, header, syntax.byteOrder()));
            }
        }
    }

    private DicomElement deferPixelData(ByteRangeInput input, Header header, TransferSyntax syntax)
            throws DicomParseException {
        if (header.length() == UNDEFINED_LENGTH) {
            return DicomElement.undefinedLength(header.tag(), header.vr(), syntax.byteOrder());
        }
        if (header.length() > Integer.MAX_VALUE) {
            throw new DicomParseException("Pixel data too large: " + header.length() + " bytes");
        }
        return DicomElement.deferred(
                header.tag(), header.vr(), syntax.byteOrder(), ByteRange.of(input.position(), (int) header.length()));
    }

    /**
     * Skips the content of an undefined length element up to and including its delimiter.
     * Nested undefined length items and sequences are skipped recursively.
     */
    private void skipUntilDelimiter(ByteRangeInput input, TransferSyntax syntax) throws IOException {
        final ByteOrder outer = input.order();
        input.order(syntax.byteOrder());
        try {
            while (true) {
                Header header = readHeader(input, syntax);
                if (header.tag().isDelimiter()) {
                    return;
                }
                if (header.length() == UNDEFINED_LENGTH) {
                    skipUntilDelimiter(input, contentSyntax(header, syntax));
                } else {
                    input.skip(header.length());
                }
            }
        } finally {
            input.order(outer);
        }
    }

    /**
     * The encoding of the content of an undefined length element. An explicit {@code UN} element
     * of undefined length holds implicit VR little endian data (PS3.5 section 6.2.2).
     */
    private static TransferSyntax contentSyntax(Header header, TransferSyntax syntax) {
        if (syntax.explicitVr() && header.vr() == ValueRepresentation.UN && header.tag().group() != 0xFFFE) {
            return TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN;
        }
        return syntax;
    }

    private Header readHeader(ByteRangeInput input, TransferSyntax syntax) throws IOException {
        final int group = input.readUnsignedShort();
        final int element = input.readUnsignedShort();
        final DicomTag tag = DicomTag.of(group, element);

        if (group == 0xFFFE) {
            // items and delimiters never carry a VR
            return new Header(tag, ValueRepresentation.UN, input.readUnsignedInt());
        }
        if (!syntax.explicitVr()) {
            return new Header(tag, tag.impliedVr(), input.readUnsignedInt());
        }
        final int first = input.readUnsignedByte();
        final int second = input.readUnsignedByte();
        final ValueRepresentation vr = ValueRepresentation.fromCode(first, second)
                .orElseThrow(() -> new DicomParseException("Invalid VR %c%c for %s at offset %d"
                        .formatted((char) first, (char) second, tag, input.position() - 6)));
        if (vr.hasLongLength()) {
            input.skip(2);
            return new Header(tag, vr, input.readUnsignedInt());
        }
        return new Header(tag, vr, input.readUnsignedShort());
    }

    private DicomElement readValue(ByteRangeInput input, Header header, ByteOrder order) throws IOException {
        if (header.length() == UNDEFINED_LENGTH) {
            throw new DicomParseException("Unexpected undefined length for " + header.tag());
        }
        if (header.length() > Integer.MAX_VALUE) {
            throw new DicomParseException("Element " + header.tag() + " too large: " + header.length());
        }
        long offset = input.position();
        byte[] value = input.readBytes((int) header.length());
        return DicomElement.loaded(header.tag(), header.vr(), order, offset, value);
    }

    private PixelSlice decodePixels(RangeReader reader, TagSet tags, DicomElement pixelData) throws IOException {
        final String source = reader.getSourceIdentifier();
        if (pixelData.isUndefinedLength() || tags.transferSyntax().encapsulated()) {
            throw new DicomParseException("Encapsulated pixel data is not supported (transfer syntax %s): %s"
                    .formatted(tags.transferSyntax().uid(), source));
        }
        final int rows = tags.getInt(DicomTag.ROWS).orElseThrow(() -> missing(DicomTag.ROWS, source));
        final int columns = tags.getInt(DicomTag.COLUMNS).orElseThrow(() -> missing(DicomTag.COLUMNS, source));
        final int bitsAllocated =
                tags.getInt(DicomTag.BITS_ALLOCATED).orElseThrow(() -> missing(DicomTag.BITS_ALLOCATED, source));
        final int samplesPerPixel = tags.getInt(DicomTag.SAMPLES_PER_PIXEL, 1);
        final boolean signed = tags.getInt(DicomTag.PIXEL_REPRESENTATION, 0) == 1;
        final boolean planar = tags.getInt(DicomTag.PLANAR_CONFIGURATION, 0) == 1;

        final PixelType type = PixelType.forBitsAllocated(bitsAllocated, signed)
                .orElseThrow(() -> new DicomParseException(
                        "Unsupported BitsAllocated %d in %s".formatted(bitsAllocated, source)));

        final int bytesPerSample = type.bytesPerSample();
        final long frameLength = (long) rows * columns * samplesPerPixel * bytesPerSample;
        final ByteRange range = pixelData.valueRange().orElseThrow();
        if (frameLength > range.length()) {
            throw new DicomParseException("Pixel data of %s holds %d bytes, %d needed for %dx%dx%d %s"
                    .formatted(source, range.length(), frameLength, rows, columns, samplesPerPixel, type));
        }
        final ByteRange frame = range.withLength((int) frameLength);
        if (frame.end() > reader.size().orElse(Long.MAX_VALUE)) {
            throw new DicomParseException("Truncated pixel data in %s: %d bytes up to offset %d, file ends first"
                    .formatted(source, frameLength, frame.end()));
        }
        ByteBuffer raw = reader.readRange(frame).flip();
        if (raw.remaining() < frameLength) {
            throw new DicomParseException("Truncated pixel data in %s: %d bytes up to offset %d, file ends first"
                    .formatted(source, frameLength, frame.end()));
        }
        raw.order(pixelData.byteOrder());

        ByteBuffer samples = ByteBuffer.allocate((int) frameLength).order(ByteOrder.LITTLE_ENDIAN);
        final int pixels = rows * columns;
        for (int p = 0; p < pixels; p++) {
            for (int s = 0; s < samplesPerPixel; s++) {
                // planar configuration 1 stores each sample plane contiguously
                int sourceIndex = planar ? s * pixels + p : p * samplesPerPixel + s;
                copySample(raw, sourceIndex * bytesPerSample, samples, bytesPerSample);
            }
        }
        return new PixelSlice(rows, columns, samplesPerPixel, type, samples.flip());
    }

    private static void copySample(ByteBuffer from, int index, ByteBuffer to, int width) {
        switch (width) {
            case 1 -> to.put(from.get(index));
            case 2 -> to.putShort(from.getShort(index));
            case 4 -> to.putInt(from.getInt(index));
            default -> throw new IllegalArgumentException("Unsupported sample width " + width);
        }
    }

    private static DicomParseException missing(DicomTag tag, String source) {
        return new DicomParseException("Missing " + tag + " in " + source);
    }

    private static boolean wanted(Set<DicomTag> filter, DicomTag tag) {
        return filter.isEmpty() || filter.contains(tag);
    }

    private record Header(DicomTag tag, ValueRepresentation vr, long length) {}
}
