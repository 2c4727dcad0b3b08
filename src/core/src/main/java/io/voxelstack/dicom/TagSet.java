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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The elements read from one DICOM file, keyed and ordered by tag.
 * <p>
 * Accessors follow the usual DICOM toolkit shape: absent elements yield empty optionals or the
 * supplied default rather than exceptions.
 */
public final class TagSet {

    private final SortedMap<DicomTag, DicomElement> elements;
    private final TransferSyntax transferSyntax;

    TagSet(Map<DicomTag, DicomElement> elements, TransferSyntax transferSyntax) {
        this.elements = Collections.unmodifiableSortedMap(new TreeMap<>(elements));
        this.transferSyntax = requireNonNull(transferSyntax, "transferSyntax");
    }

    /**
     * Creates a tag set from already decoded elements, for decoders other than
     * {@link DicomFileReader}.
     *
     * @param elements the elements
     * @param transferSyntax the syntax the elements were read with
     * @return a new tag set
     */
    public static TagSet of(Collection<DicomElement> elements, TransferSyntax transferSyntax) {
        Map<DicomTag, DicomElement> map = new TreeMap<>();
        elements.forEach(e -> map.put(e.tag(), e));
        return new TagSet(map, transferSyntax);
    }

    public TransferSyntax transferSyntax() {
        return transferSyntax;
    }

    public int size() {
        return elements.size();
    }

    public boolean contains(DicomTag tag) {
        return elements.containsKey(tag);
    }

    public Optional<DicomElement> get(DicomTag tag) {
        return Optional.ofNullable(elements.get(tag));
    }

    /**
     * @return all elements in tag order
     */
    public Collection<DicomElement> elements() {
        return elements.values();
    }

    public Optional<String> getString(DicomTag tag) {
        return get(tag).flatMap(DicomElement::getString);
    }

    public String getString(DicomTag tag, String defaultValue) {
        return getString(tag).orElse(defaultValue);
    }

    public OptionalInt getInt(DicomTag tag) {
        DicomElement element = elements.get(tag);
        return element == null ? OptionalInt.empty() : element.getInt();
    }

    public int getInt(DicomTag tag, int defaultValue) {
        return getInt(tag).orElse(defaultValue);
    }

    public Optional<double[]> getDoubles(DicomTag tag) {
        return get(tag).flatMap(DicomElement::getDoubles);
    }

    @Override
    public String toString() {
        return "TagSet[" + elements.size() + " elements, transferSyntax=" + transferSyntax.uid() + "]";
    }
}
