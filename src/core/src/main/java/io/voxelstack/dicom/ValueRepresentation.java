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

import java.util.Optional;

/**
 * DICOM value representations (PS3.5 section 6.2).
 */
public enum ValueRepresentation {
    AE(Kind.TEXT, false),
    AS(Kind.TEXT, false),
    AT(Kind.BINARY, false),
    CS(Kind.TEXT, false),
    DA(Kind.TEXT, false),
    DS(Kind.DECIMAL_STRING, false),
    DT(Kind.TEXT, false),
    FD(Kind.FLOAT64, false),
    FL(Kind.FLOAT32, false),
    IS(Kind.INTEGER_STRING, false),
    LO(Kind.TEXT, false),
    LT(Kind.TEXT, false),
    OB(Kind.BINARY, true),
    OD(Kind.BINARY, true),
    OF(Kind.BINARY, true),
    OL(Kind.BINARY, true),
    OV(Kind.BINARY, true),
    OW(Kind.BINARY, true),
    PN(Kind.TEXT, false),
    SH(Kind.TEXT, false),
    SL(Kind.INT32, false),
    SQ(Kind.SEQUENCE, true),
    SS(Kind.INT16, false),
    ST(Kind.TEXT, false),
    SV(Kind.BINARY, true),
    TM(Kind.TEXT, false),
    UC(Kind.TEXT, true),
    UI(Kind.TEXT, false),
    UL(Kind.UINT32, false),
    UN(Kind.BINARY, true),
    UR(Kind.TEXT, true),
    US(Kind.UINT16, false),
    UT(Kind.TEXT, true),
    UV(Kind.BINARY, true);

    /** How the value bytes of a representation are interpreted. */
    enum Kind {
        TEXT,
        DECIMAL_STRING,
        INTEGER_STRING,
        INT16,
        UINT16,
        INT32,
        UINT32,
        FLOAT32,
        FLOAT64,
        BINARY,
        SEQUENCE
    }

    private final Kind kind;
    private final boolean longLength;

    ValueRepresentation(Kind kind, boolean longLength) {
        this.kind = kind;
        this.longLength = longLength;
    }

    Kind kind() {
        return kind;
    }

    /**
     * Whether an explicit VR header for this representation has two reserved bytes followed by a
     * 32-bit length, instead of a 16-bit length.
     *
     * @return {@code true} for the 32-bit length form
     */
    public boolean hasLongLength() {
        return longLength;
    }

    /**
     * Whether values are character strings, possibly multi-valued with a backslash separator.
     *
     * @return {@code true} for string representations
     */
    public boolean isString() {
        return kind == Kind.TEXT || kind == Kind.DECIMAL_STRING || kind == Kind.INTEGER_STRING;
    }

    /**
     * Resolves the two ASCII characters of an explicit VR header.
     *
     * @param first first character
     * @param second second character
     * @return the representation, or empty if the code is not a known VR
     */
    public static Optional<ValueRepresentation> fromCode(int first, int second) {
        if (first < 'A' || first > 'Z' || second < 'A' || second > 'Z') {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(new String(new char[] {(char) first, (char) second})));
        } catch (IllegalArgumentException unknown) {
            return Optional.empty();
        }
    }
}
