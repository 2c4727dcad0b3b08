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

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilenameOrderingTest {

    @Test
    void digitRunsCompareNumerically() {
        List<String> names = new ArrayList<>(List.of("IM10", "IM2", "IM1", "IM100", "IM20"));
        names.sort(FilenameOrdering.NATURAL);
        assertThat(names).containsExactly("IM1", "IM2", "IM10", "IM20", "IM100");
    }

    @Test
    void mixedRunsAndPrefixes() {
        List<String> names = new ArrayList<>(List.of("s2_img10", "s10_img1", "s2_img9", "s2", "a"));
        names.sort(FilenameOrdering.NATURAL);
        assertThat(names).containsExactly("a", "s2", "s2_img9", "s2_img10", "s10_img1");
    }

    @Test
    void leadingZerosTieBreakDeterministically() {
        assertThat(FilenameOrdering.compareNatural("IM007", "IM7")).isNotZero();
        assertThat(FilenameOrdering.compareNatural("IM007", "IM8")).isNegative();
        assertThat(Integer.signum(FilenameOrdering.compareNatural("IM007", "IM7")))
                .isEqualTo(-Integer.signum(FilenameOrdering.compareNatural("IM7", "IM007")));
        assertThat(FilenameOrdering.compareNatural("IM7", "IM7")).isZero();
    }

    @Test
    void longDigitRunsDoNotOverflow() {
        assertThat(FilenameOrdering.compareNatural("1.2.840.99999999999999999999", "1.2.840.100000000000000000000"))
                .isNegative();
    }

    @Test
    void sliceFilesOrderByNameThenDirectory() {
        List<SliceFile> files = new ArrayList<>(List.of(
                SliceFile.of(Path.of("b"), "IM2"),
                SliceFile.of(Path.of("b"), "IM1"),
                SliceFile.of(Path.of("a"), "IM2")));

        files.sort(FilenameOrdering.SLICE_FILES);

        assertThat(files)
                .extracting(SliceFile::path)
                .containsExactly(Path.of("b", "IM1"), Path.of("a", "IM2"), Path.of("b", "IM2"));
    }
}
