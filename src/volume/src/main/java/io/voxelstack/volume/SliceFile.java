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

import java.nio.file.Path;

/**
 * A file name to load, paired with the directory holding it.
 * <p>
 * Lets one load mix files from the default image directory with files given an explicit
 * sub-path.
 *
 * @param directory the containing directory
 * @param name the file name within the directory
 */
public record SliceFile(Path directory, String name) {

    public SliceFile {
        requireNonNull(directory, "directory");
        requireNonNull(name, "name");
    }

    public static SliceFile of(Path directory, String name) {
        return new SliceFile(directory, name);
    }

    public Path path() {
        return directory.resolve(name);
    }
}
