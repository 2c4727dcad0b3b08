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
 * One slice of a group: the file it was read from and its grouping metadata.
 *
 * @param path the slice file
 * @param metadata the tags used for grouping and ordering
 */
public record SliceEntry(Path path, TagSnapshot metadata) {

    public SliceEntry {
        requireNonNull(path, "path");
        requireNonNull(metadata, "metadata");
    }
}
