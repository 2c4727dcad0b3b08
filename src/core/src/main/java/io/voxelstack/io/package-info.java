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

/**
 * Byte-level helpers shared by the DICOM decoder.
 * <p>
 * {@link io.voxelstack.io.ByteRangeInput} reads little- or big-endian primitives through a
 * {@link io.voxelstack.rangereader.RangeReader}, and {@link io.voxelstack.io.ByteRange} records
 * where a deferred value lives so it can be fetched later with one range read.
 *
 * <h2>Thread Safety</h2>
 * Inputs in this package are not thread-safe. Open one per file and per thread.
 */
package io.voxelstack.io;
