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
 * Minimal DICOM Part 10 decoding for slice-stack assembly.
 * <p>
 * {@link io.voxelstack.dicom.DicomSignature} performs the cheap {@code DICM} check,
 * {@link io.voxelstack.dicom.DicomDecoder} is the decoder seam used by the volume pipeline, and
 * {@link io.voxelstack.dicom.DicomFileReader} implements it for the implicit and explicit VR
 * little endian and explicit VR big endian transfer syntaxes.
 *
 * <h2>Error Handling</h2>
 * <ul>
 * <li>{@link io.voxelstack.dicom.DicomParseException} for malformed or unsupported content</li>
 * <li>{@link java.io.IOException} for general I/O errors</li>
 * </ul>
 */
package io.voxelstack.dicom;
