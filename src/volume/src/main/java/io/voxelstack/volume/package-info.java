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
 * Turns a folder of DICOM slices into one volume.
 * <p>
 * {@link io.voxelstack.volume.DicomVolumeLoader} is the entry point. It groups slices by
 * {@link io.voxelstack.volume.SeriesKey} and orientation, orders the largest group along its slice axis with
 * {@link io.voxelstack.volume.SliceStack}, and fills a {@link io.voxelstack.volume.Volume} with
 * {@link io.voxelstack.volume.VolumeAssembler}.
 *
 * <h2>Thread Safety</h2>
 * Groupers, stacks and volumes are confined to the thread running the load.
 */
package io.voxelstack.volume;
