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

import io.voxelstack.dicom.DicomDecoder;
import io.voxelstack.dicom.DicomSignature;
import io.voxelstack.dicom.TagSet;
import io.voxelstack.volume.reporting.LoggingReportingSink;
import io.voxelstack.volume.reporting.ReportingSink;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the main image of a folder of DICOM slices as one volume.
 * <p>
 * One call runs the whole pipeline once, in order:
 * <ol>
 * <li>every candidate file is checked for the DICOM signature and its grouping tags are read
 * into a {@link SliceGrouper};
 * <li>the largest group becomes the {@link SliceStack} and is put in spatial order;
 * <li>the {@link VolumeAssembler} reads the pixel data of the sorted stack.
 * </ol>
 * Files that are not DICOM are skipped with a warning. When the folder holds several series only
 * the largest one is loaded, also with a warning.
 *
 * <pre>{@code
 * DicomVolumeLoader loader = DicomVolumeLoader.builder()
 *         .config(VolumeLoaderConfig.fromProperties(System.getProperties()))
 *         .build();
 * LoadedVolume result = loader.loadMainImageFromDicomFiles(dir, fileNames, null);
 * if (!result.volume().isEmpty()) {
 *     int[] shape = result.volume().shape();
 * }
 * }</pre>
 * <p>
 * Instances hold no per-load state and can be reused, but a single load is not thread-safe with
 * respect to its reporting sink.
 */
@Slf4j
public class DicomVolumeLoader {

    static final String NOT_A_DICOM_FILE = "DicomVolumeLoader:NotADicomFile";
    static final String MULTIPLE_GROUPINGS = "DicomVolumeLoader:MultipleGroupings";

    private final DicomDecoder decoder;
    private final VolumeLoaderConfig config;
    private final ReportingSink defaultReporting;

    private DicomVolumeLoader(Builder builder) {
        this.decoder = builder.decoder == null ? DicomDecoder.getDefault() : builder.decoder;
        this.config = builder.config == null ? new VolumeLoaderConfig() : builder.config;
        this.defaultReporting = builder.reporting == null ? new LoggingReportingSink() : builder.reporting;
    }

    /**
     * @return a loader with the default decoder, configuration and logging reporting sink
     */
    public static DicomVolumeLoader create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public VolumeLoaderConfig config() {
        return config;
    }

    /**
     * Loads a single file as a one-slice volume.
     *
     * @param directory the directory holding the file
     * @param fileName the file name
     * @param reporting receives progress and warnings, {@code null} for this loader's default sink
     * @return the loaded volume and its geometry
     * @throws IOException if a file cannot be read
     * @throws IllegalArgumentException if the file is not a DICOM image
     */
    public LoadedVolume loadMainImageFromDicomFiles(Path directory, String fileName, ReportingSink reporting)
            throws IOException {
        requireNonNull(fileName, "fileName");
        return loadMainImageFromDicomFiles(directory, List.of(fileName), reporting);
    }

    /**
     * Loads the largest series found among the named files of one directory.
     *
     * @param directory the directory holding the files
     * @param fileNames the candidate file names
     * @param reporting receives progress and warnings, {@code null} for this loader's default sink
     * @return the loaded volume and its geometry
     * @throws IOException if a file cannot be read, or a slice after the first cannot be decoded
     * @throws IllegalArgumentException if none of the files is a DICOM image
     */
    public LoadedVolume loadMainImageFromDicomFiles(Path directory, List<String> fileNames, ReportingSink reporting)
            throws IOException {
        requireNonNull(directory, "directory");
        requireNonNull(fileNames, "fileNames");
        List<SliceFile> files = new ArrayList<>(fileNames.size());
        for (String name : fileNames) {
            files.add(SliceFile.of(directory, name));
        }
        return loadMainImageFromDicomFiles(files, reporting);
    }

    /**
     * Loads the largest series found among the given files, which may live in different
     * directories.
     *
     * @param files the candidate files
     * @param reporting receives progress and warnings, {@code null} for this loader's default sink
     * @return the loaded volume and its geometry
     * @throws IOException if a file cannot be read, or a slice after the first cannot be decoded
     * @throws IllegalArgumentException if none of the files is a DICOM image
     */
    public LoadedVolume loadMainImageFromDicomFiles(List<SliceFile> files, ReportingSink reporting)
            throws IOException {
        requireNonNull(files, "files");
        final ReportingSink sink = reporting == null ? defaultReporting : reporting;

        SliceGrouper grouper = loadMetadataFromDicomFiles(files, sink);
        if (grouper.numberOfGroups() == 0) {
            throw new IllegalArgumentException("No DICOM slices found among " + files.size() + " file(s)");
        }
        if (grouper.numberOfGroups() > 1) {
            sink.showWarning(
                    MULTIPLE_GROUPINGS,
                    "The images in this folder belong to " + grouper.numberOfGroups()
                            + " different series. Only the largest series is loaded; the other images are excluded.");
        }

        SliceStack stack = grouper.largestStack();
        StackGeometry geometry = stack.sortAndGetParameters(sink);
        TagSnapshot representative = stack.metadata(0);
        log.debug("Loading {} slices of {}, {}", stack.size(), representative.seriesKey(), geometry);

        Volume volume = new VolumeAssembler(decoder).loadImagesFromStack(stack, sink);
        return new LoadedVolume(volume, representative, geometry);
    }

    /**
     * Reads the grouping tags of every DICOM file, in natural file name order, into a new grouper.
     * <p>
     * The configured excluded file name and files without the DICOM signature are skipped with a
     * {@value #NOT_A_DICOM_FILE} warning.
     *
     * @param files the candidate files
     * @param reporting receives progress and warnings
     * @return the grouper holding every DICOM slice
     * @throws IOException if a file cannot be opened or its header cannot be parsed
     */
    public SliceGrouper loadMetadataFromDicomFiles(List<SliceFile> files, ReportingSink reporting)
            throws IOException {
        requireNonNull(files, "files");
        requireNonNull(reporting, "reporting");
        reporting.showProgress("Reading image metadata");
        reporting.updateProgress(0);

        List<SliceFile> ordered = new ArrayList<>(files);
        ordered.sort(FilenameOrdering.SLICE_FILES);

        final SliceGrouper grouper = new SliceGrouper(config.orientationTolerance());
        final int total = ordered.size();
        for (int index = 0; index < total; index++) {
            final SliceFile file = ordered.get(index);
            final Path path = file.path();
            if (isCandidate(file)) {
                TagSet tags = decoder.readTags(path, TagSnapshot.GROUPING_TAGS);
                grouper.addItem(path, TagSnapshot.fromTags(tags));
            } else {
                log.debug("Skipping {}", path);
                reporting.showWarning(
                        NOT_A_DICOM_FILE,
                        "The file " + file.name() + " is not a DICOM file and will be removed from this series.");
            }
            reporting.updateProgress((int) Math.round(100.0 * (index + 1) / total));
        }
        reporting.completeProgress();
        return grouper;
    }

    private boolean isCandidate(SliceFile file) throws IOException {
        return DicomSignature.isDicomImageFile(file.directory(), file.name(), config.excludedFilename());
    }

    /**
     * Builder for DicomVolumeLoader.
     */
    public static class Builder {
        private DicomDecoder decoder;
        private VolumeLoaderConfig config;
        private ReportingSink reporting;

        private Builder() {}

        /**
         * @param decoder the decoder for tags and pixel data, defaults to {@link DicomDecoder#getDefault()}
         * @return this builder
         */
        public Builder decoder(DicomDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder config(VolumeLoaderConfig config) {
            this.config = config;
            return this;
        }

        /**
         * @param reporting the sink used when a load is called without one, defaults to a
         *     {@link LoggingReportingSink}
         * @return this builder
         */
        public Builder reporting(ReportingSink reporting) {
            this.reporting = reporting;
            return this;
        }

        public DicomVolumeLoader build() {
            return new DicomVolumeLoader(this);
        }
    }
}
