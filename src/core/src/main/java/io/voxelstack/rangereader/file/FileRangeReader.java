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
package io.voxelstack.rangereader.file;

import io.voxelstack.rangereader.AbstractRangeReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Reads a local slice file through positioned {@link FileChannel} reads, so the channel position
 * is never shared between calls.
 *
 * <pre>{@code
 * try (FileRangeReader reader = FileRangeReader.of(Paths.get("series/IM00001"))) {
 *     ByteBuffer magic = reader.readRange(128, 4).flip();
 * }
 * }</pre>
 */
public class FileRangeReader extends AbstractRangeReader {

    private final Path path;
    private final FileChannel channel;

    /**
     * Opens {@code path} for reading.
     *
     * @param path the slice file
     * @throws IOException if the file cannot be opened
     */
    public FileRangeReader(Path path) throws IOException {
        this.path = Objects.requireNonNull(path, "path");
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
    }

    public static FileRangeReader of(Path path) throws IOException {
        return new FileRangeReader(path);
    }

    @Override
    protected int readRangeNoFlip(long offset, int actualLength, ByteBuffer target) throws IOException {
        ByteBuffer window = target.duplicate();
        window.limit(window.position() + actualLength);
        long position = offset;
        while (window.hasRemaining() && channel.read(window, position) >= 0) {
            position = offset + (window.position() - target.position());
        }
        int read = window.position() - target.position();
        target.position(window.position());
        return read;
    }

    @Override
    public OptionalLong size() throws IOException {
        return OptionalLong.of(channel.size());
    }

    /**
     * @return the absolute path of the file
     */
    @Override
    public String getSourceIdentifier() {
        return path.toAbsolutePath().toString();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    @Override
    public String toString() {
        return "FileRangeReader[" + path + "]";
    }
}
