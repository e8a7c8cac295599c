/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventrouter.position;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.util.Objects.requireNonNull;

/**
 * Stores positions in a properties file, one entry per router id. Every write replaces the file atomically (when the
 * file system supports it) so that a crash never leaves a half written position behind.
 * <p>
 * Failures to read or write the file are thrown as {@link UncheckedIOException}.
 * </p>
 */
public class FilePositionStorage implements PositionStorage {
    private static final Logger log = LoggerFactory.getLogger(FilePositionStorage.class);

    private final Path file;

    /**
     * @param file The file to store positions in. It's created, together with missing parent directories, on first save.
     */
    public FilePositionStorage(Path file) {
        requireNonNull(file, "file cannot be null");
        this.file = file.toAbsolutePath();
    }

    @Override
    public synchronized @Nullable String read(String routerId) {
        requireNonNull(routerId, "Router id cannot be null");
        return load().getProperty(routerId);
    }

    @Override
    public synchronized String save(String routerId, String positionToken) {
        requireNonNull(routerId, "Router id cannot be null");
        requireNonNull(positionToken, "Position token cannot be null");
        Properties positions = load();
        positions.setProperty(routerId, positionToken);
        store(positions);
        return positionToken;
    }

    @Override
    public synchronized void delete(String routerId) {
        requireNonNull(routerId, "Router id cannot be null");
        Properties positions = load();
        if (positions.remove(routerId) != null) {
            store(positions);
        }
    }

    @Override
    public synchronized boolean exists(String routerId) {
        requireNonNull(routerId, "Router id cannot be null");
        return load().containsKey(routerId);
    }

    public Path file() {
        return file;
    }

    private Properties load() {
        Properties positions = new Properties();
        if (!Files.exists(file)) {
            return positions;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            positions.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read positions from " + file, e);
        }
        return positions;
    }

    private void store(Properties positions) {
        try {
            Path directory = file.getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path tmp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                positions.store(writer, "Event router positions");
            }
            try {
                Files.move(tmp, file, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write positions to " + file, e);
        }
    }
}
