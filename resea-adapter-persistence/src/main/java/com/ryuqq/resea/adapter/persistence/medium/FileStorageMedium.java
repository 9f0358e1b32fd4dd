package com.ryuqq.resea.adapter.persistence.medium;

import com.ryuqq.resea.core.spi.StorageException;
import com.ryuqq.resea.core.spi.StorageMedium;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link StorageMedium} that keeps one UTF-8 file per key under a directory, so state
 * survives process restarts.
 *
 * <p><strong>Write procedure:</strong></p>
 * <ol>
 *   <li>Write the value to a temporary file in the same directory</li>
 *   <li>Move it over the target file (atomic where the file system supports it)</li>
 * </ol>
 *
 * <p>Readers therefore see either the previous or the new value, never a torn write.
 * Characters outside {@code [A-Za-z0-9._-]} in a key are replaced with {@code _} to form the file name.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class FileStorageMedium implements StorageMedium {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");
    private static final String SUFFIX = ".json";

    private final Path directory;

    /**
     * Creates a medium rooted at the given directory, creating it if needed.
     *
     * @param directory storage directory
     * @throws IllegalArgumentException if directory is null
     * @throws StorageException if the directory cannot be created
     */
    public FileStorageMedium(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory: " + directory, e);
        }
        this.directory = directory;
    }

    @Override
    public Optional<String> get(String key) {
        Path file = resolve(key);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Cannot read key '" + key + "' from " + file, e);
        }
    }

    @Override
    public void set(String key, String value) {
        Path file = resolve(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            move(temp, file);
        } catch (IOException e) {
            cleanUp(temp, e);
            throw new StorageException("Cannot write key '" + key + "' to " + file, e);
        }
    }

    @Override
    public void remove(String key) {
        Path file = resolve(key);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageException("Cannot remove key '" + key + "' at " + file, e);
        }
    }

    public Path directory() {
        return directory;
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        return directory.resolve(UNSAFE.matcher(key).replaceAll("_") + SUFFIX);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void cleanUp(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupFailure) {
            failure.addSuppressed(cleanupFailure);
        }
    }
}
