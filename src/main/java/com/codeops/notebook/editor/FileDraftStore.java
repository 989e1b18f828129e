package com.codeops.notebook.editor;

import com.codeops.notebook.exception.DraftStorageException;
import lombok.extern.slf4j.Slf4j;

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
 * Draft store keeping one {@code <key>.json} file per key in a local directory. Writes go to a
 * temporary file that then replaces the target, so a crash mid-write leaves the previous value.
 */
@Slf4j
public class FileDraftStore implements DraftStore {

    private static final Pattern KEY_PATTERN = Pattern.compile("[a-z0-9-]+");

    private final Path directory;

    public FileDraftStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<String> get(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new DraftStorageException("Failed to read draft key " + key, e);
        }
    }

    @Override
    public void set(String key, String value) {
        Path file = fileFor(key);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, key, ".tmp");
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported in {}, falling back to replace", directory);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new DraftStorageException("Failed to write draft key " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new DraftStorageException("Failed to delete draft key " + key, e);
        }
    }

    private Path fileFor(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid draft key: " + key);
        }
        return directory.resolve(key + ".json");
    }
}
