package com.cx.anomaly.repository;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each artifact as a file under {@code cx.artifacts.dir}.
 */
@Repository
@ConditionalOnProperty(name = "cx.artifacts.store", havingValue = "filesystem", matchIfMissing = true)
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private final Path directory;

    @Autowired
    public FileSystemArtifactStore(DetectorProperties properties) {
        this(Paths.get(properties.getArtifacts().getDir()));
    }

    public FileSystemArtifactStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public void write(String name, String json) {
        Path target = directory.resolve(name);
        try {
            Files.createDirectories(directory);
            // write next to the target and move, so readers never see a half-written file
            Path temp = Files.createTempFile(directory, name, ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote artifact {} ({} chars)", target, json.length());
        } catch (IOException e) {
            throw new DetectorException(ErrorKind.ARTIFACT_WRITE, "Failed to write artifact " + target, e);
        }
    }

    @Override
    public Optional<String> read(String name) {
        Path source = directory.resolve(name);
        try {
            return Optional.of(Files.readString(source, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new DetectorException(ErrorKind.ARTIFACT_MALFORMED, "Failed to read artifact " + source, e);
        }
    }

    @Override
    public String location() {
        return directory.toAbsolutePath().toString();
    }
}
