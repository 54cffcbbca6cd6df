package com.flamingo.ai.filingqa.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.filingqa.exception.IngestionStateException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads and writes vector store snapshots as JSON.
 *
 * <p>Writes go to a temporary file in the target directory which is then moved over the snapshot,
 * so a crash mid-write leaves the previously committed snapshot intact.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorStorePersistence {

  private final ObjectMapper objectMapper;

  /**
   * Atomically replaces the snapshot at {@code file}.
   *
   * @throws IngestionStateException when the snapshot cannot be written
   */
  public void write(Path file, VectorStoreSnapshot snapshot) {
    Path directory = file.toAbsolutePath().getParent();
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
      objectMapper.writeValue(temp.toFile(), snapshot);
      moveIntoPlace(temp, file);
      log.info("Saved {} chunks to {}", snapshot.chunks().size(), file);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new IngestionStateException("Failed to write snapshot " + file, e);
    }
  }

  /**
   * Reads the snapshot at {@code file}.
   *
   * @return empty when no snapshot exists
   * @throws IngestionStateException when the file exists but cannot be parsed
   */
  public Optional<VectorStoreSnapshot> read(Path file) {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(file.toFile(), VectorStoreSnapshot.class));
    } catch (IOException e) {
      throw new IngestionStateException("Snapshot " + file + " is unreadable", e);
    }
  }

  /** Deletes the snapshot if present. */
  public void delete(Path file) {
    try {
      if (Files.deleteIfExists(file)) {
        log.info("Deleted snapshot {}", file);
      }
    } catch (IOException e) {
      throw new IngestionStateException("Failed to delete snapshot " + file, e);
    }
  }

  private void moveIntoPlace(Path temp, Path file) throws IOException {
    try {
      Files.move(
          temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, using plain replace", file);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not remove temporary snapshot {}: {}", temp, e.getMessage());
    }
  }
}
