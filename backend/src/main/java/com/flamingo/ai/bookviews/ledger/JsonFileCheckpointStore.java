package com.flamingo.ai.bookviews.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flamingo.ai.bookviews.domain.CheckpointEntry;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Checkpoint store backed by one JSON file. Snapshots are written to a sibling temp file and moved
 * over the previous one, so a crash mid-write leaves the old snapshot intact.
 */
@Slf4j
public class JsonFileCheckpointStore implements CheckpointStore {

  private static final TypeReference<List<CheckpointEntry>> ENTRIES = new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper objectMapper;

  public JsonFileCheckpointStore(Path file) {
    this.file = file.toAbsolutePath();
    this.objectMapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  public void save(List<CheckpointEntry> entries) throws IOException {
    Path directory = file.getParent();
    Files.createDirectories(directory);
    Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
    try {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
      try {
        Files.move(
            temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.warn("Atomic move not supported for {}, falling back to replace", file);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override
  public List<CheckpointEntry> load() throws IOException {
    if (!Files.exists(file)) {
      return List.of();
    }
    return objectMapper.readValue(file.toFile(), ENTRIES);
  }

  public Path getFile() {
    return file;
  }
}
