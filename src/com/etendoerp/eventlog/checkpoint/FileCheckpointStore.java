package com.etendoerp.eventlog.checkpoint;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.exception.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Stores one JSON file per channel inside a directory. Writes go to a temporary file that
 * is then moved over the previous checkpoint, so a crash mid-write leaves the old value intact.
 */
public class FileCheckpointStore implements PositionStore {
  private static final Logger log = LogManager.getLogger();
  private static final String SUFFIX = ".checkpoint.json";

  private final Path directory;
  private final ObjectMapper objectMapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  public FileCheckpointStore(Path directory) {
    this.directory = directory;
  }

  @Override
  public void open() {
    try {
      Files.createDirectories(directory);
      log.debug("Checkpoint directory ready: {}", directory);
    } catch (IOException e) {
      throw new StoreException("Cannot create checkpoint directory " + directory, e);
    }
  }

  @Override
  public Optional<Checkpoint> load(String channel) {
    Path file = fileFor(channel);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(file.toFile(), Checkpoint.class));
    } catch (IOException e) {
      throw new StoreException("Cannot read checkpoint for channel " + channel, e);
    }
  }

  @Override
  public void save(Checkpoint checkpoint) {
    Path target = fileFor(checkpoint.getChannel());
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      Files.write(temp, objectMapper.writeValueAsBytes(checkpoint));
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new StoreException("Cannot write checkpoint for channel " + checkpoint.getChannel(), e);
    }
  }

  /**
   * Channel names may contain path separators ({@code Microsoft-Windows-Sysmon/Operational}),
   * hence the URL encoding.
   */
  Path fileFor(String channel) {
    return directory.resolve(URLEncoder.encode(channel, StandardCharsets.UTF_8) + SUFFIX);
  }
}
