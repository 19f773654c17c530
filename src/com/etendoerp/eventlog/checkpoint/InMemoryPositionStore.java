package com.etendoerp.eventlog.checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store used when no persistent storage is configured. Positions survive a
 * receiver restart within the same JVM only.
 */
public class InMemoryPositionStore implements PositionStore {
  private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

  @Override
  public Optional<Checkpoint> load(String channel) {
    return Optional.ofNullable(checkpoints.get(channel));
  }

  @Override
  public void save(Checkpoint checkpoint) {
    checkpoints.put(checkpoint.getChannel(), checkpoint);
  }
}
