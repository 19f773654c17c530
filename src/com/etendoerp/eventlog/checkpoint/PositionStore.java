package com.etendoerp.eventlog.checkpoint;

import java.util.Optional;

import com.etendoerp.eventlog.exception.StoreException;

/**
 * Durable storage of channel checkpoints. Keys are channel names, so several receivers can
 * share one store without overwriting each other.
 */
public interface PositionStore extends AutoCloseable {

  /**
   * Prepares the store for use. Called once when a receiver starts.
   *
   * @throws StoreException if the backing storage cannot be opened
   */
  default void open() {
  }

  /**
   * @return the last saved checkpoint for the channel, if any
   * @throws StoreException if the stored value cannot be read
   */
  Optional<Checkpoint> load(String channel);

  /**
   * Persists the checkpoint under its channel, replacing any previous value.
   *
   * @throws StoreException if the value could not be written
   */
  void save(Checkpoint checkpoint);

  @Override
  default void close() {
  }
}
