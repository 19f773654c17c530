package com.etendoerp.eventlog.delivery;

import java.util.List;

import com.etendoerp.eventlog.model.LogRecord;

/**
 * Downstream consumer of log records.
 */
public interface LogSink extends AutoCloseable {

  /**
   * Hands a batch over. Returns only once the records are accepted downstream.
   *
   * @throws Exception on failure; a {@link com.etendoerp.eventlog.exception.DeliveryException}
   *     of permanent kind is never retried, anything else is
   */
  void consume(List<LogRecord> records) throws Exception;

  @Override
  default void close() {
  }
}
