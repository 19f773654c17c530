package com.etendoerp.eventlog;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import com.etendoerp.eventlog.delivery.LogSink;
import com.etendoerp.eventlog.model.LogRecord;

/**
 * Sink that keeps every record it accepted. Can be told to fail a number of calls first.
 */
public class RecordingLogSink implements LogSink {
  private final List<LogRecord> records = new CopyOnWriteArrayList<>();
  private final AtomicInteger failures = new AtomicInteger();
  private final AtomicInteger calls = new AtomicInteger();
  private volatile RuntimeException failure = new IllegalStateException("sink unavailable");
  private volatile boolean closed;

  public void failNext(int count) {
    failures.set(count);
  }

  public void failNext(int count, RuntimeException error) {
    failure = error;
    failures.set(count);
  }

  @Override
  public void consume(List<LogRecord> batch) {
    calls.incrementAndGet();
    if (failures.get() > 0) {
      failures.decrementAndGet();
      throw failure;
    }
    records.addAll(batch);
  }

  public List<LogRecord> getRecords() {
    return new ArrayList<>(records);
  }

  public int getCalls() {
    return calls.get();
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
  }
}
