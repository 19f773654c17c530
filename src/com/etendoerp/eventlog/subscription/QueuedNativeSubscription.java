package com.etendoerp.eventlog.subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.exception.SubscriptionException;

/**
 * Bounded hand-off between a push-style native API and the channel worker.
 * <p>
 * Native callback threads call {@link #offer(NativeEventRecord)}; the worker drains the queue
 * through {@link #next(int)}. A callback waits at most {@code offerTimeoutMs} for space. When
 * the queue stays full the subscription is marked broken: later callbacks are discarded and,
 * once the records queued before the overflow are drained, {@code next} throws so the worker
 * resubscribes after the last record it actually saw. No event is lost, only re-read.
 */
public class QueuedNativeSubscription implements NativeSubscription {
  private static final Logger log = LogManager.getLogger();

  private final BlockingQueue<NativeEventRecord> queue;
  private final long offerTimeoutMs;
  private final Runnable onClose;
  private final AtomicReference<SubscriptionException> failure = new AtomicReference<>();
  private volatile boolean closed;

  /**
   * @param capacity maximum number of records waiting for the worker
   * @param offerTimeoutMs how long a native callback may wait for space
   * @param onClose releases the native subscription, called once from {@link #close()}
   */
  public QueuedNativeSubscription(int capacity, long offerTimeoutMs, Runnable onClose) {
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.offerTimeoutMs = offerTimeoutMs;
    this.onClose = onClose;
  }

  /**
   * Hands a record over to the worker. Called from native callback threads.
   *
   * @return true if the record was queued; otherwise it has already been closed
   */
  public boolean offer(NativeEventRecord eventRecord) {
    if (closed || failure.get() != null) {
      eventRecord.close();
      return false;
    }
    try {
      if (queue.offer(eventRecord, offerTimeoutMs, TimeUnit.MILLISECONDS)) {
        return true;
      }
      fail(new SubscriptionException(
          "hand-off queue stayed full for " + offerTimeoutMs + " ms, subscription must be reopened"));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fail(new SubscriptionException("native callback interrupted", e));
    }
    eventRecord.close();
    return false;
  }

  /**
   * Marks the subscription as broken. Only the first failure is kept.
   */
  public void fail(SubscriptionException error) {
    if (failure.compareAndSet(null, error)) {
      log.warn("Push subscription failed: {}", error.getMessage());
    }
  }

  @Override
  public List<NativeEventRecord> next(int maxRecords) {
    List<NativeEventRecord> records = new ArrayList<>(Math.min(maxRecords, queue.size()));
    queue.drainTo(records, maxRecords);
    if (records.isEmpty()) {
      SubscriptionException error = failure.get();
      if (error != null) {
        throw error;
      }
    }
    return records;
  }

  int pending() {
    return queue.size();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      onClose.run();
    } finally {
      List<NativeEventRecord> leftovers = new ArrayList<>();
      queue.drainTo(leftovers);
      leftovers.forEach(NativeEventRecord::close);
    }
  }
}
