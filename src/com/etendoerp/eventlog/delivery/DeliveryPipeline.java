package com.etendoerp.eventlog.delivery;

import java.time.Clock;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.checkpoint.Checkpoint;
import com.etendoerp.eventlog.checkpoint.PositionStore;
import com.etendoerp.eventlog.exception.DeliveryException;
import com.etendoerp.eventlog.exception.StoreException;
import com.etendoerp.eventlog.model.LogRecord;
import com.etendoerp.eventlog.monitoring.ReceiverMetrics;
import com.etendoerp.eventlog.retry.RetryPolicy;
import com.etendoerp.eventlog.subscription.BatchHandler;
import com.etendoerp.eventlog.util.CancellationSignal;

/**
 * Hands batches to the sink, retrying failures with backoff, and checkpoints a batch only once
 * the sink has accepted it.
 * <p>
 * A crash between delivery and checkpoint re-delivers the batch on restart; a batch is never
 * checkpointed without having been delivered.
 */
public class DeliveryPipeline implements BatchHandler {
  private static final Logger log = LogManager.getLogger();

  private final LogSink sink;
  private final LogRecordConverter converter;
  private final RetryPolicy retryPolicy;
  private final PositionStore positionStore;
  private final ReceiverMetrics metrics;
  private final CancellationSignal signal;
  private final Clock clock;

  public DeliveryPipeline(LogSink sink, LogRecordConverter converter, RetryPolicy retryPolicy,
      PositionStore positionStore, ReceiverMetrics metrics, CancellationSignal signal) {
    this(sink, converter, retryPolicy, positionStore, metrics, signal, Clock.systemUTC());
  }

  DeliveryPipeline(LogSink sink, LogRecordConverter converter, RetryPolicy retryPolicy,
      PositionStore positionStore, ReceiverMetrics metrics, CancellationSignal signal, Clock clock) {
    this.sink = sink;
    this.converter = converter;
    this.retryPolicy = retryPolicy;
    this.positionStore = positionStore;
    this.metrics = metrics;
    this.signal = signal;
    this.clock = clock;
  }

  @Override
  public void onBatch(DeliveryBatch batch) {
    deliver(batch);
  }

  /**
   * Delivers the batch, then saves its checkpoint. A batch without events (everything was
   * filtered) only moves the checkpoint.
   *
   * @throws DeliveryException always of permanent kind, when retries are exhausted or disabled,
   *     the sink rejected the batch permanently, or the wait between retries was cancelled
   */
  public void deliver(DeliveryBatch batch) {
    if (!batch.isEmpty()) {
      List<LogRecord> records = converter.convert(batch.getEvents());
      send(batch, records);
      metrics.recordDelivered(records.size());
      log.debug("Delivered {} records from channel '{}'", records.size(), batch.getChannel());
    }
    saveCheckpoint(batch);
  }

  private void send(DeliveryBatch batch, List<LogRecord> records) {
    long startTime = clock.millis();
    int attempt = 0;
    while (true) {
      try {
        sink.consume(records);
        return;
      } catch (DeliveryException e) {
        if (e.isPermanent()) {
          metrics.recordDeliveryFailure();
          log.error("Sink rejected {} records from channel '{}': {}", records.size(),
              batch.getChannel(), e.getMessage());
          throw e;
        }
        attempt++;
        backoff(batch, records, attempt, startTime, e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        metrics.recordDeliveryFailure();
        throw DeliveryException.permanent("delivery interrupted", e);
      } catch (Exception e) {
        attempt++;
        backoff(batch, records, attempt, startTime, e);
      }
    }
  }

  /**
   * Waits before the given retry, or fails permanently when no retry is granted.
   */
  private void backoff(DeliveryBatch batch, List<LogRecord> records, int attempt, long startTime,
      Exception cause) {
    long elapsed = clock.millis() - startTime;
    if (!retryPolicy.shouldRetry(attempt, elapsed)) {
      metrics.recordDeliveryFailure();
      log.error("Delivery of {} records from channel '{}' failed after {} attempt(s) in {} ms: {}",
          records.size(), batch.getChannel(), attempt, elapsed, cause.getMessage());
      throw DeliveryException.permanent("delivery failed after " + attempt + " attempt(s): "
          + cause.getMessage(), cause);
    }
    long delay = retryPolicy.getRetryDelay(attempt);
    metrics.recordDeliveryRetry();
    log.warn("Delivery to sink failed for channel '{}' (attempt {}), retrying in {} ms: {}",
        batch.getChannel(), attempt, delay, cause.getMessage());
    if (signal.await(delay)) {
      throw DeliveryException.permanent("delivery cancelled while waiting to retry", cause);
    }
  }

  private void saveCheckpoint(DeliveryBatch batch) {
    Checkpoint checkpoint = new Checkpoint(batch.getChannel(), batch.getLastRecordId(), clock.instant());
    try {
      positionStore.save(checkpoint);
      metrics.recordCheckpoint(batch.getLastRecordId());
    } catch (StoreException e) {
      metrics.recordCheckpointFailure();
      log.error("Cannot save checkpoint {}: {}", checkpoint, e.getMessage(), e);
    }
  }
}
