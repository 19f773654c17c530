package com.etendoerp.eventlog.subscription;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.checkpoint.Checkpoint;
import com.etendoerp.eventlog.config.EventLogReceiverConfig;
import com.etendoerp.eventlog.config.StartPolicy;
import com.etendoerp.eventlog.decoder.EventDecoder;
import com.etendoerp.eventlog.delivery.DeliveryBatch;
import com.etendoerp.eventlog.exception.ConfigException;
import com.etendoerp.eventlog.exception.DecodeException;
import com.etendoerp.eventlog.exception.OpenException;
import com.etendoerp.eventlog.exception.SubscriptionException;
import com.etendoerp.eventlog.filter.ProviderFilter;
import com.etendoerp.eventlog.model.DecodedEvent;
import com.etendoerp.eventlog.monitoring.ReceiverMetrics;
import com.etendoerp.eventlog.util.CancellationSignal;

/**
 * Owns the native subscription of a channel and drives the worker loop that pulls, decodes,
 * filters and hands records over in receipt order.
 * <p>
 * Mid-stream subscription errors are recovered by reopening after the last observed record,
 * with an exponentially growing delay. Once {@code maxConsecutiveFailures} reopen cycles fail
 * in a row the error propagates to the caller.
 */
public class SubscriptionManager {
  private static final Logger log = LogManager.getLogger();
  private static final long RESUBSCRIBE_BACKOFF_MULTIPLIER = 2;

  private final EventLogApi api;
  private final ReceiverMetrics metrics;

  public SubscriptionManager(EventLogApi api, ReceiverMetrics metrics) {
    this.api = api;
    this.metrics = metrics;
  }

  /**
   * Opens the native subscription at the position the start policy resolves to.
   *
   * @param config channel configuration
   * @param checkpoint last saved position of the channel, or null
   * @throws ConfigException if the checkpoint cannot be used for this channel; raised before
   *     any native call
   * @throws OpenException if the native subscription cannot be opened
   */
  public SubscriptionHandle open(EventLogReceiverConfig config, Checkpoint checkpoint) {
    SubscriptionPosition position = resolvePosition(config, checkpoint);
    log.info("Opening subscription to channel '{}' {}", config.getChannel(), position);
    NativeSubscription subscription = api.subscribe(config.getChannel(), position,
        config.getSubscriptionMode(), config.getMaxReads());
    EventDecoder decoder = new EventDecoder(config.isSuppressRenderingInfo(), metrics);
    ProviderFilter filter = new ProviderFilter(config.getExcludeProviders());
    return new SubscriptionHandle(config, position, decoder, filter, subscription);
  }

  static SubscriptionPosition resolvePosition(EventLogReceiverConfig config, Checkpoint checkpoint) {
    if (checkpoint != null) {
      if (!config.getChannel().equals(checkpoint.getChannel())) {
        throw new ConfigException("checkpoint belongs to channel '" + checkpoint.getChannel()
            + "', not '" + config.getChannel() + "'");
      }
      if (checkpoint.getRecordId() < 0) {
        throw new ConfigException("checkpoint record id must not be negative: " + checkpoint.getRecordId());
      }
    }
    StartPolicy policy = config.resolveStartPolicy(checkpoint != null);
    switch (policy) {
      case RESUME:
        return SubscriptionPosition.afterRecord(checkpoint.getRecordId());
      case BEGINNING:
        return SubscriptionPosition.beginning();
      case TIMESTAMP:
        if (config.getStartTimestamp() == null) {
          throw new ConfigException("start policy TIMESTAMP requires a start timestamp");
        }
        return SubscriptionPosition.sinceTimestamp(config.getStartTimestamp());
      case END:
        return SubscriptionPosition.end();
      default:
        throw new ConfigException("unsupported start policy " + policy);
    }
  }

  /**
   * Runs the worker loop until the signal is cancelled. Blocks the calling thread.
   *
   * @throws SubscriptionException once resubscription gave up
   * @throws com.etendoerp.eventlog.exception.DeliveryException when the handler fails
   *     permanently
   */
  public void run(SubscriptionHandle handle, BatchHandler handler, CancellationSignal signal) {
    EventLogReceiverConfig config = handle.getConfig();
    long pollIntervalMs = config.getPollInterval().toMillis();
    int consecutiveFailures = 0;

    while (!signal.isCancelled()) {
      List<NativeEventRecord> records;
      try {
        if (!handle.isOpen()) {
          reopen(handle);
        }
        records = handle.getSubscription().next(config.getMaxReads());
        consecutiveFailures = 0;
      } catch (SubscriptionException | OpenException e) {
        consecutiveFailures++;
        closeSubscription(handle);
        if (consecutiveFailures >= config.getMaxConsecutiveFailures()) {
          log.error("Subscription to channel '{}' failed {} times in a row, giving up: {}",
              handle.getChannel(), consecutiveFailures, e.getMessage());
          throw e instanceof SubscriptionException ? (SubscriptionException) e
              : new SubscriptionException("cannot reopen channel " + handle.getChannel(), e);
        }
        long delay = resubscribeDelay(config, consecutiveFailures);
        log.warn("Subscription to channel '{}' failed (attempt {}/{}): {}. Resubscribing {} in {} ms",
            handle.getChannel(), consecutiveFailures, config.getMaxConsecutiveFailures(),
            e.getMessage(), handle.resumePosition(), delay);
        metrics.recordResubscription();
        signal.await(delay);
        continue;
      }

      if (records.isEmpty()) {
        signal.await(pollIntervalMs);
        continue;
      }
      DeliveryBatch batch = decodeTick(handle, records);
      if (batch != null) {
        handler.onBatch(batch);
      }
    }
    log.debug("Worker loop for channel '{}' cancelled", handle.getChannel());
  }

  private DeliveryBatch decodeTick(SubscriptionHandle handle, List<NativeEventRecord> records) {
    metrics.recordReceived(records.size());
    boolean raw = handle.getConfig().isRaw();
    List<DecodedEvent> events = new ArrayList<>(records.size());
    boolean observed = false;
    for (NativeEventRecord nativeRecord : records) {
      try {
        DecodedEvent event = handle.getDecoder().decode(nativeRecord, raw);
        handle.observe(event.getRecordId());
        observed = true;
        if (handle.getFilter().accept(event)) {
          events.add(event);
        } else {
          metrics.recordFiltered();
        }
      } catch (DecodeException e) {
        metrics.recordDecodeFailure();
        log.warn("Skipping undecodable record on channel '{}': {}", handle.getChannel(), e.getMessage());
      } finally {
        nativeRecord.close();
      }
    }
    if (!observed) {
      return null;
    }
    return new DeliveryBatch(handle.getChannel(), events, handle.getLastObservedRecordId());
  }

  private void reopen(SubscriptionHandle handle) {
    EventLogReceiverConfig config = handle.getConfig();
    SubscriptionPosition position = handle.resumePosition();
    log.info("Reopening subscription to channel '{}' {}", handle.getChannel(), position);
    handle.setSubscription(api.subscribe(config.getChannel(), position,
        config.getSubscriptionMode(), config.getMaxReads()));
  }

  private static long resubscribeDelay(EventLogReceiverConfig config, int attempt) {
    return config.getResubscribeDelay().toMillis()
        * (long) Math.pow(RESUBSCRIBE_BACKOFF_MULTIPLIER, attempt - 1f);
  }

  /**
   * Releases the native subscription. Safe to call more than once.
   */
  public void close(SubscriptionHandle handle) {
    if (handle != null) {
      closeSubscription(handle);
    }
  }

  private static void closeSubscription(SubscriptionHandle handle) {
    NativeSubscription subscription = handle.getSubscription();
    if (subscription == null) {
      return;
    }
    handle.setSubscription(null);
    try {
      subscription.close();
    } catch (RuntimeException e) {
      log.warn("Error closing subscription to channel '{}': {}", handle.getChannel(), e.getMessage());
    }
  }
}
