package com.etendoerp.eventlog.monitoring;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for one channel receiver. Recording is thread-safe; the channel worker is the
 * main writer and any thread may read a snapshot.
 */
public class ReceiverMetrics {
  private final String channel;
  private final LongAdder eventsReceived = new LongAdder();
  private final LongAdder eventsFiltered = new LongAdder();
  private final LongAdder eventsDelivered = new LongAdder();
  private final LongAdder decodeFailures = new LongAdder();
  private final LongAdder degradedRenders = new LongAdder();
  private final LongAdder deliveryRetries = new LongAdder();
  private final LongAdder deliveryFailures = new LongAdder();
  private final LongAdder resubscriptions = new LongAdder();
  private final LongAdder checkpointFailures = new LongAdder();
  private final AtomicLong lastCheckpointRecordId = new AtomicLong(-1);
  private final AtomicLong lastActivity = new AtomicLong(0);

  public ReceiverMetrics(String channel) {
    this.channel = channel;
  }

  public void recordReceived(int count) {
    eventsReceived.add(count);
    lastActivity.set(System.currentTimeMillis());
  }

  public void recordFiltered() {
    eventsFiltered.increment();
  }

  public void recordDelivered(int count) {
    eventsDelivered.add(count);
  }

  public void recordDecodeFailure() {
    decodeFailures.increment();
  }

  public void recordDegradedRender() {
    degradedRenders.increment();
  }

  public void recordDeliveryRetry() {
    deliveryRetries.increment();
  }

  public void recordDeliveryFailure() {
    deliveryFailures.increment();
  }

  public void recordResubscription() {
    resubscriptions.increment();
  }

  public void recordCheckpoint(long recordId) {
    lastCheckpointRecordId.set(recordId);
  }

  public void recordCheckpointFailure() {
    checkpointFailures.increment();
  }

  public String getChannel() { return channel; }
  public long getEventsReceived() { return eventsReceived.sum(); }
  public long getEventsFiltered() { return eventsFiltered.sum(); }
  public long getEventsDelivered() { return eventsDelivered.sum(); }
  public long getDecodeFailures() { return decodeFailures.sum(); }
  public long getDegradedRenders() { return degradedRenders.sum(); }
  public long getDeliveryRetries() { return deliveryRetries.sum(); }
  public long getDeliveryFailures() { return deliveryFailures.sum(); }
  public long getResubscriptions() { return resubscriptions.sum(); }
  public long getCheckpointFailures() { return checkpointFailures.sum(); }
  public long getLastCheckpointRecordId() { return lastCheckpointRecordId.get(); }
  public long getLastActivity() { return lastActivity.get(); }

  /**
   * @return a point-in-time copy of every counter, keyed by metric name
   */
  public Map<String, Object> getSnapshot() {
    Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put("channel", channel);
    snapshot.put("eventsReceived", getEventsReceived());
    snapshot.put("eventsFiltered", getEventsFiltered());
    snapshot.put("eventsDelivered", getEventsDelivered());
    snapshot.put("decodeFailures", getDecodeFailures());
    snapshot.put("degradedRenders", getDegradedRenders());
    snapshot.put("deliveryRetries", getDeliveryRetries());
    snapshot.put("deliveryFailures", getDeliveryFailures());
    snapshot.put("resubscriptions", getResubscriptions());
    snapshot.put("checkpointFailures", getCheckpointFailures());
    snapshot.put("lastCheckpointRecordId", getLastCheckpointRecordId());
    snapshot.put("lastActivity", getLastActivity());
    return snapshot;
  }
}
