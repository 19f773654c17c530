package com.etendoerp.eventlog.delivery;

import java.util.Collections;
import java.util.List;

import com.etendoerp.eventlog.model.DecodedEvent;

/**
 * Events of one worker tick, in receipt order.
 * <p>
 * {@link #getLastRecordId()} is the highest record id observed in the tick, including records
 * that were filtered out, so checkpointing it moves the channel past them too.
 */
public class DeliveryBatch {
  private final String channel;
  private final List<DecodedEvent> events;
  private final long lastRecordId;

  public DeliveryBatch(String channel, List<DecodedEvent> events, long lastRecordId) {
    this.channel = channel;
    this.events = Collections.unmodifiableList(events);
    this.lastRecordId = lastRecordId;
  }

  public String getChannel() {
    return channel;
  }

  public List<DecodedEvent> getEvents() {
    return events;
  }

  public long getLastRecordId() {
    return lastRecordId;
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  public int size() {
    return events.size();
  }

  @Override
  public String toString() {
    return "DeliveryBatch{channel='" + channel + "', events=" + events.size()
        + ", lastRecordId=" + lastRecordId + "}";
  }
}
