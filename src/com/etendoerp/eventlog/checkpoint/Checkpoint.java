package com.etendoerp.eventlog.checkpoint;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Last delivered position of a channel.
 */
public class Checkpoint {
  private final String channel;
  private final long recordId;
  private final Instant timestamp;

  @JsonCreator
  public Checkpoint(@JsonProperty("channel") String channel,
      @JsonProperty("recordId") long recordId,
      @JsonProperty("timestamp") Instant timestamp) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.recordId = recordId;
    this.timestamp = timestamp;
  }

  public String getChannel() {
    return channel;
  }

  public long getRecordId() {
    return recordId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Checkpoint)) {
      return false;
    }
    Checkpoint other = (Checkpoint) o;
    return recordId == other.recordId && channel.equals(other.channel)
        && Objects.equals(timestamp, other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(channel, recordId, timestamp);
  }

  @Override
  public String toString() {
    return "Checkpoint{channel='" + channel + "', recordId=" + recordId + ", timestamp=" + timestamp + "}";
  }
}
