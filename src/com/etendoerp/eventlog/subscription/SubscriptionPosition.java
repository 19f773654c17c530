package com.etendoerp.eventlog.subscription;

import java.time.Instant;

/**
 * Where a native subscription starts reading.
 */
public class SubscriptionPosition {

  public enum Kind {
    /** Oldest record still present in the channel. */
    BEGINNING,
    /** Only records created after the subscription opens. */
    END,
    /** Records whose record id is greater than {@link #getRecordId()}. */
    AFTER_RECORD,
    /** Records created at or after {@link #getTimestamp()}. */
    SINCE_TIMESTAMP
  }

  private static final SubscriptionPosition BEGINNING_POSITION =
      new SubscriptionPosition(Kind.BEGINNING, 0, null);
  private static final SubscriptionPosition END_POSITION =
      new SubscriptionPosition(Kind.END, 0, null);

  private final Kind kind;
  private final long recordId;
  private final Instant timestamp;

  private SubscriptionPosition(Kind kind, long recordId, Instant timestamp) {
    this.kind = kind;
    this.recordId = recordId;
    this.timestamp = timestamp;
  }

  public static SubscriptionPosition beginning() {
    return BEGINNING_POSITION;
  }

  public static SubscriptionPosition end() {
    return END_POSITION;
  }

  public static SubscriptionPosition afterRecord(long recordId) {
    return new SubscriptionPosition(Kind.AFTER_RECORD, recordId, null);
  }

  public static SubscriptionPosition sinceTimestamp(Instant timestamp) {
    return new SubscriptionPosition(Kind.SINCE_TIMESTAMP, 0, timestamp);
  }

  public Kind getKind() {
    return kind;
  }

  public long getRecordId() {
    return recordId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    switch (kind) {
      case AFTER_RECORD:
        return "after record " + recordId;
      case SINCE_TIMESTAMP:
        return "since " + timestamp;
      default:
        return kind.name().toLowerCase();
    }
  }
}
