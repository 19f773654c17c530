package com.etendoerp.eventlog.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of decoding one native record: either the raw XML or the structured form.
 * <p>
 * This is a closed union discriminated by {@link #getKind()}. Both shapes carry the provider
 * name, record id, creation time and level, so filtering and checkpointing never re-parse.
 * Accessing the payload of the other shape throws {@link IllegalStateException}.
 */
public final class DecodedEvent {

  public enum Kind {
    RAW,
    STRUCTURED
  }

  private final Kind kind;
  private final String providerName;
  private final long recordId;
  private final Instant timeCreated;
  private final long level;
  private final String rawXml;
  private final StructuredEvent structured;

  private DecodedEvent(Kind kind, String providerName, long recordId, Instant timeCreated,
      long level, String rawXml, StructuredEvent structured) {
    this.kind = kind;
    this.providerName = Objects.requireNonNull(providerName, "providerName");
    this.recordId = recordId;
    this.timeCreated = timeCreated;
    this.level = level;
    this.rawXml = rawXml;
    this.structured = structured;
  }

  public static DecodedEvent raw(String providerName, long recordId, Instant timeCreated,
      long level, String xml) {
    return new DecodedEvent(Kind.RAW, providerName, recordId, timeCreated, level,
        Objects.requireNonNull(xml, "xml"), null);
  }

  public static DecodedEvent structured(StructuredEvent event) {
    return new DecodedEvent(Kind.STRUCTURED, event.getProvider().getName(), event.getRecordId(),
        event.getTimeCreated(), event.getLevel(), null, event);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isRaw() {
    return kind == Kind.RAW;
  }

  public String getProviderName() {
    return providerName;
  }

  public long getRecordId() {
    return recordId;
  }

  /**
   * @return the creation time, or null when the record did not carry a parsable one
   */
  public Instant getTimeCreated() {
    return timeCreated;
  }

  public long getLevel() {
    return level;
  }

  public String getRawXml() {
    if (kind != Kind.RAW) {
      throw new IllegalStateException("structured event has no raw body");
    }
    return rawXml;
  }

  public StructuredEvent getStructured() {
    if (kind != Kind.STRUCTURED) {
      throw new IllegalStateException("raw event has no structured body");
    }
    return structured;
  }

  @Override
  public String toString() {
    return "DecodedEvent{" + kind + ", provider='" + providerName + "', recordId=" + recordId + "}";
  }
}
