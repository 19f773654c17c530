package com.etendoerp.eventlog.model;

import java.util.Objects;

/**
 * Two-part event identifier: the event id and its optional qualifiers.
 */
public class EventId {
  private final long id;
  private final long qualifiers;

  public EventId(long id, long qualifiers) {
    this.id = id;
    this.qualifiers = qualifiers;
  }

  public long getId() {
    return id;
  }

  public long getQualifiers() {
    return qualifiers;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EventId)) {
      return false;
    }
    EventId other = (EventId) o;
    return id == other.id && qualifiers == other.qualifiers;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, qualifiers);
  }

  @Override
  public String toString() {
    return "EventId{id=" + id + ", qualifiers=" + qualifiers + "}";
  }
}
