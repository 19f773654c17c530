package com.etendoerp.eventlog.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Normalized log record handed to the downstream sink.
 * <p>
 * The body is a {@code String} for raw events and an ordered {@code Map<String, Object>} for
 * structured ones.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class LogRecord {

  private final Instant timestamp;
  private final Instant observedTimestamp;
  private final Severity severity;
  private final String severityText;
  private final Object body;
  private final Map<String, Object> attributes;

  public LogRecord(Instant timestamp, Instant observedTimestamp, Severity severity,
      String severityText, Object body, Map<String, Object> attributes) {
    this.timestamp = timestamp;
    this.observedTimestamp = observedTimestamp;
    this.severity = severity;
    this.severityText = severityText;
    this.body = body;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public Instant getObservedTimestamp() {
    return observedTimestamp;
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getSeverityText() {
    return severityText;
  }

  public Object getBody() {
    return body;
  }

  /**
   * @return the body as a map, or an empty map for raw records
   */
  @JsonIgnore
  @SuppressWarnings("unchecked")
  public Map<String, Object> getBodyMap() {
    return body instanceof Map ? (Map<String, Object>) body : Collections.emptyMap();
  }

  /**
   * @return the body as a string, or null for structured records
   */
  @JsonIgnore
  public String getBodyString() {
    return body instanceof String ? (String) body : null;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }
}
