package com.etendoerp.eventlog.delivery;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.etendoerp.eventlog.model.DecodedEvent;
import com.etendoerp.eventlog.model.LogRecord;
import com.etendoerp.eventlog.model.Severity;
import com.etendoerp.eventlog.model.StructuredEvent;

/**
 * Converts decoded events into {@link LogRecord}s.
 */
public class LogRecordConverter {
  public static final String ORIGINAL_ATTRIBUTE = "log.record.original";

  private final boolean includeOriginal;
  private final Clock clock;

  public LogRecordConverter(boolean includeOriginal) {
    this(includeOriginal, Clock.systemUTC());
  }

  LogRecordConverter(boolean includeOriginal, Clock clock) {
    this.includeOriginal = includeOriginal;
    this.clock = clock;
  }

  public List<LogRecord> convert(List<DecodedEvent> events) {
    Instant observed = clock.instant();
    List<LogRecord> records = new ArrayList<>(events.size());
    for (DecodedEvent event : events) {
      records.add(convert(event, observed));
    }
    return records;
  }

  LogRecord convert(DecodedEvent event, Instant observed) {
    Instant timestamp = event.getTimeCreated() == null ? observed : event.getTimeCreated();
    Severity severity = Severity.fromEventLevel(event.getLevel());
    if (event.isRaw()) {
      return new LogRecord(timestamp, observed, severity, severity.name(), event.getRawXml(),
          new LinkedHashMap<>());
    }
    StructuredEvent structured = event.getStructured();
    Map<String, Object> attributes = new LinkedHashMap<>();
    if (includeOriginal) {
      attributes.put(ORIGINAL_ATTRIBUTE, structured.getOriginalXml());
    }
    String severityText = StringUtils.defaultIfEmpty(structured.getLevelText(), severity.name());
    return new LogRecord(timestamp, observed, severity, severityText, toBody(structured), attributes);
  }

  /**
   * Builds the structured body. Key order is stable.
   */
  static Map<String, Object> toBody(StructuredEvent event) {
    Map<String, Object> body = new LinkedHashMap<>();

    Map<String, Object> eventId = new LinkedHashMap<>();
    eventId.put("id", event.getEventId().getId());
    eventId.put("qualifiers", event.getEventId().getQualifiers());
    body.put("event_id", eventId);

    Map<String, Object> provider = new LinkedHashMap<>();
    provider.put("name", event.getProvider().getName());
    provider.put("guid", event.getProvider().getGuid());
    provider.put("event_source", event.getProvider().getEventSource());
    body.put("provider", provider);

    body.put("system_time", event.getSystemTime());
    body.put("computer", event.getComputer());
    body.put("channel", event.getChannel());
    body.put("record_id", event.getRecordId());
    body.put("level", event.getLevel());
    body.put("task", event.getTask());
    body.put("opcode", event.getOpcode());
    body.put("keywords", event.getKeywords());
    body.put("message", event.getMessage());
    body.put("event_data", event.getEventData().toBodyValue());

    putIfNotEmpty(body, "level_text", event.getLevelText());
    putIfNotEmpty(body, "task_text", event.getTaskText());
    putIfNotEmpty(body, "opcode_text", event.getOpcodeText());
    if (!event.getKeywordsText().isEmpty()) {
      body.put("keywords_text", new ArrayList<>(event.getKeywordsText()));
    }

    if (event.getProcessId() != null || event.getThreadId() != null) {
      Map<String, Object> execution = new LinkedHashMap<>();
      execution.put("process_id", event.getProcessId());
      execution.put("thread_id", event.getThreadId());
      body.put("execution", execution);
    }
    if (StringUtils.isNotEmpty(event.getUserId())) {
      Map<String, Object> security = new LinkedHashMap<>();
      security.put("user_id", event.getUserId());
      body.put("security", security);
    }
    if (StringUtils.isNotEmpty(event.getActivityId())
        || StringUtils.isNotEmpty(event.getRelatedActivityId())) {
      Map<String, Object> correlation = new LinkedHashMap<>();
      putIfNotEmpty(correlation, "activity_id", event.getActivityId());
      putIfNotEmpty(correlation, "related_activity_id", event.getRelatedActivityId());
      body.put("correlation", correlation);
    }
    return body;
  }

  private static void putIfNotEmpty(Map<String, Object> map, String key, String value) {
    if (StringUtils.isNotEmpty(value)) {
      map.put(key, value);
    }
  }
}
