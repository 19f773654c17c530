package com.etendoerp.eventlog.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Fully decoded event: the {@code System} section, the {@code EventData} payload and the
 * rendered message.
 */
public class StructuredEvent {
  private final Provider provider;
  private final EventId eventId;
  private final long level;
  private final long task;
  private final long opcode;
  private final long keywords;
  private final String systemTime;
  private final Instant timeCreated;
  private final long recordId;
  private final String computer;
  private final String channel;
  private final Long processId;
  private final Long threadId;
  private final String userId;
  private final String activityId;
  private final String relatedActivityId;
  private final EventData eventData;
  private final String message;
  private final String levelText;
  private final String taskText;
  private final String opcodeText;
  private final List<String> keywordsText;
  private final String originalXml;

  private StructuredEvent(Builder builder) {
    this.provider = builder.provider == null ? new Provider("", "", "") : builder.provider;
    this.eventId = builder.eventId == null ? new EventId(0, 0) : builder.eventId;
    this.level = builder.level;
    this.task = builder.task;
    this.opcode = builder.opcode;
    this.keywords = builder.keywords;
    this.systemTime = StringUtils.defaultString(builder.systemTime);
    this.timeCreated = builder.timeCreated;
    this.recordId = builder.recordId;
    this.computer = StringUtils.defaultString(builder.computer);
    this.channel = StringUtils.defaultString(builder.channel);
    this.processId = builder.processId;
    this.threadId = builder.threadId;
    this.userId = builder.userId;
    this.activityId = builder.activityId;
    this.relatedActivityId = builder.relatedActivityId;
    this.eventData = builder.eventData == null ? EventData.empty() : builder.eventData;
    this.message = StringUtils.defaultString(builder.message);
    this.levelText = StringUtils.defaultString(builder.levelText);
    this.taskText = StringUtils.defaultString(builder.taskText);
    this.opcodeText = StringUtils.defaultString(builder.opcodeText);
    this.keywordsText = Collections.unmodifiableList(new ArrayList<>(builder.keywordsText));
    this.originalXml = StringUtils.defaultString(builder.originalXml);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Provider getProvider() {
    return provider;
  }

  public EventId getEventId() {
    return eventId;
  }

  public long getLevel() {
    return level;
  }

  public long getTask() {
    return task;
  }

  public long getOpcode() {
    return opcode;
  }

  public long getKeywords() {
    return keywords;
  }

  /**
   * @return the {@code TimeCreated/@SystemTime} attribute exactly as written
   */
  public String getSystemTime() {
    return systemTime;
  }

  /**
   * @return the parsed creation time, or null when the attribute is missing or malformed
   */
  public Instant getTimeCreated() {
    return timeCreated;
  }

  public long getRecordId() {
    return recordId;
  }

  public String getComputer() {
    return computer;
  }

  public String getChannel() {
    return channel;
  }

  public Long getProcessId() {
    return processId;
  }

  public Long getThreadId() {
    return threadId;
  }

  public String getUserId() {
    return userId;
  }

  public String getActivityId() {
    return activityId;
  }

  public String getRelatedActivityId() {
    return relatedActivityId;
  }

  public EventData getEventData() {
    return eventData;
  }

  public String getMessage() {
    return message;
  }

  public String getLevelText() {
    return levelText;
  }

  public String getTaskText() {
    return taskText;
  }

  public String getOpcodeText() {
    return opcodeText;
  }

  public List<String> getKeywordsText() {
    return keywordsText;
  }

  public String getOriginalXml() {
    return originalXml;
  }

  public static class Builder {
    private Provider provider;
    private EventId eventId;
    private long level;
    private long task;
    private long opcode;
    private long keywords;
    private String systemTime;
    private Instant timeCreated;
    private long recordId;
    private String computer;
    private String channel;
    private Long processId;
    private Long threadId;
    private String userId;
    private String activityId;
    private String relatedActivityId;
    private EventData eventData;
    private String message;
    private String levelText;
    private String taskText;
    private String opcodeText;
    private final List<String> keywordsText = new ArrayList<>();
    private String originalXml;

    public Builder provider(Provider provider) {
      this.provider = provider;
      return this;
    }

    public Builder eventId(EventId eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder level(long level) {
      this.level = level;
      return this;
    }

    public Builder task(long task) {
      this.task = task;
      return this;
    }

    public Builder opcode(long opcode) {
      this.opcode = opcode;
      return this;
    }

    public Builder keywords(long keywords) {
      this.keywords = keywords;
      return this;
    }

    public Builder systemTime(String systemTime) {
      this.systemTime = systemTime;
      return this;
    }

    public Builder timeCreated(Instant timeCreated) {
      this.timeCreated = timeCreated;
      return this;
    }

    public Builder recordId(long recordId) {
      this.recordId = recordId;
      return this;
    }

    public Builder computer(String computer) {
      this.computer = computer;
      return this;
    }

    public Builder channel(String channel) {
      this.channel = channel;
      return this;
    }

    public Builder processId(Long processId) {
      this.processId = processId;
      return this;
    }

    public Builder threadId(Long threadId) {
      this.threadId = threadId;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder activityId(String activityId) {
      this.activityId = activityId;
      return this;
    }

    public Builder relatedActivityId(String relatedActivityId) {
      this.relatedActivityId = relatedActivityId;
      return this;
    }

    public Builder eventData(EventData eventData) {
      this.eventData = eventData;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder levelText(String levelText) {
      this.levelText = levelText;
      return this;
    }

    public Builder taskText(String taskText) {
      this.taskText = taskText;
      return this;
    }

    public Builder opcodeText(String opcodeText) {
      this.opcodeText = opcodeText;
      return this;
    }

    public Builder addKeywordText(String keywordText) {
      this.keywordsText.add(keywordText);
      return this;
    }

    public Builder originalXml(String originalXml) {
      this.originalXml = originalXml;
      return this;
    }

    public String getMessage() {
      return message;
    }

    public Provider getProvider() {
      return provider;
    }

    public StructuredEvent build() {
      return new StructuredEvent(this);
    }
  }
}
