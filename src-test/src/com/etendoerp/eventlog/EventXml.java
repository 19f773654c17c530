package com.etendoerp.eventlog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@code <Event>} documents shaped like the ones {@code EvtRender} produces.
 */
public class EventXml {
  public static final String NS = "http://schemas.microsoft.com/win/2004/08/events/event";

  private final long recordId;
  private String provider = "Test";
  private String providerGuid;
  private String eventSource;
  private long eventId = 10;
  private Long qualifiers = 0L;
  private long level = 4;
  private long task;
  private long opcode;
  private String keywords = "0x80000000000000";
  private Instant timeCreated = Instant.parse("2024-05-01T10:15:30.1234567Z");
  private String channel = "Application";
  private String computer = "test-host";
  private String userId;
  private String activityId;
  private final List<String[]> data = new ArrayList<>();
  private String binary;
  private String message;
  private String levelText;
  private final List<String> keywordTexts = new ArrayList<>();

  private EventXml(long recordId) {
    this.recordId = recordId;
  }

  public static EventXml event(long recordId) {
    return new EventXml(recordId);
  }

  public EventXml provider(String provider) {
    this.provider = provider;
    return this;
  }

  public EventXml providerGuid(String providerGuid) {
    this.providerGuid = providerGuid;
    return this;
  }

  public EventXml eventSource(String eventSource) {
    this.eventSource = eventSource;
    return this;
  }

  public EventXml eventId(long eventId) {
    this.eventId = eventId;
    return this;
  }

  public EventXml qualifiers(Long qualifiers) {
    this.qualifiers = qualifiers;
    return this;
  }

  public EventXml level(long level) {
    this.level = level;
    return this;
  }

  public EventXml task(long task) {
    this.task = task;
    return this;
  }

  public EventXml opcode(long opcode) {
    this.opcode = opcode;
    return this;
  }

  public EventXml keywords(String keywords) {
    this.keywords = keywords;
    return this;
  }

  public EventXml timeCreated(Instant timeCreated) {
    this.timeCreated = timeCreated;
    return this;
  }

  public EventXml channel(String channel) {
    this.channel = channel;
    return this;
  }

  public EventXml computer(String computer) {
    this.computer = computer;
    return this;
  }

  public EventXml userId(String userId) {
    this.userId = userId;
    return this;
  }

  public EventXml activityId(String activityId) {
    this.activityId = activityId;
    return this;
  }

  /**
   * Adds a {@code <Data>} element; a null name produces an unnamed element.
   */
  public EventXml data(String name, String value) {
    data.add(new String[] { name, value });
    return this;
  }

  public EventXml binary(String binary) {
    this.binary = binary;
    return this;
  }

  /**
   * Adds a {@code RenderingInfo} section carrying the message.
   */
  public EventXml message(String message) {
    this.message = message;
    return this;
  }

  public EventXml levelText(String levelText) {
    this.levelText = levelText;
    return this;
  }

  public EventXml keywordText(String keywordText) {
    keywordTexts.add(keywordText);
    return this;
  }

  public long getRecordId() {
    return recordId;
  }

  public Instant getTimeCreated() {
    return timeCreated;
  }

  public String getProvider() {
    return provider;
  }

  public String build() {
    StringBuilder xml = new StringBuilder();
    xml.append("<Event xmlns='").append(NS).append("'>");
    xml.append("<System>");
    xml.append("<Provider Name='").append(escape(provider)).append("'");
    if (providerGuid != null) {
      xml.append(" Guid='").append(providerGuid).append("'");
    }
    if (eventSource != null) {
      xml.append(" EventSourceName='").append(escape(eventSource)).append("'");
    }
    xml.append("/>");
    xml.append("<EventID");
    if (qualifiers != null) {
      xml.append(" Qualifiers='").append(qualifiers).append("'");
    }
    xml.append(">").append(eventId).append("</EventID>");
    xml.append("<Version>0</Version>");
    xml.append("<Level>").append(level).append("</Level>");
    xml.append("<Task>").append(task).append("</Task>");
    xml.append("<Opcode>").append(opcode).append("</Opcode>");
    xml.append("<Keywords>").append(keywords).append("</Keywords>");
    if (timeCreated != null) {
      xml.append("<TimeCreated SystemTime='").append(timeCreated).append("'/>");
    }
    xml.append("<EventRecordID>").append(recordId).append("</EventRecordID>");
    if (activityId != null) {
      xml.append("<Correlation ActivityID='").append(activityId).append("'/>");
    } else {
      xml.append("<Correlation/>");
    }
    xml.append("<Execution ProcessID='1234' ThreadID='5678'/>");
    xml.append("<Channel>").append(escape(channel)).append("</Channel>");
    xml.append("<Computer>").append(escape(computer)).append("</Computer>");
    if (userId != null) {
      xml.append("<Security UserID='").append(userId).append("'/>");
    } else {
      xml.append("<Security/>");
    }
    xml.append("</System>");
    if (!data.isEmpty() || binary != null) {
      xml.append("<EventData>");
      for (String[] value : data) {
        xml.append("<Data");
        if (value[0] != null) {
          xml.append(" Name='").append(escape(value[0])).append("'");
        }
        xml.append(">").append(escape(value[1])).append("</Data>");
      }
      if (binary != null) {
        xml.append("<Binary>").append(binary).append("</Binary>");
      }
      xml.append("</EventData>");
    }
    if (message != null || levelText != null || !keywordTexts.isEmpty()) {
      xml.append("<RenderingInfo Culture='en-US'>");
      if (message != null) {
        xml.append("<Message>").append(escape(message)).append("</Message>");
      }
      if (levelText != null) {
        xml.append("<Level>").append(escape(levelText)).append("</Level>");
      }
      if (!keywordTexts.isEmpty()) {
        xml.append("<Keywords>");
        for (String keyword : keywordTexts) {
          xml.append("<Keyword>").append(escape(keyword)).append("</Keyword>");
        }
        xml.append("</Keywords>");
      }
      xml.append("</RenderingInfo>");
    }
    xml.append("</Event>");
    return xml.toString();
  }

  private static String escape(String value) {
    return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("'", "&apos;");
  }
}
