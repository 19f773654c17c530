package com.etendoerp.eventlog.decoder;

import java.io.StringReader;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.exception.DecodeException;
import com.etendoerp.eventlog.model.DataValue;
import com.etendoerp.eventlog.model.EventData;
import com.etendoerp.eventlog.model.EventId;
import com.etendoerp.eventlog.model.Provider;
import com.etendoerp.eventlog.model.StructuredEvent;

/**
 * Streaming parser for Windows {@code <Event>} XML documents.
 */
public class EventXmlParser {
  private static final Logger log = LogManager.getLogger();

  private static final String SYSTEM = "System";
  private static final String EVENT_DATA = "EventData";
  private static final String RENDERING_INFO = "RenderingInfo";
  private static final String PROVIDER = "Provider";
  private static final String LEVEL = "Level";
  private static final String TASK = "Task";
  private static final String OPCODE = "Opcode";
  private static final String KEYWORDS = "Keywords";
  private static final String TIME_CREATED = "TimeCreated";
  private static final String EVENT_RECORD_ID = "EventRecordID";
  private static final String SYSTEM_TIME = "SystemTime";

  private final XMLInputFactory inputFactory;

  public EventXmlParser() {
    inputFactory = XMLInputFactory.newInstance();
    inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
  }

  /**
   * Header fields needed to filter and checkpoint an event kept in raw form.
   */
  public static class SystemSummary {
    private final String providerName;
    private final long recordId;
    private final Instant timeCreated;
    private final long level;

    SystemSummary(String providerName, long recordId, Instant timeCreated, long level) {
      this.providerName = providerName;
      this.recordId = recordId;
      this.timeCreated = timeCreated;
      this.level = level;
    }

    public String getProviderName() {
      return providerName;
    }

    public long getRecordId() {
      return recordId;
    }

    public Instant getTimeCreated() {
      return timeCreated;
    }

    public long getLevel() {
      return level;
    }
  }

  /**
   * Reads only the {@code System} section and stops there; the rest of the document is not
   * parsed.
   *
   * @throws DecodeException if the document is not well formed up to the end of {@code System}
   */
  public SystemSummary scanSystem(String xml) {
    String provider = "";
    long recordId = 0;
    Instant timeCreated = null;
    long level = 0;
    XMLStreamReader reader = open(xml);
    try {
      boolean inSystem = false;
      while (reader.hasNext()) {
        int event = reader.next();
        if (event == XMLStreamConstants.END_ELEMENT && SYSTEM.equals(reader.getLocalName())) {
          break;
        }
        if (event != XMLStreamConstants.START_ELEMENT) {
          continue;
        }
        String name = reader.getLocalName();
        if (SYSTEM.equals(name)) {
          inSystem = true;
        } else if (inSystem) {
          switch (name) {
            case PROVIDER:
              provider = StringUtils.defaultString(reader.getAttributeValue(null, "Name"));
              break;
            case EVENT_RECORD_ID:
              recordId = parseLong(reader.getElementText());
              break;
            case TIME_CREATED:
              timeCreated = parseTime(reader.getAttributeValue(null, SYSTEM_TIME));
              break;
            case LEVEL:
              level = parseLong(reader.getElementText());
              break;
            default:
              break;
          }
        }
      }
      return new SystemSummary(provider, recordId, timeCreated, level);
    } catch (XMLStreamException e) {
      throw new DecodeException("Malformed event XML: " + e.getMessage(), e);
    } finally {
      closeQuietly(reader);
    }
  }

  /**
   * Parses the whole document. The returned builder has no message set unless the document
   * carried a {@code RenderingInfo/Message}.
   *
   * @throws DecodeException if the document is not well formed
   */
  public StructuredEvent.Builder parse(String xml) {
    StructuredEvent.Builder builder = StructuredEvent.builder().originalXml(xml);
    List<DataValue> data = new ArrayList<>();
    String binary = "";
    XMLStreamReader reader = open(xml);
    try {
      // depth of the current element: 1 = Event, 2 = section, 3 = field
      int depth = 0;
      String section = "";
      while (reader.hasNext()) {
        int event = reader.next();
        if (event == XMLStreamConstants.END_ELEMENT) {
          depth--;
          continue;
        }
        if (event != XMLStreamConstants.START_ELEMENT) {
          continue;
        }
        depth++;
        String name = reader.getLocalName();
        if (depth == 2) {
          section = name;
        } else if (depth == 3 && SYSTEM.equals(section)) {
          depth -= readSystemField(reader, name, builder);
        } else if (depth == 3 && EVENT_DATA.equals(section)) {
          if ("Data".equals(name)) {
            String dataName = reader.getAttributeValue(null, "Name");
            data.add(new DataValue(dataName, reader.getElementText()));
            depth--;
          } else if ("Binary".equals(name)) {
            binary = reader.getElementText();
            depth--;
          }
        } else if (depth >= 3 && RENDERING_INFO.equals(section)) {
          depth -= readRenderingField(reader, name, depth, builder);
        }
      }
    } catch (XMLStreamException e) {
      throw new DecodeException("Malformed event XML: " + e.getMessage(), e);
    } finally {
      closeQuietly(reader);
    }
    return builder.eventData(new EventData(data, binary));
  }

  /**
   * @return 1 if the element was fully consumed (reader is on its end tag), 0 otherwise
   */
  private int readSystemField(XMLStreamReader reader, String name, StructuredEvent.Builder builder)
      throws XMLStreamException {
    switch (name) {
      case PROVIDER:
        builder.provider(new Provider(reader.getAttributeValue(null, "Name"),
            reader.getAttributeValue(null, "Guid"),
            reader.getAttributeValue(null, "EventSourceName")));
        return 0;
      case "EventID":
        long qualifiers = parseLong(reader.getAttributeValue(null, "Qualifiers"));
        builder.eventId(new EventId(parseLong(reader.getElementText()), qualifiers));
        return 1;
      case LEVEL:
        builder.level(parseLong(reader.getElementText()));
        return 1;
      case TASK:
        builder.task(parseLong(reader.getElementText()));
        return 1;
      case OPCODE:
        builder.opcode(parseLong(reader.getElementText()));
        return 1;
      case KEYWORDS:
        builder.keywords(parseLong(reader.getElementText()));
        return 1;
      case TIME_CREATED:
        String systemTime = reader.getAttributeValue(null, SYSTEM_TIME);
        builder.systemTime(systemTime).timeCreated(parseTime(systemTime));
        return 0;
      case EVENT_RECORD_ID:
        builder.recordId(parseLong(reader.getElementText()));
        return 1;
      case "Correlation":
        builder.activityId(reader.getAttributeValue(null, "ActivityID"))
            .relatedActivityId(reader.getAttributeValue(null, "RelatedActivityID"));
        return 0;
      case "Execution":
        builder.processId(parseOptionalLong(reader.getAttributeValue(null, "ProcessID")))
            .threadId(parseOptionalLong(reader.getAttributeValue(null, "ThreadID")));
        return 0;
      case "Channel":
        builder.channel(reader.getElementText());
        return 1;
      case "Computer":
        builder.computer(reader.getElementText());
        return 1;
      case "Security":
        builder.userId(reader.getAttributeValue(null, "UserID"));
        return 0;
      default:
        return 0;
    }
  }

  private int readRenderingField(XMLStreamReader reader, String name, int depth,
      StructuredEvent.Builder builder) throws XMLStreamException {
    if (depth == 4) {
      if ("Keyword".equals(name)) {
        builder.addKeywordText(reader.getElementText());
        return 1;
      }
      return 0;
    }
    if (depth != 3) {
      return 0;
    }
    switch (name) {
      case "Message":
        builder.message(reader.getElementText());
        return 1;
      case LEVEL:
        builder.levelText(reader.getElementText());
        return 1;
      case TASK:
        builder.taskText(reader.getElementText());
        return 1;
      case OPCODE:
        builder.opcodeText(reader.getElementText());
        return 1;
      default:
        return 0;
    }
  }

  private XMLStreamReader open(String xml) {
    try {
      return inputFactory.createXMLStreamReader(new StringReader(xml));
    } catch (XMLStreamException e) {
      throw new DecodeException("Cannot read event XML: " + e.getMessage(), e);
    }
  }

  private static void closeQuietly(XMLStreamReader reader) {
    try {
      reader.close();
    } catch (XMLStreamException e) {
      log.debug("Error closing XML reader: {}", e.getMessage());
    }
  }

  /**
   * Parses decimal or {@code 0x} prefixed hexadecimal values as unsigned 64-bit integers.
   * Blank or malformed values decode as 0.
   */
  static long parseLong(String value) {
    String trimmed = StringUtils.trimToEmpty(value);
    if (trimmed.isEmpty()) {
      return 0;
    }
    try {
      if (StringUtils.startsWithIgnoreCase(trimmed, "0x")) {
        return Long.parseUnsignedLong(trimmed.substring(2), 16);
      }
      return Long.parseUnsignedLong(trimmed);
    } catch (NumberFormatException e) {
      log.debug("Unparsable numeric field '{}', using 0", value);
      return 0;
    }
  }

  private static Long parseOptionalLong(String value) {
    return StringUtils.isBlank(value) ? null : parseLong(value);
  }

  static Instant parseTime(String value) {
    if (StringUtils.isBlank(value)) {
      return null;
    }
    try {
      return Instant.parse(value.trim());
    } catch (DateTimeParseException e) {
      log.debug("Unparsable TimeCreated '{}'", value);
      return null;
    }
  }
}
