package com.etendoerp.eventlog.decoder;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.exception.DecodeException;
import com.etendoerp.eventlog.model.DecodedEvent;
import com.etendoerp.eventlog.model.StructuredEvent;
import com.etendoerp.eventlog.monitoring.ReceiverMetrics;
import com.etendoerp.eventlog.subscription.NativeEventRecord;

/**
 * Turns native records into {@link DecodedEvent}s.
 * <p>
 * Message rendering failures never drop an event: the structured record is produced with an
 * empty message. Only XML that cannot be parsed at all raises {@link DecodeException}.
 */
public class EventDecoder {
  private static final Logger log = LogManager.getLogger();

  private final EventXmlParser parser;
  private final boolean suppressRenderingInfo;
  private final ReceiverMetrics metrics;

  public EventDecoder(boolean suppressRenderingInfo, ReceiverMetrics metrics) {
    this(new EventXmlParser(), suppressRenderingInfo, metrics);
  }

  EventDecoder(EventXmlParser parser, boolean suppressRenderingInfo, ReceiverMetrics metrics) {
    this.parser = parser;
    this.suppressRenderingInfo = suppressRenderingInfo;
    this.metrics = metrics;
  }

  /**
   * Decodes one record.
   *
   * @param eventRecord native record, still open
   * @param raw whether to keep the XML body untouched
   * @throws DecodeException if the record cannot be rendered or its XML is malformed
   */
  public DecodedEvent decode(NativeEventRecord eventRecord, boolean raw) {
    String xml = render(eventRecord);
    if (raw) {
      EventXmlParser.SystemSummary summary = parser.scanSystem(xml);
      return DecodedEvent.raw(summary.getProviderName(), summary.getRecordId(),
          summary.getTimeCreated(), summary.getLevel(), xml);
    }

    StructuredEvent.Builder builder = parser.parse(xml);
    if (StringUtils.isEmpty(builder.getMessage()) && !suppressRenderingInfo) {
      builder.message(formatMessage(eventRecord, builder.getProvider() == null
          ? "" : builder.getProvider().getName()));
    }
    return DecodedEvent.structured(builder.build());
  }

  private String render(NativeEventRecord eventRecord) {
    try {
      String xml = eventRecord.renderXml();
      if (StringUtils.isBlank(xml)) {
        throw new DecodeException("Native record rendered an empty document");
      }
      return xml;
    } catch (DecodeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DecodeException("Cannot render native record: " + e.getMessage(), e);
    }
  }

  private String formatMessage(NativeEventRecord eventRecord, String providerName) {
    try {
      return StringUtils.defaultString(eventRecord.formatMessage(providerName));
    } catch (RuntimeException e) {
      log.debug("Message rendering failed for provider '{}': {}", providerName, e.getMessage());
      if (metrics != null) {
        metrics.recordDegradedRender();
      }
      return "";
    }
  }
}
