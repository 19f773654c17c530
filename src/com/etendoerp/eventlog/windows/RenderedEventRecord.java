package com.etendoerp.eventlog.windows;

import com.etendoerp.eventlog.subscription.NativeEventRecord;

/**
 * Event rendered inside a push callback, where the native handle dies with the callback.
 * Holds the XML and the message (or the reason it could not be formatted).
 */
class RenderedEventRecord implements NativeEventRecord {
  private final String xml;
  private final String message;
  private final RuntimeException messageFailure;

  RenderedEventRecord(String xml, String message, RuntimeException messageFailure) {
    this.xml = xml;
    this.message = message;
    this.messageFailure = messageFailure;
  }

  @Override
  public String renderXml() {
    return xml;
  }

  @Override
  public String formatMessage(String providerName) {
    if (messageFailure != null) {
      throw messageFailure;
    }
    return message;
  }

  @Override
  public void close() {
    // nothing native left to release
  }
}
