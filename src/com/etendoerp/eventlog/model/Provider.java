package com.etendoerp.eventlog.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Event provider as declared in the {@code System/Provider} element.
 */
public class Provider {
  private final String name;
  private final String guid;
  private final String eventSource;

  public Provider(String name, String guid, String eventSource) {
    this.name = StringUtils.defaultString(name);
    this.guid = StringUtils.defaultString(guid);
    this.eventSource = StringUtils.defaultString(eventSource);
  }

  public String getName() {
    return name;
  }

  public String getGuid() {
    return guid;
  }

  public String getEventSource() {
    return eventSource;
  }
}
