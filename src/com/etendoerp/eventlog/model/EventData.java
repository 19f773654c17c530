package com.etendoerp.eventlog.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * Ordered payload of the {@code EventData} section.
 */
public class EventData {
  private static final EventData EMPTY = new EventData(Collections.emptyList(), "");

  private final List<DataValue> values;
  private final String binary;

  public EventData(List<DataValue> values, String binary) {
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
    this.binary = StringUtils.defaultString(binary);
  }

  public static EventData empty() {
    return EMPTY;
  }

  public List<DataValue> getValues() {
    return values;
  }

  public String getBinary() {
    return binary;
  }

  public boolean isEmpty() {
    return values.isEmpty() && binary.isEmpty();
  }

  /**
   * Renders the payload as a body value: {@code {"data": [{name: value}, ...]}} plus
   * {@code "binary"} when present. Each value keeps its own single-entry map so duplicate and
   * unnamed ({@code ""}) keys survive in order.
   */
  public Map<String, Object> toBodyValue() {
    Map<String, Object> out = new LinkedHashMap<>();
    List<Map<String, Object>> data = new ArrayList<>(values.size());
    for (DataValue value : values) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put(value.getName(), value.getValue());
      data.add(entry);
    }
    out.put("data", data);
    if (!binary.isEmpty()) {
      out.put("binary", binary);
    }
    return out;
  }
}
