package com.etendoerp.eventlog.model;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * One {@code EventData/Data} element. Positional values have an empty name.
 */
public class DataValue {
  private final String name;
  private final String value;

  public DataValue(String name, String value) {
    this.name = StringUtils.defaultString(name);
    this.value = StringUtils.defaultString(value);
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  public boolean isNamed() {
    return !name.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataValue)) {
      return false;
    }
    DataValue other = (DataValue) o;
    return name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
