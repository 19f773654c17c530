package com.etendoerp.eventlog.config;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import com.etendoerp.eventlog.exception.ConfigException;

/**
 * Position a subscription starts from when no checkpoint is used.
 */
public enum StartAt {
  BEGINNING,
  END,
  TIMESTAMP;

  /**
   * Parses the {@code start_at} keyword. Only {@code beginning} and {@code end} are keywords;
   * timestamps are recognized by {@link EventLogReceiverConfig#fromProperties}.
   *
   * @throws ConfigException for any other value
   */
  public static StartAt parse(String value) {
    String normalized = StringUtils.trimToEmpty(value).toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "beginning":
        return BEGINNING;
      case "end":
        return END;
      default:
        throw new ConfigException(
            "invalid start_at value '" + value + "', must be 'beginning' or 'end'");
    }
  }
}
