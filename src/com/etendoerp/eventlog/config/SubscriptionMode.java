package com.etendoerp.eventlog.config;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import com.etendoerp.eventlog.exception.ConfigException;

/**
 * How native events reach the channel worker.
 */
public enum SubscriptionMode {
  /** The worker pulls batches itself. */
  PULL,
  /** The OS pushes events on its own threads; they are queued for the worker. */
  PUSH;

  public static SubscriptionMode parse(String value) {
    String normalized = StringUtils.trimToEmpty(value).toLowerCase(Locale.ROOT);
    if ("pull".equals(normalized)) {
      return PULL;
    }
    if ("push".equals(normalized)) {
      return PUSH;
    }
    throw new ConfigException("invalid mode '" + value + "', must be 'pull' or 'push'");
  }
}
