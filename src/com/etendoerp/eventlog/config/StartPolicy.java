package com.etendoerp.eventlog.config;

/**
 * Effective start policy of a subscription, resolved from {@link StartAt} and the resume flag.
 */
public enum StartPolicy {
  BEGINNING,
  END,
  RESUME,
  TIMESTAMP
}
