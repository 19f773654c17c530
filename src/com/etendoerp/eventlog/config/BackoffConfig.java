package com.etendoerp.eventlog.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry-on-failure settings for deliveries to the downstream sink.
 */
public class BackoffConfig {
  public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_MAX_ELAPSED_TIME = Duration.ofMinutes(5);

  private final boolean enabled;
  private final Duration initialInterval;
  private final Duration maxInterval;
  private final Duration maxElapsedTime;

  public BackoffConfig(boolean enabled, Duration initialInterval, Duration maxInterval,
      Duration maxElapsedTime) {
    this.enabled = enabled;
    this.initialInterval = Objects.requireNonNull(initialInterval, "initialInterval");
    this.maxInterval = Objects.requireNonNull(maxInterval, "maxInterval");
    this.maxElapsedTime = Objects.requireNonNull(maxElapsedTime, "maxElapsedTime");
  }

  public static BackoffConfig defaultConfig() {
    return new BackoffConfig(true, DEFAULT_INITIAL_INTERVAL, DEFAULT_MAX_INTERVAL,
        DEFAULT_MAX_ELAPSED_TIME);
  }

  public static BackoffConfig disabled() {
    return new BackoffConfig(false, DEFAULT_INITIAL_INTERVAL, DEFAULT_MAX_INTERVAL,
        DEFAULT_MAX_ELAPSED_TIME);
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getInitialInterval() {
    return initialInterval;
  }

  public Duration getMaxInterval() {
    return maxInterval;
  }

  public Duration getMaxElapsedTime() {
    return maxElapsedTime;
  }
}
