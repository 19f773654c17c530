package com.etendoerp.eventlog.retry;

import java.time.Duration;

import com.etendoerp.eventlog.config.BackoffConfig;

/**
 * Exponential backoff bounded by a maximum interval and a maximum elapsed time.
 * The delay before retry {@code n} is {@code initial * multiplier^(n-1)}, capped at the
 * maximum interval. Once the elapsed time reaches the limit no further retries are granted.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final double DEFAULT_MULTIPLIER = 1.5;

  private final long initialIntervalMs;
  private final long maxIntervalMs;
  private final long maxElapsedTimeMs;
  private final double multiplier;

  public ExponentialBackoffRetryPolicy(Duration initialInterval, Duration maxInterval,
      Duration maxElapsedTime) {
    this(initialInterval, maxInterval, maxElapsedTime, DEFAULT_MULTIPLIER);
  }

  public ExponentialBackoffRetryPolicy(Duration initialInterval, Duration maxInterval,
      Duration maxElapsedTime, double multiplier) {
    if (multiplier < 1) {
      throw new IllegalArgumentException("multiplier must be >= 1");
    }
    this.initialIntervalMs = initialInterval.toMillis();
    this.maxIntervalMs = Math.max(maxInterval.toMillis(), initialIntervalMs);
    this.maxElapsedTimeMs = maxElapsedTime.toMillis();
    this.multiplier = multiplier;
  }

  /**
   * Builds the policy described by the receiver configuration. A disabled configuration
   * yields a policy that never retries.
   */
  public static ExponentialBackoffRetryPolicy from(BackoffConfig config) {
    if (!config.isEnabled()) {
      return new ExponentialBackoffRetryPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }
    return new ExponentialBackoffRetryPolicy(config.getInitialInterval(), config.getMaxInterval(),
        config.getMaxElapsedTime());
  }

  @Override
  public boolean shouldRetry(int attemptNumber, long elapsedMs) {
    return attemptNumber > 0 && elapsedMs < maxElapsedTimeMs;
  }

  @Override
  public long getRetryDelay(int attemptNumber) {
    double delay = initialIntervalMs * Math.pow(multiplier, Math.max(0, attemptNumber - 1f));
    return (long) Math.min(delay, maxIntervalMs);
  }

  public long getMaxElapsedTimeMs() {
    return maxElapsedTimeMs;
  }
}
