package com.etendoerp.eventlog.config;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.etendoerp.eventlog.exception.ConfigException;

/**
 * Immutable configuration of one channel receiver. Instances are only created through
 * {@link Builder#build()}, which validates every field, so a receiver never sees an invalid
 * configuration.
 */
public class EventLogReceiverConfig {
  public static final int DEFAULT_MAX_READS = 100;
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
  public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 5;
  public static final Duration DEFAULT_RESUBSCRIBE_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  // Property keys, relative to the caller supplied prefix
  public static final String CHANNEL = "channel";
  public static final String START_AT = "start_at";
  public static final String RESUME = "resume";
  public static final String RAW = "raw";
  public static final String EXCLUDE_PROVIDERS = "exclude_providers";
  public static final String MAX_READS = "max_reads";
  public static final String POLL_INTERVAL = "poll_interval";
  public static final String MODE = "mode";
  public static final String SUPPRESS_RENDERING_INFO = "suppress_rendering_info";
  public static final String INCLUDE_LOG_RECORD_ORIGINAL = "include_log_record_original";
  public static final String RETRY_ENABLED = "retry_on_failure.enabled";
  public static final String RETRY_INITIAL_INTERVAL = "retry_on_failure.initial_interval";
  public static final String RETRY_MAX_INTERVAL = "retry_on_failure.max_interval";
  public static final String RETRY_MAX_ELAPSED_TIME = "retry_on_failure.max_elapsed_time";
  public static final String MAX_CONSECUTIVE_FAILURES = "max_consecutive_failures";
  public static final String RESUBSCRIBE_DELAY = "resubscribe_delay";
  public static final String SHUTDOWN_TIMEOUT = "shutdown_timeout";

  private final String channel;
  private final StartAt startAt;
  private final Instant startTimestamp;
  private final boolean resumeFromCheckpoint;
  private final boolean raw;
  private final Set<String> excludeProviders;
  private final int maxReads;
  private final Duration pollInterval;
  private final SubscriptionMode subscriptionMode;
  private final boolean suppressRenderingInfo;
  private final boolean includeLogRecordOriginal;
  private final BackoffConfig retry;
  private final int maxConsecutiveFailures;
  private final Duration resubscribeDelay;
  private final Duration shutdownTimeout;

  private EventLogReceiverConfig(Builder builder) {
    this.channel = builder.channel;
    this.startAt = builder.startAt;
    this.startTimestamp = builder.startTimestamp;
    this.resumeFromCheckpoint = builder.resumeFromCheckpoint;
    this.raw = builder.raw;
    this.excludeProviders = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excludeProviders));
    this.maxReads = builder.maxReads;
    this.pollInterval = builder.pollInterval;
    this.subscriptionMode = builder.subscriptionMode;
    this.suppressRenderingInfo = builder.suppressRenderingInfo;
    this.includeLogRecordOriginal = builder.includeLogRecordOriginal;
    this.retry = builder.retry;
    this.maxConsecutiveFailures = builder.maxConsecutiveFailures;
    this.resubscribeDelay = builder.resubscribeDelay;
    this.shutdownTimeout = builder.shutdownTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads a configuration from flat properties such as {@code eventlog.channel=application}.
   * Durations are expressed in milliseconds.
   *
   * @param props source properties
   * @param prefix key prefix including the trailing dot, may be empty
   * @throws ConfigException when a value is missing or malformed
   */
  public static EventLogReceiverConfig fromProperties(Properties props, String prefix) {
    String p = StringUtils.defaultString(prefix);
    Builder builder = builder().channel(props.getProperty(p + CHANNEL));

    String startAt = props.getProperty(p + START_AT);
    if (StringUtils.isNotBlank(startAt)) {
      String trimmed = startAt.trim();
      if (Character.isDigit(trimmed.charAt(0))) {
        try {
          builder.startTimestamp(Instant.parse(trimmed));
        } catch (DateTimeParseException e) {
          throw new ConfigException("invalid start_at timestamp '" + startAt + "'", e);
        }
      } else {
        builder.startAt(StartAt.parse(trimmed));
      }
    }

    builder.resumeFromCheckpoint(parseBoolean(props, p + RESUME, true))
        .raw(parseBoolean(props, p + RAW, false))
        .maxReads(parseInt(props, p + MAX_READS, DEFAULT_MAX_READS))
        .pollInterval(parseMillis(props, p + POLL_INTERVAL, DEFAULT_POLL_INTERVAL))
        .suppressRenderingInfo(parseBoolean(props, p + SUPPRESS_RENDERING_INFO, false))
        .includeLogRecordOriginal(parseBoolean(props, p + INCLUDE_LOG_RECORD_ORIGINAL, false))
        .maxConsecutiveFailures(
            parseInt(props, p + MAX_CONSECUTIVE_FAILURES, DEFAULT_MAX_CONSECUTIVE_FAILURES))
        .resubscribeDelay(parseMillis(props, p + RESUBSCRIBE_DELAY, DEFAULT_RESUBSCRIBE_DELAY))
        .shutdownTimeout(parseMillis(props, p + SHUTDOWN_TIMEOUT, DEFAULT_SHUTDOWN_TIMEOUT));

    String mode = props.getProperty(p + MODE);
    if (StringUtils.isNotBlank(mode)) {
      builder.subscriptionMode(SubscriptionMode.parse(mode));
    }

    String excluded = props.getProperty(p + EXCLUDE_PROVIDERS);
    if (excluded != null) {
      for (String provider : StringUtils.splitPreserveAllTokens(excluded, ',')) {
        builder.excludeProvider(provider.trim());
      }
    }

    builder.retry(new BackoffConfig(
        parseBoolean(props, p + RETRY_ENABLED, true),
        parseMillis(props, p + RETRY_INITIAL_INTERVAL, BackoffConfig.DEFAULT_INITIAL_INTERVAL),
        parseMillis(props, p + RETRY_MAX_INTERVAL, BackoffConfig.DEFAULT_MAX_INTERVAL),
        parseMillis(props, p + RETRY_MAX_ELAPSED_TIME, BackoffConfig.DEFAULT_MAX_ELAPSED_TIME)));
    return builder.build();
  }

  private static boolean parseBoolean(Properties props, String key, boolean defaultValue) {
    String value = props.getProperty(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if ("true".equals(normalized)) {
      return true;
    }
    if ("false".equals(normalized)) {
      return false;
    }
    throw new ConfigException("invalid boolean for " + key + ": '" + value + "'");
  }

  private static int parseInt(Properties props, String key, int defaultValue) {
    String value = props.getProperty(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigException("invalid integer for " + key + ": '" + value + "'", e);
    }
  }

  private static Duration parseMillis(Properties props, String key, Duration defaultValue) {
    String value = props.getProperty(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Duration.ofMillis(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      throw new ConfigException("invalid duration (ms) for " + key + ": '" + value + "'", e);
    }
  }

  /**
   * Resolves the start policy for a subscription being opened.
   *
   * @param checkpointAvailable whether a checkpoint exists for the channel
   */
  public StartPolicy resolveStartPolicy(boolean checkpointAvailable) {
    if (resumeFromCheckpoint && checkpointAvailable) {
      return StartPolicy.RESUME;
    }
    switch (startAt) {
      case BEGINNING:
        return StartPolicy.BEGINNING;
      case TIMESTAMP:
        return StartPolicy.TIMESTAMP;
      default:
        return StartPolicy.END;
    }
  }

  public String getChannel() {
    return channel;
  }

  public StartAt getStartAt() {
    return startAt;
  }

  public Instant getStartTimestamp() {
    return startTimestamp;
  }

  public boolean isResumeFromCheckpoint() {
    return resumeFromCheckpoint;
  }

  public boolean isRaw() {
    return raw;
  }

  public Set<String> getExcludeProviders() {
    return excludeProviders;
  }

  public int getMaxReads() {
    return maxReads;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public SubscriptionMode getSubscriptionMode() {
    return subscriptionMode;
  }

  public boolean isSuppressRenderingInfo() {
    return suppressRenderingInfo;
  }

  public boolean isIncludeLogRecordOriginal() {
    return includeLogRecordOriginal;
  }

  public BackoffConfig getRetry() {
    return retry;
  }

  public int getMaxConsecutiveFailures() {
    return maxConsecutiveFailures;
  }

  public Duration getResubscribeDelay() {
    return resubscribeDelay;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  /**
   * Returns a builder pre-populated with this configuration.
   */
  public Builder toBuilder() {
    Builder builder = new Builder()
        .channel(channel)
        .startAt(startAt)
        .resumeFromCheckpoint(resumeFromCheckpoint)
        .raw(raw)
        .excludeProviders(excludeProviders)
        .maxReads(maxReads)
        .pollInterval(pollInterval)
        .subscriptionMode(subscriptionMode)
        .suppressRenderingInfo(suppressRenderingInfo)
        .includeLogRecordOriginal(includeLogRecordOriginal)
        .retry(retry)
        .maxConsecutiveFailures(maxConsecutiveFailures)
        .resubscribeDelay(resubscribeDelay)
        .shutdownTimeout(shutdownTimeout);
    builder.startTimestamp = startTimestamp;
    return builder;
  }

  @Override
  public String toString() {
    return "EventLogReceiverConfig{channel='" + channel + "', startAt=" + startAt
        + ", resume=" + resumeFromCheckpoint + ", raw=" + raw
        + ", excludeProviders=" + excludeProviders + ", mode=" + subscriptionMode + "}";
  }

  public static class Builder {
    private String channel;
    private StartAt startAt = StartAt.END;
    private Instant startTimestamp;
    private boolean resumeFromCheckpoint = true;
    private boolean raw;
    private final Set<String> excludeProviders = new LinkedHashSet<>();
    private int maxReads = DEFAULT_MAX_READS;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private SubscriptionMode subscriptionMode = SubscriptionMode.PULL;
    private boolean suppressRenderingInfo;
    private boolean includeLogRecordOriginal;
    private BackoffConfig retry = BackoffConfig.defaultConfig();
    private int maxConsecutiveFailures = DEFAULT_MAX_CONSECUTIVE_FAILURES;
    private Duration resubscribeDelay = DEFAULT_RESUBSCRIBE_DELAY;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

    public Builder channel(String channel) {
      this.channel = channel;
      return this;
    }

    public Builder startAt(StartAt startAt) {
      this.startAt = startAt;
      return this;
    }

    /**
     * Starts at the first record created at or after the given instant. Implies
     * {@link StartAt#TIMESTAMP}.
     */
    public Builder startTimestamp(Instant startTimestamp) {
      this.startTimestamp = startTimestamp;
      this.startAt = StartAt.TIMESTAMP;
      return this;
    }

    public Builder resumeFromCheckpoint(boolean resumeFromCheckpoint) {
      this.resumeFromCheckpoint = resumeFromCheckpoint;
      return this;
    }

    public Builder raw(boolean raw) {
      this.raw = raw;
      return this;
    }

    public Builder excludeProvider(String provider) {
      if (StringUtils.isBlank(provider)) {
        throw new ConfigException("exclude_providers must not contain blank entries");
      }
      this.excludeProviders.add(provider);
      return this;
    }

    public Builder excludeProviders(Collection<String> providers) {
      providers.forEach(this::excludeProvider);
      return this;
    }

    public Builder maxReads(int maxReads) {
      this.maxReads = maxReads;
      return this;
    }

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public Builder subscriptionMode(SubscriptionMode subscriptionMode) {
      this.subscriptionMode = subscriptionMode;
      return this;
    }

    public Builder suppressRenderingInfo(boolean suppressRenderingInfo) {
      this.suppressRenderingInfo = suppressRenderingInfo;
      return this;
    }

    public Builder includeLogRecordOriginal(boolean includeLogRecordOriginal) {
      this.includeLogRecordOriginal = includeLogRecordOriginal;
      return this;
    }

    public Builder retry(BackoffConfig retry) {
      this.retry = retry;
      return this;
    }

    public Builder maxConsecutiveFailures(int maxConsecutiveFailures) {
      this.maxConsecutiveFailures = maxConsecutiveFailures;
      return this;
    }

    public Builder resubscribeDelay(Duration resubscribeDelay) {
      this.resubscribeDelay = resubscribeDelay;
      return this;
    }

    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public EventLogReceiverConfig build() {
      if (StringUtils.isBlank(channel)) {
        throw new ConfigException("channel is required");
      }
      if (startAt == null) {
        throw new ConfigException("start_at is required");
      }
      if (startAt == StartAt.TIMESTAMP && startTimestamp == null) {
        throw new ConfigException("start_at timestamp requires a start timestamp");
      }
      if (maxReads < 1) {
        throw new ConfigException("max_reads must be greater than zero");
      }
      requirePositive(pollInterval, POLL_INTERVAL);
      requirePositive(shutdownTimeout, SHUTDOWN_TIMEOUT);
      if (resubscribeDelay == null || resubscribeDelay.isNegative()) {
        throw new ConfigException(RESUBSCRIBE_DELAY + " must not be negative");
      }
      if (maxConsecutiveFailures < 1) {
        throw new ConfigException("max_consecutive_failures must be greater than zero");
      }
      if (subscriptionMode == null) {
        throw new ConfigException("mode is required");
      }
      if (retry == null) {
        throw new ConfigException("retry_on_failure is required");
      }
      if (retry.isEnabled()) {
        requirePositive(retry.getInitialInterval(), RETRY_INITIAL_INTERVAL);
        requirePositive(retry.getMaxInterval(), RETRY_MAX_INTERVAL);
        if (retry.getMaxElapsedTime().isNegative()) {
          throw new ConfigException(RETRY_MAX_ELAPSED_TIME + " must not be negative");
        }
      }
      return new EventLogReceiverConfig(this);
    }

    private static void requirePositive(Duration duration, String name) {
      if (duration == null || duration.isZero() || duration.isNegative()) {
        throw new ConfigException(name + " must be a positive duration");
      }
    }
  }
}
