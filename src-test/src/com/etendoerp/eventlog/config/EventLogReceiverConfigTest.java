package com.etendoerp.eventlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Properties;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.etendoerp.eventlog.exception.ConfigException;

/**
 * Tests for {@link EventLogReceiverConfig}: builder validation, property loading and start
 * policy resolution.
 */
class EventLogReceiverConfigTest {
  private static final String PREFIX = "eventlog.";

  private static Properties props(String... keyValues) {
    Properties props = new Properties();
    for (int i = 0; i < keyValues.length; i += 2) {
      props.setProperty(PREFIX + keyValues[i], keyValues[i + 1]);
    }
    return props;
  }

  @Test
  void defaultsApplyWhenOnlyChannelIsGiven() {
    EventLogReceiverConfig config = EventLogReceiverConfig.builder().channel("Application").build();

    assertEquals(StartAt.END, config.getStartAt());
    assertTrue(config.isResumeFromCheckpoint());
    assertFalse(config.isRaw());
    assertEquals(100, config.getMaxReads());
    assertEquals(Duration.ofSeconds(1), config.getPollInterval());
    assertEquals(SubscriptionMode.PULL, config.getSubscriptionMode());
    assertTrue(config.getRetry().isEnabled());
    assertEquals(Duration.ofSeconds(1), config.getRetry().getInitialInterval());
    assertEquals(Duration.ofSeconds(30), config.getRetry().getMaxInterval());
    assertEquals(Duration.ofMinutes(5), config.getRetry().getMaxElapsedTime());
    assertEquals(5, config.getMaxConsecutiveFailures());
    assertEquals(Duration.ofSeconds(10), config.getShutdownTimeout());
  }

  @Test
  void blankChannelIsRejected() {
    assertThrows(ConfigException.class, () -> EventLogReceiverConfig.builder().channel(" ").build());
  }

  @Test
  void invalidStartAtFailsAtCreation() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> EventLogReceiverConfig.fromProperties(props("channel", "application", "start_at", "middle"), PREFIX));
    assertTrue(e.getMessage().contains("middle"));
  }

  @Test
  void startAtKeywordsAreCaseInsensitive() {
    EventLogReceiverConfig config = EventLogReceiverConfig.fromProperties(
        props("channel", "application", "start_at", "Beginning"), PREFIX);
    assertEquals(StartAt.BEGINNING, config.getStartAt());
  }

  @Test
  void startAtTimestampIsParsed() {
    EventLogReceiverConfig config = EventLogReceiverConfig.fromProperties(
        props("channel", "application", "start_at", "2024-05-01T00:00:00Z"), PREFIX);
    assertEquals(StartAt.TIMESTAMP, config.getStartAt());
    assertEquals(Instant.parse("2024-05-01T00:00:00Z"), config.getStartTimestamp());
  }

  @Test
  void malformedTimestampIsRejected() {
    assertThrows(ConfigException.class, () -> EventLogReceiverConfig.fromProperties(
        props("channel", "application", "start_at", "2024-13-45"), PREFIX));
  }

  @Test
  void excludeProvidersAreSplitAndTrimmed() {
    EventLogReceiverConfig config = EventLogReceiverConfig.fromProperties(
        props("channel", "application", "exclude_providers", "blocked-src, Other Source"), PREFIX);
    assertEquals(Set.of("blocked-src", "Other Source"), config.getExcludeProviders());
  }

  @Test
  void blankExcludeEntryIsRejected() {
    assertThrows(ConfigException.class, () -> EventLogReceiverConfig.fromProperties(
        props("channel", "application", "exclude_providers", "a,,b"), PREFIX));
  }

  @Test
  void allPropertiesAreRead() {
    EventLogReceiverConfig config = EventLogReceiverConfig.fromProperties(props(
        "channel", "Security",
        "start_at", "beginning",
        "resume", "false",
        "raw", "true",
        "max_reads", "25",
        "poll_interval", "250",
        "mode", "push",
        "suppress_rendering_info", "true",
        "include_log_record_original", "true",
        "retry_on_failure.enabled", "false",
        "max_consecutive_failures", "3",
        "resubscribe_delay", "50",
        "shutdown_timeout", "2000"), PREFIX);

    assertEquals("Security", config.getChannel());
    assertFalse(config.isResumeFromCheckpoint());
    assertTrue(config.isRaw());
    assertEquals(25, config.getMaxReads());
    assertEquals(Duration.ofMillis(250), config.getPollInterval());
    assertEquals(SubscriptionMode.PUSH, config.getSubscriptionMode());
    assertTrue(config.isSuppressRenderingInfo());
    assertTrue(config.isIncludeLogRecordOriginal());
    assertFalse(config.getRetry().isEnabled());
    assertEquals(3, config.getMaxConsecutiveFailures());
    assertEquals(Duration.ofMillis(50), config.getResubscribeDelay());
    assertEquals(Duration.ofSeconds(2), config.getShutdownTimeout());
  }

  @Test
  void malformedNumbersAndBooleansAreRejected() {
    assertThrows(ConfigException.class, () -> EventLogReceiverConfig.fromProperties(
        props("channel", "application", "max_reads", "many"), PREFIX));
    assertThrows(ConfigException.class, () -> EventLogReceiverConfig.fromProperties(
        props("channel", "application", "raw", "yes"), PREFIX));
    assertThrows(ConfigException.class, () -> EventLogReceiverConfig.fromProperties(
        props("channel", "application", "mode", "stream"), PREFIX));
  }

  @Test
  void nonPositiveLimitsAreRejected() {
    assertThrows(ConfigException.class,
        () -> EventLogReceiverConfig.builder().channel("a").maxReads(0).build());
    assertThrows(ConfigException.class,
        () -> EventLogReceiverConfig.builder().channel("a").pollInterval(Duration.ZERO).build());
    assertThrows(ConfigException.class,
        () -> EventLogReceiverConfig.builder().channel("a").maxConsecutiveFailures(0).build());
  }

  @Test
  void timestampStartRequiresTimestamp() {
    assertThrows(ConfigException.class,
        () -> EventLogReceiverConfig.builder().channel("a").startAt(StartAt.TIMESTAMP).build());
  }

  @Test
  void resumeWinsOnlyWhenCheckpointExists() {
    EventLogReceiverConfig config = EventLogReceiverConfig.builder()
        .channel("a").startAt(StartAt.BEGINNING).build();

    assertEquals(StartPolicy.RESUME, config.resolveStartPolicy(true));
    assertEquals(StartPolicy.BEGINNING, config.resolveStartPolicy(false));
  }

  @Test
  void resumeDisabledIgnoresCheckpoint() {
    EventLogReceiverConfig config = EventLogReceiverConfig.builder()
        .channel("a").resumeFromCheckpoint(false).build();

    assertEquals(StartPolicy.END, config.resolveStartPolicy(true));
  }

  @Test
  void toBuilderKeepsEveryField() {
    EventLogReceiverConfig original = EventLogReceiverConfig.builder()
        .channel("a")
        .startTimestamp(Instant.parse("2024-01-01T00:00:00Z"))
        .raw(true)
        .excludeProvider("x")
        .build();

    EventLogReceiverConfig copy = original.toBuilder().build();

    assertEquals(StartAt.TIMESTAMP, copy.getStartAt());
    assertEquals(original.getStartTimestamp(), copy.getStartTimestamp());
    assertTrue(copy.isRaw());
    assertEquals(Set.of("x"), copy.getExcludeProviders());
  }
}
