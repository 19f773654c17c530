package com.etendoerp.eventlog.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.etendoerp.eventlog.config.BackoffConfig;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void delayGrowsByMultiplierAndIsCapped() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(
        Duration.ofSeconds(1), Duration.ofSeconds(3), Duration.ofMinutes(5));

    assertEquals(1000, policy.getRetryDelay(1));
    assertEquals(1500, policy.getRetryDelay(2));
    assertEquals(2250, policy.getRetryDelay(3));
    assertEquals(3000, policy.getRetryDelay(4));
    assertEquals(3000, policy.getRetryDelay(10));
  }

  @Test
  void retriesStopOnceElapsedTimeIsReached() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(
        Duration.ofMillis(10), Duration.ofMillis(100), Duration.ofSeconds(1));

    assertTrue(policy.shouldRetry(1, 0));
    assertTrue(policy.shouldRetry(50, 999));
    assertFalse(policy.shouldRetry(2, 1000));
    assertFalse(policy.shouldRetry(0, 0));
  }

  @Test
  void disabledConfigNeverRetries() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.from(BackoffConfig.disabled());

    assertFalse(policy.shouldRetry(1, 0));
  }

  @Test
  void defaultConfigIsUsedAsIs() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.from(BackoffConfig.defaultConfig());

    assertEquals(1000, policy.getRetryDelay(1));
    assertEquals(Duration.ofMinutes(5).toMillis(), policy.getMaxElapsedTimeMs());
  }

  @Test
  void multiplierBelowOneIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(
        Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3), 0.5));
  }
}
