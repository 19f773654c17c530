package com.etendoerp.eventlog;

import java.util.function.BooleanSupplier;

/**
 * Constants shared by the event log tests.
 */
public class EventLogTestConstants {
  public static final String CHANNEL = "Application";
  public static final String TEST_PROVIDER = "Test";
  public static final String BLOCKED_PROVIDER = "blocked-src";
  public static final String TEST_LOG = "Test log";
  public static final long TEST_EVENT_ID = 10;

  public static final String ASSERT_TIMEOUT = "Condition not reached in time";

  private EventLogTestConstants() {
  }

  /**
   * Polls the condition every 10 ms for up to five seconds.
   */
  public static boolean waitFor(BooleanSupplier condition) {
    long deadline = System.currentTimeMillis() + 5000;
    while (System.currentTimeMillis() < deadline) {
      if (condition.getAsBoolean()) {
        return true;
      }
      try {
        Thread.sleep(10);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return condition.getAsBoolean();
  }
}
