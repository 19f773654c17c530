package com.etendoerp.eventlog.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.etendoerp.eventlog.EventLogTestConstants;
import com.etendoerp.eventlog.health.ReceiverHealthTracker.HealthListener;
import com.etendoerp.eventlog.health.ReceiverHealthTracker.Status;

/**
 * Unit tests for {@link ReceiverHealthTracker}.
 */
@ExtendWith(MockitoExtension.class)
class ReceiverHealthTrackerTest {
  private static final String CHANNEL = EventLogTestConstants.CHANNEL;

  @Mock
  private HealthListener listener;

  private ReceiverHealthTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new ReceiverHealthTracker(CHANNEL);
    tracker.addListener(listener);
  }

  @Test
  void startsHealthy() {
    assertTrue(tracker.isHealthy());
    assertEquals(Status.HEALTHY, tracker.getStatus());
    assertNull(tracker.getLastError());
    assertEquals(CHANNEL, tracker.getChannel());
  }

  @Test
  void unhealthyIsReportedOncePerTransition() {
    tracker.markUnhealthy("subscription lost");
    tracker.markUnhealthy("still lost");

    assertFalse(tracker.isHealthy());
    assertEquals("still lost", tracker.getLastError());
    verify(listener, times(1)).onUnhealthy(CHANNEL, "subscription lost");
    verify(listener, never()).onUnhealthy(CHANNEL, "still lost");
  }

  @Test
  void recoveryNotifiesListeners() {
    tracker.markUnhealthy("sink down");
    tracker.markHealthy();
    tracker.markHealthy();

    assertTrue(tracker.isHealthy());
    verify(listener, times(1)).onHealthy(CHANNEL);
  }

  @Test
  void healthyReceiverDoesNotNotify() {
    tracker.markHealthy();

    verify(listener, never()).onHealthy(anyString());
  }

  @Test
  void removedListenerIsNotNotified() {
    tracker.removeListener(listener);

    tracker.markUnhealthy("sink down");

    verify(listener, never()).onUnhealthy(anyString(), anyString());
  }

  @Test
  void reportShowsStatusAndReason() {
    tracker.markUnhealthy("sink down");

    String report = tracker.getHealthReport();

    assertTrue(report.contains("Channel: " + CHANNEL));
    assertTrue(report.contains("Status: UNHEALTHY (sink down)"));
  }
}
