package com.etendoerp.eventlog.windows;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.etendoerp.eventlog.EventLogTestConstants;
import com.etendoerp.eventlog.config.SubscriptionMode;
import com.etendoerp.eventlog.exception.OpenException;
import com.etendoerp.eventlog.subscription.SubscriptionPosition;
import com.sun.jna.Platform;
import com.sun.jna.platform.win32.Winevt;

class WindowsEventLogApiTest {

  @Test
  void beginningAndEndSelectEverything() {
    assertEquals("*", WindowsEventLogApi.buildQuery(SubscriptionPosition.beginning()));
    assertEquals("*", WindowsEventLogApi.buildQuery(SubscriptionPosition.end()));
  }

  @Test
  void checkpointSelectsNewerRecords() {
    assertEquals("*[System[EventRecordID>42]]",
        WindowsEventLogApi.buildQuery(SubscriptionPosition.afterRecord(42)));
  }

  @Test
  void timestampSelectsRecordsCreatedSince() {
    SubscriptionPosition position = SubscriptionPosition.sinceTimestamp(
        Instant.parse("2024-05-01T10:15:30Z"));

    assertEquals("*[System[TimeCreated[@SystemTime>='2024-05-01T10:15:30Z']]]",
        WindowsEventLogApi.buildQuery(position));
  }

  @Test
  void onlyEndSubscribesToFutureEvents() {
    assertEquals(Winevt.EVT_SUBSCRIBE_FLAGS.EvtSubscribeToFutureEvents,
        WindowsEventLogApi.subscribeFlags(SubscriptionPosition.end()));
    assertEquals(Winevt.EVT_SUBSCRIBE_FLAGS.EvtSubscribeStartAtOldestRecord,
        WindowsEventLogApi.subscribeFlags(SubscriptionPosition.beginning()));
    assertEquals(Winevt.EVT_SUBSCRIBE_FLAGS.EvtSubscribeStartAtOldestRecord,
        WindowsEventLogApi.subscribeFlags(SubscriptionPosition.afterRecord(7)));
  }

  @Test
  void subscribeFailsOutsideWindows() {
    assumeFalse(Platform.isWindows());
    WindowsEventLogApi api = new WindowsEventLogApi();
    SubscriptionPosition position = SubscriptionPosition.end();

    OpenException e = assertThrows(OpenException.class,
        () -> api.subscribe(EventLogTestConstants.CHANNEL, position, SubscriptionMode.PULL, 100));
    assertEquals(0, e.getErrorCode());
  }
}
