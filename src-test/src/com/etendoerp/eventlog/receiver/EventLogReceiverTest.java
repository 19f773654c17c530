package com.etendoerp.eventlog.receiver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.etendoerp.eventlog.EventLogTestConstants;
import com.etendoerp.eventlog.EventXml;
import com.etendoerp.eventlog.FakeEventLogApi;
import com.etendoerp.eventlog.RecordingLogSink;
import com.etendoerp.eventlog.checkpoint.Checkpoint;
import com.etendoerp.eventlog.checkpoint.InMemoryPositionStore;
import com.etendoerp.eventlog.checkpoint.PositionStore;
import com.etendoerp.eventlog.config.BackoffConfig;
import com.etendoerp.eventlog.config.EventLogReceiverConfig;
import com.etendoerp.eventlog.config.StartAt;
import com.etendoerp.eventlog.delivery.LogSink;
import com.etendoerp.eventlog.exception.DeliveryException;
import com.etendoerp.eventlog.exception.OpenException;
import com.etendoerp.eventlog.exception.StoreException;
import com.etendoerp.eventlog.exception.SubscriptionException;
import com.etendoerp.eventlog.model.LogRecord;

/**
 * End-to-end tests of a channel receiver against an in-memory event log.
 */
@Timeout(value = 20, unit = TimeUnit.SECONDS)
class EventLogReceiverTest {
  private static final String CHANNEL = EventLogTestConstants.CHANNEL;

  private FakeEventLogApi api;
  private InMemoryPositionStore store;
  private RecordingLogSink sink;
  private EventLogReceiver receiver;

  @BeforeEach
  void setUp() {
    api = new FakeEventLogApi().channel(CHANNEL);
    store = new InMemoryPositionStore();
    sink = new RecordingLogSink();
  }

  @AfterEach
  void tearDown() {
    if (receiver != null) {
      receiver.shutdown();
    }
  }

  private static EventLogReceiverConfig.Builder config() {
    return EventLogReceiverConfig.builder()
        .channel(CHANNEL)
        .startAt(StartAt.BEGINNING)
        .pollInterval(Duration.ofMillis(10))
        .resubscribeDelay(Duration.ofMillis(1))
        .shutdownTimeout(Duration.ofSeconds(2))
        .retry(new BackoffConfig(true, Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofSeconds(2)));
  }

  private EventLogReceiver start(EventLogReceiverConfig config) {
    receiver = EventLogReceiverFactory.create(config, api, store, sink);
    receiver.start();
    return receiver;
  }

  private void awaitRecords(int count) {
    assertTrue(EventLogTestConstants.waitFor(() -> sink.getRecords().size() >= count),
        EventLogTestConstants.ASSERT_TIMEOUT);
  }

  private void awaitCheckpoint(long recordId) {
    assertTrue(EventLogTestConstants.waitFor(() -> store.load(CHANNEL)
        .map(Checkpoint::getRecordId).orElse(-1L) == recordId), EventLogTestConstants.ASSERT_TIMEOUT);
  }

  private List<Object> deliveredRecordIds() {
    return sink.getRecords().stream()
        .map(logRecord -> logRecord.getBodyMap().get("record_id"))
        .collect(Collectors.toList());
  }

  @Test
  void structuredEventIsDelivered() {
    api.write(CHANNEL, EventXml.event(1).data(null, EventLogTestConstants.TEST_LOG));

    start(config().build());
    awaitRecords(1);

    Map<String, Object> body = sink.getRecords().get(0).getBodyMap();
    @SuppressWarnings("unchecked")
    Map<String, Object> eventId = (Map<String, Object>) body.get("event_id");
    assertEquals(EventLogTestConstants.TEST_EVENT_ID, eventId.get("id"));
    assertEquals(Map.of("data", List.of(Map.of("", EventLogTestConstants.TEST_LOG))), body.get("event_data"));
    assertEquals("Rendered message of event 1", body.get("message"));
    assertEquals(ReceiverState.RUNNING, receiver.getState());
    assertTrue(receiver.getHealth().isHealthy());
    awaitCheckpoint(1);
  }

  @Test
  void rawEventKeepsXml() {
    api.write(CHANNEL, EventXml.event(1).data(null, EventLogTestConstants.TEST_LOG));

    start(config().raw(true).build());
    awaitRecords(1);

    LogRecord logRecord = sink.getRecords().get(0);
    assertTrue(logRecord.getBodyString().contains("<Data>Test log</Data>"));
  }

  @Test
  void excludedProviderIsNotDelivered() {
    api.write(CHANNEL, EventXml.event(1).provider(EventLogTestConstants.BLOCKED_PROVIDER));
    api.write(CHANNEL, EventXml.event(2));
    api.write(CHANNEL, EventXml.event(3).provider(EventLogTestConstants.BLOCKED_PROVIDER));

    start(config().excludeProvider(EventLogTestConstants.BLOCKED_PROVIDER).build());
    awaitCheckpoint(3);

    assertEquals(List.of(2L), deliveredRecordIds());
    assertEquals(2, receiver.getMetrics().getEventsFiltered());
  }

  @Test
  void resumesAfterCheckpoint() {
    for (long id = 1; id <= 4; id++) {
      api.write(CHANNEL, EventXml.event(id));
    }
    store.save(new Checkpoint(CHANNEL, 2, Instant.now()));

    start(config().build());
    awaitCheckpoint(4);

    assertEquals(List.of(3L, 4L), deliveredRecordIds());
  }

  @Test
  void resumeDisabledIgnoresCheckpoint() {
    for (long id = 1; id <= 3; id++) {
      api.write(CHANNEL, EventXml.event(id));
    }
    store.save(new Checkpoint(CHANNEL, 2, Instant.now()));

    start(config().resumeFromCheckpoint(false).build());
    awaitRecords(3);

    assertEquals(List.of(1L, 2L, 3L), deliveredRecordIds());
  }

  @Test
  void restartContinuesWhereThePreviousRunStopped() {
    for (long id = 1; id <= 3; id++) {
      api.write(CHANNEL, EventXml.event(id));
    }
    start(config().build());
    awaitCheckpoint(3);
    receiver.shutdown();

    api.write(CHANNEL, EventXml.event(4));
    api.write(CHANNEL, EventXml.event(5));
    RecordingLogSink firstSink = sink;
    sink = new RecordingLogSink();
    start(config().build());
    awaitCheckpoint(5);

    assertEquals(3, firstSink.getRecords().size());
    assertEquals(List.of(4L, 5L), deliveredRecordIds());
  }

  @Test
  void unreadableCheckpointStartsFromConfiguredPosition() {
    for (long id = 1; id <= 2; id++) {
      api.write(CHANNEL, EventXml.event(id));
    }
    PositionStore corruptStore = mock(PositionStore.class);
    when(corruptStore.load(anyString())).thenThrow(new StoreException("corrupt checkpoint file", null));

    receiver = EventLogReceiverFactory.create(config().build(), api, corruptStore, sink);
    receiver.start();
    awaitRecords(2);

    assertEquals(ReceiverState.RUNNING, receiver.getState());
    assertEquals(1, receiver.getMetrics().getCheckpointFailures());
    assertEquals(List.of(1L, 2L), deliveredRecordIds());
  }

  @Test
  void batchWithoutSavedCheckpointIsDeliveredAgainAfterRestart() {
    FailingSaveStore failingStore = new FailingSaveStore();
    store = failingStore;
    for (long id = 1; id <= 3; id++) {
      api.write(CHANNEL, EventXml.event(id));
    }
    start(config().build());
    awaitRecords(3);
    assertTrue(EventLogTestConstants.waitFor(() -> receiver.getMetrics().getCheckpointFailures() >= 1),
        EventLogTestConstants.ASSERT_TIMEOUT);
    receiver.shutdown();
    assertFalse(store.load(CHANNEL).isPresent());

    failingStore.failSaves = false;
    sink = new RecordingLogSink();
    start(config().build());
    awaitCheckpoint(3);

    assertEquals(List.of(1L, 2L, 3L), deliveredRecordIds());
  }

  @Test
  void shutdownWaitsForInterruptedWorkerBeforeClosingSubscription() throws InterruptedException {
    CountDownLatch consuming = new CountDownLatch(1);
    AtomicBoolean consumeReturned = new AtomicBoolean();
    LogSink slowSink = records -> {
      consuming.countDown();
      sleepIgnoringInterrupts(300);
      consumeReturned.set(true);
    };
    api.write(CHANNEL, EventXml.event(1));
    receiver = EventLogReceiverFactory.create(config().shutdownTimeout(Duration.ofMillis(50)).build(),
        api, store, slowSink);
    receiver.start();
    assertTrue(consuming.await(5, TimeUnit.SECONDS));

    receiver.shutdown();

    assertTrue(consumeReturned.get());
    assertTrue(api.allSubscriptionsClosed());
    assertEquals(ReceiverState.STOPPED, receiver.getState());
  }

  @Test
  void transientSinkErrorsAreRetried() {
    sink.failNext(2);
    api.write(CHANNEL, EventXml.event(1));

    start(config().build());
    awaitCheckpoint(1);

    assertEquals(1, sink.getRecords().size());
    assertEquals(2, receiver.getMetrics().getDeliveryRetries());
  }

  @Test
  void permanentDeliveryFailureFailsReceiver() {
    sink.failNext(1);
    api.write(CHANNEL, EventXml.event(1));

    start(config().retry(BackoffConfig.disabled()).build());

    assertTrue(EventLogTestConstants.waitFor(() -> receiver.getState() == ReceiverState.FAILED),
        EventLogTestConstants.ASSERT_TIMEOUT);
    assertFalse(receiver.getHealth().isHealthy());
    assertTrue(receiver.getFailure().orElseThrow() instanceof DeliveryException);
    assertFalse(store.load(CHANNEL).isPresent());
  }

  @Test
  void lostSubscriptionFailsReceiverAfterRetries() {
    api.failNextPulls(100);

    start(config().maxConsecutiveFailures(2).build());

    assertTrue(EventLogTestConstants.waitFor(() -> receiver.getState() == ReceiverState.FAILED),
        EventLogTestConstants.ASSERT_TIMEOUT);
    assertTrue(receiver.getFailure().orElseThrow() instanceof SubscriptionException);
  }

  @Test
  void missingChannelFailsStart() {
    EventLogReceiverConfig config = config().channel("Missing").build();
    receiver = EventLogReceiverFactory.create(config, api, store, sink);

    assertThrows(OpenException.class, receiver::start);

    assertEquals(ReceiverState.FAILED, receiver.getState());
    assertFalse(receiver.getHealth().isHealthy());
    assertTrue(sink.isClosed());
  }

  @Test
  void shutdownReleasesEverything() {
    api.write(CHANNEL, EventXml.event(1));
    start(config().build());
    awaitRecords(1);

    receiver.shutdown();

    assertEquals(ReceiverState.STOPPED, receiver.getState());
    assertTrue(sink.isClosed());
    assertTrue(api.allSubscriptionsClosed());
    assertEquals(1, api.getClosedRecords());
  }

  @Test
  void shutdownIsIdempotent() {
    start(config().build());

    receiver.shutdown();
    receiver.shutdown();

    assertEquals(ReceiverState.STOPPED, receiver.getState());
  }

  @Test
  void startTwiceIsRejected() {
    start(config().build());

    assertThrows(IllegalStateException.class, receiver::start);
    assertEquals(ReceiverState.RUNNING, receiver.getState());
  }

  @Test
  void shutdownBeforeStartPreventsStart() {
    receiver = EventLogReceiverFactory.create(config().build(), api, store, sink);

    receiver.shutdown();

    assertEquals(ReceiverState.STOPPED, receiver.getState());
    assertThrows(IllegalStateException.class, receiver::start);
    assertEquals(0, api.getSubscriptionCount());
  }

  @Test
  void eventsWrittenWhileRunningAreDelivered() {
    start(config().build());

    api.write(CHANNEL, EventXml.event(1));
    api.write(CHANNEL, EventXml.event(2));
    awaitCheckpoint(2);

    assertEquals(List.of(1L, 2L), deliveredRecordIds());
    assertEquals(2, receiver.getMetrics().getEventsDelivered());
  }

  private static void sleepIgnoringInterrupts(long millis) {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    boolean interrupted = false;
    long remaining;
    while ((remaining = deadline - System.nanoTime()) > 0) {
      try {
        TimeUnit.NANOSECONDS.sleep(remaining);
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private static class FailingSaveStore extends InMemoryPositionStore {
    private volatile boolean failSaves = true;

    @Override
    public void save(Checkpoint checkpoint) {
      if (failSaves) {
        throw new StoreException("disk full", null);
      }
      super.save(checkpoint);
    }
  }
}
