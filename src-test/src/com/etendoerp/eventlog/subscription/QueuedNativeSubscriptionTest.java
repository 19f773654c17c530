package com.etendoerp.eventlog.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.etendoerp.eventlog.exception.SubscriptionException;

class QueuedNativeSubscriptionTest {

  @Test
  void drainsInOfferOrderUpToMax() {
    QueuedNativeSubscription queue = new QueuedNativeSubscription(10, 10, () -> { });
    NativeEventRecord first = mock(NativeEventRecord.class);
    NativeEventRecord second = mock(NativeEventRecord.class);
    NativeEventRecord third = mock(NativeEventRecord.class);
    queue.offer(first);
    queue.offer(second);
    queue.offer(third);

    assertEquals(List.of(first, second), queue.next(2));
    assertEquals(List.of(third), queue.next(2));
    assertTrue(queue.next(2).isEmpty());
  }

  @Test
  void fullQueueFailsAfterDrainingQueuedRecords() {
    QueuedNativeSubscription queue = new QueuedNativeSubscription(1, 5, () -> { });
    NativeEventRecord queued = mock(NativeEventRecord.class);
    NativeEventRecord overflow = mock(NativeEventRecord.class);

    assertTrue(queue.offer(queued));
    assertFalse(queue.offer(overflow));
    verify(overflow).close();

    assertEquals(List.of(queued), queue.next(10));
    assertThrows(SubscriptionException.class, () -> queue.next(10));
  }

  @Test
  void recordsOfferedAfterFailureAreDiscarded() {
    QueuedNativeSubscription queue = new QueuedNativeSubscription(5, 5, () -> { });
    queue.fail(new SubscriptionException("native error 1726"));
    NativeEventRecord late = mock(NativeEventRecord.class);

    assertFalse(queue.offer(late));
    verify(late).close();
    assertEquals(0, queue.pending());
  }

  @Test
  void firstFailureWins() {
    QueuedNativeSubscription queue = new QueuedNativeSubscription(5, 5, () -> { });
    queue.fail(new SubscriptionException("first"));
    queue.fail(new SubscriptionException("second"));

    SubscriptionException e = assertThrows(SubscriptionException.class, () -> queue.next(1));
    assertEquals("first", e.getMessage());
  }

  @Test
  void closeRunsHookOnceAndClosesLeftovers() {
    AtomicInteger closes = new AtomicInteger();
    QueuedNativeSubscription queue = new QueuedNativeSubscription(5, 5, closes::incrementAndGet);
    NativeEventRecord leftover = mock(NativeEventRecord.class);
    queue.offer(leftover);

    queue.close();
    queue.close();

    assertEquals(1, closes.get());
    verify(leftover).close();
  }

  @Test
  void offerAfterCloseClosesRecord() {
    QueuedNativeSubscription queue = new QueuedNativeSubscription(5, 5, () -> { });
    queue.close();
    NativeEventRecord eventRecord = mock(NativeEventRecord.class);

    assertFalse(queue.offer(eventRecord));
    verify(eventRecord).close();
  }

  @Test
  void blockedOfferResumesWhenWorkerDrains() throws InterruptedException {
    QueuedNativeSubscription queue = new QueuedNativeSubscription(1, 2000, () -> { });
    NativeEventRecord first = mock(NativeEventRecord.class);
    NativeEventRecord second = mock(NativeEventRecord.class);
    queue.offer(first);

    Thread producer = new Thread(() -> queue.offer(second));
    producer.start();
    Thread.sleep(50);
    assertEquals(List.of(first), queue.next(1));
    producer.join(2000);

    assertEquals(List.of(second), queue.next(1));
    verify(second, never()).close();
  }
}
