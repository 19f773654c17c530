package com.etendoerp.eventlog.util;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag with cancellable waits. Once cancelled it stays cancelled.
 */
public class CancellationSignal {
  private final CountDownLatch latch = new CountDownLatch(1);

  public void cancel() {
    latch.countDown();
  }

  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Waits for the given time or until cancelled, whichever comes first. An interrupt is
   * treated as a cancellation of the wait and the interrupt flag is restored.
   *
   * @return true if the signal was cancelled (or the thread interrupted) during the wait
   */
  public boolean await(long millis) {
    if (millis <= 0) {
      return isCancelled();
    }
    try {
      return latch.await(millis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    }
  }
}
