package com.etendoerp.eventlog.subscription;

import com.etendoerp.eventlog.delivery.DeliveryBatch;

/**
 * Receives the batch assembled on each worker tick. Called synchronously from the channel
 * worker; the next pull only happens once it returns.
 */
@FunctionalInterface
public interface BatchHandler {

  /**
   * @throws com.etendoerp.eventlog.exception.DeliveryException with a permanent kind to stop
   *     the worker
   */
  void onBatch(DeliveryBatch batch);
}
