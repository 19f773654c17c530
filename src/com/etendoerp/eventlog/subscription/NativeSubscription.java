package com.etendoerp.eventlog.subscription;

import java.util.List;

import com.etendoerp.eventlog.exception.SubscriptionException;

/**
 * Open native subscription to one channel. Only the channel worker calls {@link #next(int)}.
 */
public interface NativeSubscription extends AutoCloseable {

  /**
   * Returns the records available right now, in the order the OS produced them. Never blocks
   * waiting for new events; an empty list means nothing is pending.
   *
   * @param maxRecords upper bound on the number of records returned
   * @throws SubscriptionException when the subscription broke and must be reopened
   */
  List<NativeEventRecord> next(int maxRecords);

  @Override
  void close();
}
