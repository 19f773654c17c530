package com.etendoerp.eventlog.subscription;

import com.etendoerp.eventlog.config.SubscriptionMode;
import com.etendoerp.eventlog.exception.OpenException;

/**
 * Entry point to the operating system's event log subscription API.
 */
public interface EventLogApi {

  /**
   * Opens a subscription to a channel.
   *
   * @param channel channel name, e.g. {@code Application}
   * @param position where to start reading
   * @param mode whether records are pulled by the worker or pushed by the OS
   * @param bufferSize bound of the hand-off queue used in push mode
   * @return the open subscription
   * @throws OpenException if the channel does not exist or cannot be read
   */
  NativeSubscription subscribe(String channel, SubscriptionPosition position,
      SubscriptionMode mode, int bufferSize);
}
