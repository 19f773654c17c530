package com.etendoerp.eventlog.exception;

/**
 * Mid-stream failure of an open subscription (channel cleared or rolled over, provider
 * unregistered, push queue overflow). Recovered by resubscribing.
 */
public class SubscriptionException extends EventLogReceiverException {

  public SubscriptionException(String message) {
    super(message);
  }

  public SubscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
