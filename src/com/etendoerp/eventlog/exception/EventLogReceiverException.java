package com.etendoerp.eventlog.exception;

/**
 * Base unchecked exception for every failure raised by the event log receiver.
 */
public class EventLogReceiverException extends RuntimeException {

  public EventLogReceiverException(String message) {
    super(message);
  }

  public EventLogReceiverException(String message, Throwable cause) {
    super(message, cause);
  }
}
