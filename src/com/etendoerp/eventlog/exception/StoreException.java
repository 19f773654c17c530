package com.etendoerp.eventlog.exception;

/**
 * Failure reading or writing a checkpoint. Callers log it and carry on; the only consequence
 * is possible re-delivery after a restart.
 */
public class StoreException extends EventLogReceiverException {

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
