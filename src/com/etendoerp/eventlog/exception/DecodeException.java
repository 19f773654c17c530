package com.etendoerp.eventlog.exception;

public class DecodeException extends EventLogReceiverException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
