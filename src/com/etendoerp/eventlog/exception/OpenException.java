package com.etendoerp.eventlog.exception;

/**
 * The native subscription could not be opened (missing channel, access denied).
 */
public class OpenException extends EventLogReceiverException {
  private final int errorCode;

  public OpenException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public OpenException(String message, Throwable cause) {
    super(message, cause);
    this.errorCode = 0;
  }

  /**
   * @return the native error code, or 0 when the failure did not come from the OS
   */
  public int getErrorCode() {
    return errorCode;
  }
}
