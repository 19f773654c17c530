package com.etendoerp.eventlog.exception;

/**
 * Failure handing a batch to the downstream sink.
 */
public class DeliveryException extends EventLogReceiverException {

  public enum Kind {
    /** Retried inside the delivery pipeline, never seen by callers. */
    TRANSIENT,
    /** Retries exhausted or disabled; the channel worker stops. */
    PERMANENT
  }

  private final Kind kind;

  public DeliveryException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static DeliveryException permanent(String message, Throwable cause) {
    return new DeliveryException(Kind.PERMANENT, message, cause);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isPermanent() {
    return kind == Kind.PERMANENT;
  }
}
