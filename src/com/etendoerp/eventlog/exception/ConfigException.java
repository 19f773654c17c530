package com.etendoerp.eventlog.exception;

/**
 * Invalid receiver configuration. Raised while building the configuration or opening the
 * subscription, before any native call is made. Never retried.
 */
public class ConfigException extends EventLogReceiverException {

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
