package com.etendoerp.eventlog.receiver;

/**
 * Lifecycle of a receiver:
 * {@code CREATED -> STARTING -> RUNNING -> STOPPING -> STOPPED}, with {@code FAILED} reachable
 * from {@code STARTING} and {@code RUNNING}.
 */
public enum ReceiverState {
  CREATED,
  STARTING,
  RUNNING,
  STOPPING,
  STOPPED,
  FAILED;

  public boolean isTerminal() {
    return this == STOPPED || this == FAILED;
  }
}
