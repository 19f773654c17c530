package com.etendoerp.eventlog.subscription;

/**
 * One event as delivered by the native API. Owned by the subscription manager until decoded,
 * then closed.
 */
public interface NativeEventRecord extends AutoCloseable {

  /**
   * @return the event rendered as an {@code <Event>} XML document
   */
  String renderXml();

  /**
   * Resolves the human readable message from the provider's message table, in the host's
   * current locale.
   *
   * @param providerName provider that emitted the event
   * @return the formatted message
   * @throws RuntimeException when the provider metadata or the message cannot be resolved
   */
  String formatMessage(String providerName);

  /**
   * Releases the native handle. Idempotent.
   */
  @Override
  void close();
}
