package com.etendoerp.eventlog.subscription;

import com.etendoerp.eventlog.config.EventLogReceiverConfig;
import com.etendoerp.eventlog.decoder.EventDecoder;
import com.etendoerp.eventlog.filter.ProviderFilter;

/**
 * State of one open channel subscription. Only the channel worker mutates it after
 * {@link SubscriptionManager#open} returns.
 */
public class SubscriptionHandle {
  private final EventLogReceiverConfig config;
  private final SubscriptionPosition initialPosition;
  private final EventDecoder decoder;
  private final ProviderFilter filter;
  private volatile NativeSubscription subscription;
  private long lastObservedRecordId;
  private boolean recordObserved;

  SubscriptionHandle(EventLogReceiverConfig config, SubscriptionPosition initialPosition,
      EventDecoder decoder, ProviderFilter filter, NativeSubscription subscription) {
    this.config = config;
    this.initialPosition = initialPosition;
    this.decoder = decoder;
    this.filter = filter;
    this.subscription = subscription;
    if (initialPosition.getKind() == SubscriptionPosition.Kind.AFTER_RECORD) {
      this.lastObservedRecordId = initialPosition.getRecordId();
      this.recordObserved = true;
    }
  }

  public String getChannel() {
    return config.getChannel();
  }

  public EventLogReceiverConfig getConfig() {
    return config;
  }

  EventDecoder getDecoder() {
    return decoder;
  }

  ProviderFilter getFilter() {
    return filter;
  }

  public SubscriptionPosition getInitialPosition() {
    return initialPosition;
  }

  NativeSubscription getSubscription() {
    return subscription;
  }

  void setSubscription(NativeSubscription subscription) {
    this.subscription = subscription;
  }

  public long getLastObservedRecordId() {
    return lastObservedRecordId;
  }

  void observe(long recordId) {
    if (!recordObserved || recordId > lastObservedRecordId) {
      lastObservedRecordId = recordId;
    }
    recordObserved = true;
  }

  /**
   * Where a replacement subscription must start so that no record after the last observed one
   * is skipped.
   */
  SubscriptionPosition resumePosition() {
    return recordObserved ? SubscriptionPosition.afterRecord(lastObservedRecordId) : initialPosition;
  }

  public boolean isOpen() {
    return subscription != null;
  }
}
