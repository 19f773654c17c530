package com.etendoerp.eventlog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import com.etendoerp.eventlog.config.SubscriptionMode;
import com.etendoerp.eventlog.exception.OpenException;
import com.etendoerp.eventlog.exception.SubscriptionException;
import com.etendoerp.eventlog.subscription.EventLogApi;
import com.etendoerp.eventlog.subscription.NativeEventRecord;
import com.etendoerp.eventlog.subscription.NativeSubscription;
import com.etendoerp.eventlog.subscription.SubscriptionPosition;

/**
 * In-memory event log. Channels hold the events written to them; subscriptions read them from
 * the requested position like the OS does.
 */
public class FakeEventLogApi implements EventLogApi {
  public static final int ERROR_EVT_CHANNEL_NOT_FOUND = 15007;

  private final Map<String, List<EventXml>> channels = new ConcurrentHashMap<>();
  private final List<SubscriptionPosition> positions = new CopyOnWriteArrayList<>();
  private final List<FakeSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicInteger failingNextCalls = new AtomicInteger();
  private final AtomicInteger failingOpens = new AtomicInteger();
  private final AtomicInteger closedRecords = new AtomicInteger();
  private volatile String failingMessageProvider;

  public FakeEventLogApi channel(String name) {
    channels.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>());
    return this;
  }

  public void write(String channel, EventXml event) {
    channels.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(event);
  }

  /**
   * Makes the next {@code count} pulls on any subscription fail.
   */
  public void failNextPulls(int count) {
    failingNextCalls.set(count);
  }

  /**
   * Makes the next {@code count} subscribe calls fail.
   */
  public void failNextOpens(int count) {
    failingOpens.set(count);
  }

  /**
   * Message rendering fails for events of this provider.
   */
  public void failMessagesFor(String provider) {
    failingMessageProvider = provider;
  }

  public List<SubscriptionPosition> getPositions() {
    return new ArrayList<>(positions);
  }

  public int getSubscriptionCount() {
    return subscriptions.size();
  }

  public boolean allSubscriptionsClosed() {
    return subscriptions.stream().allMatch(FakeSubscription::isClosed);
  }

  public int getClosedRecords() {
    return closedRecords.get();
  }

  @Override
  public NativeSubscription subscribe(String channel, SubscriptionPosition position,
      SubscriptionMode mode, int bufferSize) {
    List<EventXml> events = channels.get(channel);
    if (events == null) {
      throw new OpenException("channel '" + channel + "' does not exist", ERROR_EVT_CHANNEL_NOT_FOUND);
    }
    if (failingOpens.get() > 0) {
      failingOpens.decrementAndGet();
      throw new OpenException("simulated open failure", 1722);
    }
    positions.add(position);
    FakeSubscription subscription = new FakeSubscription(events, startIndex(events, position));
    subscriptions.add(subscription);
    return subscription;
  }

  private static int startIndex(List<EventXml> events, SubscriptionPosition position) {
    switch (position.getKind()) {
      case BEGINNING:
        return 0;
      case END:
        return events.size();
      case AFTER_RECORD:
        for (int i = 0; i < events.size(); i++) {
          if (events.get(i).getRecordId() > position.getRecordId()) {
            return i;
          }
        }
        return events.size();
      default:
        for (int i = 0; i < events.size(); i++) {
          if (!events.get(i).getTimeCreated().isBefore(position.getTimestamp())) {
            return i;
          }
        }
        return events.size();
    }
  }

  private class FakeSubscription implements NativeSubscription {
    private final List<EventXml> events;
    private int index;
    private volatile boolean closed;

    FakeSubscription(List<EventXml> events, int index) {
      this.events = events;
      this.index = index;
    }

    @Override
    public List<NativeEventRecord> next(int maxRecords) {
      if (closed) {
        throw new SubscriptionException("subscription closed");
      }
      if (failingNextCalls.get() > 0) {
        failingNextCalls.decrementAndGet();
        throw new SubscriptionException("simulated RPC failure");
      }
      if (index >= events.size()) {
        return Collections.emptyList();
      }
      List<NativeEventRecord> records = new ArrayList<>();
      while (index < events.size() && records.size() < maxRecords) {
        records.add(new FakeRecord(events.get(index++)));
      }
      return records;
    }

    boolean isClosed() {
      return closed;
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  private class FakeRecord implements NativeEventRecord {
    private final EventXml event;
    private boolean closed;

    FakeRecord(EventXml event) {
      this.event = event;
    }

    @Override
    public String renderXml() {
      return event.build();
    }

    @Override
    public String formatMessage(String providerName) {
      if (providerName.equals(failingMessageProvider)) {
        throw new IllegalStateException("publisher metadata unavailable for provider " + providerName);
      }
      return "Rendered message of event " + event.getRecordId();
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        closedRecords.incrementAndGet();
      }
    }
  }
}
