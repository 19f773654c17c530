package com.etendoerp.eventlog.windows;

import java.lang.ref.Reference;
import java.time.format.DateTimeFormatter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.sun.jna.Platform;
import com.sun.jna.Pointer;
import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.Wevtapi;
import com.sun.jna.platform.win32.Win32Exception;
import com.sun.jna.platform.win32.WinNT.HANDLE;
import com.sun.jna.platform.win32.Winevt;
import com.sun.jna.platform.win32.Winevt.EVT_HANDLE;

import com.etendoerp.eventlog.config.SubscriptionMode;
import com.etendoerp.eventlog.decoder.EventXmlParser;
import com.etendoerp.eventlog.exception.OpenException;
import com.etendoerp.eventlog.exception.SubscriptionException;
import com.etendoerp.eventlog.subscription.EventLogApi;
import com.etendoerp.eventlog.subscription.NativeSubscription;
import com.etendoerp.eventlog.subscription.QueuedNativeSubscription;
import com.etendoerp.eventlog.subscription.SubscriptionPosition;

/**
 * {@link EventLogApi} backed by {@code wevtapi.dll} through JNA.
 */
public class WindowsEventLogApi implements EventLogApi {
  private static final Logger log = LogManager.getLogger();

  static final int ERROR_ACCESS_DENIED = 5;
  static final int ERROR_NO_MORE_ITEMS = 259;
  static final int ERROR_TIMEOUT = 1460;
  static final int RPC_S_INVALID_BOUND = 1734;
  static final int ERROR_INVALID_OPERATION = 4317;
  static final int ERROR_EVT_CHANNEL_NOT_FOUND = 15007;

  private static final long PUSH_OFFER_TIMEOUT_MS = 5000;

  private final boolean renderMessages;

  public WindowsEventLogApi() {
    this(true);
  }

  /**
   * @param renderMessages whether push callbacks resolve the message text while the event
   *     handle is still valid; pull subscriptions render on demand regardless
   */
  public WindowsEventLogApi(boolean renderMessages) {
    this.renderMessages = renderMessages;
  }

  @Override
  public NativeSubscription subscribe(String channel, SubscriptionPosition position,
      SubscriptionMode mode, int bufferSize) {
    if (!Platform.isWindows()) {
      throw new OpenException("the Windows Event Log is not available on this platform", 0);
    }
    String query = buildQuery(position);
    int flags = subscribeFlags(position);
    log.debug("EvtSubscribe channel='{}' query='{}' flags={} mode={}", channel, query, flags, mode);
    return mode == SubscriptionMode.PUSH
        ? subscribePush(channel, query, flags, bufferSize)
        : subscribePull(channel, query, flags);
  }

  private NativeSubscription subscribePull(String channel, String query, int flags) {
    HANDLE signalEvent = Kernel32.INSTANCE.CreateEvent(null, true, true, null);
    if (signalEvent == null) {
      int error = Kernel32.INSTANCE.GetLastError();
      throw new OpenException("cannot create signal event: " + new Win32Exception(error).getMessage(), error);
    }
    EVT_HANDLE subscription = Wevtapi.INSTANCE.EvtSubscribe(null,
        new EVT_HANDLE(signalEvent.getPointer()), channel, query, null, null, null, flags);
    if (subscription == null) {
      int error = Kernel32.INSTANCE.GetLastError();
      Kernel32.INSTANCE.CloseHandle(signalEvent);
      throw openFailure(channel, error);
    }
    return new WindowsPullSubscription(channel, subscription, signalEvent, new PublisherCache());
  }

  private NativeSubscription subscribePush(String channel, String query, int flags, int bufferSize) {
    PublisherCache publishers = new PublisherCache();
    EVT_HANDLE[] subscription = new EVT_HANDLE[1];
    EventXmlParser parser = new EventXmlParser();
    QueuedNativeSubscription[] queue = new QueuedNativeSubscription[1];

    EvtSubscribeCallback callback = (action, userContext, event) -> {
      if (action == Winevt.EVT_SUBSCRIBE_NOTIFY_ACTION.EvtSubscribeActionError) {
        // on error the event argument carries the Win32 error code instead of a handle
        int error = event == null ? 0 : (int) Pointer.nativeValue(event.getPointer());
        queue[0].fail(new SubscriptionException("subscription to " + channel + " reported error "
            + error + ": " + new Win32Exception(error).getMessage()));
        return 0;
      }
      queue[0].offer(render(parser, publishers, event));
      return 0;
    };

    queue[0] = new QueuedNativeSubscription(bufferSize, PUSH_OFFER_TIMEOUT_MS, () -> {
      if (subscription[0] != null) {
        Wevtapi.INSTANCE.EvtClose(subscription[0]);
      }
      publishers.close();
      // the callback must not be collected while the native subscription can still call it
      Reference.reachabilityFence(callback);
    });
    subscription[0] = Wevtapi.INSTANCE.EvtSubscribe(null, null, channel, query, null, null,
        callback, flags);
    if (subscription[0] == null) {
      int error = Kernel32.INSTANCE.GetLastError();
      queue[0].close();
      throw openFailure(channel, error);
    }
    return queue[0];
  }

  private RenderedEventRecord render(EventXmlParser parser, PublisherCache publishers,
      EVT_HANDLE event) {
    String xml;
    try {
      xml = WindowsEventRecord.renderXml(event);
    } catch (Win32Exception e) {
      // an empty document is reported by the decoder as undecodable
      log.warn("EvtRender failed inside push callback: {}", e.getMessage());
      return new RenderedEventRecord("", "", null);
    }
    if (!renderMessages) {
      return new RenderedEventRecord(xml, "", null);
    }
    try {
      String provider = parser.scanSystem(xml).getProviderName();
      return new RenderedEventRecord(xml,
          WindowsEventRecord.formatMessage(publishers, event, provider), null);
    } catch (RuntimeException e) {
      return new RenderedEventRecord(xml, null, e);
    }
  }

  private static OpenException openFailure(String channel, int error) {
    switch (error) {
      case ERROR_EVT_CHANNEL_NOT_FOUND:
        return new OpenException("channel '" + channel + "' does not exist", error);
      case ERROR_ACCESS_DENIED:
        return new OpenException("access to channel '" + channel + "' denied", error);
      default:
        return new OpenException("cannot subscribe to channel '" + channel + "': "
            + new Win32Exception(error).getMessage(), error);
    }
  }

  /**
   * XPath query selecting the records at or after the position.
   */
  static String buildQuery(SubscriptionPosition position) {
    switch (position.getKind()) {
      case AFTER_RECORD:
        return "*[System[EventRecordID>" + position.getRecordId() + "]]";
      case SINCE_TIMESTAMP:
        return "*[System[TimeCreated[@SystemTime>='"
            + DateTimeFormatter.ISO_INSTANT.format(position.getTimestamp()) + "']]]";
      default:
        return "*";
    }
  }

  static int subscribeFlags(SubscriptionPosition position) {
    if (position.getKind() == SubscriptionPosition.Kind.END) {
      return Winevt.EVT_SUBSCRIBE_FLAGS.EvtSubscribeToFutureEvents;
    }
    return Winevt.EVT_SUBSCRIBE_FLAGS.EvtSubscribeStartAtOldestRecord;
  }
}
