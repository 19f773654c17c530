package com.etendoerp.eventlog.windows;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.Wevtapi;
import com.sun.jna.platform.win32.Win32Exception;
import com.sun.jna.platform.win32.WinNT.HANDLE;
import com.sun.jna.platform.win32.Winevt.EVT_HANDLE;
import com.sun.jna.ptr.IntByReference;

import com.etendoerp.eventlog.exception.SubscriptionException;
import com.etendoerp.eventlog.subscription.NativeEventRecord;
import com.etendoerp.eventlog.subscription.NativeSubscription;

/**
 * Pull-model subscription: the worker drains pending events with a non-blocking
 * {@code EvtNext} on every tick.
 */
class WindowsPullSubscription implements NativeSubscription {
  private static final Logger log = LogManager.getLogger();

  private final String channel;
  private final EVT_HANDLE subscription;
  private final HANDLE signalEvent;
  private final PublisherCache publishers;
  private int batchLimit = Integer.MAX_VALUE;
  private boolean closed;

  WindowsPullSubscription(String channel, EVT_HANDLE subscription, HANDLE signalEvent,
      PublisherCache publishers) {
    this.channel = channel;
    this.subscription = subscription;
    this.signalEvent = signalEvent;
    this.publishers = publishers;
  }

  @Override
  public List<NativeEventRecord> next(int maxRecords) {
    if (closed) {
      throw new SubscriptionException("subscription to " + channel + " is closed");
    }
    int size = Math.min(maxRecords, batchLimit);
    EVT_HANDLE[] events = new EVT_HANDLE[size];
    IntByReference returned = new IntByReference();
    if (!Wevtapi.INSTANCE.EvtNext(subscription, size, events, 0, 0, returned)) {
      int error = Kernel32.INSTANCE.GetLastError();
      switch (error) {
        case WindowsEventLogApi.ERROR_NO_MORE_ITEMS:
        case WindowsEventLogApi.ERROR_TIMEOUT:
          return Collections.emptyList();
        case WindowsEventLogApi.ERROR_INVALID_OPERATION:
          if (returned.getValue() == 0) {
            return Collections.emptyList();
          }
          break;
        case WindowsEventLogApi.RPC_S_INVALID_BOUND:
          // the batch did not fit the RPC buffer; shrink it and try again next tick
          batchLimit = Math.max(1, size / 2);
          log.debug("EvtNext batch too large for channel '{}', limiting to {}", channel, batchLimit);
          return Collections.emptyList();
        default:
          break;
      }
      throw new SubscriptionException("EvtNext failed on channel " + channel + ": "
          + new Win32Exception(error).getMessage());
    }
    int count = returned.getValue();
    List<NativeEventRecord> records = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      records.add(new WindowsEventRecord(events[i], publishers));
    }
    return records;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      Wevtapi.INSTANCE.EvtClose(subscription);
      Kernel32.INSTANCE.CloseHandle(signalEvent);
    } finally {
      publishers.close();
    }
  }
}
