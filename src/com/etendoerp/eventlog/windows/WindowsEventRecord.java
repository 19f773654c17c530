package com.etendoerp.eventlog.windows;

import com.sun.jna.Memory;
import com.sun.jna.platform.win32.Wevtapi;
import com.sun.jna.platform.win32.WevtapiUtil;
import com.sun.jna.platform.win32.Winevt;
import com.sun.jna.platform.win32.Winevt.EVT_HANDLE;
import com.sun.jna.ptr.IntByReference;

import com.etendoerp.eventlog.subscription.NativeEventRecord;

/**
 * Event handle returned by {@code EvtNext}. Rendering is done on demand by the worker.
 */
class WindowsEventRecord implements NativeEventRecord {
  private final EVT_HANDLE event;
  private final PublisherCache publishers;
  private boolean closed;

  WindowsEventRecord(EVT_HANDLE event, PublisherCache publishers) {
    this.event = event;
    this.publishers = publishers;
  }

  @Override
  public String renderXml() {
    return renderXml(event);
  }

  @Override
  public String formatMessage(String providerName) {
    return formatMessage(publishers, event, providerName);
  }

  static String renderXml(EVT_HANDLE event) {
    Memory buffer = WevtapiUtil.EvtRender(null, event,
        Winevt.EVT_RENDER_FLAGS.EvtRenderEventXml, new IntByReference());
    return buffer.getWideString(0);
  }

  static String formatMessage(PublisherCache publishers, EVT_HANDLE event, String providerName) {
    return WevtapiUtil.EvtFormatMessage(publishers.get(providerName), event, 0, 0, null,
        Winevt.EVT_FORMAT_MESSAGE_FLAGS.EvtFormatMessageEvent);
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      Wevtapi.INSTANCE.EvtClose(event);
    }
  }
}
