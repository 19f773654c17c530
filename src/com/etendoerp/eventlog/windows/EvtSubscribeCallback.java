package com.etendoerp.eventlog.windows;

import com.sun.jna.Pointer;
import com.sun.jna.platform.win32.Winevt.EVT_HANDLE;
import com.sun.jna.win32.StdCallLibrary;

/**
 * Native {@code EVT_SUBSCRIBE_CALLBACK}. The event handle is only valid while the callback runs.
 */
interface EvtSubscribeCallback extends StdCallLibrary.StdCallCallback {

  /**
   * @param action {@code EvtSubscribeActionDeliver} or {@code EvtSubscribeActionError}
   * @param userContext context pointer given to {@code EvtSubscribe}, unused
   * @param event the event, or the Win32 error code when {@code action} is an error
   * @return ignored by the service, 0 by convention
   */
  int callback(int action, Pointer userContext, EVT_HANDLE event);
}
