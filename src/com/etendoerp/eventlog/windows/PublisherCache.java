package com.etendoerp.eventlog.windows;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.Wevtapi;
import com.sun.jna.platform.win32.Win32Exception;
import com.sun.jna.platform.win32.Winevt.EVT_HANDLE;

/**
 * Publisher metadata handles, opened once per provider and kept until the subscription closes.
 * Providers whose metadata cannot be opened are remembered so the lookup is not retried for
 * every event.
 */
class PublisherCache implements AutoCloseable {
  private static final Logger log = LogManager.getLogger();
  // LCID 0 selects the locale of the calling thread
  private static final int HOST_LOCALE = 0;

  private final Map<String, Optional<EVT_HANDLE>> handles = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * @throws Win32Exception if the metadata of the provider cannot be opened
   * @throws IllegalStateException once the cache is closed
   */
  EVT_HANDLE get(String providerName) {
    if (closed) {
      throw new IllegalStateException("publisher cache closed");
    }
    if (StringUtils.isEmpty(providerName)) {
      throw new IllegalArgumentException("event has no provider name");
    }
    return handles.computeIfAbsent(providerName, this::open)
        .orElseThrow(() -> new IllegalStateException(
            "publisher metadata unavailable for provider " + providerName));
  }

  private Optional<EVT_HANDLE> open(String providerName) {
    EVT_HANDLE handle = Wevtapi.INSTANCE.EvtOpenPublisherMetadata(null, providerName, null,
        HOST_LOCALE, 0);
    if (handle == null) {
      int error = Kernel32.INSTANCE.GetLastError();
      log.debug("Cannot open publisher metadata for '{}': {}", providerName,
          new Win32Exception(error).getMessage());
      return Optional.empty();
    }
    return Optional.of(handle);
  }

  @Override
  public void close() {
    closed = true;
    handles.values().forEach(handle -> handle.ifPresent(Wevtapi.INSTANCE::EvtClose));
    handles.clear();
  }
}
