package com.etendoerp.eventlog.health;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Health of one channel receiver. Listeners are notified on transitions only, so an ongoing
 * condition is reported once.
 */
public class ReceiverHealthTracker {
  private static final Logger log = LogManager.getLogger();

  public enum Status {
    HEALTHY,
    UNHEALTHY
  }

  public interface HealthListener {
    void onUnhealthy(String channel, String reason);

    void onHealthy(String channel);
  }

  private final String channel;
  private final List<HealthListener> listeners = new CopyOnWriteArrayList<>();
  private Status status = Status.HEALTHY;
  private String lastError;
  private LocalDateTime lastChange = LocalDateTime.now();

  public ReceiverHealthTracker(String channel) {
    this.channel = channel;
  }

  public void addListener(HealthListener listener) {
    listeners.add(listener);
  }

  public void removeListener(HealthListener listener) {
    listeners.remove(listener);
  }

  public void markHealthy() {
    synchronized (this) {
      if (status == Status.HEALTHY) {
        return;
      }
      status = Status.HEALTHY;
      lastChange = LocalDateTime.now();
    }
    log.info("Receiver for channel '{}' is healthy again", channel);
    listeners.forEach(listener -> listener.onHealthy(channel));
  }

  public void markUnhealthy(String reason) {
    synchronized (this) {
      lastError = reason;
      if (status == Status.UNHEALTHY) {
        return;
      }
      status = Status.UNHEALTHY;
      lastChange = LocalDateTime.now();
    }
    log.warn("Receiver for channel '{}' became unhealthy: {}", channel, reason);
    listeners.forEach(listener -> listener.onUnhealthy(channel, reason));
  }

  public synchronized Status getStatus() {
    return status;
  }

  public synchronized boolean isHealthy() {
    return status == Status.HEALTHY;
  }

  /**
   * @return the reason of the most recent unhealthy report, or null if there was none
   */
  public synchronized String getLastError() {
    return lastError;
  }

  public synchronized LocalDateTime getLastChange() {
    return lastChange;
  }

  public String getChannel() {
    return channel;
  }

  /**
   * Gets a human readable health report.
   */
  public synchronized String getHealthReport() {
    StringBuilder report = new StringBuilder();
    report.append("=== Event Log Receiver Health Report ===\n");
    report.append("Channel: ").append(channel).append("\n");
    report.append("Status: ").append(status);
    if (status == Status.UNHEALTHY && lastError != null) {
      report.append(" (").append(lastError).append(")");
    }
    report.append("\n");
    report.append("Last change: ").append(lastChange).append("\n");
    return report.toString();
  }
}
