package com.etendoerp.eventlog.receiver;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.checkpoint.FileCheckpointStore;
import com.etendoerp.eventlog.checkpoint.InMemoryPositionStore;
import com.etendoerp.eventlog.checkpoint.PositionStore;
import com.etendoerp.eventlog.config.EventLogReceiverConfig;
import com.etendoerp.eventlog.delivery.KafkaLogSink;
import com.etendoerp.eventlog.delivery.LogSink;
import com.etendoerp.eventlog.exception.ConfigException;
import com.etendoerp.eventlog.subscription.EventLogApi;
import com.etendoerp.eventlog.windows.WindowsEventLogApi;

/**
 * Creates receivers. Configuration problems surface here as {@link ConfigException}, before a
 * receiver exists.
 */
public final class EventLogReceiverFactory {
  private static final Logger log = LogManager.getLogger();

  /** Directory for checkpoint files; when absent checkpoints only live in memory. */
  public static final String CHECKPOINT_DIRECTORY = "checkpoint.directory";

  private EventLogReceiverFactory() {
  }

  public static EventLogReceiver create(EventLogReceiverConfig config, EventLogApi api,
      PositionStore positionStore, LogSink sink) {
    if (config == null) {
      throw new ConfigException("configuration is required");
    }
    if (api == null) {
      throw new ConfigException("event log API is required");
    }
    if (positionStore == null) {
      throw new ConfigException("position store is required");
    }
    if (sink == null) {
      throw new ConfigException("sink is required");
    }
    return new EventLogReceiver(config, api, positionStore, sink);
  }

  /**
   * Creates a receiver bound to the Windows Event Log from flat properties, with the given sink.
   */
  public static EventLogReceiver create(Properties props, String prefix, LogSink sink) {
    EventLogReceiverConfig config = EventLogReceiverConfig.fromProperties(props, prefix);
    return create(config, new WindowsEventLogApi(!config.isSuppressRenderingInfo()),
        positionStore(props, prefix), sink);
  }

  /**
   * Creates a receiver bound to the Windows Event Log that publishes to Kafka, entirely from
   * flat properties.
   */
  public static EventLogReceiver create(Properties props, String prefix) {
    EventLogReceiverConfig config = EventLogReceiverConfig.fromProperties(props, prefix);
    PositionStore positionStore = positionStore(props, prefix);
    LogSink sink = KafkaLogSink.fromProperties(props, prefix, config.getChannel());
    return create(config, new WindowsEventLogApi(!config.isSuppressRenderingInfo()), positionStore, sink);
  }

  static PositionStore positionStore(Properties props, String prefix) {
    String directory = props.getProperty(StringUtils.defaultString(prefix) + CHECKPOINT_DIRECTORY);
    if (StringUtils.isBlank(directory)) {
      log.warn("No {} configured, checkpoints will not survive a restart", CHECKPOINT_DIRECTORY);
      return new InMemoryPositionStore();
    }
    try {
      return new FileCheckpointStore(Paths.get(directory.trim()));
    } catch (InvalidPathException e) {
      throw new ConfigException("invalid " + CHECKPOINT_DIRECTORY + ": '" + directory + "'", e);
    }
  }
}
