package com.etendoerp.eventlog.receiver;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.checkpoint.Checkpoint;
import com.etendoerp.eventlog.checkpoint.PositionStore;
import com.etendoerp.eventlog.config.EventLogReceiverConfig;
import com.etendoerp.eventlog.delivery.DeliveryPipeline;
import com.etendoerp.eventlog.delivery.LogRecordConverter;
import com.etendoerp.eventlog.delivery.LogSink;
import com.etendoerp.eventlog.exception.StoreException;
import com.etendoerp.eventlog.health.ReceiverHealthTracker;
import com.etendoerp.eventlog.monitoring.ReceiverMetrics;
import com.etendoerp.eventlog.retry.ExponentialBackoffRetryPolicy;
import com.etendoerp.eventlog.subscription.EventLogApi;
import com.etendoerp.eventlog.subscription.SubscriptionHandle;
import com.etendoerp.eventlog.subscription.SubscriptionManager;
import com.etendoerp.eventlog.util.CancellationSignal;

/**
 * Receives the events of one channel on a dedicated worker thread and forwards them to a sink.
 * <p>
 * {@link #start()} and {@link #shutdown()} are serialized by a lock. The worker moves the
 * receiver to {@link ReceiverState#FAILED} with a compare-and-set, so a failure racing with
 * shutdown never overwrites {@code STOPPING}.
 */
public class EventLogReceiver {
  private static final Logger log = LogManager.getLogger();
  private static final long WORKER_INTERRUPT_TIMEOUT_MS = 1000L;

  private final EventLogReceiverConfig config;
  private final EventLogApi api;
  private final PositionStore positionStore;
  private final LogSink sink;
  private final ReceiverMetrics metrics;
  private final ReceiverHealthTracker health;

  private final ReentrantLock lifecycleLock = new ReentrantLock();
  private final AtomicReference<ReceiverState> state = new AtomicReference<>(ReceiverState.CREATED);
  private final CancellationSignal signal = new CancellationSignal();

  private SubscriptionManager subscriptionManager;
  private SubscriptionHandle handle;
  private ExecutorService worker;
  private volatile Throwable failure;
  private boolean resourcesReleased;

  EventLogReceiver(EventLogReceiverConfig config, EventLogApi api, PositionStore positionStore,
      LogSink sink) {
    this.config = config;
    this.api = api;
    this.positionStore = positionStore;
    this.sink = sink;
    this.metrics = new ReceiverMetrics(config.getChannel());
    this.health = new ReceiverHealthTracker(config.getChannel());
  }

  /**
   * Loads the checkpoint, opens the subscription and starts the worker.
   *
   * @throws IllegalStateException if the receiver was already started
   * @throws com.etendoerp.eventlog.exception.EventLogReceiverException if the store or the
   *     subscription cannot be opened; the receiver is then {@code FAILED}
   */
  public void start() {
    lifecycleLock.lock();
    try {
      if (!state.compareAndSet(ReceiverState.CREATED, ReceiverState.STARTING)) {
        throw new IllegalStateException("receiver for channel '" + config.getChannel()
            + "' cannot start from state " + state.get());
      }
      log.info("Starting event log receiver: {}", config);
      try {
        positionStore.open();
        Checkpoint checkpoint = config.isResumeFromCheckpoint() ? loadCheckpoint() : null;
        if (checkpoint != null) {
          log.info("Resuming channel '{}' from {}", config.getChannel(), checkpoint);
        }
        subscriptionManager = new SubscriptionManager(api, metrics);
        handle = subscriptionManager.open(config, checkpoint);
        DeliveryPipeline pipeline = new DeliveryPipeline(sink,
            new LogRecordConverter(config.isIncludeLogRecordOriginal()),
            ExponentialBackoffRetryPolicy.from(config.getRetry()), positionStore, metrics, signal);

        worker = Executors.newSingleThreadExecutor(runnable -> {
          Thread thread = new Thread(runnable, "eventlog-" + config.getChannel());
          thread.setDaemon(true);
          return thread;
        });
        state.set(ReceiverState.RUNNING);
        worker.submit(() -> runWorker(pipeline));
        health.markHealthy();
        log.info("Event log receiver for channel '{}' running", config.getChannel());
      } catch (RuntimeException e) {
        failure = e;
        state.set(ReceiverState.FAILED);
        health.markUnhealthy("start failed: " + e.getMessage());
        log.error("Cannot start receiver for channel '{}': {}", config.getChannel(), e.getMessage(), e);
        releaseResources(true);
        throw e;
      }
    } finally {
      lifecycleLock.unlock();
    }
  }

  /**
   * A checkpoint that cannot be read is not fatal: the channel is read again from the configured
   * start position, at the cost of delivering some events twice.
   */
  private Checkpoint loadCheckpoint() {
    try {
      return positionStore.load(config.getChannel()).orElse(null);
    } catch (StoreException e) {
      metrics.recordCheckpointFailure();
      log.error("Cannot read checkpoint of channel '{}', starting at {}: {}", config.getChannel(),
          config.getStartAt(), e.getMessage(), e);
      return null;
    }
  }

  private void runWorker(DeliveryPipeline pipeline) {
    try {
      subscriptionManager.run(handle, pipeline, signal);
    } catch (RuntimeException e) {
      if (signal.isCancelled()) {
        log.info("Worker for channel '{}' stopped during shutdown: {}", config.getChannel(), e.getMessage());
        return;
      }
      failure = e;
      if (state.compareAndSet(ReceiverState.RUNNING, ReceiverState.FAILED)) {
        log.error("Receiver for channel '{}' failed: {}", config.getChannel(), e.getMessage(), e);
        health.markUnhealthy(e.getMessage());
      }
    } finally {
      // the worker owns the native handle once it runs, so it closes it on the way out
      subscriptionManager.close(handle);
    }
  }

  /**
   * Stops the worker and releases the subscription, the sink and the store. Waits up to the
   * configured shutdown timeout for the worker, then interrupts it. Idempotent.
   */
  public void shutdown() {
    lifecycleLock.lock();
    try {
      ReceiverState current = state.get();
      if (current == ReceiverState.CREATED) {
        state.set(ReceiverState.STOPPED);
        return;
      }
      if (current == ReceiverState.STOPPED) {
        return;
      }
      boolean stopping = state.compareAndSet(ReceiverState.RUNNING, ReceiverState.STOPPING);
      log.info("Shutting down event log receiver for channel '{}'", config.getChannel());
      signal.cancel();
      boolean workerStopped = stopWorker();
      releaseResources(workerStopped);
      if (stopping) {
        state.compareAndSet(ReceiverState.STOPPING, ReceiverState.STOPPED);
      }
      log.info("Event log receiver for channel '{}' is {}. Metrics: {}", config.getChannel(),
          state.get(), metrics.getSnapshot());
    } finally {
      lifecycleLock.unlock();
    }
  }

  /**
   * @return whether the worker has terminated, or there was none
   */
  private boolean stopWorker() {
    if (worker == null) {
      return true;
    }
    worker.shutdown();
    long timeoutMs = config.getShutdownTimeout().toMillis();
    try {
      if (worker.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Worker for channel '{}' did not stop within {} ms, interrupting",
          config.getChannel(), timeoutMs);
      worker.shutdownNow();
      if (worker.awaitTermination(WORKER_INTERRUPT_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Worker for channel '{}' still running after interrupt, it closes its subscription when it exits",
          config.getChannel());
      return false;
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void releaseResources(boolean closeSubscription) {
    if (resourcesReleased) {
      return;
    }
    resourcesReleased = true;
    if (closeSubscription && subscriptionManager != null) {
      subscriptionManager.close(handle);
    }
    try {
      sink.close();
    } catch (RuntimeException e) {
      log.warn("Error closing sink for channel '{}': {}", config.getChannel(), e.getMessage());
    }
    try {
      positionStore.close();
    } catch (RuntimeException e) {
      log.warn("Error closing position store for channel '{}': {}", config.getChannel(), e.getMessage());
    }
  }

  public ReceiverState getState() {
    return state.get();
  }

  public String getChannel() {
    return config.getChannel();
  }

  public EventLogReceiverConfig getConfig() {
    return config;
  }

  public ReceiverMetrics getMetrics() {
    return metrics;
  }

  public ReceiverHealthTracker getHealth() {
    return health;
  }

  /**
   * @return the error that moved the receiver to {@code FAILED}, if any
   */
  public Optional<Throwable> getFailure() {
    return Optional.ofNullable(failure);
  }
}
