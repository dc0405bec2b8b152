package io.flagstore;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import io.flagstore.interfaces.DataStoreStatusProvider;
import io.flagstore.interfaces.DataStoreStatusProvider.Status;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Used internally to encapsulate the availability tracking and recovery polling for PersistentDataStoreWrapper.
 * <p>
 * The last known availability and the poller handle are guarded by this object's monitor. The monitor is
 * never held while calling the status function or the status consumer. Each poller is started with a
 * generation number; a poller whose generation is no longer current does nothing, so at most one poller
 * is ever effective even if a cancellation races with a scheduled run.
 */
final class PersistentDataStoreStatusManager implements Closeable {
  static final int POLL_INTERVAL_MS = 500; // visible for testing

  private final Consumer<DataStoreStatusProvider.Status> statusUpdater;
  private final ScheduledExecutorService scheduler;
  private final Callable<Boolean> statusPollFn;
  private final LDLogger logger;
  private boolean lastAvailable = true;
  private ScheduledFuture<?> pollerFuture;
  private long pollerGeneration;
  private boolean closed;

  PersistentDataStoreStatusManager(
      Callable<Boolean> statusPollFn,
      Consumer<DataStoreStatusProvider.Status> statusUpdater,
      ScheduledExecutorService sharedExecutor,
      LDLogger logger
      ) {
    this.statusPollFn = statusPollFn;
    this.statusUpdater = statusUpdater;
    this.scheduler = sharedExecutor;
    this.logger = logger;
  }

  public void close() {
    ScheduledFuture<?> pollerToStop;
    synchronized (this) {
      closed = true;
      pollerGeneration++;
      pollerToStop = pollerFuture;
      pollerFuture = null;
    }
    if (pollerToStop != null) {
      pollerToStop.cancel(false);
    }
  }

  synchronized boolean isAvailable() {
    return lastAvailable;
  }

  synchronized boolean isPolling() { // visible for testing
    return pollerFuture != null;
  }

  void updateAvailability(boolean available) {
    ScheduledFuture<?> pollerToStop = null;
    synchronized (this) {
      if (closed || lastAvailable == available) {
        return;
      }
      lastAvailable = available;
      pollerGeneration++;
      if (available) {
        pollerToStop = pollerFuture;
        pollerFuture = null;
      } else if (pollerFuture == null) {
        final long generation = pollerGeneration;
        pollerFuture = scheduler.scheduleAtFixedRate(
            () -> poll(generation),
            POLL_INTERVAL_MS,
            POLL_INTERVAL_MS,
            TimeUnit.MILLISECONDS
            );
      }
    }

    if (available) {
      logger.warn("Persistent store is available again");
    } else {
      logger.warn("Detected persistent store unavailability; updates will be cached until it recovers");
    }

    // The data that was written while the store was down may be missing from it, so both transitions
    // are reported as stale.
    statusUpdater.accept(new Status(available, true));

    if (pollerToStop != null) {
      pollerToStop.cancel(false);
    }
  }

  private void poll(long generation) {
    synchronized (this) {
      if (generation != pollerGeneration) {
        return;
      }
    }
    try {
      if (statusPollFn.call()) {
        updateAvailability(true);
      }
    } catch (Exception e) {
      logger.error("Unexpected error from data store status function: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
    }
  }
}
