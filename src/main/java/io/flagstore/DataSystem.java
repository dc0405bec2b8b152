package io.flagstore;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.launchdarkly.sdk.LDContext;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.DataSystemConfig.ComponentFactory;
import io.flagstore.interfaces.ChangeSetListener;
import io.flagstore.interfaces.DataSourceStatusProvider;
import io.flagstore.interfaces.DataSourceStatusProvider.ErrorInfo;
import io.flagstore.interfaces.DataSourceStatusProvider.ErrorKind;
import io.flagstore.interfaces.DataSourceStatusProvider.State;
import io.flagstore.interfaces.DataStoreStatusProvider;
import io.flagstore.interfaces.FlagChangeEvent;
import io.flagstore.interfaces.FlagChangeListener;
import io.flagstore.interfaces.FlagTracker;
import io.flagstore.subsystems.DataSystemTypes.Basis;
import io.flagstore.subsystems.DataSystemTypes.BasisResult;
import io.flagstore.subsystems.DataSystemTypes.ChangeSet;
import io.flagstore.subsystems.DataSystemTypes.DataAvailability;
import io.flagstore.subsystems.DataSystemTypes.DataStoreMode;
import io.flagstore.subsystems.DataSystemTypes.Update;
import io.flagstore.subsystems.Initializer;
import io.flagstore.subsystems.ReadOnlyStore;
import io.flagstore.subsystems.Synchronizer;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

/**
 * Obtains flag and segment data from the configured initializers and synchronizers, keeps it in a
 * {@link Store}, and reports the status of both the data source and the persistent store.
 * <p>
 * Initializers are run in order until one of them returns data with a defined selector. Synchronizers are
 * then run one at a time. A synchronizer that stays INITIALIZING or INTERRUPTED for too long is replaced by
 * the next one in the list, and a fallback synchronizer that has been VALID for long enough gives way to the
 * primary one again. A synchronizer that reports OFF or throws an exception is removed for good.
 */
public final class DataSystem implements Closeable {
  private static final long THREAD_JOIN_TIMEOUT_MILLIS = 5000;
  private static final long READER_JOIN_TIMEOUT_MILLIS = 500;

  private enum SyncResult {
    FALLBACK,
    RECOVER,
    REMOVE,
    FDV1
  }

  // Signals that share the synchronizer's queue with its updates.
  private enum LoopSignal {
    CHECK,
    QUIT
  }

  private final DataSystemConfig config;
  private final LDLogger logger;
  private final ScheduledExecutorService sharedExecutor;
  private final EventBroadcasterImpl<FlagChangeListener, FlagChangeEvent> flagChangeBroadcaster;
  private final EventBroadcasterImpl<ChangeSetListener, ChangeSet> changeSetBroadcaster;
  private final Store store;
  private final DataSourceStatusProviderImpl dataSourceStatusProvider;
  private final DataStoreStatusProviderImpl dataStoreStatusProvider;
  private final List<ComponentFactory<Synchronizer>> synchronizerFactories;
  private final boolean configuredWithDataSources;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private final CompletableFuture<Void> readyFuture = new CompletableFuture<>();
  private final Object activeSynchronizerLock = new Object();

  private Synchronizer activeSynchronizer;
  private volatile Thread mainThread;

  /**
   * Creates a data system. Nothing is started until {@link #start()} is called.
   *
   * @param config the configuration
   */
  public DataSystem(DataSystemConfig config) {
    this.config = config;
    LDLogger baseLogger = LDLogger.withAdapter(config.logAdapter, config.baseLoggerName);
    this.logger = baseLogger.subLogger(Loggers.DATA_SOURCE_LOGGER_NAME);
    LDLogger storeLogger = baseLogger.subLogger(Loggers.DATA_STORE_LOGGER_NAME);

    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("flagstore-tasks-%d")
        .build();
    this.sharedExecutor = Executors.newSingleThreadScheduledExecutor(threadFactory);

    this.flagChangeBroadcaster = EventBroadcasterImpl.forFlagChangeEvents(sharedExecutor, baseLogger);
    this.changeSetBroadcaster = EventBroadcasterImpl.forChangeSets(sharedExecutor, baseLogger);
    this.dataSourceStatusProvider = new DataSourceStatusProviderImpl(
        EventBroadcasterImpl.forDataSourceStatus(sharedExecutor, baseLogger));
    EventBroadcasterImpl<DataStoreStatusProvider.StatusListener, DataStoreStatusProvider.Status> dataStoreStatusBroadcaster =
        EventBroadcasterImpl.forDataStoreStatus(sharedExecutor, baseLogger);
    this.dataStoreStatusProvider = new DataStoreStatusProviderImpl(dataStoreStatusBroadcaster);
    dataStoreStatusBroadcaster.register(this::persistentStoreOutageRecovery);

    this.store = new Store(flagChangeBroadcaster, changeSetBroadcaster, storeLogger);
    if (config.persistentStore != null) {
      PersistentDataStoreWrapper wrapper = new PersistentDataStoreWrapper(
          config.persistentStore,
          dataStoreStatusProvider,
          sharedExecutor,
          storeLogger
          );
      dataStoreStatusProvider.setStore(wrapper);
      store.withPersistence(wrapper, config.persistentStoreMode == DataStoreMode.READ_WRITE, dataStoreStatusProvider);
    }

    this.synchronizerFactories = new ArrayList<>(config.synchronizers);
    this.configuredWithDataSources = config.hasDataSources();
  }

  /**
   * Starts obtaining data in the background.
   * <p>
   * The returned future completes when data is ready: when an initializer has provided current data, when
   * a synchronizer has reported a VALID state, or when every data source has been given up on. It never
   * completes exceptionally. Calling this method again returns the same future.
   *
   * @return a future that completes when the data system is ready
   */
  public Future<Void> start() {
    if (config.offline) {
      logger.warn("Data system is offline; evaluations will use application-defined default values");
      readyFuture.complete(null);
      return readyFuture;
    }
    if (!started.compareAndSet(false, true)) {
      return readyFuture;
    }
    Thread t = new Thread(this::runMainLoop, "flagstore-data-system");
    t.setDaemon(true);
    mainThread = t;
    t.start();
    return readyFuture;
  }

  /**
   * Stops all data sources, closes the persistent store, and shuts down the worker threads.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    synchronized (activeSynchronizerLock) {
      closeSynchronizer(activeSynchronizer);
    }
    Thread t = mainThread;
    if (t != null && t.isAlive()) {
      try {
        t.join(THREAD_JOIN_TIMEOUT_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (t.isAlive()) {
        logger.warn("Thread {} did not terminate in time", t.getName());
      }
    }
    Exception err = store.close();
    if (err != null) {
      logger.error("Error closing persistent store: {}", LogValues.exceptionSummary(err));
    }
    sharedExecutor.shutdown();
  }

  @Override
  public void close() throws IOException {
    stop();
  }

  /**
   * Returns the store that the evaluation engine should read from.
   *
   * @return the active store
   */
  public ReadOnlyStore getStore() {
    return store.getActiveStore();
  }

  public DataSourceStatusProvider getDataSourceStatusProvider() {
    return dataSourceStatusProvider;
  }

  public DataStoreStatusProvider getDataStoreStatusProvider() {
    return dataStoreStatusProvider;
  }

  /**
   * Returns a {@link FlagTracker} for flag change events.
   *
   * @param evaluateFn evaluates a flag for a context; used only by value change listeners
   * @return a flag tracker
   */
  public FlagTracker getFlagTracker(BiFunction<String, LDContext, LDValue> evaluateFn) {
    return new FlagTrackerImpl(flagChangeBroadcaster, evaluateFn);
  }

  /**
   * Registers a listener to be notified of every change set that is applied.
   *
   * @param listener the listener
   */
  public void addChangeSetListener(ChangeSetListener listener) {
    changeSetBroadcaster.register(listener);
  }

  public void removeChangeSetListener(ChangeSetListener listener) {
    changeSetBroadcaster.unregister(listener);
  }

  /**
   * Describes the data that is currently available.
   *
   * @return {@link DataAvailability#REFRESHED} if the data is known to be current,
   *   {@link DataAvailability#CACHED} if there is data that may be out of date, or
   *   {@link DataAvailability#DEFAULTS} if there is no data
   */
  public DataAvailability getDataAvailability() {
    if (store.getSelector().isDefined()) {
      return DataAvailability.REFRESHED;
    }
    if (!configuredWithDataSources || store.isInitialized()) {
      return DataAvailability.CACHED;
    }
    return DataAvailability.DEFAULTS;
  }

  /**
   * Describes the best data availability that this configuration can reach.
   *
   * @return {@link DataAvailability#REFRESHED} if any data sources are configured, otherwise
   *   {@link DataAvailability#CACHED}
   */
  public DataAvailability getTargetAvailability() {
    return configuredWithDataSources ? DataAvailability.REFRESHED : DataAvailability.CACHED;
  }

  // package-private for tests
  Store getInternalStore() {
    return store;
  }

  private void runMainLoop() {
    try {
      dataSourceStatusProvider.updateStatus(State.INITIALIZING, null);
      runInitializers();
      runSynchronizers();
    } catch (RuntimeException e) {
      logger.error("Error in data system main loop: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
    } finally {
      readyFuture.complete(null);
    }
  }

  private void runInitializers() {
    for (ComponentFactory<Initializer> factory: config.initializers) {
      if (stopped.get()) {
        return;
      }
      try {
        Initializer initializer = factory.build();
        logger.info("Attempting to initialize via {}", initializer.getName());
        BasisResult result = initializer.fetch(store);
        if (result.isSuccess()) {
          Basis basis = result.getBasis();
          logger.info("Initialized via {}", initializer.getName());
          store.apply(basis.getChangeSet(), basis.isPersist());
          // Only data that comes with a selector is known to be current.
          if (basis.getChangeSet().getSelector().isDefined()) {
            readyFuture.complete(null);
            return;
          }
        } else {
          logger.warn("Initializer {} failed: {}", initializer.getName(), result.getError());
        }
      } catch (RuntimeException e) {
        logger.error("Initializer failed with exception: {}", LogValues.exceptionSummary(e));
        logger.debug("{}", LogValues.exceptionTrace(e));
      }
    }
  }

  private void runSynchronizers() {
    if (synchronizerFactories.isEmpty()) {
      readyFuture.complete(null);
      return;
    }
    int currentIndex = 0;
    try {
      while (!stopped.get() && currentIndex < synchronizerFactories.size()) {
        boolean isPrimary = currentIndex == 0;
        Synchronizer synchronizer;
        try {
          synchronizer = synchronizerFactories.get(currentIndex).build();
        } catch (RuntimeException e) {
          logger.error("Failed to build synchronizer: {}", LogValues.exceptionSummary(e));
          break;
        }
        synchronized (activeSynchronizerLock) {
          if (stopped.get()) {
            closeSynchronizer(synchronizer);
            break;
          }
          activeSynchronizer = synchronizer;
        }
        logger.info("Synchronizer[{}] {} is starting", currentIndex, synchronizer.getName());

        SyncResult result = consumeSynchronizerResults(synchronizer, !isPrimary);
        if (stopped.get()) {
          break;
        }

        switch (result) {
        case FDV1:
          if (config.fdv1FallbackSynchronizer != null) {
            logger.info("Reverting to the FDv1 fallback synchronizer");
            synchronizerFactories.clear();
            synchronizerFactories.add(config.fdv1FallbackSynchronizer);
            currentIndex = 0;
            continue;
          }
          // without an FDv1 synchronizer this is an ordinary fallback
          currentIndex++;
          break;
        case RECOVER:
          logger.info("Recovery condition met, returning to primary synchronizer");
          currentIndex = 0;
          break;
        case REMOVE:
          logger.info("Removing synchronizer from list due to permanent failure");
          synchronizerFactories.remove(currentIndex);
          break;
        case FALLBACK:
        default:
          logger.info("Fallback condition met");
          currentIndex++;
          break;
        }

        if (currentIndex >= synchronizerFactories.size()) {
          currentIndex = 0;
        }
        if (synchronizerFactories.isEmpty()) {
          logger.warn("No more synchronizers available");
          dataSourceStatusProvider.updateStatus(State.OFF, dataSourceStatusProvider.getStatus().getLastError());
          break;
        }
      }
    } finally {
      readyFuture.complete(null);
      synchronized (activeSynchronizerLock) {
        closeSynchronizer(activeSynchronizer);
        activeSynchronizer = null;
      }
    }
  }

  private SyncResult consumeSynchronizerResults(Synchronizer synchronizer, boolean checkRecovery) {
    BlockingQueue<Object> actions = new LinkedBlockingQueue<>();
    Instant startedAt = Instant.now();
    long checkMillis = config.conditionCheckInterval.toMillis();
    ScheduledFuture<?> timer = sharedExecutor.scheduleAtFixedRate(() -> actions.add(LoopSignal.CHECK),
        checkMillis, checkMillis, TimeUnit.MILLISECONDS);

    Thread reader = new Thread(() -> {
      try {
        synchronizer.sync(store, actions::add);
      } catch (RuntimeException e) {
        logger.error("Synchronizer {} failed: {}", synchronizer.getName(), LogValues.exceptionSummary(e));
        logger.debug("{}", LogValues.exceptionTrace(e));
        dataSourceStatusProvider.updateStatus(State.INTERRUPTED, ErrorInfo.fromException(ErrorKind.UNKNOWN, e));
      } finally {
        actions.add(LoopSignal.QUIT);
      }
    }, "flagstore-sync-reader");
    reader.setDaemon(true);
    reader.start();

    try {
      while (true) {
        Object action = actions.take();
        if (action == LoopSignal.QUIT) {
          break;
        }
        if (action == LoopSignal.CHECK) {
          DataSourceStatusProvider.Status status = dataSourceStatusProvider.getStatus();
          if (checkRecovery && recoveryCondition(status, startedAt)) {
            return SyncResult.RECOVER;
          }
          if (fallbackCondition(status, startedAt)) {
            return SyncResult.FALLBACK;
          }
          continue;
        }

        Update update = (Update)action;
        logger.debug("Synchronizer {} update: {}", synchronizer.getName(), update.getState());
        if (stopped.get()) {
          return SyncResult.FALLBACK;
        }
        if (update.getChangeSet() != null) {
          store.apply(update.getChangeSet(), true);
        }
        if (update.getState() == State.VALID) {
          readyFuture.complete(null);
        }
        dataSourceStatusProvider.updateStatus(update.getState(), update.getError());
        if (update.isRevertToFdv1()) {
          return SyncResult.FDV1;
        }
        if (update.getState() == State.OFF) {
          return SyncResult.REMOVE;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return SyncResult.REMOVE;
    } catch (RuntimeException e) {
      logger.error("Error consuming synchronizer results: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      return SyncResult.REMOVE;
    } finally {
      timer.cancel(false);
      closeSynchronizer(synchronizer);
      try {
        reader.join(READER_JOIN_TIMEOUT_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    return SyncResult.REMOVE;
  }

  // A state that began before the synchronizer started is timed from the synchronizer's start.
  private static Duration timeInState(DataSourceStatusProvider.Status status, Instant startedAt) {
    Instant since = status.getStateSince().isAfter(startedAt) ? status.getStateSince() : startedAt;
    return Duration.between(since, Instant.now());
  }

  private boolean fallbackCondition(DataSourceStatusProvider.Status status, Instant startedAt) {
    Duration inState = timeInState(status, startedAt);
    return (status.getState() == State.INTERRUPTED && inState.compareTo(config.interruptedFallbackTimeout) > 0) ||
        (status.getState() == State.INITIALIZING && inState.compareTo(config.initializingFallbackTimeout) > 0);
  }

  private boolean recoveryCondition(DataSourceStatusProvider.Status status, Instant startedAt) {
    Duration inState = timeInState(status, startedAt);
    return status.getState() == State.VALID && inState.compareTo(config.recoveryTimeout) > 0;
  }

  // If the store has come back and may have missed updates, write everything we have to it.
  private void persistentStoreOutageRecovery(DataStoreStatusProvider.Status status) {
    if (!status.isAvailable() || !status.isStale()) {
      return;
    }
    Exception err = store.commit();
    if (err != null) {
      logger.error("Failed to reinitialize data store: {}", LogValues.exceptionSummary(err));
    }
  }

  private void closeSynchronizer(Synchronizer synchronizer) {
    if (synchronizer == null) {
      return;
    }
    try {
      synchronizer.close();
    } catch (IOException | RuntimeException e) {
      logger.error("Error stopping synchronizer {}: {}", synchronizer.getName(), LogValues.exceptionSummary(e));
    }
  }
}
