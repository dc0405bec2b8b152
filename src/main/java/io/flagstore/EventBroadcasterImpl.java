package io.flagstore;

import com.google.common.collect.ImmutableList;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import io.flagstore.interfaces.ChangeSetListener;
import io.flagstore.interfaces.DataSourceStatusProvider;
import io.flagstore.interfaces.DataStoreStatusProvider;
import io.flagstore.interfaces.FlagChangeEvent;
import io.flagstore.interfaces.FlagChangeListener;
import io.flagstore.subsystems.DataSystemTypes.ChangeSet;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.function.BiConsumer;

/**
 * Keeps a list of listeners of one type and delivers events to them on the shared executor.
 * <p>
 * Each event is delivered by a single task that calls the listeners registered at the time of the
 * broadcast, in registration order. Since the executor has one thread, listeners see events in the order
 * they were broadcast, and a listener registered earlier always sees an event before one registered later.
 *
 * @param <L> the listener interface
 * @param <E> the event type
 */
final class EventBroadcasterImpl<L, E> {
  private final List<L> listeners = new CopyOnWriteArrayList<>();
  private final BiConsumer<L, E> deliver;
  private final ExecutorService executor;
  private final LDLogger logger;

  /**
   * Creates an instance.
   *
   * @param deliver calls the listener method for an event
   * @param executor runs the deliveries; if null, {@link #broadcast(Object)} does nothing, which is only
   *   useful in tests
   * @param logger receives listener failures
   */
  EventBroadcasterImpl(BiConsumer<L, E> deliver, ExecutorService executor, LDLogger logger) {
    this.deliver = deliver;
    this.executor = executor;
    this.logger = logger;
  }

  static EventBroadcasterImpl<FlagChangeListener, FlagChangeEvent> forFlagChangeEvents(
      ExecutorService executor, LDLogger logger) {
    return new EventBroadcasterImpl<>(FlagChangeListener::onFlagChange, executor, logger);
  }

  static EventBroadcasterImpl<ChangeSetListener, ChangeSet> forChangeSets(
      ExecutorService executor, LDLogger logger) {
    return new EventBroadcasterImpl<>(ChangeSetListener::onChangeSetApplied, executor, logger);
  }

  static EventBroadcasterImpl<DataSourceStatusProvider.StatusListener, DataSourceStatusProvider.Status>
      forDataSourceStatus(ExecutorService executor, LDLogger logger) {
    return new EventBroadcasterImpl<>(DataSourceStatusProvider.StatusListener::dataSourceStatusChanged,
        executor, logger);
  }

  static EventBroadcasterImpl<DataStoreStatusProvider.StatusListener, DataStoreStatusProvider.Status>
      forDataStoreStatus(ExecutorService executor, LDLogger logger) {
    return new EventBroadcasterImpl<>(DataStoreStatusProvider.StatusListener::dataStoreStatusChanged,
        executor, logger);
  }

  void register(L listener) {
    listeners.add(listener);
  }

  void unregister(L listener) {
    listeners.remove(listener);
  }

  /**
   * Returns true if at least one listener is registered. Callers use this to skip work, such as
   * snapshotting old data, whose only purpose is to produce events.
   *
   * @return true if there are listeners
   */
  boolean hasListeners() {
    return !listeners.isEmpty();
  }

  void broadcast(E event) {
    if (executor == null || listeners.isEmpty()) {
      return;
    }
    List<L> recipients = ImmutableList.copyOf(listeners);
    executor.execute(() -> {
      for (L listener: recipients) {
        try {
          deliver.accept(listener, event);
        } catch (RuntimeException e) {
          logger.warn("Unexpected error from listener ({}): {}", listener.getClass(), LogValues.exceptionSummary(e));
          logger.debug("{}", LogValues.exceptionTrace(e));
        }
      }
    });
  }
}
