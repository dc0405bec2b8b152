package io.flagstore;

import io.flagstore.interfaces.DataStoreStatusProvider;
import io.flagstore.subsystems.DataStoreUpdateSink;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest data store status and broadcasts changes to it. The availability wrapper reports
 * to this object through {@link DataStoreUpdateSink}; a status equal to the current one is not
 * broadcast again.
 */
final class DataStoreStatusProviderImpl implements DataStoreStatusProvider, DataStoreUpdateSink {
  private final EventBroadcasterImpl<StatusListener, Status> statusBroadcaster;
  private final AtomicReference<Status> lastStatus;
  private volatile PersistentDataStoreWrapper store;

  DataStoreStatusProviderImpl(
      EventBroadcasterImpl<StatusListener, Status> statusBroadcaster
      ) {
    this.statusBroadcaster = statusBroadcaster;
    this.lastStatus = new AtomicReference<>(new Status(true, false)); // initially "available"
  }

  // The wrapper reports to this object, so it can only be attached after both exist.
  void setStore(PersistentDataStoreWrapper store) {
    this.store = store;
  }

  @Override
  public void updateStatus(Status newStatus) {
    if (newStatus != null) {
      Status oldStatus = lastStatus.getAndSet(newStatus);
      if (!newStatus.equals(oldStatus)) {
        statusBroadcaster.broadcast(newStatus);
      }
    }
  }

  @Override
  public Status getStatus() {
    return lastStatus.get();
  }

  @Override
  public boolean isStatusMonitoringEnabled() {
    PersistentDataStoreWrapper s = store;
    return s != null && s.isStatusMonitoringEnabled();
  }

  @Override
  public void addStatusListener(StatusListener listener) {
    statusBroadcaster.register(listener);
  }

  @Override
  public void removeStatusListener(StatusListener listener) {
    statusBroadcaster.unregister(listener);
  }
}
