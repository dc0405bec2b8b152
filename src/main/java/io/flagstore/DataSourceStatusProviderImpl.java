package io.flagstore;

import io.flagstore.interfaces.DataSourceStatusProvider;

import java.time.Duration;
import java.time.Instant;

/**
 * Holds the latest data source status, applies the state transition rules to incoming updates, and
 * broadcasts the resulting changes.
 */
final class DataSourceStatusProviderImpl implements DataSourceStatusProvider {
  private final EventBroadcasterImpl<StatusListener, Status> dataSourceStatusNotifier;
  private final Object stateLock = new Object();
  private Status currentStatus;

  DataSourceStatusProviderImpl(
      EventBroadcasterImpl<StatusListener, Status> dataSourceStatusNotifier
      ) {
    this.dataSourceStatusNotifier = dataSourceStatusNotifier;
    this.currentStatus = new Status(State.INITIALIZING, Instant.now(), null);
  }

  /**
   * Reports the state of the update source.
   * <p>
   * An {@link State#INTERRUPTED} report while still {@link State#INITIALIZING} leaves the state as
   * INITIALIZING, since no data has been received yet, and nothing can return the state to INITIALIZING
   * once it has left it. A report that changes neither the state nor the error is ignored.
   *
   * @param newState the new state
   * @param newError an error, or null to keep the previous error
   */
  void updateStatus(State newState, ErrorInfo newError) {
    if (newState == null) {
      return;
    }

    Status statusToBroadcast = null;

    synchronized (stateLock) {
      Status oldStatus = currentStatus;

      if (newState == State.INTERRUPTED && oldStatus.getState() == State.INITIALIZING) {
        newState = State.INITIALIZING;
      } else if (newState == State.INITIALIZING && oldStatus.getState() != State.INITIALIZING) {
        newState = oldStatus.getState();
      }

      if (newState != oldStatus.getState() || newError != null) {
        currentStatus = new Status(
            newState,
            newState == oldStatus.getState() ? oldStatus.getStateSince() : Instant.now(),
            newError == null ? oldStatus.getLastError() : newError
            );
        statusToBroadcast = currentStatus;
        stateLock.notifyAll();
      }
    }

    if (statusToBroadcast != null) {
      dataSourceStatusNotifier.broadcast(statusToBroadcast);
    }
  }

  @Override
  public Status getStatus() {
    synchronized (stateLock) {
      return currentStatus;
    }
  }

  @Override
  public boolean waitFor(State desiredState, Duration timeout) throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeout.toMillis();
    synchronized (stateLock) {
      while (true) {
        if (currentStatus.getState() == desiredState) {
          return true;
        }
        if (currentStatus.getState() == State.OFF) {
          return false;
        }
        if (timeout.isZero() || timeout.isNegative()) {
          stateLock.wait();
        } else {
          long now = System.currentTimeMillis();
          if (now >= deadline) {
            return false;
          }
          stateLock.wait(deadline - now);
        }
      }
    }
  }

  @Override
  public void addStatusListener(StatusListener listener) {
    dataSourceStatusNotifier.register(listener);
  }

  @Override
  public void removeStatusListener(StatusListener listener) {
    dataSourceStatusNotifier.unregister(listener);
  }
}
