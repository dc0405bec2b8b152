package io.flagstore.interfaces;

import java.util.Objects;

/**
 * Reports whether the persistent store, if there is one, can be reached.
 * <p>
 * Implemented by the data system; applications only consume it.
 */
public interface DataStoreStatusProvider {
  /**
   * Returns the last known status. With no persistent store configured this is always available and
   * not stale.
   *
   * @return the status, never null
   */
  Status getStatus();

  /**
   * True if the persistent store can tell when an outage is over. Without that, a listener will never
   * be told that the store recovered, so a status other than the initial one should not be expected.
   *
   * @return true if the store is monitored
   */
  boolean isStatusMonitoringEnabled();

  /**
   * Adds a listener. It is told when a store operation fails, and again when polling finds the store
   * reachable, in which case the new status is stale if the store missed updates in between.
   *
   * @param listener the listener
   */
  void addStatusListener(StatusListener listener);

  void removeStatusListener(StatusListener listener);

  /**
   * Whether the store is reachable, and whether its contents may be behind the in-memory data.
   */
  final class Status {
    private final boolean available;
    private final boolean stale;

    public Status(boolean available, boolean stale) {
      this.available = available;
      this.stale = stale;
    }

    /**
     * @return false after a store operation failed, until the store is reachable again
     */
    public boolean isAvailable() {
      return available;
    }

    /**
     * @return true if updates may have been lost during an outage, so the store should be rewritten from
     *   the in-memory data
     */
    public boolean isStale() {
      return stale;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Status)) {
        return false;
      }
      Status o = (Status)other;
      return available == o.available && stale == o.stale;
    }

    @Override
    public int hashCode() {
      return Objects.hash(available, stale);
    }

    @Override
    public String toString() {
      return "Status(" + available + "," + stale + ")";
    }
  }

  interface StatusListener {
    void dataStoreStatusChanged(Status newStatus);
  }
}
