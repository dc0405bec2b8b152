package io.flagstore.subsystems;

/**
 * Optional capability of a {@link PersistentDataStore} that lets the data layer detect when the store
 * has recovered from an outage.
 * <p>
 * Status monitoring is only enabled if the store implements this interface and
 * {@link #isStatusMonitoringEnabled()} returns true.
 */
public interface MonitorablePersistentDataStore extends PersistentDataStore {
  /**
   * Returns true if this store supports availability monitoring.
   *
   * @return true if monitoring is enabled
   */
  boolean isStatusMonitoringEnabled();

  /**
   * Tests whether the data store seems to be functioning normally.
   * <p>
   * This should not be a detailed test of different kinds of operations, but just the smallest possible
   * operation to determine whether (for instance) we can reach the database. The data layer calls this
   * repeatedly while the store is unavailable.
   *
   * @return true if the underlying data store is reachable
   */
  boolean isStoreAvailable();
}
