package io.flagstore.subsystems;

import io.flagstore.subsystems.DataStoreTypes.DataKind;
import io.flagstore.subsystems.DataStoreTypes.FullDataSet;
import io.flagstore.subsystems.DataStoreTypes.KeyedItems;
import io.flagstore.subsystems.DataStoreTypes.SerializedItemDescriptor;

import java.io.Closeable;

/**
 * A database integration that stores flags and segments as JSON strings.
 * <p>
 * Implementations deal only in {@link SerializedItemDescriptor}s. The data system wraps the store in a
 * {@code PersistentDataStoreWrapper}, which does the JSON conversion, orders full data sets so that
 * dependencies are written first, and tracks whether the database is reachable.
 * <p>
 * Any unchecked exception from one of these methods counts as an outage: the wrapper marks the store
 * unavailable and rethrows. Stores that implement {@link MonitorablePersistentDataStore} are then polled
 * until they say they are reachable again.
 * <p>
 * A deletion arrives as an {@link #upsert(DataKind, String, SerializedItemDescriptor)} of a tombstone, so
 * the deleted version stays in the database and an older update can never resurrect the item.
 */
public interface PersistentDataStore extends Closeable {
  /**
   * Replaces everything in the store. A store without transactions should write items in the order given.
   *
   * @param allData every collection with all of its items
   */
  void init(FullDataSet<SerializedItemDescriptor> allData);

  /**
   * @param kind the collection
   * @param key the item key
   * @return the stored item, possibly a tombstone; null if there is no such key
   */
  SerializedItemDescriptor get(DataKind kind, String key);

  /**
   * @param kind the collection
   * @return every item in the collection including tombstones, in no particular order
   */
  KeyedItems<SerializedItemDescriptor> getAll(DataKind kind);

  /**
   * Writes one item, unless the store already holds the same key at an equal or higher version.
   *
   * @param kind the collection
   * @param key the item key
   * @param item the new item or tombstone
   * @return false if the write was skipped because of the version check
   */
  boolean upsert(DataKind kind, String key, SerializedItemDescriptor item);

  /**
   * Whether {@link #init(FullDataSet)} has ever completed for this store. For a shared database this should
   * also be true if another process did the init.
   *
   * @return true if initialized
   */
  boolean isInitialized();
}
