package io.flagstore.subsystems;

import io.flagstore.subsystems.DataStoreTypes.DataKind;
import io.flagstore.subsystems.DataStoreTypes.ItemDescriptor;
import io.flagstore.subsystems.DataStoreTypes.KeyedItems;

/**
 * The read view of a data store, as seen by the evaluation engine.
 * <p>
 * Both the in-memory store and the persistent store wrapper implement this. Whichever one is currently
 * authoritative is returned by the store orchestrator. Items are decoded flag or segment objects.
 */
public interface ReadOnlyStore {
  /**
   * Retrieves an item from the specified collection.
   *
   * @param kind specifies which collection to use
   * @param key the unique key of the item within that collection
   * @return the versioned item, or null if the key is unknown or the item has been deleted
   */
  ItemDescriptor get(DataKind kind, String key);

  /**
   * Retrieves all items from the specified collection, excluding deleted items.
   *
   * @param kind specifies which collection to use
   * @return a collection of key-value pairs; the ordering is not significant
   */
  KeyedItems<ItemDescriptor> getAll(DataKind kind);

  /**
   * Returns true if this store has been initialized with a full data set.
   *
   * @return true if the store contains data
   */
  boolean isInitialized();
}
