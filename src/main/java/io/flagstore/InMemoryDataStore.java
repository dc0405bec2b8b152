package io.flagstore;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.subsystems.DataStoreTypes.DataKind;
import io.flagstore.subsystems.DataStoreTypes.FullDataSet;
import io.flagstore.subsystems.DataStoreTypes.ItemDescriptor;
import io.flagstore.subsystems.DataStoreTypes.KeyedItems;
import io.flagstore.subsystems.ReadOnlyStore;
import io.flagstore.subsystems.SerializationException;

import java.util.AbstractMap;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A thread-safe store for feature flags and segments based on a {@link HashMap}.
 * <p>
 * Incoming items are JSON values; they are decoded before the lock is taken, and a batch containing any
 * item that cannot be decoded is rejected as a whole, leaving the store untouched. Items are kept as
 * they arrive, tombstones included, but reads never return deleted items. This store does not compare
 * versions: {@link #applyDelta(Map)} overwrites whatever is there.
 */
final class InMemoryDataStore implements ReadOnlyStore {
  private final Map<DataKind, Map<String, ItemDescriptor>> allData = new EnumMap<>(DataKind.class);
  private boolean initialized = false;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final LDLogger logger;

  InMemoryDataStore(LDLogger logger) {
    this.logger = logger;
  }

  /**
   * Replaces the entire contents of the store.
   *
   * @param collections JSON items keyed by kind and then by item key
   * @return the decoded items, or null if decoding failed and nothing was changed
   */
  Map<DataKind, Map<String, ItemDescriptor>> setBasis(Map<DataKind, Map<String, LDValue>> collections) {
    Map<DataKind, Map<String, ItemDescriptor>> decoded = decodeCollections(collections);
    if (decoded == null) {
      return null;
    }
    lock.writeLock().lock();
    try {
      allData.clear();
      for (Map.Entry<DataKind, Map<String, ItemDescriptor>> e: decoded.entrySet()) {
        allData.put(e.getKey(), new HashMap<>(e.getValue()));
      }
      initialized = true;
    } finally {
      lock.writeLock().unlock();
    }
    return decoded;
  }

  /**
   * Merges items over the existing contents of the store, replacing any item with the same kind and key.
   *
   * @param collections JSON items keyed by kind and then by item key
   * @return the decoded items, or null if decoding failed and nothing was changed
   */
  Map<DataKind, Map<String, ItemDescriptor>> applyDelta(Map<DataKind, Map<String, LDValue>> collections) {
    Map<DataKind, Map<String, ItemDescriptor>> decoded = decodeCollections(collections);
    if (decoded == null) {
      return null;
    }
    lock.writeLock().lock();
    try {
      for (Map.Entry<DataKind, Map<String, ItemDescriptor>> e: decoded.entrySet()) {
        allData.computeIfAbsent(e.getKey(), k -> new HashMap<>()).putAll(e.getValue());
      }
    } finally {
      lock.writeLock().unlock();
    }
    return decoded;
  }

  private Map<DataKind, Map<String, ItemDescriptor>> decodeCollections(Map<DataKind, Map<String, LDValue>> collections) {
    Map<DataKind, Map<String, ItemDescriptor>> result = new EnumMap<>(DataKind.class);
    try {
      for (Map.Entry<DataKind, Map<String, LDValue>> kindEntry: collections.entrySet()) {
        DataKind kind = kindEntry.getKey();
        ImmutableMap.Builder<String, ItemDescriptor> items = ImmutableMap.builder();
        for (Map.Entry<String, LDValue> e: kindEntry.getValue().entrySet()) {
          items.put(e.getKey(), DataModelSerialization.deserializeItem(kind, e.getValue(), logger));
        }
        result.put(kind, items.build());
      }
    } catch (SerializationException e) {
      logger.error("Failed decoding collection: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      return null;
    }
    return result;
  }

  @Override
  public ItemDescriptor get(DataKind kind, String key) {
    lock.readLock().lock();
    try {
      Map<String, ItemDescriptor> items = allData.get(kind);
      if (items == null) {
        return null;
      }
      ItemDescriptor item = items.get(key);
      return item == null || item.isDeleted() ? null : item;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public KeyedItems<ItemDescriptor> getAll(DataKind kind) {
    lock.readLock().lock();
    try {
      Map<String, ItemDescriptor> items = allData.get(kind);
      if (items == null) {
        return new KeyedItems<>(null);
      }
      ImmutableList.Builder<Map.Entry<String, ItemDescriptor>> builder = ImmutableList.builder();
      for (Map.Entry<String, ItemDescriptor> e: items.entrySet()) {
        if (!e.getValue().isDeleted()) {
          builder.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue()));
        }
      }
      return new KeyedItems<>(builder.build());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns a snapshot of all non-deleted items of every kind.
   *
   * @return the current data
   */
  FullDataSet<ItemDescriptor> getAllData() {
    ImmutableMap.Builder<DataKind, KeyedItems<ItemDescriptor>> builder = ImmutableMap.builder();
    for (DataKind kind: DataKind.values()) {
      builder.put(kind, getAll(kind));
    }
    return new FullDataSet<>(builder.build().entrySet());
  }

  @Override
  public boolean isInitialized() {
    lock.readLock().lock();
    try {
      return initialized;
    } finally {
      lock.readLock().unlock();
    }
  }
}
