package io.flagstore;

import com.google.common.collect.ImmutableList;
import com.launchdarkly.logging.LDLogger;
import io.flagstore.subsystems.DataStoreTypes.DataKind;
import io.flagstore.subsystems.DataStoreTypes.FullDataSet;
import io.flagstore.subsystems.DataStoreTypes.ItemDescriptor;
import io.flagstore.subsystems.DataStoreTypes.KeyedItems;
import io.flagstore.subsystems.DataStoreTypes.SerializedItemDescriptor;
import io.flagstore.subsystems.DataStoreUpdateSink;
import io.flagstore.subsystems.MonitorablePersistentDataStore;
import io.flagstore.subsystems.PersistentDataStore;
import io.flagstore.subsystems.ReadOnlyStore;

import java.io.Closeable;
import java.io.IOException;
import java.util.AbstractMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Package-private wrapper around an application-supplied {@link PersistentDataStore}.
 * <p>
 * It converts between decoded items and their serialized form, sorts full data sets so that dependencies are
 * written first, and tracks the availability of the underlying store. Any exception thrown by the store is
 * rethrown unchanged to the caller; if the store supports status monitoring, the exception also marks the store
 * as unavailable and starts a poller that reports when it has recovered. A successful operation does not by
 * itself mark the store available again.
 */
final class PersistentDataStoreWrapper implements ReadOnlyStore, Closeable {
  private final PersistentDataStore core;
  private final PersistentDataStoreStatusManager statusManager;
  private final boolean monitoringEnabled;
  private final LDLogger logger;

  PersistentDataStoreWrapper(
      final PersistentDataStore core,
      DataStoreUpdateSink dataStoreUpdates,
      ScheduledExecutorService sharedExecutor,
      LDLogger logger
    ) {
    this.core = core;
    this.logger = logger;
    this.monitoringEnabled = storeSupportsMonitoring(core);
    this.statusManager = new PersistentDataStoreStatusManager(
        this::pollAvailabilityAfterOutage,
        dataStoreUpdates::updateStatus,
        sharedExecutor,
        logger
        );
  }

  private static boolean storeSupportsMonitoring(PersistentDataStore core) {
    // Monitoring requires a way to find out when the store has come back, not just a way to see failures.
    return core instanceof MonitorablePersistentDataStore &&
        ((MonitorablePersistentDataStore)core).isStatusMonitoringEnabled();
  }

  @Override
  public void close() throws IOException {
    statusManager.close();
    core.close();
  }

  /**
   * Returns true if the underlying store supports availability monitoring.
   *
   * @return true if monitoring is enabled
   */
  boolean isStatusMonitoringEnabled() {
    return monitoringEnabled;
  }

  @Override
  public boolean isInitialized() {
    return core.isInitialized();
  }

  /**
   * Replaces the contents of the underlying store. Deleted items are written as tombstones.
   *
   * @param allData the data to write
   */
  void init(FullDataSet<ItemDescriptor> allData) {
    FullDataSet<ItemDescriptor> sorted = DataModelDependencies.sortAllCollections(allData);
    ImmutableList.Builder<Map.Entry<DataKind, KeyedItems<SerializedItemDescriptor>>> allBuilder = ImmutableList.builder();
    for (Map.Entry<DataKind, KeyedItems<ItemDescriptor>> e0: sorted.getData()) {
      allBuilder.add(new AbstractMap.SimpleEntry<>(e0.getKey(), serializeAll(e0.getValue())));
    }
    FullDataSet<SerializedItemDescriptor> serialized = new FullDataSet<>(allBuilder.build());
    monitored(() -> {
      core.init(serialized);
      return null;
    });
  }

  @Override
  public ItemDescriptor get(DataKind kind, String key) {
    SerializedItemDescriptor maybeSerializedItem = monitored(() -> core.get(kind, key));
    if (maybeSerializedItem == null) {
      return null;
    }
    ItemDescriptor item = deserialize(kind, maybeSerializedItem);
    return item.isDeleted() ? null : item;
  }

  @Override
  public KeyedItems<ItemDescriptor> getAll(DataKind kind) {
    KeyedItems<SerializedItemDescriptor> allItems = monitored(() -> core.getAll(kind));
    ImmutableList.Builder<Map.Entry<String, ItemDescriptor>> b = ImmutableList.builder();
    for (Map.Entry<String, SerializedItemDescriptor> e: allItems.getItems()) {
      ItemDescriptor item = deserialize(kind, e.getValue());
      if (!item.isDeleted()) {
        b.add(new AbstractMap.SimpleEntry<>(e.getKey(), item));
      }
    }
    return new KeyedItems<>(b.build());
  }

  /**
   * Writes a single item, which may be a deleted item placeholder.
   *
   * @param kind the data kind
   * @param key the item key
   * @param item the item
   * @return true if the underlying store accepted the item; false if it already had a newer version
   */
  boolean upsert(DataKind kind, String key, ItemDescriptor item) {
    SerializedItemDescriptor serializedItem = DataModelSerialization.serializeItemDescriptor(key, item);
    return monitored(() -> core.upsert(kind, key, serializedItem));
  }

  /**
   * Marks an item as deleted by writing a tombstone with the given version.
   *
   * @param kind the data kind
   * @param key the item key
   * @param version the version of the deletion
   * @return true if the underlying store accepted the tombstone
   */
  boolean delete(DataKind kind, String key, int version) {
    return upsert(kind, key, ItemDescriptor.deletedItem(version));
  }

  private <T> T monitored(Supplier<T> action) {
    try {
      return action.get();
    } catch (RuntimeException e) {
      if (monitoringEnabled) {
        statusManager.updateAvailability(false);
      }
      throw e;
    }
  }

  private KeyedItems<SerializedItemDescriptor> serializeAll(KeyedItems<ItemDescriptor> items) {
    ImmutableList.Builder<Map.Entry<String, SerializedItemDescriptor>> itemsBuilder = ImmutableList.builder();
    for (Map.Entry<String, ItemDescriptor> e: items.getItems()) {
      itemsBuilder.add(new AbstractMap.SimpleEntry<>(e.getKey(),
          DataModelSerialization.serializeItemDescriptor(e.getKey(), e.getValue())));
    }
    return new KeyedItems<>(itemsBuilder.build());
  }

  private ItemDescriptor deserialize(DataKind kind, SerializedItemDescriptor serializedItemDesc) {
    if (serializedItemDesc.isDeleted() || serializedItemDesc.getSerializedItem() == null) {
      return ItemDescriptor.deletedItem(serializedItemDesc.getVersion());
    }
    ItemDescriptor deserializedItem = DataModelSerialization.deserializeItem(kind, serializedItemDesc.getSerializedItem());
    if (serializedItemDesc.getVersion() == 0 || serializedItemDesc.getVersion() == deserializedItem.getVersion()
        || deserializedItem.getItem() == null) {
      return deserializedItem;
    }
    // If the store gave us a version number that isn't what was encoded in the object, trust it
    return new ItemDescriptor(serializedItemDesc.getVersion(), deserializedItem.getItem());
  }

  private boolean pollAvailabilityAfterOutage() {
    boolean available = ((MonitorablePersistentDataStore)core).isStoreAvailable();
    if (available) {
      logger.debug("Persistent store reported that it is available");
    }
    return available;
  }
}
