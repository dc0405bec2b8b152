package io.flagstore;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.DataModelDependencies.KindAndKey;
import io.flagstore.interfaces.ChangeSetListener;
import io.flagstore.interfaces.DataStoreStatusProvider;
import io.flagstore.interfaces.FlagChangeEvent;
import io.flagstore.interfaces.FlagChangeListener;
import io.flagstore.subsystems.DataStoreTypes.DataKind;
import io.flagstore.subsystems.DataStoreTypes.FullDataSet;
import io.flagstore.subsystems.DataStoreTypes.ItemDescriptor;
import io.flagstore.subsystems.DataStoreTypes.KeyedItems;
import io.flagstore.subsystems.DataSystemTypes.Change;
import io.flagstore.subsystems.DataSystemTypes.ChangeSet;
import io.flagstore.subsystems.DataSystemTypes.ChangeType;
import io.flagstore.subsystems.DataSystemTypes.Selector;
import io.flagstore.subsystems.ReadOnlyStore;
import io.flagstore.subsystems.SelectorStore;

import java.util.AbstractMap;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.google.common.collect.Iterables.concat;
import static io.flagstore.subsystems.DataStoreTypes.DataKind.FEATURES;
import static java.util.Collections.emptyMap;

/**
 * Serves flag and segment data to the evaluation engine, switching between an in-memory store and an
 * optional persistent store.
 * <p>
 * If a persistent store is configured, it is read from until the first change set arrives. After that,
 * every read goes to the in-memory store, and the persistent store (if writable) only receives copies of
 * what was applied. Change sets are applied under a write lock, so a reader never sees a partially merged
 * batch. Flag change events are computed with the dependency graph, so that a change to a segment or a
 * prerequisite also produces events for every flag that depends on it.
 * <p>
 * {@link #apply(ChangeSet, boolean)} never throws: a change set that can't be applied is logged and
 * dropped, and the previously applied data stays in place.
 */
final class Store implements SelectorStore {
  /**
   * Which underlying store currently answers reads.
   */
  static enum ActiveStore {
    MEMORY,
    PERSISTENT
  }

  private final InMemoryDataStore memoryStore;
  private final DataModelDependencies.DependencyTracker dependencyTracker = new DataModelDependencies.DependencyTracker();
  private final EventBroadcasterImpl<FlagChangeListener, FlagChangeEvent> flagChangeEventNotifier;
  private final EventBroadcasterImpl<ChangeSetListener, ChangeSet> changeSetNotifier;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final LDLogger logger;

  private PersistentDataStoreWrapper persistentStore;
  private boolean persistentStoreWritable;
  private DataStoreStatusProvider persistentStoreStatusProvider;
  private ActiveStore activeStore = ActiveStore.MEMORY;
  private boolean persist;
  private Selector selector = Selector.NO_SELECTOR;

  Store(
      EventBroadcasterImpl<FlagChangeListener, FlagChangeEvent> flagChangeEventNotifier,
      EventBroadcasterImpl<ChangeSetListener, ChangeSet> changeSetNotifier,
      LDLogger logger
      ) {
    this.flagChangeEventNotifier = flagChangeEventNotifier;
    this.changeSetNotifier = changeSetNotifier;
    this.logger = logger;
    this.memoryStore = new InMemoryDataStore(logger);
  }

  /**
   * Configures a persistent store. Until data has been applied, reads go directly to this store.
   *
   * @param store the wrapped persistent store
   * @param writable true if applied data should be written to the store
   * @param statusProvider the status provider for the store
   * @return the same Store
   */
  Store withPersistence(PersistentDataStoreWrapper store, boolean writable, DataStoreStatusProvider statusProvider) {
    lock.writeLock().lock();
    try {
      this.persistentStore = store;
      this.persistentStoreWritable = writable;
      this.persistentStoreStatusProvider = statusProvider;
      this.activeStore = ActiveStore.PERSISTENT;
    } finally {
      lock.writeLock().unlock();
    }
    return this;
  }

  @Override
  public Selector getSelector() {
    lock.readLock().lock();
    try {
      return selector;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Applies a change set.
   *
   * @param changeSet the change set
   * @param persist true if the data may be written to the persistent store
   */
  void apply(ChangeSet changeSet, boolean persist) {
    lock.writeLock().lock();
    try {
      Map<DataKind, Map<String, LDValue>> collections = changesToStoreData(changeSet.getChanges());
      boolean applied;
      switch (changeSet.getIntentCode()) {
      case TRANSFER_FULL:
        applied = setBasis(collections, changeSet.getSelector(), persist);
        break;
      case TRANSFER_CHANGES:
        applied = applyDelta(collections, changeSet.getSelector(), persist);
        break;
      default:
        return;
      }
      if (applied) {
        changeSetNotifier.broadcast(changeSet);
      }
    } catch (RuntimeException e) {
      logger.error("Couldn't apply changeset: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Writes the entire contents of the in-memory store to the persistent store, if one is configured and
   * writable and the current data may be persisted. This is used to repopulate a store after an outage.
   *
   * @return the exception thrown by the persistent store, or null if there was none
   */
  Exception commit() {
    lock.writeLock().lock();
    try {
      if (!shouldPersist()) {
        return null;
      }
      persistentStore.init(memoryStore.getAllData());
    } catch (RuntimeException e) {
      return e;
    } finally {
      lock.writeLock().unlock();
    }
    return null;
  }

  /**
   * Returns the store that currently answers reads.
   *
   * @return the in-memory store, or the persistent store if no data has been applied yet
   */
  ReadOnlyStore getActiveStore() {
    lock.readLock().lock();
    try {
      return activeStore == ActiveStore.PERSISTENT ? persistentStore : memoryStore;
    } finally {
      lock.readLock().unlock();
    }
  }

  ActiveStore getActiveStoreKind() {
    lock.readLock().lock();
    try {
      return activeStore;
    } finally {
      lock.readLock().unlock();
    }
  }

  boolean isInitialized() {
    return getActiveStore().isInitialized();
  }

  DataStoreStatusProvider getDataStoreStatusProvider() {
    lock.readLock().lock();
    try {
      return persistentStoreStatusProvider;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Closes the persistent store, if any.
   *
   * @return the exception thrown while closing, or null if there was none
   */
  Exception close() {
    lock.writeLock().lock();
    try {
      if (persistentStore != null) {
        persistentStore.close();
      }
    } catch (Exception e) {
      return e;
    } finally {
      lock.writeLock().unlock();
    }
    return null;
  }

  private boolean setBasis(Map<DataKind, Map<String, LDValue>> collections, Selector newSelector, boolean newPersist) {
    Map<DataKind, Map<String, ItemDescriptor>> oldData = null;
    if (flagChangeEventNotifier.hasListeners()) {
      // Query the existing data so that after the update we can send events for whatever was changed
      oldData = new EnumMap<>(DataKind.class);
      for (DataKind kind: DataKind.values()) {
        oldData.put(kind, ImmutableMap.copyOf(memoryStore.getAll(kind).getItems()));
      }
    }

    Map<DataKind, Map<String, ItemDescriptor>> newData = memoryStore.setBasis(collections);
    if (newData == null) {
      return false;
    }

    updateDependencyTrackerFromFullDataSet(newData);

    this.persist = newPersist;
    this.selector = newSelector == null ? Selector.NO_SELECTOR : newSelector;
    this.activeStore = ActiveStore.MEMORY;

    if (shouldPersist()) {
      try {
        persistentStore.init(toFullDataSet(newData));
      } catch (RuntimeException e) {
        reportPersistenceFailure(e);
      }
    }

    if (oldData != null) {
      sendChangeEvents(computeChangedItemsForFullDataSet(oldData, newData));
    }
    return true;
  }

  private boolean applyDelta(Map<DataKind, Map<String, LDValue>> collections, Selector newSelector, boolean newPersist) {
    Map<DataKind, Map<String, ItemDescriptor>> newData = memoryStore.applyDelta(collections);
    if (newData == null) {
      return false;
    }

    boolean hasListeners = flagChangeEventNotifier.hasListeners();
    Set<KindAndKey> affectedItems = new HashSet<>();
    for (Map.Entry<DataKind, Map<String, ItemDescriptor>> e0: newData.entrySet()) {
      DataKind kind = e0.getKey();
      for (Map.Entry<String, ItemDescriptor> e1: e0.getValue().entrySet()) {
        dependencyTracker.updateDependenciesFrom(kind, e1.getKey(), e1.getValue());
        if (hasListeners) {
          dependencyTracker.addAffectedItems(affectedItems, new KindAndKey(kind, e1.getKey()));
        }
      }
    }

    this.persist = newPersist;
    this.selector = newSelector == null ? Selector.NO_SELECTOR : newSelector;

    if (shouldPersist()) {
      try {
        for (Map.Entry<DataKind, Map<String, ItemDescriptor>> e0: newData.entrySet()) {
          for (Map.Entry<String, ItemDescriptor> e1: e0.getValue().entrySet()) {
            persistentStore.upsert(e0.getKey(), e1.getKey(), e1.getValue());
          }
        }
      } catch (RuntimeException e) {
        reportPersistenceFailure(e);
      }
    }

    if (!affectedItems.isEmpty()) {
      sendChangeEvents(affectedItems);
    }
    return true;
  }

  private boolean shouldPersist() {
    return persist && persistentStore != null && persistentStoreWritable;
  }

  private void reportPersistenceFailure(RuntimeException e) {
    logger.warn("Unexpected data store error when trying to persist an update: {}",
        LogValues.exceptionSummary(e));
    logger.debug("{}", LogValues.exceptionTrace(e));
  }

  // Deletions become tombstones so that the version of the deletion is kept.
  private Map<DataKind, Map<String, LDValue>> changesToStoreData(Iterable<Change> changes) {
    Map<DataKind, Map<String, LDValue>> allData = new EnumMap<>(DataKind.class);
    for (DataKind kind: DataKind.values()) {
      allData.put(kind, new LinkedHashMap<>());
    }
    for (Change change: changes) {
      // a newer service may send object kinds or actions that this version does not know
      if (change.getKind() == null || change.getAction() == null) {
        logger.warn("Ignoring change to \"{}\" with unrecognized kind or action", change.getKey());
        continue;
      }
      DataKind kind = change.getKind().getDataKind();
      if (change.getAction() == ChangeType.PUT && change.getObject() != null) {
        allData.get(kind).put(change.getKey(), change.getObject());
      } else if (change.getAction() == ChangeType.DELETE) {
        allData.get(kind).put(change.getKey(), DataModelSerialization.tombstone(change.getKey(), change.getVersion()));
      }
    }
    return allData;
  }

  private void updateDependencyTrackerFromFullDataSet(Map<DataKind, Map<String, ItemDescriptor>> allData) {
    dependencyTracker.reset();
    for (Map.Entry<DataKind, Map<String, ItemDescriptor>> e0: allData.entrySet()) {
      DataKind kind = e0.getKey();
      for (Map.Entry<String, ItemDescriptor> e1: e0.getValue().entrySet()) {
        dependencyTracker.updateDependenciesFrom(kind, e1.getKey(), e1.getValue());
      }
    }
  }

  private Set<KindAndKey> computeChangedItemsForFullDataSet(Map<DataKind, Map<String, ItemDescriptor>> oldDataMap,
      Map<DataKind, Map<String, ItemDescriptor>> newDataMap) {
    Set<KindAndKey> affectedItems = new HashSet<>();
    for (DataKind kind: DataKind.values()) {
      Map<String, ItemDescriptor> oldItems = oldDataMap.get(kind);
      Map<String, ItemDescriptor> newItems = newDataMap.get(kind);
      if (oldItems == null) {
        oldItems = emptyMap();
      }
      if (newItems == null) {
        newItems = emptyMap();
      }
      Set<String> allKeys = ImmutableSet.copyOf(concat(oldItems.keySet(), newItems.keySet()));
      for (String key: allKeys) {
        ItemDescriptor oldItem = oldItems.get(key);
        ItemDescriptor newItem = newItems.get(key);
        if (oldItem == null || newItem == null || oldItem.getVersion() != newItem.getVersion()) {
          dependencyTracker.addAffectedItems(affectedItems, new KindAndKey(kind, key));
        }
      }
    }
    return affectedItems;
  }

  private void sendChangeEvents(Iterable<KindAndKey> affectedItems) {
    for (KindAndKey item: affectedItems) {
      if (item.kind == FEATURES) {
        flagChangeEventNotifier.broadcast(new FlagChangeEvent(item.key));
      }
    }
  }

  private static FullDataSet<ItemDescriptor> toFullDataSet(Map<DataKind, Map<String, ItemDescriptor>> data) {
    ImmutableList.Builder<Map.Entry<DataKind, KeyedItems<ItemDescriptor>>> builder = ImmutableList.builder();
    for (Map.Entry<DataKind, Map<String, ItemDescriptor>> e: data.entrySet()) {
      builder.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(),
          new KeyedItems<>(ImmutableList.copyOf(e.getValue().entrySet()))));
    }
    return new FullDataSet<>(builder.build());
  }
}
