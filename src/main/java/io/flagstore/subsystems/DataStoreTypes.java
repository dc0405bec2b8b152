package io.flagstore.subsystems;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.Map;
import java.util.Objects;

/**
 * Value types passed to and from stores.
 * <p>
 * Only a custom {@link PersistentDataStore} implementation needs these outside of this library.
 */
public abstract class DataStoreTypes {
  private DataStoreTypes() {}

  /**
   * A namespace of items. Keys only have to be unique within one kind.
   * <p>
   * {@link #getName()} is stable and can be used by a persistent store to build table names or key
   * prefixes.
   */
  public enum DataKind {
    FEATURES("features", 1),

    // Written before flags, since flag rules refer to segments.
    SEGMENTS("segments", 0);

    private final String name;
    private final int priority;

    DataKind(String name, int priority) {
      this.name = name;
      this.priority = priority;
    }

    public String getName() {
      return name;
    }

    /**
     * @return the position of this kind when a full data set is written one item at a time; lower comes first
     */
    public int getPriority() {
      return priority;
    }

    @Override
    public String toString() {
      return "DataKind(" + name + ")";
    }
  }

  /**
   * A decoded item with its version, as held by the in-memory store.
   * <p>
   * A null item is a tombstone: the item was deleted at {@code version}.
   */
  public static final class ItemDescriptor {
    private final int version;
    private final Object item;

    /**
     * @param version the version from the update source
     * @param item a {@code FeatureFlag} or {@code Segment}, or null for a deletion
     */
    public ItemDescriptor(int version, Object item) {
      this.version = version;
      this.item = item;
    }

    public static ItemDescriptor deletedItem(int version) {
      return new ItemDescriptor(version, null);
    }

    public int getVersion() {
      return version;
    }

    public Object getItem() {
      return item;
    }

    public boolean isDeleted() {
      return item == null;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ItemDescriptor)) {
        return false;
      }
      ItemDescriptor other = (ItemDescriptor)o;
      return version == other.version && Objects.equals(item, other.item);
    }

    @Override
    public int hashCode() {
      return Objects.hash(version, item);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this).addValue(version).addValue(item).toString();
    }
  }

  /**
   * An item as a persistent store sees it: version, tombstone flag and JSON text.
   * <p>
   * For a deleted item the JSON is a tombstone object, {@code {"key":...,"version":...,"deleted":true}}.
   */
  public static final class SerializedItemDescriptor {
    private final int version;
    private final boolean deleted;
    private final String serializedItem;

    public SerializedItemDescriptor(int version, boolean deleted, String serializedItem) {
      this.version = version;
      this.deleted = deleted;
      this.serializedItem = serializedItem;
    }

    public int getVersion() {
      return version;
    }

    public boolean isDeleted() {
      return deleted;
    }

    public String getSerializedItem() {
      return serializedItem;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof SerializedItemDescriptor)) {
        return false;
      }
      SerializedItemDescriptor other = (SerializedItemDescriptor)o;
      return version == other.version && deleted == other.deleted &&
          Objects.equals(serializedItem, other.serializedItem);
    }

    @Override
    public int hashCode() {
      return Objects.hash(version, deleted, serializedItem);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this).addValue(version).addValue(deleted).addValue(serializedItem)
          .toString();
    }
  }

  /**
   * Every item of every kind, for a full replacement of a store's contents.
   * <p>
   * Iteration order matters at both levels. A store that cannot write atomically writes in this order, and
   * the data system arranges it so that an item's dependencies come before the item.
   *
   * @param <TDescriptor> {@link ItemDescriptor} or {@link SerializedItemDescriptor}
   */
  public static final class FullDataSet<TDescriptor> {
    private final Iterable<Map.Entry<DataKind, KeyedItems<TDescriptor>>> data;

    /**
     * @param data the collections; null is treated as empty
     */
    public FullDataSet(Iterable<Map.Entry<DataKind, KeyedItems<TDescriptor>>> data) {
      this.data = data == null ? ImmutableList.of() : data;
    }

    public Iterable<Map.Entry<DataKind, KeyedItems<TDescriptor>>> getData() {
      return data;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof FullDataSet<?> && data.equals(((FullDataSet<?>)o).data);
    }

    @Override
    public int hashCode() {
      return data.hashCode();
    }
  }

  /**
   * The items of one kind, keyed by item key.
   *
   * @param <TDescriptor> {@link ItemDescriptor} or {@link SerializedItemDescriptor}
   */
  public static final class KeyedItems<TDescriptor> {
    private final Iterable<Map.Entry<String, TDescriptor>> items;

    /**
     * @param items the items; null is treated as empty
     */
    public KeyedItems(Iterable<Map.Entry<String, TDescriptor>> items) {
      this.items = items == null ? ImmutableList.of() : items;
    }

    public Iterable<Map.Entry<String, TDescriptor>> getItems() {
      return items;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof KeyedItems<?> && items.equals(((KeyedItems<?>)o).items);
    }

    @Override
    public int hashCode() {
      return items.hashCode();
    }
  }
}
