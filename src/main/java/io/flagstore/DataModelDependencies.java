package io.flagstore;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.DataModel.Clause;
import io.flagstore.DataModel.FeatureFlag;
import io.flagstore.DataModel.Operator;
import io.flagstore.DataModel.Prerequisite;
import io.flagstore.DataModel.Rule;
import io.flagstore.DataModel.Segment;
import io.flagstore.DataModel.SegmentRule;
import io.flagstore.subsystems.DataStoreTypes.DataKind;
import io.flagstore.subsystems.DataStoreTypes.FullDataSet;
import io.flagstore.subsystems.DataStoreTypes.ItemDescriptor;
import io.flagstore.subsystems.DataStoreTypes.KeyedItems;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.flagstore.subsystems.DataStoreTypes.DataKind.FEATURES;
import static io.flagstore.subsystems.DataStoreTypes.DataKind.SEGMENTS;

/**
 * Dependency relationships between flags and segments.
 * <p>
 * A flag depends on each of its prerequisite flags and on every segment named by a {@code segmentMatch}
 * clause in its rules. A segment depends on every segment named by a {@code segmentMatch} clause in its own
 * rules. These edges are used in two ways: to find out which flags may have changed when an item is
 * updated, and to order a full data set so that a store that is written item by item never holds an item
 * before the items it depends on.
 */
abstract class DataModelDependencies {
  private DataModelDependencies() {}

  /**
   * Identifies an item by its kind and key.
   */
  static final class KindAndKey {
    final DataKind kind;
    final String key;

    public KindAndKey(DataKind kind, String key) {
      this.kind = kind;
      this.key = key;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof KindAndKey)) {
        return false;
      }
      KindAndKey o = (KindAndKey)other;
      return kind == o.kind && Objects.equals(key, o.key);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, key);
    }

    @Override
    public String toString() {
      return kind.getName() + ":" + key;
    }
  }

  /**
   * Returns the items that the given item directly depends on, in the order they are referenced.
   *
   * @param fromKind the item's kind
   * @param fromItem the item, which may be null or a deleted item
   * @return the dependencies; empty if there are none
   */
  public static Set<KindAndKey> computeDependenciesFrom(DataKind fromKind, ItemDescriptor fromItem) {
    if (fromItem == null || fromItem.getItem() == null) {
      return ImmutableSet.of();
    }
    ImmutableSet.Builder<KindAndKey> deps = ImmutableSet.builder();
    if (fromKind == FEATURES) {
      FeatureFlag flag = (FeatureFlag)fromItem.getItem();
      for (Prerequisite p: flag.getPrerequisites()) {
        deps.add(new KindAndKey(FEATURES, p.getKey()));
      }
      for (Rule r: flag.getRules()) {
        addSegmentReferences(deps, r.getClauses());
      }
    } else {
      Segment segment = (Segment)fromItem.getItem();
      for (SegmentRule r: segment.getRules()) {
        addSegmentReferences(deps, r.getClauses());
      }
    }
    return deps.build();
  }

  private static void addSegmentReferences(ImmutableSet.Builder<KindAndKey> deps, Iterable<Clause> clauses) {
    for (Clause c: clauses) {
      if (c.getOp() != Operator.segmentMatch) {
        continue;
      }
      for (LDValue v: c.getValues()) {
        String segmentKey = v.stringValue();
        // values that are not strings can't name a segment
        if (segmentKey != null) {
          deps.add(new KindAndKey(SEGMENTS, segmentKey));
        }
      }
    }
  }

  /**
   * Returns a copy of the data set in which segments come before flags, and each flag comes after any
   * prerequisite flags that are in the same data set. Prerequisite cycles are broken arbitrarily.
   *
   * @param allData the data set
   * @return the ordered data set
   */
  public static FullDataSet<ItemDescriptor> sortAllCollections(FullDataSet<ItemDescriptor> allData) {
    List<Map.Entry<DataKind, KeyedItems<ItemDescriptor>>> collections = new ArrayList<>();
    for (Map.Entry<DataKind, KeyedItems<ItemDescriptor>> e: allData.getData()) {
      collections.add(e);
    }
    collections.sort(Comparator.comparingInt(e -> e.getKey().getPriority()));

    List<Map.Entry<DataKind, KeyedItems<ItemDescriptor>>> sorted = new ArrayList<>();
    for (Map.Entry<DataKind, KeyedItems<ItemDescriptor>> e: collections) {
      KeyedItems<ItemDescriptor> items = e.getKey() == FEATURES ? sortByPrerequisites(e.getValue()) : e.getValue();
      sorted.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), items));
    }
    return new FullDataSet<>(sorted);
  }

  private static KeyedItems<ItemDescriptor> sortByPrerequisites(KeyedItems<ItemDescriptor> flags) {
    Map<String, ItemDescriptor> byKey = new LinkedHashMap<>();
    for (Map.Entry<String, ItemDescriptor> e: flags.getItems()) {
      byKey.put(e.getKey(), e.getValue());
    }
    // ImmutableMap keeps insertion order.
    ImmutableMap.Builder<String, ItemDescriptor> out = ImmutableMap.builder();
    Set<String> visited = new HashSet<>();
    for (String key: byKey.keySet()) {
      visitPrerequisitesFirst(key, byKey, visited, out);
    }
    return new KeyedItems<>(out.build().entrySet());
  }

  private static void visitPrerequisitesFirst(String key, Map<String, ItemDescriptor> byKey, Set<String> visited,
      ImmutableMap.Builder<String, ItemDescriptor> out) {
    if (!visited.add(key)) {
      return;
    }
    ItemDescriptor item = byKey.get(key);
    for (KindAndKey dep: computeDependenciesFrom(FEATURES, item)) {
      if (dep.kind == FEATURES && byKey.containsKey(dep.key)) {
        visitPrerequisitesFirst(dep.key, byKey, visited, out);
      }
    }
    out.put(key, item);
  }

  /**
   * A graph of the current dependencies, kept in both directions so that an item's edges can be replaced
   * and so that the items depending on a changed item can be found.
   * <p>
   * Not thread-safe; the store only uses it while holding its write lock.
   */
  static final class DependencyTracker {
    private final Map<KindAndKey, Set<KindAndKey>> dependsOn = new HashMap<>();
    private final SetMultimap<KindAndKey, KindAndKey> dependedOnBy = HashMultimap.create();

    /**
     * Replaces the recorded dependencies of an item with the ones it has now.
     *
     * @param fromKind the item's kind
     * @param fromKey the item's key
     * @param fromItem the new state of the item; a deleted item has no dependencies
     */
    public void updateDependenciesFrom(DataKind fromKind, String fromKey, ItemDescriptor fromItem) {
      KindAndKey from = new KindAndKey(fromKind, fromKey);
      Set<KindAndKey> previous = dependsOn.remove(from);
      if (previous != null) {
        for (KindAndKey dep: previous) {
          dependedOnBy.remove(dep, from);
        }
      }
      Set<KindAndKey> current = computeDependenciesFrom(fromKind, fromItem);
      dependsOn.put(from, current);
      for (KindAndKey dep: current) {
        dependedOnBy.put(dep, from);
      }
    }

    public void reset() {
      dependsOn.clear();
      dependedOnBy.clear();
    }

    /**
     * Adds the modified item, and every item that depends on it directly or through other items, to the
     * given set. Items already in the set are not expanded again, so cycles terminate.
     *
     * @param itemsOut the set to add to
     * @param initialModifiedItem the item that changed
     */
    public void addAffectedItems(Set<KindAndKey> itemsOut, KindAndKey initialModifiedItem) {
      Deque<KindAndKey> pending = new ArrayDeque<>();
      pending.add(initialModifiedItem);
      while (!pending.isEmpty()) {
        KindAndKey item = pending.poll();
        if (itemsOut.add(item)) {
          pending.addAll(dependedOnBy.get(item));
        }
      }
    }
  }
}
