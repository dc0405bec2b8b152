package io.flagstore;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.AttributeRef;
import com.launchdarkly.sdk.ContextKind;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.DataModel.Clause;
import io.flagstore.DataModel.FeatureFlag;
import io.flagstore.DataModel.Operator;
import io.flagstore.DataModel.Rollout;
import io.flagstore.DataModel.RolloutKind;
import io.flagstore.DataModel.Segment;
import io.flagstore.DataModel.SegmentRule;
import io.flagstore.DataModel.VersionedData;
import io.flagstore.DataModel.WeightedVariation;
import io.flagstore.subsystems.DataStoreTypes.DataKind;
import io.flagstore.subsystems.DataStoreTypes.ItemDescriptor;
import io.flagstore.subsystems.DataStoreTypes.SerializedItemDescriptor;
import io.flagstore.subsystems.SerializationException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static io.flagstore.JsonHelpers.gsonKeepingNulls;

/**
 * Converts flags and segments between their JSON form and {@link ItemDescriptor}s, including the tombstone
 * form used for deleted items.
 */
abstract class DataModelSerialization {
  private DataModelSerialization() {}

  static Class<? extends VersionedData> itemClass(DataKind kind) {
    switch (kind) {
    case FEATURES:
      return FeatureFlag.class;
    case SEGMENTS:
      return Segment.class;
    default:
      throw new IllegalArgumentException("unknown data kind: " + kind);
    }
  }

  /**
   * Decodes an item from its JSON representation. A representation with {@code "deleted": true}
   * becomes a deleted-item placeholder.
   *
   * @param kind the data kind
   * @param json the JSON string
   * @return the item descriptor
   * @throws SerializationException if the JSON is malformed or is not an object
   */
  static ItemDescriptor deserializeItem(DataKind kind, String json) throws SerializationException {
    VersionedData o = JsonHelpers.decode(json, itemClass(kind));
    return o.isDeleted() ? ItemDescriptor.deletedItem(o.getVersion()) : new ItemDescriptor(o.getVersion(), o);
  }

  /**
   * Same as {@link #deserializeItem(DataKind, String)}, but also logs any data inconsistencies that were
   * found while preprocessing the item.
   *
   * @param kind the data kind
   * @param json the JSON string
   * @param logger the logger for inconsistency messages
   * @return the item descriptor
   * @throws SerializationException if the JSON is malformed or is not an object
   */
  static ItemDescriptor deserializeItem(DataKind kind, String json, LDLogger logger) throws SerializationException {
    ItemDescriptor item = deserializeItem(kind, json);
    logInconsistencies(item.getItem(), logger);
    return item;
  }

  /**
   * Decodes an item from a JSON value that was already parsed, as delivered in a change set.
   *
   * @param kind the data kind
   * @param value the JSON value
   * @param logger the logger for inconsistency messages
   * @return the item descriptor
   * @throws SerializationException if the value is not a valid item
   */
  static ItemDescriptor deserializeItem(DataKind kind, LDValue value, LDLogger logger) throws SerializationException {
    return deserializeItem(kind, value.toJsonString(), logger);
  }

  /**
   * Returns the JSON representation of an item, or a tombstone if the item is deleted.
   *
   * @param key the item key, used only for tombstones
   * @param item the item descriptor
   * @return a JSON string
   */
  static String serializeItem(String key, ItemDescriptor item) {
    Object o = item.getItem();
    if (o != null) {
      return JsonHelpers.encode(o);
    }
    return tombstone(key, item.getVersion()).toJsonString();
  }

  static SerializedItemDescriptor serializeItemDescriptor(String key, ItemDescriptor item) {
    return new SerializedItemDescriptor(item.getVersion(), item.isDeleted(), serializeItem(key, item));
  }

  /**
   * Returns the placeholder that represents a deleted item.
   *
   * @param key the item key
   * @param version the version of the deletion
   * @return {@code {"key":key,"version":version,"deleted":true}}
   */
  static LDValue tombstone(String key, int version) {
    return LDValue.buildObject().put("key", key).put("version", version).put("deleted", true).build();
  }

  static void logInconsistencies(Object item, LDLogger logger) {
    if (item instanceof FeatureFlag) {
      FeatureFlag f = (FeatureFlag)item;
      if (f.preprocessed != null) {
        for (String message: f.preprocessed.inconsistencies) {
          logger.error("Data inconsistency in feature flag \"{}\": {}", f.getKey(), message);
        }
      }
    } else if (item instanceof Segment) {
      Segment s = (Segment)item;
      if (s.preprocessed != null) {
        for (String message: s.preprocessed.inconsistencies) {
          logger.error("Data inconsistency in segment \"{}\": {}", s.getKey(), message);
        }
      }
    }
  }

  // Clause, Rollout and SegmentRule have adapters of their own because an attribute string means a literal
  // attribute name when no context kind is given, and an attribute reference path when one is.

  static final class ClauseTypeAdapter extends TypeAdapter<Clause> {
    @Override
    public void write(JsonWriter out, Clause c) throws IOException {
      out.beginObject();
      writeOptional(out, "contextKind", c.getContextKind());
      writeAttribute(out, "attribute", c.getAttribute(), c.getContextKind());
      out.name("op").value(c.getOp() == null ? null : c.getOp().name());
      out.name("values");
      writeArray(out, c.getValues(), LDValue.class);
      out.name("negate").value(c.isNegate());
      out.endObject();
    }

    @Override
    public Clause read(JsonReader in) throws IOException {
      ContextKind contextKind = null;
      String attribute = null;
      Operator op = null;
      List<LDValue> values = null;
      boolean negate = false;
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("contextKind")) {
          contextKind = readContextKind(in);
        } else if (name.equals("attribute")) {
          attribute = readNullableString(in);
        } else if (name.equals("op")) {
          String opName = readNullableString(in);
          op = opName == null ? null : Operator.forName(opName);
        } else if (name.equals("values")) {
          values = readArray(in, LDValue.class);
        } else if (name.equals("negate")) {
          negate = in.nextBoolean();
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      return new Clause(contextKind, attributeNameOrPath(attribute, contextKind), op, values, negate);
    }
  }

  static final class RolloutTypeAdapter extends TypeAdapter<Rollout> {
    @Override
    public void write(JsonWriter out, Rollout r) throws IOException {
      out.beginObject();
      writeOptional(out, "contextKind", r.getContextKind());
      out.name("variations");
      writeArray(out, r.getVariations(), WeightedVariation.class);
      writeAttribute(out, "bucketBy", r.getBucketBy(), r.getContextKind());
      if (r.isExperiment()) {
        out.name("kind").value(r.getKind().name());
      }
      if (r.getSeed() != null) {
        out.name("seed").value(r.getSeed());
      }
      out.endObject();
    }

    @Override
    public Rollout read(JsonReader in) throws IOException {
      ContextKind contextKind = null;
      List<WeightedVariation> variations = null;
      String bucketBy = null;
      RolloutKind kind = RolloutKind.rollout;
      Integer seed = null;
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("contextKind")) {
          contextKind = readContextKind(in);
        } else if (name.equals("variations")) {
          variations = readArray(in, WeightedVariation.class);
        } else if (name.equals("bucketBy")) {
          bucketBy = readNullableString(in);
        } else if (name.equals("kind")) {
          // anything unrecognized is a plain rollout
          kind = RolloutKind.experiment.name().equals(readNullableString(in)) ? RolloutKind.experiment :
            RolloutKind.rollout;
        } else if (name.equals("seed")) {
          seed = readNullableInt(in);
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      return new Rollout(contextKind, variations, attributeNameOrPath(bucketBy, contextKind), kind, seed);
    }
  }

  static final class SegmentRuleTypeAdapter extends TypeAdapter<SegmentRule> {
    @Override
    public void write(JsonWriter out, SegmentRule sr) throws IOException {
      out.beginObject();
      out.name("clauses");
      writeArray(out, sr.getClauses(), Clause.class);
      if (sr.getWeight() != null) {
        out.name("weight").value(sr.getWeight());
      }
      writeOptional(out, "rolloutContextKind", sr.getRolloutContextKind());
      writeAttribute(out, "bucketBy", sr.getBucketBy(), sr.getRolloutContextKind());
      out.endObject();
    }

    @Override
    public SegmentRule read(JsonReader in) throws IOException {
      List<Clause> clauses = null;
      Integer weight = null;
      ContextKind rolloutContextKind = null;
      String bucketBy = null;
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("clauses")) {
          clauses = readArray(in, Clause.class);
        } else if (name.equals("weight")) {
          weight = readNullableInt(in);
        } else if (name.equals("rolloutContextKind")) {
          rolloutContextKind = readContextKind(in);
        } else if (name.equals("bucketBy")) {
          bucketBy = readNullableString(in);
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      return new SegmentRule(clauses, weight, rolloutContextKind, attributeNameOrPath(bucketBy, rolloutContextKind));
    }
  }

  private static void writeOptional(JsonWriter out, String name, Object value) throws IOException {
    if (value != null) {
      out.name(name).value(value.toString());
    }
  }

  // The inverse of attributeNameOrPath: with no context kind the attribute is written back as its literal
  // name, since the path form escapes characters like '/' and '~'.
  private static void writeAttribute(JsonWriter out, String name, AttributeRef attr, ContextKind contextKind)
      throws IOException {
    if (attr == null) {
      return;
    }
    if (contextKind == null && attr.isValid() && attr.getDepth() == 1) {
      out.name(name).value(attr.getComponent(0));
    } else {
      out.name(name).value(attr.toString());
    }
  }

  private static <T> void writeArray(JsonWriter out, List<T> items, Class<T> itemClass) throws IOException {
    out.beginArray();
    for (T item: items) {
      gsonKeepingNulls().toJson(item, itemClass, out);
    }
    out.endArray();
  }

  // A JSON null is read as an empty list.
  private static <T> List<T> readArray(JsonReader in, Class<T> itemClass) throws IOException {
    List<T> items = new ArrayList<>();
    if (in.peek() == JsonToken.NULL) {
      in.skipValue();
      return items;
    }
    in.beginArray();
    while (in.hasNext()) {
      items.add(gsonKeepingNulls().fromJson(in, itemClass));
    }
    in.endArray();
    return items;
  }

  private static String readNullableString(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NULL) {
      in.skipValue();
      return null;
    }
    return in.nextString();
  }

  private static ContextKind readContextKind(JsonReader in) throws IOException {
    String kind = readNullableString(in);
    return kind == null ? null : ContextKind.of(kind);
  }

  static Integer readNullableInt(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NULL) {
      in.skipValue();
      return null;
    }
    return in.nextInt();
  }

  static AttributeRef attributeNameOrPath(String attrString, ContextKind contextKind) {
    if (attrString == null) {
      return null;
    }
    return contextKind == null ? AttributeRef.fromLiteral(attrString) : AttributeRef.fromPath(attrString);
  }
}
