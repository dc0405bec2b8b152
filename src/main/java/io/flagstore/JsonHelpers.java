package io.flagstore;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.flagstore.subsystems.SerializationException;

import java.io.IOException;

/**
 * Shared Gson instances and the decode/encode entry points used for flag and segment JSON.
 */
abstract class JsonHelpers {
  private JsonHelpers() {}

  private static final Gson GSON = new GsonBuilder().create();

  // Used inside custom type adapters, which write their own nulls where the format needs them.
  private static final Gson GSON_KEEPING_NULLS = new GsonBuilder().serializeNulls().create();

  static Gson gson() {
    return GSON;
  }

  static Gson gsonKeepingNulls() {
    return GSON_KEEPING_NULLS;
  }

  /**
   * Decodes a JSON string into an object of the given class.
   *
   * @param json the JSON string
   * @param objectClass the class to create
   * @return the decoded object, never null
   * @throws SerializationException if the JSON is malformed, has the wrong shape, or is a JSON null
   */
  static <T> T decode(String json, Class<T> objectClass) throws SerializationException {
    T result;
    try {
      result = GSON.fromJson(json, objectClass);
    } catch (RuntimeException e) {
      throw new SerializationException(e);
    }
    if (result == null) {
      throw new SerializationException(new IllegalArgumentException("expected a JSON object but got: " + json));
    }
    return result;
  }

  static String encode(Object o) {
    return GSON.toJson(o);
  }

  /**
   * A model class whose derived state must be computed once its fields have been decoded. The class must
   * also be annotated with {@code @JsonAdapter(JsonHelpers.PreprocessingAdapterFactory.class)}.
   */
  interface Preprocessable {
    void preprocess();
  }

  static final class PreprocessingAdapterFactory implements TypeAdapterFactory {
    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
      TypeAdapter<T> fieldsAdapter = gson.getDelegateAdapter(this, type);
      return new TypeAdapter<T>() {
        @Override
        public void write(JsonWriter out, T value) throws IOException {
          fieldsAdapter.write(out, value);
        }

        @Override
        public T read(JsonReader in) throws IOException {
          T decoded = fieldsAdapter.read(in);
          if (decoded instanceof Preprocessable) {
            ((Preprocessable)decoded).preprocess();
          }
          return decoded;
        }
      };
    }
  }
}
