package io.flagstore.subsystems;

import com.google.common.collect.ImmutableList;
import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.sdk.LDValueType;
import io.flagstore.interfaces.DataSourceStatusProvider.ErrorInfo;
import io.flagstore.interfaces.DataSourceStatusProvider.State;
import io.flagstore.subsystems.DataStoreTypes.DataKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Types that describe the data delivered by update sources: change sets, the selectors used to resume
 * a synchronization, and the results produced by {@link Initializer} and {@link Synchronizer}.
 * <p>
 * Applications should never need to use any of these types unless they are implementing a custom
 * update source.
 */
public abstract class DataSystemTypes {
  private DataSystemTypes() {}

  /**
   * How a {@link ChangeSet} is to be applied to the existing data.
   */
  public static enum IntentCode {
    /**
     * The change set contains the complete data set, which replaces everything that is stored.
     */
    TRANSFER_FULL("xfer-full"),

    /**
     * The change set contains a delta to be merged over the stored data.
     */
    TRANSFER_CHANGES("xfer-changes"),

    /**
     * The stored data is already current; nothing is to be changed.
     */
    TRANSFER_NONE("none");

    private final String wireName;

    private IntentCode(String wireName) {
      this.wireName = wireName;
    }

    /**
     * Returns the string that represents this intent in the delivery protocol.
     *
     * @return the protocol name
     */
    public String getWireName() {
      return wireName;
    }

    /**
     * Looks up an intent by its protocol name.
     *
     * @param wireName the protocol name
     * @return the intent, or null if the name is not recognized
     */
    public static IntentCode fromWireName(String wireName) {
      for (IntentCode code: values()) {
        if (code.wireName.equals(wireName)) {
          return code;
        }
      }
      return null;
    }
  }

  /**
   * The kind of object that a {@link Change} refers to.
   */
  public static enum ObjectKind {
    /**
     * A feature flag.
     */
    FLAG("flag", DataKind.FEATURES),

    /**
     * A segment.
     */
    SEGMENT("segment", DataKind.SEGMENTS);

    private final String wireName;
    private final DataKind dataKind;

    private ObjectKind(String wireName, DataKind dataKind) {
      this.wireName = wireName;
      this.dataKind = dataKind;
    }

    /**
     * Returns the string that represents this kind in the delivery protocol.
     *
     * @return the protocol name
     */
    public String getWireName() {
      return wireName;
    }

    /**
     * Returns the store collection that objects of this kind belong to.
     *
     * @return the data kind
     */
    public DataKind getDataKind() {
      return dataKind;
    }

    /**
     * Looks up a kind by its protocol name.
     *
     * @param wireName the protocol name
     * @return the kind, or null if the name is not recognized
     */
    public static ObjectKind fromWireName(String wireName) {
      for (ObjectKind kind: values()) {
        if (kind.wireName.equals(wireName)) {
          return kind;
        }
      }
      return null;
    }
  }

  /**
   * The action described by a {@link Change}.
   */
  public static enum ChangeType {
    /**
     * The object is inserted or replaced.
     */
    PUT,

    /**
     * The object is deleted; a tombstone with the change's version is kept in its place.
     */
    DELETE
  }

  /**
   * Whether the data layer may write to a configured persistent store.
   */
  public static enum DataStoreMode {
    /**
     * The persistent store is only read from; it is populated by some other process.
     */
    READ_ONLY,

    /**
     * Data received from update sources is also written to the persistent store.
     */
    READ_WRITE
  }

  /**
   * Describes how current the data available for evaluations is.
   */
  public static enum DataAvailability {
    /**
     * No data is available; evaluations will return application-defined defaults.
     */
    DEFAULTS,

    /**
     * Data is available, but it was loaded from a cache or persistent store and may be out of date.
     */
    CACHED,

    /**
     * Data has been received from an update source and is as current as that source.
     */
    REFRESHED
  }

  /**
   * An opaque cursor identifying a point in the upstream data sequence.
   * <p>
   * An update source stores the selector along with the data it delivers, and reads it back from the
   * {@link SelectorStore} to resume synchronization from that point.
   */
  public static final class Selector {
    /**
     * The sentinel value meaning that no point in the sequence is known.
     */
    public static final Selector NO_SELECTOR = new Selector("", 0);

    private final String state;
    private final int version;

    private Selector(String state, int version) {
      this.state = state == null ? "" : state;
      this.version = version;
    }

    /**
     * Creates a selector.
     *
     * @param state the opaque state token
     * @param version the version number of the data
     * @return a selector
     */
    public static Selector of(String state, int version) {
      return new Selector(state, version);
    }

    /**
     * Parses a selector from its JSON representation, {@code {"state": string, "version": number}}.
     *
     * @param json the JSON value
     * @return a selector
     * @throws IllegalArgumentException if either property is missing or has the wrong type
     */
    public static Selector fromJson(LDValue json) {
      LDValue state = json.get("state");
      LDValue version = json.get("version");
      if (state.getType() != LDValueType.STRING || !version.isNumber()) {
        throw new IllegalArgumentException("Missing required fields in selector: " + json);
      }
      return new Selector(state.stringValue(), version.intValue());
    }

    /**
     * Returns the opaque state token.
     *
     * @return the state; never null
     */
    public String getState() {
      return state;
    }

    /**
     * Returns the version number of the data.
     *
     * @return the version
     */
    public int getVersion() {
      return version;
    }

    /**
     * Returns true if this is anything other than {@link #NO_SELECTOR}.
     *
     * @return true if the selector is defined
     */
    public boolean isDefined() {
      return !this.equals(NO_SELECTOR);
    }

    /**
     * Returns the JSON representation of the selector.
     *
     * @return a JSON object with the properties "state" and "version"
     */
    public LDValue toJson() {
      return LDValue.buildObject().put("state", state).put("version", version).build();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Selector) {
        Selector o = (Selector)other;
        return state.equals(o.state) && version == o.version;
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(state, version);
    }

    @Override
    public String toString() {
      return "Selector(" + state + "," + version + ")";
    }
  }

  /**
   * A single versioned change to a flag or segment.
   */
  public static final class Change {
    private final ChangeType action;
    private final ObjectKind kind;
    private final String key;
    private final int version;
    private final LDValue object;

    /**
     * Constructs an instance.
     *
     * @param action whether this is a put or a delete
     * @param kind the kind of object
     * @param key the object key
     * @param version the object version
     * @param object the JSON representation of the object for a put; null for a delete
     */
    public Change(ChangeType action, ObjectKind kind, String key, int version, LDValue object) {
      this.action = action;
      this.kind = kind;
      this.key = key;
      this.version = version;
      this.object = object;
    }

    /**
     * Returns whether this is a put or a delete.
     *
     * @return the action
     */
    public ChangeType getAction() {
      return action;
    }

    /**
     * Returns the kind of object that changed.
     *
     * @return the object kind
     */
    public ObjectKind getKind() {
      return kind;
    }

    /**
     * Returns the key of the object that changed.
     *
     * @return the key
     */
    public String getKey() {
      return key;
    }

    /**
     * Returns the new version of the object.
     *
     * @return the version
     */
    public int getVersion() {
      return version;
    }

    /**
     * Returns the JSON representation of the object, for a put.
     *
     * @return the object, or null for a delete
     */
    public LDValue getObject() {
      return object;
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Change) {
        Change o = (Change)other;
        return action == o.action && kind == o.kind && Objects.equals(key, o.key) && version == o.version &&
            Objects.equals(object, o.object);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(action, kind, key, version, object);
    }

    @Override
    public String toString() {
      return "Change(" + action + "," + kind + "," + key + "," + version + ")";
    }
  }

  /**
   * An ordered batch of changes, tagged with an intent code and the selector that the data
   * corresponds to.
   */
  public static final class ChangeSet {
    private final IntentCode intentCode;
    private final List<Change> changes;
    private final Selector selector;

    /**
     * Constructs an instance.
     *
     * @param intentCode how the changes are to be applied
     * @param changes the changes, in the order they are to be applied
     * @param selector the selector for the resulting data; null is treated as {@link Selector#NO_SELECTOR}
     */
    public ChangeSet(IntentCode intentCode, Iterable<Change> changes, Selector selector) {
      this.intentCode = intentCode;
      this.changes = changes == null ? ImmutableList.of() : ImmutableList.copyOf(changes);
      this.selector = selector == null ? Selector.NO_SELECTOR : selector;
    }

    /**
     * Returns how the changes are to be applied.
     *
     * @return the intent code
     */
    public IntentCode getIntentCode() {
      return intentCode;
    }

    /**
     * Returns the changes in the order they are to be applied.
     *
     * @return an immutable list
     */
    public List<Change> getChanges() {
      return changes;
    }

    /**
     * Returns the selector for the data after these changes are applied.
     *
     * @return the selector; never null
     */
    public Selector getSelector() {
      return selector;
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof ChangeSet) {
        ChangeSet o = (ChangeSet)other;
        return intentCode == o.intentCode && changes.equals(o.changes) && selector.equals(o.selector);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(intentCode, changes, selector);
    }

    @Override
    public String toString() {
      return "ChangeSet(" + intentCode + "," + changes + "," + selector + ")";
    }
  }

  /**
   * Accumulates changes from a delivery protocol into {@link ChangeSet}s.
   * <p>
   * A protocol session starts with an intent ({@link #start(IntentCode)}), receives puts and deletes, and
   * completes a batch with {@link #finish(Selector)}. Once a full transfer has been completed, further
   * batches in the same session are deltas. This class is not thread-safe.
   */
  public static final class ChangeSetBuilder {
    private IntentCode intent;
    private List<Change> changes = new ArrayList<>();

    /**
     * Returns a change set meaning that the stored data is already current.
     *
     * @return a change set with {@link IntentCode#TRANSFER_NONE} and no selector
     */
    public static ChangeSet noChanges() {
      return new ChangeSet(IntentCode.TRANSFER_NONE, null, Selector.NO_SELECTOR);
    }

    /**
     * Returns a change set that replaces all stored data with nothing.
     *
     * @param selector the selector for the resulting (empty) data
     * @return a change set with {@link IntentCode#TRANSFER_FULL} and no changes
     */
    public static ChangeSet empty(Selector selector) {
      return new ChangeSet(IntentCode.TRANSFER_FULL, null, selector);
    }

    /**
     * Begins a new batch with the given intent, discarding any pending changes.
     *
     * @param intent the intent code
     */
    public void start(IntentCode intent) {
      this.intent = intent;
      this.changes = new ArrayList<>();
    }

    /**
     * Indicates that changes are about to arrive even though the session's intent was
     * {@link IntentCode#TRANSFER_NONE}; the intent becomes {@link IntentCode#TRANSFER_CHANGES}.
     *
     * @throws IllegalStateException if no intent has been started
     */
    public void expectChanges() {
      if (intent == null) {
        throw new IllegalStateException("changeset: cannot expect changes without a server-intent");
      }
      if (intent == IntentCode.TRANSFER_NONE) {
        intent = IntentCode.TRANSFER_CHANGES;
      }
    }

    /**
     * Discards any pending changes, keeping the current intent.
     */
    public void reset() {
      changes = new ArrayList<>();
    }

    /**
     * Completes the current batch.
     *
     * @param selector the selector for the data after the batch is applied
     * @return the completed change set
     * @throws IllegalStateException if no intent has been started
     */
    public ChangeSet finish(Selector selector) {
      if (intent == null) {
        throw new IllegalStateException("changeset: cannot complete without a server-intent");
      }
      ChangeSet changeSet = new ChangeSet(intent, changes, selector);
      changes = new ArrayList<>();
      if (intent == IntentCode.TRANSFER_FULL) {
        intent = IntentCode.TRANSFER_CHANGES;
      }
      return changeSet;
    }

    /**
     * Adds an insert-or-replace change.
     *
     * @param kind the kind of object
     * @param key the object key
     * @param version the object version
     * @param object the JSON representation of the object
     */
    public void addPut(ObjectKind kind, String key, int version, LDValue object) {
      changes.add(new Change(ChangeType.PUT, kind, key, version, object));
    }

    /**
     * Adds a delete change.
     *
     * @param kind the kind of object
     * @param key the object key
     * @param version the version of the deletion
     */
    public void addDelete(ObjectKind kind, String key, int version) {
      changes.add(new Change(ChangeType.DELETE, kind, key, version, null));
    }

    IntentCode getIntent() {
      return intent;
    }
  }

  /**
   * The starting state returned by an {@link Initializer}: a full change set, whether it should be
   * written to a persistent store, and the environment it came from.
   */
  public static final class Basis {
    private final ChangeSet changeSet;
    private final boolean persist;
    private final String environmentId;

    /**
     * Constructs an instance.
     *
     * @param changeSet the change set, normally with {@link IntentCode#TRANSFER_FULL}
     * @param persist true if the data should be written to a persistent store
     * @param environmentId the environment identifier, or null
     */
    public Basis(ChangeSet changeSet, boolean persist, String environmentId) {
      this.changeSet = changeSet;
      this.persist = persist;
      this.environmentId = environmentId;
    }

    /**
     * Returns the change set.
     *
     * @return the change set
     */
    public ChangeSet getChangeSet() {
      return changeSet;
    }

    /**
     * Returns true if the data should be written to a persistent store.
     *
     * @return true if the data should be persisted
     */
    public boolean isPersist() {
      return persist;
    }

    /**
     * Returns the environment identifier, if known.
     *
     * @return the environment identifier or null
     */
    public String getEnvironmentId() {
      return environmentId;
    }
  }

  /**
   * The result of {@link Initializer#fetch(SelectorStore)}: either a {@link Basis} or an error.
   */
  public static final class BasisResult {
    private final Basis basis;
    private final String error;
    private final Exception exception;

    private BasisResult(Basis basis, String error, Exception exception) {
      this.basis = basis;
      this.error = error;
      this.exception = exception;
    }

    /**
     * Creates a successful result.
     *
     * @param basis the basis
     * @return a result
     */
    public static BasisResult success(Basis basis) {
      return new BasisResult(basis, null, null);
    }

    /**
     * Creates a failed result.
     *
     * @param error a description of the failure
     * @param exception the exception that caused it, or null
     * @return a result
     */
    public static BasisResult failure(String error, Exception exception) {
      return new BasisResult(null, error, exception);
    }

    /**
     * Returns true if a basis was obtained.
     *
     * @return true for success
     */
    public boolean isSuccess() {
      return basis != null;
    }

    /**
     * Returns the basis.
     *
     * @return the basis, or null if this is a failure
     */
    public Basis getBasis() {
      return basis;
    }

    /**
     * Returns the description of the failure.
     *
     * @return the error description, or null if this is a success
     */
    public String getError() {
      return error;
    }

    /**
     * Returns the exception that caused the failure, if any.
     *
     * @return an exception or null
     */
    public Exception getException() {
      return exception;
    }

    @Override
    public String toString() {
      return isSuccess() ? "BasisResult(success)" : "BasisResult(" + error + ")";
    }
  }

  /**
   * One item of the sequence produced by {@link Synchronizer#sync(SelectorStore, java.util.function.Consumer)}.
   * <p>
   * {@link State#OFF} means that the synchronizer will not deliver anything more.
   * {@link State#INTERRUPTED} means that the data may be stale but the synchronizer is still trying.
   */
  public static final class Update {
    private final State state;
    private final ChangeSet changeSet;
    private final ErrorInfo error;
    private final boolean revertToFdv1;
    private final String environmentId;

    /**
     * Constructs an instance.
     *
     * @param state the connection state of the synchronizer
     * @param changeSet the data to apply, or null
     * @param error a description of an error, or null
     * @param revertToFdv1 true if the service has asked the client to switch to the older protocol
     * @param environmentId the environment identifier, or null
     */
    public Update(State state, ChangeSet changeSet, ErrorInfo error, boolean revertToFdv1, String environmentId) {
      this.state = state;
      this.changeSet = changeSet;
      this.error = error;
      this.revertToFdv1 = revertToFdv1;
      this.environmentId = environmentId;
    }

    /**
     * Shortcut for a {@link State#VALID} update carrying data.
     *
     * @param changeSet the data to apply
     * @return an update
     */
    public static Update valid(ChangeSet changeSet) {
      return new Update(State.VALID, changeSet, null, false, null);
    }

    /**
     * Shortcut for an {@link State#INTERRUPTED} update.
     *
     * @param error the error that caused the interruption
     * @return an update
     */
    public static Update interrupted(ErrorInfo error) {
      return new Update(State.INTERRUPTED, null, error, false, null);
    }

    /**
     * Shortcut for an {@link State#OFF} update.
     *
     * @param error the error that caused the shutdown, or null
     * @return an update
     */
    public static Update off(ErrorInfo error) {
      return new Update(State.OFF, null, error, false, null);
    }

    /**
     * Returns the connection state of the synchronizer.
     *
     * @return the state
     */
    public State getState() {
      return state;
    }

    /**
     * Returns the data to apply, if any.
     *
     * @return a change set or null
     */
    public ChangeSet getChangeSet() {
      return changeSet;
    }

    /**
     * Returns the error that accompanied this update, if any.
     *
     * @return an error or null
     */
    public ErrorInfo getError() {
      return error;
    }

    /**
     * Returns true if the service asked the client to switch to the older delivery protocol.
     *
     * @return true to revert
     */
    public boolean isRevertToFdv1() {
      return revertToFdv1;
    }

    /**
     * Returns the environment identifier, if known.
     *
     * @return the environment identifier or null
     */
    public String getEnvironmentId() {
      return environmentId;
    }

    @Override
    public String toString() {
      return "Update(" + state + "," + changeSet + "," + error + ")";
    }
  }
}
