package io.flagstore;

import com.google.common.collect.ImmutableList;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDSLF4J;
import com.launchdarkly.logging.Logs;
import io.flagstore.subsystems.DataSystemTypes.DataStoreMode;
import io.flagstore.subsystems.Initializer;
import io.flagstore.subsystems.PersistentDataStore;
import io.flagstore.subsystems.Synchronizer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for a {@link DataSystem}. Instances are immutable and must be constructed with
 * {@link DataSystemConfig#builder()}.
 */
public final class DataSystemConfig {
  /**
   * How long the data source may stay in the INITIALIZING state before the next synchronizer is tried.
   */
  public static final Duration DEFAULT_INITIALIZING_FALLBACK_TIMEOUT = Duration.ofSeconds(10);

  /**
   * How long the data source may stay in the INTERRUPTED state before the next synchronizer is tried.
   */
  public static final Duration DEFAULT_INTERRUPTED_FALLBACK_TIMEOUT = Duration.ofSeconds(60);

  /**
   * How long a fallback synchronizer must stay VALID before the primary synchronizer is tried again.
   */
  public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofMinutes(5);

  /**
   * How often the fallback and recovery conditions are checked.
   */
  public static final Duration DEFAULT_CONDITION_CHECK_INTERVAL = Duration.ofSeconds(10);

  /**
   * Creates a component for the data system. A factory is called again every time the data system needs
   * a fresh instance, for instance when it returns to a synchronizer it had fallen back from.
   *
   * @param <T> the component type
   */
  @FunctionalInterface
  public interface ComponentFactory<T> {
    /**
     * Creates an instance.
     *
     * @return the new component
     */
    T build();
  }

  final List<ComponentFactory<Initializer>> initializers;
  final List<ComponentFactory<Synchronizer>> synchronizers;
  final ComponentFactory<Synchronizer> fdv1FallbackSynchronizer;
  final PersistentDataStore persistentStore;
  final DataStoreMode persistentStoreMode;
  final boolean offline;
  final LDLogAdapter logAdapter;
  final String baseLoggerName;
  final Duration initializingFallbackTimeout;
  final Duration interruptedFallbackTimeout;
  final Duration recoveryTimeout;
  final Duration conditionCheckInterval;

  private DataSystemConfig(Builder builder) {
    this.initializers = ImmutableList.copyOf(builder.initializers);
    this.synchronizers = ImmutableList.copyOf(builder.synchronizers);
    this.fdv1FallbackSynchronizer = builder.fdv1FallbackSynchronizer;
    this.persistentStore = builder.persistentStore;
    this.persistentStoreMode = builder.persistentStoreMode;
    this.offline = builder.offline;
    LDLogAdapter adapter = builder.logAdapter == null ? getDefaultLogAdapter() : builder.logAdapter;
    // For a framework like SLF4J that has its own configuration, the level filter has no effect.
    this.logAdapter = Logs.level(adapter, builder.minimumLevel == null ? LDLogLevel.INFO : builder.minimumLevel);
    this.baseLoggerName = builder.baseLoggerName == null ? Loggers.BASE_LOGGER_NAME : builder.baseLoggerName;
    this.initializingFallbackTimeout = builder.initializingFallbackTimeout;
    this.interruptedFallbackTimeout = builder.interruptedFallbackTimeout;
    this.recoveryTimeout = builder.recoveryTimeout;
    this.conditionCheckInterval = builder.conditionCheckInterval;
  }

  /**
   * Returns a new builder with default settings.
   *
   * @return a builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns true if at least one initializer or synchronizer was configured.
   *
   * @return true if there are data sources
   */
  public boolean hasDataSources() {
    return !initializers.isEmpty() || !synchronizers.isEmpty();
  }

  public boolean isOffline() {
    return offline;
  }

  public DataStoreMode getPersistentStoreMode() {
    return persistentStoreMode;
  }

  private static LDLogAdapter getDefaultLogAdapter() {
    // If SLF4J is present in the classpath, use that by default; otherwise use the console.
    try {
      Class.forName("org.slf4j.LoggerFactory");
      return LDSLF4J.adapter();
    } catch (ClassNotFoundException e) {
      return Logs.toConsole();
    }
  }

  /**
   * A mutable builder for {@link DataSystemConfig}.
   */
  public static final class Builder {
    private final List<ComponentFactory<Initializer>> initializers = new ArrayList<>();
    private final List<ComponentFactory<Synchronizer>> synchronizers = new ArrayList<>();
    private ComponentFactory<Synchronizer> fdv1FallbackSynchronizer;
    private PersistentDataStore persistentStore;
    private DataStoreMode persistentStoreMode = DataStoreMode.READ_WRITE;
    private boolean offline;
    private LDLogAdapter logAdapter;
    private LDLogLevel minimumLevel;
    private String baseLoggerName;
    private Duration initializingFallbackTimeout = DEFAULT_INITIALIZING_FALLBACK_TIMEOUT;
    private Duration interruptedFallbackTimeout = DEFAULT_INTERRUPTED_FALLBACK_TIMEOUT;
    private Duration recoveryTimeout = DEFAULT_RECOVERY_TIMEOUT;
    private Duration conditionCheckInterval = DEFAULT_CONDITION_CHECK_INTERVAL;

    private Builder() {}

    /**
     * Sets the initializers, which are run in order until one of them provides data that is fully
     * current. Replaces any previously set initializers.
     *
     * @param initializers the initializer factories
     * @return the builder
     */
    @SafeVarargs
    public final Builder initializers(ComponentFactory<Initializer>... initializers) {
      this.initializers.clear();
      this.initializers.addAll(Arrays.asList(initializers));
      return this;
    }

    /**
     * Sets the synchronizers. The first one is the primary synchronizer; the others are fallbacks that are
     * used, in order, when the one before them fails or stalls. Replaces any previously set synchronizers.
     *
     * @param synchronizers the synchronizer factories
     * @return the builder
     */
    @SafeVarargs
    public final Builder synchronizers(ComponentFactory<Synchronizer>... synchronizers) {
      this.synchronizers.clear();
      this.synchronizers.addAll(Arrays.asList(synchronizers));
      return this;
    }

    /**
     * Sets the synchronizer that replaces all others if a synchronizer reports that the older protocol
     * must be used.
     *
     * @param fdv1FallbackSynchronizer the synchronizer factory, or null for none
     * @return the builder
     */
    public Builder fdv1FallbackSynchronizer(ComponentFactory<Synchronizer> fdv1FallbackSynchronizer) {
      this.fdv1FallbackSynchronizer = fdv1FallbackSynchronizer;
      return this;
    }

    /**
     * Configures a persistent store.
     *
     * @param persistentStore the store implementation, or null for none
     * @param mode {@link DataStoreMode#READ_WRITE} to copy received data into the store, or
     *   {@link DataStoreMode#READ_ONLY} to only read from it; null defaults to READ_WRITE
     * @return the builder
     */
    public Builder persistentStore(PersistentDataStore persistentStore, DataStoreMode mode) {
      this.persistentStore = persistentStore;
      this.persistentStoreMode = mode == null ? DataStoreMode.READ_WRITE : mode;
      return this;
    }

    /**
     * Set whether the data system is offline. In offline mode no data sources are started.
     *
     * @param offline true if offline
     * @return the builder
     */
    public Builder offline(boolean offline) {
      this.offline = offline;
      return this;
    }

    /**
     * Specifies the implementation of logging to use.
     * <p>
     * If not set, SLF4J is used when it is on the classpath, and otherwise log output goes to
     * {@code System.err}.
     *
     * @param logAdapter an {@link LDLogAdapter}, or null for the default
     * @return the builder
     */
    public Builder logAdapter(LDLogAdapter logAdapter) {
      this.logAdapter = logAdapter;
      return this;
    }

    /**
     * Specifies the lowest level of logging to enable. This has no effect on adapters such as SLF4J
     * that are configured externally.
     *
     * @param minimumLevel the minimum level, or null for the default of INFO
     * @return the builder
     */
    public Builder level(LDLogLevel minimumLevel) {
      this.minimumLevel = minimumLevel;
      return this;
    }

    /**
     * Specifies a custom base logger name. Subsystem loggers are named by appending a suffix to it,
     * such as ".DataSource".
     *
     * @param name the base logger name, or null for the default of "io.flagstore"
     * @return the builder
     */
    public Builder baseLoggerName(String name) {
      this.baseLoggerName = name;
      return this;
    }

    /**
     * Sets how long a synchronizer may fail to initialize before the next one is tried.
     *
     * @param timeout the timeout, or null for the default
     * @return the builder
     */
    public Builder initializingFallbackTimeout(Duration timeout) {
      this.initializingFallbackTimeout = timeout == null ? DEFAULT_INITIALIZING_FALLBACK_TIMEOUT : timeout;
      return this;
    }

    /**
     * Sets how long a synchronizer may stay interrupted before the next one is tried.
     *
     * @param timeout the timeout, or null for the default
     * @return the builder
     */
    public Builder interruptedFallbackTimeout(Duration timeout) {
      this.interruptedFallbackTimeout = timeout == null ? DEFAULT_INTERRUPTED_FALLBACK_TIMEOUT : timeout;
      return this;
    }

    /**
     * Sets how long a fallback synchronizer must stay valid before the primary one is tried again.
     *
     * @param timeout the timeout, or null for the default
     * @return the builder
     */
    public Builder recoveryTimeout(Duration timeout) {
      this.recoveryTimeout = timeout == null ? DEFAULT_RECOVERY_TIMEOUT : timeout;
      return this;
    }

    /**
     * Sets how often the fallback and recovery conditions are checked.
     *
     * @param interval the interval, or null for the default
     * @return the builder
     */
    public Builder conditionCheckInterval(Duration interval) {
      this.conditionCheckInterval = interval == null ? DEFAULT_CONDITION_CHECK_INTERVAL : interval;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration
     */
    public DataSystemConfig build() {
      return new DataSystemConfig(this);
    }
  }
}
