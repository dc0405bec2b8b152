package io.flagstore;

import io.flagstore.DataModel.FeatureFlag;
import io.flagstore.interfaces.DataSourceStatusProvider;
import io.flagstore.interfaces.DataSourceStatusProvider.ErrorInfo;
import io.flagstore.interfaces.DataSourceStatusProvider.ErrorKind;
import io.flagstore.interfaces.DataSourceStatusProvider.State;
import io.flagstore.interfaces.DataStoreStatusProvider;
import io.flagstore.interfaces.FlagChangeEvent;
import io.flagstore.subsystems.DataStoreTypes.ItemDescriptor;
import io.flagstore.subsystems.DataSystemTypes.Basis;
import io.flagstore.subsystems.DataSystemTypes.BasisResult;
import io.flagstore.subsystems.DataSystemTypes.ChangeSet;
import io.flagstore.subsystems.DataSystemTypes.DataAvailability;
import io.flagstore.subsystems.DataSystemTypes.DataStoreMode;
import io.flagstore.subsystems.DataSystemTypes.Selector;
import io.flagstore.subsystems.DataSystemTypes.Update;
import io.flagstore.subsystems.Initializer;
import io.flagstore.subsystems.SelectorStore;
import io.flagstore.subsystems.Synchronizer;

import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static com.launchdarkly.testhelpers.ConcurrentHelpers.assertNoMoreValues;
import static com.launchdarkly.testhelpers.ConcurrentHelpers.awaitValue;
import static io.flagstore.ModelBuilders.flagBuilder;
import static io.flagstore.TestComponents.fullChangeSet;
import static io.flagstore.TestComponents.partialChangeSet;
import static io.flagstore.subsystems.DataStoreTypes.DataKind.FEATURES;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

@SuppressWarnings("javadoc")
public class DataSystemTest extends BaseTest {
  private static final Duration SHORT_TIMEOUT = Duration.ofMillis(50);
  private static final Duration CHECK_INTERVAL = Duration.ofMillis(10);

  private final FeatureFlag flag1 = flagBuilder("flag1").version(1).build();
  private final FeatureFlag flag2 = flagBuilder("flag2").version(1).build();

  private DataSystem dataSystem;

  @After
  public void tearDown() {
    if (dataSystem != null) {
      dataSystem.stop();
    }
  }

  private DataSystem create(DataSystemConfig.Builder config) {
    dataSystem = new DataSystem(config.build());
    return dataSystem;
  }

  private static void awaitReady(Future<Void> ready) throws Exception {
    ready.get(2, TimeUnit.SECONDS);
  }

  @Test
  public void offlineModeIsReadyImmediatelyAndStartsNothing() throws Exception {
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().offline(true).synchronizers(syncs));

    Future<Void> ready = dataSystem.start();

    assertThat(ready.isDone(), is(true));
    assertNoMoreValues(syncs.built, 100, TimeUnit.MILLISECONDS);
  }

  @Test
  public void noDataSourcesIsReadyWithCachedAvailability() throws Exception {
    create(baseConfig());

    awaitReady(dataSystem.start());

    assertThat(dataSystem.getDataAvailability(), is(DataAvailability.CACHED));
    assertThat(dataSystem.getTargetAvailability(), is(DataAvailability.CACHED));
  }

  @Test
  public void availabilityIsDefaultsBeforeAnyData() {
    create(baseConfig().synchronizers(new SynchronizerFactory("sync")));

    assertThat(dataSystem.getDataAvailability(), is(DataAvailability.DEFAULTS));
    assertThat(dataSystem.getTargetAvailability(), is(DataAvailability.REFRESHED));
  }

  @Test
  public void initializerWithSelectorMakesDataSystemReady() throws Exception {
    ChangeSet cs = fullChangeSet().flag(flag1).build(Selector.of("state1", 1));
    MockInitializer init = new MockInitializer("init", () -> BasisResult.success(new Basis(cs, true, null)));
    MockInitializer neverCalled = new MockInitializer("never", () -> BasisResult.failure("unused", null));
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().initializers(() -> init, () -> neverCalled).synchronizers(syncs));

    awaitReady(dataSystem.start());

    assertThat(dataSystem.getStore().get(FEATURES, "flag1"), notNullValue());
    assertThat(dataSystem.getDataAvailability(), is(DataAvailability.REFRESHED));
    assertThat(neverCalled.calls.get(), equalTo(0));

    // the synchronizer starts from the selector the initializer provided
    MockSynchronizer sync = awaitValue(syncs.built, 1, TimeUnit.SECONDS);
    assertThat(awaitValue(sync.seenSelectors, 1, TimeUnit.SECONDS), equalTo(Selector.of("state1", 1)));
  }

  @Test
  public void initializersContinueUntilDataHasSelector() throws Exception {
    ChangeSet noSelector = fullChangeSet().flag(flag1).build();
    ChangeSet withSelector = fullChangeSet().flag(flag2).build(Selector.of("s", 2));
    MockInitializer failing = new MockInitializer("failing", () -> BasisResult.failure("oops", new RuntimeException("oops")));
    MockInitializer throwing = new MockInitializer("throwing", () -> {
      throw new RuntimeException("boom");
    });
    MockInitializer cached = new MockInitializer("cached", () -> BasisResult.success(new Basis(noSelector, false, null)));
    MockInitializer current = new MockInitializer("current", () -> BasisResult.success(new Basis(withSelector, true, null)));
    create(baseConfig().initializers(() -> failing, () -> throwing, () -> cached, () -> current));

    awaitReady(dataSystem.start());

    assertThat(failing.calls.get(), equalTo(1));
    assertThat(throwing.calls.get(), equalTo(1));
    assertThat(cached.calls.get(), equalTo(1));
    assertThat(current.calls.get(), equalTo(1));
    assertThat(dataSystem.getStore().get(FEATURES, "flag1"), nullValue());
    assertThat(dataSystem.getStore().get(FEATURES, "flag2"), notNullValue());
    assertThat(logCapture.getMessageStrings(), hasItem("WARN:Initializer failing failed: oops"));
  }

  @Test
  public void initializerDataWithoutSelectorIsCached() throws Exception {
    ChangeSet noSelector = fullChangeSet().flag(flag1).build();
    MockInitializer cached = new MockInitializer("cached", () -> BasisResult.success(new Basis(noSelector, false, null)));
    create(baseConfig().initializers(() -> cached));

    awaitReady(dataSystem.start());

    assertThat(dataSystem.getStore().get(FEATURES, "flag1"), notNullValue());
    assertThat(dataSystem.getDataAvailability(), is(DataAvailability.CACHED));
  }

  @Test
  public void validSynchronizerUpdateMakesDataSystemReady() throws Exception {
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().synchronizers(syncs));
    Future<Void> ready = dataSystem.start();
    MockSynchronizer sync = awaitValue(syncs.built, 1, TimeUnit.SECONDS);
    assertThat(awaitValue(sync.seenSelectors, 1, TimeUnit.SECONDS), sameInstance(Selector.NO_SELECTOR));
    assertThat(ready.isDone(), is(false));

    sync.send(Update.valid(fullChangeSet().flag(flag1).build(Selector.of("s", 1))));

    awaitReady(ready);
    assertThat(dataSystem.getDataSourceStatusProvider().waitFor(State.VALID, Duration.ofSeconds(1)), is(true));
    assertThat(dataSystem.getStore().get(FEATURES, "flag1"), notNullValue());
    assertThat(dataSystem.getDataAvailability(), is(DataAvailability.REFRESHED));
  }

  @Test
  public void synchronizerUpdatesAreApplied() throws Exception {
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().synchronizers(syncs));
    BlockingQueue<ChangeSet> changeSets = new LinkedBlockingQueue<>();
    dataSystem.addChangeSetListener(changeSets::add);
    BlockingQueue<FlagChangeEvent> flagEvents = new LinkedBlockingQueue<>();
    dataSystem.getFlagTracker((key, context) -> null).addFlagChangeListener(flagEvents::add);
    dataSystem.start();
    MockSynchronizer sync = awaitValue(syncs.built, 1, TimeUnit.SECONDS);

    sync.send(Update.valid(fullChangeSet().flag(flag1).build(Selector.of("s", 1))));
    awaitValue(changeSets, 1, TimeUnit.SECONDS);
    assertThat(awaitValue(flagEvents, 1, TimeUnit.SECONDS).getKey(), equalTo("flag1"));

    ChangeSet delta = partialChangeSet().flag(flag2).build(Selector.of("s", 2));
    sync.send(Update.valid(delta));

    assertThat(awaitValue(changeSets, 1, TimeUnit.SECONDS), sameInstance(delta));
    assertThat(awaitValue(flagEvents, 1, TimeUnit.SECONDS).getKey(), equalTo("flag2"));
    assertThat(dataSystem.getStore().get(FEATURES, "flag1"), notNullValue());
    assertThat(dataSystem.getStore().get(FEATURES, "flag2"), notNullValue());
    assertThat(dataSystem.getInternalStore().getSelector(), equalTo(Selector.of("s", 2)));
  }

  @Test
  public void synchronizerThatReportsOffIsReplacedByNextOne() throws Exception {
    SynchronizerFactory primary = new SynchronizerFactory("primary");
    SynchronizerFactory secondary = new SynchronizerFactory("secondary");
    create(baseConfig().synchronizers(primary, secondary).conditionCheckInterval(CHECK_INTERVAL));
    dataSystem.start();

    BlockingQueue<DataSourceStatusProvider.Status> statuses = new LinkedBlockingQueue<>();
    dataSystem.getDataSourceStatusProvider().addStatusListener(statuses::add);

    MockSynchronizer sync1 = awaitValue(primary.built, 1, TimeUnit.SECONDS);
    sync1.send(Update.off(ErrorInfo.fromHttpError(401)));
    assertThat(awaitValue(statuses, 1, TimeUnit.SECONDS).getState(), is(State.OFF));

    MockSynchronizer sync2 = awaitValue(secondary.built, 1, TimeUnit.SECONDS);
    assertThat(sync1.closed, is(true));
    sync2.send(Update.valid(fullChangeSet().flag(flag1).build(Selector.of("s", 1))));

    assertThat(awaitValue(statuses, 1, TimeUnit.SECONDS).getState(), is(State.VALID));
    assertThat(dataSystem.getStore().get(FEATURES, "flag1"), notNullValue());
  }

  @Test
  public void dataSystemIsOffWhenAllSynchronizersAreRemoved() throws Exception {
    SynchronizerFactory primary = new SynchronizerFactory("primary");
    SynchronizerFactory secondary = new SynchronizerFactory("secondary");
    create(baseConfig().synchronizers(primary, secondary));
    Future<Void> ready = dataSystem.start();

    awaitValue(primary.built, 1, TimeUnit.SECONDS).send(Update.off(ErrorInfo.fromHttpError(401)));
    awaitValue(secondary.built, 1, TimeUnit.SECONDS).send(Update.off(ErrorInfo.fromHttpError(403)));

    awaitReady(ready);
    DataSourceStatusProvider statusProvider = dataSystem.getDataSourceStatusProvider();
    assertThat(statusProvider.waitFor(State.OFF, Duration.ofSeconds(1)), is(true));
    assertThat(statusProvider.getStatus().getLastError().getStatusCode(), equalTo(403));
    assertThat(logCapture.getMessageStrings(), hasItem("WARN:No more synchronizers available"));
    assertNoMoreValues(primary.built, 100, TimeUnit.MILLISECONDS);
  }

  @Test
  public void synchronizerExceptionRemovesSynchronizer() throws Exception {
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().synchronizers(syncs));
    Future<Void> ready = dataSystem.start();

    awaitValue(syncs.built, 1, TimeUnit.SECONDS).fail(new RuntimeException("sync failure"));

    awaitReady(ready);
    DataSourceStatusProvider statusProvider = dataSystem.getDataSourceStatusProvider();
    assertThat(statusProvider.waitFor(State.OFF, Duration.ofSeconds(1)), is(true));
    assertThat(statusProvider.getStatus().getLastError().getKind(), is(ErrorKind.UNKNOWN));
    assertNoMoreValues(syncs.built, 100, TimeUnit.MILLISECONDS);
  }

  @Test
  public void interruptedSynchronizerFallsBackAndPrimaryIsRecovered() throws Exception {
    SynchronizerFactory primary = new SynchronizerFactory("primary");
    SynchronizerFactory secondary = new SynchronizerFactory("secondary");
    create(baseConfig().synchronizers(primary, secondary)
        .interruptedFallbackTimeout(Duration.ofMillis(200))
        .recoveryTimeout(SHORT_TIMEOUT)
        .conditionCheckInterval(CHECK_INTERVAL));
    dataSystem.start();

    MockSynchronizer sync1 = awaitValue(primary.built, 1, TimeUnit.SECONDS);
    sync1.send(Update.valid(fullChangeSet().flag(flag1).build(Selector.of("s", 1))));
    sync1.send(Update.interrupted(ErrorInfo.fromHttpError(503)));

    MockSynchronizer sync2 = awaitValue(secondary.built, 1, TimeUnit.SECONDS);
    assertThat(sync1.closed, is(true));
    assertThat(awaitValue(sync2.seenSelectors, 1, TimeUnit.SECONDS), equalTo(Selector.of("s", 1)));
    sync2.send(Update.valid(partialChangeSet().flag(flag2).build(Selector.of("s", 2))));

    // once the fallback has been valid for long enough, the primary is tried again
    MockSynchronizer sync1Again = awaitValue(primary.built, 2, TimeUnit.SECONDS);
    assertThat(sync2.closed, is(true));
    assertThat(awaitValue(sync1Again.seenSelectors, 1, TimeUnit.SECONDS), equalTo(Selector.of("s", 2)));
  }

  @Test
  public void synchronizerStuckInitializingFallsBack() throws Exception {
    SynchronizerFactory primary = new SynchronizerFactory("primary");
    SynchronizerFactory secondary = new SynchronizerFactory("secondary");
    create(baseConfig().synchronizers(primary, secondary)
        .initializingFallbackTimeout(SHORT_TIMEOUT)
        .conditionCheckInterval(CHECK_INTERVAL));
    dataSystem.start();

    MockSynchronizer sync1 = awaitValue(primary.built, 1, TimeUnit.SECONDS);
    awaitValue(secondary.built, 2, TimeUnit.SECONDS);

    assertThat(sync1.closed, is(true));
  }

  @Test
  public void revertToFdv1ReplacesAllSynchronizers() throws Exception {
    SynchronizerFactory primary = new SynchronizerFactory("primary");
    SynchronizerFactory secondary = new SynchronizerFactory("secondary");
    SynchronizerFactory fdv1 = new SynchronizerFactory("fdv1");
    create(baseConfig().synchronizers(primary, secondary).fdv1FallbackSynchronizer(fdv1));
    Future<Void> ready = dataSystem.start();

    awaitValue(primary.built, 1, TimeUnit.SECONDS).send(new Update(State.INTERRUPTED, null,
        ErrorInfo.fromHttpError(500), true, null));

    MockSynchronizer fallback = awaitValue(fdv1.built, 1, TimeUnit.SECONDS);
    fallback.send(Update.valid(fullChangeSet().flag(flag1).build()));
    awaitReady(ready);

    assertThat(dataSystem.getStore().get(FEATURES, "flag1"), notNullValue());
    assertNoMoreValues(secondary.built, 100, TimeUnit.MILLISECONDS);
  }

  @Test
  public void revertToFdv1WithoutFallbackSynchronizerMovesToNextOne() throws Exception {
    SynchronizerFactory primary = new SynchronizerFactory("primary");
    SynchronizerFactory secondary = new SynchronizerFactory("secondary");
    create(baseConfig().synchronizers(primary, secondary));
    dataSystem.start();

    awaitValue(primary.built, 1, TimeUnit.SECONDS).send(new Update(State.INTERRUPTED, null,
        ErrorInfo.fromHttpError(500), true, null));

    assertThat(awaitValue(secondary.built, 1, TimeUnit.SECONDS), notNullValue());
  }

  @Test
  public void persistentStoreProvidesDataBeforeSynchronizer() throws Exception {
    MockPersistentDataStore core = new MockPersistentDataStore();
    core.forceSet(FEATURES, "cached", DataStoreTestTypes.toSerialized("cached",
        new ItemDescriptor(3, flagBuilder("cached").version(3).build())));
    core.inited.set(true);
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().persistentStore(core, DataStoreMode.READ_ONLY).synchronizers(syncs));

    assertThat(dataSystem.getStore().get(FEATURES, "cached").getVersion(), equalTo(3));
    assertThat(dataSystem.getDataAvailability(), is(DataAvailability.CACHED));
    assertThat(dataSystem.getDataStoreStatusProvider().isStatusMonitoringEnabled(), is(true));

    dataSystem.start();
    awaitValue(syncs.built, 1, TimeUnit.SECONDS).send(Update.valid(fullChangeSet().flag(flag1).build(Selector.of("s", 1))));
    assertThat(dataSystem.getDataSourceStatusProvider().waitFor(State.VALID, Duration.ofSeconds(1)), is(true));

    assertThat(dataSystem.getStore().get(FEATURES, "flag1"), notNullValue());
    assertThat(dataSystem.getStore().get(FEATURES, "cached"), nullValue());
    assertThat(core.initedCount.get(), equalTo(0));
  }

  @Test
  public void synchronizerDataIsWrittenToWritablePersistentStore() throws Exception {
    MockPersistentDataStore core = new MockPersistentDataStore();
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().persistentStore(core, DataStoreMode.READ_WRITE).synchronizers(syncs));
    BlockingQueue<ChangeSet> changeSets = new LinkedBlockingQueue<>();
    dataSystem.addChangeSetListener(changeSets::add);
    dataSystem.start();
    MockSynchronizer sync = awaitValue(syncs.built, 1, TimeUnit.SECONDS);

    sync.send(Update.valid(fullChangeSet().flag(flag1).build(Selector.of("s", 1))));
    sync.send(Update.valid(partialChangeSet().flag(flag2).build(Selector.of("s", 2))));
    sync.send(Update.valid(partialChangeSet().deleteFlag("flag1", 2).build(Selector.of("s", 3))));
    for (int i = 0; i < 3; i++) {
      awaitValue(changeSets, 1, TimeUnit.SECONDS);
    }

    assertThat(core.initedCount.get(), equalTo(1));
    assertThat(core.data.get(FEATURES).get("flag2").getVersion(), equalTo(1));
    assertThat(core.data.get(FEATURES).get("flag1").isDeleted(), is(true));
  }

  @Test
  public void persistentStoreIsRewrittenAfterOutage() throws Exception {
    MockPersistentDataStore core = new MockPersistentDataStore();
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().persistentStore(core, DataStoreMode.READ_WRITE).synchronizers(syncs));
    BlockingQueue<DataStoreStatusProvider.Status> storeStatuses = new LinkedBlockingQueue<>();
    dataSystem.getDataStoreStatusProvider().addStatusListener(storeStatuses::add);
    dataSystem.start();
    MockSynchronizer sync = awaitValue(syncs.built, 1, TimeUnit.SECONDS);
    sync.send(Update.valid(fullChangeSet().flag(flag1).build(Selector.of("s", 1))));
    assertThat(dataSystem.getDataSourceStatusProvider().waitFor(State.VALID, Duration.ofSeconds(1)), is(true));

    core.failNext(1, new RuntimeException("store is down"));
    sync.send(Update.valid(partialChangeSet().flag(flag2).build(Selector.of("s", 2))));

    assertThat(awaitValue(storeStatuses, 1, TimeUnit.SECONDS), equalTo(new DataStoreStatusProvider.Status(false, true)));
    assertThat(awaitValue(storeStatuses, 2, TimeUnit.SECONDS), equalTo(new DataStoreStatusProvider.Status(true, true)));

    // the recovery listener runs before ours on the same thread, so the store has been rewritten by now
    assertThat(core.initedCount.get(), equalTo(2));
    assertThat(core.data.get(FEATURES).keySet(), hasItem("flag2"));
    assertThat(core.data.get(FEATURES).keySet(), hasItem("flag1"));
  }

  @Test
  public void stopClosesSynchronizerAndPersistentStore() throws Exception {
    MockPersistentDataStore core = new MockPersistentDataStore();
    SynchronizerFactory syncs = new SynchronizerFactory("sync");
    create(baseConfig().persistentStore(core, DataStoreMode.READ_WRITE).synchronizers(syncs));
    dataSystem.start();
    MockSynchronizer sync = awaitValue(syncs.built, 1, TimeUnit.SECONDS);

    dataSystem.close();

    assertThat(sync.closed, is(true));
    assertThat(core.closed, is(true));
  }

  static final class MockInitializer implements Initializer {
    final String name;
    final Supplier<BasisResult> result;
    final AtomicInteger calls = new AtomicInteger();

    MockInitializer(String name, Supplier<BasisResult> result) {
      this.name = name;
      this.result = result;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public BasisResult fetch(SelectorStore selectorStore) {
      calls.incrementAndGet();
      return result.get();
    }
  }

  static final class SynchronizerFactory implements DataSystemConfig.ComponentFactory<Synchronizer> {
    final String name;
    final BlockingQueue<MockSynchronizer> built = new LinkedBlockingQueue<>();

    SynchronizerFactory(String name) {
      this.name = name;
    }

    @Override
    public Synchronizer build() {
      MockSynchronizer sync = new MockSynchronizer(name);
      built.add(sync);
      return sync;
    }
  }

  static final class MockSynchronizer implements Synchronizer {
    private static final Object STOP = new Object();

    final String name;
    final BlockingQueue<Selector> seenSelectors = new LinkedBlockingQueue<>();
    private final BlockingQueue<Object> pending = new LinkedBlockingQueue<>();
    volatile boolean closed;

    MockSynchronizer(String name) {
      this.name = name;
    }

    void send(Update update) {
      pending.add(update);
    }

    void fail(RuntimeException e) {
      pending.add(e);
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public void sync(SelectorStore selectorStore, Consumer<Update> updates) {
      seenSelectors.add(selectorStore.getSelector());
      while (true) {
        Object item;
        try {
          item = pending.take();
        } catch (InterruptedException e) {
          return;
        }
        if (item == STOP) {
          return;
        }
        if (item instanceof RuntimeException) {
          throw (RuntimeException)item;
        }
        Update update = (Update)item;
        updates.accept(update);
        if (update.getState() == State.OFF) {
          return;
        }
      }
    }

    @Override
    public void close() {
      closed = true;
      pending.add(STOP);
    }
  }
}
