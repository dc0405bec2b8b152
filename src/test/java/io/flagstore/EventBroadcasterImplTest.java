package io.flagstore;

import io.flagstore.interfaces.ChangeSetListener;
import io.flagstore.interfaces.FlagChangeEvent;
import io.flagstore.interfaces.FlagChangeListener;
import io.flagstore.subsystems.DataSystemTypes.ChangeSet;
import io.flagstore.subsystems.DataSystemTypes.ChangeSetBuilder;
import io.flagstore.subsystems.DataSystemTypes.Selector;

import org.junit.Test;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static com.launchdarkly.testhelpers.ConcurrentHelpers.assertNoMoreValues;
import static com.launchdarkly.testhelpers.ConcurrentHelpers.awaitValue;
import static io.flagstore.TestComponents.sharedExecutor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;

@SuppressWarnings("javadoc")
public class EventBroadcasterImplTest extends BaseTest {
  private final EventBroadcasterImpl<ChangeSetListener, ChangeSet> broadcaster =
      EventBroadcasterImpl.forChangeSets(sharedExecutor, testLogger);

  @Test
  public void sendingEventWithNoListenersDoesNotCauseError() {
    broadcaster.broadcast(ChangeSetBuilder.noChanges());
  }

  @Test
  public void sendingEventWithNoExecutorDoesNotCauseError() {
    EventBroadcasterImpl<FlagChangeListener, FlagChangeEvent> b = EventBroadcasterImpl.forFlagChangeEvents(null, testLogger);
    b.register(e -> {});
    b.broadcast(new FlagChangeEvent("flag"));
  }

  @Test
  public void hasListeners() {
    assertThat(broadcaster.hasListeners(), is(false));

    ChangeSetListener listener1 = cs -> {};
    ChangeSetListener listener2 = cs -> {};
    broadcaster.register(listener1);
    broadcaster.register(listener2);
    assertThat(broadcaster.hasListeners(), is(true));

    broadcaster.unregister(listener1);
    assertThat(broadcaster.hasListeners(), is(true));

    broadcaster.unregister(listener2);
    assertThat(broadcaster.hasListeners(), is(false));
  }

  @Test
  public void allListenersReceiveChangeSetsInOrder() throws Exception {
    BlockingQueue<ChangeSet> received1 = new LinkedBlockingQueue<>();
    BlockingQueue<ChangeSet> received2 = new LinkedBlockingQueue<>();
    broadcaster.register(received1::add);
    broadcaster.register(received2::add);

    ChangeSet cs1 = ChangeSetBuilder.empty(Selector.of("a", 1));
    ChangeSet cs2 = ChangeSetBuilder.empty(Selector.of("a", 2));
    broadcaster.broadcast(cs1);
    broadcaster.broadcast(cs2);

    assertThat(awaitValue(received1, 1, TimeUnit.SECONDS), sameInstance(cs1));
    assertThat(awaitValue(received1, 1, TimeUnit.SECONDS), sameInstance(cs2));
    assertThat(awaitValue(received2, 1, TimeUnit.SECONDS), sameInstance(cs1));
    assertThat(awaitValue(received2, 1, TimeUnit.SECONDS), sameInstance(cs2));
    assertNoMoreValues(received1, 50, TimeUnit.MILLISECONDS);
  }

  @Test
  public void unregisteredListenerMissesEvents() throws Exception {
    BlockingQueue<ChangeSet> received1 = new LinkedBlockingQueue<>();
    BlockingQueue<ChangeSet> received2 = new LinkedBlockingQueue<>();
    ChangeSetListener listener1 = received1::add;
    ChangeSetListener listener2 = received2::add;
    broadcaster.register(listener1);
    broadcaster.register(listener2);

    ChangeSet cs1 = ChangeSetBuilder.empty(Selector.of("a", 1));
    ChangeSet cs2 = ChangeSetBuilder.empty(Selector.of("a", 2));
    ChangeSet cs3 = ChangeSetBuilder.empty(Selector.of("a", 3));

    broadcaster.broadcast(cs1);
    broadcaster.unregister(listener2);
    broadcaster.broadcast(cs2);
    broadcaster.register(listener2);
    broadcaster.broadcast(cs3);

    assertThat(awaitValue(received1, 1, TimeUnit.SECONDS), sameInstance(cs1));
    assertThat(awaitValue(received1, 1, TimeUnit.SECONDS), sameInstance(cs2));
    assertThat(awaitValue(received1, 1, TimeUnit.SECONDS), sameInstance(cs3));
    assertThat(awaitValue(received2, 1, TimeUnit.SECONDS), sameInstance(cs1));
    assertThat(awaitValue(received2, 1, TimeUnit.SECONDS), sameInstance(cs3));
    assertNoMoreValues(received2, 50, TimeUnit.MILLISECONDS);
  }

  @Test
  public void exceptionFromListenerIsLoggedAndDoesNotStopLaterListeners() throws Exception {
    broadcaster.register(cs -> {
      throw new RuntimeException("sorry");
    });
    BlockingQueue<ChangeSet> received = new LinkedBlockingQueue<>();
    broadcaster.register(received::add);

    ChangeSet cs = ChangeSetBuilder.noChanges();
    broadcaster.broadcast(cs);

    assertThat(awaitValue(received, 1, TimeUnit.SECONDS), sameInstance(cs));
    assertThat(logCapture.getMessageStrings(), hasItem(startsWith("WARN:Unexpected error from listener")));
  }
}
