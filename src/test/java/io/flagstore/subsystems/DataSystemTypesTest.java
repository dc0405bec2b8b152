package io.flagstore.subsystems;

import com.launchdarkly.sdk.LDValue;
import io.flagstore.subsystems.DataSystemTypes.Basis;
import io.flagstore.subsystems.DataSystemTypes.BasisResult;
import io.flagstore.subsystems.DataSystemTypes.Change;
import io.flagstore.subsystems.DataSystemTypes.ChangeSet;
import io.flagstore.subsystems.DataSystemTypes.ChangeSetBuilder;
import io.flagstore.subsystems.DataSystemTypes.ChangeType;
import io.flagstore.subsystems.DataSystemTypes.IntentCode;
import io.flagstore.subsystems.DataSystemTypes.ObjectKind;
import io.flagstore.subsystems.DataSystemTypes.Selector;
import io.flagstore.subsystems.DataStoreTypes.DataKind;

import org.junit.Test;

import static com.launchdarkly.testhelpers.JsonAssertions.assertJsonEquals;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class DataSystemTypesTest {
  private static final LDValue flagJson = LDValue.parse("{\"key\":\"a\",\"version\":1}");

  @Test
  public void intentCodeWireNames() {
    assertThat(IntentCode.TRANSFER_FULL.getWireName(), equalTo("xfer-full"));
    assertThat(IntentCode.TRANSFER_CHANGES.getWireName(), equalTo("xfer-changes"));
    assertThat(IntentCode.TRANSFER_NONE.getWireName(), equalTo("none"));
    for (IntentCode code: IntentCode.values()) {
      assertThat(IntentCode.fromWireName(code.getWireName()), is(code));
    }
    assertThat(IntentCode.fromWireName("bogus"), nullValue());
  }

  @Test
  public void objectKindWireNamesAndDataKinds() {
    assertThat(ObjectKind.fromWireName("flag"), is(ObjectKind.FLAG));
    assertThat(ObjectKind.fromWireName("segment"), is(ObjectKind.SEGMENT));
    assertThat(ObjectKind.fromWireName("user"), nullValue());
    assertThat(ObjectKind.FLAG.getDataKind(), is(DataKind.FEATURES));
    assertThat(ObjectKind.SEGMENT.getDataKind(), is(DataKind.SEGMENTS));
  }

  @Test
  public void selectorEquality() {
    assertThat(Selector.of("p:1", 2), equalTo(Selector.of("p:1", 2)));
    assertThat(Selector.of("p:1", 2).hashCode(), equalTo(Selector.of("p:1", 2).hashCode()));
    assertThat(Selector.of("p:1", 2), not(equalTo(Selector.of("p:1", 3))));
    assertThat(Selector.of("p:1", 2), not(equalTo(Selector.of("p:2", 2))));
  }

  @Test
  public void selectorWithEmptyStateAndZeroVersionIsUndefined() {
    assertThat(Selector.NO_SELECTOR.isDefined(), is(false));
    assertThat(Selector.of("", 0).isDefined(), is(false));
    assertThat(Selector.of(null, 0).isDefined(), is(false));
    assertThat(Selector.of("", 1).isDefined(), is(true));
    assertThat(Selector.of("x", 0).isDefined(), is(true));
  }

  @Test
  public void selectorToJson() {
    assertJsonEquals("{\"state\":\"abc\",\"version\":7}", Selector.of("abc", 7).toJson().toJsonString());
  }

  @Test
  public void selectorFromJson() {
    assertThat(Selector.fromJson(LDValue.parse("{\"state\":\"abc\",\"version\":7}")), equalTo(Selector.of("abc", 7)));
  }

  @Test
  public void selectorFromJsonRequiresBothFields() {
    for (String json: new String[] { "{\"state\":\"abc\"}", "{\"version\":1}", "{\"state\":1,\"version\":1}",
        "{\"state\":\"abc\",\"version\":\"1\"}" }) {
      try {
        Selector.fromJson(LDValue.parse(json));
        fail("expected exception for " + json);
      } catch (IllegalArgumentException e) {}
    }
  }

  @Test
  public void changeSetWithNullSelectorUsesNoSelector() {
    ChangeSet cs = new ChangeSet(IntentCode.TRANSFER_CHANGES, null, null);
    assertThat(cs.getSelector(), sameInstance(Selector.NO_SELECTOR));
    assertThat(cs.getChanges(), empty());
  }

  @Test
  public void builderFinishRequiresIntent() {
    ChangeSetBuilder b = new ChangeSetBuilder();
    try {
      b.finish(Selector.NO_SELECTOR);
      fail("expected exception");
    } catch (IllegalStateException e) {}
  }

  @Test
  public void builderExpectChangesRequiresIntent() {
    ChangeSetBuilder b = new ChangeSetBuilder();
    try {
      b.expectChanges();
      fail("expected exception");
    } catch (IllegalStateException e) {}
  }

  @Test
  public void builderAccumulatesChangesInOrder() {
    ChangeSetBuilder b = new ChangeSetBuilder();
    b.start(IntentCode.TRANSFER_FULL);
    b.addPut(ObjectKind.FLAG, "a", 1, flagJson);
    b.addDelete(ObjectKind.SEGMENT, "s", 4);
    Selector selector = Selector.of("state", 2);

    ChangeSet cs = b.finish(selector);

    assertThat(cs.getIntentCode(), is(IntentCode.TRANSFER_FULL));
    assertThat(cs.getSelector(), equalTo(selector));
    assertThat(cs.getChanges(), contains(
        new Change(ChangeType.PUT, ObjectKind.FLAG, "a", 1, flagJson),
        new Change(ChangeType.DELETE, ObjectKind.SEGMENT, "s", 4, null)
        ));
  }

  @Test
  public void fullTransferBecomesChangesAfterFinish() {
    ChangeSetBuilder b = new ChangeSetBuilder();
    b.start(IntentCode.TRANSFER_FULL);
    b.addPut(ObjectKind.FLAG, "a", 1, flagJson);
    b.finish(Selector.of("s", 1));

    assertThat(b.getIntent(), is(IntentCode.TRANSFER_CHANGES));
    b.addPut(ObjectKind.FLAG, "b", 1, flagJson);
    ChangeSet second = b.finish(Selector.of("s", 2));

    assertThat(second.getIntentCode(), is(IntentCode.TRANSFER_CHANGES));
    assertThat(second.getChanges().size(), equalTo(1));
  }

  @Test
  public void expectChangesTurnsNoneIntoChanges() {
    ChangeSetBuilder b = new ChangeSetBuilder();
    b.start(IntentCode.TRANSFER_NONE);
    b.expectChanges();
    assertThat(b.getIntent(), is(IntentCode.TRANSFER_CHANGES));
  }

  @Test
  public void expectChangesLeavesFullIntentAlone() {
    ChangeSetBuilder b = new ChangeSetBuilder();
    b.start(IntentCode.TRANSFER_FULL);
    b.expectChanges();
    assertThat(b.getIntent(), is(IntentCode.TRANSFER_FULL));
  }

  @Test
  public void resetDiscardsPendingChanges() {
    ChangeSetBuilder b = new ChangeSetBuilder();
    b.start(IntentCode.TRANSFER_CHANGES);
    b.addPut(ObjectKind.FLAG, "a", 1, flagJson);
    b.reset();

    assertThat(b.finish(Selector.NO_SELECTOR).getChanges(), empty());
    assertThat(b.getIntent(), is(IntentCode.TRANSFER_CHANGES));
  }

  @Test
  public void noChangesAndEmpty() {
    ChangeSet none = ChangeSetBuilder.noChanges();
    assertThat(none.getIntentCode(), is(IntentCode.TRANSFER_NONE));
    assertThat(none.getSelector().isDefined(), is(false));
    assertThat(none.getChanges(), empty());

    Selector selector = Selector.of("x", 3);
    ChangeSet empty = ChangeSetBuilder.empty(selector);
    assertThat(empty.getIntentCode(), is(IntentCode.TRANSFER_FULL));
    assertThat(empty.getSelector(), equalTo(selector));
    assertThat(empty.getChanges(), empty());
  }

  @Test
  public void basisResult() {
    Basis basis = new Basis(ChangeSetBuilder.empty(Selector.of("x", 1)), true, "env");
    BasisResult ok = BasisResult.success(basis);
    assertThat(ok.isSuccess(), is(true));
    assertThat(ok.getBasis(), sameInstance(basis));
    assertThat(ok.getBasis().isPersist(), is(true));
    assertThat(ok.getBasis().getEnvironmentId(), equalTo("env"));

    Exception e = new RuntimeException("boom");
    BasisResult failed = BasisResult.failure("no data", e);
    assertThat(failed.isSuccess(), is(false));
    assertThat(failed.getBasis(), nullValue());
    assertThat(failed.getError(), equalTo("no data"));
    assertThat(failed.getException(), sameInstance(e));
  }
}
