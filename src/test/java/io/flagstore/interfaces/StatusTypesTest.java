package io.flagstore.interfaces;

import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.testhelpers.TypeBehavior;
import io.flagstore.interfaces.DataSourceStatusProvider.ErrorInfo;
import io.flagstore.interfaces.DataSourceStatusProvider.ErrorKind;
import io.flagstore.interfaces.DataSourceStatusProvider.State;

import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

@SuppressWarnings("javadoc")
public class StatusTypesTest {
  @Test
  public void dataStoreStatusEquality() {
    List<TypeBehavior.ValueFactory<DataStoreStatusProvider.Status>> allPermutations = new ArrayList<>();
    for (boolean available: new boolean[] { false, true }) {
      for (boolean stale: new boolean[] { false, true }) {
        allPermutations.add(() -> new DataStoreStatusProvider.Status(available, stale));
      }
    }
    TypeBehavior.checkEqualsAndHashCode(allPermutations);
  }

  @Test
  public void dataStoreStatusStringRepresentation() {
    assertThat(new DataStoreStatusProvider.Status(false, true).toString(), equalTo("Status(false,true)"));
  }

  @Test
  public void dataSourceStatusEquality() {
    List<TypeBehavior.ValueFactory<DataSourceStatusProvider.Status>> allPermutations = new ArrayList<>();
    Instant[] times = new Instant[] { Instant.ofEpochMilli(1000), Instant.ofEpochMilli(2000) };
    ErrorInfo[] errors = new ErrorInfo[] {
        null,
        new ErrorInfo(ErrorKind.NETWORK_ERROR, 0, null, Instant.ofEpochMilli(5)),
        new ErrorInfo(ErrorKind.STORE_ERROR, 0, "down", Instant.ofEpochMilli(5))
    };
    for (State state: State.values()) {
      for (Instant time: times) {
        for (ErrorInfo e: errors) {
          allPermutations.add(() -> new DataSourceStatusProvider.Status(state, time, e));
        }
      }
    }
    TypeBehavior.checkEqualsAndHashCode(allPermutations);
  }

  @Test
  public void errorInfoFromException() {
    Exception ex = new IllegalStateException("bad data");
    ErrorInfo e = ErrorInfo.fromException(ErrorKind.INVALID_DATA, ex);
    assertThat(e.getKind(), equalTo(ErrorKind.INVALID_DATA));
    assertThat(e.getStatusCode(), equalTo(0));
    assertThat(e.getMessage(), equalTo(ex.toString()));
    assertThat(e.getTime(), not(nullValue()));
  }

  @Test
  public void errorInfoFromHttpError() {
    ErrorInfo e = ErrorInfo.fromHttpError(503);
    assertThat(e.getKind(), equalTo(ErrorKind.ERROR_RESPONSE));
    assertThat(e.getStatusCode(), equalTo(503));
    assertThat(e.getMessage(), nullValue());
  }

  @Test
  public void errorInfoEquality() {
    List<TypeBehavior.ValueFactory<ErrorInfo>> allPermutations = new ArrayList<>();
    for (ErrorKind kind: ErrorKind.values()) {
      for (int statusCode: new int[] { 0, 500 }) {
        for (String message: new String[] { null, "a" }) {
          allPermutations.add(() -> new ErrorInfo(kind, statusCode, message, Instant.ofEpochMilli(100)));
        }
      }
    }
    TypeBehavior.checkEqualsAndHashCode(allPermutations);
  }

  @Test
  public void flagValueChangeEventNormalizesNulls() {
    FlagValueChangeEvent event = new FlagValueChangeEvent("flag", null, LDValue.of(true));
    assertThat(event.getKey(), equalTo("flag"));
    assertThat(event.getOldValue(), equalTo(LDValue.ofNull()));
    assertThat(event.getNewValue(), equalTo(LDValue.of(true)));
  }
}
