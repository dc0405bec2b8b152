package io.flagstore.interfaces;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reports the health of whichever initializer or synchronizer is currently feeding the data system.
 * <p>
 * Implemented by the data system; applications only consume it.
 */
public interface DataSourceStatusProvider {
  /**
   * @return the current status, never null
   */
  Status getStatus();

  /**
   * Adds a listener that is called on the event thread whenever the state, its timestamp or the last
   * error changes.
   *
   * @param listener the listener
   */
  void addStatusListener(StatusListener listener);

  /**
   * Removes a listener. Unknown listeners are ignored.
   *
   * @param listener the listener
   */
  void removeStatusListener(StatusListener listener);

  /**
   * Blocks until the state is {@code desiredState}.
   * <p>
   * Returns early with false when the state becomes {@link State#OFF}, since nothing leaves that state,
   * or when the timeout runs out.
   *
   * @param desiredState the state to wait for, usually {@link State#VALID}
   * @param timeout how long to wait; zero or negative waits forever
   * @return true if the desired state was reached
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean waitFor(State desiredState, Duration timeout) throws InterruptedException;

  enum State {
    /**
     * Nothing has delivered data yet. Errors that will be retried leave the state here.
     */
    INITIALIZING,

    /**
     * The current source is delivering data without problems.
     */
    VALID,

    /**
     * The current source had an error it expects to recover from. Data may be stale in the meantime, and
     * updates that do arrive are still applied.
     */
    INTERRUPTED,

    /**
     * Permanent: every source has failed for good, or the data system was stopped.
     */
    OFF
  }

  /**
   * @see ErrorInfo#getKind()
   */
  enum ErrorKind {
    /** Anything without a better category, such as an unexpected exception. */
    UNKNOWN,

    /** A connection failed or was dropped. */
    NETWORK_ERROR,

    /** The service answered with an HTTP error; see {@link ErrorInfo#getStatusCode()}. */
    ERROR_RESPONSE,

    /** The source received data it could not decode. */
    INVALID_DATA,

    /** Data was received but writing it to the store failed. */
    STORE_ERROR
  }

  /**
   * The details of one error reported by a source.
   */
  final class ErrorInfo {
    private final ErrorKind kind;
    private final int statusCode;
    private final String message;
    private final Instant time;

    /**
     * @param kind the category
     * @param statusCode the HTTP status, or zero
     * @param message a description, or null
     * @param time when the error happened
     */
    public ErrorInfo(ErrorKind kind, int statusCode, String message, Instant time) {
      this.kind = kind;
      this.statusCode = statusCode;
      this.message = message;
      this.time = time;
    }

    /**
     * @param kind the category
     * @param t the exception; its {@code toString()} becomes the message
     * @return an error timestamped now
     */
    public static ErrorInfo fromException(ErrorKind kind, Throwable t) {
      return new ErrorInfo(kind, 0, t.toString(), Instant.now());
    }

    /**
     * @param statusCode the HTTP status
     * @return an {@link ErrorKind#ERROR_RESPONSE} error timestamped now
     */
    public static ErrorInfo fromHttpError(int statusCode) {
      return new ErrorInfo(ErrorKind.ERROR_RESPONSE, statusCode, null, Instant.now());
    }

    public ErrorKind getKind() {
      return kind;
    }

    /**
     * @return the HTTP status for {@link ErrorKind#ERROR_RESPONSE}, otherwise zero
     */
    public int getStatusCode() {
      return statusCode;
    }

    public String getMessage() {
      return message;
    }

    public Instant getTime() {
      return time;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ErrorInfo)) {
        return false;
      }
      ErrorInfo o = (ErrorInfo)other;
      return kind == o.kind && statusCode == o.statusCode && Objects.equals(message, o.message) &&
          Objects.equals(time, o.time);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, statusCode, message, time);
    }

    // KIND(status,message)@time, leaving out whatever is unset
    @Override
    public String toString() {
      List<String> details = new ArrayList<>();
      if (statusCode > 0) {
        details.add(String.valueOf(statusCode));
      }
      if (!Strings.isNullOrEmpty(message)) {
        details.add(message);
      }
      String s = details.isEmpty() ? kind.toString() : kind + "(" + Joiner.on(',').join(details) + ")";
      return time == null ? s : s + "@" + time;
    }
  }

  /**
   * A snapshot of the source state.
   */
  final class Status {
    private final State state;
    private final Instant stateSince;
    private final ErrorInfo lastError;

    /**
     * @param state the state
     * @param stateSince when the state last changed
     * @param lastError the most recent error, or null if there has been none
     */
    public Status(State state, Instant stateSince, ErrorInfo lastError) {
      this.state = state;
      this.stateSince = stateSince;
      this.lastError = lastError;
    }

    public State getState() {
      return state;
    }

    public Instant getStateSince() {
      return stateSince;
    }

    /**
     * The most recent error. It is kept after the state goes back to {@link State#VALID}.
     *
     * @return the error, or null if there has been none
     */
    public ErrorInfo getLastError() {
      return lastError;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Status)) {
        return false;
      }
      Status o = (Status)other;
      return state == o.state && Objects.equals(stateSince, o.stateSince) && Objects.equals(lastError, o.lastError);
    }

    @Override
    public int hashCode() {
      return Objects.hash(state, stateSince, lastError);
    }

    @Override
    public String toString() {
      return "Status(" + state + "," + stateSince + "," + lastError + ")";
    }
  }

  interface StatusListener {
    void dataSourceStatusChanged(Status newStatus);
  }
}
