package io.flagstore.interfaces;

import com.launchdarkly.sdk.LDContext;

/**
 * Lets an application find out when flag data has changed.
 * <p>
 * There are two levels of notification. A {@link FlagChangeListener} hears about every flag whose
 * definition may be affected by an update. A {@link FlagValueChangeListener} is tied to one flag and
 * one context, and only hears about updates that change what that flag returns for that context.
 */
public interface FlagTracker {
  /**
   * Starts sending {@link FlagChangeEvent}s to the listener.
   * <p>
   * A flag is reported when it is updated, and also when any flag or segment it depends on is updated,
   * however indirectly.
   *
   * @param listener the listener
   */
  void addFlagChangeListener(FlagChangeListener listener);

  /**
   * Stops sending events to a listener. Unknown listeners are ignored.
   *
   * @param listener a listener previously passed to {@link #addFlagChangeListener(FlagChangeListener)}, or
   *   returned by {@link #addFlagValueChangeListener(String, LDContext, FlagValueChangeListener)}
   */
  void removeFlagChangeListener(FlagChangeListener listener);

  /**
   * Watches the value of one flag for one context.
   * <p>
   * The flag is evaluated right away to get a starting value. After that it is evaluated again each time
   * it may have changed, and the listener is called only when the result differs from the previous one.
   *
   * @param flagKey the flag to watch
   * @param context the context to evaluate it for
   * @param listener receives the value changes
   * @return the underlying flag change listener; pass it to {@link #removeFlagChangeListener(FlagChangeListener)}
   *   to stop watching
   */
  FlagChangeListener addFlagValueChangeListener(String flagKey, LDContext context, FlagValueChangeListener listener);
}
