package io.flagstore.interfaces;

/**
 * Receives {@link FlagValueChangeEvent}s for the flag and context it was registered with.
 *
 * @see FlagTracker#addFlagValueChangeListener(String, com.launchdarkly.sdk.LDContext, FlagValueChangeListener)
 */
public interface FlagValueChangeListener {
  void onFlagValueChange(FlagValueChangeEvent event);
}
