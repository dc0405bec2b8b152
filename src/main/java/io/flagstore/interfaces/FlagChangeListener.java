package io.flagstore.interfaces;

/**
 * Receives {@link FlagChangeEvent}s. Calls are made on the data system's event thread, one per affected
 * flag for each update that is applied.
 *
 * @see FlagTracker#addFlagChangeListener(FlagChangeListener)
 */
public interface FlagChangeListener {
  void onFlagChange(FlagChangeEvent event);
}
