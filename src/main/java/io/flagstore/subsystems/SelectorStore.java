package io.flagstore.subsystems;

import io.flagstore.subsystems.DataSystemTypes.Selector;

/**
 * Gives an update source access to the selector of the data currently held, so that it can resume
 * synchronization from that point.
 */
public interface SelectorStore {
  /**
   * Returns the selector of the most recently applied change set.
   *
   * @return the selector; {@link Selector#NO_SELECTOR} if no data has been applied
   */
  Selector getSelector();
}
