package io.flagstore.subsystems;

import io.flagstore.subsystems.DataSystemTypes.BasisResult;

/**
 * A one-shot source of a full data set, used at startup before a {@link Synchronizer} takes over.
 * <p>
 * Initializers are tried in order until one of them produces data with a defined selector.
 */
public interface Initializer {
  /**
   * Returns a human-readable name for this initializer, used in log messages.
   *
   * @return the name
   */
  String getName();

  /**
   * Retrieves the initial data.
   * <p>
   * This method may block. It should not throw; failures are reported through
   * {@link BasisResult#failure(String, Exception)}.
   *
   * @param selectorStore provides the selector of any data already held
   * @return a basis or an error
   */
  BasisResult fetch(SelectorStore selectorStore);
}
