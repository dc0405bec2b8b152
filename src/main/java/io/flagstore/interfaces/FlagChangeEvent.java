package io.flagstore.interfaces;

/**
 * Tells a {@link FlagChangeListener} that the stored definition of one flag may be different now.
 * <p>
 * The flag is reported when it was updated itself, and also when a prerequisite flag or a referenced
 * segment was updated, since either can change how the flag evaluates. Nothing is evaluated to produce
 * this event: the flag may well return the same value as before for every context.
 */
public class FlagChangeEvent {
  private final String key;

  /**
   * @param key the flag key
   */
  public FlagChangeEvent(String key) {
    this.key = key;
  }

  /**
   * @return the key of the flag that may have changed
   */
  public String getKey() {
    return key;
  }

  @Override
  public String toString() {
    return "FlagChangeEvent(" + key + ")";
  }
}
