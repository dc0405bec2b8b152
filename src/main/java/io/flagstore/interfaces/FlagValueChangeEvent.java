package io.flagstore.interfaces;

import com.launchdarkly.sdk.LDValue;

/**
 * Delivered to a {@link FlagValueChangeListener} when re-evaluating a flag for the watched context gave
 * a value different from the last one seen.
 * <p>
 * A null value passed to the constructor is stored as {@link LDValue#ofNull()}.
 */
public class FlagValueChangeEvent extends FlagChangeEvent {
  private final LDValue oldValue;
  private final LDValue newValue;

  public FlagValueChangeEvent(String key, LDValue oldValue, LDValue newValue) {
    super(key);
    this.oldValue = LDValue.normalize(oldValue);
    this.newValue = LDValue.normalize(newValue);
  }

  /**
   * @return the value before the change, never null
   */
  public LDValue getOldValue() {
    return oldValue;
  }

  /**
   * @return the value after the change, never null
   */
  public LDValue getNewValue() {
    return newValue;
  }

  @Override
  public String toString() {
    return "FlagValueChangeEvent(" + getKey() + ", " + oldValue + " -> " + newValue + ")";
  }
}
