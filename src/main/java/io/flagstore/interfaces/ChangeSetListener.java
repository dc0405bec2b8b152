package io.flagstore.interfaces;

import io.flagstore.subsystems.DataSystemTypes.ChangeSet;

/**
 * A listener that receives every change set after it has been successfully applied to the store.
 * <p>
 * This is lower-level than {@link FlagChangeListener}: it sees the raw changes exactly as they were
 * delivered, but no dependency analysis has been done on them. Sets with the intent
 * {@link io.flagstore.subsystems.DataSystemTypes.IntentCode#TRANSFER_NONE} are not delivered.
 */
public interface ChangeSetListener {
  /**
   * Called after a change set has been applied.
   *
   * @param changeSet the applied change set
   */
  void onChangeSetApplied(ChangeSet changeSet);
}
