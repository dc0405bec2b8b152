package io.flagstore.subsystems;

import io.flagstore.subsystems.DataSystemTypes.Update;

import java.io.Closeable;
import java.util.function.Consumer;

/**
 * A long-running source of updates.
 * <p>
 * {@link #sync(SelectorStore, Consumer)} blocks for as long as the synchronizer is delivering data and
 * returns once it has stopped, either because it was closed or because it reported
 * {@link io.flagstore.interfaces.DataSourceStatusProvider.State#OFF}. {@link #close()} may be called from
 * another thread while {@code sync} is running, and may be called more than once.
 */
public interface Synchronizer extends Closeable {
  /**
   * Returns a human-readable name for this synchronizer, used in log messages.
   *
   * @return the name
   */
  String getName();

  /**
   * Runs the synchronizer, delivering each update to the consumer in order.
   *
   * @param selectorStore provides the selector of the data currently held
   * @param updates receives the updates
   */
  void sync(SelectorStore selectorStore, Consumer<Update> updates);
}
