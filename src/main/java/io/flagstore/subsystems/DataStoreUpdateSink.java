package io.flagstore.subsystems;

import io.flagstore.interfaces.DataStoreStatusProvider;

/**
 * Where a persistent store wrapper sends its availability changes. The data system's implementation
 * records the status and forwards it to {@link DataStoreStatusProvider} listeners.
 */
public interface DataStoreUpdateSink {
  void updateStatus(DataStoreStatusProvider.Status newStatus);
}
