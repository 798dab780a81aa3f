package com.devicetrack.locator.cache;

import com.devicetrack.locator.model.LatestIndex;
import com.devicetrack.locator.model.Snapshot;
import com.devicetrack.locator.model.TelemetryRecord;
import java.util.Optional;

/**
 * Key-value persistence for the loaded dataset.
 *
 * <p>Two logical namespaces are kept: one latest record per device and one entry holding the
 * whole ordered snapshot. Every write is a full overwrite. Implementations raise
 * {@link CacheUnavailableException} on backend failures and return an empty result for absent
 * keys.
 */
public interface TelemetryCacheStore {
  void putLatest(long deviceId, TelemetryRecord record);

  /**
   * Writes the latest record of every device in the index.
   *
   * @param index latest-per-device index
   */
  void putAllLatest(LatestIndex index);

  Optional<TelemetryRecord> getLatest(long deviceId);

  void putSnapshot(Snapshot snapshot);

  Optional<Snapshot> getSnapshot();
}
