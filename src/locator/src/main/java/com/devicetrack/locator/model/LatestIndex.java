package com.devicetrack.locator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest record per device, derived from a {@link Snapshot} at load time.
 *
 * @param byDevice device id to its latest record, in first-seen device order
 */
public record LatestIndex(Map<Long, TelemetryRecord> byDevice) {
  public LatestIndex {
    byDevice = Collections.unmodifiableMap(new LinkedHashMap<>(byDevice));
  }

  /**
   * Builds the index by scanning the snapshot once; the last record seen for a device wins.
   *
   * @param snapshot sts-ordered snapshot
   * @return latest record per device
   */
  public static LatestIndex from(Snapshot snapshot) {
    Map<Long, TelemetryRecord> latest = new LinkedHashMap<>();
    for (TelemetryRecord record : snapshot.records()) {
      latest.put(record.deviceId(), record);
    }
    return new LatestIndex(latest);
  }

  public Optional<TelemetryRecord> get(long deviceId) {
    return Optional.ofNullable(byDevice.get(deviceId));
  }

  public int deviceCount() {
    return byDevice.size();
  }
}
