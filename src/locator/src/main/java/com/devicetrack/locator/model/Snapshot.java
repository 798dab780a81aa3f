package com.devicetrack.locator.model;

import java.util.List;

/**
 * Full dataset as loaded, ordered ascending by {@code sts} across all devices.
 *
 * <p>Records are kept verbatim (no deduplication). Instances are immutable.
 *
 * @param records ordered records
 */
public record Snapshot(List<TelemetryRecord> records) {
  public Snapshot {
    records = List.copyOf(records);
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
