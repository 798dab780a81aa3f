package com.devicetrack.locator.service;

import com.devicetrack.locator.api.DeviceNotFoundException;
import com.devicetrack.locator.model.LocationPoint;
import com.devicetrack.locator.model.Snapshot;
import com.devicetrack.locator.model.StartEndLocationResponse;
import com.devicetrack.locator.model.TelemetryRecord;
import java.time.Instant;
import java.util.List;

/**
 * Stateless queries over a materialized {@link Snapshot}.
 *
 * <p>All results keep snapshot order (ascending {@code sts}).
 */
public final class TelemetryQueryEngine {

  private TelemetryQueryEngine() {}

  public static List<TelemetryRecord> fullDataset(Snapshot snapshot) {
    return snapshot.records();
  }

  /**
   * Returns the first and last position of a device in snapshot order.
   *
   * @param snapshot loaded snapshot
   * @param deviceId device identifier
   * @return start/end positions, equal when the device has a single record
   * @throws DeviceNotFoundException when the device has no record
   */
  public static StartEndLocationResponse startEndLocation(Snapshot snapshot, long deviceId) {
    List<TelemetryRecord> deviceRecords = recordsOf(snapshot, deviceId);
    if (deviceRecords.isEmpty()) {
      throw new DeviceNotFoundException(deviceId);
    }
    return new StartEndLocationResponse(
        deviceRecords.get(0).location(),
        deviceRecords.get(deviceRecords.size() - 1).location());
  }

  /**
   * Returns the positions of a device whose event time lies in {@code [start, end]}.
   *
   * <p>An unknown device or an empty window yields an empty list, not an error.
   *
   * @param snapshot loaded snapshot
   * @param deviceId device identifier
   * @param start inclusive lower bound on {@code time_stamp}
   * @param end inclusive upper bound on {@code time_stamp}
   * @return matching points in snapshot order
   */
  public static List<LocationPoint> locationPointsInWindow(
      Snapshot snapshot, long deviceId, Instant start, Instant end) {
    return snapshot.records().stream()
        .filter(record -> record.deviceId() == deviceId)
        .filter(record -> !record.timeStamp().isBefore(start) && !record.timeStamp().isAfter(end))
        .map(LocationPoint::of)
        .toList();
  }

  private static List<TelemetryRecord> recordsOf(Snapshot snapshot, long deviceId) {
    return snapshot.records().stream()
        .filter(record -> record.deviceId() == deviceId)
        .toList();
  }
}
