package com.devicetrack.locator.service;

import com.devicetrack.locator.api.DatasetNotLoadedException;
import com.devicetrack.locator.api.DeviceNotFoundException;
import com.devicetrack.locator.api.NoDataException;
import com.devicetrack.locator.cache.TelemetryCacheStore;
import com.devicetrack.locator.model.LocationPoint;
import com.devicetrack.locator.model.Snapshot;
import com.devicetrack.locator.model.StartEndLocationResponse;
import com.devicetrack.locator.model.TelemetryRecord;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Query facade for the location endpoints.
 *
 * <p>Request parameters are validated before the cache is touched; results are derived from the
 * cached snapshot by {@link TelemetryQueryEngine}, except the latest record which is read from its
 * own key.
 */
@Service
public class TelemetryQueryService {
  private final TelemetryCacheStore cacheStore;

  public TelemetryQueryService(TelemetryCacheStore cacheStore) {
    this.cacheStore = cacheStore;
  }

  /**
   * Returns every cached record in snapshot order.
   *
   * @return full dataset
   * @throws NoDataException when no snapshot is cached
   */
  public List<TelemetryRecord> getAllData() {
    Snapshot snapshot = cacheStore.getSnapshot().orElseThrow(NoDataException::new);
    return TelemetryQueryEngine.fullDataset(snapshot);
  }

  /**
   * Returns the latest record of a device.
   *
   * @param deviceIdRaw raw {@code device_id} parameter
   * @return latest record
   */
  public TelemetryRecord getLatest(String deviceIdRaw) {
    long deviceId = QueryParser.parseDeviceId(deviceIdRaw);
    return cacheStore.getLatest(deviceId).orElseThrow(() -> new DeviceNotFoundException(deviceId));
  }

  /**
   * Returns the start and end position of a device.
   *
   * @param deviceIdRaw raw {@code device_id} parameter
   * @return start/end positions
   */
  public StartEndLocationResponse getStartEndLocation(String deviceIdRaw) {
    long deviceId = QueryParser.parseDeviceId(deviceIdRaw);
    return TelemetryQueryEngine.startEndLocation(loadedSnapshot(), deviceId);
  }

  /**
   * Returns the positions of a device within an inclusive event-time window.
   *
   * @param deviceIdRaw raw {@code device_id} parameter
   * @param startTimeRaw raw {@code start_time} parameter
   * @param endTimeRaw raw {@code end_time} parameter
   * @return matching points, possibly empty
   */
  public List<LocationPoint> getLocationPoints(String deviceIdRaw, String startTimeRaw, String endTimeRaw) {
    QueryParser.requireWindowParameters(deviceIdRaw, startTimeRaw, endTimeRaw);
    long deviceId = QueryParser.parseDeviceId(deviceIdRaw);
    Instant start = QueryParser.parseTime("start_time", startTimeRaw);
    Instant end = QueryParser.parseTime("end_time", endTimeRaw);
    return TelemetryQueryEngine.locationPointsInWindow(loadedSnapshot(), deviceId, start, end);
  }

  private Snapshot loadedSnapshot() {
    return cacheStore.getSnapshot().orElseThrow(DatasetNotLoadedException::new);
  }
}
