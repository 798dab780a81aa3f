package com.devicetrack.locator.api;

import com.devicetrack.locator.model.LocationPoint;
import com.devicetrack.locator.model.StartEndLocationResponse;
import com.devicetrack.locator.model.TelemetryRecord;
import com.devicetrack.locator.service.TelemetryQueryService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the read-only device location endpoints.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /get_all_data}: every cached record</li>
 *   <li>{@code GET /latest_device_info}: latest record of one device</li>
 *   <li>{@code GET /fetch_start_end_location}: first and last position of one device</li>
 *   <li>{@code GET /fetch_location_points}: positions of one device inside a time window</li>
 * </ul>
 *
 * <p>Parameters are bound as optional strings so that missing or malformed values are reported by
 * the service with a descriptive 400 body.
 */
@RestController
public class LocatorController {
  private final TelemetryQueryService queryService;

  public LocatorController(TelemetryQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping("/get_all_data")
  public List<TelemetryRecord> getAllData() {
    return queryService.getAllData();
  }

  /**
   * Returns the latest record of a device.
   *
   * @param deviceId device identifier
   * @return latest record
   */
  @GetMapping("/latest_device_info")
  public TelemetryRecord latestDeviceInfo(
      @RequestParam(value = "device_id", required = false) String deviceId) {
    return queryService.getLatest(deviceId);
  }

  /**
   * Returns the start and end position of a device as {@code [lat, lon]} pairs.
   *
   * @param deviceId device identifier
   * @return start/end payload
   */
  @GetMapping("/fetch_start_end_location")
  public StartEndLocationResponse fetchStartEndLocation(
      @RequestParam(value = "device_id", required = false) String deviceId) {
    return queryService.getStartEndLocation(deviceId);
  }

  /**
   * Returns the positions of a device with {@code start_time <= time_stamp <= end_time}.
   *
   * @param deviceId device identifier
   * @param startTime inclusive window start (ISO-8601)
   * @param endTime inclusive window end (ISO-8601)
   * @return matching points, possibly empty
   */
  @GetMapping("/fetch_location_points")
  public List<LocationPoint> fetchLocationPoints(
      @RequestParam(value = "device_id", required = false) String deviceId,
      @RequestParam(value = "start_time", required = false) String startTime,
      @RequestParam(value = "end_time", required = false) String endTime) {
    return queryService.getLocationPoints(deviceId, startTime, endTime);
  }
}
