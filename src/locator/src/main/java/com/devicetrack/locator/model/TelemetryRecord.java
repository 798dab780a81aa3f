package com.devicetrack.locator.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One telemetry sample of a device, as cached in Redis and served by the API.
 *
 * <p>Timestamps are written as ISO-8601 instants so sub-second precision survives the cache round
 * trip. Coordinates and speed are nullable when the source cell was empty.
 *
 * @param deviceId non-negative device identifier ({@code device_fk_id})
 * @param latitude latitude as supplied by the source
 * @param longitude longitude as supplied by the source
 * @param timeStamp event time used for window filtering
 * @param sts secondary timestamp defining snapshot order
 * @param speed speed as supplied by the source
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelemetryRecord(
    @JsonProperty("device_fk_id") long deviceId,
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude,
    @JsonProperty("time_stamp") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant timeStamp,
    @JsonProperty("sts") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant sts,
    @JsonProperty("speed") Double speed) {

  /**
   * Returns the position of this sample.
   *
   * @return latitude/longitude pair
   */
  public Location location() {
    return new Location(latitude, longitude);
  }
}
