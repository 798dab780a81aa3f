package com.devicetrack.locator.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Position of a device at a given event time.
 *
 * @param latitude latitude
 * @param longitude longitude
 * @param timeStamp event time of the sample
 */
public record LocationPoint(
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude,
    @JsonProperty("time_stamp") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant timeStamp) {

  public static LocationPoint of(TelemetryRecord record) {
    return new LocationPoint(record.latitude(), record.longitude(), record.timeStamp());
  }
}
