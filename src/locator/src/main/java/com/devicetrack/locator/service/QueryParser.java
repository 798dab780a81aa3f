package com.devicetrack.locator.service;

import com.devicetrack.locator.api.BadRequestException;
import com.devicetrack.locator.api.InvalidRangeException;
import com.devicetrack.locator.loader.TimestampParser;
import java.time.Instant;

/**
 * Utility class for parsing and validating query parameters.
 */
public final class QueryParser {

  private QueryParser() {}

  /**
   * Parses a required {@code device_id} parameter.
   *
   * @param raw raw query value
   * @return non-negative device identifier
   */
  public static long parseDeviceId(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new BadRequestException("device_id not provided");
    }
    try {
      long deviceId = Long.parseLong(raw.trim());
      if (deviceId < 0) {
        throw new BadRequestException("device_id must be a non-negative integer");
      }
      return deviceId;
    } catch (NumberFormatException ex) {
      throw new BadRequestException("device_id must be a non-negative integer");
    }
  }

  /**
   * Parses a required time-window bound.
   *
   * @param name parameter name, used in error messages
   * @param raw raw query value
   * @return parsed instant
   */
  public static Instant parseTime(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new BadRequestException(name + " not provided");
    }
    return TimestampParser.parse(raw)
        .orElseThrow(() -> new InvalidRangeException(name + " is not a valid timestamp: " + raw));
  }

  /**
   * Rejects a window request unless all three parameters are present.
   *
   * @param deviceId raw device id
   * @param startTime raw window start
   * @param endTime raw window end
   */
  public static void requireWindowParameters(String deviceId, String startTime, String endTime) {
    if (isBlank(deviceId) || isBlank(startTime) || isBlank(endTime)) {
      throw new BadRequestException("required parameters not provided: device_id, start_time, end_time");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
