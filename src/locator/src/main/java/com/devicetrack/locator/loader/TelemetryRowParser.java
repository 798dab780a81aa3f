package com.devicetrack.locator.loader;

import com.devicetrack.locator.model.TelemetryRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Strict parser turning one header-keyed CSV row into a {@link TelemetryRecord}.
 */
public final class TelemetryRowParser {
  public static final String DEVICE_ID = "device_fk_id";
  public static final String LATITUDE = "latitude";
  public static final String LONGITUDE = "longitude";
  public static final String TIME_STAMP = "time_stamp";
  public static final String STS = "sts";
  public static final String SPEED = "speed";

  /** Columns a telemetry export must declare in its header. */
  public static final List<String> REQUIRED_COLUMNS =
      List.of(DEVICE_ID, LATITUDE, LONGITUDE, TIME_STAMP, STS, SPEED);

  private TelemetryRowParser() {}

  /**
   * Parses a row.
   *
   * @param row column name to raw cell value
   * @param rowNumber CSV record number, used in error messages
   * @return parsed record
   * @throws MalformedRecordException when a required field is missing or unparsable
   */
  public static TelemetryRecord parse(Map<String, String> row, long rowNumber) {
    long deviceId = parseDeviceId(row.get(DEVICE_ID), rowNumber);
    Instant timeStamp = parseTimestamp(TIME_STAMP, row.get(TIME_STAMP), rowNumber);
    Instant sts = parseTimestamp(STS, row.get(STS), rowNumber);
    return new TelemetryRecord(
        deviceId,
        parseOptionalDouble(LATITUDE, row.get(LATITUDE), rowNumber),
        parseOptionalDouble(LONGITUDE, row.get(LONGITUDE), rowNumber),
        timeStamp,
        sts,
        parseOptionalDouble(SPEED, row.get(SPEED), rowNumber));
  }

  private static long parseDeviceId(String raw, long rowNumber) {
    if (raw == null || raw.isBlank()) {
      throw new MalformedRecordException(rowNumber, DEVICE_ID + " is missing");
    }
    long deviceId;
    try {
      deviceId = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new MalformedRecordException(rowNumber, DEVICE_ID + " is not an integer: " + raw);
    }
    if (deviceId < 0) {
      throw new MalformedRecordException(rowNumber, DEVICE_ID + " must be non-negative: " + raw);
    }
    return deviceId;
  }

  private static Instant parseTimestamp(String column, String raw, long rowNumber) {
    if (raw == null || raw.isBlank()) {
      throw new MalformedRecordException(rowNumber, column + " is missing");
    }
    return TimestampParser.parse(raw)
        .orElseThrow(() -> new MalformedRecordException(rowNumber, column + " is not a timestamp: " + raw));
  }

  private static Double parseOptionalDouble(String column, String raw, long rowNumber) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new MalformedRecordException(rowNumber, column + " is not numeric: " + raw);
    }
    if (!Double.isFinite(value)) {
      throw new MalformedRecordException(rowNumber, column + " must be a finite number: " + raw);
    }
    return value;
  }
}
