package com.devicetrack.locator.loader;

/**
 * Raised when a telemetry row cannot be turned into a record.
 */
public class MalformedRecordException extends RuntimeException {
  private final long rowNumber;

  public MalformedRecordException(long rowNumber, String message) {
    super("row " + rowNumber + ": " + message);
    this.rowNumber = rowNumber;
  }

  public long getRowNumber() {
    return rowNumber;
  }
}
