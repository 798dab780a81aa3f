package com.devicetrack.locator.api;

/**
 * A time window bound that is not a recognized timestamp.
 */
public class InvalidRangeException extends BadRequestException {
  public InvalidRangeException(String message) {
    super(message);
  }
}
