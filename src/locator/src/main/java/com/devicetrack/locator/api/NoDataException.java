package com.devicetrack.locator.api;

/**
 * No dataset snapshot has been cached yet.
 */
public class NoDataException extends NotFoundException {
  public NoDataException() {
    super("no data in cache");
  }
}
