package com.devicetrack.locator.api;

/**
 * A location query needed the cached snapshot but none is present.
 *
 * <p>Mapped to HTTP 500: the service is expected to have loaded the dataset at startup.
 */
public class DatasetNotLoadedException extends RuntimeException {
  public DatasetNotLoadedException() {
    super("unable to fetch raw data: dataset not loaded");
  }
}
