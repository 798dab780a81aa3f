package com.devicetrack.locator.cache;

/**
 * The cache backend could not be reached or answered with an error.
 *
 * <p>Distinct from an absent key, which cache reads report as an empty result.
 */
public class CacheUnavailableException extends RuntimeException {
  public CacheUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
