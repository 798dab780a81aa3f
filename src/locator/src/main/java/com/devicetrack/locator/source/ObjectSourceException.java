package com.devicetrack.locator.source;

/**
 * Failure to reach or read from the object store.
 */
public class ObjectSourceException extends RuntimeException {
  public ObjectSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
