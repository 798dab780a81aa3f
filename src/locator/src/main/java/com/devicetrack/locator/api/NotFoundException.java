package com.devicetrack.locator.api;

/**
 * Domain-level exception used when requested data does not exist.
 *
 * <p>Mapped to HTTP 404 by {@link ApiExceptionHandler}.
 */
public class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
