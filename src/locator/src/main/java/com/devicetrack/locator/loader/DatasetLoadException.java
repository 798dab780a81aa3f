package com.devicetrack.locator.loader;

/**
 * Failure of a whole dataset load. No partial result is ever produced.
 */
public class DatasetLoadException extends RuntimeException {

  /** Failure category. */
  public enum Kind {
    SOURCE_UNAVAILABLE,
    PARSE_FAILURE
  }

  private final Kind kind;

  public DatasetLoadException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
