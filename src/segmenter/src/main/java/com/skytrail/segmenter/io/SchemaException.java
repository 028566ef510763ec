package com.skytrail.segmenter.io;

/**
 * Input position data does not match the expected schema.
 *
 * <p>Schema errors are fatal: the run aborts without recovering the current chunk.
 */
public class SchemaException extends RuntimeException {
  /**
   * Creates a schema exception.
   *
   * @param message description naming the file and line
   */
  public SchemaException(String message) {
    super(message);
  }

  /**
   * Creates a schema exception with its parse cause.
   *
   * @param message description naming the file and line
   * @param cause underlying parse failure
   */
  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
