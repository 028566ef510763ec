package com.skytrail.segmenter.io;

/** A day partition could not be read or written. */
public class OutputWriteException extends RuntimeException {
  public OutputWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
