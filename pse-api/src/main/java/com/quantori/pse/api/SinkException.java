package com.quantori.pse.api;

/**
 * Thrown by a {@link PlasmidWriter} when a record can not be persisted, i.e. a primary key
 * violation or an I/O error of a file sink.
 */
public class SinkException extends RuntimeException {
  /**
   * Constructs a {@code SinkException} with the specified detail message.
   *
   * @param message the detail message
   */
  public SinkException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code SinkException} with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause   the cause
   */
  public SinkException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructs a {@code SinkException} with the specified detail message and error code.
   *
   * @param message   the detail message
   * @param errorCode the error code reported by the storage, i.e. an SQL state
   * @param cause     the cause
   */
  public SinkException(String message, String errorCode, Throwable cause) {
    super(String.format("%s, errorCode %s", message, errorCode), cause);
  }
}
