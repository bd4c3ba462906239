package com.quantori.pse.api;

import lombok.Getter;

/**
 * A failure to retrieve a remote document. Transient failures (timeouts, connection resets, an
 * overloaded server) are worth retrying, the rest are not.
 */
@Getter
public class TransportException extends RuntimeException {
  private final boolean transientFailure;
  private final int statusCode;

  public TransportException(String message, boolean transientFailure, int statusCode) {
    super(message);
    this.transientFailure = transientFailure;
    this.statusCode = statusCode;
  }

  public TransportException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
    this.statusCode = -1;
  }

  public static TransportException forStatus(String uri, int statusCode, boolean transientFailure) {
    return new TransportException(
        String.format("GET %s answered with status %d", uri, statusCode), transientFailure, statusCode);
  }
}
