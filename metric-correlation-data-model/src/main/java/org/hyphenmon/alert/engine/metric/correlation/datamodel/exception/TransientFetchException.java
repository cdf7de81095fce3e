package org.hyphenmon.alert.engine.metric.correlation.datamodel.exception;

/** A store or network read failed in a way that is expected to clear up on the next cycle. */
public class TransientFetchException extends RuntimeException {
  public TransientFetchException(String message) {
    super(message);
  }

  public TransientFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
