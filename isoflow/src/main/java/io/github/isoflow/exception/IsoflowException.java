package io.github.isoflow.exception;

/**
 * Base of the errors raised by the orchestration core.
 */
public class IsoflowException extends RuntimeException {

  public IsoflowException(final String message) {
    super(message);
  }

  public IsoflowException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
