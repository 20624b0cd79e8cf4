package io.github.isoflow.exception;

/**
 * A dataset was added under an id that is already stored and deletion was not requested.
 */
public class DatasetAlreadyExistsException extends IsoflowException {

  public DatasetAlreadyExistsException(final String message) {
    super(message);
  }
}
