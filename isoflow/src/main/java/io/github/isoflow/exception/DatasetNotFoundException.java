package io.github.isoflow.exception;

/**
 * Unknown dataset id, or a dataset without the stored images an operation needs.
 */
public class DatasetNotFoundException extends IsoflowException {

  public DatasetNotFoundException(final String message) {
    super(message);
  }
}
