package io.github.isoflow.exception;

/**
 * No molecular database matches the requested id or name and version.
 */
public class MolecularDbNotFoundException extends IsoflowException {

  public MolecularDbNotFoundException(final String message) {
    super(message);
  }
}
