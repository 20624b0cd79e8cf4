package io.github.isoflow.exception;

/**
 * Theoretical peaks can not be assembled into a table fit for scoring: no rows match
 * the requested parameters, or a formula and adduct pair occurs twice.
 */
public class PeakTableConsistencyException extends IsoflowException {

  public PeakTableConsistencyException(final String message) {
    super(message);
  }
}
