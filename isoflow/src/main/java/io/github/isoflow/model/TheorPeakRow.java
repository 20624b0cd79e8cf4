package io.github.isoflow.model;

import org.immutables.value.Value;

/**
 * Theoretical peaks of a formula and adduct as read from the database,
 * centroids still JSON encoded.
 */
@Value.Immutable
public interface TheorPeakRow {

  int formulaId();

  String adduct();

  String centrMzs();

  String centrInts();

}
