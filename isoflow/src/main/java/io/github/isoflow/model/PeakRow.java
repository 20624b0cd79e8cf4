package io.github.isoflow.model;

import org.immutables.value.Value;

/**
 * Centroided theoretical isotope pattern of one ion.
 */
@Value.Immutable
public interface PeakRow {

  int formulaId();

  String adduct();

  double[] centroidMzs();

  double[] centroidInts();

  @Value.Derived
  default Ion ion() {
    return Ion.of(formulaId(), adduct());
  }

  @Value.Check
  default void check() {
    if (centroidMzs().length != centroidInts().length) {
      throw new IllegalStateException("Centroid m/z and intensity arrays differ in length for " + ion());
    }
  }

}
