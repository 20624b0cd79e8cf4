package io.github.isoflow.model;

import org.immutables.value.Value;

/**
 * A single theoretical peak of an ion.
 */
@Value.Immutable
public interface IonPeak {

  @Value.Parameter
  int formulaId();

  @Value.Parameter
  String adduct();

  @Value.Parameter
  int peakIndex();

  @Value.Parameter
  double mz();

}
