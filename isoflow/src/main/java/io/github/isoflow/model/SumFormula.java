package io.github.isoflow.model;

import org.immutables.value.Value;

/**
 * Row of the sum_formula table.
 */
@Value.Immutable
public interface SumFormula {

  int id();

  String sf();

}
