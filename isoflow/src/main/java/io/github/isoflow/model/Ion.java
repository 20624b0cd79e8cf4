package io.github.isoflow.model;

import java.util.Comparator;
import org.immutables.value.Value;

/**
 * A sum formula combined with an adduct.
 */
@Value.Immutable
public interface Ion extends Comparable<Ion> {

  Comparator<Ion> ORDER = Comparator.comparingInt(Ion::formulaId).thenComparing(Ion::adduct);

  static Ion of(final int formulaId, final String adduct) {
    return ImmutableIon.of(formulaId, adduct);
  }

  @Value.Parameter
  int formulaId();

  @Value.Parameter
  String adduct();

  @Override
  default int compareTo(final Ion other) {
    return ORDER.compare(this, other);
  }

}
