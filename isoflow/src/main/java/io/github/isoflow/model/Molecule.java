package io.github.isoflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A molecule of a molecular database matching a sum formula.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableMolecule.class)
@JsonDeserialize(as = ImmutableMolecule.class)
public interface Molecule {

  @JsonProperty("mol_id")
  String molId();

  @JsonProperty("mol_name")
  String molName();

}
