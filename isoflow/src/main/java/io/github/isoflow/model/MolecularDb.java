package io.github.isoflow.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Molecular database as described by the molecular database service.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableMolecularDb.class)
@JsonDeserialize(as = ImmutableMolecularDb.class)
public interface MolecularDb {

  /**
   * Id.
   *
   * @return the id
   */
  int id();

  /**
   * Name.
   *
   * @return the name
   */
  String name();

  /**
   * Version.
   *
   * @return the version
   */
  String version();

}
