package io.github.isoflow.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Molecular database selection entry of a dataset config.
 */
@Value.Immutable
public interface MolDbRef {

  /**
   * Name.
   *
   * @return the name
   */
  @Value.Parameter
  String name();

  /**
   * Version, the latest version is used when absent.
   *
   * @return the version
   */
  @Value.Parameter
  Optional<String> version();

}
