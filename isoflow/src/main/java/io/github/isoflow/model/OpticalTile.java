package io.github.isoflow.model;

import org.immutables.value.Value;

/**
 * Row of the optical_image table: one stored tile per zoom level.
 */
@Value.Immutable
public interface OpticalTile {

  @Value.Parameter
  String id();

  @Value.Parameter
  String dsId();

  @Value.Parameter
  int zoom();

}
