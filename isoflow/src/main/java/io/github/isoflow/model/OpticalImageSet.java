package io.github.isoflow.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Optical imagery registered for a dataset.
 */
@Value.Immutable
public interface OpticalImageSet {

  /**
   * Id of the raw optical image in the image store.
   *
   * @return the raw image id
   */
  Optional<String> rawImageId();

  /**
   * The 3x3 projective transform, row major.
   *
   * @return the transform
   */
  Optional<List<List<Double>>> transform();

  /**
   * Stored tile id per zoom level.
   *
   * @return the tiles
   */
  Map<Integer, String> tiles();

  /**
   * True when nothing is registered.
   *
   * @return true if empty
   */
  @Value.Derived
  default boolean isEmpty() {
    return rawImageId().isEmpty() && tiles().isEmpty();
  }

}
