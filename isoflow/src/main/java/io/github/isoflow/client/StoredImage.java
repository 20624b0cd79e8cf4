package io.github.isoflow.client;

import org.immutables.value.Value;

/**
 * Image fetched from the image store.
 */
@Value.Immutable
public interface StoredImage {

  /**
   * Encoded image.
   *
   * @return the bytes
   */
  byte[] bytes();

  /**
   * Width in pixels.
   *
   * @return the width
   */
  int width();

  /**
   * Height in pixels.
   *
   * @return the height
   */
  int height();

}
