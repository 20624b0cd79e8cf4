package io.github.isoflow.client;

/**
 * Kinds of images kept in the image store.
 */
public enum ImageKind {
  ISO_IMAGE("iso_image"),
  OPTICAL_IMAGE("optical_image"),
  RAW_OPTICAL_IMAGE("raw_optical_image");

  private final String code;

  ImageKind(final String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
