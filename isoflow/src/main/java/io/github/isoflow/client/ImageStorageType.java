package io.github.isoflow.client;

import java.util.Arrays;

/**
 * Storage class of the image store.
 */
public enum ImageStorageType {
  FS("fs"),
  DB("db");

  private final String code;

  ImageStorageType(final String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Storage type for a stored code.
   *
   * @param code the code
   * @return the type
   */
  public static ImageStorageType fromCode(final String code) {
    return Arrays.stream(values())
        .filter(type -> type.code.equalsIgnoreCase(code))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown image storage type: " + code));
  }
}
