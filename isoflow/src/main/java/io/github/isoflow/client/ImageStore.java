package io.github.isoflow.client;

/**
 * Image storage service.
 */
public interface ImageStore {

  /**
   * Fetch an image.
   *
   * @param storageType the storage type
   * @param kind        the image kind
   * @param id          the image id
   * @return the image with its size
   */
  StoredImage getImageById(ImageStorageType storageType, ImageKind kind, String id);

  /**
   * Store an image.
   *
   * @param storageType the storage type
   * @param kind        the image kind
   * @param bytes       the encoded image
   * @return the new image id
   */
  String postImage(ImageStorageType storageType, ImageKind kind, byte[] bytes);

  /**
   * Delete an image.
   *
   * @param storageType the storage type
   * @param kind        the image kind
   * @param id          the image id
   */
  void deleteImageById(ImageStorageType storageType, ImageKind kind, String id);
}
