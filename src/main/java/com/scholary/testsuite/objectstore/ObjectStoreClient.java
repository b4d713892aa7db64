package com.scholary.testsuite.objectstore;

import java.util.List;

/**
 * Abstraction for object storage operations.
 *
 * <p>Decouples result persistence from a specific backend (S3, MinIO). Objects here are small JSON
 * documents and images, so they move as whole byte arrays: one put replaces one object.
 */
public interface ObjectStoreClient {

  /**
   * Store an object, replacing any previous version under the same key.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the complete object content
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data, String contentType);

  /**
   * Read a whole object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object content
   * @throws ObjectNotFoundException if the object doesn't exist
   * @throws ObjectStoreException if retrieval fails
   */
  byte[] getObject(String bucket, String key);

  /**
   * List every key under a prefix.
   *
   * @param bucket the bucket name
   * @param prefix the key prefix, e.g. {@code styles/s1/test_results/}
   * @return matching keys, in the store's listing order
   * @throws ObjectStoreException if listing fails
   */
  List<String> listKeys(String bucket, String prefix);
}
