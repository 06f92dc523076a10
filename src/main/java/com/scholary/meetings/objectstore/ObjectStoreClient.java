package com.scholary.meetings.objectstore;

import java.nio.file.Path;

/**
 * Abstraction for the object storage that uploaded meeting recordings live in.
 *
 * <p>Jobs reference audio either by local path or by an {@code s3://bucket/key} location. Only
 * the second goes through this interface.
 */
public interface ObjectStoreClient {

  /**
   * Download an object to a local file, replacing the file if it exists.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param target where to write the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  void downloadToFile(String bucket, String key, Path target);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
