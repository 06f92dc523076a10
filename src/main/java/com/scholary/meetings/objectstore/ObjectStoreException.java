package com.scholary.meetings.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Inside a job this is just another processing failure and goes through the retry path.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
