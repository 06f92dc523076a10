package com.scholary.meetings.objectstore;

import java.util.Optional;

/** A parsed {@code s3://bucket/key} reference. */
public record S3Location(String bucket, String key) {

  private static final String SCHEME = "s3://";

  public S3Location {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key must not be blank");
    }
  }

  /**
   * Parse a file reference.
   *
   * @return the location, or empty if the reference is not an s3 URI
   * @throws IllegalArgumentException if it is an s3 URI without a bucket or key
   */
  public static Optional<S3Location> parse(String reference) {
    if (reference == null || !reference.startsWith(SCHEME)) {
      return Optional.empty();
    }
    String rest = reference.substring(SCHEME.length());
    int slash = rest.indexOf('/');
    if (slash <= 0) {
      throw new IllegalArgumentException("Invalid s3 location: " + reference);
    }
    return Optional.of(new S3Location(rest.substring(0, slash), rest.substring(slash + 1)));
  }

  /** The last path segment of the key. */
  public String fileName() {
    int slash = key.lastIndexOf('/');
    return slash < 0 ? key : key.substring(slash + 1);
  }

  @Override
  public String toString() {
    return SCHEME + bucket + "/" + key;
  }
}
