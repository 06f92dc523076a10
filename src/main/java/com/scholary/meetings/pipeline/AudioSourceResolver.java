package com.scholary.meetings.pipeline;

import com.scholary.meetings.job.MeetingJob;
import com.scholary.meetings.objectstore.ObjectStoreClient;
import com.scholary.meetings.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.meetings.objectstore.S3Location;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a job's file reference into a local file.
 *
 * <p>Plain paths are used in place. {@code s3://bucket/key} references are downloaded into the
 * pipeline temp directory under a name prefixed with the job id, so concurrent workers never
 * collide.
 */
@Component
public class AudioSourceResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSourceResolver.class);

  private final ObjectStoreClient objectStoreClient;
  private final Path tempDir;

  public AudioSourceResolver(ObjectStoreClient objectStoreClient, PipelineProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.tempDir = Paths.get(properties.tempDir());
  }

  /**
   * Resolve the recording for a job.
   *
   * @throws ProcessingException if a local file does not exist or the reference is invalid
   * @throws com.scholary.meetings.objectstore.ObjectStoreException if the download fails
   */
  public AudioSource resolve(MeetingJob job) {
    String reference = job.getFilePath();
    if (reference == null || reference.isBlank()) {
      throw new ProcessingException("Job " + job.getId() + " has no file path");
    }

    Optional<S3Location> location;
    try {
      location = S3Location.parse(reference);
    } catch (IllegalArgumentException e) {
      throw new ProcessingException(e.getMessage(), e);
    }

    if (location.isEmpty()) {
      Path local = Paths.get(reference);
      if (!Files.exists(local)) {
        throw new ProcessingException("Audio file not found: " + reference);
      }
      return AudioSource.local(local);
    }

    S3Location s3 = location.get();
    ObjectMetadata metadata = objectStoreClient.getObjectMetadata(s3.bucket(), s3.key());
    LOGGER.info(
        "Downloading recording {} ({} bytes, {})",
        s3,
        metadata.contentLength(),
        metadata.contentType());

    Path target = tempDir.resolve(job.getId() + "-" + s3.fileName());
    objectStoreClient.downloadToFile(s3.bucket(), s3.key(), target);
    return AudioSource.temporary(target);
  }
}
