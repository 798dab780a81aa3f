package com.devicetrack.locator.source;

import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;

/**
 * {@link ObjectSource} backed by Amazon S3 (or any S3-compatible endpoint).
 */
@Component
public class S3ObjectSource implements ObjectSource {
  private static final Logger log = LoggerFactory.getLogger(S3ObjectSource.class);

  private final S3Client s3Client;

  public S3ObjectSource(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  @Override
  public InputStream fetch(String bucket, String key) {
    log.info("Fetching s3://{}/{}", bucket, key);
    try {
      return s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (SdkException ex) {
      throw new ObjectSourceException("Unable to read s3://" + bucket + "/" + key + ": " + ex.getMessage(), ex);
    }
  }
}
