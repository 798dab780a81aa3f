package com.devicetrack.locator.source;

import com.devicetrack.locator.config.AwsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;

/**
 * Resolves the credentials used to read the telemetry bucket.
 *
 * <p>Order: explicit key pair from configuration, then SSM parameter names, then the AWS default
 * credentials chain. The first two are cached once resolved.
 */
@Component
public class S3CredentialsResolver implements AwsCredentialsProvider {
  private static final Logger log = LoggerFactory.getLogger(S3CredentialsResolver.class);

  private final AwsProperties properties;
  private final SsmClient ssmClient;
  private final AwsCredentialsProvider fallback;
  private AwsCredentials resolved;

  @Autowired
  public S3CredentialsResolver(AwsProperties properties, SsmClient ssmClient) {
    this(properties, ssmClient, DefaultCredentialsProvider.create());
  }

  S3CredentialsResolver(AwsProperties properties, SsmClient ssmClient, AwsCredentialsProvider fallback) {
    this.properties = properties;
    this.ssmClient = ssmClient;
    this.fallback = fallback;
  }

  @Override
  public synchronized AwsCredentials resolveCredentials() {
    if (resolved != null) {
      return resolved;
    }

    if (isPresent(properties.accessKeyId()) && isPresent(properties.secretAccessKey())) {
      resolved = AwsBasicCredentials.create(properties.accessKeyId(), properties.secretAccessKey());
      return resolved;
    }

    if (isPresent(properties.accessKeyIdSsm()) && isPresent(properties.secretAccessKeySsm())) {
      log.info("Reading S3 credentials from SSM parameters {}", properties.accessKeyIdSsm());
      resolved = AwsBasicCredentials.create(
          getParameter(properties.accessKeyIdSsm()),
          getParameter(properties.secretAccessKeySsm()));
      return resolved;
    }

    return fallback.resolveCredentials();
  }

  private boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }

  private String getParameter(String name) {
    return ssmClient.getParameter(
        GetParameterRequest.builder().name(name).withDecryption(true).build()).parameter().value();
  }
}
