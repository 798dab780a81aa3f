package com.devicetrack.locator.config;

import com.devicetrack.locator.source.S3CredentialsResolver;
import java.net.URI;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.ssm.SsmClient;

@Configuration
public class AppConfig {
  @Bean
  public SsmClient ssmClient(AwsProperties awsProperties) {
    return SsmClient.builder().region(Region.of(awsProperties.region())).build();
  }

  @Bean
  public S3Client s3Client(AwsProperties awsProperties, S3CredentialsResolver credentialsResolver) {
    S3ClientBuilder builder = S3Client.builder()
        .region(Region.of(awsProperties.region()))
        .credentialsProvider(credentialsResolver)
        .forcePathStyle(awsProperties.pathStyleAccess());
    // Custom endpoint for S3-compatible stores (MinIO, LocalStack).
    if (awsProperties.endpoint() != null && !awsProperties.endpoint().isBlank()) {
      builder.endpointOverride(URI.create(awsProperties.endpoint()));
    }
    return builder.build();
  }
}
