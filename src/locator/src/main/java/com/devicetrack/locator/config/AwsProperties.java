package com.devicetrack.locator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aws")
public record AwsProperties(
    String region,
    String endpoint,
    boolean pathStyleAccess,
    String accessKeyId,
    String secretAccessKey,
    String accessKeyIdSsm,
    String secretAccessKeySsm) {}
