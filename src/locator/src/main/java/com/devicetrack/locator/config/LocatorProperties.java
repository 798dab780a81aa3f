package com.devicetrack.locator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the locator service.
 *
 * <p>Values are bound from {@code locator.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "locator")
public class LocatorProperties {
  private final Dataset dataset = new Dataset();
  private final Redis redis = new Redis();

  public Dataset getDataset() {
    return dataset;
  }

  public Redis getRedis() {
    return redis;
  }

  /** Location of the telemetry export and startup load behavior. */
  public static class Dataset {
    private String bucket = "carnot-bucket";
    private String key = "data/data.csv";
    private boolean loadOnStartup = true;
    private boolean failOnLoadError = false;

    public String getBucket() {
      return bucket;
    }

    public void setBucket(String bucket) {
      this.bucket = bucket;
    }

    public String getKey() {
      return key;
    }

    public void setKey(String key) {
      this.key = key;
    }

    public boolean isLoadOnStartup() {
      return loadOnStartup;
    }

    public void setLoadOnStartup(boolean loadOnStartup) {
      this.loadOnStartup = loadOnStartup;
    }

    public boolean isFailOnLoadError() {
      return failOnLoadError;
    }

    public void setFailOnLoadError(boolean failOnLoadError) {
      this.failOnLoadError = failOnLoadError;
    }
  }

  /** Redis key layout for the cached dataset. */
  public static class Redis {
    private String latestKeyPrefix = "locator:device:latest:";
    private String snapshotKey = "locator:dataset:snapshot";

    public String getLatestKeyPrefix() {
      return latestKeyPrefix;
    }

    public void setLatestKeyPrefix(String latestKeyPrefix) {
      this.latestKeyPrefix = latestKeyPrefix;
    }

    public String getSnapshotKey() {
      return snapshotKey;
    }

    public void setSnapshotKey(String snapshotKey) {
      this.snapshotKey = snapshotKey;
    }
  }
}
