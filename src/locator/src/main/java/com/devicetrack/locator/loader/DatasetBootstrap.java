package com.devicetrack.locator.loader;

import com.devicetrack.locator.cache.CacheUnavailableException;
import com.devicetrack.locator.cache.TelemetryCacheStore;
import com.devicetrack.locator.config.LocatorProperties;
import com.devicetrack.locator.source.ObjectSource;
import com.devicetrack.locator.source.ObjectSourceException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Populates the cache from the configured telemetry export.
 *
 * <p>Runs once while the application context starts, before the web server accepts requests.
 * The cache is only written after the export was fetched and fully parsed, so a failed load
 * leaves previously cached data in place.
 */
@Component
public class DatasetBootstrap {
  private static final Logger log = LoggerFactory.getLogger(DatasetBootstrap.class);

  private final ObjectSource objectSource;
  private final DatasetLoader datasetLoader;
  private final TelemetryCacheStore cacheStore;
  private final LocatorProperties properties;
  private final MeterRegistry meterRegistry;
  private final Counter recordCounter;
  private final Timer loadTimer;
  private final AtomicInteger deviceCount;

  public DatasetBootstrap(
      ObjectSource objectSource,
      DatasetLoader datasetLoader,
      TelemetryCacheStore cacheStore,
      LocatorProperties properties,
      MeterRegistry meterRegistry) {
    this.objectSource = objectSource;
    this.datasetLoader = datasetLoader;
    this.cacheStore = cacheStore;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.recordCounter = meterRegistry.counter("locator.load.records");
    this.loadTimer = meterRegistry.timer("locator.load.duration");
    this.deviceCount = meterRegistry.gauge("locator.load.devices", new AtomicInteger(0));
  }

  @PostConstruct
  public void loadOnStartup() {
    LocatorProperties.Dataset dataset = properties.getDataset();
    if (!dataset.isLoadOnStartup()) {
      log.info("Startup dataset load disabled; serving whatever is already cached");
      return;
    }
    try {
      refresh();
    } catch (DatasetLoadException ex) {
      if (dataset.isFailOnLoadError()) {
        throw ex;
      }
      // Keep serving the previous cache contents.
      log.error("Dataset load failed ({}), previous cache contents retained", ex.getKind(), ex);
    } catch (CacheUnavailableException ex) {
      if (dataset.isFailOnLoadError()) {
        throw ex;
      }
      log.error("Dataset loaded but could not be written to the cache", ex);
    }
  }

  /**
   * Fetches, parses and caches the configured export.
   *
   * @return the loaded snapshot and index
   * @throws DatasetLoadException when the export cannot be fetched or parsed
   * @throws CacheUnavailableException when Redis rejects the write
   */
  public LoadResult refresh() {
    LocatorProperties.Dataset dataset = properties.getDataset();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      byte[] content = fetch(dataset.getBucket(), dataset.getKey());
      LoadResult result = datasetLoader.load(new ByteArrayInputStream(content));

      cacheStore.putAllLatest(result.latestIndex());
      cacheStore.putSnapshot(result.snapshot());

      recordCounter.increment(result.snapshot().size());
      deviceCount.set(result.latestIndex().deviceCount());
      log.info(
          "Loaded {} records for {} devices from s3://{}/{}",
          result.snapshot().size(),
          result.latestIndex().deviceCount(),
          dataset.getBucket(),
          dataset.getKey());
      return result;
    } catch (DatasetLoadException ex) {
      meterRegistry.counter("locator.load.failures", "kind", ex.getKind().name().toLowerCase(Locale.ROOT))
          .increment();
      throw ex;
    } catch (CacheUnavailableException ex) {
      meterRegistry.counter("locator.load.failures", "kind", "cache_unavailable").increment();
      throw ex;
    } finally {
      sample.stop(loadTimer);
    }
  }

  private byte[] fetch(String bucket, String key) {
    try (InputStream in = objectSource.fetch(bucket, key)) {
      return in.readAllBytes();
    } catch (ObjectSourceException | SdkException | IOException ex) {
      // S3 body streams report read failures as SdkException.
      throw new DatasetLoadException(
          DatasetLoadException.Kind.SOURCE_UNAVAILABLE,
          "Unable to fetch s3://" + bucket + "/" + key + ": " + ex.getMessage(),
          ex);
    }
  }
}
