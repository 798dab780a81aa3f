package com.devicetrack.locator.cache;

import com.devicetrack.locator.config.LocatorProperties;
import com.devicetrack.locator.model.LatestIndex;
import com.devicetrack.locator.model.Snapshot;
import com.devicetrack.locator.model.TelemetryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis implementation of {@link TelemetryCacheStore}.
 *
 * <p>Key layout:
 * <ul>
 *   <li>{@code <latestKeyPrefix><deviceId>}: JSON object of the device's latest record</li>
 *   <li>{@code <snapshotKey>}: JSON array of all records in snapshot order</li>
 * </ul>
 */
@Component
public class RedisTelemetryCacheStore implements TelemetryCacheStore {
  private static final Logger log = LoggerFactory.getLogger(RedisTelemetryCacheStore.class);
  private static final TypeReference<List<TelemetryRecord>> RECORD_LIST = new TypeReference<>() {};

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final LocatorProperties properties;

  public RedisTelemetryCacheStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      LocatorProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void putLatest(long deviceId, TelemetryRecord record) {
    String payload = write(record);
    try {
      redisTemplate.opsForValue().set(latestKey(deviceId), payload);
    } catch (DataAccessException ex) {
      throw unavailable("write latest record for device " + deviceId, ex);
    }
  }

  @Override
  public void putAllLatest(LatestIndex index) {
    if (index.deviceCount() == 0) {
      return;
    }
    Map<String, String> payloads = new LinkedHashMap<>();
    index.byDevice().forEach((deviceId, record) -> payloads.put(latestKey(deviceId), write(record)));
    try {
      redisTemplate.opsForValue().multiSet(payloads);
    } catch (DataAccessException ex) {
      throw unavailable("write latest records", ex);
    }
    log.debug("Wrote latest records for {} devices", payloads.size());
  }

  @Override
  public Optional<TelemetryRecord> getLatest(long deviceId) {
    String payload;
    try {
      payload = redisTemplate.opsForValue().get(latestKey(deviceId));
    } catch (DataAccessException ex) {
      throw unavailable("read latest record for device " + deviceId, ex);
    }
    if (payload == null) {
      return Optional.empty();
    }
    return Optional.of(read(payload, TelemetryRecord.class));
  }

  @Override
  public void putSnapshot(Snapshot snapshot) {
    String payload = write(snapshot.records());
    try {
      redisTemplate.opsForValue().set(properties.getRedis().getSnapshotKey(), payload);
    } catch (DataAccessException ex) {
      throw unavailable("write snapshot", ex);
    }
  }

  @Override
  public Optional<Snapshot> getSnapshot() {
    String payload;
    try {
      payload = redisTemplate.opsForValue().get(properties.getRedis().getSnapshotKey());
    } catch (DataAccessException ex) {
      throw unavailable("read snapshot", ex);
    }
    if (payload == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(new Snapshot(objectMapper.readValue(payload, RECORD_LIST)));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cached snapshot is not valid JSON", ex);
    }
  }

  private String latestKey(long deviceId) {
    return properties.getRedis().getLatestKeyPrefix() + deviceId;
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), ex);
    }
  }

  private <T> T read(String payload, Class<T> type) {
    try {
      return objectMapper.readValue(payload, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cached " + type.getSimpleName() + " is not valid JSON", ex);
    }
  }

  private CacheUnavailableException unavailable(String operation, DataAccessException ex) {
    return new CacheUnavailableException(
        "Redis unavailable while trying to " + operation + ": " + ex.getMostSpecificCause().getMessage(), ex);
  }
}
