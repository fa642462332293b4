package com.flamingo.ai.pitchscoop.store;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.enums.EntityType;
import com.flamingo.ai.pitchscoop.exception.StorageUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Tenant store on Redis string values, with SCAN-based prefix enumeration. */
@Component
@ConditionalOnProperty(
    name = "pitchscoop.store.backend",
    havingValue = "redis",
    matchIfMissing = true)
@Slf4j
public class RedisTenantStore implements TenantStore {

  static final String RETRY_NAME = "tenant-store";

  private final StringRedisTemplate redis;
  private final Retry retry;
  private final MeterRegistry meterRegistry;
  private final int scanBatchSize;

  public RedisTenantStore(
      StringRedisTemplate redis,
      RetryRegistry retryRegistry,
      MeterRegistry meterRegistry,
      PitchScoopProperties properties) {
    this.redis = redis;
    this.retry = retryRegistry.retry(RETRY_NAME);
    this.meterRegistry = meterRegistry;
    this.scanBatchSize = Math.max(1, properties.getStore().getScanBatchSize());
  }

  @Override
  public void put(
      String tenantId, EntityType entityType, String entityId, String value, Duration ttl) {
    String key = TenantKey.of(tenantId, entityType, entityId).render();
    execute(
        "put",
        key,
        () -> {
          if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(key, value);
          } else {
            redis.opsForValue().set(key, value, ttl);
          }
          return null;
        });
  }

  @Override
  public Optional<String> find(String tenantId, EntityType entityType, String entityId) {
    String key = TenantKey.of(tenantId, entityType, entityId).render();
    return Optional.ofNullable(execute("get", key, () -> redis.opsForValue().get(key)));
  }

  @Override
  public boolean delete(String tenantId, EntityType entityType, String entityId) {
    String key = TenantKey.of(tenantId, entityType, entityId).render();
    Boolean deleted = execute("delete", key, () -> redis.delete(key));
    return Boolean.TRUE.equals(deleted);
  }

  @Override
  public Iterable<TenantEntry> scanPrefix(
      String tenantId, EntityType entityType, String subPrefix) {
    String prefix = TenantKey.prefix(tenantId, entityType, subPrefix);
    return () -> new ScanIterator(tenantId, entityType, prefix, scanKeys(prefix));
  }

  private List<String> scanKeys(String prefix) {
    ScanOptions options =
        ScanOptions.scanOptions().match(prefix + "*").count(scanBatchSize).build();
    return execute(
        "scan",
        prefix,
        () -> {
          List<String> keys = new ArrayList<>();
          try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
              keys.add(cursor.next());
            }
          }
          return keys;
        });
  }

  private <T> T execute(String operation, String key, Supplier<T> action) {
    try {
      return Retry.decorateSupplier(retry, action).get();
    } catch (DataAccessException e) {
      meterRegistry.counter("tenant_store.failures", "operation", operation).increment();
      log.error(
          "Tenant store {} failed for key {} after retries: {}", operation, key, e.getMessage());
      throw new StorageUnavailableException(
          String.format("Tenant store %s failed for key %s", operation, key), e);
    }
  }

  /** Walks a key snapshot and fetches values one batch at a time. */
  private class ScanIterator implements Iterator<TenantEntry> {

    private final String tenantId;
    private final EntityType entityType;
    private final String prefix;
    private final List<String> keys;
    private final List<TenantEntry> buffer = new ArrayList<>();
    private int nextKey;
    private int nextBuffered;

    ScanIterator(String tenantId, EntityType entityType, String prefix, List<String> keys) {
      this.tenantId = tenantId;
      this.entityType = entityType;
      this.prefix = prefix;
      this.keys = keys;
    }

    @Override
    public boolean hasNext() {
      while (nextBuffered >= buffer.size() && nextKey < keys.size()) {
        fill();
      }
      return nextBuffered < buffer.size();
    }

    @Override
    public TenantEntry next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return buffer.get(nextBuffered++);
    }

    private void fill() {
      buffer.clear();
      nextBuffered = 0;
      List<String> batch = keys.subList(nextKey, Math.min(keys.size(), nextKey + scanBatchSize));
      nextKey += batch.size();
      List<String> values = execute("mget", prefix, () -> redis.opsForValue().multiGet(batch));
      for (int i = 0; i < batch.size(); i++) {
        String value = values == null || i >= values.size() ? null : values.get(i);
        if (value != null) {
          buffer.add(new TenantEntry(TenantKey.parse(tenantId, entityType, batch.get(i)), value));
        }
      }
    }
  }
}
