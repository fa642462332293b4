package com.flamingo.ai.pitchscoop.store;

import com.flamingo.ai.pitchscoop.domain.enums.EntityType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Tenant store held in process memory. Honours TTLs lazily on read and scan. */
@Component
@ConditionalOnProperty(name = "pitchscoop.store.backend", havingValue = "memory")
@Slf4j
public class InMemoryTenantStore implements TenantStore {

  private final ConcurrentSkipListMap<String, StoredValue> values = new ConcurrentSkipListMap<>();
  private final Clock clock;

  @Autowired
  public InMemoryTenantStore() {
    this(Clock.systemUTC());
  }

  public InMemoryTenantStore(Clock clock) {
    this.clock = clock;
    log.info("Using in-memory tenant store; data is lost on restart");
  }

  @Override
  public void put(
      String tenantId, EntityType entityType, String entityId, String value, Duration ttl) {
    String key = TenantKey.of(tenantId, entityType, entityId).render();
    Instant expiresAt =
        ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
    values.put(key, new StoredValue(value, expiresAt));
  }

  @Override
  public Optional<String> find(String tenantId, EntityType entityType, String entityId) {
    String key = TenantKey.of(tenantId, entityType, entityId).render();
    return Optional.ofNullable(live(key, values.get(key)));
  }

  @Override
  public boolean delete(String tenantId, EntityType entityType, String entityId) {
    String key = TenantKey.of(tenantId, entityType, entityId).render();
    StoredValue removed = values.remove(key);
    return removed != null && !removed.isExpired(clock.instant());
  }

  @Override
  public Iterable<TenantEntry> scanPrefix(
      String tenantId, EntityType entityType, String subPrefix) {
    String prefix = TenantKey.prefix(tenantId, entityType, subPrefix);
    return () -> {
      List<TenantEntry> snapshot = new ArrayList<>();
      for (Map.Entry<String, StoredValue> entry : values.tailMap(prefix, true).entrySet()) {
        if (!entry.getKey().startsWith(prefix)) {
          break;
        }
        String value = live(entry.getKey(), entry.getValue());
        if (value != null) {
          snapshot.add(
              new TenantEntry(TenantKey.parse(tenantId, entityType, entry.getKey()), value));
        }
      }
      return snapshot.iterator();
    };
  }

  private String live(String key, StoredValue stored) {
    if (stored == null) {
      return null;
    }
    if (stored.isExpired(clock.instant())) {
      values.remove(key, stored);
      return null;
    }
    return stored.value();
  }

  private record StoredValue(String value, Instant expiresAt) {
    boolean isExpired(Instant now) {
      return expiresAt != null && !now.isBefore(expiresAt);
    }
  }
}
