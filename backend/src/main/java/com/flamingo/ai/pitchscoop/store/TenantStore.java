package com.flamingo.ai.pitchscoop.store;

import com.flamingo.ai.pitchscoop.domain.enums.EntityType;
import com.flamingo.ai.pitchscoop.exception.EntityNotFoundException;
import com.flamingo.ai.pitchscoop.exception.StorageUnavailableException;
import java.time.Duration;
import java.util.Optional;

/**
 * Tenant-scoped key-value store. Every operation takes the tenant id explicitly and the store
 * composes the physical key, so callers cannot address keys outside their tenant.
 *
 * <p>Connectivity failures are retried inside the store and then surface as {@link
 * StorageUnavailableException}; a missing key is never reported that way.
 */
public interface TenantStore {

  /**
   * Stores a value.
   *
   * @param ttl time to live, {@code null} or zero to keep the value until deleted
   */
  void put(String tenantId, EntityType entityType, String entityId, String value, Duration ttl);

  default void put(String tenantId, EntityType entityType, String entityId, String value) {
    put(tenantId, entityType, entityId, value, null);
  }

  Optional<String> find(String tenantId, EntityType entityType, String entityId);

  /**
   * Returns a value that must exist.
   *
   * @throws EntityNotFoundException if the key is absent in the tenant
   */
  default String get(String tenantId, EntityType entityType, String entityId) {
    return find(tenantId, entityType, entityId)
        .orElseThrow(
            () -> new EntityNotFoundException(tenantId, entityType.getSegment(), entityId));
  }

  /** Deletes a value. Returns whether it existed. */
  boolean delete(String tenantId, EntityType entityType, String entityId);

  /**
   * Lazily enumerates the entries of one entity type in a tenant. Each iteration starts a fresh
   * scan bounded by the keys present when it starts; entries removed mid-scan are skipped.
   *
   * @param subPrefix optional literal prefix of the entity id, e.g. {@code rubric:}
   */
  Iterable<TenantEntry> scanPrefix(String tenantId, EntityType entityType, String subPrefix);

  default Iterable<TenantEntry> scanPrefix(String tenantId, EntityType entityType) {
    return scanPrefix(tenantId, entityType, null);
  }
}
