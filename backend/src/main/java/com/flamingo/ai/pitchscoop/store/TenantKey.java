package com.flamingo.ai.pitchscoop.store;

import com.flamingo.ai.pitchscoop.domain.enums.EntityType;
import com.flamingo.ai.pitchscoop.exception.ValidationException;

/**
 * Fully qualified store key {@code tenantId:entityType:entityId}. The tenant segment may not
 * contain separators or glob characters, so a key can never address another tenant's data.
 */
public record TenantKey(String tenantId, EntityType entityType, String entityId) {

  public static final char SEPARATOR = ':';

  public TenantKey {
    validateTenantId(tenantId);
    if (entityType == null) {
      throw new ValidationException("Entity type is required");
    }
    if (entityId == null || entityId.isBlank()) {
      throw new ValidationException("Entity id must not be blank");
    }
    if (containsGlob(entityId)) {
      throw new ValidationException("Entity id contains reserved characters: " + entityId);
    }
  }

  public static TenantKey of(String tenantId, EntityType entityType, String entityId) {
    return new TenantKey(tenantId, entityType, entityId);
  }

  /** Rendered key as stored by the backend. */
  public String render() {
    return tenantId + SEPARATOR + entityType.getSegment() + SEPARATOR + entityId;
  }

  /**
   * Literal prefix shared by all keys of a tenant and entity type, optionally narrowed by a
   * sub-prefix of the entity id.
   */
  public static String prefix(String tenantId, EntityType entityType, String subPrefix) {
    validateTenantId(tenantId);
    String sub = subPrefix == null ? "" : subPrefix;
    if (containsGlob(sub)) {
      throw new ValidationException("Scan prefix contains reserved characters: " + sub);
    }
    return tenantId + SEPARATOR + entityType.getSegment() + SEPARATOR + sub;
  }

  /** Parses a rendered key that is known to belong to {@code tenantId} and {@code entityType}. */
  public static TenantKey parse(String tenantId, EntityType entityType, String rendered) {
    String prefix = prefix(tenantId, entityType, null);
    if (rendered == null || !rendered.startsWith(prefix)) {
      throw new IllegalArgumentException("Key " + rendered + " is outside prefix " + prefix);
    }
    return new TenantKey(tenantId, entityType, rendered.substring(prefix.length()));
  }

  static void validateTenantId(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new ValidationException("Tenant id must not be blank");
    }
    if (tenantId.indexOf(SEPARATOR) >= 0 || containsGlob(tenantId)) {
      throw new ValidationException("Tenant id contains reserved characters: " + tenantId);
    }
  }

  private static boolean containsGlob(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
        return true;
      }
    }
    return false;
  }
}
