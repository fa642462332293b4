package com.flamingo.ai.pitchscoop.exception;

/** Exception thrown when an entity does not exist within a tenant. */
public class EntityNotFoundException extends PitchScoopException {

  private final String tenantId;
  private final String entityType;
  private final String entityId;

  public EntityNotFoundException(String tenantId, String entityType, String entityId) {
    super(
        ErrorKind.NOT_FOUND,
        String.format("%s not found: %s (tenant %s)", entityType, entityId, tenantId),
        capitalize(entityType) + " not found");
    this.tenantId = tenantId;
    this.entityType = entityType;
    this.entityId = entityId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getEntityId() {
    return entityId;
  }

  private static String capitalize(String value) {
    if (value == null || value.isEmpty()) {
      return "Entity";
    }
    return Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }
}
