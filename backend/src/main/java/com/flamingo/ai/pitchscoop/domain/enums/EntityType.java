package com.flamingo.ai.pitchscoop.domain.enums;

/** Entity namespaces permitted in the tenant store. */
public enum EntityType {
  SESSION("session"),
  SCORE("score"),
  INDEX("index");

  private final String segment;

  EntityType(String segment) {
    this.segment = segment;
  }

  /** Key segment used between the tenant id and the entity id. */
  public String getSegment() {
    return segment;
  }
}
