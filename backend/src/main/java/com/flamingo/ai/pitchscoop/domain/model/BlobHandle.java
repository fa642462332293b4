package com.flamingo.ai.pitchscoop.domain.model;

/** Reference to a stored audio object. */
public record BlobHandle(
    String tenantId, String sessionId, String objectKey, String format, long sizeBytes) {}
