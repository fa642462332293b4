package com.flamingo.ai.pitchscoop.service.session.event;

import java.time.Instant;

/** Published once a session reaches {@code completed} with a frozen transcript. */
public record SessionCompletedEvent(String tenantId, String sessionId, Instant completedAt) {}
