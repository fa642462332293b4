package com.flamingo.ai.pitchscoop.domain.model;

import java.time.Instant;

/** Time-limited access URL for a stored blob. */
public record SignedUrl(String url, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
