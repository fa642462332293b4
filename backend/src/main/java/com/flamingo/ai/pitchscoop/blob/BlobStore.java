package com.flamingo.ai.pitchscoop.blob;

import com.flamingo.ai.pitchscoop.domain.model.BlobHandle;
import com.flamingo.ai.pitchscoop.domain.model.SignedUrl;
import java.io.InputStream;
import java.time.Duration;

/** Storage for recorded audio with time-limited signed access. */
public interface BlobStore {

  /**
   * Stores audio bytes for a session.
   *
   * @param format file extension of the audio, e.g. {@code wav}
   * @return handle to record on the session once this call returns
   */
  BlobHandle put(String tenantId, String sessionId, byte[] bytes, String format);

  /** Issues a URL that grants read access until {@code now + ttl}. */
  SignedUrl sign(BlobHandle handle, Duration ttl);

  /** Checks a signature produced by {@link #sign}. Expired or tampered tokens fail. */
  boolean verify(String objectKey, long expiresAtEpochSecond, String signature);

  boolean exists(BlobHandle handle);

  InputStream open(BlobHandle handle);
}
