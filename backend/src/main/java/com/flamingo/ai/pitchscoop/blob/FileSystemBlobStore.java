package com.flamingo.ai.pitchscoop.blob;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.model.BlobHandle;
import com.flamingo.ai.pitchscoop.domain.model.SignedUrl;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Blob store on the local file system. Objects live at {@code {root}/{tenant}/{session}/
 * {timestamp}.{format}}; signed URLs carry an HMAC-SHA256 over {@code objectKey|expiresAt}.
 */
@Service
@Slf4j
public class FileSystemBlobStore implements BlobStore {

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final Pattern FORMAT = Pattern.compile("[a-z0-9]{1,8}");

  private final Path root;
  private final String publicBaseUrl;
  private final byte[] signingKey;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public FileSystemBlobStore(PitchScoopProperties properties, MeterRegistry meterRegistry) {
    this(properties, meterRegistry, Clock.systemUTC());
  }

  public FileSystemBlobStore(
      PitchScoopProperties properties, MeterRegistry meterRegistry, Clock clock) {
    PitchScoopProperties.Blob blob = properties.getBlob();
    this.root = Path.of(blob.getRootDir()).toAbsolutePath().normalize();
    this.publicBaseUrl = stripTrailingSlash(blob.getPublicBaseUrl());
    this.signingKey = blob.getSigningSecret().getBytes(StandardCharsets.UTF_8);
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  @Timed(value = "blob.put", description = "Time to store an audio blob")
  public BlobHandle put(String tenantId, String sessionId, byte[] bytes, String format) {
    if (bytes == null || bytes.length == 0) {
      throw new ValidationException("Audio payload must not be empty");
    }
    String normalizedFormat = format == null ? "" : format.toLowerCase(Locale.ROOT);
    if (!FORMAT.matcher(normalizedFormat).matches()) {
      throw new ValidationException("Unsupported audio format: " + format);
    }
    String objectKey =
        tenantId + "/" + sessionId + "/" + clock.millis() + "." + normalizedFormat;
    Path target = resolve(objectKey);

    try {
      Files.createDirectories(target.getParent());
      Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      Files.write(temp, bytes);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      meterRegistry.counter("blob.put.failure").increment();
      throw new BlobStorageException(objectKey, "Failed to store audio " + objectKey, e);
    }

    meterRegistry.counter("blob.put.success").increment();
    log.info(
        "Stored audio for session {} in tenant {}: {} ({} bytes)",
        sessionId,
        tenantId,
        objectKey,
        bytes.length);
    return new BlobHandle(tenantId, sessionId, objectKey, normalizedFormat, bytes.length);
  }

  @Override
  public SignedUrl sign(BlobHandle handle, Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new ValidationException("Signed URL TTL must be positive");
    }
    Instant expiresAt = clock.instant().plus(ttl);
    long expires = expiresAt.getEpochSecond();
    String signature = signature(handle.objectKey(), expires);
    String url =
        publicBaseUrl
            + "/"
            + handle.objectKey()
            + "?expires="
            + expires
            + "&signature="
            + signature;
    return new SignedUrl(url, Instant.ofEpochSecond(expires));
  }

  @Override
  public boolean verify(String objectKey, long expiresAtEpochSecond, String signature) {
    if (objectKey == null || signature == null) {
      return false;
    }
    if (clock.instant().getEpochSecond() >= expiresAtEpochSecond) {
      return false;
    }
    byte[] expected =
        signature(objectKey, expiresAtEpochSecond).getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.US_ASCII));
  }

  @Override
  public boolean exists(BlobHandle handle) {
    return Files.isRegularFile(resolve(handle.objectKey()));
  }

  @Override
  public InputStream open(BlobHandle handle) {
    try {
      return Files.newInputStream(resolve(handle.objectKey()));
    } catch (IOException e) {
      throw new BlobStorageException(
          handle.objectKey(), "Failed to open audio " + handle.objectKey(), e);
    }
  }

  private Path resolve(String objectKey) {
    Path path = root.resolve(objectKey).normalize();
    if (!path.startsWith(root)) {
      throw new ValidationException("Object key escapes the blob root: " + objectKey);
    }
    return path;
  }

  private String signature(String objectKey, long expires) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(signingKey, HMAC_ALGORITHM));
      byte[] digest = mac.doFinal((objectKey + "|" + expires).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 is not available", e);
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
