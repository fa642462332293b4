package com.flamingo.ai.pitchscoop.blob;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.model.BlobHandle;
import com.flamingo.ai.pitchscoop.domain.model.SignedUrl;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileSystemBlobStore")
class FileSystemBlobStoreTest {

  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

  @TempDir Path root;

  private PitchScoopProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private FileSystemBlobStore store;

  @BeforeEach
  void setUp() {
    properties = new PitchScoopProperties();
    properties.getBlob().setRootDir(root.toString());
    properties.getBlob().setPublicBaseUrl("https://audio.example.com/");
    properties.getBlob().setSigningSecret("secret");
    meterRegistry = new SimpleMeterRegistry();
    store = storeAt(NOW);
  }

  @Test
  void shouldStoreAudio_underTenantAndSessionPrefix() throws Exception {
    // When
    BlobHandle handle = store.put("acme", "s-1", new byte[] {1, 2, 3}, "WAV");

    // Then
    assertThat(handle.objectKey()).isEqualTo("acme/s-1/" + NOW.toEpochMilli() + ".wav");
    assertThat(handle.sizeBytes()).isEqualTo(3);
    assertThat(store.exists(handle)).isTrue();
    try (InputStream in = store.open(handle)) {
      assertThat(in.readAllBytes()).containsExactly(1, 2, 3);
    }
    assertThat(meterRegistry.counter("blob.put.success").count()).isEqualTo(1.0);
  }

  @Test
  void shouldRejectEmptyPayloads_andOddFormats() {
    assertThatThrownBy(() -> store.put("acme", "s-1", new byte[0], "wav"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> store.put("acme", "s-1", new byte[] {1}, "../x"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldRejectObjectKeys_thatEscapeTheRoot() {
    BlobHandle evil = new BlobHandle("acme", "s-1", "../../etc/passwd", "wav", 1);

    assertThatThrownBy(() -> store.exists(evil)).isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldIssueSignedUrl_thatVerifiesUntilExpiry() {
    // Given
    BlobHandle handle = store.put("acme", "s-1", new byte[] {1}, "wav");

    // When
    SignedUrl url = store.sign(handle, Duration.ofMinutes(10));

    // Then
    long expires = NOW.plus(Duration.ofMinutes(10)).getEpochSecond();
    assertThat(url.url())
        .startsWith("https://audio.example.com/" + handle.objectKey() + "?expires=" + expires);
    assertThat(url.expiresAt()).isEqualTo(Instant.ofEpochSecond(expires));
    String signature = url.url().substring(url.url().indexOf("signature=") + "signature=".length());
    assertThat(store.verify(handle.objectKey(), expires, signature)).isTrue();
    assertThat(store.verify("acme/s-2/other.wav", expires, signature)).isFalse();
    assertThat(store.verify(handle.objectKey(), expires + 1, signature)).isFalse();

    FileSystemBlobStore later = storeAt(NOW.plus(Duration.ofMinutes(11)));
    assertThat(later.verify(handle.objectKey(), expires, signature)).isFalse();
  }

  @Test
  void shouldRejectNonPositiveTtl() {
    BlobHandle handle = new BlobHandle("acme", "s-1", "acme/s-1/1.wav", "wav", 1);

    assertThatThrownBy(() -> store.sign(handle, Duration.ZERO))
        .isInstanceOf(ValidationException.class);
  }

  private FileSystemBlobStore storeAt(Instant instant) {
    return new FileSystemBlobStore(properties, meterRegistry, Clock.fixed(instant, ZoneOffset.UTC));
  }
}
