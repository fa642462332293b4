package com.flamingo.ai.pitchscoop.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pitchscoop.domain.enums.EntityType;
import com.flamingo.ai.pitchscoop.exception.EntityNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryTenantStore")
class InMemoryTenantStoreTest {

  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

  private Clock clock;
  private InMemoryTenantStore store;

  @BeforeEach
  void setUp() {
    clock = mock(Clock.class);
    when(clock.instant()).thenReturn(NOW);
    store = new InMemoryTenantStore(clock);
  }

  @Test
  void shouldReturnStoredValue_whenKeyExists() {
    store.put("acme", EntityType.SESSION, "s-1", "{\"a\":1}");

    assertThat(store.find("acme", EntityType.SESSION, "s-1")).contains("{\"a\":1}");
    assertThat(store.get("acme", EntityType.SESSION, "s-1")).isEqualTo("{\"a\":1}");
  }

  @Test
  void shouldIsolateTenants_withIdenticalEntityIds() {
    // Given
    store.put("acme", EntityType.SESSION, "s-1", "acme-value");
    store.put("globex", EntityType.SESSION, "s-1", "globex-value");

    // Then
    assertThat(store.get("acme", EntityType.SESSION, "s-1")).isEqualTo("acme-value");
    assertThat(store.get("globex", EntityType.SESSION, "s-1")).isEqualTo("globex-value");
    assertThat(values(store.scanPrefix("acme", EntityType.SESSION))).containsExactly("acme-value");
  }

  @Test
  void shouldThrowNotFound_whenGettingMissingKey() {
    assertThatThrownBy(() -> store.get("acme", EntityType.SCORE, "missing"))
        .isInstanceOf(EntityNotFoundException.class);
  }

  @Test
  void shouldExpireValues_afterTheirTtl() {
    // Given
    store.put("acme", EntityType.SESSION, "s-1", "v", Duration.ofMinutes(5));

    // When
    when(clock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(6)));

    // Then
    assertThat(store.find("acme", EntityType.SESSION, "s-1")).isEmpty();
    assertThat(store.scanPrefix("acme", EntityType.SESSION)).isEmpty();
  }

  @Test
  void shouldKeepValuesWithoutTtl_indefinitely() {
    store.put("acme", EntityType.SESSION, "s-1", "v", Duration.ZERO);

    when(clock.instant()).thenReturn(NOW.plus(Duration.ofDays(3650)));

    assertThat(store.find("acme", EntityType.SESSION, "s-1")).contains("v");
  }

  @Test
  void shouldScanOnlyTheRequestedTypeAndSubPrefix() {
    // Given
    store.put("acme", EntityType.INDEX, "rubric:1", "r1");
    store.put("acme", EntityType.INDEX, "rubric:2", "r2");
    store.put("acme", EntityType.INDEX, "transcript:1", "t1");
    store.put("acme", EntityType.SESSION, "rubric:3", "s");

    // When
    List<TenantEntry> entries = new ArrayList<>();
    store.scanPrefix("acme", EntityType.INDEX, "rubric:").forEach(entries::add);

    // Then
    assertThat(entries).extracting(TenantEntry::value).containsExactly("r1", "r2");
    assertThat(entries).extracting(e -> e.key().entityId()).containsExactly("rubric:1", "rubric:2");
  }

  @Test
  void shouldReportWhetherDeleteRemovedSomething() {
    store.put("acme", EntityType.SCORE, "s-1", "v");

    assertThat(store.delete("acme", EntityType.SCORE, "s-1")).isTrue();
    assertThat(store.delete("acme", EntityType.SCORE, "s-1")).isFalse();
  }

  private static List<String> values(Iterable<TenantEntry> entries) {
    List<String> values = new ArrayList<>();
    entries.forEach(e -> values.add(e.value()));
    return values;
  }
}
