package com.flamingo.ai.pitchscoop.domain.repository;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.ScoreRecord;
import com.flamingo.ai.pitchscoop.domain.enums.EntityType;
import com.flamingo.ai.pitchscoop.exception.EntityNotFoundException;
import com.flamingo.ai.pitchscoop.store.TenantDocumentMapper;
import com.flamingo.ai.pitchscoop.store.TenantEntry;
import com.flamingo.ai.pitchscoop.store.TenantStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

/** Score records stored under {@code {tenant}:score:{sessionId}}; one per session. */
@Repository
@RequiredArgsConstructor
public class ScoreRecordRepository {

  private final TenantStore tenantStore;
  private final TenantDocumentMapper mapper;
  private final PitchScoopProperties properties;

  /** Writes the record in a single store operation, replacing any previous one. */
  public ScoreRecord save(ScoreRecord record) {
    tenantStore.put(
        record.getTenantId(),
        EntityType.SCORE,
        record.getSessionId(),
        mapper.write(record),
        properties.getStore().getScoreTtl());
    return record;
  }

  public Optional<ScoreRecord> findBySessionId(String tenantId, String sessionId) {
    return tenantStore
        .find(tenantId, EntityType.SCORE, sessionId)
        .map(json -> mapper.read(json, ScoreRecord.class));
  }

  public ScoreRecord getBySessionId(String tenantId, String sessionId) {
    return findBySessionId(tenantId, sessionId)
        .orElseThrow(() -> new EntityNotFoundException(tenantId, "score", sessionId));
  }

  public List<ScoreRecord> findAllByTenant(String tenantId) {
    List<ScoreRecord> records = new ArrayList<>();
    for (TenantEntry entry : tenantStore.scanPrefix(tenantId, EntityType.SCORE)) {
      records.add(mapper.read(entry.value(), ScoreRecord.class));
    }
    return records;
  }
}
