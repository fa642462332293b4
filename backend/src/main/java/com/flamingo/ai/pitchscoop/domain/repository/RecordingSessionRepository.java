package com.flamingo.ai.pitchscoop.domain.repository;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RecordingSession;
import com.flamingo.ai.pitchscoop.domain.enums.EntityType;
import com.flamingo.ai.pitchscoop.exception.SessionNotFoundException;
import com.flamingo.ai.pitchscoop.store.TenantDocumentMapper;
import com.flamingo.ai.pitchscoop.store.TenantEntry;
import com.flamingo.ai.pitchscoop.store.TenantStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

/** Recording sessions stored under {@code {tenant}:session:{sessionId}}. */
@Repository
@RequiredArgsConstructor
public class RecordingSessionRepository {

  private final TenantStore tenantStore;
  private final TenantDocumentMapper mapper;
  private final PitchScoopProperties properties;

  public RecordingSession save(RecordingSession session) {
    tenantStore.put(
        session.getTenantId(),
        EntityType.SESSION,
        session.getSessionId(),
        mapper.write(session),
        properties.getStore().getSessionTtl());
    return session;
  }

  public Optional<RecordingSession> findById(String tenantId, String sessionId) {
    return tenantStore
        .find(tenantId, EntityType.SESSION, sessionId)
        .map(json -> mapper.read(json, RecordingSession.class));
  }

  public RecordingSession getById(String tenantId, String sessionId) {
    return findById(tenantId, sessionId)
        .orElseThrow(() -> new SessionNotFoundException(tenantId, sessionId));
  }

  /** All sessions of a tenant, oldest first. */
  public List<RecordingSession> findAllByTenant(String tenantId) {
    List<RecordingSession> sessions = new ArrayList<>();
    for (TenantEntry entry : tenantStore.scanPrefix(tenantId, EntityType.SESSION)) {
      sessions.add(mapper.read(entry.value(), RecordingSession.class));
    }
    sessions.sort(
        Comparator.comparing(
                RecordingSession::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(RecordingSession::getSessionId));
    return sessions;
  }
}
