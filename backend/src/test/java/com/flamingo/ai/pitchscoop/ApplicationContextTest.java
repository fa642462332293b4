package com.flamingo.ai.pitchscoop;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import com.flamingo.ai.pitchscoop.service.pipeline.PitchPipeline;
import com.flamingo.ai.pitchscoop.service.ranking.LeaderboardService;
import com.flamingo.ai.pitchscoop.service.retrieval.RetrievalIndex;
import com.flamingo.ai.pitchscoop.service.retrieval.StoreBackedRetrievalIndex;
import com.flamingo.ai.pitchscoop.service.scoring.ScoringOrchestrator;
import com.flamingo.ai.pitchscoop.service.scoring.ScoringTier;
import com.flamingo.ai.pitchscoop.service.session.SessionService;
import com.flamingo.ai.pitchscoop.store.InMemoryTenantStore;
import com.flamingo.ai.pitchscoop.store.TenantStore;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.Comparator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the application context wires with the in-memory store and store-backed retrieval.
 * The OpenAI models are mocked so no API key or network is needed.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core pipeline beans should be available")
  void corePipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(PitchPipeline.class)).isNotNull();
    assertThat(applicationContext.getBean(SessionService.class)).isNotNull();
    assertThat(applicationContext.getBean(ScoringOrchestrator.class)).isNotNull();
    assertThat(applicationContext.getBean(LeaderboardService.class)).isNotNull();
  }

  @Test
  @DisplayName("Configured backends should be selected")
  void configuredBackendsShouldBeSelected() {
    assertThat(applicationContext.getBean(TenantStore.class))
        .isInstanceOf(InMemoryTenantStore.class);
    assertThat(applicationContext.getBean(RetrievalIndex.class))
        .isInstanceOf(StoreBackedRetrievalIndex.class);
  }

  @Test
  @DisplayName("Scoring chain should hold all three tiers in fallback order")
  void scoringChainShouldHoldAllTiers() {
    assertThat(
            applicationContext.getBeansOfType(ScoringTier.class).values().stream()
                .sorted(Comparator.comparingInt(ScoringTier::order))
                .map(ScoringTier::method))
        .containsExactly(
            ScoringMethod.RAG_ENHANCED, ScoringMethod.STRUCTURED_LLM, ScoringMethod.HEURISTIC);
  }
}
