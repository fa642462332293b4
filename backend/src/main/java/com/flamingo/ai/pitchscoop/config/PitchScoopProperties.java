package com.flamingo.ai.pitchscoop.config;

import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the pitch pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pitchscoop")
@Validated
@Getter
@Setter
public class PitchScoopProperties {

  @Valid private Store store = new Store();
  @Valid private Blob blob = new Blob();
  @Valid private Transcription transcription = new Transcription();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Scoring scoring = new Scoring();
  @Valid private Ranking ranking = new Ranking();

  @Getter
  @Setter
  public static class Store {
    /** {@code redis} or {@code memory}. */
    @Pattern(regexp = "redis|memory")
    private String backend = "redis";

    @NotNull private Duration sessionTtl = Duration.ofDays(30);
    @NotNull private Duration scoreTtl = Duration.ofDays(30);

    /** Zero keeps index documents until deleted. */
    @NotNull private Duration indexTtl = Duration.ZERO;

    /** Keys fetched per round trip while scanning. */
    @Positive private int scanBatchSize = 100;
  }

  @Getter
  @Setter
  public static class Blob {
    @NotBlank private String rootDir = "./data/audio";
    @NotBlank private String publicBaseUrl = "http://localhost:8080/audio";
    @NotBlank private String signingSecret = "change-me";
    @NotNull private Duration defaultUrlTtl = Duration.ofHours(1);
  }

  @Getter
  @Setter
  public static class Transcription {
    @NotBlank private String baseUrl = "https://api.gladia.io";
    private String apiKey = "";
    @NotNull private Duration requestTimeout = Duration.ofSeconds(15);
    @NotNull private Duration finalizeTimeout = Duration.ofSeconds(30);
    @NotBlank private String encoding = "wav/pcm";
    @Positive private int sampleRate = 16000;
    @Positive private int bitDepth = 16;
    @Positive private int channels = 1;
    @NotBlank private String language = "en";
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** {@code store} or {@code elasticsearch}. */
    @Pattern(regexp = "store|elasticsearch")
    private String backend = "store";

    @Min(1)
    @Max(50)
    private int topK = 5;

    @NotBlank private String indexPrefix = "pitchscoop";
    @Positive private int embeddingDimensions = 1536;

    /** Characters per rubric chunk. */
    @Min(100)
    private int chunkSize = 1200;
  }

  @Getter
  @Setter
  public static class Scoring {
    @NotNull private Duration ragTimeout = Duration.ofSeconds(60);
    @NotNull private Duration structuredTimeout = Duration.ofSeconds(45);
    @NotNull private Duration heuristicTimeout = Duration.ofSeconds(5);

    @NotNull private ConcurrencyPolicy concurrencyPolicy = ConcurrencyPolicy.JOIN;
    private boolean autoScoreOnComplete = true;
    private boolean heuristicEnabled = true;

    /** Benchmark speaking rate for a three-minute pitch. */
    @Positive private int targetWordsPerMinute = 150;

    @NotNull
    private List<String> sponsorTools =
        new ArrayList<>(
            List.of(
                "OpenAI", "Azure OpenAI", "Redis", "RedisVL", "MinIO", "Gladia", "Qdrant",
                "LlamaIndex", "Bright Data", "Elasticsearch"));
  }

  @Getter
  @Setter
  public static class Ranking {
    @NotNull private ScoreCategory tieBreakCategory = ScoreCategory.TOOLS;
    @Positive private int cacheMaxTenants = 500;
    @NotNull private Duration cacheTtl = Duration.ofMinutes(10);
  }

  /** What a second caller gets while a session is already being scored. */
  public enum ConcurrencyPolicy {
    JOIN,
    REJECT
  }
}
