package com.flamingo.ai.pitchscoop.service.transcription;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptionChannel;
import com.flamingo.ai.pitchscoop.exception.TranscriptionException;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Gladia live API client. {@code POST /v2/live} opens a channel; {@code GET /v2/live/{id}}
 * returns the post-processed utterances once the provider is done.
 */
@Service
@Slf4j
public class GladiaTranscriptionGateway implements TranscriptionGateway {

  static final String API_KEY_HEADER = "X-Gladia-Key";
  static final String LIVE_PATH = "/v2/live";

  private final WebClient webClient;
  private final PitchScoopProperties.Transcription config;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public GladiaTranscriptionGateway(
      WebClient.Builder webClientBuilder,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry) {
    this(webClientBuilder, properties, meterRegistry, Clock.systemUTC());
  }

  public GladiaTranscriptionGateway(
      WebClient.Builder webClientBuilder,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.config = properties.getTranscription();
    this.webClient =
        webClientBuilder
            .baseUrl(config.getBaseUrl())
            .defaultHeader(API_KEY_HEADER, config.getApiKey())
            .build();
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  @Timed(value = "transcription.openChannel", description = "Time to open a live channel")
  public TranscriptionChannel openChannel(String tenantId, String sessionId) {
    log.info("Opening Gladia channel for session {} in tenant {}", sessionId, tenantId);

    JsonNode response;
    try {
      response =
          webClient
              .post()
              .uri(LIVE_PATH)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(audioConfiguration())
              .retrieve()
              .bodyToMono(JsonNode.class)
              .block(config.getRequestTimeout());
    } catch (WebClientResponseException e) {
      meterRegistry.counter("transcription.channel.failure", "reason", "http").increment();
      throw new TranscriptionException(
          String.format(
              "Gladia refused channel for session %s: HTTP %d",
              sessionId, e.getStatusCode().value()),
          e);
    } catch (RuntimeException e) {
      meterRegistry.counter("transcription.channel.failure", "reason", "io").increment();
      throw new TranscriptionException(
          "Gladia channel request failed for session " + sessionId + ": " + e.getMessage(), e);
    }

    String channelId = text(response, "id");
    String url = text(response, "url");
    if (channelId == null || url == null) {
      meterRegistry.counter("transcription.channel.failure", "reason", "response").increment();
      throw new TranscriptionException(
          "Gladia response for session " + sessionId + " lacks a channel id or url");
    }

    meterRegistry.counter("transcription.channel.opened").increment();
    log.info("Opened Gladia channel {} for session {}", channelId, sessionId);
    return new TranscriptionChannel(channelId, url, clock.instant());
  }

  @Override
  @Timed(value = "transcription.finalize", description = "Time to finalize a transcript")
  public List<TranscriptSegment> finalizeTranscript(
      TranscriptionChannel channel, List<TranscriptSegment> liveSegments) {
    List<TranscriptSegment> live = liveSegments == null ? List.of() : List.copyOf(liveSegments);
    if (channel == null) {
      return live;
    }

    JsonNode response;
    try {
      response =
          webClient
              .get()
              .uri(LIVE_PATH + "/{id}", channel.channelId())
              .retrieve()
              .bodyToMono(JsonNode.class)
              .block(config.getRequestTimeout());
    } catch (RuntimeException e) {
      meterRegistry.counter("transcription.finalize.failure").increment();
      throw new TranscriptionException(
          "Failed to fetch Gladia result for channel " + channel.channelId(), live, e);
    }

    if ("error".equalsIgnoreCase(text(response, "status"))) {
      meterRegistry.counter("transcription.finalize.failure").increment();
      throw new TranscriptionException(
          "Gladia reported an error for channel " + channel.channelId(), live, null);
    }

    List<TranscriptSegment> utterances = parseUtterances(response);
    if (utterances.isEmpty()) {
      log.debug(
          "No utterances from Gladia for channel {}, keeping {} live segments",
          channel.channelId(),
          live.size());
      return live;
    }
    log.info(
        "Finalized channel {} with {} provider utterances", channel.channelId(), utterances.size());
    return utterances;
  }

  private Map<String, Object> audioConfiguration() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("encoding", config.getEncoding());
    body.put("sample_rate", config.getSampleRate());
    body.put("bit_depth", config.getBitDepth());
    body.put("channels", config.getChannels());
    if (config.getLanguage() != null && !config.getLanguage().isBlank()) {
      body.put("language_config", Map.of("languages", List.of(config.getLanguage())));
    }
    return body;
  }

  private List<TranscriptSegment> parseUtterances(JsonNode response) {
    List<TranscriptSegment> segments = new ArrayList<>();
    if (response == null) {
      return segments;
    }
    JsonNode utterances = response.path("result").path("transcription").path("utterances");
    for (JsonNode utterance : utterances) {
      String text = utterance.path("text").asText("");
      if (text.isBlank()) {
        continue;
      }
      double start = Math.max(0.0, utterance.path("start").asDouble(0.0));
      double end = Math.max(start, utterance.path("end").asDouble(start));
      Double confidence =
          utterance.hasNonNull("confidence")
              ? Math.min(1.0, Math.max(0.0, utterance.get("confidence").asDouble()))
              : null;
      try {
        segments.add(new TranscriptSegment(text, start, end, confidence, true));
      } catch (ValidationException e) {
        log.warn("Skipping invalid Gladia utterance: {}", e.getMessage());
      }
    }
    return segments;
  }

  private static String text(JsonNode node, String field) {
    if (node == null || !node.hasNonNull(field)) {
      return null;
    }
    String value = node.get(field).asText();
    return value.isBlank() ? null : value;
  }
}
