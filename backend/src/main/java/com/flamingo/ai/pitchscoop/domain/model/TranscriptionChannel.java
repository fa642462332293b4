package com.flamingo.ai.pitchscoop.domain.model;

import java.time.Instant;

/** Live transcription channel obtained from the speech-to-text provider. */
public record TranscriptionChannel(String channelId, String streamUrl, Instant openedAt) {}
