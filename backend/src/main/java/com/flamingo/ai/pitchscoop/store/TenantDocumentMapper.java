package com.flamingo.ai.pitchscoop.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pitchscoop.exception.ErrorKind;
import com.flamingo.ai.pitchscoop.exception.PitchScoopException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** JSON encoding of entities kept in the tenant store. */
@Component
@RequiredArgsConstructor
public class TenantDocumentMapper {

  private static final String USER_MESSAGE = "Stored data could not be processed";

  private final ObjectMapper objectMapper;

  public String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new PitchScoopException(
          ErrorKind.INTERNAL_ERROR,
          "Failed to serialize " + value.getClass().getSimpleName(),
          USER_MESSAGE,
          e);
    }
  }

  public <T> T read(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new PitchScoopException(
          ErrorKind.INTERNAL_ERROR,
          "Failed to deserialize " + type.getSimpleName() + ": " + e.getOriginalMessage(),
          USER_MESSAGE,
          e);
    }
  }
}
