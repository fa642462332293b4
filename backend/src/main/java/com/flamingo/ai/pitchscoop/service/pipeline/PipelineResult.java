package com.flamingo.ai.pitchscoop.service.pipeline;

import com.flamingo.ai.pitchscoop.exception.ApiError;
import java.util.NoSuchElementException;

/**
 * Outcome of a pipeline call: exactly one of {@code value} and {@code error} is set.
 *
 * @param <T> type of the successful value
 */
public record PipelineResult<T>(T value, ApiError error) {

  public static <T> PipelineResult<T> ok(T value) {
    return new PipelineResult<>(value, null);
  }

  public static <T> PipelineResult<T> failure(ApiError error) {
    return new PipelineResult<>(null, error);
  }

  public boolean isOk() {
    return error == null;
  }

  /**
   * @throws NoSuchElementException if the call failed
   */
  public T getOrThrow() {
    if (error != null) {
      throw new NoSuchElementException(error.getCode() + ": " + error.getMessage());
    }
    return value;
  }
}
