package com.flamingo.ai.pitchscoop.exception;

/** Exception thrown when the backing store cannot be reached after retries. */
public class StorageUnavailableException extends PitchScoopException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(
        ErrorKind.STORAGE_UNAVAILABLE,
        message,
        "Storage is temporarily unavailable. Please try again.",
        cause);
  }
}
