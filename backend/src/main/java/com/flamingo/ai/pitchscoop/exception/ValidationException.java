package com.flamingo.ai.pitchscoop.exception;

/** Exception thrown when caller input is invalid. */
public class ValidationException extends PitchScoopException {

  public ValidationException(String message) {
    super(ErrorKind.VALIDATION_ERROR, message, message);
  }
}
