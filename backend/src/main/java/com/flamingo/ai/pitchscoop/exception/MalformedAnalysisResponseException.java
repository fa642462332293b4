package com.flamingo.ai.pitchscoop.exception;

/**
 * Exception thrown when the analysis capability answers with text that does not match the score
 * schema. Keeps a truncated preview of the raw output for diagnosis.
 */
public class MalformedAnalysisResponseException extends AnalysisCapabilityException {

  private static final int PREVIEW_LENGTH = 200;

  private final String rawPreview;

  public MalformedAnalysisResponseException(String reason, String rawText) {
    super("Malformed analysis response: " + reason);
    this.rawPreview = preview(rawText);
  }

  public MalformedAnalysisResponseException(String reason, String rawText, Throwable cause) {
    super("Malformed analysis response: " + reason, cause);
    this.rawPreview = preview(rawText);
  }

  public String getRawPreview() {
    return rawPreview;
  }

  private static String preview(String rawText) {
    if (rawText == null) {
      return "";
    }
    return rawText.length() > PREVIEW_LENGTH
        ? rawText.substring(0, PREVIEW_LENGTH) + "..."
        : rawText;
  }
}
