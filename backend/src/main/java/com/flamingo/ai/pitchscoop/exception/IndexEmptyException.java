package com.flamingo.ai.pitchscoop.exception;

import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;

/** Internal signal that a retrieval index holds no documents for the tenant. */
public class IndexEmptyException extends PitchScoopException {

  public IndexEmptyException(String tenantId, DocumentType documentType) {
    super(
        ErrorKind.INDEX_EMPTY,
        String.format("No %s documents indexed for tenant %s", documentType.getValue(), tenantId),
        "No reference material has been indexed yet");
  }
}
