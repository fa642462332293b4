package com.flamingo.ai.pitchscoop.blob;

import com.flamingo.ai.pitchscoop.exception.StorageUnavailableException;

/** Exception thrown when the blob store cannot read or write an object. */
public class BlobStorageException extends StorageUnavailableException {

  private final String objectKey;

  public BlobStorageException(String objectKey, String message, Throwable cause) {
    super(message, cause);
    this.objectKey = objectKey;
  }

  public String getObjectKey() {
    return objectKey;
  }
}
