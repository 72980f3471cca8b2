package com.gentoro.autotag.exception;

/** Failures while copying a file or running the external metadata tool. */
public class MetadataWriteException extends AutoTagException {
  public MetadataWriteException(String message) {
    super(AutoTagErrorCode.WRITE_ERROR, message);
  }

  public MetadataWriteException(String message, Throwable cause) {
    super(AutoTagErrorCode.WRITE_ERROR, message, cause);
  }
}
