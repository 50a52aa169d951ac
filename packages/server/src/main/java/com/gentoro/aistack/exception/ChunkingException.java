package com.gentoro.aistack.exception;

import java.util.Map;

/** Documents could not be chunked or inserted into a memory bank. */
public class ChunkingException extends StackException {
  public ChunkingException(String message) {
    super(StackErrorCode.CHUNKING_ERROR, message);
  }

  public ChunkingException(String message, Throwable cause) {
    super(StackErrorCode.CHUNKING_ERROR, message, cause);
  }

  public ChunkingException(StackErrorCode code, String message, Map<String, ?> context) {
    super(code, message, context);
  }
}
