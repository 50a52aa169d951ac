package com.gentoro.aistack.exception;

/** A prompt template could not be loaded or rendered. */
public class PromptException extends StackException {
  public PromptException(String message) {
    super(StackErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(StackErrorCode.PROMPT_ERROR, message, cause);
  }
}
