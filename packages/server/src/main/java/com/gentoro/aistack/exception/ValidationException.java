package com.gentoro.aistack.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends StackException {
  public ValidationException(String message) {
    super(StackErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(StackErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
