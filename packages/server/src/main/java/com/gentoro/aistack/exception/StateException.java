package com.gentoro.aistack.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends StackException {
  public StateException(String message) {
    super(StackErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(StackErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
