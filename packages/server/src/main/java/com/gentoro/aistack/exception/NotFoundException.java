package com.gentoro.aistack.exception;

import java.util.Map;

/** Resource requested was not found (memory bank, agent, session, trace). */
public class NotFoundException extends StackException {
  public NotFoundException(String message) {
    super(StackErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(StackErrorCode.NOT_FOUND, message, context);
  }
}
