package com.gentoro.aistack.exception;

import java.util.Map;

/**
 * The router could not serve the call: no provider bound, unknown operation or shield, or the
 * adapter answered with a result that does not match the declared contract shape. Never retried by
 * the core.
 */
public class RoutingException extends StackException {
  public RoutingException(StackErrorCode code, String message) {
    super(code, message);
  }

  public RoutingException(StackErrorCode code, String message, Map<String, ?> context) {
    super(code, message, context);
  }
}
