package com.gentoro.aistack.exception;

import java.util.Map;

/**
 * Configuration or manifest problem. Raised during startup, the process must not start. Specific
 * codes: {@link StackErrorCode#MISSING_CAPABILITY}, {@link StackErrorCode#UNKNOWN_PROVIDER_KIND}
 * and {@link StackErrorCode#DUPLICATE_BANK}.
 */
public class ConfigException extends StackException {
  public ConfigException(String message) {
    super(StackErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(StackErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  public ConfigException(StackErrorCode code, String message, Map<String, ?> context) {
    super(code, message, context);
  }
}
