package com.gentoro.aistack.exception;

/** Feature or operation is not supported by the selected provider. */
public class UnsupportedFeatureException extends StackException {
  public UnsupportedFeatureException(String message) {
    super(StackErrorCode.UNSUPPORTED_FEATURE, message);
  }

  public UnsupportedFeatureException(String message, Throwable cause) {
    super(StackErrorCode.UNSUPPORTED_FEATURE, message, cause);
  }
}
