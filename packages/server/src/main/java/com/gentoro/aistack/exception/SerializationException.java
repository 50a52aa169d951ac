package com.gentoro.aistack.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends StackException {
  public SerializationException(String message) {
    super(StackErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(StackErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
