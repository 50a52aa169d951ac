package com.gentoro.aistack.exception;

/** I/O operation failed (filesystem, classpath, streams). */
public class IoException extends StackException {
  public IoException(String message) {
    super(StackErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(StackErrorCode.IO_ERROR, message, cause);
  }
}
