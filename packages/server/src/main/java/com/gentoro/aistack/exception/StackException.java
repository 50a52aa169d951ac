package com.gentoro.aistack.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the stack with a stable {@link StackErrorCode} and optional context.
 *
 * <p>The context map is exposed read-only. The router adds the originating capability group and
 * provider id through {@link #annotate(String, Object)} before re-raising a failure; annotations
 * never overwrite a key that is already present.
 */
public class StackException extends RuntimeException {
  private final StackErrorCode code;
  private final Map<String, Object> context;

  public StackException(StackErrorCode code, String message) {
    this(code, message, null, null);
  }

  public StackException(StackErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public StackException(StackErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public StackException(
      StackErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = new LinkedHashMap<>();
    if (context != null) {
      context.forEach(this.context::put);
    }
  }

  public StackErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    synchronized (context) {
      return Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
  }

  public StackException annotate(String key, Object value) {
    if (key != null && value != null) {
      synchronized (context) {
        context.putIfAbsent(key, value);
      }
    }
    return this;
  }

  @Override
  public String toString() {
    Map<String, Object> ctx = getContext();
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + getMessage()
        + (ctx.isEmpty() ? "" : ", context=" + ctx)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
