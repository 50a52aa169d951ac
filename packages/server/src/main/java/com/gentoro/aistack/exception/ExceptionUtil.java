package com.gentoro.aistack.exception;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link StackException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof StackException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getCode().origin(),
          ex.getContext().isEmpty() ? null : ex.getContext(),
          Instant.now().toString());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        StackErrorCode.UNKNOWN,
        StackErrorCode.UNKNOWN.origin(),
        null,
        Instant.now().toString());
  }

  /**
   * Rebuild the exception a remote stack reported. The exception type follows the error code, so a
   * caller sees the same failure whether the provider ran in-process or behind HTTP.
   */
  public static StackException fromErrorDetails(ErrorDetails details) {
    StackErrorCode code = details.code == null ? StackErrorCode.UNKNOWN : details.code;
    String message = safeMessage(details.message);
    Map<String, Object> context = details.context;
    return switch (code) {
      case CONFIGURATION_ERROR, MISSING_CAPABILITY, UNKNOWN_PROVIDER_KIND, DUPLICATE_BANK ->
          new ConfigException(code, message, context);
      case NO_ACTIVE_PROVIDER, UNKNOWN_OPERATION, UNKNOWN_SHIELD, CONTRACT_VIOLATION ->
          new RoutingException(code, message, context);
      case DUPLICATE_DOCUMENT_ID, CHUNKING_ERROR -> new ChunkingException(code, message, context);
      case NOT_FOUND -> new NotFoundException(message, context);
      case TIMEOUT,
          UPSTREAM_ERROR,
          TRANSPORT_ERROR,
          EXECUTION_ERROR,
          IO_ERROR,
          CANCELLED,
          UNKNOWN ->
          new AdapterException(code, message, context);
      default -> new StackException(code, message, context);
    };
  }

  /**
   * Produce a compact, human-friendly representation of a throwable's stack trace, joined in call
   * order, e.g. {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}.
   *
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static StackException rethrowIfUnchecked(
      Throwable t, Function<Throwable, StackException> supplier) {
    if (t instanceof StackException) {
      return (StackException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
