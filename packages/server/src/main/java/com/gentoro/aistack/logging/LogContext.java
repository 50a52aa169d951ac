package com.gentoro.aistack.logging;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;

/**
 * MDC scope that tags every log line emitted while a capability call is being served. Closing it
 * removes only the keys it set.
 */
public final class LogContext implements AutoCloseable {
  private final List<String> keys = new ArrayList<>();

  private LogContext() {}

  public static LogContext forCall(String api, String providerId, String operation) {
    LogContext ctx = new LogContext();
    ctx.put(LoggingService.MDC_API, api);
    ctx.put(LoggingService.MDC_PROVIDER_ID, providerId);
    ctx.put(LoggingService.MDC_OPERATION, operation);
    return ctx;
  }

  private void put(String key, String value) {
    if (value != null) {
      MDC.put(key, value);
      keys.add(key);
    }
  }

  @Override
  public void close() {
    keys.forEach(MDC::remove);
  }
}
