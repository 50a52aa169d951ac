package com.gentoro.aistack.apis.telemetry;

public interface Telemetry {
  String LOG_EVENT = "log_event";
  String GET_TRACE = "get_trace";

  void logEvent(LogEventRequest request);

  Trace getTrace(TraceRef ref);
}
