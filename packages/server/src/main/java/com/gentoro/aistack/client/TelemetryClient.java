package com.gentoro.aistack.client;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.apis.telemetry.LogEventRequest;
import com.gentoro.aistack.apis.telemetry.Telemetry;
import com.gentoro.aistack.apis.telemetry.Trace;
import com.gentoro.aistack.apis.telemetry.TraceRef;
import com.gentoro.aistack.provider.Api;

public class TelemetryClient extends TransportClient implements Telemetry {
  public TelemetryClient(CapabilityTransport transport) {
    super(transport);
  }

  @Override
  public void logEvent(LogEventRequest request) {
    transport.invoke(Api.TELEMETRY, LOG_EVENT, request, Empty.class);
  }

  @Override
  public Trace getTrace(TraceRef ref) {
    return transport.invoke(Api.TELEMETRY, GET_TRACE, ref, Trace.class);
  }
}
