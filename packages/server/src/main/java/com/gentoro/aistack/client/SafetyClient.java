package com.gentoro.aistack.client;

import com.gentoro.aistack.apis.safety.RunShieldRequest;
import com.gentoro.aistack.apis.safety.RunShieldResponse;
import com.gentoro.aistack.apis.safety.Safety;
import com.gentoro.aistack.provider.Api;

public class SafetyClient extends TransportClient implements Safety {
  public SafetyClient(CapabilityTransport transport) {
    super(transport);
  }

  @Override
  public RunShieldResponse runShield(RunShieldRequest request) {
    return transport.invoke(Api.SAFETY, RUN_SHIELD, request, RunShieldResponse.class);
  }
}
