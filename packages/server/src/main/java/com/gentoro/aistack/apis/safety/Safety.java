package com.gentoro.aistack.apis.safety;

/** Safety capability: evaluates a conversation against a named shield. */
public interface Safety {
  String RUN_SHIELD = "run_shield";

  RunShieldResponse runShield(RunShieldRequest request);
}
