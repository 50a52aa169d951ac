package com.gentoro.aistack.apis.shields;

/** Routing table of the shields configured on the safety providers. */
public interface Shields {
  String LIST = "list";
  String GET = "get";

  ListShieldsResponse listShields();

  ShieldDef getShield(ShieldRef ref);
}
