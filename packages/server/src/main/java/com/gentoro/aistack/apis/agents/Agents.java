package com.gentoro.aistack.apis.agents;

/** Agents capability: stateful conversations composed from inference, safety and memory. */
public interface Agents {
  String CREATE_AGENT = "create_agent";
  String DELETE_AGENT = "delete_agent";
  String CREATE_SESSION = "create_session";
  String GET_SESSION = "get_session";
  String DELETE_SESSION = "delete_session";
  String CREATE_TURN = "create_turn";

  AgentCreateResponse createAgent(CreateAgentRequest request);

  void deleteAgent(AgentRef ref);

  SessionCreateResponse createSession(CreateSessionRequest request);

  Session getSession(SessionRef ref);

  void deleteSession(SessionRef ref);

  /** Run one non-streaming turn and persist it in the session. */
  Turn createTurn(CreateTurnRequest request);
}
