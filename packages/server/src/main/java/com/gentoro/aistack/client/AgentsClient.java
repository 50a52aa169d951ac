package com.gentoro.aistack.client;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.apis.agents.AgentCreateResponse;
import com.gentoro.aistack.apis.agents.AgentRef;
import com.gentoro.aistack.apis.agents.Agents;
import com.gentoro.aistack.apis.agents.CreateAgentRequest;
import com.gentoro.aistack.apis.agents.CreateSessionRequest;
import com.gentoro.aistack.apis.agents.CreateTurnRequest;
import com.gentoro.aistack.apis.agents.Session;
import com.gentoro.aistack.apis.agents.SessionCreateResponse;
import com.gentoro.aistack.apis.agents.SessionRef;
import com.gentoro.aistack.apis.agents.Turn;
import com.gentoro.aistack.provider.Api;

public class AgentsClient extends TransportClient implements Agents {
  public AgentsClient(CapabilityTransport transport) {
    super(transport);
  }

  @Override
  public AgentCreateResponse createAgent(CreateAgentRequest request) {
    return transport.invoke(Api.AGENTS, CREATE_AGENT, request, AgentCreateResponse.class);
  }

  @Override
  public void deleteAgent(AgentRef ref) {
    transport.invoke(Api.AGENTS, DELETE_AGENT, ref, Empty.class);
  }

  @Override
  public SessionCreateResponse createSession(CreateSessionRequest request) {
    return transport.invoke(Api.AGENTS, CREATE_SESSION, request, SessionCreateResponse.class);
  }

  @Override
  public Session getSession(SessionRef ref) {
    return transport.invoke(Api.AGENTS, GET_SESSION, ref, Session.class);
  }

  @Override
  public void deleteSession(SessionRef ref) {
    transport.invoke(Api.AGENTS, DELETE_SESSION, ref, Empty.class);
  }

  @Override
  public Turn createTurn(CreateTurnRequest request) {
    return transport.invoke(Api.AGENTS, CREATE_TURN, request, Turn.class);
  }
}
