package com.gentoro.aistack.router;

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
import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.ChatCompletionResponse;
import com.gentoro.aistack.apis.inference.CompletionRequest;
import com.gentoro.aistack.apis.inference.CompletionResponse;
import com.gentoro.aistack.apis.inference.EmbeddingsRequest;
import com.gentoro.aistack.apis.inference.EmbeddingsResponse;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.InsertDocumentsRequest;
import com.gentoro.aistack.apis.memory.ListMemoryBanksResponse;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memory.MemoryBankDef;
import com.gentoro.aistack.apis.memory.QueryDocumentsRequest;
import com.gentoro.aistack.apis.memory.QueryDocumentsResponse;
import com.gentoro.aistack.apis.memory.RegisterMemoryBankResponse;
import com.gentoro.aistack.apis.memorybanks.MemoryBanks;
import com.gentoro.aistack.apis.models.ListModelsResponse;
import com.gentoro.aistack.apis.models.Model;
import com.gentoro.aistack.apis.models.ModelRef;
import com.gentoro.aistack.apis.models.Models;
import com.gentoro.aistack.apis.safety.RunShieldRequest;
import com.gentoro.aistack.apis.safety.RunShieldResponse;
import com.gentoro.aistack.apis.safety.Safety;
import com.gentoro.aistack.apis.shields.ListShieldsResponse;
import com.gentoro.aistack.apis.shields.ShieldDef;
import com.gentoro.aistack.apis.shields.ShieldRef;
import com.gentoro.aistack.apis.shields.Shields;
import com.gentoro.aistack.apis.telemetry.LogEventRequest;
import com.gentoro.aistack.apis.telemetry.Telemetry;
import com.gentoro.aistack.apis.telemetry.Trace;
import com.gentoro.aistack.apis.telemetry.TraceRef;
import com.gentoro.aistack.provider.Api;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Every operation the router knows, keyed by {@code <api>/<operation>}. */
public final class OperationCatalog {
  private static final Map<String, OperationDef<?, ?, ?>> OPERATIONS;

  static {
    Map<String, OperationDef<?, ?, ?>> ops = new LinkedHashMap<>();

    // inference
    add(
        ops,
        OperationDef.of(
                Api.INFERENCE,
                Inference.CHAT_COMPLETION,
                Inference.class,
                ChatCompletionRequest.class,
                ChatCompletionResponse.class,
                Inference::chatCompletion)
            .routedByResource(ChatCompletionRequest::model)
            .checkedBy(
                (q, r) -> r.completionMessage() == null ? "completion_message is missing" : null));
    add(
        ops,
        OperationDef.of(
                Api.INFERENCE,
                Inference.COMPLETION,
                Inference.class,
                CompletionRequest.class,
                CompletionResponse.class,
                Inference::completion)
            .routedByResource(CompletionRequest::model)
            .checkedBy((q, r) -> r.content() == null ? "content is missing" : null));
    add(
        ops,
        OperationDef.of(
                Api.INFERENCE,
                Inference.EMBEDDINGS,
                Inference.class,
                EmbeddingsRequest.class,
                EmbeddingsResponse.class,
                Inference::embeddings)
            .routedByResource(EmbeddingsRequest::model)
            .checkedBy(OperationCatalog::checkEmbeddings));

    // safety
    add(
        ops,
        OperationDef.of(
                Api.SAFETY,
                Safety.RUN_SHIELD,
                Safety.class,
                RunShieldRequest.class,
                RunShieldResponse.class,
                Safety::runShield)
            .routedByResource(RunShieldRequest::shieldType)
            .checkedBy(
                (q, r) -> r.violationLevel() == null ? "violation_level is missing" : null));

    // memory
    add(
        ops,
        OperationDef.of(
                Api.MEMORY,
                Memory.REGISTER_MEMORY_BANK,
                Memory.class,
                MemoryBankDef.class,
                RegisterMemoryBankResponse.class,
                Memory::registerMemoryBank)
            .routedByProvider(MemoryBankDef::providerId)
            .checkedBy((q, r) -> isBlank(r.bankId()) ? "bank_id is missing" : null));
    add(
        ops,
        OperationDef.ofVoid(
                Api.MEMORY,
                Memory.INSERT,
                Memory.class,
                InsertDocumentsRequest.class,
                Memory::insertDocuments)
            .routedByResource(InsertDocumentsRequest::bankId));
    add(
        ops,
        OperationDef.of(
                Api.MEMORY,
                Memory.QUERY,
                Memory.class,
                QueryDocumentsRequest.class,
                QueryDocumentsResponse.class,
                Memory::queryDocuments)
            .routedByResource(QueryDocumentsRequest::bankId)
            .checkedBy(OperationCatalog::checkQueryResult));
    add(
        ops,
        OperationDef.of(
                Api.MEMORY,
                Memory.GET_MEMORY_BANK,
                Memory.class,
                BankRef.class,
                MemoryBankDef.class,
                Memory::getMemoryBank)
            .routedByResource(BankRef::bankId)
            .checkedBy((q, r) -> isBlank(r.identifier()) ? "identifier is missing" : null));
    add(
        ops,
        OperationDef.of(
                Api.MEMORY,
                Memory.LIST_MEMORY_BANKS,
                Memory.class,
                Empty.class,
                ListMemoryBanksResponse.class,
                (m, q) -> m.listMemoryBanks())
            .checkedBy((q, r) -> r.banks() == null ? "banks is missing" : null));
    add(
        ops,
        OperationDef.ofVoid(
                Api.MEMORY,
                Memory.DROP_MEMORY_BANK,
                Memory.class,
                BankRef.class,
                Memory::dropMemoryBank)
            .routedByResource(BankRef::bankId));

    // agents
    add(
        ops,
        OperationDef.of(
                Api.AGENTS,
                Agents.CREATE_AGENT,
                Agents.class,
                CreateAgentRequest.class,
                AgentCreateResponse.class,
                Agents::createAgent)
            .checkedBy((q, r) -> isBlank(r.agentId()) ? "agent_id is missing" : null));
    add(
        ops,
        OperationDef.ofVoid(
            Api.AGENTS, Agents.DELETE_AGENT, Agents.class, AgentRef.class, Agents::deleteAgent));
    add(
        ops,
        OperationDef.of(
                Api.AGENTS,
                Agents.CREATE_SESSION,
                Agents.class,
                CreateSessionRequest.class,
                SessionCreateResponse.class,
                Agents::createSession)
            .checkedBy((q, r) -> isBlank(r.sessionId()) ? "session_id is missing" : null));
    add(
        ops,
        OperationDef.of(
                Api.AGENTS,
                Agents.GET_SESSION,
                Agents.class,
                SessionRef.class,
                Session.class,
                Agents::getSession)
            .checkedBy((q, r) -> r.turns() == null ? "turns is missing" : null));
    add(
        ops,
        OperationDef.ofVoid(
            Api.AGENTS,
            Agents.DELETE_SESSION,
            Agents.class,
            SessionRef.class,
            Agents::deleteSession));
    add(
        ops,
        OperationDef.of(
                Api.AGENTS,
                Agents.CREATE_TURN,
                Agents.class,
                CreateTurnRequest.class,
                Turn.class,
                Agents::createTurn)
            .checkedBy((q, r) -> r.outputMessage() == null ? "output_message is missing" : null));

    // telemetry
    add(
        ops,
        OperationDef.ofVoid(
            Api.TELEMETRY,
            Telemetry.LOG_EVENT,
            Telemetry.class,
            LogEventRequest.class,
            Telemetry::logEvent));
    add(
        ops,
        OperationDef.of(
                Api.TELEMETRY,
                Telemetry.GET_TRACE,
                Telemetry.class,
                TraceRef.class,
                Trace.class,
                Telemetry::getTrace)
            .checkedBy((q, r) -> r.spans() == null ? "spans is missing" : null));

    // routing tables, served by the router itself
    add(
        ops,
        OperationDef.of(
            Api.MODELS,
            Models.LIST,
            Models.class,
            Empty.class,
            ListModelsResponse.class,
            (m, q) -> m.listModels()));
    add(
        ops,
        OperationDef.of(
            Api.MODELS, Models.GET, Models.class, ModelRef.class, Model.class, Models::getModel));
    add(
        ops,
        OperationDef.of(
            Api.SHIELDS,
            Shields.LIST,
            Shields.class,
            Empty.class,
            ListShieldsResponse.class,
            (s, q) -> s.listShields()));
    add(
        ops,
        OperationDef.of(
            Api.SHIELDS,
            Shields.GET,
            Shields.class,
            ShieldRef.class,
            ShieldDef.class,
            Shields::getShield));
    add(
        ops,
        OperationDef.of(
            Api.MEMORY_BANKS,
            MemoryBanks.LIST,
            MemoryBanks.class,
            Empty.class,
            ListMemoryBanksResponse.class,
            (b, q) -> b.listMemoryBanks()));
    add(
        ops,
        OperationDef.of(
            Api.MEMORY_BANKS,
            MemoryBanks.GET,
            MemoryBanks.class,
            BankRef.class,
            MemoryBankDef.class,
            MemoryBanks::getMemoryBank));

    OPERATIONS = Collections.unmodifiableMap(ops);
  }

  private OperationCatalog() {}

  public static Optional<OperationDef<?, ?, ?>> find(Api api, String operation) {
    return Optional.ofNullable(OPERATIONS.get(key(api, operation)));
  }

  public static List<OperationDef<?, ?, ?>> operations(Api api) {
    return OPERATIONS.values().stream().filter(op -> op.api() == api).toList();
  }

  private static void add(Map<String, OperationDef<?, ?, ?>> ops, OperationDef<?, ?, ?> op) {
    ops.put(key(op.api(), op.name()), op);
  }

  private static String key(Api api, String operation) {
    return api.wireName() + "/" + operation;
  }

  private static String checkEmbeddings(EmbeddingsRequest q, EmbeddingsResponse r) {
    if (r.embeddings() == null) {
      return "embeddings is missing";
    }
    int expected = q.contents() == null ? 0 : q.contents().size();
    if (r.embeddings().size() != expected) {
      return "expected %d embeddings, got %d".formatted(expected, r.embeddings().size());
    }
    for (float[] vector : r.embeddings()) {
      if (vector == null || vector.length == 0) {
        return "empty embedding vector";
      }
    }
    return null;
  }

  private static String checkQueryResult(QueryDocumentsRequest q, QueryDocumentsResponse r) {
    if (r.chunks() == null || r.scores() == null) {
      return "chunks and scores are required";
    }
    if (r.chunks().size() != r.scores().size()) {
      return "%d chunks but %d scores".formatted(r.chunks().size(), r.scores().size());
    }
    for (int i = 1; i < r.scores().size(); i++) {
      if (r.scores().get(i) > r.scores().get(i - 1)) {
        return "scores are not in non-increasing order";
      }
    }
    return null;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
