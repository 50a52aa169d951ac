package com.gentoro.aistack.providers.agents;

import com.gentoro.aistack.apis.agents.AgentConfig;
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
import com.gentoro.aistack.apis.agents.TurnStep;
import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.ChatCompletionResponse;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.apis.memory.Chunk;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memory.QueryDocumentsRequest;
import com.gentoro.aistack.apis.memory.QueryDocumentsResponse;
import com.gentoro.aistack.apis.safety.RunShieldRequest;
import com.gentoro.aistack.apis.safety.RunShieldResponse;
import com.gentoro.aistack.apis.safety.Safety;
import com.gentoro.aistack.apis.safety.ViolationLevel;
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.prompt.ClasspathPromptRepository;
import com.gentoro.aistack.prompt.PromptTemplate;
import com.gentoro.aistack.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Inline agents provider.
 *
 * <p>A turn runs, in order: the agent's input shields, retrieval from its memory banks, one
 * inference call over the session history, and the output shields. An input violation at level
 * {@code error} ends the turn without inference; an output violation replaces the model answer.
 * In both cases the assistant message is the shield's user message. Turns of a session are
 * serialized; different sessions run concurrently.
 */
public class AgentsEngine implements Agents, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(AgentsEngine.class);

  public static final int DEFAULT_MAX_CHUNKS = 10;
  static final String CONTEXT_PROMPT = "retrieved_context";

  private final KvStore store;
  private final Inference inference;
  private final Safety safety;
  private final Memory memory;
  private final Supplier<String> ids;
  private final PromptTemplate contextPrompt;
  private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();

  public AgentsEngine(KvStore store, Inference inference, Safety safety, Memory memory) {
    this(store, inference, safety, memory, () -> UUID.randomUUID().toString());
  }

  AgentsEngine(
      KvStore store, Inference inference, Safety safety, Memory memory, Supplier<String> ids) {
    this.store = store;
    this.inference = inference;
    this.safety = safety;
    this.memory = memory;
    this.ids = ids;
    this.contextPrompt = ClasspathPromptRepository.bundled().get(CONTEXT_PROMPT);
  }

  static String agentKey(String agentId) {
    return "agent:" + agentId;
  }

  static String sessionKey(String agentId, String sessionId) {
    return "session:" + agentId + ":" + sessionId;
  }

  @Override
  public AgentCreateResponse createAgent(CreateAgentRequest request) {
    AgentConfig config = request == null ? null : request.agentConfig();
    if (config == null) {
      throw new ValidationException("agent_config is required");
    }
    if (config.model() == null || config.model().isBlank()) {
      throw new ValidationException("agent_config.model is required");
    }
    if (config.maxChunks() != null && config.maxChunks() <= 0) {
      throw new ValidationException("agent_config.max_chunks must be positive");
    }
    String agentId = ids.get();
    store.set(agentKey(agentId), JacksonUtility.toJson(config));
    log.info("Created agent {} on model {}", agentId, config.model());
    return new AgentCreateResponse(agentId);
  }

  @Override
  public void deleteAgent(AgentRef ref) {
    String agentId = requireId(ref == null ? null : ref.agentId(), "agent_id");
    if (!store.delete(agentKey(agentId))) {
      throw agentNotFound(agentId);
    }
    for (String key : store.keys("session:" + agentId + ":")) {
      store.delete(key);
      sessionLocks.remove(key);
    }
    log.info("Deleted agent {}", agentId);
  }

  @Override
  public SessionCreateResponse createSession(CreateSessionRequest request) {
    String agentId = requireId(request == null ? null : request.agentId(), "agent_id");
    loadAgent(agentId);
    String sessionId = ids.get();
    Session session =
        new Session(
            sessionId, agentId, request.sessionName(), List.of(), System.currentTimeMillis());
    store.set(sessionKey(agentId, sessionId), JacksonUtility.toJson(session));
    return new SessionCreateResponse(sessionId);
  }

  @Override
  public Session getSession(SessionRef ref) {
    String agentId = requireId(ref == null ? null : ref.agentId(), "agent_id");
    String sessionId = requireId(ref.sessionId(), "session_id");
    return loadSession(agentId, sessionId);
  }

  @Override
  public void deleteSession(SessionRef ref) {
    String agentId = requireId(ref == null ? null : ref.agentId(), "agent_id");
    String sessionId = requireId(ref.sessionId(), "session_id");
    String key = sessionKey(agentId, sessionId);
    if (!store.delete(key)) {
      throw sessionNotFound(agentId, sessionId);
    }
    sessionLocks.remove(key);
  }

  @Override
  public Turn createTurn(CreateTurnRequest request) {
    String agentId = requireId(request == null ? null : request.agentId(), "agent_id");
    String sessionId = requireId(request.sessionId(), "session_id");
    if (request.messages() == null || request.messages().isEmpty()) {
      throw new ValidationException("create_turn requires at least one message");
    }
    AgentConfig agent = loadAgent(agentId);

    ReentrantLock lock =
        sessionLocks.computeIfAbsent(sessionKey(agentId, sessionId), k -> new ReentrantLock());
    lock.lock();
    try {
      Session session = loadSession(agentId, sessionId);
      Turn turn = runTurn(agent, session, request.messages());
      List<Turn> turns = new ArrayList<>(session.turns() == null ? List.of() : session.turns());
      turns.add(turn);
      store.set(
          sessionKey(agentId, sessionId),
          JacksonUtility.toJson(
              new Session(
                  session.sessionId(),
                  session.agentId(),
                  session.sessionName(),
                  turns,
                  session.startedAt())));
      return turn;
    } finally {
      lock.unlock();
    }
  }

  private Turn runTurn(AgentConfig agent, Session session, List<Message> input) {
    long started = System.currentTimeMillis();
    List<TurnStep> steps = new ArrayList<>();

    Message blocked = runShields(agent.inputShieldsOrEmpty(), input, steps);
    if (blocked != null) {
      return new Turn(
          ids.get(),
          session.sessionId(),
          input,
          steps,
          blocked,
          started,
          System.currentTimeMillis());
    }

    String context = retrieve(agent, input, steps);

    List<Message> prompt = new ArrayList<>();
    if (agent.instructions() != null && !agent.instructions().isBlank()) {
      prompt.add(Message.system(agent.instructions()));
    }
    if (session.turns() != null) {
      for (Turn previous : session.turns()) {
        prompt.addAll(previous.inputMessages());
        if (previous.outputMessage() != null) {
          prompt.add(previous.outputMessage());
        }
      }
    }
    if (context != null) {
      prompt.add(Message.system(context));
    }
    prompt.addAll(input);

    long inferenceStart = System.currentTimeMillis();
    ChatCompletionResponse response =
        inference.chatCompletion(
            new ChatCompletionRequest(agent.model(), prompt, agent.samplingParams()));
    Message output = response.completionMessage();
    steps.add(
        new TurnStep(
            TurnStep.StepType.INFERENCE,
            null,
            null,
            null,
            null,
            output,
            inferenceStart,
            System.currentTimeMillis()));

    List<Message> exchange = new ArrayList<>(input);
    exchange.add(output);
    Message replaced = runShields(agent.outputShieldsOrEmpty(), exchange, steps);
    if (replaced != null) {
      output = replaced;
    }
    return new Turn(
        ids.get(), session.sessionId(), input, steps, output, started, System.currentTimeMillis());
  }

  /** @return the replacement assistant message when a shield reports an error-level violation */
  private Message runShields(List<String> shields, List<Message> messages, List<TurnStep> steps) {
    for (String shieldId : shields) {
      long start = System.currentTimeMillis();
      RunShieldResponse verdict = safety.runShield(new RunShieldRequest(shieldId, messages));
      steps.add(
          new TurnStep(
              TurnStep.StepType.SHIELD_CALL,
              shieldId,
              verdict,
              null,
              null,
              null,
              start,
              System.currentTimeMillis()));
      if (verdict.violationLevel() == ViolationLevel.ERROR) {
        log.info("Shield {} blocked the turn: {}", shieldId, verdict.metadata());
        return Message.assistant(verdict.userMessage());
      }
      if (verdict.isViolation()) {
        log.warn("Shield {} reported a warning: {}", shieldId, verdict.metadata());
      }
    }
    return null;
  }

  private String retrieve(AgentConfig agent, List<Message> input, List<TurnStep> steps) {
    List<String> banks = agent.memoryBankIdsOrEmpty();
    if (banks.isEmpty()) {
      return null;
    }
    Message query = Message.lastOf(input, Message.Role.USER);
    if (query == null || query.content() == null || query.content().isBlank()) {
      return null;
    }
    int maxChunks = agent.maxChunks() == null ? DEFAULT_MAX_CHUNKS : agent.maxChunks();
    long start = System.currentTimeMillis();

    record Hit(Chunk chunk, double score, int order) {}
    List<Hit> hits = new ArrayList<>();
    for (String bankId : banks) {
      QueryDocumentsResponse result =
          memory.queryDocuments(
              new QueryDocumentsRequest(
                  bankId,
                  List.of(query.content()),
                  Map.of(QueryDocumentsRequest.MAX_CHUNKS, maxChunks)));
      for (int i = 0; i < result.chunks().size(); i++) {
        hits.add(new Hit(result.chunks().get(i), result.scores().get(i), hits.size()));
      }
    }
    hits.sort(Comparator.comparingDouble(Hit::score).reversed().thenComparingInt(Hit::order));

    String context = null;
    if (!hits.isEmpty()) {
      List<Map<String, Object>> chunks =
          hits.stream()
              .limit(maxChunks)
              .map(
                  h ->
                      Map.<String, Object>of(
                          "document_id", h.chunk().documentId(),
                          "content", h.chunk().content()))
              .toList();
      context = contextPrompt.renderText(Map.of("chunks", chunks));
    }
    steps.add(
        new TurnStep(
            TurnStep.StepType.MEMORY_RETRIEVAL,
            null,
            null,
            List.copyOf(banks),
            context,
            null,
            start,
            System.currentTimeMillis()));
    return context;
  }

  private AgentConfig loadAgent(String agentId) {
    return store
        .get(agentKey(agentId))
        .map(json -> JacksonUtility.fromJson(json, AgentConfig.class))
        .orElseThrow(() -> agentNotFound(agentId));
  }

  private Session loadSession(String agentId, String sessionId) {
    return store
        .get(sessionKey(agentId, sessionId))
        .map(json -> JacksonUtility.fromJson(json, Session.class))
        .orElseThrow(() -> sessionNotFound(agentId, sessionId));
  }

  private static String requireId(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " is required");
    }
    return value;
  }

  private static NotFoundException agentNotFound(String agentId) {
    return new NotFoundException("Agent not found: " + agentId, Map.of("agent_id", agentId));
  }

  private static NotFoundException sessionNotFound(String agentId, String sessionId) {
    return new NotFoundException(
        "Session not found: " + sessionId, Map.of("agent_id", agentId, "session_id", sessionId));
  }

  @Override
  public void close() {
    store.close();
  }
}
