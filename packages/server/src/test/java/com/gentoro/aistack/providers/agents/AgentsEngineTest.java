package com.gentoro.aistack.providers.agents;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.aistack.apis.agents.AgentConfig;
import com.gentoro.aistack.apis.agents.AgentRef;
import com.gentoro.aistack.apis.agents.CreateAgentRequest;
import com.gentoro.aistack.apis.agents.CreateSessionRequest;
import com.gentoro.aistack.apis.agents.CreateTurnRequest;
import com.gentoro.aistack.apis.agents.Session;
import com.gentoro.aistack.apis.agents.SessionRef;
import com.gentoro.aistack.apis.agents.Turn;
import com.gentoro.aistack.apis.agents.TurnStep;
import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.apis.memory.Chunk;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memory.QueryDocumentsResponse;
import com.gentoro.aistack.apis.safety.RunShieldResponse;
import com.gentoro.aistack.apis.safety.Safety;
import com.gentoro.aistack.apis.safety.ViolationLevel;
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.testing.FakeInference;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AgentsEngineTest {

  private InMemoryKvStore store;
  private FakeInference inference;
  private Safety safety;
  private Memory memory;
  private AgentsEngine engine;

  @BeforeEach
  void setUp() {
    store = new InMemoryKvStore();
    inference = FakeInference.replying("model answer");
    safety = mock(Safety.class);
    memory = mock(Memory.class);
    AtomicInteger ids = new AtomicInteger();
    engine =
        new AgentsEngine(store, inference, safety, memory, () -> "id-" + ids.incrementAndGet());
  }

  private static AgentConfig config(
      List<String> inputShields, List<String> outputShields, List<String> banks) {
    return new AgentConfig(
        "Llama3.2-3B-Instruct",
        "You are helpful.",
        inputShields,
        outputShields,
        banks,
        null,
        null);
  }

  private String[] agentAndSession(AgentConfig config) {
    String agentId = engine.createAgent(new CreateAgentRequest(config)).agentId();
    String sessionId = engine.createSession(new CreateSessionRequest(agentId, "s")).sessionId();
    return new String[] {agentId, sessionId};
  }

  private Turn turn(String[] ids, String text) {
    return engine.createTurn(new CreateTurnRequest(ids[0], ids[1], List.of(Message.user(text))));
  }

  @Test
  @DisplayName("A plain turn calls the model with instructions and input, then is persisted")
  void plainTurn() {
    String[] ids = agentAndSession(config(null, null, null));

    Turn turn = turn(ids, "hello");

    assertEquals("model answer", turn.outputMessage().content());
    assertEquals(1, turn.steps().size());
    assertEquals(TurnStep.StepType.INFERENCE, turn.steps().get(0).stepType());
    ChatCompletionRequest sent = inference.chatRequests.get(0);
    assertEquals("Llama3.2-3B-Instruct", sent.model());
    assertEquals(
        List.of(Message.system("You are helpful."), Message.user("hello")), sent.messages());

    Session session = engine.getSession(new SessionRef(ids[0], ids[1]));
    assertEquals(1, session.turns().size());
    assertEquals("s", session.sessionName());
  }

  @Test
  @DisplayName("Later turns see the earlier exchanges of the session")
  void history() {
    String[] ids = agentAndSession(config(null, null, null));
    turn(ids, "first");
    turn(ids, "second");

    List<Message> prompt = inference.chatRequests.get(1).messages();
    assertEquals(
        List.of(
            Message.system("You are helpful."),
            Message.user("first"),
            Message.assistant("model answer"),
            Message.user("second")),
        prompt);
    assertEquals(2, engine.getSession(new SessionRef(ids[0], ids[1])).turns().size());
  }

  @Test
  @DisplayName("An error-level input shield ends the turn without inference")
  void blockedInput() {
    when(safety.runShield(any()))
        .thenReturn(
            new RunShieldResponse(
                ViolationLevel.ERROR, "I can't answer that.", Map.of("violation_type", "S1")));
    String[] ids = agentAndSession(config(List.of("llama_guard"), null, null));

    Turn turn = turn(ids, "something bad");

    assertEquals(Message.assistant("I can't answer that."), turn.outputMessage());
    assertTrue(inference.chatRequests.isEmpty());
    assertEquals(1, turn.steps().size());
    assertEquals(TurnStep.StepType.SHIELD_CALL, turn.steps().get(0).stepType());
    assertEquals("llama_guard", turn.steps().get(0).shieldId());
    assertEquals(ViolationLevel.ERROR, turn.steps().get(0).violation().violationLevel());
  }

  @Test
  @DisplayName("Warnings are recorded but do not block")
  void warningDoesNotBlock() {
    when(safety.runShield(any()))
        .thenReturn(new RunShieldResponse(ViolationLevel.WARNING, "careful", Map.of()));
    String[] ids = agentAndSession(config(List.of("guard"), null, null));

    Turn turn = turn(ids, "borderline");

    assertEquals("model answer", turn.outputMessage().content());
    assertEquals(2, turn.steps().size());
  }

  @Test
  @DisplayName("An error-level output shield replaces the model answer")
  void outputReplaced() {
    when(safety.runShield(argThat(r -> r != null && r.messages().size() == 2)))
        .thenReturn(new RunShieldResponse(ViolationLevel.ERROR, "Withheld.", Map.of()));
    String[] ids = agentAndSession(config(null, List.of("guard"), null));

    Turn turn = turn(ids, "hello");

    assertEquals(Message.assistant("Withheld."), turn.outputMessage());
    assertEquals(
        List.of(TurnStep.StepType.INFERENCE, TurnStep.StepType.SHIELD_CALL),
        turn.steps().stream().map(TurnStep::stepType).toList());
    assertEquals("model answer", turn.steps().get(0).modelResponse().content());
  }

  @Test
  @DisplayName("Retrieved chunks are merged by score and inserted before the input")
  void retrieval() {
    when(memory.queryDocuments(argThat(q -> q != null && q.bankId().equals("kb1"))))
        .thenReturn(
            new QueryDocumentsResponse(
                List.of(new Chunk("doc-a", "alpha", 1), new Chunk("doc-b", "beta", 1)),
                List.of(0.4, 0.2)));
    when(memory.queryDocuments(argThat(q -> q != null && q.bankId().equals("kb2"))))
        .thenReturn(
            new QueryDocumentsResponse(List.of(new Chunk("doc-c", "gamma", 1)), List.of(0.9)));
    String[] ids = agentAndSession(config(null, null, List.of("kb1", "kb2")));

    Turn turn = turn(ids, "tell me");

    String expected =
        "Here are the retrieved documents for relevant context:\n"
            + "=== START-RETRIEVED-CONTEXT ===\n"
            + "id:doc-c; content:gamma\n"
            + "id:doc-a; content:alpha\n"
            + "id:doc-b; content:beta\n"
            + "\n=== END-RETRIEVED-CONTEXT ===";
    TurnStep retrieval = turn.steps().get(0);
    assertEquals(TurnStep.StepType.MEMORY_RETRIEVAL, retrieval.stepType());
    assertEquals(List.of("kb1", "kb2"), retrieval.memoryBankIds());
    assertEquals(expected, retrieval.insertedContext());

    List<Message> prompt = inference.chatRequests.get(0).messages();
    assertEquals(Message.system(expected), prompt.get(prompt.size() - 2));
    assertEquals(Message.user("tell me"), prompt.get(prompt.size() - 1));
    for (String bank : List.of("kb1", "kb2")) {
      verify(memory)
          .queryDocuments(
              argThat(
                  q ->
                      q != null
                          && q.bankId().equals(bank)
                          && q.query().equals(List.of("tell me"))
                          && Integer.valueOf(AgentsEngine.DEFAULT_MAX_CHUNKS)
                              .equals(q.params().get("max_chunks"))));
    }
    verify(memory, times(2)).queryDocuments(any());
  }

  @Test
  @DisplayName("Agents without banks never query memory")
  void noRetrieval() {
    String[] ids = agentAndSession(config(null, null, List.of()));
    turn(ids, "hi");
    verify(memory, never()).queryDocuments(any());
  }

  @Test
  @DisplayName("Unknown agents and sessions fail with NOT_FOUND")
  void notFound() {
    assertThrows(
        NotFoundException.class,
        () -> engine.createSession(new CreateSessionRequest("missing", null)));
    String[] ids = agentAndSession(config(null, null, null));
    assertThrows(
        NotFoundException.class, () -> engine.getSession(new SessionRef(ids[0], "missing")));
    assertThrows(
        NotFoundException.class,
        () ->
            engine.createTurn(
                new CreateTurnRequest(ids[0], "missing", List.of(Message.user("x")))));
  }

  @Test
  @DisplayName("Deleting an agent removes its sessions")
  void deleteAgent() {
    String[] ids = agentAndSession(config(null, null, null));
    engine.deleteAgent(new AgentRef(ids[0]));

    assertTrue(store.keys("").isEmpty());
    assertThrows(
        NotFoundException.class, () -> engine.getSession(new SessionRef(ids[0], ids[1])));
    assertThrows(NotFoundException.class, () -> engine.deleteAgent(new AgentRef(ids[0])));
  }

  @Test
  @DisplayName("Deleting a session leaves the agent in place")
  void deleteSession() {
    String[] ids = agentAndSession(config(null, null, null));
    engine.deleteSession(new SessionRef(ids[0], ids[1]));

    assertThrows(
        NotFoundException.class, () -> engine.getSession(new SessionRef(ids[0], ids[1])));
    assertNotNull(engine.createSession(new CreateSessionRequest(ids[0], "again")).sessionId());
  }

  @Test
  @DisplayName("Invalid agent configs and empty turns are rejected")
  void validation() {
    assertThrows(ValidationException.class, () -> engine.createAgent(new CreateAgentRequest(null)));
    assertThrows(
        ValidationException.class,
        () ->
            engine.createAgent(
                new CreateAgentRequest(new AgentConfig(" ", null, null, null, null, null, null))));
    assertThrows(
        ValidationException.class,
        () ->
            engine.createAgent(
                new CreateAgentRequest(new AgentConfig("m", null, null, null, null, 0, null))));
    String[] ids = agentAndSession(config(null, null, null));
    assertThrows(
        ValidationException.class,
        () -> engine.createTurn(new CreateTurnRequest(ids[0], ids[1], List.of())));
  }
}
