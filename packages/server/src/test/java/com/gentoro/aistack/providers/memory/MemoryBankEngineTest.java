package com.gentoro.aistack.providers.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.Chunk;
import com.gentoro.aistack.apis.memory.InsertDocumentsRequest;
import com.gentoro.aistack.apis.memory.MemoryBankDef;
import com.gentoro.aistack.apis.memory.MemoryBankDocument;
import com.gentoro.aistack.apis.memory.QueryDocumentsRequest;
import com.gentoro.aistack.apis.memory.QueryDocumentsResponse;
import com.gentoro.aistack.exception.ChunkingException;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.StackException;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.testing.FakeInference;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MemoryBankEngineTest {

  private FakeInference inference;
  private MemoryBankEngine engine;

  @BeforeEach
  void setUp() {
    inference = FakeInference.replying("unused");
    engine =
        new MemoryBankEngine(
            "memory-1", inference, new DocumentContentLoader(Duration.ofSeconds(5)), 3, 5, 2);
  }

  private void register(String bankId) {
    engine.registerMemoryBank(new MemoryBankDef(bankId, "test-embedding", 16, 4, null));
  }

  private void insert(String bankId, MemoryBankDocument... docs) {
    engine.insertDocuments(new InsertDocumentsRequest(bankId, List.of(docs)));
  }

  @Test
  @DisplayName("Registered banks carry the provider id and are listed in registration order")
  void registerAndList() {
    register("b2");
    register("b1");

    MemoryBankDef def = engine.getMemoryBank(new BankRef("b2"));
    assertEquals("memory-1", def.providerId());
    assertEquals(16, def.chunkSizeInTokens());
    assertEquals(
        List.of("b2", "b1"),
        engine.listMemoryBanks().banks().stream().map(MemoryBankDef::identifier).toList());
  }

  @Test
  @DisplayName("Registering an existing identifier fails with DUPLICATE_BANK")
  void duplicateBank() {
    register("docs");
    ConfigException ex = assertThrows(ConfigException.class, () -> register("docs"));
    assertEquals(StackErrorCode.DUPLICATE_BANK, ex.getCode());
  }

  @Test
  @DisplayName("Invalid chunk windows are rejected at registration")
  void invalidWindow() {
    assertThrows(
        ValidationException.class,
        () -> engine.registerMemoryBank(new MemoryBankDef("x", "m", 8, 8, null)));
    assertThrows(
        ValidationException.class,
        () -> engine.registerMemoryBank(new MemoryBankDef("x", null, 8, 2, null)));
  }

  @Test
  @DisplayName("Querying an empty bank returns nothing and does not embed")
  void emptyBank() {
    register("empty");
    QueryDocumentsResponse response =
        engine.queryDocuments(new QueryDocumentsRequest("empty", List.of("anything")));
    assertTrue(response.chunks().isEmpty());
    assertTrue(response.scores().isEmpty());
    assertTrue(inference.embeddingRequests.isEmpty());
  }

  @Test
  @DisplayName("The closest chunk ranks first and scores never increase")
  void queryRanking() {
    register("kb");
    insert(
        "kb",
        MemoryBankDocument.text("fruit", "apples and pears grow in the orchard"),
        MemoryBankDocument.text("space", "rockets launch satellites into orbit"),
        MemoryBankDocument.text("sea", "whales swim across the cold ocean"));

    QueryDocumentsResponse response =
        engine.queryDocuments(
            new QueryDocumentsRequest("kb", List.of("rockets launch satellites into orbit")));

    assertEquals(3, response.chunks().size());
    assertEquals(response.chunks().size(), response.scores().size());
    assertEquals("space", response.chunks().get(0).documentId());
    for (int i = 1; i < response.scores().size(); i++) {
      assertTrue(response.scores().get(i - 1) >= response.scores().get(i));
    }
  }

  @Test
  @DisplayName("Embedding calls are batched by embedding_batch_size")
  void embeddingBatches() {
    register("kb");
    insert(
        "kb",
        MemoryBankDocument.text("a", "one"),
        MemoryBankDocument.text("b", "two"),
        MemoryBankDocument.text("c", "three"));

    assertEquals(2, inference.embeddingRequests.size());
    assertEquals(2, inference.embeddingRequests.get(0).contents().size());
    assertEquals(1, inference.embeddingRequests.get(1).contents().size());
    assertEquals("test-embedding", inference.embeddingRequests.get(0).model());
  }

  @Test
  @DisplayName("Long documents are split into overlapping chunks")
  void longDocument() {
    register("kb");
    String text = IntStream.range(0, 40).mapToObj(i -> "t" + i).collect(Collectors.joining(" "));
    insert("kb", MemoryBankDocument.text("long", text));

    QueryDocumentsResponse response =
        engine.queryDocuments(
            new QueryDocumentsRequest("kb", List.of("t0 t1"), Map.of("max_chunks", 5)));
    // 16 token windows with 4 overlap over 40 tokens: starts at 0, 12 and 24.
    assertEquals(3, response.chunks().size());
    assertTrue(response.chunks().stream().allMatch(c -> c.documentId().equals("long")));
    assertEquals(
        List.of(16, 16, 16),
        response.chunks().stream().map(Chunk::tokenCount).sorted().toList());
  }

  @Test
  @DisplayName("max_chunks defaults, is clamped to the limit and must be positive")
  void maxChunks() {
    register("kb");
    for (int i = 0; i < 8; i++) {
      insert("kb", MemoryBankDocument.text("d" + i, "document number " + i));
    }

    assertEquals(
        3,
        engine
            .queryDocuments(new QueryDocumentsRequest("kb", List.of("document")))
            .chunks()
            .size());
    assertEquals(
        5,
        engine
            .queryDocuments(
                new QueryDocumentsRequest("kb", List.of("document"), Map.of("max_chunks", 50)))
            .chunks()
            .size());
    assertEquals(
        2,
        engine
            .queryDocuments(
                new QueryDocumentsRequest("kb", List.of("document"), Map.of("max_chunks", "2")))
            .chunks()
            .size());
    assertThrows(
        ValidationException.class,
        () ->
            engine.queryDocuments(
                new QueryDocumentsRequest("kb", List.of("document"), Map.of("max_chunks", 0))));
    assertThrows(
        ValidationException.class,
        () ->
            engine.queryDocuments(
                new QueryDocumentsRequest("kb", List.of("document"), Map.of("max_chunks", "x"))));
  }

  @Test
  @DisplayName("Duplicate document ids fail and leave the bank unchanged")
  void duplicateDocuments() {
    register("kb");
    insert("kb", MemoryBankDocument.text("a", "first"));

    ChunkingException existing =
        assertThrows(
            ChunkingException.class, () -> insert("kb", MemoryBankDocument.text("a", "again")));
    assertEquals(StackErrorCode.DUPLICATE_DOCUMENT_ID, existing.getCode());

    ChunkingException inBatch =
        assertThrows(
            ChunkingException.class,
            () ->
                insert(
                    "kb",
                    MemoryBankDocument.text("b", "one"),
                    MemoryBankDocument.text("b", "two")));
    assertEquals(StackErrorCode.DUPLICATE_DOCUMENT_ID, inBatch.getCode());

    QueryDocumentsResponse response =
        engine.queryDocuments(
            new QueryDocumentsRequest("kb", List.of("one"), Map.of("max_chunks", 5)));
    assertEquals(List.of("a"), response.chunks().stream().map(Chunk::documentId).toList());
  }

  @Test
  @DisplayName("Unknown banks fail with NOT_FOUND, dropped banks disappear")
  void unknownAndDropped() {
    StackException ex =
        assertThrows(
            NotFoundException.class,
            () -> engine.queryDocuments(new QueryDocumentsRequest("nope", List.of("q"))));
    assertEquals("nope", ex.getContext().get("bank_id"));

    register("kb");
    engine.dropMemoryBank(new BankRef("kb"));
    assertTrue(engine.listMemoryBanks().banks().isEmpty());
    assertThrows(NotFoundException.class, () -> engine.getMemoryBank(new BankRef("kb")));
    assertThrows(NotFoundException.class, () -> engine.dropMemoryBank(new BankRef("kb")));
  }

  @Test
  @DisplayName("Blank queries are rejected")
  void blankQuery() {
    register("kb");
    assertThrows(
        ValidationException.class,
        () -> engine.queryDocuments(new QueryDocumentsRequest("kb", List.of(" "))));
    assertThrows(
        ValidationException.class,
        () -> engine.queryDocuments(new QueryDocumentsRequest("kb", List.of())));
  }

  @Test
  @DisplayName("Chunks with equal scores keep their insertion order")
  void tiesKeepInsertionOrder() {
    register("kb");
    insert(
        "kb",
        MemoryBankDocument.text("first", "the same sentence twice"),
        MemoryBankDocument.text("other", "completely unrelated words"),
        MemoryBankDocument.text("second", "the same sentence twice"));

    QueryDocumentsResponse response =
        engine.queryDocuments(
            new QueryDocumentsRequest("kb", List.of("the same sentence twice")));

    assertEquals("first", response.chunks().get(0).documentId());
    assertEquals("second", response.chunks().get(1).documentId());
    assertEquals(response.scores().get(0), response.scores().get(1));
  }

  @Test
  @DisplayName("Repeating a query returns the same chunks and scores")
  void repeatedQueryIsStable() {
    register("kb");
    insert(
        "kb",
        MemoryBankDocument.text("fruit", "apples and pears grow in the orchard"),
        MemoryBankDocument.text("space", "rockets launch satellites into orbit"),
        MemoryBankDocument.text("sea", "whales swim across the cold ocean"));
    QueryDocumentsRequest request =
        new QueryDocumentsRequest("kb", List.of("cold ocean orbit"), Map.of("max_chunks", 5));

    QueryDocumentsResponse first = engine.queryDocuments(request);
    QueryDocumentsResponse second = engine.queryDocuments(request);

    assertEquals(first.chunks(), second.chunks());
    assertEquals(first.scores(), second.scores());
  }

  @Test
  @DisplayName("Several queries merge into one list where each chunk keeps its best score")
  void multiQueryMerge() {
    register("kb");
    insert(
        "kb",
        MemoryBankDocument.text("fruit", "apples and pears grow in the orchard"),
        MemoryBankDocument.text("space", "rockets launch satellites into orbit"),
        MemoryBankDocument.text("sea", "whales swim across the cold ocean"),
        MemoryBankDocument.text("city", "trains carry commuters downtown"));

    double fruitAlone = topScore("apples and pears grow in the orchard", "fruit");
    double spaceAlone = topScore("rockets launch satellites into orbit", "space");

    QueryDocumentsResponse merged =
        engine.queryDocuments(
            new QueryDocumentsRequest(
                "kb",
                List.of(
                    "apples and pears grow in the orchard",
                    "rockets launch satellites into orbit"),
                Map.of("max_chunks", 2)));

    assertEquals(2, merged.chunks().size());
    List<String> ids = merged.chunks().stream().map(Chunk::documentId).toList();
    assertEquals(2, ids.stream().distinct().count());
    assertTrue(ids.containsAll(List.of("fruit", "space")));
    assertEquals(fruitAlone, merged.scores().get(ids.indexOf("fruit")));
    assertEquals(spaceAlone, merged.scores().get(ids.indexOf("space")));
    assertTrue(merged.scores().get(0) >= merged.scores().get(1));
  }

  private double topScore(String query, String expectedDocument) {
    QueryDocumentsResponse response =
        engine.queryDocuments(new QueryDocumentsRequest("kb", List.of(query)));
    assertEquals(expectedDocument, response.chunks().get(0).documentId());
    return response.scores().get(0);
  }

  @Test
  @DisplayName("file: documents are refused unless a root is configured")
  void fileDocumentsRefusedByDefault() {
    register("kb");
    MemoryBankDocument local =
        new MemoryBankDocument("passwd", null, "file:///etc/passwd", "text/plain", Map.of());

    assertThrows(ValidationException.class, () -> insert("kb", local));
    assertTrue(
        engine.queryDocuments(new QueryDocumentsRequest("kb", List.of("root"))).chunks().isEmpty());
    assertTrue(inference.embeddingRequests.isEmpty());
  }
}
