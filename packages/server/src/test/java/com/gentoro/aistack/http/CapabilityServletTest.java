package com.gentoro.aistack.http;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.InsertDocumentsRequest;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memory.MemoryBankDef;
import com.gentoro.aistack.apis.memory.MemoryBankDocument;
import com.gentoro.aistack.apis.memory.QueryDocumentsRequest;
import com.gentoro.aistack.apis.memory.QueryDocumentsResponse;
import com.gentoro.aistack.client.CapabilityClients;
import com.gentoro.aistack.client.DeferredTransport;
import com.gentoro.aistack.exception.ChunkingException;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.manifest.ProviderBinding;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderKind;
import com.gentoro.aistack.provider.ProviderRegistry;
import com.gentoro.aistack.provider.RegisteredProvider;
import com.gentoro.aistack.providers.memory.DocumentContentLoader;
import com.gentoro.aistack.providers.memory.MemoryBankEngine;
import com.gentoro.aistack.providers.remote.RemoteStackClient;
import com.gentoro.aistack.router.RequestRouter;
import com.gentoro.aistack.testing.FakeInference;
import com.gentoro.aistack.testing.TestHttp;
import com.gentoro.aistack.utility.JacksonUtility;
import java.time.Duration;
import java.util.List;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.configuration2.BaseHierarchicalConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CapabilityServletTest {

  private RequestRouter router;
  private EmbeddedJettyServer server;
  private final OkHttpClient http = new OkHttpClient();

  @BeforeEach
  void setUp() throws Exception {
    DeferredTransport transport = new DeferredTransport();
    MemoryBankEngine engine =
        new MemoryBankEngine(
            "mem",
            CapabilityClients.create(Inference.class, transport),
            new DocumentContentLoader(Duration.ofSeconds(1)),
            5,
            10,
            16);
    ProviderRegistry.Builder builder =
        ProviderRegistry.builder().api(Api.INFERENCE).api(Api.MEMORY).api(Api.MEMORY_BANKS);
    builder.provider(provider(Api.INFERENCE, "fake", FakeInference.replying("ok")), true);
    builder.provider(provider(Api.MEMORY, "mem", engine), true);
    router = new RequestRouter(builder.build(), 2, 0);
    transport.bind(router);
    server = TestHttp.start(ctx -> CapabilityServlet.register(ctx, router));
  }

  @AfterEach
  void tearDown() {
    server.stop();
    router.close();
  }

  private static RegisteredProvider provider(Api api, String id, Object adapter) {
    return new RegisteredProvider(
        api,
        new ProviderBinding(
            id, "inline::test", ProviderKind.INLINE, false, new BaseHierarchicalConfiguration()),
        adapter,
        List.of());
  }

  private Response post(String path, String json) throws Exception {
    return http.newCall(
            new Request.Builder()
                .url(TestHttp.baseUrl(server).resolve(path))
                .post(RequestBody.create(json, MediaType.get("application/json")))
                .build())
        .execute();
  }

  @Test
  @DisplayName("A remote client sees the same results and failures as an in-process caller")
  void remoteTransparency() throws Exception {
    try (RemoteStackClient transport =
        new RemoteStackClient(TestHttp.baseUrl(server), Duration.ofSeconds(5), true)) {
      Memory memory = CapabilityClients.create(Memory.class, transport);

      memory.registerMemoryBank(new MemoryBankDef("kb", "emb", 32, 4, null));
      memory.insertDocuments(
          new InsertDocumentsRequest(
              "kb", List.of(MemoryBankDocument.text("d1", "the quick brown fox"))));
      QueryDocumentsResponse result =
          memory.queryDocuments(new QueryDocumentsRequest("kb", List.of("quick fox")));
      assertEquals("d1", result.chunks().get(0).documentId());
      assertEquals(result.chunks().size(), result.scores().size());

      assertThrows(NotFoundException.class, () -> memory.getMemoryBank(new BankRef("nope")));
      ConfigException duplicate =
          assertThrows(
              ConfigException.class,
              () -> memory.registerMemoryBank(new MemoryBankDef("kb", "emb", 32, 4, null)));
      assertEquals(StackErrorCode.DUPLICATE_BANK, duplicate.getCode());
      ChunkingException dupDoc =
          assertThrows(
              ChunkingException.class,
              () ->
                  memory.insertDocuments(
                      new InsertDocumentsRequest(
                          "kb", List.of(MemoryBankDocument.text("d1", "again")))));
      assertEquals(StackErrorCode.DUPLICATE_DOCUMENT_ID, dupDoc.getCode());
    }
  }

  @Test
  @DisplayName("Only POST is accepted")
  void methodNotAllowed() throws Exception {
    try (Response response =
        http.newCall(
                new Request.Builder().url(TestHttp.baseUrl(server).resolve("memory/query")).build())
            .execute()) {
      assertEquals(405, response.code());
      assertEquals("POST", response.header("Allow"));
    }
  }

  @Test
  @DisplayName("Malformed paths and unknown operations answer 404 with error details")
  void notFound() throws Exception {
    try (Response response = post("memory", "{}")) {
      assertEquals(404, response.code());
    }
    try (Response response = post("memory/teleport", "{}")) {
      assertEquals(404, response.code());
      String body = response.body().string();
      assertTrue(body.contains("\"code\":\"UNKNOWN_OPERATION\""));
      assertTrue(body.contains("\"origin\":\"client\""));
    }
  }

  @Test
  @DisplayName("Malformed JSON answers 400")
  void badJson() throws Exception {
    try (Response response = post("memory/query", "{not json")) {
      assertEquals(400, response.code());
    }
  }

  @Test
  @DisplayName("Operations without a result answer an empty object")
  void emptyBody() throws Exception {
    try (Response response =
        post(
            "memory/register_memory_bank",
            JacksonUtility.toJson(new MemoryBankDef("b", "emb", 16, 2, null)))) {
      assertEquals(200, response.code());
    }
    try (Response response = post("memory/drop_memory_bank", "{\"bank_id\":\"b\"}")) {
      assertEquals(200, response.code());
      assertEquals("{}", response.body().string());
    }
  }

  @Test
  @DisplayName("Error codes map to HTTP statuses by origin")
  void statusMapping() {
    assertEquals(404, CapabilityServlet.statusFor(StackErrorCode.NOT_FOUND));
    assertEquals(409, CapabilityServlet.statusFor(StackErrorCode.DUPLICATE_BANK));
    assertEquals(501, CapabilityServlet.statusFor(StackErrorCode.UNSUPPORTED_FEATURE));
    assertEquals(504, CapabilityServlet.statusFor(StackErrorCode.TIMEOUT));
    assertEquals(502, CapabilityServlet.statusFor(StackErrorCode.UPSTREAM_ERROR));
    assertEquals(500, CapabilityServlet.statusFor(StackErrorCode.EXECUTION_ERROR));
    assertEquals(400, CapabilityServlet.statusFor(StackErrorCode.INVALID_ARGUMENT));
    assertEquals(400, CapabilityServlet.statusFor(StackErrorCode.CONTRACT_VIOLATION));
  }
}
