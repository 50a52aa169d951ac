package com.gentoro.aistack.providers.remote;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.ChatCompletionResponse;
import com.gentoro.aistack.apis.inference.CompletionRequest;
import com.gentoro.aistack.apis.inference.CompletionResponse;
import com.gentoro.aistack.apis.inference.EmbeddingsRequest;
import com.gentoro.aistack.apis.inference.EmbeddingsResponse;
import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.apis.memory.InsertDocumentsRequest;
import com.gentoro.aistack.apis.safety.RunShieldRequest;
import com.gentoro.aistack.apis.safety.RunShieldResponse;
import com.gentoro.aistack.apis.telemetry.Trace;
import com.gentoro.aistack.apis.telemetry.TraceRef;
import com.gentoro.aistack.exception.AdapterException;
import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.http.EmbeddedJettyServer;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.testing.TestHttp;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import okhttp3.HttpUrl;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RemoteStackClientTest {

  private static final Map<String, AtomicInteger> HITS = new ConcurrentHashMap<>();
  private static final Map<String, String> BODIES = new ConcurrentHashMap<>();
  private static EmbeddedJettyServer server;

  /** Answers each path with a canned response. */
  private static final class CannedServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String path = req.getPathInfo();
      HITS.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();
      BODIES.put(path, req.getReader().lines().collect(Collectors.joining("\n")));
      resp.setContentType("application/json");
      switch (path) {
        case "/inference/chat_completion" -> {
          resp.setStatus(200);
          resp.getWriter()
              .print(
                  "{\"completion_message\":{\"role\":\"assistant\",\"content\":\"hi there\"},"
                      + "\"stop_reason\":\"end_of_turn\",\"extra\":1}");
        }
        case "/inference/completion" -> {
          resp.setStatus(500);
          resp.getWriter().print("model crashed");
        }
        case "/safety/run_shield" -> {
          resp.setStatus(400);
          resp.getWriter()
              .print(
                  "{\"type\":\"RoutingException\",\"message\":\"Unknown shield: x\","
                      + "\"code\":\"UNKNOWN_SHIELD\",\"origin\":\"client\","
                      + "\"context\":{\"shield_type\":\"x\"}}");
        }
        case "/inference/embeddings" -> {
          try {
            Thread.sleep(2_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          resp.setStatus(200);
          resp.getWriter().print("{\"embeddings\":[]}");
        }
        case "/inference/redirected" -> {
          resp.setStatus(307);
          resp.setHeader("Location", "/inference/chat_completion");
        }
        case "/telemetry/get_trace" -> {
          resp.setStatus(200);
          resp.getWriter().print("this is not json");
        }
        default -> {
          resp.setStatus(200);
          resp.getWriter().print("{}");
        }
      }
    }
  }

  @BeforeAll
  static void startServer() throws Exception {
    server =
        TestHttp.start(ctx -> ctx.addServlet(new ServletHolder(new CannedServlet()), "/*"));
  }

  @AfterAll
  static void stopServer() {
    server.stop();
  }

  @BeforeEach
  void reset() {
    HITS.clear();
    BODIES.clear();
  }

  private static RemoteStackClient client(boolean structured) {
    return new RemoteStackClient(TestHttp.baseUrl(server), Duration.ofMillis(500), structured);
  }

  @Test
  @DisplayName("Posts the request as JSON to /<api>/<operation> and decodes the result")
  void success() {
    try (RemoteStackClient client = client(false)) {
      ChatCompletionResponse response =
          client.invoke(
              Api.INFERENCE,
              "chat_completion",
              new ChatCompletionRequest("m", List.of(Message.user("hello"))),
              ChatCompletionResponse.class);

      assertEquals("hi there", response.completionMessage().content());
      assertEquals(1, HITS.get("/inference/chat_completion").get());
      assertTrue(BODIES.get("/inference/chat_completion").contains("\"model\":\"m\""));
      assertTrue(BODIES.get("/inference/chat_completion").contains("\"role\":\"user\""));
    }
  }

  @Test
  @DisplayName("Operations without a result return Empty")
  void emptyResult() {
    try (RemoteStackClient client = client(false)) {
      Object result =
          client.invoke(
              Api.MEMORY, "insert", new InsertDocumentsRequest("kb", List.of()), Empty.class);
      assertSame(Empty.INSTANCE, result);
    }
  }

  @Test
  @DisplayName("Non-2xx answers fail with UPSTREAM_ERROR, status and body, without retry")
  void upstreamError() {
    try (RemoteStackClient client = client(false)) {
      AdapterException ex =
          assertThrows(
              AdapterException.class,
              () ->
                  client.invoke(
                      Api.INFERENCE,
                      "completion",
                      new CompletionRequest("m", "x", null),
                      CompletionResponse.class));
      assertEquals(StackErrorCode.UPSTREAM_ERROR, ex.getCode());
      assertEquals(500, ex.statusCode());
      assertEquals("model crashed", ex.body());
      assertEquals(1, HITS.get("/inference/completion").get());
    }
  }

  @Test
  @DisplayName("Redirects are not followed, so the body is posted once")
  void redirectNotFollowed() {
    try (RemoteStackClient client = client(false)) {
      AdapterException ex =
          assertThrows(
              AdapterException.class,
              () ->
                  client.invoke(
                      Api.INFERENCE,
                      "redirected",
                      new ChatCompletionRequest("m", List.of(Message.user("hello"))),
                      ChatCompletionResponse.class));
      assertEquals(StackErrorCode.UPSTREAM_ERROR, ex.getCode());
      assertEquals(307, ex.statusCode());
      assertEquals(1, HITS.get("/inference/redirected").get());
      assertNull(HITS.get("/inference/chat_completion"));
    }
  }

  @Test
  @DisplayName("Structured error bodies are rebuilt as the matching exception")
  void structuredErrors() {
    RunShieldRequest request = new RunShieldRequest("x", List.of(Message.user("hi")));
    try (RemoteStackClient client = client(true)) {
      RoutingException ex =
          assertThrows(
              RoutingException.class,
              () -> client.invoke(Api.SAFETY, "run_shield", request, RunShieldResponse.class));
      assertEquals(StackErrorCode.UNKNOWN_SHIELD, ex.getCode());
      assertEquals("x", ex.getContext().get("shield_type"));
      assertEquals(400, ex.getContext().get(AdapterException.STATUS_CODE));
    }
    try (RemoteStackClient opaque = client(false)) {
      AdapterException ex =
          assertThrows(
              AdapterException.class,
              () -> opaque.invoke(Api.SAFETY, "run_shield", request, RunShieldResponse.class));
      assertEquals(StackErrorCode.UPSTREAM_ERROR, ex.getCode());
      assertEquals(400, ex.statusCode());
    }
  }

  @Test
  @DisplayName("Slow answers fail with TIMEOUT after a single attempt")
  void timeout() {
    try (RemoteStackClient client = client(false)) {
      AdapterException ex =
          assertThrows(
              AdapterException.class,
              () ->
                  client.invoke(
                      Api.INFERENCE,
                      "embeddings",
                      new EmbeddingsRequest("m", List.of("a")),
                      EmbeddingsResponse.class));
      assertEquals(StackErrorCode.TIMEOUT, ex.getCode());
      assertEquals(1, HITS.get("/inference/embeddings").get());
    }
  }

  @Test
  @DisplayName("Bodies that do not decode fail with CONTRACT_VIOLATION")
  void malformedBody() {
    try (RemoteStackClient client = client(false)) {
      RoutingException ex =
          assertThrows(
              RoutingException.class,
              () -> client.invoke(Api.TELEMETRY, "get_trace", new TraceRef("t"), Trace.class));
      assertEquals(StackErrorCode.CONTRACT_VIOLATION, ex.getCode());
    }
  }

  @Test
  @DisplayName("An unreachable stack fails with TRANSPORT_ERROR")
  void unreachable() throws Exception {
    int port;
    try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    try (RemoteStackClient client =
        new RemoteStackClient(
            HttpUrl.get("http://127.0.0.1:" + port + "/"), Duration.ofSeconds(2), false)) {
      AdapterException ex =
          assertThrows(
              AdapterException.class,
              () ->
                  client.invoke(
                      Api.INFERENCE,
                      "completion",
                      new CompletionRequest("m", "x", null),
                      CompletionResponse.class));
      assertEquals(StackErrorCode.TRANSPORT_ERROR, ex.getCode());
    }
  }
}
