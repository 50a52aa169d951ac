package com.gentoro.aistack.providers.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.ChatCompletionResponse;
import com.gentoro.aistack.apis.inference.CompletionRequest;
import com.gentoro.aistack.apis.inference.CompletionResponse;
import com.gentoro.aistack.apis.inference.EmbeddingsRequest;
import com.gentoro.aistack.apis.inference.EmbeddingsResponse;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.apis.inference.SamplingParams;
import com.gentoro.aistack.apis.inference.StopReason;
import com.gentoro.aistack.exception.AdapterException;
import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.SerializationException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.http.OkHttpFactory;
import com.gentoro.aistack.utility.JacksonUtility;
import io.github.ollama4j.Ollama;
import io.github.ollama4j.exceptions.OllamaException;
import io.github.ollama4j.models.chat.OllamaChatMessageRole;
import io.github.ollama4j.models.chat.OllamaChatRequest;
import io.github.ollama4j.models.chat.OllamaChatResult;
import io.github.ollama4j.models.chat.OllamaChatStreamObserver;
import io.github.ollama4j.models.generate.OllamaGenerateTokenHandler;
import io.github.ollama4j.utils.Options;
import io.github.ollama4j.utils.OptionsBuilder;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Inference served by an Ollama server. Chat goes through ollama4j; embeddings use the {@code
 * /api/embed} endpoint directly. Stack model identifiers are translated to Ollama tags with {@link
 * OllamaModels}; identifiers listed as embedding models are passed through unchanged.
 */
public class OllamaInferenceAdapter implements Inference, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(OllamaInferenceAdapter.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final HttpUrl baseUrl;
  private final Ollama ollama;
  private final OkHttpClient http;
  private final Set<String> embeddingModels;

  public OllamaInferenceAdapter(HttpUrl baseUrl, Duration timeout, Set<String> embeddingModels) {
    this.baseUrl = baseUrl;
    this.embeddingModels = Set.copyOf(embeddingModels);
    String host = baseUrl.toString();
    this.ollama = new Ollama(host.endsWith("/") ? host.substring(0, host.length() - 1) : host);
    this.ollama.setRequestTimeoutSeconds(Math.max(1, timeout.toSeconds()));
    this.http = OkHttpFactory.create(timeout);
  }

  @Override
  public ChatCompletionResponse chatCompletion(ChatCompletionRequest request) {
    if (request.messages() == null || request.messages().isEmpty()) {
      throw new ValidationException("chat_completion requires at least one message");
    }
    String tag = OllamaModels.requireOllamaTag(request.model());
    String content = chat(tag, request.messages(), request.samplingParams());
    return new ChatCompletionResponse(Message.assistant(content), StopReason.END_OF_TURN);
  }

  @Override
  public CompletionResponse completion(CompletionRequest request) {
    if (request.content() == null) {
      throw new ValidationException("completion requires content");
    }
    String tag = OllamaModels.requireOllamaTag(request.model());
    String content =
        chat(tag, List.of(Message.user(request.content())), request.samplingParams());
    return new CompletionResponse(content, StopReason.END_OF_TURN);
  }

  private String chat(String tag, List<Message> messages, SamplingParams params) {
    OllamaChatRequest builder =
        OllamaChatRequest.builder()
            .withModel(tag)
            .withUseTools(false)
            .withOptions(options(params))
            .withTools(new ArrayList<>());
    messages.forEach(
        m ->
            builder.withMessage(
                switch (m.role()) {
                  case USER -> OllamaChatMessageRole.USER;
                  case ASSISTANT -> OllamaChatMessageRole.ASSISTANT;
                  case SYSTEM -> OllamaChatMessageRole.SYSTEM;
                  case TOOL -> OllamaChatMessageRole.TOOL;
                },
                m.content()));

    OllamaChatStreamObserver streamObserver = new OllamaChatStreamObserver();
    streamObserver.setThinkingStreamHandler(
        new OllamaGenerateTokenHandler() {
          @Override
          public void accept(String message) {
            log.trace("[{}] thinking: {}", tag, message);
          }
        });
    streamObserver.setResponseStreamHandler(
        new OllamaGenerateTokenHandler() {
          @Override
          public void accept(String message) {
            log.trace("[{}] token: {}", tag, message);
          }
        });

    long start = System.currentTimeMillis();
    try {
      OllamaChatResult result = ollama.chat(builder.build(), streamObserver);
      log.debug(
          "Ollama chat on {} took {} ms, prompt tokens {}",
          tag,
          System.currentTimeMillis() - start,
          result.getResponseModel().getPromptEvalCount());
      return result.getResponseModel().getMessage().getResponse();
    } catch (OllamaException e) {
      throw new AdapterException(
          StackErrorCode.UPSTREAM_ERROR,
          "Ollama chat failed for model " + tag + ": " + e.getMessage(),
          Map.of("url", baseUrl.toString(), "model", tag),
          e);
    }
  }

  private static Options options(SamplingParams params) {
    OptionsBuilder options = new OptionsBuilder();
    if (params == null) {
      return options.build();
    }
    if (params.temperature() != null) options.setTemperature(params.temperature().floatValue());
    if (params.topP() != null) options.setTopP(params.topP().floatValue());
    if (params.maxTokens() != null) options.setNumPredict(params.maxTokens());
    if (params.repetitionPenalty() != null) {
      options.setRepeatPenalty(params.repetitionPenalty().floatValue());
    }
    return options.build();
  }

  @Override
  public EmbeddingsResponse embeddings(EmbeddingsRequest request) {
    if (request.contents() == null || request.contents().isEmpty()) {
      return new EmbeddingsResponse(List.of());
    }
    String model = embeddingTag(request.model());
    HttpUrl url = baseUrl.newBuilder().addPathSegments("api/embed").build();
    String payload = JacksonUtility.toJson(Map.of("model", model, "input", request.contents()));
    Request httpRequest =
        new Request.Builder().url(url).post(RequestBody.create(payload, JSON)).build();
    try (Response response = http.newCall(httpRequest).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw AdapterException.upstream(response.code(), text).annotate("model", model);
      }
      return parseEmbeddings(model, text);
    } catch (InterruptedIOException e) {
      throw new AdapterException(
          StackErrorCode.TIMEOUT,
          "Ollama embeddings timed out for model " + model,
          Map.of("url", url.toString()),
          e);
    } catch (IOException e) {
      throw new AdapterException(
          StackErrorCode.TRANSPORT_ERROR,
          "Ollama unreachable at " + url,
          Map.of("url", url.toString()),
          e);
    }
  }

  String embeddingTag(String model) {
    if (model != null && embeddingModels.contains(model)) {
      return model;
    }
    return OllamaModels.requireOllamaTag(model);
  }

  static EmbeddingsResponse parseEmbeddings(String model, String body) {
    JsonNode vectors;
    try {
      vectors = JacksonUtility.readTree(body).path("embeddings");
    } catch (SerializationException e) {
      throw new RoutingException(
          StackErrorCode.CONTRACT_VIOLATION,
          "Ollama answered embeddings with malformed JSON",
          Map.of("model", model));
    }
    if (!vectors.isArray()) {
      throw new RoutingException(
          StackErrorCode.CONTRACT_VIOLATION,
          "Ollama answered without an embeddings array",
          Map.of("model", model));
    }
    List<float[]> embeddings = new ArrayList<>(vectors.size());
    for (JsonNode vector : vectors) {
      float[] values = new float[vector.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = (float) vector.get(i).asDouble();
      }
      embeddings.add(values);
    }
    return new EmbeddingsResponse(embeddings);
  }

  @Override
  public void close() {
    http.dispatcher().executorService().shutdown();
    http.connectionPool().evictAll();
  }
}
