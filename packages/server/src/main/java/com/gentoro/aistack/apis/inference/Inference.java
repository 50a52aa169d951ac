package com.gentoro.aistack.apis.inference;

/**
 * Inference capability. Model internals live behind this interface: providers talk to a model
 * server or compute locally, callers only see messages in and messages or vectors out.
 */
public interface Inference {
  String CHAT_COMPLETION = "chat_completion";
  String COMPLETION = "completion";
  String EMBEDDINGS = "embeddings";

  ChatCompletionResponse chatCompletion(ChatCompletionRequest request);

  CompletionResponse completion(CompletionRequest request);

  /** Embed every content string with the requested model. */
  EmbeddingsResponse embeddings(EmbeddingsRequest request);
}
