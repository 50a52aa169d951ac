package com.gentoro.aistack.client;

import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.ChatCompletionResponse;
import com.gentoro.aistack.apis.inference.CompletionRequest;
import com.gentoro.aistack.apis.inference.CompletionResponse;
import com.gentoro.aistack.apis.inference.EmbeddingsRequest;
import com.gentoro.aistack.apis.inference.EmbeddingsResponse;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.provider.Api;

public class InferenceClient extends TransportClient implements Inference {
  public InferenceClient(CapabilityTransport transport) {
    super(transport);
  }

  @Override
  public ChatCompletionResponse chatCompletion(ChatCompletionRequest request) {
    return transport.invoke(Api.INFERENCE, CHAT_COMPLETION, request, ChatCompletionResponse.class);
  }

  @Override
  public CompletionResponse completion(CompletionRequest request) {
    return transport.invoke(Api.INFERENCE, COMPLETION, request, CompletionResponse.class);
  }

  @Override
  public EmbeddingsResponse embeddings(EmbeddingsRequest request) {
    return transport.invoke(Api.INFERENCE, EMBEDDINGS, request, EmbeddingsResponse.class);
  }
}
