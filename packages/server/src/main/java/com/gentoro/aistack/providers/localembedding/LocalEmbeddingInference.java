package com.gentoro.aistack.providers.localembedding;

import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.ChatCompletionResponse;
import com.gentoro.aistack.apis.inference.CompletionRequest;
import com.gentoro.aistack.apis.inference.CompletionResponse;
import com.gentoro.aistack.apis.inference.EmbeddingsRequest;
import com.gentoro.aistack.apis.inference.EmbeddingsResponse;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.exception.UnsupportedFeatureException;
import com.gentoro.aistack.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** In-process embeddings only; text generation is not available from this provider. */
public class LocalEmbeddingInference implements Inference {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(LocalEmbeddingInference.class);

  private final HashingEmbedder embedder;
  private final Set<String> models;

  public LocalEmbeddingInference(HashingEmbedder embedder, Set<String> models) {
    this.embedder = embedder;
    this.models = Set.copyOf(models);
  }

  @Override
  public ChatCompletionResponse chatCompletion(ChatCompletionRequest request) {
    throw new UnsupportedFeatureException("Local embedding provider does not support chat");
  }

  @Override
  public CompletionResponse completion(CompletionRequest request) {
    throw new UnsupportedFeatureException("Local embedding provider does not support completion");
  }

  @Override
  public EmbeddingsResponse embeddings(EmbeddingsRequest request) {
    if (!models.isEmpty() && !models.contains(request.model())) {
      throw new ValidationException(
          "Model " + request.model() + " is not served by the local embedding provider");
    }
    List<String> contents = request.contents() == null ? List.of() : request.contents();
    List<float[]> vectors = new ArrayList<>(contents.size());
    for (String content : contents) {
      vectors.add(embedder.embed(content));
    }
    log.trace("Embedded {} contents with {} dimensions", contents.size(), embedder.dimension());
    return new EmbeddingsResponse(vectors);
  }
}
