package com.gentoro.aistack.providers.localembedding;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.EmbeddingsRequest;
import com.gentoro.aistack.apis.inference.EmbeddingsResponse;
import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.UnsupportedFeatureException;
import com.gentoro.aistack.exception.ValidationException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LocalEmbeddingInferenceTest {

  private static double cosine(float[] a, float[] b) {
    double dot = 0;
    for (int i = 0; i < a.length; i++) dot += a[i] * b[i];
    return dot;
  }

  private static double norm(float[] v) {
    return Math.sqrt(cosine(v, v));
  }

  @Test
  @DisplayName("Vectors are deterministic, normalized and closer for shared vocabulary")
  void embeddings() {
    HashingEmbedder embedder = new HashingEmbedder(128);
    float[] a = embedder.embed("The cat sat on the mat");
    float[] b = embedder.embed("the CAT sat on a mat");
    float[] c = embedder.embed("quarterly revenue forecast");

    assertArrayEquals(a, embedder.embed("The cat sat on the mat"));
    assertEquals(128, a.length);
    assertEquals(1.0, norm(a), 1e-5);
    assertTrue(cosine(a, b) > cosine(a, c));
  }

  @Test
  @DisplayName("Text without words embeds to the zero vector")
  void zeroVector() {
    HashingEmbedder embedder = new HashingEmbedder(16);
    assertEquals(0.0, norm(embedder.embed("  ...  ")));
    assertEquals(0.0, norm(embedder.embed(null)));
    assertThrows(ConfigException.class, () -> new HashingEmbedder(0));
  }

  @Test
  @DisplayName("Only the configured models are served, one vector per content")
  void servedModels() {
    LocalEmbeddingInference inference =
        new LocalEmbeddingInference(new HashingEmbedder(32), Set.of("local-hash"));

    EmbeddingsResponse response =
        inference.embeddings(new EmbeddingsRequest("local-hash", List.of("a b", "c")));
    assertEquals(2, response.embeddings().size());
    assertThrows(
        ValidationException.class,
        () -> inference.embeddings(new EmbeddingsRequest("other", List.of("x"))));
  }

  @Test
  @DisplayName("Chat is not supported")
  void noChat() {
    LocalEmbeddingInference inference =
        new LocalEmbeddingInference(new HashingEmbedder(32), Set.of());
    UnsupportedFeatureException ex =
        assertThrows(
            UnsupportedFeatureException.class,
            () ->
                inference.chatCompletion(
                    new ChatCompletionRequest("m", List.of(Message.user("hi")))));
    assertEquals(StackErrorCode.UNSUPPORTED_FEATURE, ex.getCode());
  }
}
