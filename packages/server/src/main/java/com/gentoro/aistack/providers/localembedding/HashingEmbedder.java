package com.gentoro.aistack.providers.localembedding;

import com.gentoro.aistack.exception.ConfigException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic bag-of-words embedder. Every lower-cased word and word bigram is hashed into one
 * of {@code dimension} buckets with a hash-derived sign; the vector is L2-normalized. Texts that
 * share vocabulary end up close in cosine space, which is enough for offline retrieval.
 */
public final class HashingEmbedder {
  public static final int DEFAULT_DIMENSION = 384;

  private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

  private final int dimension;

  public HashingEmbedder(int dimension) {
    if (dimension <= 0) {
      throw new ConfigException("dimension must be positive: " + dimension);
    }
    this.dimension = dimension;
  }

  public int dimension() {
    return dimension;
  }

  public float[] embed(String text) {
    float[] vector = new float[dimension];
    if (text == null) {
      return vector;
    }
    Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
    String previous = null;
    while (m.find()) {
      String word = m.group();
      add(vector, word, 1.0f);
      if (previous != null) {
        add(vector, previous + " " + word, 0.5f);
      }
      previous = word;
    }
    normalize(vector);
    return vector;
  }

  private void add(float[] vector, String feature, float weight) {
    int h = fnv1a(feature);
    int bucket = Math.floorMod(h, dimension);
    vector[bucket] += ((h >>> 31) == 0 ? weight : -weight);
  }

  private static void normalize(float[] vector) {
    double sum = 0.0;
    for (float v : vector) sum += v * v;
    if (sum == 0.0) return;
    float norm = (float) Math.sqrt(sum);
    for (int i = 0; i < vector.length; i++) {
      vector[i] /= norm;
    }
  }

  // 32-bit FNV-1a over the UTF-8 bytes.
  private static int fnv1a(String s) {
    int hash = 0x811c9dc5;
    for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
      hash ^= (b & 0xff);
      hash *= 0x01000193;
    }
    return hash;
  }
}
