package com.gentoro.aistack.providers.memory;

import com.gentoro.aistack.apis.memory.Chunk;
import com.gentoro.aistack.apis.memory.MemoryBankDef;
import com.gentoro.aistack.apis.memory.MemoryBankDocument;
import com.gentoro.aistack.exception.ChunkingException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Chunks and embeddings of one bank. Append-only; writers take the write lock for the whole batch
 * so the chunks of a document are contiguous and queries never see half a batch.
 */
final class BankIndex {
  private final MemoryBankDef definition;
  private final long registrationOrder;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<StoredChunk> chunks = new ArrayList<>();
  private final Map<String, MemoryBankDocument> documents = new LinkedHashMap<>();
  private int dimension = -1;

  /** A chunk with its vector; {@code seq} is its insertion position in the bank. */
  record StoredChunk(Chunk chunk, float[] embedding, long seq) {}

  /** A chunk scored against a query. */
  record Scored(StoredChunk stored, double score) {
    static final Comparator<Scored> ORDER =
        Comparator.comparingDouble(Scored::score)
            .reversed()
            .thenComparingLong(s -> s.stored().seq());
  }

  BankIndex(MemoryBankDef definition, long registrationOrder) {
    this.definition = definition;
    this.registrationOrder = registrationOrder;
  }

  MemoryBankDef definition() {
    return definition;
  }

  long registrationOrder() {
    return registrationOrder;
  }

  boolean containsDocument(String documentId) {
    lock.readLock().lock();
    try {
      return documents.containsKey(documentId);
    } finally {
      lock.readLock().unlock();
    }
  }

  int size() {
    lock.readLock().lock();
    try {
      return chunks.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Append a batch. {@code chunks} and {@code embeddings} are parallel and ordered by document.
   * Nothing is written when a document id is already present or a vector has the wrong dimension.
   */
  void append(
      Collection<MemoryBankDocument> batch, List<Chunk> newChunks, List<float[]> embeddings) {
    lock.writeLock().lock();
    try {
      for (MemoryBankDocument doc : batch) {
        if (documents.containsKey(doc.documentId())) {
          throw duplicate(doc.documentId());
        }
      }
      int dim = dimension;
      for (float[] vector : embeddings) {
        if (dim < 0) {
          dim = vector.length;
        } else if (vector.length != dim) {
          throw new ValidationException(
              "Embedding dimension %d does not match bank dimension %d"
                  .formatted(vector.length, dim));
        }
      }
      dimension = dim;
      for (MemoryBankDocument doc : batch) {
        documents.put(doc.documentId(), doc);
      }
      for (int i = 0; i < newChunks.size(); i++) {
        chunks.add(new StoredChunk(newChunks.get(i), embeddings.get(i), chunks.size()));
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Top {@code k} chunks by cosine similarity to {@code query}, best first. */
  List<Scored> topK(float[] query, int k) {
    lock.readLock().lock();
    try {
      if (dimension > 0 && query.length != dimension) {
        throw new ValidationException(
            "Query embedding dimension %d does not match bank dimension %d"
                .formatted(query.length, dimension));
      }
      List<Scored> scored = new ArrayList<>(chunks.size());
      for (StoredChunk c : chunks) {
        scored.add(new Scored(c, cosineSimilarity(query, c.embedding())));
      }
      scored.sort(Scored.ORDER);
      return scored.size() > k ? new ArrayList<>(scored.subList(0, k)) : scored;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Merge per-query results; a chunk keeps its best score. */
  static List<Scored> merge(List<List<Scored>> perQuery, int k) {
    Map<Long, Scored> best = new HashMap<>();
    for (List<Scored> results : perQuery) {
      for (Scored s : results) {
        best.merge(s.stored().seq(), s, (a, b) -> b.score() > a.score() ? b : a);
      }
    }
    List<Scored> merged = new ArrayList<>(best.values());
    merged.sort(Scored.ORDER);
    return merged.size() > k ? merged.subList(0, k) : merged;
  }

  static double cosineSimilarity(float[] a, float[] b) {
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  static ChunkingException duplicate(String documentId) {
    return new ChunkingException(
        StackErrorCode.DUPLICATE_DOCUMENT_ID,
        "Document '%s' is already present".formatted(documentId),
        Map.of("document_id", documentId));
  }
}
