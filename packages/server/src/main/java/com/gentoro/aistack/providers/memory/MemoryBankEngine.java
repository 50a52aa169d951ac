package com.gentoro.aistack.providers.memory;

import com.gentoro.aistack.apis.inference.EmbeddingsRequest;
import com.gentoro.aistack.apis.inference.EmbeddingsResponse;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.Chunk;
import com.gentoro.aistack.apis.memory.InsertDocumentsRequest;
import com.gentoro.aistack.apis.memory.ListMemoryBanksResponse;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memory.MemoryBankDef;
import com.gentoro.aistack.apis.memory.MemoryBankDocument;
import com.gentoro.aistack.apis.memory.QueryDocumentsRequest;
import com.gentoro.aistack.apis.memory.QueryDocumentsResponse;
import com.gentoro.aistack.apis.memory.RegisterMemoryBankResponse;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.ValidationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process memory provider: chunks documents, embeds the chunks through the inference
 * capability and answers similarity queries with cosine scores.
 *
 * <p>Embeddings are computed before any bank lock is taken; only the append itself runs under the
 * bank's write lock.
 */
public class MemoryBankEngine implements Memory {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(MemoryBankEngine.class);

  public static final int DEFAULT_MAX_CHUNKS = 10;
  public static final int DEFAULT_MAX_CHUNKS_LIMIT = 100;
  public static final int DEFAULT_EMBEDDING_BATCH_SIZE = 64;

  private final String providerId;
  private final Inference inference;
  private final DocumentContentLoader contentLoader;
  private final int defaultMaxChunks;
  private final int maxChunksLimit;
  private final int embeddingBatchSize;
  private final Map<String, BankIndex> banks = new ConcurrentHashMap<>();
  private final AtomicLong registrations = new AtomicLong();

  public MemoryBankEngine(
      String providerId,
      Inference inference,
      DocumentContentLoader contentLoader,
      int defaultMaxChunks,
      int maxChunksLimit,
      int embeddingBatchSize) {
    if (maxChunksLimit < 1 || defaultMaxChunks < 1 || embeddingBatchSize < 1) {
      throw new ConfigException(
          "max_chunks, max_chunks_limit and embedding_batch_size must be positive");
    }
    this.providerId = providerId;
    this.inference = inference;
    this.contentLoader = contentLoader;
    this.defaultMaxChunks = Math.min(defaultMaxChunks, maxChunksLimit);
    this.maxChunksLimit = maxChunksLimit;
    this.embeddingBatchSize = embeddingBatchSize;
  }

  @Override
  public RegisterMemoryBankResponse registerMemoryBank(MemoryBankDef bank) {
    if (bank == null || bank.identifier() == null || bank.identifier().isBlank()) {
      throw new ValidationException("Memory bank identifier is required");
    }
    if (bank.embeddingModel() == null || bank.embeddingModel().isBlank()) {
      throw new ValidationException("embedding_model is required for bank " + bank.identifier());
    }
    if (bank.chunkSizeInTokens() <= 0
        || bank.overlapSizeInTokens() < 0
        || bank.overlapSizeInTokens() >= bank.chunkSizeInTokens()) {
      throw new ValidationException(
          "Bank %s needs chunk_size_in_tokens > 0 and 0 <= overlap_size_in_tokens < chunk size"
              .formatted(bank.identifier()));
    }
    MemoryBankDef def = bank.withProviderId(providerId);
    BankIndex index = new BankIndex(def, registrations.incrementAndGet());
    if (banks.putIfAbsent(def.identifier(), index) != null) {
      throw new ConfigException(
          StackErrorCode.DUPLICATE_BANK,
          "Memory bank '%s' already exists".formatted(def.identifier()),
          Map.of("bank_id", def.identifier()));
    }
    log.info(
        "Registered memory bank '{}' (model {}, chunk {}/{})",
        def.identifier(),
        def.embeddingModel(),
        def.chunkSizeInTokens(),
        def.overlapSizeInTokens());
    return new RegisterMemoryBankResponse(def.identifier());
  }

  @Override
  public void insertDocuments(InsertDocumentsRequest request) {
    BankIndex bank = require(request.bankId());
    List<MemoryBankDocument> documents =
        request.documents() == null ? List.of() : request.documents();
    if (documents.isEmpty()) {
      return;
    }

    Set<String> ids = new HashSet<>();
    for (MemoryBankDocument doc : documents) {
      if (doc == null || doc.documentId() == null || doc.documentId().isBlank()) {
        throw new ValidationException("Every document needs a document_id");
      }
      if (!ids.add(doc.documentId()) || bank.containsDocument(doc.documentId())) {
        throw BankIndex.duplicate(doc.documentId());
      }
    }

    MemoryBankDef def = bank.definition();
    DocumentChunker chunker =
        new DocumentChunker(def.chunkSizeInTokens(), def.overlapSizeInTokens());
    List<Chunk> chunks = new ArrayList<>();
    for (MemoryBankDocument doc : documents) {
      DocumentContentLoader.LoadedContent content = contentLoader.load(doc);
      chunks.addAll(chunker.chunk(doc.documentId(), content.text()));
    }

    List<float[]> embeddings =
        embed(def.embeddingModel(), chunks.stream().map(Chunk::content).toList());
    bank.append(documents, chunks, embeddings);
    log.debug(
        "Inserted {} document(s) as {} chunk(s) into bank '{}'",
        documents.size(),
        chunks.size(),
        def.identifier());
  }

  @Override
  public QueryDocumentsResponse queryDocuments(QueryDocumentsRequest request) {
    BankIndex bank = require(request.bankId());
    List<String> queries = request.query() == null ? List.of() : request.query();
    if (queries.isEmpty() || queries.stream().anyMatch(q -> q == null || q.isBlank())) {
      throw new ValidationException("query must contain at least one non-blank string");
    }
    int k = maxChunks(request.params());

    if (bank.size() == 0) {
      return new QueryDocumentsResponse(List.of(), List.of());
    }
    List<float[]> vectors = embed(bank.definition().embeddingModel(), queries);
    List<List<BankIndex.Scored>> perQuery = new ArrayList<>();
    for (float[] vector : vectors) {
      perQuery.add(bank.topK(vector, k));
    }
    List<BankIndex.Scored> merged = BankIndex.merge(perQuery, k);

    List<Chunk> chunks = new ArrayList<>(merged.size());
    List<Double> scores = new ArrayList<>(merged.size());
    for (BankIndex.Scored s : merged) {
      chunks.add(s.stored().chunk());
      scores.add(s.score());
    }
    return new QueryDocumentsResponse(chunks, scores);
  }

  @Override
  public MemoryBankDef getMemoryBank(BankRef ref) {
    return require(ref == null ? null : ref.bankId()).definition();
  }

  @Override
  public ListMemoryBanksResponse listMemoryBanks() {
    return new ListMemoryBanksResponse(
        banks.values().stream()
            .sorted(Comparator.comparingLong(BankIndex::registrationOrder))
            .map(BankIndex::definition)
            .toList());
  }

  @Override
  public void dropMemoryBank(BankRef ref) {
    String bankId = ref == null ? null : ref.bankId();
    require(bankId);
    if (banks.remove(bankId) != null) {
      log.info("Dropped memory bank '{}'", bankId);
    }
  }

  private BankIndex require(String bankId) {
    if (bankId == null || bankId.isBlank()) {
      throw new ValidationException("bank_id is required");
    }
    BankIndex bank = banks.get(bankId);
    if (bank == null) {
      throw new NotFoundException(
          "Memory bank '%s' does not exist".formatted(bankId), Map.of("bank_id", bankId));
    }
    return bank;
  }

  private int maxChunks(Map<String, Object> params) {
    Object raw = params == null ? null : params.get(QueryDocumentsRequest.MAX_CHUNKS);
    if (raw == null) {
      return defaultMaxChunks;
    }
    int requested;
    try {
      requested = raw instanceof Number n ? n.intValue() : Integer.parseInt(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("max_chunks must be an integer, got " + raw, e);
    }
    if (requested < 1) {
      throw new ValidationException("max_chunks must be positive, got " + requested);
    }
    return Math.min(requested, maxChunksLimit);
  }

  private List<float[]> embed(String model, List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int from = 0; from < texts.size(); from += embeddingBatchSize) {
      List<String> batch =
          List.copyOf(texts.subList(from, Math.min(texts.size(), from + embeddingBatchSize)));
      EmbeddingsResponse response = inference.embeddings(new EmbeddingsRequest(model, batch));
      if (response == null
          || response.embeddings() == null
          || response.embeddings().size() != batch.size()) {
        throw new RoutingException(
            StackErrorCode.CONTRACT_VIOLATION,
            "Embedding model %s returned a wrong number of vectors".formatted(model),
            Map.of("model", model));
      }
      vectors.addAll(response.embeddings());
    }
    return vectors;
  }
}
