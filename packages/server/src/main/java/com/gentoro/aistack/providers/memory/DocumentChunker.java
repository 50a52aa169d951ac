package com.gentoro.aistack.providers.memory;

import com.gentoro.aistack.apis.memory.Chunk;
import com.gentoro.aistack.exception.ChunkingException;
import com.gentoro.aistack.exception.StackErrorCode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fixed-window chunker. Windows hold {@code chunkSize} tokens and consecutive windows share {@code
 * overlap} tokens; the last window may be shorter. Windowing stops at the first window that reaches
 * the end of the text, so a text that fits in one window yields one chunk.
 */
public final class DocumentChunker {
  private final int chunkSize;
  private final int overlap;

  public DocumentChunker(int chunkSize, int overlap) {
    if (chunkSize <= 0 || overlap < 0 || overlap >= chunkSize) {
      throw new ChunkingException(
          StackErrorCode.CHUNKING_ERROR,
          "Invalid chunking window: chunk size %d, overlap %d".formatted(chunkSize, overlap),
          Map.of("chunk_size_in_tokens", chunkSize, "overlap_size_in_tokens", overlap));
    }
    this.chunkSize = chunkSize;
    this.overlap = overlap;
  }

  public List<Chunk> chunk(String documentId, String text) {
    List<Tokenizer.Token> tokens = Tokenizer.tokenize(text);
    List<Chunk> chunks = new ArrayList<>();
    if (tokens.isEmpty()) return chunks;

    int stride = chunkSize - overlap;
    for (int start = 0; ; start += stride) {
      int end = Math.min(start + chunkSize, tokens.size());
      String content = text.substring(tokens.get(start).start(), tokens.get(end - 1).end());
      chunks.add(new Chunk(documentId, content, end - start));
      if (end == tokens.size()) break;
    }
    return chunks;
  }
}
