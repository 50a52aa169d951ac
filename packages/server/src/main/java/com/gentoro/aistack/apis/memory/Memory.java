package com.gentoro.aistack.apis.memory;

/** Memory capability: vector banks over chunked documents. */
public interface Memory {
  String REGISTER_MEMORY_BANK = "register_memory_bank";
  String INSERT = "insert";
  String QUERY = "query";
  String GET_MEMORY_BANK = "get_memory_bank";
  String LIST_MEMORY_BANKS = "list_memory_banks";
  String DROP_MEMORY_BANK = "drop_memory_bank";

  /**
   * Create a bank.
   *
   * @throws com.gentoro.aistack.exception.ConfigException with {@code DUPLICATE_BANK} when the
   *     identifier is taken
   */
  RegisterMemoryBankResponse registerMemoryBank(MemoryBankDef bank);

  /**
   * Chunk, embed and append documents. The batch is applied atomically.
   *
   * @throws com.gentoro.aistack.exception.NotFoundException for an unknown bank
   * @throws com.gentoro.aistack.exception.ChunkingException with {@code DUPLICATE_DOCUMENT_ID}
   */
  void insertDocuments(InsertDocumentsRequest request);

  QueryDocumentsResponse queryDocuments(QueryDocumentsRequest request);

  MemoryBankDef getMemoryBank(BankRef ref);

  ListMemoryBanksResponse listMemoryBanks();

  void dropMemoryBank(BankRef ref);
}
