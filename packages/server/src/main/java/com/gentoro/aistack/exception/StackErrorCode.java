package com.gentoro.aistack.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical error codes for the stack. Codes are stable and suitable for downstream services and
 * logs. Each code is either a client error (the request or the configuration is wrong) or a backend
 * failure (a provider failed to serve a valid request), so callers can pick a retry strategy.
 */
public enum StackErrorCode {
  // Generic
  UNKNOWN(Origin.BACKEND),
  INVALID_ARGUMENT(Origin.CLIENT),
  FAILED_PRECONDITION(Origin.CLIENT),
  NOT_FOUND(Origin.CLIENT),
  CANCELLED(Origin.BACKEND),

  // Configuration and I/O
  CONFIGURATION_ERROR(Origin.CLIENT),
  MISSING_CAPABILITY(Origin.CLIENT),
  UNKNOWN_PROVIDER_KIND(Origin.CLIENT),
  DUPLICATE_BANK(Origin.CLIENT),
  IO_ERROR(Origin.BACKEND),
  PROMPT_ERROR(Origin.BACKEND),
  SERIALIZATION_ERROR(Origin.CLIENT),

  // Routing
  NO_ACTIVE_PROVIDER(Origin.CLIENT),
  UNKNOWN_OPERATION(Origin.CLIENT),
  UNKNOWN_SHIELD(Origin.CLIENT),
  CONTRACT_VIOLATION(Origin.CLIENT),

  // Adapter
  TIMEOUT(Origin.BACKEND),
  UPSTREAM_ERROR(Origin.BACKEND),
  TRANSPORT_ERROR(Origin.BACKEND),
  EXECUTION_ERROR(Origin.BACKEND),

  // Memory
  DUPLICATE_DOCUMENT_ID(Origin.CLIENT),
  CHUNKING_ERROR(Origin.CLIENT),

  UNSUPPORTED_FEATURE(Origin.CLIENT);

  /** Who is expected to act on the failure. */
  public enum Origin {
    @JsonProperty("client")
    CLIENT,
    @JsonProperty("backend")
    BACKEND
  }

  private final Origin origin;

  StackErrorCode(Origin origin) {
    this.origin = origin;
  }

  public Origin origin() {
    return origin;
  }

  public boolean isBackendFailure() {
    return origin == Origin.BACKEND;
  }
}
