package com.gentoro.aistack.provider;

import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import java.util.Map;

/** Where a provider runs: in this process, or behind HTTP. */
public enum ProviderKind {
  INLINE,
  REMOTE;

  public static final String REMOTE_PREFIX = "remote::";
  public static final String INLINE_PREFIX = "inline::";
  public static final String META_REFERENCE = "meta-reference";

  /** Derive the kind from a provider type such as {@code remote::ollama}. */
  public static ProviderKind fromProviderType(String providerType) {
    String type = providerType == null ? "" : providerType.trim();
    if (type.startsWith(REMOTE_PREFIX) && type.length() > REMOTE_PREFIX.length()) {
      return REMOTE;
    }
    if ((type.startsWith(INLINE_PREFIX) && type.length() > INLINE_PREFIX.length())
        || type.equals(META_REFERENCE)) {
      return INLINE;
    }
    throw new ConfigException(
        StackErrorCode.UNKNOWN_PROVIDER_KIND,
        "Cannot derive provider kind from provider_type '" + type + "'",
        Map.of("provider_type", type));
  }
}
