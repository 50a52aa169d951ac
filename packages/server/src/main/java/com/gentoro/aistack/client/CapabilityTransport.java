package com.gentoro.aistack.client;

import com.gentoro.aistack.provider.Api;

/**
 * Moves one capability call to whoever serves it. The in-process router and the HTTP client of a
 * remote stack both implement this, which is what makes a local adapter and a remote proxy
 * interchangeable behind the same contract.
 */
public interface CapabilityTransport {

  /**
   * @param resultType expected result type; {@link com.gentoro.aistack.apis.Empty} for operations
   *     without a result
   */
  <R> R invoke(Api api, String operation, Object request, Class<R> resultType);
}
