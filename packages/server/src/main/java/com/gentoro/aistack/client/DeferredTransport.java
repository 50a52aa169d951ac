package com.gentoro.aistack.client;

import com.gentoro.aistack.exception.StateException;
import com.gentoro.aistack.provider.Api;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transport whose target is bound after construction. Adapters receive their dependencies before
 * the router that will serve them exists.
 */
public final class DeferredTransport implements CapabilityTransport {
  private final AtomicReference<CapabilityTransport> target = new AtomicReference<>();

  public void bind(CapabilityTransport transport) {
    if (!target.compareAndSet(null, transport)) {
      throw new StateException("Transport already bound");
    }
  }

  @Override
  public <R> R invoke(Api api, String operation, Object request, Class<R> resultType) {
    CapabilityTransport t = target.get();
    if (t == null) {
      throw new StateException(
          "Stack is still being assembled, cannot call %s/%s".formatted(api, operation));
    }
    return t.invoke(api, operation, request, resultType);
  }
}
