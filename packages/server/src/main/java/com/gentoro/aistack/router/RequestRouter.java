package com.gentoro.aistack.router;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memory.RegisterMemoryBankResponse;
import com.gentoro.aistack.client.CapabilityTransport;
import com.gentoro.aistack.exception.AdapterException;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.StackException;
import com.gentoro.aistack.exception.StateException;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.logging.LogContext;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderRegistry;
import com.gentoro.aistack.provider.RegisteredProvider;
import com.gentoro.aistack.utility.JacksonUtility;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches capability calls to the provider that serves them.
 *
 * <p>Each call is bound to its request type, routed (explicit provider id, then resource owner,
 * then the active provider of the api), executed on the worker pool and its result is checked
 * against the operation's declared shape. Failures are annotated with {@code api}, {@code
 * provider_id} and {@code operation} and re-raised; nothing is retried.
 *
 * <p>Calls an adapter makes into the stack while it is being served (memory asking inference for
 * embeddings, a shield asking inference for a verdict) run on the calling worker, so nested calls
 * never wait for a free worker.
 */
public class RequestRouter implements CapabilityTransport, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(RequestRouter.class);

  private static final ThreadLocal<Boolean> ON_WORKER = ThreadLocal.withInitial(() -> false);

  private final ProviderRegistry registry;
  private final ExecutorService executor;
  private final long callTimeoutMs;
  private final Map<String, RegisteredProvider> bankRoutes = new ConcurrentHashMap<>();
  private final RoutingTables routingTables;

  public RequestRouter(ProviderRegistry registry, int workerThreads, long callTimeoutMs) {
    if (workerThreads < 1) {
      throw new ConfigException("router.worker-threads must be at least 1, got " + workerThreads);
    }
    if (callTimeoutMs < 0) {
      throw new ConfigException("router.call-timeout-ms must not be negative");
    }
    this.registry = registry;
    this.callTimeoutMs = callTimeoutMs;
    this.routingTables = new RoutingTables(registry, this::bankOwner);
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newFixedThreadPool(
            workerThreads,
            r -> {
              Thread t =
                  new Thread(
                      () -> {
                        ON_WORKER.set(true);
                        r.run();
                      },
                      "router-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public ProviderRegistry registry() {
    return registry;
  }

  /** Dispatch by wire names, as received over HTTP. */
  public Object dispatch(String apiName, String operation, Object payload) {
    Api api =
        Api.fromWireName(apiName)
            .orElseThrow(
                () ->
                    new RoutingException(
                        StackErrorCode.UNKNOWN_OPERATION,
                        "Unknown api '%s'".formatted(apiName),
                        Map.of("api", String.valueOf(apiName))));
    return dispatch(api, operation, payload);
  }

  /**
   * Serve one call and wait for its result.
   *
   * @param payload an instance of the operation's request type, or an untyped form of it (Jackson
   *     tree, map) that is bound first
   * @throws RoutingException for unknown operations, missing providers and malformed results
   * @throws AdapterException when the provider fails or the call exceeds {@code
   *     router.call-timeout-ms}
   */
  public Object dispatch(Api api, String operation, Object payload) {
    Call call = prepare(api, operation, payload);
    if (ON_WORKER.get()) {
      return execute(call);
    }
    Future<Object> future;
    try {
      future = executor.submit(() -> execute(call));
    } catch (RejectedExecutionException e) {
      throw call.annotate(new StateException("Router is shut down", e));
    }
    try {
      return callTimeoutMs > 0
          ? future.get(callTimeoutMs, TimeUnit.MILLISECONDS)
          : future.get();
    } catch (TimeoutException e) {
      future.cancel(true);
      throw call.annotate(timeout(call, e));
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw call.annotate(
          new StackException(StackErrorCode.CANCELLED, "Interrupted while waiting for " + call, e));
    } catch (ExecutionException e) {
      throw call.annotate(unwrap(call, e.getCause()));
    }
  }

  /** Like {@link #dispatch(Api, String, Object)} without blocking the caller. */
  public CompletableFuture<Object> dispatchAsync(Api api, String operation, Object payload) {
    CompletableFuture<Object> result = new CompletableFuture<>();
    Call call;
    try {
      call = prepare(api, operation, payload);
    } catch (StackException e) {
      result.completeExceptionally(e);
      return result;
    }
    Future<?> task;
    try {
      task =
          executor.submit(
              () -> {
                try {
                  result.complete(execute(call));
                } catch (RuntimeException e) {
                  result.completeExceptionally(e);
                }
              });
    } catch (RejectedExecutionException e) {
      result.completeExceptionally(call.annotate(new StateException("Router is shut down", e)));
      return result;
    }
    if (callTimeoutMs > 0) {
      CompletableFuture.delayedExecutor(callTimeoutMs, TimeUnit.MILLISECONDS)
          .execute(
              () -> {
                if (result.completeExceptionally(call.annotate(timeout(call, null)))) {
                  task.cancel(true);
                }
              });
    }
    return result;
  }

  @Override
  public <R> R invoke(Api api, String operation, Object request, Class<R> resultType) {
    Object result = dispatch(api, operation, request);
    if (!resultType.isInstance(result)) {
      throw new RoutingException(
          StackErrorCode.CONTRACT_VIOLATION,
          "%s/%s returned %s, caller expected %s"
              .formatted(
                  api.wireName(),
                  operation,
                  result.getClass().getSimpleName(),
                  resultType.getSimpleName()));
    }
    return resultType.cast(result);
  }

  private Call prepare(Api api, String operation, Object payload) {
    OperationDef<?, ?, ?> op =
        OperationCatalog.find(api, operation)
            .orElseThrow(
                () ->
                    new RoutingException(
                        StackErrorCode.UNKNOWN_OPERATION,
                        "Unknown operation '%s' for api '%s'".formatted(operation, api.wireName()),
                        Map.of("api", api.wireName(), "operation", String.valueOf(operation))));
    Call call = new Call(op, null, null);
    try {
      if (!registry.exposes(api)) {
        throw new RoutingException(
            StackErrorCode.NO_ACTIVE_PROVIDER,
            "Api '%s' is not served by this stack".formatted(api.wireName()));
      }
      Object request = bind(op, payload);
      RegisteredProvider provider = api.isRoutingTable() ? null : select(op, request);
      return new Call(op, request, provider);
    } catch (StackException e) {
      throw call.annotate(e);
    }
  }

  private Object bind(OperationDef<?, ?, ?> op, Object payload) {
    if (op.requestType().isInstance(payload)) {
      return payload;
    }
    if (payload == null && op.requestType() == Empty.class) {
      return Empty.INSTANCE;
    }
    Object request = payload == null ? null : JacksonUtility.bind(payload, op.requestType());
    if (request == null) {
      throw new ValidationException("Missing request payload for " + op);
    }
    return request;
  }

  private RegisteredProvider select(OperationDef<?, ?, ?> op, Object request) {
    Api api = op.api();
    String explicit = op.providerKey(request);
    if (explicit != null && !explicit.isBlank()) {
      return registry
          .find(api, explicit)
          .orElseThrow(
              () ->
                  new RoutingException(
                      StackErrorCode.NO_ACTIVE_PROVIDER,
                      "No provider '%s' is bound for api '%s'".formatted(explicit, api.wireName()),
                      Map.of("requested_provider_id", explicit)));
    }
    String resource = op.resourceKey(request);
    if (resource != null) {
      RegisteredProvider owner =
          api == Api.MEMORY
              ? bankRoutes.get(resource)
              : registry.ownerOf(api, resource).orElse(null);
      if (owner != null) {
        return owner;
      }
    }
    return registry.active(api);
  }

  private RegisteredProvider bankOwner(String bankId) {
    RegisteredProvider owner = bankRoutes.get(bankId);
    return owner != null ? owner : registry.active(Api.MEMORY);
  }

  private Object execute(Call call) {
    OperationDef<?, ?, ?> op = call.op();
    String providerId = call.provider() == null ? null : call.provider().providerId();
    try (LogContext ignored = LogContext.forCall(op.api().wireName(), providerId, op.name())) {
      log.debug("Dispatching {} to provider '{}'", op, providerId);
      Object adapter = call.provider() == null ? routingTables : call.provider().adapter();
      Object result;
      try {
        result = op.invoke(adapter, call.request());
      } catch (StackException e) {
        throw call.annotate(e);
      } catch (RuntimeException e) {
        throw call.annotate(
            new AdapterException(
                StackErrorCode.EXECUTION_ERROR,
                "Provider failed to serve %s: %s".formatted(op, e.getMessage()),
                e));
      }
      try {
        op.checkResult(call.request(), result);
      } catch (StackException e) {
        log.warn("Provider '{}' returned a malformed result for {}", providerId, op);
        throw call.annotate(e);
      }
      track(call, result);
      return result;
    }
  }

  /** Keeps the bank-to-provider routes in step with bank registrations. */
  private void track(Call call, Object result) {
    if (call.op().api() != Api.MEMORY) {
      return;
    }
    switch (call.op().name()) {
      case Memory.REGISTER_MEMORY_BANK -> bankRoutes.put(
          ((RegisterMemoryBankResponse) result).bankId(), call.provider());
      case Memory.DROP_MEMORY_BANK -> bankRoutes.remove(((BankRef) call.request()).bankId());
      default -> {}
    }
  }

  private AdapterException timeout(Call call, Throwable cause) {
    return new AdapterException(
        StackErrorCode.TIMEOUT,
        "%s did not complete within %d ms".formatted(call, callTimeoutMs),
        Map.of("timeout_ms", callTimeoutMs),
        cause);
  }

  private static StackException unwrap(Call call, Throwable cause) {
    if (cause instanceof StackException se) {
      return se;
    }
    return new AdapterException(
        StackErrorCode.EXECUTION_ERROR, "Unexpected failure while serving " + call, cause);
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Router workers did not terminate in 5 seconds, forcing shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private record Call(OperationDef<?, ?, ?> op, Object request, RegisteredProvider provider) {

    <E extends StackException> E annotate(E e) {
      e.annotate("api", op.api().wireName());
      if (provider != null) {
        e.annotate("provider_id", provider.providerId());
      }
      e.annotate("operation", op.name());
      return e;
    }

    @Override
    public String toString() {
      return op.toString();
    }
  }
}
