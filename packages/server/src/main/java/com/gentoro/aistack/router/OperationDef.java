package com.gentoro.aistack.router;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * One routable operation: its request and result types, how to call it on an adapter, how to pick
 * the provider and what a well formed result looks like.
 *
 * @param <A> capability contract the operation belongs to
 * @param <Q> request type
 * @param <R> result type
 */
public final class OperationDef<A, Q, R> {
  private final Api api;
  private final String name;
  private final Class<A> contract;
  private final Class<Q> requestType;
  private final Class<R> resultType;
  private final BiFunction<A, Q, R> invoker;
  private final Function<Q, String> resourceKey;
  private final Function<Q, String> providerKey;
  private final BiFunction<Q, R, String> shapeCheck;

  private OperationDef(
      Api api,
      String name,
      Class<A> contract,
      Class<Q> requestType,
      Class<R> resultType,
      BiFunction<A, Q, R> invoker,
      Function<Q, String> resourceKey,
      Function<Q, String> providerKey,
      BiFunction<Q, R, String> shapeCheck) {
    this.api = api;
    this.name = name;
    this.contract = contract;
    this.requestType = requestType;
    this.resultType = resultType;
    this.invoker = invoker;
    this.resourceKey = resourceKey;
    this.providerKey = providerKey;
    this.shapeCheck = shapeCheck;
  }

  public static <A, Q, R> OperationDef<A, Q, R> of(
      Api api,
      String name,
      Class<A> contract,
      Class<Q> requestType,
      Class<R> resultType,
      BiFunction<A, Q, R> invoker) {
    return new OperationDef<>(
        api, name, contract, requestType, resultType, invoker, null, null, null);
  }

  /** Operation without a result; callers receive {@link Empty#INSTANCE}. */
  public static <A, Q> OperationDef<A, Q, Empty> ofVoid(
      Api api, String name, Class<A> contract, Class<Q> requestType, BiConsumer<A, Q> invoker) {
    return of(
        api,
        name,
        contract,
        requestType,
        Empty.class,
        (a, q) -> {
          invoker.accept(a, q);
          return Empty.INSTANCE;
        });
  }

  /** Route by the id of a resource a provider serves (model, shield, bank). */
  public OperationDef<A, Q, R> routedByResource(Function<Q, String> key) {
    return new OperationDef<>(
        api, name, contract, requestType, resultType, invoker, key, providerKey, shapeCheck);
  }

  /** Route by an explicit provider id carried in the request. */
  public OperationDef<A, Q, R> routedByProvider(Function<Q, String> key) {
    return new OperationDef<>(
        api, name, contract, requestType, resultType, invoker, resourceKey, key, shapeCheck);
  }

  /** Adds a structural check; the function returns a description of the defect, or null. */
  public OperationDef<A, Q, R> checkedBy(BiFunction<Q, R, String> check) {
    return new OperationDef<>(
        api, name, contract, requestType, resultType, invoker, resourceKey, providerKey, check);
  }

  public Api api() {
    return api;
  }

  public String name() {
    return name;
  }

  public Class<Q> requestType() {
    return requestType;
  }

  public Class<R> resultType() {
    return resultType;
  }

  Object invoke(Object adapter, Object request) {
    return invoker.apply(contract.cast(adapter), requestType.cast(request));
  }

  String resourceKey(Object request) {
    return resourceKey == null ? null : resourceKey.apply(requestType.cast(request));
  }

  String providerKey(Object request) {
    return providerKey == null ? null : providerKey.apply(requestType.cast(request));
  }

  /** Verifies the result has the declared shape. Results are never coerced. */
  void checkResult(Object request, Object result) {
    if (result == null || !resultType.isInstance(result)) {
      throw violation(
          "expected %s but got %s"
              .formatted(
                  resultType.getSimpleName(),
                  result == null ? "null" : result.getClass().getSimpleName()));
    }
    if (shapeCheck != null) {
      String defect = shapeCheck.apply(requestType.cast(request), resultType.cast(result));
      if (defect != null) {
        throw violation(defect);
      }
    }
  }

  private RoutingException violation(String detail) {
    return new RoutingException(
        StackErrorCode.CONTRACT_VIOLATION,
        "Result of %s/%s violates its contract: %s".formatted(api.wireName(), name, detail),
        Map.of("api", api.wireName(), "operation", name));
  }

  @Override
  public String toString() {
    return api.wireName() + "/" + name;
  }
}
