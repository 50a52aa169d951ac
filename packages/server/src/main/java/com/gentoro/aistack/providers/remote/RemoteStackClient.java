package com.gentoro.aistack.providers.remote;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.client.CapabilityTransport;
import com.gentoro.aistack.exception.AdapterException;
import com.gentoro.aistack.exception.ErrorDetails;
import com.gentoro.aistack.exception.ExceptionUtil;
import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.SerializationException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.http.OkHttpFactory;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * HTTP transport to another stack. Every call is a single {@code POST <url>/<api>/<operation>}
 * with a JSON body; there is no retry on any failure.
 */
public class RemoteStackClient implements CapabilityTransport, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(RemoteStackClient.class);

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final HttpUrl baseUrl;
  private final OkHttpClient http;
  private final boolean structuredErrors;

  public RemoteStackClient(HttpUrl baseUrl, Duration timeout, boolean structuredErrors) {
    this(baseUrl, OkHttpFactory.create(timeout), structuredErrors);
  }

  RemoteStackClient(HttpUrl baseUrl, OkHttpClient http, boolean structuredErrors) {
    this.baseUrl = baseUrl;
    this.http = http;
    this.structuredErrors = structuredErrors;
  }

  public HttpUrl baseUrl() {
    return baseUrl;
  }

  @Override
  public <R> R invoke(Api api, String operation, Object request, Class<R> resultType) {
    HttpUrl url =
        baseUrl.newBuilder().addPathSegment(api.wireName()).addPathSegment(operation).build();
    String payload = JacksonUtility.toJson(request == null ? Empty.INSTANCE : request);
    Request httpRequest =
        new Request.Builder().url(url).post(RequestBody.create(payload, JSON)).build();

    String body;
    int status;
    try (Response response = http.newCall(httpRequest).execute()) {
      ResponseBody responseBody = response.body();
      body = responseBody == null ? "" : responseBody.string();
      status = response.code();
    } catch (InterruptedIOException e) {
      throw new AdapterException(
          StackErrorCode.TIMEOUT,
          "Remote stack did not answer in time: " + url,
          Map.of("url", url.toString()),
          e);
    } catch (IOException e) {
      throw new AdapterException(
          StackErrorCode.TRANSPORT_ERROR,
          "Remote stack unreachable: " + url + " (" + e.getMessage() + ")",
          Map.of("url", url.toString()),
          e);
    }

    if (status < 200 || status >= 300) {
      log.debug("Remote stack {} answered {} for {}/{}", baseUrl, status, api, operation);
      throw failure(status, body);
    }
    if (resultType == Empty.class) {
      return resultType.cast(Empty.INSTANCE);
    }
    try {
      return JacksonUtility.fromJson(body, resultType);
    } catch (SerializationException e) {
      throw new RoutingException(
          StackErrorCode.CONTRACT_VIOLATION,
          "Remote stack answered %s/%s with a body that is not a %s"
              .formatted(api, operation, resultType.getSimpleName()),
          Map.of("url", url.toString(), AdapterException.BODY, body));
    }
  }

  private RuntimeException failure(int status, String body) {
    if (structuredErrors) {
      try {
        ErrorDetails details = JacksonUtility.fromJson(body, ErrorDetails.class);
        if (details.code != null) {
          return ExceptionUtil.fromErrorDetails(details)
              .annotate(AdapterException.STATUS_CODE, status);
        }
      } catch (SerializationException e) {
        log.debug("Error body from {} is not structured, reporting it as opaque", baseUrl);
      }
    }
    return AdapterException.upstream(status, body);
  }

  @Override
  public void close() {
    http.dispatcher().executorService().shutdown();
    http.connectionPool().evictAll();
  }
}
