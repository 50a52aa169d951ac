package com.gentoro.aistack.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Logs outgoing provider calls at DEBUG, response bodies at TRACE. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final long MAX_LOGGED_BODY = 64 * 1024;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("Sending {} {}\nBody:\n{}", request.method(), request.url(), bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.debug(
          "Call to {} failed after {} ms: {}",
          request.url(),
          String.format("%.1f", (System.nanoTime() - startTime) / 1e6d),
          e.toString());
      throw e;
    }

    log.debug(
        "Received response for {} in {} ms, status {}",
        response.request().url(),
        String.format("%.1f", (System.nanoTime() - startTime) / 1e6d),
        response.code());

    if (log.isTraceEnabled()) {
      ResponseBody responseBody = response.peekBody(MAX_LOGGED_BODY);
      log.trace("Response body:\n{}", responseBody.string());
    }
    return response;
  }

  private static String bodyToString(Request request) {
    if (request.body() == null) return "";
    try {
      Buffer buffer = new Buffer();
      request.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body: " + e.getMessage() + ")";
    }
  }
}
