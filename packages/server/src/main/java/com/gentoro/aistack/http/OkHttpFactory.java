package com.gentoro.aistack.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

/**
 * OkHttp clients used to reach remote providers. Connection failures are never retried and
 * redirects are not followed, so a request body reaches exactly one URL; a 3xx answer surfaces as
 * an error. The call timeout bounds the whole exchange, connect through body.
 */
public class OkHttpFactory {

  public static OkHttpClient create(Duration callTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .readTimeout(callTimeout)
        .writeTimeout(callTimeout)
        .callTimeout(callTimeout)
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
