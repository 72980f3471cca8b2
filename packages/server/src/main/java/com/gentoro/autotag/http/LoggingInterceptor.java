package com.gentoro.autotag.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Logs outbound calls with their status and duration. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)",
          request.method(),
          request.url(),
          elapsedMillis(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Could not connect: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMillis(startTime),
          e.getMessage());
      throw e;
    }

    long durationMs = elapsedMillis(startTime);
    if (response.isSuccessful()) {
      log.debug("{} {} -> {} ({}ms)", request.method(), request.url(), response.code(), durationMs);
    } else {
      log.warn("{} {} -> {} ({}ms)", request.method(), request.url(), response.code(), durationMs);
    }
    return response;
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
