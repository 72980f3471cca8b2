package com.gentoro.autotag.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  private OkHttpFactory() {}

  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .writeTimeout(readTimeout)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
