package com.gentoro.tldr.client;

import java.time.Duration;
import okhttp3.OkHttpClient;

/** Builds the OkHttp clients used for outbound calls. */
public final class OkHttpFactory {
  private OkHttpFactory() {}

  /**
   * Create a client whose whole-call timeout is {@code callTimeout}; {@link Duration#ZERO} leaves
   * calls unbounded. Reads are only bounded by the call timeout since generation can stall for a
   * long time before the first byte.
   */
  public static OkHttpClient create(Duration callTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(Duration.ofSeconds(10))
        .readTimeout(Duration.ZERO)
        .writeTimeout(Duration.ofSeconds(20))
        .callTimeout(callTimeout)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  /** Derive a client sharing connection pool and dispatcher but with a different call timeout. */
  public static OkHttpClient withCallTimeout(OkHttpClient base, Duration callTimeout) {
    return base.newBuilder().callTimeout(callTimeout).readTimeout(callTimeout).build();
  }
}
