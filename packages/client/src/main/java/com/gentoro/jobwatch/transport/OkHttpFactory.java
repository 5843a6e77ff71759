package com.gentoro.jobwatch.transport;

import com.gentoro.jobwatch.config.TransportSettings;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(TransportSettings settings) {
    if (settings == null) {
      throw new IllegalArgumentException("TransportSettings cannot be null");
    }
    return new OkHttpClient.Builder()
        .connectTimeout(settings.connectTimeoutMs(), TimeUnit.MILLISECONDS)
        .readTimeout(settings.readTimeoutMs(), TimeUnit.MILLISECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
