package com.adsbrelay.recorder.config;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(RecorderProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(properties.feed().connectTimeoutMs()))
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
