package com.adsbrelay.recorder.config;

import java.net.URI;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recorder")
public record RecorderProperties(Feed feed, Persistence persistence, Store store) {
  public record Feed(URI uri, long baseBackoffMs, long maxBackoffMs, long connectTimeoutMs) {}

  public record Persistence(long intervalMs) {}

  public record Store(String path, long pollMs, long sweepIntervalMs, double sessionInactivitySeconds) {}
}
