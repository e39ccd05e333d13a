package com.adsbrelay.feeder.config;

import com.adsbrelay.feeder.broadcast.SnapshotBroadcaster;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the snapshot broadcaster on the configured WebSocket path.
 *
 * <p>Non-browser subscribers send no {@code Origin} header and are always accepted; browser
 * origins must be listed in {@code feeder.broadcast.allowed-origins}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final FeederProperties properties;
  private final SnapshotBroadcaster broadcaster;

  public WebSocketConfig(FeederProperties properties, SnapshotBroadcaster broadcaster) {
    this.properties = properties;
    this.broadcaster = broadcaster;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    WebSocketHandlerRegistration registration =
        registry.addHandler(broadcaster, properties.getBroadcast().getPath());

    List<String> allowedOrigins = properties.getBroadcast().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (!allowedOrigins.isEmpty()) {
      registration.setAllowedOrigins(allowedOrigins.toArray(String[]::new));
    }
  }
}
