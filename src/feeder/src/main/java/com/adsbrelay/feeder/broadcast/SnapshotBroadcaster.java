package com.adsbrelay.feeder.broadcast;

import com.adsbrelay.feeder.aircraft.AircraftStateAggregator;
import com.adsbrelay.feeder.config.FeederProperties;
import com.adsbrelay.feeder.model.AircraftSnapshot;
import com.adsbrelay.feeder.support.FailureCauses;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket fan-out of the aircraft snapshot.
 *
 * <p>Every broadcast interval the current snapshot is serialized once and the same text frame is
 * sent to all connected sessions in parallel. A session whose send fails is dropped and closed;
 * the other sessions still get the frame.
 */
@Component
public class SnapshotBroadcaster extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(SnapshotBroadcaster.class);

  private final AircraftStateAggregator aggregator;
  private final SnapshotCodec codec;
  private final FeederProperties.Broadcast properties;
  private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
  private final Counter deliveredCounter;
  private final Counter failedCounter;
  private final ScheduledExecutorService scheduler =
      Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "feeder-broadcast");
        thread.setDaemon(true);
        return thread;
      });
  private final ExecutorService sendExecutor =
      Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "feeder-broadcast-send");
        thread.setDaemon(true);
        return thread;
      });

  public SnapshotBroadcaster(
      AircraftStateAggregator aggregator,
      SnapshotCodec codec,
      FeederProperties properties,
      MeterRegistry meterRegistry) {
    this.aggregator = aggregator;
    this.codec = codec;
    this.properties = properties.getBroadcast();
    this.deliveredCounter = meterRegistry.counter("feeder.broadcast.sends", "outcome", "delivered");
    this.failedCounter = meterRegistry.counter("feeder.broadcast.sends", "outcome", "failed");
  }

  /** Starts the periodic broadcast. */
  @jakarta.annotation.PostConstruct
  public void start() {
    long interval = properties.getIntervalMs();
    scheduler.scheduleWithFixedDelay(this::broadcastSafely, interval, interval, TimeUnit.MILLISECONDS);
  }

  /** Stops broadcasting and closes every connected session. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    scheduler.shutdownNow();
    for (WebSocketSession session : sessions.values()) {
      closeSilently(session, CloseStatus.GOING_AWAY);
    }
    sessions.clear();
    sendExecutor.shutdownNow();
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(
        session, properties.getSendTimeLimitMs(), properties.getBufferSizeLimit()));
    log.info("Subscriber connected id={} remote={} (subscribers={})",
        session.getId(), session.getRemoteAddress(), sessions.size());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    if (sessions.remove(session.getId()) != null) {
      log.info("Subscriber disconnected id={} status={} (subscribers={})",
          session.getId(), status.getCode(), sessions.size());
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    WebSocketSession removed = sessions.remove(session.getId());
    if (removed == null) {
      return;
    }
    if (FailureCauses.isPeerDisconnect(exception)) {
      log.debug("Subscriber id={} went away: {}", session.getId(), FailureCauses.rootCauseSummary(exception));
    } else {
      log.warn("Transport error for subscriber id={}", session.getId(), exception);
    }
    closeSilently(removed, CloseStatus.SERVER_ERROR);
  }

  int subscriberCount() {
    return sessions.size();
  }

  /**
   * Serializes the current snapshot once and delivers it to every session.
   *
   * <p>Returns after every send has completed or failed. Does nothing without subscribers.
   */
  void broadcast() {
    if (sessions.isEmpty()) {
      return;
    }

    AircraftSnapshot snapshot = aggregator.snapshot();
    TextMessage message;
    try {
      message = new TextMessage(codec.encode(snapshot));
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize snapshot of {} aircraft", snapshot.size(), ex);
      return;
    }

    List<CompletableFuture<Void>> sends = new ArrayList<>(sessions.size());
    for (Map.Entry<String, WebSocketSession> entry : sessions.entrySet()) {
      sends.add(CompletableFuture.runAsync(
          () -> send(entry.getKey(), entry.getValue(), message), sendExecutor));
    }
    CompletableFuture.allOf(sends.toArray(CompletableFuture[]::new)).join();
  }

  private void broadcastSafely() {
    try {
      broadcast();
    } catch (Exception ex) {
      log.warn("Snapshot broadcast cycle failed", ex);
    }
  }

  private void send(String id, WebSocketSession session, TextMessage message) {
    try {
      session.sendMessage(message);
      deliveredCounter.increment();
    } catch (Exception ex) {
      failedCounter.increment();
      sessions.remove(id, session);
      if (FailureCauses.isPeerDisconnect(ex)) {
        log.debug("Subscriber id={} disconnected during broadcast: {}", id, FailureCauses.rootCauseSummary(ex));
      } else {
        log.warn("Snapshot delivery failed for subscriber id={}", id, ex);
      }
      closeSilently(session, CloseStatus.SERVER_ERROR);
    }
  }

  private static void closeSilently(WebSocketSession session, CloseStatus status) {
    try {
      session.close(status);
    } catch (Exception ignore) {
      // Session is already closed or broken; nothing else to do.
    }
  }
}
