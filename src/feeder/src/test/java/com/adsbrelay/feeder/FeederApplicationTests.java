package com.adsbrelay.feeder;

import static org.assertj.core.api.Assertions.assertThat;

import com.adsbrelay.feeder.aircraft.AircraftStateAggregator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "feeder.source.enabled=false",
        "feeder.broadcast.interval-ms=200"
    })
class FeederApplicationTests {
  @LocalServerPort
  private int port;

  @Autowired
  private AircraftStateAggregator aggregator;

  @Autowired
  private ObjectMapper objectMapper;

  @Test
  void subscriberReceivesSnapshotKeyedByAddress() throws Exception {
    BlockingQueue<String> received = new LinkedBlockingQueue<>();
    TextWebSocketHandler handler = new TextWebSocketHandler() {
      @Override
      protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        received.add(message.getPayload());
      }
    };

    aggregator.accept("8D406B902015A678D4D220AA4BDA", 1_700_000_000.0);
    WebSocketSession session = new StandardWebSocketClient()
        .execute(handler, "ws://localhost:" + port + "/adsb")
        .get(5, TimeUnit.SECONDS);
    try {
      String payload = received.poll(5, TimeUnit.SECONDS);
      assertThat(payload).isNotNull();

      JsonNode aircraft = objectMapper.readTree(payload).get("406B90");
      assertThat(aircraft.get("icao").asText()).isEqualTo("406B90");
      assertThat(aircraft.get("callsign").asText()).isEqualTo("EZY85MH");
      assertThat(aircraft.get("first_seen").asDouble()).isEqualTo(1_700_000_000.0);
      assertThat(aircraft.has("position")).isTrue();
      assertThat(aircraft.get("position").isNull()).isTrue();
      assertThat(aircraft.get("velocity").isNull()).isTrue();
      assertThat(aircraft.get("stale_cpr_count").asInt()).isZero();
    } finally {
      session.close();
    }
  }
}
