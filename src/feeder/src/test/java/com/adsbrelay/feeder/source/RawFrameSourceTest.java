package com.adsbrelay.feeder.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.adsbrelay.feeder.aircraft.AircraftStateAggregator;
import com.adsbrelay.feeder.config.FeederProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class RawFrameSourceTest {
  private static final String FIRST_FRAME = "8D406B902015A678D4D220AA4BDA";
  private static final String SECOND_FRAME = "8D40058B58C901375147EFD09357";

  @Test
  void normalizeStripsFeedFraming() {
    assertThat(RawFrameSource.normalize("*8d406b902015a678d4d220aa4bda;"))
        .isEqualTo("8D406B902015A678D4D220AA4BDA");
    assertThat(RawFrameSource.normalize("  8D406B902015A678D4D220AA4BDA \r"))
        .isEqualTo("8D406B902015A678D4D220AA4BDA");
    assertThat(RawFrameSource.normalize("*;")).isNull();
    assertThat(RawFrameSource.normalize("hello")).isNull();
    assertThat(RawFrameSource.normalize(null)).isNull();
  }

  @Test
  void readsFramesFromFeedAndHandsThemToAggregator() throws Exception {
    AircraftStateAggregator aggregator = mock(AircraftStateAggregator.class);

    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      FeederProperties properties = new FeederProperties();
      properties.getSource().setHost("127.0.0.1");
      properties.getSource().setPort(server.getLocalPort());
      properties.getSource().setReconnectDelayMs(100);
      RawFrameSource source = new RawFrameSource(aggregator, properties, new SimpleMeterRegistry());
      source.start();
      try (Socket client = server.accept()) {
        OutputStream out = client.getOutputStream();
        out.write("*8D406B902015A678D4D220AA4BDA;\n".getBytes(StandardCharsets.US_ASCII));
        out.write("garbage\n".getBytes(StandardCharsets.US_ASCII));
        out.flush();

        verify(aggregator, timeout(5_000)).accept(eq("8D406B902015A678D4D220AA4BDA"), anyDouble());
      } finally {
        source.stop();
      }
    }
  }

  @Test
  void aggregatorFailureSkipsFrameAndKeepsReading() throws Exception {
    AircraftStateAggregator aggregator = mock(AircraftStateAggregator.class);
    when(aggregator.accept(eq(FIRST_FRAME), anyDouble()))
        .thenThrow(new IllegalStateException("boom"));
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      FeederProperties properties = new FeederProperties();
      properties.getSource().setHost("127.0.0.1");
      properties.getSource().setPort(server.getLocalPort());
      properties.getSource().setReconnectDelayMs(100);
      RawFrameSource source = new RawFrameSource(aggregator, properties, meterRegistry);
      source.start();
      try (Socket client = server.accept()) {
        OutputStream out = client.getOutputStream();
        out.write(("*" + FIRST_FRAME + ";\n").getBytes(StandardCharsets.US_ASCII));
        out.write(("*" + SECOND_FRAME + ";\n").getBytes(StandardCharsets.US_ASCII));
        out.flush();

        verify(aggregator, timeout(5_000)).accept(eq(SECOND_FRAME), anyDouble());
      }

      // the feed closed; the source must reconnect
      try (Socket reconnected = server.accept()) {
        reconnected.getOutputStream()
            .write(("*" + FIRST_FRAME + ";\n").getBytes(StandardCharsets.US_ASCII));
        reconnected.getOutputStream().flush();
        verify(aggregator, timeout(5_000).atLeast(2)).accept(eq(FIRST_FRAME), anyDouble());
      } finally {
        source.stop();
      }
    }
    assertThat(meterRegistry.counter("feeder.source.errors").count()).isGreaterThanOrEqualTo(2.0);
  }
}
