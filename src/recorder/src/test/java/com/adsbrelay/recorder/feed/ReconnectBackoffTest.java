package com.adsbrelay.recorder.feed;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ReconnectBackoffTest {

  @Test
  void doublesUpToCeilingAndResets() {
    ReconnectBackoff backoff = ReconnectBackoff.initial(Duration.ofSeconds(5), Duration.ofSeconds(60));

    assertThat(backoff.delay()).isEqualTo(Duration.ofSeconds(5));
    backoff = backoff.next();
    assertThat(backoff.delay()).isEqualTo(Duration.ofSeconds(10));
    backoff = backoff.next().next().next();
    assertThat(backoff.delay()).isEqualTo(Duration.ofSeconds(60));
    backoff = backoff.next();
    assertThat(backoff.delay()).isEqualTo(Duration.ofSeconds(60));

    assertThat(backoff.reset().delay()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void ceilingNeverBelowBase() {
    ReconnectBackoff backoff = ReconnectBackoff.initial(Duration.ofSeconds(5), Duration.ofSeconds(1));

    assertThat(backoff.next().delay()).isEqualTo(Duration.ofSeconds(5));
  }
}
