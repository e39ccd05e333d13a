package com.adsbrelay.recorder.feed;

import java.time.Duration;

/**
 * Exponential reconnect delay: starts at {@code base}, doubles per failed attempt and is capped
 * at {@code max}.
 *
 * @param base first delay, restored by {@link #reset()}
 * @param max ceiling
 * @param delay delay to wait before the next attempt
 */
public record ReconnectBackoff(Duration base, Duration max, Duration delay) {

  public static ReconnectBackoff initial(Duration base, Duration max) {
    Duration ceiling = max.compareTo(base) < 0 ? base : max;
    return new ReconnectBackoff(base, ceiling, base);
  }

  public ReconnectBackoff next() {
    Duration doubled = delay.multipliedBy(2);
    return new ReconnectBackoff(base, max, doubled.compareTo(max) > 0 ? max : doubled);
  }

  public ReconnectBackoff reset() {
    return new ReconnectBackoff(base, max, base);
  }
}
