package com.adsbrelay.recorder.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Latest snapshot received from the feed.
 *
 * <p>Each valid payload replaces the whole mirror in one volatile write. A payload that is not a
 * JSON object of address to aircraft object is counted and ignored, leaving the previous mirror
 * in place.
 */
@Component
public class SnapshotMirror {
  private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotMirror.class);

  private final ObjectMapper objectMapper;
  private final Counter appliedCounter;
  private final Counter malformedCounter;
  private volatile Map<String, AircraftView> aircraft = Map.of();

  public SnapshotMirror(ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    this.objectMapper = objectMapper;
    this.appliedCounter = meterRegistry.counter("recorder.feed.messages", "outcome", "applied");
    this.malformedCounter = meterRegistry.counter("recorder.feed.messages", "outcome", "malformed");
  }

  /**
   * Parses a broadcast payload and, when valid, makes it the current mirror.
   *
   * @param payload raw text message
   * @return {@code true} when the mirror was replaced
   */
  public boolean apply(String payload) {
    Map<String, AircraftView> next = parse(payload);
    if (next == null) {
      malformedCounter.increment();
      return false;
    }
    aircraft = Collections.unmodifiableMap(next);
    appliedCounter.increment();
    return true;
  }

  /** Returns the current mirror; the map is immutable. */
  public Map<String, AircraftView> current() {
    return aircraft;
  }

  private Map<String, AircraftView> parse(String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      LOGGER.debug("Ignoring unparseable feed payload: {}", ex.getOriginalMessage());
      return null;
    }
    if (root == null || !root.isObject()) {
      LOGGER.debug("Ignoring feed payload that is not an object keyed by address");
      return null;
    }

    Map<String, AircraftView> parsed = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
    while (entries.hasNext()) {
      Map.Entry<String, JsonNode> entry = entries.next();
      if (!entry.getValue().isObject()) {
        LOGGER.debug("Ignoring feed payload with non-object entry for {}", entry.getKey());
        return null;
      }
      try {
        parsed.put(entry.getKey(), objectMapper.treeToValue(entry.getValue(), AircraftView.class));
      } catch (JsonProcessingException ex) {
        LOGGER.debug("Ignoring feed payload with invalid entry for {}", entry.getKey(), ex);
        return null;
      }
    }
    return parsed;
  }
}
