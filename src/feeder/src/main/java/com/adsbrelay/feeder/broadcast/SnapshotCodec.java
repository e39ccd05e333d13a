package com.adsbrelay.feeder.broadcast;

import com.adsbrelay.feeder.model.AircraftSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/** Serializes a snapshot to the wire format: a JSON object keyed by ICAO address. */
@Component
public class SnapshotCodec {
  private final ObjectMapper objectMapper;

  public SnapshotCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(AircraftSnapshot snapshot) throws JsonProcessingException {
    return objectMapper.writeValueAsString(snapshot.aircraft());
  }
}
