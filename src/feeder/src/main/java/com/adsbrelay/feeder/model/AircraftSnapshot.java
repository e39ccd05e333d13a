package com.adsbrelay.feeder.model;

import java.util.Map;

/**
 * Point-in-time copy of every tracked aircraft, keyed by ICAO address.
 *
 * @param aircraft unmodifiable address to state mapping
 */
public record AircraftSnapshot(Map<String, AircraftState> aircraft) {

  public boolean isEmpty() {
    return aircraft.isEmpty();
  }

  public int size() {
    return aircraft.size();
  }
}
