package com.adsbrelay.feeder.aircraft;

import com.adsbrelay.feeder.model.AircraftState;
import com.adsbrelay.feeder.model.GeoPosition;
import com.adsbrelay.feeder.model.Velocity;

/**
 * Mutable per-aircraft state, confined to the aggregator's ingest thread.
 *
 * <p>Readers never see this class; they get {@link AircraftState} copies from {@link #toState()}.
 */
final class AircraftRecord {
  private final String address;
  private final double firstSeen;
  private final CprPairState cpr = new CprPairState();
  private double lastUpdate;
  private String callsign;
  private GeoPosition position;
  private Integer altitude;
  private Velocity velocity;
  private Double distanceNm;
  private Double distanceKm;
  private Double assemblyTimeMs;
  private boolean assemblyIncomplete;

  AircraftRecord(String address, double firstSeen) {
    this.address = address;
    this.firstSeen = firstSeen;
    this.lastUpdate = firstSeen;
  }

  String address() {
    return address;
  }

  double firstSeen() {
    return firstSeen;
  }

  CprPairState cpr() {
    return cpr;
  }

  void touch(double timestamp) {
    lastUpdate = Math.max(lastUpdate, timestamp);
  }

  void setCallsign(String callsign) {
    this.callsign = callsign;
  }

  void setAltitude(Integer altitude) {
    this.altitude = altitude;
  }

  void setVelocity(Velocity velocity) {
    this.velocity = velocity;
  }

  void setPosition(GeoPosition position, Double distanceNm) {
    this.position = position;
    this.distanceNm = distanceNm;
    this.distanceKm = distanceNm == null ? null : distanceNm * GreatCircle.KM_PER_NM;
  }

  GeoPosition position() {
    return position;
  }

  boolean isFullyAssembled() {
    return callsign != null && position != null && altitude != null && velocity != null;
  }

  Double assemblyTimeMs() {
    return assemblyTimeMs;
  }

  void setAssemblyTimeMs(double assemblyTimeMs) {
    this.assemblyTimeMs = assemblyTimeMs;
  }

  boolean isAssemblyIncomplete() {
    return assemblyIncomplete;
  }

  void markAssemblyIncomplete() {
    this.assemblyIncomplete = true;
  }

  AircraftState toState() {
    return new AircraftState(
        address,
        callsign,
        position,
        altitude,
        velocity,
        lastUpdate,
        firstSeen,
        distanceNm,
        distanceKm,
        assemblyTimeMs,
        cpr.staleCount());
  }
}
