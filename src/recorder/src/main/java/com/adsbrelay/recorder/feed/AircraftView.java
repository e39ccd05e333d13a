package com.adsbrelay.recorder.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One aircraft entry of the broadcast snapshot, as mirrored by the recorder. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AircraftView(
    @JsonProperty("icao") String icao,
    @JsonProperty("callsign") String callsign,
    @JsonProperty("position") Position position,
    @JsonProperty("altitude") Integer altitude,
    @JsonProperty("velocity") Velocity velocity,
    @JsonProperty("last_update") Double lastUpdate,
    @JsonProperty("first_seen") Double firstSeen,
    @JsonProperty("distance_nm") Double distanceNm,
    @JsonProperty("distance_km") Double distanceKm,
    @JsonProperty("assembly_time_ms") Double assemblyTimeMs,
    @JsonProperty("stale_cpr_count") Integer staleCprCount) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Position(@JsonProperty("lat") Double lat, @JsonProperty("lon") Double lon) {
    public boolean isComplete() {
      return lat != null && lon != null;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Velocity(
      @JsonProperty("speed") Double speed,
      @JsonProperty("track") Double track,
      @JsonProperty("vertical_rate") Integer verticalRate,
      @JsonProperty("type") String type) {}

  public boolean hasPosition() {
    return position != null && position.isComplete();
  }
}
