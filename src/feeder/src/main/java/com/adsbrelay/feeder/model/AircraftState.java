package com.adsbrelay.feeder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable view of one aircraft, as published in every broadcast snapshot.
 *
 * <p>Absent values are serialized as {@code null} so subscribers can rely on key presence.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AircraftState(
    @JsonProperty("icao") String icao,
    @JsonProperty("callsign") String callsign,
    @JsonProperty("position") GeoPosition position,
    @JsonProperty("altitude") Integer altitude,
    @JsonProperty("velocity") Velocity velocity,
    @JsonProperty("last_update") double lastUpdate,
    @JsonProperty("first_seen") double firstSeen,
    @JsonProperty("distance_nm") Double distanceNm,
    @JsonProperty("distance_km") Double distanceKm,
    @JsonProperty("assembly_time_ms") Double assemblyTimeMs,
    @JsonProperty("stale_cpr_count") int staleCprCount) {}
