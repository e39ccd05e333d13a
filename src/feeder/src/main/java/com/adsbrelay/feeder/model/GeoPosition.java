package com.adsbrelay.feeder.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * WGS84 coordinate in decimal degrees.
 *
 * @param lat latitude
 * @param lon longitude
 */
public record GeoPosition(
    @JsonProperty("lat") double lat,
    @JsonProperty("lon") double lon) {}
