package com.adsbrelay.feeder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decoded velocity report.
 *
 * @param speed speed in knots, ground speed for {@code GS}, airspeed for {@code IAS}/{@code TAS}
 * @param track ground track (or magnetic heading for airspeed reports) in degrees
 * @param verticalRate vertical rate in ft/min
 * @param type speed kind: {@code GS}, {@code IAS} or {@code TAS}
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Velocity(
    @JsonProperty("speed") Double speed,
    @JsonProperty("track") Double track,
    @JsonProperty("vertical_rate") Integer verticalRate,
    @JsonProperty("type") String type) {}
