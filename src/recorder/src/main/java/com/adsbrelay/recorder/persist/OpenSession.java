package com.adsbrelay.recorder.persist;

/**
 * Flight session without an end time.
 *
 * @param sessionId session id
 * @param address aircraft address
 * @param startTime session start, epoch seconds
 * @param lastPathTs latest path timestamp recorded for the aircraft, or {@code null}
 */
public record OpenSession(String sessionId, String address, double startTime, Double lastPathTs) {

  /** Latest activity seen for this session: its start or its aircraft's latest path point. */
  public double lastActivity() {
    return lastPathTs == null ? startTime : Math.max(startTime, lastPathTs);
  }
}
