package com.adsbrelay.recorder.persist;

/** Notification that the inactivity sweep ended a session. */
public record ClosedSession(String sessionId, String address, double endTime) {}
