package com.adsbrelay.recorder.feed;

/** Lifecycle of the subscriber's link to the broadcast feed. */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
