package com.adsbrelay.feeder.aircraft;

import com.adsbrelay.feeder.decode.CprParity;

/** Even/odd slot pair plus the bookkeeping the resolver keeps per aircraft. */
final class CprPairState {
  private ParitySlot even;
  private ParitySlot odd;
  private int staleCount;
  private double lastLogAt = Double.NEGATIVE_INFINITY;

  void store(ParitySlot slot) {
    if (slot.parity() == CprParity.EVEN) {
      even = slot;
    } else {
      odd = slot;
    }
  }

  void discard(CprParity parity) {
    if (parity == CprParity.EVEN) {
      even = null;
    } else {
      odd = null;
    }
  }

  ParitySlot even() {
    return even;
  }

  ParitySlot odd() {
    return odd;
  }

  boolean isComplete() {
    return even != null && odd != null;
  }

  int staleCount() {
    return staleCount;
  }

  void markStale() {
    staleCount++;
  }

  /** Returns {@code true} and arms the limiter when a log line is allowed at {@code now}. */
  boolean tryLog(double now, double intervalSeconds) {
    if (now - lastLogAt < intervalSeconds) {
      return false;
    }
    lastLogAt = now;
    return true;
  }

  void resetLogStreak() {
    lastLogAt = Double.NEGATIVE_INFINITY;
  }
}
