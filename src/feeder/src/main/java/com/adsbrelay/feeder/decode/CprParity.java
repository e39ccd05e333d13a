package com.adsbrelay.feeder.decode;

/** Format flag of a split-position (CPR) frame. */
public enum CprParity {
  EVEN,
  ODD;

  public CprParity opposite() {
    return this == EVEN ? ODD : EVEN;
  }
}
