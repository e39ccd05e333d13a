package com.adsbrelay.feeder.decode;

import com.adsbrelay.feeder.model.GeoPosition;
import com.adsbrelay.feeder.model.Velocity;
import java.util.Optional;

/**
 * Field extraction over a single 112-bit Mode S frame given as 28 hex characters.
 *
 * <p>Only {@link #isValid(String)} checks the frame; every other method assumes a valid frame
 * and returns {@link Optional#empty()} when the requested field is not carried or not available.
 */
public interface AdsbDecoder {

  /**
   * Checks length, hex content and CRC-24 parity.
   *
   * @param frame hex frame
   * @return {@code true} when the frame can be decoded
   */
  boolean isValid(String frame);

  int downlinkFormat(String frame);

  /**
   * Returns the 24-bit aircraft address as upper-case hex.
   *
   * @param frame valid DF17 frame
   * @return six hex characters
   */
  String address(String frame);

  /**
   * Returns the ADS-B type code (first five bits of the ME field).
   *
   * @param frame valid DF17 frame
   * @return type code between 0 and 31
   */
  int typeCode(String frame);

  Optional<String> callsign(String frame);

  /** Barometric altitude in feet for airborne position frames (type codes 9-18). */
  Optional<Integer> altitude(String frame);

  /** CPR format flag for position frames (type codes 5-18). */
  Optional<CprParity> parity(String frame);

  /** Airborne velocity (type code 19, subtypes 1-4). */
  Optional<Velocity> airborneVelocity(String frame);

  /** Ground movement and track from a surface position frame (type codes 5-8). */
  Optional<Velocity> surfaceVelocity(String frame);

  /**
   * Resolves a global position from an even/odd frame pair.
   *
   * <p>Surface frames can only be resolved with a reference position; without one the result is
   * empty.
   *
   * @param evenFrame even-format position frame
   * @param oddFrame odd-format position frame
   * @param evenTime arrival time of the even frame, epoch seconds
   * @param oddTime arrival time of the odd frame, epoch seconds
   * @param reference receiver location, may be {@code null}
   * @return resolved coordinate, or empty when the pair is inconsistent
   */
  Optional<GeoPosition> globalPosition(
      String evenFrame, String oddFrame, double evenTime, double oddTime, GeoPosition reference);
}
