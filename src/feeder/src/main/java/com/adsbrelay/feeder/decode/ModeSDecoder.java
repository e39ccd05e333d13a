package com.adsbrelay.feeder.decode;

import com.adsbrelay.feeder.model.GeoPosition;
import com.adsbrelay.feeder.model.Velocity;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Mode S / ADS-B (DF17 extended squitter) decoder working on 28-character hex frames.
 *
 * <p>Bit offsets below are absolute positions in the 112-bit frame; the ME (message) field
 * starts at bit 32.
 */
@Component
public class ModeSDecoder implements AdsbDecoder {
  static final int FRAME_HEX_LENGTH = 28;
  private static final int FRAME_BITS = FRAME_HEX_LENGTH * 4;
  private static final int ME = 32;
  private static final String GENERATOR = "1111111111111010000001001";
  private static final String CALLSIGN_CHARS =
      "#ABCDEFGHIJKLMNOPQRSTUVWXYZ#####_###############0123456789######";

  private static final int[] MOVEMENT_BOUNDS = {2, 9, 13, 39, 94, 109, 124};
  private static final double[] MOVEMENT_KNOTS = {0.125, 1, 2, 15, 70, 100, 175};

  @Override
  public boolean isValid(String frame) {
    if (frame == null || frame.length() != FRAME_HEX_LENGTH) {
      return false;
    }
    for (int i = 0; i < frame.length(); i++) {
      if (Character.digit(frame.charAt(i), 16) < 0) {
        return false;
      }
    }
    return crcRemainder(frame) == 0;
  }

  /**
   * Computes the CRC-24 remainder over the whole frame.
   *
   * <p>For a DF17 frame the parity field is part of the division, so an intact frame leaves a
   * zero remainder.
   */
  static int crcRemainder(String frame) {
    char[] bits = toBits(frame).toCharArray();
    int generatorLength = GENERATOR.length();
    for (int i = 0; i <= bits.length - generatorLength; i++) {
      if (bits[i] != '1') {
        continue;
      }
      for (int g = 0; g < generatorLength; g++) {
        bits[i + g] = bits[i + g] == GENERATOR.charAt(g) ? '0' : '1';
      }
    }
    return Integer.parseInt(new String(bits, bits.length - 24, 24), 2);
  }

  @Override
  public int downlinkFormat(String frame) {
    int df = (int) field(toBits(frame), 0, 5);
    return Math.min(df, 24);
  }

  @Override
  public String address(String frame) {
    return frame.substring(2, 8).toUpperCase(Locale.ROOT);
  }

  @Override
  public int typeCode(String frame) {
    return (int) field(toBits(frame), ME, ME + 5);
  }

  @Override
  public Optional<String> callsign(String frame) {
    String bits = toBits(frame);
    int tc = (int) field(bits, ME, ME + 5);
    if (tc < 1 || tc > 4) {
      return Optional.empty();
    }
    StringBuilder callsign = new StringBuilder(8);
    for (int offset = ME + 8; offset < ME + 56; offset += 6) {
      char c = CALLSIGN_CHARS.charAt((int) field(bits, offset, offset + 6));
      if (c != '#' && c != '_') {
        callsign.append(c);
      }
    }
    return callsign.length() == 0 ? Optional.empty() : Optional.of(callsign.toString());
  }

  @Override
  public Optional<Integer> altitude(String frame) {
    String bits = toBits(frame);
    int tc = (int) field(bits, ME, ME + 5);
    if (tc < 9 || tc > 18) {
      return Optional.empty();
    }
    String code = bits.substring(ME + 8, ME + 20);
    if (code.charAt(7) != '1') {
      // Gray-coded (100 ft) altitudes are rare on DF17 and not decoded.
      return Optional.empty();
    }
    int n = Integer.parseInt(code.substring(0, 7) + code.substring(8), 2);
    return Optional.of(n * 25 - 1000);
  }

  @Override
  public Optional<CprParity> parity(String frame) {
    String bits = toBits(frame);
    int tc = (int) field(bits, ME, ME + 5);
    if (tc < 5 || tc > 18) {
      return Optional.empty();
    }
    return Optional.of(bits.charAt(ME + 21) == '1' ? CprParity.ODD : CprParity.EVEN);
  }

  @Override
  public Optional<Velocity> airborneVelocity(String frame) {
    String bits = toBits(frame);
    String mb = bits.substring(ME);
    if (field(mb, 0, 5) != 19) {
      return Optional.empty();
    }
    int subtype = (int) field(mb, 5, 8);
    if (subtype < 1 || subtype > 4) {
      return Optional.empty();
    }
    long first = field(mb, 14, 24);
    long second = field(mb, 25, 35);
    if (first == 0 || second == 0) {
      return Optional.empty();
    }

    Double speed;
    Double track;
    String type;
    if (subtype <= 2) {
      int multiplier = subtype == 2 ? 4 : 1;
      long eastWest = (first - 1) * multiplier * (mb.charAt(13) == '1' ? -1 : 1);
      long northSouth = (second - 1) * multiplier * (mb.charAt(24) == '1' ? -1 : 1);
      speed = (double) Math.round(Math.hypot(eastWest, northSouth));
      double degrees = Math.toDegrees(Math.atan2(eastWest, northSouth));
      if (degrees < 0) {
        degrees += 360;
      }
      track = Math.round(degrees * 100.0) / 100.0;
      type = "GS";
    } else {
      track = mb.charAt(13) == '1' ? Math.round(first / 1024.0 * 360.0 * 100.0) / 100.0 : null;
      speed = (double) ((second - 1) * (subtype == 4 ? 4 : 1));
      type = mb.charAt(24) == '1' ? "TAS" : "IAS";
    }

    long rate = field(mb, 37, 46);
    Integer verticalRate = rate == 0
        ? null
        : (int) ((rate - 1) * 64 * (mb.charAt(36) == '1' ? -1 : 1));
    return Optional.of(new Velocity(speed, track, verticalRate, type));
  }

  @Override
  public Optional<Velocity> surfaceVelocity(String frame) {
    String mb = toBits(frame).substring(ME);
    int tc = (int) field(mb, 0, 5);
    if (tc < 5 || tc > 8) {
      return Optional.empty();
    }
    Double track = mb.charAt(12) == '1'
        ? Math.round(field(mb, 13, 20) * 360.0 / 128.0 * 10.0) / 10.0
        : null;
    Double speed = groundSpeed((int) field(mb, 5, 12));
    if (speed == null && track == null) {
      return Optional.empty();
    }
    return Optional.of(new Velocity(speed, track, 0, "GS"));
  }

  private static Double groundSpeed(int movement) {
    if (movement == 0 || movement > 124) {
      return null;
    }
    if (movement == 1) {
      return 0.0;
    }
    if (movement == 124) {
      return 175.0;
    }
    int i = 1;
    while (MOVEMENT_BOUNDS[i] <= movement) {
      i++;
    }
    double step = (MOVEMENT_KNOTS[i] - MOVEMENT_KNOTS[i - 1])
        / (MOVEMENT_BOUNDS[i] - MOVEMENT_BOUNDS[i - 1]);
    double speed = MOVEMENT_KNOTS[i - 1] + (movement - MOVEMENT_BOUNDS[i - 1]) * step;
    return Math.round(speed * 100.0) / 100.0;
  }

  @Override
  public Optional<GeoPosition> globalPosition(
      String evenFrame, String oddFrame, double evenTime, double oddTime, GeoPosition reference) {
    String even = toBits(evenFrame);
    String odd = toBits(oddFrame);
    if (even.charAt(ME + 21) != '0' || odd.charAt(ME + 21) != '1') {
      return Optional.empty();
    }
    double latEven = CprMath.scale(field(even, ME + 22, ME + 39));
    double lonEven = CprMath.scale(field(even, ME + 39, ME + 56));
    double latOdd = CprMath.scale(field(odd, ME + 22, ME + 39));
    double lonOdd = CprMath.scale(field(odd, ME + 39, ME + 56));
    boolean evenIsNewer = evenTime > oddTime;

    int tc = (int) field(even, ME, ME + 5);
    if (tc >= 5 && tc <= 8) {
      if (reference == null) {
        return Optional.empty();
      }
      return CprMath.surface(latEven, lonEven, latOdd, lonOdd, evenIsNewer, reference);
    }
    return CprMath.airborne(latEven, lonEven, latOdd, lonOdd, evenIsNewer);
  }

  private static String toBits(String frame) {
    StringBuilder bits = new StringBuilder(FRAME_BITS);
    for (int i = 0; i < frame.length(); i++) {
      String nibble = Integer.toBinaryString(Character.digit(frame.charAt(i), 16));
      bits.append("0000", nibble.length(), 4).append(nibble);
    }
    return bits.toString();
  }

  private static long field(String bits, int from, int to) {
    return Long.parseLong(bits.substring(from, to), 2);
  }
}
