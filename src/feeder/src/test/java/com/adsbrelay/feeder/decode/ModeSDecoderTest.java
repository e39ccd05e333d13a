package com.adsbrelay.feeder.decode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.adsbrelay.feeder.model.GeoPosition;
import com.adsbrelay.feeder.model.Velocity;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ModeSDecoderTest {
  private static final String IDENTIFICATION = "8D406B902015A678D4D220AA4BDA";
  private static final String EVEN = "8D40058B58C901375147EFD09357";
  private static final String ODD = "8D40058B58C904A87F402D3B8C59";

  private final ModeSDecoder decoder = new ModeSDecoder();

  @Test
  void isValidChecksLengthHexAndParity() {
    assertThat(decoder.isValid(IDENTIFICATION)).isTrue();
    assertThat(decoder.isValid(IDENTIFICATION.toLowerCase())).isTrue();
    assertThat(decoder.isValid("8D406B902015A678D4D220AA4BDB")).isFalse();
    assertThat(decoder.isValid("8D406B902015A678D4D220AA4B")).isFalse();
    assertThat(decoder.isValid("8D406B902015A678D4D220AA4BDZ")).isFalse();
    assertThat(decoder.isValid(null)).isFalse();
  }

  @Test
  void decodesIdentificationFrame() {
    assertThat(decoder.downlinkFormat(IDENTIFICATION)).isEqualTo(17);
    assertThat(decoder.address(IDENTIFICATION)).isEqualTo("406B90");
    assertThat(decoder.typeCode(IDENTIFICATION)).isEqualTo(4);
    assertThat(decoder.callsign(IDENTIFICATION)).contains("EZY85MH");
    assertThat(decoder.altitude(IDENTIFICATION)).isEmpty();
    assertThat(decoder.parity(IDENTIFICATION)).isEmpty();
  }

  @Test
  void decodesAirbornePositionFields() {
    assertThat(decoder.typeCode(EVEN)).isEqualTo(11);
    assertThat(decoder.altitude(EVEN)).contains(39000);
    assertThat(decoder.parity(EVEN)).contains(CprParity.EVEN);
    assertThat(decoder.parity(ODD)).contains(CprParity.ODD);
    assertThat(decoder.callsign(EVEN)).isEmpty();
  }

  @Test
  void resolvesAirbornePairUsingNewestFrame() {
    GeoPosition oddNewer = decoder.globalPosition(EVEN, ODD, 1446332400, 1446332405, null).orElseThrow();
    assertThat(oddNewer.lat()).isCloseTo(49.81755, within(1e-5));
    assertThat(oddNewer.lon()).isCloseTo(6.08442, within(1e-5));

    GeoPosition evenNewer = decoder.globalPosition(
        "8D40621D58C382D690C8AC2863A7", "8D40621D58C386435CC412692AD6", 1457996402, 1457996400, null)
        .orElseThrow();
    assertThat(evenNewer.lat()).isCloseTo(52.2572, within(1e-5));
    assertThat(evenNewer.lon()).isCloseTo(3.91937, within(1e-5));
  }

  @Test
  void rejectsPairWithSwappedParity() {
    assertThat(decoder.globalPosition(ODD, EVEN, 1, 2, null)).isEmpty();
  }

  @Test
  void surfacePairNeedsReference() {
    String even = "8CC8200A3AC8F009BCDEF2000000";
    String odd = "8FC8200A3AB8F5F893096B000000";

    assertThat(decoder.globalPosition(even, odd, 0, 2, null)).isEmpty();

    GeoPosition position =
        decoder.globalPosition(even, odd, 0, 2, new GeoPosition(-43.496, 172.558)).orElseThrow();
    assertThat(position.lat()).isCloseTo(-43.48564, within(1e-5));
    assertThat(position.lon()).isCloseTo(172.53942, within(1e-5));
  }

  @Test
  void decodesGroundSpeedVelocity() {
    Velocity velocity = decoder.airborneVelocity("8D485020994409940838175B284F").orElseThrow();

    assertThat(velocity.speed()).isEqualTo(159.0);
    assertThat(velocity.track()).isEqualTo(182.88);
    assertThat(velocity.verticalRate()).isEqualTo(-832);
    assertThat(velocity.type()).isEqualTo("GS");
  }

  @Test
  void decodesAirspeedVelocityWithHeading() {
    Velocity velocity = decoder.airborneVelocity("8DA05F219B06B6AF189400CBC33F").orElseThrow();

    assertThat(velocity.speed()).isEqualTo(375.0);
    assertThat(velocity.track()).isEqualTo(243.98);
    assertThat(velocity.verticalRate()).isEqualTo(-2304);
    assertThat(velocity.type()).isEqualTo("TAS");
  }

  @Test
  void decodesSurfaceMovement() {
    Optional<Velocity> velocity = decoder.surfaceVelocity("8C4841753A9A153237AEF0F275BE");

    assertThat(velocity).contains(new Velocity(17.0, 92.8, 0, "GS"));
    assertThat(decoder.airborneVelocity("8C4841753A9A153237AEF0F275BE")).isEmpty();
  }

  @Test
  void longitudeZonesMatchBoundaryCases() {
    assertThat(CprMath.longitudeZones(0.0)).isEqualTo(59);
    assertThat(CprMath.longitudeZones(10.0)).isEqualTo(59);
    assertThat(CprMath.longitudeZones(52.2572)).isEqualTo(36);
    assertThat(CprMath.longitudeZones(87.0)).isEqualTo(2);
    assertThat(CprMath.longitudeZones(-88.0)).isEqualTo(1);
  }
}
